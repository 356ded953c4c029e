package ir.value;

public enum Opcode {
    // 二元运算指令
    ADD("add"), // 加法
    SUB("sub"), // 减法
    MUL("mul"), // 乘法
    SDIV("sdiv"), // 有符号除法
    UDIV("udiv"), // 无符号除法
    SREM("srem"), // 有符号取余
    UREM("urem"), // 无符号取余
    SHL("shl"), // 左移
    LSHR("lshr"), // 逻辑右移
    ASHR("ashr"), // 算术右移
    AND("and"), // 按位与
    OR("or"), // 按位或
    XOR("xor"), // 按位异或

    // 比较指令
    ICMP_EQ("eq"), // 相等比较
    ICMP_NE("ne"), // 不等比较
    ICMP_UGT("ugt"), // 无符号大于
    ICMP_UGE("uge"), // 无符号大于等于
    ICMP_ULT("ult"), // 无符号小于
    ICMP_ULE("ule"), // 无符号小于等于
    ICMP_SGT("sgt"), // 有符号大于
    ICMP_SGE("sge"), // 有符号大于等于
    ICMP_SLT("slt"), // 有符号小于
    ICMP_SLE("sle"), // 有符号小于等于

    // 类型转换指令
    TRUNC("trunc"), // 截断
    ZEXT("zext"), // 零扩展
    SEXT("sext"), // 符号扩展
    BITCAST("bitcast"), // 位转换
    INTTOPTR("inttoptr"), // 整数转指针
    PTRTOINT("ptrtoint"), // 指针转整数
    ADDRSPACECAST("addrspacecast"), // 地址空间转换

    // 内存操作指令
    ALLOCA("alloca"), // 分配栈空间
    LOAD("load"), // 从内存加载
    STORE("store"), // 存储到内存
    GETELEMENTPOINTER("getelementptr"), // 获取元素指针

    // 终结指令
    RET("ret"), // 返回
    BR("br"), // 分支
    SWITCH("switch"), // 多分支

    // 其他指令
    PHI("phi"), // Phi 节点
    CALL("call"), // 函数调用
    SELECT("select"), // 三元操作
    ;

    private final String keyword;

    Opcode(String keyword) {
        this.keyword = keyword;
    }

    /* 文本 IR 中的助记符；比较指令返回的是谓词 */
    public String getKeyword() {
        return keyword;
    }

    /**
     * 判断操作码是否为终结指令
     * 
     * @return 如果是终结指令返回 true
     */
    public boolean isTerminator() {
        return this == RET || this == BR || this == SWITCH;
    }

    public boolean isCast() {
        return ordinal() >= TRUNC.ordinal() && ordinal() <= ADDRSPACECAST.ordinal();
    }

    public boolean isBinary() {
        return ordinal() >= ADD.ordinal() && ordinal() <= XOR.ordinal();
    }

    public boolean isICmp() {
        return ordinal() >= ICMP_EQ.ordinal() && ordinal() <= ICMP_SLE.ordinal();
    }

    /* 按助记符查找，找不到返回 null */
    public static Opcode fromKeyword(String keyword) {
        for (Opcode op : values()) {
            if (!op.isICmp() && op.keyword.equals(keyword)) {
                return op;
            }
        }
        return null;
    }

    public static Opcode fromPredicate(String predicate) {
        for (Opcode op : values()) {
            if (op.isICmp() && op.keyword.equals(predicate)) {
                return op;
            }
        }
        return null;
    }
}
