package ir.value;

/**
 * 函数级属性，写在参数列表之后，例如
 * {@code define void @task(i32 addrspace(100)* %p) async { ... }}
 */
public enum FunctionAttribute {
    // 异步任务入口，delegate 抽取从这些函数开始
    ASYNC("async"),
    // 不读写内存
    READNONE("readnone"),
    // 与所在节点无关，可以出现在任意 delegate 里
    UNBOUND("unbound");

    private final String keyword;

    FunctionAttribute(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static FunctionAttribute fromKeyword(String keyword) {
        for (FunctionAttribute attr : values()) {
            if (attr.keyword.equals(keyword)) {
                return attr;
            }
        }
        return null;
    }
}
