package ir.value;

import ir.type.Type;
import java.util.LinkedList;
import java.util.Objects;

public abstract class Value {
    private Type type;
    private String name;

    // 谁用了我
    private LinkedList<Use> usesList;

    protected Value(Type type, String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
        this.usesList = new LinkedList<>();
    }

    public abstract String toIR();

    /* getter setter */
    public String getName() { return this.name; }
    public Type getType() { return this.type; }
    public LinkedList<Use> getUses() { return usesList; }
    public boolean isConstant() { return false; }

    public void setName(String name) { this.name = name; }

    /**
     * 获取在指令中引用此值时的字符串表示
     * 对于常量：只返回取值部分（如 "42"），由常量自己覆盖
     * 对于全局量和函数："@name"
     * 对于局部值："%name"
     */
    public String getReference() {
        return "%" + getName();
    }

    /* use field */
    // 将所有使用oldValue的值换成newValue
    public void replaceAllUsesWith(Value newValue) {
        if (this == newValue) return;
        LinkedList<Use> oldUses = new LinkedList<>(usesList);
        for (Use use : oldUses) {
            User user = use.getUser();
            int index = use.getOperandIndex();
            // 替换 User 的操作数
            user.setOperand(index, newValue);
        }
    }

    void addUse(Use use) {
        Objects.requireNonNull(use, "use");
        this.usesList.add(use);
    }

    void removeUseFrom(User user) {
        usesList.removeIf(use -> use.getUser() == user);
    }

    void removeUseBy(User user, int index) {
        usesList.removeIf(use ->
                          use.getUser() == user
                          && use.getOperandIndex() == index);
    }

    @Override
    public String toString() {
        return toIR();
    }
}
