package ir.type;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 字面量结构体类型 { T0, T1, ... }，按元素列表池化。
 * delegate 的输入/输出缓冲区布局都用它来描述。
 */
public final class StructType extends Type {
    private final List<Type> elementTypes;

    private static final Map<List<Type>, StructType> pool =
        new ConcurrentHashMap<>();

    private StructType(List<Type> elementTypes) {
        super(TypeKind.STRUCT);
        this.elementTypes = elementTypes;
    }

    public static StructType get(List<Type> elementTypes) {
        return pool.computeIfAbsent(List.copyOf(elementTypes), StructType::new);
    }

    public List<Type> getElementTypes() {
        return elementTypes;
    }

    public Type getElementType(int index) {
        if (index < 0 || index >= elementTypes.size()) {
            throw new IndexOutOfBoundsException(
                "struct field " + index + " out of range for " + toIR());
        }
        return elementTypes.get(index);
    }

    public int getNumElements() {
        return elementTypes.size();
    }

    @Override
    public String toIR() {
        if (elementTypes.isEmpty()) {
            return "{}";
        }
        return elementTypes.stream()
            .map(Type::toIR)
            .collect(Collectors.joining(", ", "{ ", " }"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructType other)) return false;
        return elementTypes.equals(other.elementTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), elementTypes);
    }
}
