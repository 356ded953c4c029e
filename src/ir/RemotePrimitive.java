package ir;

import ir.type.FunctionType;
import ir.type.IntegerType;
import ir.type.PointerType;

import java.util.List;
import java.util.function.Supplier;

/**
 * 分布式运行时提供的原语。
 * <pre>
 * declare i16 @resolve_location(i8 addrspace(100)*)
 * declare i16 @invoke_remote(i16, i16 (i8*, i8*)*, i8*, i64, i8*, i64)
 * </pre>
 */
public enum RemotePrimitive {
    // 求出一个全局指针所在的节点
    RESOLVE_LOCATION("resolve_location",
            () -> FunctionType.get(IntegerType.getI16(),
                    List.of(PointerType.get(IntegerType.getI8(), PointerType.GLOBAL_SPACE)))),
    // 在目标节点上执行 delegate，返回出口编号
    INVOKE_REMOTE("invoke_remote",
            () -> FunctionType.get(IntegerType.getI16(),
                    List.of(IntegerType.getI16(),
                            PointerType.get(delegateType()),
                            PointerType.get(IntegerType.getI8()),
                            IntegerType.getI64(),
                            PointerType.get(IntegerType.getI8()),
                            IntegerType.getI64())));

    private final String name;
    private final Supplier<FunctionType> typeSupplier;

    RemotePrimitive(String name, Supplier<FunctionType> typeSupplier) {
        this.name = name;
        this.typeSupplier = typeSupplier;
    }

    /* delegate 的统一签名 i16 (i8*, i8*) */
    public static FunctionType delegateType() {
        PointerType bytePtr = PointerType.get(IntegerType.getI8());
        return FunctionType.get(IntegerType.getI16(), List.of(bytePtr, bytePtr));
    }

    public String getName() {
        return name;
    }

    public FunctionType getType() {
        return typeSupplier.get();
    }
}
