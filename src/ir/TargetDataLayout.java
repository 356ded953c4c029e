package ir;

import ir.type.ArrayType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;

/**
 * 64 位目标的数据布局：指针 8 字节，整数按自然宽度对齐，
 * 结构体按成员的最大对齐补齐。delegate 的输入输出缓冲区大小由这里算出。
 */
public record TargetDataLayout(String dataLayoutString) {
    private static final TargetDataLayout DEFAULT =
        new TargetDataLayout("e-m:e-p:64:64-i64:64-n8:16:32:64-S128");

    public static TargetDataLayout getDefault() {
        return DEFAULT;
    }

    public int getAlignment(Type type) {
        if (type instanceof PointerType) {
            return 8; // 64-bit pointers
        }
        if (type instanceof IntegerType intType) {
            return Math.max(1, intType.getBitWidth() / 8);
        }
        if (type instanceof ArrayType arrayType) {
            return getAlignment(arrayType.getElementType());
        }
        if (type instanceof StructType structType) {
            int align = 1;
            for (Type elem : structType.getElementTypes()) {
                align = Math.max(align, getAlignment(elem));
            }
            return align;
        }
        // Default alignment for types without a size, such as void or function.
        return 1;
    }

    public long getTypeSize(Type type) {
        if (type instanceof PointerType) {
            return 8;
        }
        if (type instanceof IntegerType intType) {
            return Math.max(1, intType.getBitWidth() / 8);
        }
        if (type instanceof ArrayType arrayType) {
            return getTypeSize(arrayType.getElementType()) * arrayType.getLength();
        }
        if (type instanceof StructType structType) {
            long offset = 0;
            for (Type elem : structType.getElementTypes()) {
                offset = alignTo(offset, getAlignment(elem)) + getTypeSize(elem);
            }
            return alignTo(offset, getAlignment(structType));
        }
        return 0;
    }

    private static long alignTo(long value, int align) {
        return (value + align - 1) / align * align;
    }
}
