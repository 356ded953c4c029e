package ir.value.instructions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import ir.type.ArrayType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantInt;

public class GEPInst extends Instruction {
    private final boolean inBounds;

    /**
     * operand: [pointer, idx1, idx2]
     */
    public GEPInst(Value pointer, List<Value> indices, boolean inBounds, String name) {
        super(computeResultType(pointer.getType(), indices), name);

        if (indices.isEmpty()) {
            throw new IllegalArgumentException("GEP must have at least one index");
        }

        this.inBounds = inBounds;
        addOperand(pointer);

        for (var idx : indices) {
            addOperand(idx);
        }
    }

    public boolean isInBounds() {
        return inBounds;
    }

    public Value getPointer() {
        return getOperand(0);
    }

    public int getNumIndices() {
        return getNumOperands() - 1;
    }

    public Value getIndex(int i) {
        if (i < 0 || i >= getNumIndices()) {
            throw new IndexOutOfBoundsException("Index out of bounds: " + i);
        }
        return getOperand(i + 1);
    }

    public List<Value> getIndices() {
        return getOperands().subList(1, getOperands().size());
    }

    /**
     * 结果指针和基址在同一个地址空间。结构体只能用常量下标索引。
     */
    public static Type computeResultType(Type baseType, List<Value> indices) {
        if (!(baseType instanceof PointerType ptrType)) {
            throw new IllegalArgumentException("GEP base must be a pointer type");
        }

        Type currentType = ptrType.getPointeeType();

        // LLVM GEP: 第一个 index 只是解引用，不深入结构
        for (int i = 1; i < indices.size(); i++) {
            if (currentType instanceof ArrayType arrayType) {
                currentType = arrayType.getElementType();
            } else if (currentType instanceof StructType structType) {
                if (!(indices.get(i) instanceof ConstantInt fieldIdx)) {
                    throw new IllegalArgumentException("struct index must be a constant integer");
                }
                currentType = structType.getElementType((int) fieldIdx.getValue());
            } else {
                throw new IllegalArgumentException("Unsupported GEP indexing into type: " + currentType);
            }
        }

        return PointerType.get(currentType, ptrType.getAddressSpace());
    }

    @Override
    public Opcode opCode() {
        return Opcode.GETELEMENTPOINTER;
    }

    @Override
    public String toIR() {
        Value pointer = getOperand(0);
        if (!(pointer.getType() instanceof PointerType ptrType)) {
            throw new IllegalStateException("GEP pointer must have pointer type");
        }
        Type baseType = ptrType.getPointeeType();

        StringBuilder indexStr = new StringBuilder();
        for (int i = 1; i < getNumOperands(); i++) {
            if (i > 1)
                indexStr.append(", ");
            indexStr.append(typed(getOperand(i)));
        }

        return "%" + getName() + " = getelementptr "
                + (inBounds ? "inbounds " : "")
                + baseType.toIR() + ", "
                + typed(pointer)
                + ", " + indexStr;
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        List<Value> newIndices = new ArrayList<>();
        for (Value idx : getIndices()) {
            newIndices.add(mapValue(valueMap, idx));
        }
        return new GEPInst(mapValue(valueMap, getPointer()), newIndices, inBounds, getName());
    }
}
