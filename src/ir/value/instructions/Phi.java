package ir.value.instructions;

import java.util.Map;

import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

public class Phi extends Instruction {
    public Phi(Type type, String name) {
        super(type, name);
    }

    public void addIncoming(Value value, BasicBlock block) {
        assert value.getType().equals(getType())
            : "PHI incoming value must match PHI type";
        addOperand(value);
        addOperand(block);
    }

    public int getNumIncoming() {
        return getNumOperands() / 2;
    }

    public Value getIncomingValue(int index) {
        assert index >= 0 && index < getNumIncoming()
            : "PHI index out of range";
        return getOperand(index * 2);
    }

    public BasicBlock getIncomingBlock(int index) {
        return (BasicBlock) getOperand(index * 2 + 1);
    }

    public void setIncomingBlock(int index, BasicBlock blk) {
        setOperand(index * 2 + 1, blk);
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append("%").append(getName())
          .append(" = phi ")
          .append(getType().toIR())
          .append(" ");

        for (int i = 0; i < getNumIncoming(); i++) {
            if (i > 0) sb.append(", ");
            sb.append("[ ")
              .append(getIncomingValue(i).getReference())
              .append(", %")
              .append(getIncomingBlock(i).getName())
              .append(" ]");
        }

        return sb.toString();
    }

    @Override
    public Opcode opCode() {
        return Opcode.PHI;
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        Phi newPhi = new Phi(getType(), getName());
        for (int i = 0; i < getNumIncoming(); i++) {
            newPhi.addIncoming(mapValue(valueMap, getIncomingValue(i)),
                    mapBlock(blockMap, getIncomingBlock(i)));
        }
        return newPhi;
    }
}
