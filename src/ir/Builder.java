package ir;

import java.util.List;

import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantInt;
import ir.value.instructions.AllocaInst;
import ir.value.instructions.BinOperator;
import ir.value.instructions.BranchInst;
import ir.value.instructions.CallInst;
import ir.value.instructions.CastInst;
import ir.value.instructions.GEPInst;
import ir.value.instructions.ICmpInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import ir.value.instructions.Phi;
import ir.value.instructions.ReturnInst;
import ir.value.instructions.SelectInst;
import ir.value.instructions.StoreInst;
import ir.value.instructions.SwitchInst;

public class Builder {
    private final IRModule module;
    private BasicBlock currentBlock;
    private Function currentFunction;
    // 非空时新指令插在它前面，否则追加到块尾
    private Instruction insertPoint;

    public Builder(IRModule module) {
        this.module = module;
    }

    public void positionAtEnd(BasicBlock block) {
        this.currentBlock = block;
        this.currentFunction = block.getParent();
        this.insertPoint = null;
    }

    public void positionBefore(Instruction inst) {
        this.currentBlock = inst.getParent();
        this.currentFunction = currentBlock.getParent();
        this.insertPoint = inst;
    }

    public IRModule getModule() {
        return module;
    }

    private void insertInstruction(Instruction inst) {
        assert inst != null : "Instruction cannot be null";
        if (insertPoint != null) {
            currentBlock.addInstructionBefore(inst, insertPoint);
            return;
        }
        assert !currentBlock.lastInstIsTerminator()
                : "Cannot insert into a terminated BasicBlock";
        currentBlock.addInstruction(inst);
    }

    public Value buildBinary(Opcode opcode, Value lhs, Value rhs, String name) {
        assert lhs.getType().equals(rhs.getType())
                : "lhs and rhs should have the same type in bin instruction";
        Instruction inst = new BinOperator(name, opcode, lhs.getType(), lhs, rhs);
        insertInstruction(inst);
        return inst;
    }

    // --- 算术指令 ---
    public Value buildICmp(Opcode predicate, Value lhs, Value rhs, String name) {
        assert lhs.getType().equals(rhs.getType())
                : "icmp operands should have the same type";
        Instruction inst = new ICmpInst(predicate, name, lhs, rhs);
        insertInstruction(inst);
        return inst;
    }

    // --- 内存操作 ---

    /* alloca 统一放在入口块开头的 alloca 序列之后 */
    public Value buildAlloca(Type allocatedType, String name) {
        BasicBlock entryBlock = currentFunction.getEntryBlock();
        AllocaInst inst = new AllocaInst(allocatedType, name);

        // Find the first non-alloca instruction in the entry block
        Instruction firstNonAlloca = null;
        for (var node : entryBlock.getInstructions()) {
            if (!(node.getVal() instanceof AllocaInst)) {
                firstNonAlloca = node.getVal();
                break;
            }
        }

        if (firstNonAlloca != null) {
            entryBlock.addInstructionBefore(inst, firstNonAlloca);
        } else {
            entryBlock.addInstruction(inst);
        }
        return inst;
    }

    public Value buildLoad(Value pointer, String name) {
        assert pointer.getType().isPointer()
                : "Load requires a pointer operand";
        Instruction inst = new LoadInst(pointer, name);
        insertInstruction(inst);
        return inst;
    }

    public void buildStore(Value value, Value pointer) {
        assert pointer.getType().isPointer()
                : "Store requires a pointer operand";
        PointerType ptrType = (PointerType) pointer.getType();
        assert ptrType.getPointeeType().equals(value.getType())
                : "Store: value type doesn't match pointer's pointee type";

        Instruction inst = new StoreInst(pointer, value);
        insertInstruction(inst);
    }

    // --- 类型转换 ---
    public Value buildCast(Opcode op, Value value, Type destType, String name) {
        Instruction inst = new CastInst(op, value, destType, name);
        insertInstruction(inst);
        return inst;
    }

    public Value buildBitCast(Value value, Type destType, String name) {
        return buildCast(Opcode.BITCAST, value, destType, name);
    }

    /* 指针转换：地址空间不同时用 addrspacecast */
    public Value buildPointerCast(Value value, PointerType destType, String name) {
        if (value.getType().equals(destType)) {
            return value;
        }
        Opcode op = value.getType().getAddressSpace() == destType.getAddressSpace()
                ? Opcode.BITCAST : Opcode.ADDRSPACECAST;
        if (op == Opcode.ADDRSPACECAST) {
            // addrspacecast 只换地址空间，指向类型先用 bitcast 对齐
            PointerType sameSpace = PointerType.get(destType.getPointeeType(), value.getType().getAddressSpace());
            value = buildPointerCast(value, sameSpace, name);
        }
        return buildCast(op, value, destType, name);
    }

    // --- 控制流 ---
    public void buildBr(BasicBlock dest) {
        assert dest != null : "Branch destination cannot be null";
        Instruction inst = new BranchInst(dest);
        currentBlock.setSuccessor(dest);
        insertInstruction(inst);
    }

    public void buildCondBr(Value condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        assert condition != null && thenBlock != null && elseBlock != null
                : "Conditional branch requires non-null condition and destinations";
        assert condition.getType().isI1()
                : "Condition must be of i1 type for conditional branch";
        Instruction inst = new BranchInst(condition, thenBlock, elseBlock);
        currentBlock.setSuccessor(thenBlock);
        currentBlock.setSuccessor(elseBlock);
        insertInstruction(inst);
    }

    /* case 由调用者通过 addCase 补齐，后继关系也在 addCase 时维护 */
    public SwitchInst buildSwitch(Value condition, BasicBlock defaultBlock) {
        SwitchInst inst = new SwitchInst(condition, defaultBlock);
        currentBlock.setSuccessor(defaultBlock);
        insertInstruction(inst);
        return inst;
    }

    public void addCase(SwitchInst inst, long value, BasicBlock dest) {
        inst.addCase(ConstantInt.get((IntegerType) inst.getCondition().getType(), value), dest);
        inst.getParent().setSuccessor(dest);
    }

    public void buildRet(Value value) {
        assert value != null : "Return value cannot be null; use buildRetVoid instead if void";
        Instruction inst = new ReturnInst(value);
        insertInstruction(inst);
    }

    public void buildRetVoid() {
        Instruction inst = new ReturnInst(null);
        insertInstruction(inst);
    }

    // --- 选择指令 ---
    public Value buildSelect(Value cond, Value trueVal, Value falseVal, String name) {
        Instruction inst = new SelectInst(cond, trueVal, falseVal, name);
        insertInstruction(inst);
        return inst;
    }

    /* 普通函数调用 */
    public Value buildCall(Function function, List<Value> args, String name) {
        Instruction inst = new CallInst(function, args, name);
        insertInstruction(inst);
        return inst;
    }

    /* 对运行时原语的调用 */
    public Value buildCallToPrimitive(RemotePrimitive primitive, List<Value> args, String name) {
        return buildCall(module.getPrimitive(primitive), args, name);
    }

    // --- GEP ---
    public Value buildGEP(Value pointer, List<Value> indices, String name) {
        assert pointer.getType().isPointer()
                : "GEP base must be a pointer";
        Instruction inst = new GEPInst(pointer, indices, false, name);
        insertInstruction(inst);
        return inst;
    }

    public Value buildInBoundsGEP(Value pointer, List<Value> indices, String name) {
        assert pointer.getType().isPointer()
                : "GEP base must be a pointer";
        Instruction inst = new GEPInst(pointer, indices, true, name);
        insertInstruction(inst);
        return inst;
    }

    /* 结构体第 index 个字段的地址：gep inbounds {0, index} */
    public Value buildStructGEP(Value pointer, int index, String name) {
        return buildInBoundsGEP(pointer,
                List.of(ConstantInt.get(IntegerType.getI32(), 0), ConstantInt.get(IntegerType.getI32(), index)),
                name);
    }

    // --- PHI ---

    public Phi buildPhi(Type type, String name) {
        Phi inst = new Phi(type, name);
        currentBlock.insertPhi(inst);
        return inst;
    }
}
