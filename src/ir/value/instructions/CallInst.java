package ir.value.instructions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;

public class CallInst extends Instruction {

    private final Function func;

    public CallInst(Function func, List<Value> args, String name) {
        super(func.getFunctionType().getReturnType(), func.getFunctionType().getReturnType().isVoid() ? "" : name);
        this.func = func;
        if (args.size() != func.getFunctionType().getParamTypes().size()) {
            throw new IllegalArgumentException("call to @" + func.getName() + " expects "
                    + func.getFunctionType().getParamTypes().size() + " args, got " + args.size());
        }

        for (Value arg : args) {
            addOperand(arg);
        }
    }

    public Function getCalledFunction() {
        return func;
    }

    public int getNumArgs() {
        return getNumOperands();
    }

    public Value getArg(int i) {
        return getOperand(i);
    }

    public List<Value> getArgs() {
        return getOperands();
    }

    public boolean isVoid() {
        return getType().isVoid();
    }

    @Override
    public Opcode opCode() {
        return Opcode.CALL;
    }

    @Override
    public String toIR() {
        List<Type> paramTypes = func.getFunctionType().getParamTypes();
        ArrayList<String> argStrings = new ArrayList<>();
        for (int i = 0; i < getNumArgs(); i++) {
            // 形参类型为准：函数作为实参时打印成函数指针
            argStrings.add(paramTypes.get(i).toIR() + " " + getArg(i).getReference());
        }

        String argStr = String.join(", ", argStrings);
        if (getType().isVoid()) {
            return "call void @" + func.getName() + "(" + argStr + ")";
        } else {
            return "%" + getName() + " = call " + getType().toIR() + " @" + func.getName() + "(" + argStr + ")";
        }
    }

    @Override
    public Instruction clone(Map<Value, Value> valueMap, Map<BasicBlock, BasicBlock> blockMap) {
        List<Value> newArgs = new ArrayList<>();
        for (Value arg : getArgs()) {
            newArgs.add(mapValue(valueMap, arg));
        }
        return new CallInst(func, newArgs, getName());
    }
}
