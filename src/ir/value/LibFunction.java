package ir.value;

import ir.IRModule;
import ir.type.FunctionType;
import ir.type.Type;

import java.util.stream.Collectors;

/**
 * 只有声明没有函数体的外部函数，包括运行时原语。
 */
public class LibFunction extends Function {

    public LibFunction(IRModule parent, FunctionType type, String name) {
        super(parent, type, name);
    }

    @Override
    public boolean isDeclaration() {
        return true; // Lib functions are always declarations
    }

    @Override
    public String toIR() {
        FunctionType fnType = getFunctionType();

        String argsStr = fnType.getParamTypes().stream()
            .map(Type::toIR)
            .collect(Collectors.joining(", "));

        return "declare " + fnType.getReturnType().toIR()
            + " @" + getName() + "(" + argsStr + ")" + attributesToIR();
    }

}
