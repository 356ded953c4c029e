package ir;

import ir.type.FunctionType;
import ir.type.PointerType;
import ir.type.Type;
import ir.value.*;
import ir.value.constants.Constant;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class IRModule {
    private static IRModule INSTANCE = new IRModule();
    private String moduleName;

    // 维护函数名到函数的映射
    private final Map<String, Function> functions = new LinkedHashMap<>();

    // 维护全局变量名到全局变量的映射
    private final Map<String, GlobalVariable> globalVariables = new LinkedHashMap<>();

    private final Map<String, Integer> nameCounts;

    private final TargetDataLayout targetDataLayout;

    private IRModule() {
        this.moduleName = "";
        this.targetDataLayout = TargetDataLayout.getDefault();
        nameCounts = new HashMap<>();
    }

    public void setName(String name) {
        this.moduleName = name;
    }

    public static IRModule getModule() {
        return INSTANCE;
    }

    public Function addFunction(String name, FunctionType type) {
        return addFunction(name, type, null);
    }

    public Function addFunction(String name, FunctionType type, List<String> argNames) {
        Function newFunc = new Function(this, type, name, argNames);
        registerFunction(name, newFunc);
        return newFunc;
    }

    /* 只有声明的外部函数 */
    public LibFunction declareFunction(String name, FunctionType type) {
        LibFunction decl = new LibFunction(this, type, name);
        registerFunction(name, decl);
        return decl;
    }

    public void registerFunction(String name, Function function) {
        if (functions.containsKey(name)) {
            throw new IllegalArgumentException(
                    "Function'" + name + "' has already been declared.");
        }
        functions.put(name, function);
    }

    public GlobalVariable addGlobal(String name, Type valueType, int addressSpace, Constant initializer) {
        if (globalVariables.containsKey(name)) {
            throw new IllegalArgumentException(
                    "Global '" + name + "' has already been defined.");
        }
        GlobalVariable gv = new GlobalVariable(this, PointerType.get(valueType, addressSpace), name, initializer);
        globalVariables.put(name, gv);
        return gv;
    }

    /**
     * 运行时原语是否已经以正确的签名声明。
     */
    public boolean hasPrimitive(RemotePrimitive primitive) {
        Function func = functions.get(primitive.getName());
        return func != null && func.getFunctionType().equals(primitive.getType());
    }

    public Function getPrimitive(RemotePrimitive primitive) {
        if (!hasPrimitive(primitive)) {
            throw exception.CompileException.missingPrimitive(primitive.getName());
        }
        return functions.get(primitive.getName());
    }

    public Function getOrDeclarePrimitive(RemotePrimitive primitive) {
        Function existing = functions.get(primitive.getName());
        if (existing != null) {
            return getPrimitive(primitive);
        }
        return declareFunction(primitive.getName(), primitive.getType());
    }

    public TargetDataLayout getTargetDataLayout() {
        return targetDataLayout;
    }

    public String getName() {
        return moduleName;
    }

    public List<Function> getFunctions() {
        List<Function> arr = new ArrayList<>(functions.values());
        return Collections.unmodifiableList(arr);
    }

    public GlobalVariable getGlobalVariable(String name) {
        return globalVariables.get(name);
    }

    public Function getFunction(String name) {
        return functions.get(name);
    }

    public List<GlobalVariable> getGlobalVariables() {
        return new ArrayList<>(globalVariables.values());
    }

    /**
     * Generates a unique name for a global entity (function, global variable, etc.)
     * within this module, e.g. "d0", "d0.0", "d0.1".
     *
     * @param baseName The base name to make unique.
     * @return A unique name.
     */
    public String getUniqueGlobalName(String baseName) {
        int count = nameCounts.getOrDefault(baseName, 0);
        String uniqueName = baseName;
        // Check if the name already exists in functions or global variables
        while (functions.containsKey(uniqueName) || globalVariables.containsKey(uniqueName)) {
            uniqueName = baseName + "." + count;
            count++;
        }
        nameCounts.put(baseName, count); // Store the next available count for this baseName
        return uniqueName;
    }

    @Override
    public String toString() {
        return toIR();
    }

    public String toIR() {
        StringBuilder sb = new StringBuilder();

        // Metadata
        sb.append("; ModuleID = '" + moduleName + "'\n");

        // Global variable definitions
        for (GlobalVariable global : globalVariables.values()) {
            sb.append(global.toIR()).append("\n");
        }
        sb.append("\n");

        // Print declarations first.
        for (Function func : functions.values()) {
            if (func instanceof LibFunction) {
                sb.append(func.toIR()).append("\n");
            }
        }
        sb.append("\n");

        // Then print the definitions of other functions.
        for (Function func : functions.values()) {
            if (!(func instanceof LibFunction))
                sb.append(func.toIR()).append("\n");
        }
        return sb.toString();
    }

    public void printToFile(String filename) throws IOException {
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(filename))) {
            writer.write(this.toIR());
        }
    }

    /* 每次编译或每个测试开始前调用 */
    public static void reset() {
        INSTANCE = new IRModule();
    }

}
