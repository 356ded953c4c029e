package frontend.irgen;

import frontend.grammar.IRBaseVisitor;
import frontend.grammar.IRParser;
import ir.Builder;
import ir.IRModule;
import ir.type.ArrayType;
import ir.type.FunctionType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.Type;
import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.FunctionAttribute;
import ir.value.GlobalVariable;
import ir.value.Opcode;
import ir.value.UndefValue;
import ir.value.Value;
import ir.value.constants.Constant;
import ir.value.constants.ConstantExpr;
import ir.value.constants.ConstantInt;
import ir.value.constants.ConstantNull;
import ir.value.constants.ConstantZeroInitializer;
import ir.value.instructions.AllocaInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.Phi;
import ir.value.instructions.SwitchInst;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import pass.IRPass.analysis.CFGAnalysisPass;
import util.LoggingManager;
import util.llvm.IRParseException;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把文本 IR 的语法树翻译成 {@link IRModule}。
 *
 * <p>先登记全局量和所有函数签名，再逐个生成函数体，函数体里可以调用后面才定义的函数。
 * 函数内对尚未定义的值（phi、回边）先放一个唯一的 undef 占位，定义时再替换。
 */
public class IRTextGenerator extends IRBaseVisitor<Value> {
    private static final Logger log = LoggingManager.getLogger(IRTextGenerator.class);

    private final IRModule module;
    private final Builder builder;

    private Function currentFunction;
    private BasicBlock currentBlock;
    // 正在生成的赋值指令左边的名字
    private String pendingName;
    private final Map<String, Value> locals = new HashMap<>();
    private final Map<String, BasicBlock> blocks = new HashMap<>();
    private final Map<String, UndefValue> forwardRefs = new LinkedHashMap<>();
    private final Map<String, Token> forwardRefTokens = new HashMap<>();

    public IRTextGenerator(String moduleName) {
        this.module = IRModule.getModule();
        this.module.setName(moduleName);
        this.builder = new Builder(module);
    }

    public IRModule getModule() {
        return module;
    }

    /**
     * 生成整个模块，语义错误转换成 {@link IRParseException}。
     */
    public IRModule generate(IRParser.IrModuleContext ctx) throws IRParseException {
        try {
            visit(ctx);
        } catch (SemanticError e) {
            throw new IRParseException(e.getMessage(), e.line, e.column);
        }
        return module;
    }

    /* 语义错误在访问者内部以非受检异常传递，由 generate 统一转换 */
    private static final class SemanticError extends RuntimeException {
        private final int line;
        private final int column;

        SemanticError(String message, int line, int column) {
            super(message);
            this.line = line;
            this.column = column;
        }
    }

    private static SemanticError error(ParserRuleContext ctx, String message) {
        Token start = ctx.getStart();
        return new SemanticError(message, start.getLine(), start.getCharPositionInLine());
    }

    private static SemanticError error(Token token, String message) {
        return new SemanticError(message, token.getLine(), token.getCharPositionInLine());
    }

    // ==================== 模块 ====================

    @Override
    public Value visitIrModule(IRParser.IrModuleContext ctx) {
        Map<IRParser.IrDefineContext, Function> definitions = new LinkedHashMap<>();
        for (IRParser.IrTopLevelContext top : ctx.irTopLevel()) {
            if (top.irGlobal() != null) {
                visit(top.irGlobal());
            } else if (top.irDeclare() != null) {
                visit(top.irDeclare());
            } else if (top.irDefine() != null) {
                definitions.put(top.irDefine(), declareDefinition(top.irDefine()));
            }
        }
        for (var e : definitions.entrySet()) {
            generateBody(e.getKey(), e.getValue());
        }
        log.debug("loaded module '{}': {} functions, {} globals", module.getName(),
                module.getFunctions().size(), module.getGlobalVariables().size());
        return null;
    }

    @Override
    public Value visitIrGlobal(IRParser.IrGlobalContext ctx) {
        String name = stripSigil(ctx.GLOBAL_ID().getText());
        if (module.getGlobalVariable(name) != null || module.getFunction(name) != null) {
            throw error(ctx, "redefinition of @" + name);
        }
        Type valueType = parseType(ctx.irType());
        int space = ctx.irAddrSpace() != null ? parseAddrSpace(ctx.irAddrSpace()) : PointerType.DEFAULT_SPACE;
        Constant init = null;
        if (ctx.irConstant() != null) {
            Value v = parseConstant(ctx.irConstant(), valueType);
            if (!(v instanceof Constant c)) {
                throw error(ctx.irConstant(), "global initializer must be a constant");
            }
            init = c;
        }
        GlobalVariable gv = module.addGlobal(name, valueType, space, init);
        gv.setConst(ctx.CONSTANT() != null);
        return gv;
    }

    @Override
    public Value visitIrDeclare(IRParser.IrDeclareContext ctx) {
        String name = stripSigil(ctx.GLOBAL_ID().getText());
        if (module.getFunction(name) != null) {
            throw error(ctx, "redefinition of @" + name);
        }
        FunctionType type = FunctionType.get(parseType(ctx.irType()), parseTypeList(ctx.irTypeList()));
        Function decl = module.declareFunction(name, type);
        addAttributes(decl, ctx.irFuncAttr());
        return decl;
    }

    private Function declareDefinition(IRParser.IrDefineContext ctx) {
        String name = stripSigil(ctx.GLOBAL_ID().getText());
        if (module.getFunction(name) != null) {
            throw error(ctx, "redefinition of @" + name);
        }
        List<Type> paramTypes = new ArrayList<>();
        List<String> argNames = new ArrayList<>();
        if (ctx.irParams() != null) {
            for (IRParser.IrParamContext p : ctx.irParams().irParam()) {
                paramTypes.add(parseType(p.irType()));
                argNames.add(stripSigil(p.LOCAL_ID().getText()));
            }
        }
        FunctionType type = FunctionType.get(parseType(ctx.irType()), paramTypes);
        Function func = module.addFunction(name, type, argNames);
        addAttributes(func, ctx.irFuncAttr());
        return func;
    }

    private static void addAttributes(Function func, List<IRParser.IrFuncAttrContext> attrs) {
        for (IRParser.IrFuncAttrContext attr : attrs) {
            func.addAttribute(FunctionAttribute.fromKeyword(attr.getText()));
        }
    }

    private void generateBody(IRParser.IrDefineContext ctx, Function func) {
        currentFunction = func;
        locals.clear();
        blocks.clear();
        forwardRefs.clear();
        forwardRefTokens.clear();

        List<IRParser.IrParamContext> params = ctx.irParams() != null ? ctx.irParams().irParam() : List.of();
        for (int i = 0; i < params.size(); i++) {
            String argName = stripSigil(params.get(i).LOCAL_ID().getText());
            if (locals.put(argName, func.getParam(i)) != null) {
                throw error(params.get(i), "duplicate parameter %" + argName);
            }
        }

        // 先建好所有块，分支可以引用后面的块
        List<BasicBlock> created = new ArrayList<>();
        for (IRParser.IrBlockContext blockCtx : ctx.irBlock()) {
            String label = blockCtx.LABEL() != null
                    ? blockCtx.LABEL().getText().substring(0, blockCtx.LABEL().getText().length() - 1)
                    : "entry";
            if (blocks.containsKey(label)) {
                throw error(blockCtx, "duplicate block label " + label);
            }
            BasicBlock bb = func.appendBasicBlock(label);
            blocks.put(label, bb);
            created.add(bb);
        }

        for (int i = 0; i < created.size(); i++) {
            currentBlock = created.get(i);
            builder.positionAtEnd(currentBlock);
            for (IRParser.IrInstructionContext inst : ctx.irBlock(i).irInstruction()) {
                if (currentBlock.lastInstIsTerminator()) {
                    throw error(inst, "instruction after terminator in block " + currentBlock.getName());
                }
                visit(inst);
            }
            if (!currentBlock.lastInstIsTerminator()) {
                throw error(ctx.irBlock(i), "block " + currentBlock.getName() + " has no terminator");
            }
        }

        if (!forwardRefs.isEmpty()) {
            String name = forwardRefs.keySet().iterator().next();
            throw error(forwardRefTokens.get(name), "use of undefined value %" + name);
        }
        new CFGAnalysisPass().runOnFunction(func);
    }

    // ==================== 类型 ====================

    private Type parseType(IRParser.IrTypeContext ctx) {
        Type type = parseBaseType(ctx.irBaseType());
        for (IRParser.IrTypeSuffixContext suffix : ctx.irTypeSuffix()) {
            if (suffix instanceof IRParser.IrPointerSuffixContext ptr) {
                int space = ptr.irAddrSpace() != null ? parseAddrSpace(ptr.irAddrSpace()) : PointerType.DEFAULT_SPACE;
                type = PointerType.get(type, space);
            } else if (suffix instanceof IRParser.IrFunctionSuffixContext fn) {
                type = FunctionType.get(type, parseTypeList(fn.irTypeList()));
            }
        }
        return type;
    }

    private Type parseBaseType(IRParser.IrBaseTypeContext ctx) {
        if (ctx instanceof IRParser.IrVoidTypeContext) {
            return VoidType.getVoid();
        }
        if (ctx instanceof IRParser.IrIntTypeContext intType) {
            int bits = Integer.parseInt(intType.INT_TYPE().getText().substring(1));
            if (bits != 1 && bits != 8 && bits != 16 && bits != 32 && bits != 64) {
                throw error(ctx, "unsupported integer width i" + bits);
            }
            return IntegerType.getInteger(bits);
        }
        if (ctx instanceof IRParser.IrArrayTypeContext array) {
            return ArrayType.get(parseType(array.irType()), Integer.parseInt(array.INT().getText()));
        }
        if (ctx instanceof IRParser.IrStructTypeContext struct) {
            return StructType.get(parseTypeList(struct.irTypeList()));
        }
        throw error(ctx, "unknown type " + ctx.getText());
    }

    private List<Type> parseTypeList(IRParser.IrTypeListContext ctx) {
        List<Type> types = new ArrayList<>();
        if (ctx != null) {
            for (IRParser.IrTypeContext t : ctx.irType()) {
                types.add(parseType(t));
            }
        }
        return types;
    }

    private static int parseAddrSpace(IRParser.IrAddrSpaceContext ctx) {
        return Integer.parseInt(ctx.INT().getText());
    }

    // ==================== 值 ====================

    private Value parseTypedValue(IRParser.IrTypedValueContext ctx) {
        return parseValue(ctx.irValue(), parseType(ctx.irType()));
    }

    private Value parseValue(IRParser.IrValueContext ctx, Type type) {
        if (ctx.LOCAL_ID() != null) {
            return lookupLocal(ctx.LOCAL_ID().getSymbol(), type);
        }
        if (ctx.GLOBAL_ID() != null) {
            return lookupGlobal(ctx, stripSigil(ctx.GLOBAL_ID().getText()), type);
        }
        return parseConstant(ctx.irConstant(), type);
    }

    private Value lookupLocal(Token token, Type type) {
        String name = stripSigil(token.getText());
        if (currentFunction == null) {
            throw error(token, "local value %" + name + " outside of a function");
        }
        Value v = locals.get(name);
        if (v == null) {
            // 前向引用
            UndefValue placeholder = forwardRefs.computeIfAbsent(name, k -> UndefValue.createUnique(type));
            forwardRefTokens.putIfAbsent(name, token);
            v = placeholder;
        }
        if (!v.getType().equals(type)) {
            throw error(token, "%" + name + " has type " + v.getType() + ", expected " + type);
        }
        return v;
    }

    private Value lookupGlobal(ParserRuleContext ctx, String name, Type type) {
        GlobalVariable gv = module.getGlobalVariable(name);
        if (gv != null) {
            if (!gv.getType().equals(type)) {
                throw error(ctx, "@" + name + " has type " + gv.getType() + ", expected " + type);
            }
            return gv;
        }
        Function func = module.getFunction(name);
        if (func != null) {
            // 函数作为值时写成函数指针
            boolean matches = type.equals(func.getFunctionType())
                    || type instanceof PointerType ptr && ptr.getPointeeType().equals(func.getFunctionType());
            if (!matches) {
                throw error(ctx, "@" + name + " has type " + func.getFunctionType() + ", expected " + type);
            }
            return func;
        }
        throw error(ctx, "unknown global @" + name);
    }

    private Value parseConstant(IRParser.IrConstantContext ctx, Type type) {
        if (ctx instanceof IRParser.IrIntConstContext intConst) {
            if (!(type instanceof IntegerType intType)) {
                throw error(ctx, "integer constant of non-integer type " + type);
            }
            return ConstantInt.get(intType, Long.parseLong(intConst.INT().getText()));
        }
        if (ctx instanceof IRParser.IrBoolConstContext boolConst) {
            if (!type.isI1()) {
                throw error(ctx, "boolean constant of type " + type);
            }
            return ConstantInt.get(IntegerType.getI1(), boolConst.TRUE() != null ? 1 : 0);
        }
        if (ctx instanceof IRParser.IrNullConstContext) {
            if (!(type instanceof PointerType ptrType)) {
                throw error(ctx, "null of non-pointer type " + type);
            }
            return new ConstantNull(ptrType);
        }
        if (ctx instanceof IRParser.IrUndefConstContext) {
            return UndefValue.get(type);
        }
        if (ctx instanceof IRParser.IrZeroConstContext) {
            return new ConstantZeroInitializer(type);
        }
        if (ctx instanceof IRParser.IrGEPConstContext gep) {
            Type sourceType = parseType(gep.irType());
            Value pointer = parseTypedValue(gep.irTypedValue(0));
            checkPointee(gep, pointer, sourceType);
            List<Value> indices = new ArrayList<>();
            for (int i = 1; i < gep.irTypedValue().size(); i++) {
                indices.add(parseTypedValue(gep.irTypedValue(i)));
            }
            ConstantExpr expr;
            try {
                expr = ConstantExpr.getGEP(pointer, indices, gep.INBOUNDS() != null);
            } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
                throw error(gep, e.getMessage());
            }
            return checkType(gep, expr, type);
        }
        if (ctx instanceof IRParser.IrCastConstContext cast) {
            Opcode op = Opcode.fromKeyword(cast.irCastOp().getText());
            Value operand = parseTypedValue(cast.irTypedValue());
            ConstantExpr expr = ConstantExpr.getCast(op, operand, parseType(cast.irType()));
            return checkType(cast, expr, type);
        }
        throw error(ctx, "unknown constant " + ctx.getText());
    }

    private static Value checkType(ParserRuleContext ctx, Value v, Type expected) {
        if (!v.getType().equals(expected)) {
            throw error(ctx, "value has type " + v.getType() + ", expected " + expected);
        }
        return v;
    }

    private static void checkPointee(ParserRuleContext ctx, Value pointer, Type expected) {
        if (!(pointer.getType() instanceof PointerType ptrType)) {
            throw error(ctx, "expected a pointer, got " + pointer.getType());
        }
        if (!ptrType.getPointeeType().equals(expected)) {
            throw error(ctx, "pointer to " + ptrType.getPointeeType() + " used as pointer to " + expected);
        }
    }

    private BasicBlock lookupBlock(Token token) {
        String name = stripSigil(token.getText());
        BasicBlock bb = blocks.get(name);
        if (bb == null) {
            throw error(token, "unknown block %" + name);
        }
        return bb;
    }

    /* 定义局部值，替换掉之前的前向引用占位 */
    private void defineLocal(ParserRuleContext ctx, String name, Value v) {
        if (locals.containsKey(name)) {
            throw error(ctx, "redefinition of %" + name);
        }
        UndefValue placeholder = forwardRefs.remove(name);
        if (placeholder != null) {
            forwardRefTokens.remove(name);
            if (!placeholder.getType().equals(v.getType())) {
                throw error(ctx, "%" + name + " defined as " + v.getType()
                        + " but used as " + placeholder.getType());
            }
            placeholder.replaceAllUsesWith(v);
        }
        locals.put(name, v);
    }

    private static String stripSigil(String text) {
        return text.substring(1);
    }

    // ==================== 指令 ====================

    @Override
    public Value visitIrAssignInst(IRParser.IrAssignInstContext ctx) {
        String name = stripSigil(ctx.LOCAL_ID().getText());
        pendingName = name;
        Value v = visit(ctx.irValueInst());
        pendingName = null;
        if (v.getType().isVoid()) {
            throw error(ctx, "cannot assign a void value to %" + name);
        }
        defineLocal(ctx, name, v);
        return v;
    }

    @Override
    public Value visitIrAllocaInst(IRParser.IrAllocaInstContext ctx) {
        // 不经过 builder.buildAlloca，保持 alloca 在源文本里的位置
        Instruction inst = new AllocaInst(parseType(ctx.irType()), pendingName);
        currentBlock.addInstruction(inst);
        return inst;
    }

    @Override
    public Value visitIrLoadInst(IRParser.IrLoadInstContext ctx) {
        Type type = parseType(ctx.irType());
        Value pointer = parseTypedValue(ctx.irTypedValue());
        checkPointee(ctx, pointer, type);
        return builder.buildLoad(pointer, pendingName);
    }

    @Override
    public Value visitIrStoreInst(IRParser.IrStoreInstContext ctx) {
        Value value = parseTypedValue(ctx.irTypedValue(0));
        Value pointer = parseTypedValue(ctx.irTypedValue(1));
        checkPointee(ctx, pointer, value.getType());
        builder.buildStore(value, pointer);
        return null;
    }

    @Override
    public Value visitIrGEPInst(IRParser.IrGEPInstContext ctx) {
        Type sourceType = parseType(ctx.irType());
        Value pointer = parseTypedValue(ctx.irTypedValue(0));
        checkPointee(ctx, pointer, sourceType);
        List<Value> indices = new ArrayList<>();
        for (int i = 1; i < ctx.irTypedValue().size(); i++) {
            indices.add(parseTypedValue(ctx.irTypedValue(i)));
        }
        if (indices.isEmpty()) {
            throw error(ctx, "getelementptr needs at least one index");
        }
        try {
            return ctx.INBOUNDS() != null
                    ? builder.buildInBoundsGEP(pointer, indices, pendingName)
                    : builder.buildGEP(pointer, indices, pendingName);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw error(ctx, e.getMessage());
        }
    }

    @Override
    public Value visitIrCastInst(IRParser.IrCastInstContext ctx) {
        Opcode op = Opcode.fromKeyword(ctx.irCastOp().getText());
        Value value = parseTypedValue(ctx.irTypedValue());
        Type dest = parseType(ctx.irType());
        checkCast(ctx, op, value.getType(), dest);
        return builder.buildCast(op, value, dest, pendingName);
    }

    private static void checkCast(ParserRuleContext ctx, Opcode op, Type src, Type dest) {
        boolean ok = switch (op) {
            case TRUNC, ZEXT, SEXT -> src.isInteger() && dest.isInteger() && !src.equals(dest);
            case PTRTOINT -> src.isPointer() && dest.isInteger();
            case INTTOPTR -> src.isInteger() && dest.isPointer();
            case ADDRSPACECAST -> src.isPointer() && dest.isPointer();
            default -> true;
        };
        if (!ok) {
            throw error(ctx, "invalid " + op.getKeyword() + " from " + src + " to " + dest);
        }
    }

    @Override
    public Value visitIrBinaryInst(IRParser.IrBinaryInstContext ctx) {
        Opcode op = Opcode.fromKeyword(ctx.irBinOp().getText());
        Type type = parseType(ctx.irType());
        if (!type.isInteger()) {
            throw error(ctx, ctx.irBinOp().getText() + " on non-integer type " + type);
        }
        Value lhs = parseValue(ctx.irValue(0), type);
        Value rhs = parseValue(ctx.irValue(1), type);
        return builder.buildBinary(op, lhs, rhs, pendingName);
    }

    @Override
    public Value visitIrICmpInst(IRParser.IrICmpInstContext ctx) {
        Opcode op = Opcode.fromPredicate(ctx.irPredicate().getText());
        Type type = parseType(ctx.irType());
        Value lhs = parseValue(ctx.irValue(0), type);
        Value rhs = parseValue(ctx.irValue(1), type);
        return builder.buildICmp(op, lhs, rhs, pendingName);
    }

    @Override
    public Value visitIrSelectInst(IRParser.IrSelectInstContext ctx) {
        Value cond = parseTypedValue(ctx.irTypedValue(0));
        Value trueVal = parseTypedValue(ctx.irTypedValue(1));
        Value falseVal = parseTypedValue(ctx.irTypedValue(2));
        if (!cond.getType().isI1()) {
            throw error(ctx, "select condition must be i1");
        }
        checkType(ctx, falseVal, trueVal.getType());
        return builder.buildSelect(cond, trueVal, falseVal, pendingName);
    }

    @Override
    public Value visitIrPhiInst(IRParser.IrPhiInstContext ctx) {
        if (currentBlock.getFirstNonPhi() != null) {
            throw error(ctx, "phi after non-phi instruction in block " + currentBlock.getName());
        }
        Type type = parseType(ctx.irType());
        Phi phi = new Phi(type, pendingName);
        for (IRParser.IrIncomingContext in : ctx.irIncoming()) {
            phi.addIncoming(parseValue(in.irValue(), type), lookupBlock(in.LOCAL_ID().getSymbol()));
        }
        // 按文本顺序追加，insertPhi 会把 phi 插到块首
        currentBlock.addInstruction(phi);
        return phi;
    }

    @Override
    public Value visitIrCallInst(IRParser.IrCallInstContext ctx) {
        return buildCall(ctx, ctx.irType(), ctx.GLOBAL_ID().getSymbol(), ctx.irArgs(), pendingName);
    }

    @Override
    public Value visitIrVoidCallInst(IRParser.IrVoidCallInstContext ctx) {
        return buildCall(ctx, ctx.irType(), ctx.GLOBAL_ID().getSymbol(), ctx.irArgs(), "");
    }

    private Value buildCall(ParserRuleContext ctx, IRParser.IrTypeContext retCtx, Token callee,
                            IRParser.IrArgsContext argsCtx, String name) {
        String calleeName = stripSigil(callee.getText());
        Function func = module.getFunction(calleeName);
        if (func == null) {
            throw error(callee, "call to unknown function @" + calleeName);
        }
        FunctionType fnType = func.getFunctionType();
        Type retType = parseType(retCtx);
        if (!retType.equals(fnType.getReturnType())) {
            throw error(ctx, "@" + calleeName + " returns " + fnType.getReturnType() + ", not " + retType);
        }
        List<IRParser.IrTypedValueContext> argCtxs = argsCtx != null ? argsCtx.irTypedValue() : List.of();
        if (argCtxs.size() != fnType.getParamTypes().size()) {
            throw error(ctx, "@" + calleeName + " expects " + fnType.getParamTypes().size()
                    + " arguments, got " + argCtxs.size());
        }
        List<Value> args = new ArrayList<>();
        for (int i = 0; i < argCtxs.size(); i++) {
            Value arg = parseTypedValue(argCtxs.get(i));
            Type paramType = fnType.getParamTypes().get(i);
            if (!arg.getType().equals(paramType) && !(arg instanceof Function)) {
                throw error(argCtxs.get(i), "argument " + i + " of @" + calleeName + " has type "
                        + arg.getType() + ", expected " + paramType);
            }
            args.add(arg);
        }
        // 丢弃返回值的调用也需要一个名字才能打印
        if (name.isEmpty() && !retType.isVoid()) {
            name = "call";
        }
        return builder.buildCall(func, args, name);
    }

    @Override
    public Value visitIrBrInst(IRParser.IrBrInstContext ctx) {
        builder.buildBr(lookupBlock(ctx.LOCAL_ID().getSymbol()));
        return null;
    }

    @Override
    public Value visitIrCondBrInst(IRParser.IrCondBrInstContext ctx) {
        Value cond = parseTypedValue(ctx.irTypedValue());
        if (!cond.getType().isI1()) {
            throw error(ctx, "branch condition must be i1");
        }
        builder.buildCondBr(cond,
                lookupBlock(ctx.LOCAL_ID(0).getSymbol()),
                lookupBlock(ctx.LOCAL_ID(1).getSymbol()));
        return null;
    }

    @Override
    public Value visitIrSwitchInst(IRParser.IrSwitchInstContext ctx) {
        Value cond = parseTypedValue(ctx.irTypedValue());
        if (!cond.getType().isInteger()) {
            throw error(ctx, "switch condition must be an integer");
        }
        SwitchInst sw = builder.buildSwitch(cond, lookupBlock(ctx.LOCAL_ID().getSymbol()));
        for (IRParser.IrCaseContext c : ctx.irCase()) {
            Value v = parseTypedValue(c.irTypedValue());
            if (!(v instanceof ConstantInt caseValue) || !v.getType().equals(cond.getType())) {
                throw error(c, "switch case must be a constant of type " + cond.getType());
            }
            builder.addCase(sw, caseValue.getValue(), lookupBlock(c.LOCAL_ID().getSymbol()));
        }
        return null;
    }

    @Override
    public Value visitIrRetVoidInst(IRParser.IrRetVoidInstContext ctx) {
        if (!currentFunction.getFunctionType().getReturnType().isVoid()) {
            throw error(ctx, "ret void in non-void function @" + currentFunction.getName());
        }
        builder.buildRetVoid();
        return null;
    }

    @Override
    public Value visitIrRetInst(IRParser.IrRetInstContext ctx) {
        Value v = parseTypedValue(ctx.irTypedValue());
        checkType(ctx, v, currentFunction.getFunctionType().getReturnType());
        builder.buildRet(v);
        return null;
    }
}
