package util.llvm;

import frontend.grammar.IRLexer;
import frontend.grammar.IRParser;
import frontend.irgen.IRTextGenerator;
import ir.IRModule;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import util.LoggingManager;
import util.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 文本 IR 加载器
 *
 * 把 .ll 文件解析成 {@link IRModule}。每次加载都会重置全局模块，得到一个全新的模块。
 */
public class IRLoader {
    private static final Logger log = LoggingManager.getLogger(IRLoader.class);

    /**
     * 从文件路径加载 .ll 文件
     *
     * @param filePath .ll 文件路径
     * @return 解析后的模块
     * @throws IOException 文件读取错误
     * @throws IRParseException 语法或语义错误
     */
    public static IRModule loadFromFile(String filePath) throws IOException, IRParseException {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + filePath);
        }
        log.debug("loading {}", path);
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return parse(CharStreams.fromString(content, filePath), extractModuleName(path.getFileName().toString()));
    }

    /**
     * 从 classpath 资源加载 .ll 文件
     *
     * @param resourcePath 资源路径，例如 "ir/single_remote_load.ll"
     */
    public static IRModule loadFromResource(String resourcePath) throws IOException, IRParseException {
        try (InputStream inputStream = IRLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            CharStream chars = CharStreams.fromStream(inputStream, StandardCharsets.UTF_8);
            String fileName = resourcePath.substring(resourcePath.lastIndexOf('/') + 1);
            return parse(chars, extractModuleName(fileName));
        }
    }

    /**
     * 从字符串内容解析文本 IR
     */
    public static IRModule loadFromString(String content, String moduleName) throws IRParseException {
        return parse(CharStreams.fromString(content, moduleName), moduleName);
    }

    private static IRModule parse(CharStream chars, String moduleName) throws IRParseException {
        CollectingErrorListener errors = new CollectingErrorListener();

        IRLexer lexer = new IRLexer(chars);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        IRParser parser = new IRParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        IRParser.IrModuleContext tree = parser.irModule();
        if (!errors.getErrors().isEmpty()) {
            throw new IRParseException("Syntax errors in " + moduleName, errors.getErrors());
        }

        IRModule.reset();
        return new IRTextGenerator(moduleName).generate(tree);
    }

    private static String extractModuleName(String fileName) {
        if (fileName.endsWith(".ll")) {
            return fileName.substring(0, fileName.length() - 3);
        }
        return fileName;
    }

    /* 收集词法和语法错误，不打印到控制台 */
    private static class CollectingErrorListener extends BaseErrorListener {
        private final List<IRParseException.ParseError> errors = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            errors.add(new IRParseException.ParseError(line, charPositionInLine, msg));
        }

        List<IRParseException.ParseError> getErrors() {
            return errors;
        }
    }
}
