package util.llvm;

import java.util.ArrayList;
import java.util.List;

/**
 * 文本 IR 解析异常
 *
 * 语法错误由 ANTLR 的错误监听器收集，语义错误（未定义的值、类型不匹配）在生成 IR 时抛出，
 * 都带上出错的行列号。
 */
public class IRParseException extends Exception {

    private final List<ParseError> errors;

    /**
     * 单个错误的位置和信息
     */
    public static class ParseError {
        private final int line;
        private final int column;
        private final String errorMessage;

        public ParseError(int line, int column, String errorMessage) {
            this.line = line;
            this.column = column;
            this.errorMessage = errorMessage;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        @Override
        public String toString() {
            return "line " + line + ":" + column + " " + errorMessage;
        }
    }

    public IRParseException(String message) {
        super(message);
        this.errors = new ArrayList<>();
    }

    public IRParseException(String message, int line, int column) {
        super(message + " (line " + line + ":" + column + ")");
        this.errors = new ArrayList<>(List.of(new ParseError(line, column, message)));
    }

    public IRParseException(String message, List<ParseError> errors) {
        super(formatMultipleErrors(message, errors));
        this.errors = new ArrayList<>(errors);
    }

    public IRParseException(String message, Throwable cause) {
        super(message, cause);
        this.errors = new ArrayList<>();
    }

    public List<ParseError> getErrors() {
        return new ArrayList<>(errors);
    }

    private static String formatMultipleErrors(String message, List<ParseError> errors) {
        StringBuilder sb = new StringBuilder(message);
        sb.append("\nFound ").append(errors.size()).append(" error(s):");

        for (int i = 0; i < errors.size() && i < 5; i++) {
            sb.append("\n").append(i + 1).append(". ").append(errors.get(i));
        }

        if (errors.size() > 5) {
            sb.append("\n... and ").append(errors.size() - 5).append(" more error(s)");
        }

        return sb.toString();
    }
}
