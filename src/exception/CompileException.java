package exception;

public class CompileException extends RuntimeException {
    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CompileException noArgs() {
        return new CompileException("need args to process");
    }

    public static CompileException wrongArgs(String msg) {
        return new CompileException("Unexpected args: " + msg);
    }

    public static CompileException unSupported(String msg) {
        return new CompileException("UnSupported: " + msg);
    }

    /* 同一个边界被记录了两个不同的 frontier */
    public static CompileException ambiguousMerge(String msg) {
        return new CompileException("Ambiguous merge: " + msg);
    }

    public static CompileException badVisit(String msg) {
        return new CompileException("Bad visit: " + msg);
    }

    public static CompileException doubleOwner(String msg) {
        return new CompileException("Double owner: " + msg);
    }

    public static CompileException escapedUse(String msg) {
        return new CompileException("Escaped use: " + msg);
    }

    public static CompileException escapedBlock(String msg) {
        return new CompileException("Escaped block: " + msg);
    }

    public static CompileException missingPrimitive(String msg) {
        return new CompileException("Missing runtime primitive: " + msg);
    }
}
