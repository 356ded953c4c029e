import driver.*;
import exception.CompileException;

public class Compiler {
    /*
     * move the duty of compiler to driver,
     * for we can't use package here
     */
    public static void main(String[] args) {
        CompilerDriver driver = CompilerDriver.getInstance();
        try {
            driver.parseArgs(args);
            driver.run();
        } catch (CompileException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        }
    }
}
