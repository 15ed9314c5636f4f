package exception;

public class CompileException extends RuntimeException {
    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CompileException noArgs() {
        return new CompileException("No arguments given");
    }

    public static CompileException wrongArgs(String msg) {
        return new CompileException("Wrong argument: " + msg);
    }

    public static CompileException unSupported(String msg) {
        return new CompileException("UnSupported: " + msg);
    }

    public static CompileException illegalOperand(String msg) {
        return new CompileException("Illegal operand: " + msg);
    }

    public static CompileException illegalInstruction(String msg) {
        return new CompileException("Illegal instruction: " + msg);
    }

    public static CompileException unknownPass(String msg) {
        return new CompileException("Unknown pass: " + msg);
    }
}
