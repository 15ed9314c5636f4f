package util.llvm;

import java.util.ArrayList;
import java.util.List;

/**
 * Raised when textual LLVM IR cannot be turned into an {@link ir.IRModule}.
 * Carries every collected {@link ParseError} with its line context.
 */
public class LLVMParseException extends Exception {

    private final List<ParseError> errors;

    public static class ParseError {
        private final int lineNumber;
        private final String line;
        private final String errorMessage;

        public ParseError(int lineNumber, String line, String errorMessage) {
            this.lineNumber = lineNumber;
            this.line = line;
            this.errorMessage = errorMessage;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getLine() {
            return line;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("Line ").append(lineNumber).append(": ").append(errorMessage);
            if (line != null && !line.isEmpty()) {
                sb.append("\n  -> ").append(line.trim());
            }
            return sb.toString();
        }
    }

    public LLVMParseException(String message) {
        super(message);
        this.errors = new ArrayList<>();
    }

    public LLVMParseException(String message, List<ParseError> errors) {
        super(formatMultipleErrors(message, errors));
        this.errors = new ArrayList<>(errors);
    }

    public LLVMParseException(String message, Throwable cause) {
        super(message, cause);
        this.errors = new ArrayList<>();
    }

    public List<ParseError> getErrors() {
        return new ArrayList<>(errors);
    }

    /** line of the first error, or -1 */
    public int getLineNumber() {
        return errors.isEmpty() ? -1 : errors.get(0).getLineNumber();
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
