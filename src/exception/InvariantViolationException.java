package exception;

import ir.value.BasicBlock;
import ir.value.instructions.Instruction;

/**
 * Thrown when the HCFG construction observes input or internal state outside
 * its contract. A build that throws this leaves no usable plan behind.
 */
public class InvariantViolationException extends CompileException {
    public enum Kind {
        /** a value or region was referenced before it was produced */
        TRAVERSAL_ORDER,
        /** the CFG or a merge does not have the expected shape */
        SHAPE,
        /** an unresolved operand is not defined outside the loop nest */
        EXTERNAL_DEF
    }

    private final Kind kind;

    public InvariantViolationException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static InvariantViolationException traversalOrder(String msg, BasicBlock bb, Instruction inst) {
        return new InvariantViolationException(Kind.TRAVERSAL_ORDER, withContext(msg, bb, inst));
    }

    public static InvariantViolationException shape(String msg, BasicBlock bb, Instruction inst) {
        return new InvariantViolationException(Kind.SHAPE, withContext(msg, bb, inst));
    }

    public static InvariantViolationException externalDef(String msg, BasicBlock bb, Instruction inst) {
        return new InvariantViolationException(Kind.EXTERNAL_DEF, withContext(msg, bb, inst));
    }

    private static String withContext(String msg, BasicBlock bb, Instruction inst) {
        StringBuilder sb = new StringBuilder(msg);
        if (bb != null) {
            sb.append(" (block %").append(bb.getName()).append(")");
        }
        if (inst != null) {
            sb.append("\n  -> ").append(inst.toLLVM());
        }
        return sb.toString();
    }
}
