package ir.type;

// type of a basic block when used as a branch or phi operand
public final class LabelType extends Type {
    private static final LabelType INSTANCE = new LabelType();

    private LabelType() {
        super(TypeKind.LABEL);
    }

    public static LabelType getLabel() {
        return INSTANCE;
    }

    @Override
    public String toLLVM() {
        return "label";
    }
}
