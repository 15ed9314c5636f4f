package ir.type;

public final class VoidType extends Type {
    private static final VoidType INSTANCE = new VoidType();

    private VoidType() {
        super(TypeKind.VOID);
    }

    public static VoidType getVoid() {
        return INSTANCE;
    }

    @Override
    public String toLLVM() {
        return "void";
    }
}
