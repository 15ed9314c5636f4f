package ir.type;

public abstract class Type {
    private final TypeKind kind;

    protected Type(TypeKind kind) {
        this.kind = kind;
    }

    public TypeKind getKind() {
        return this.kind;
    }

    public abstract String toLLVM();

    /* classification helpers */
    public boolean is(TypeKind k) { return kind == k; }
    public boolean isI1() { return is(TypeKind.I1); }
    public boolean isI32() { return is(TypeKind.I32); }
    public boolean isFunc() { return is(TypeKind.FUNC); }
    public boolean isVoid() { return is(TypeKind.VOID); }
    public boolean isPointer() { return is(TypeKind.POINTER); }
    public boolean isLabel() { return is(TypeKind.LABEL); }
    public boolean isInteger() {
        return switch (kind) {
            case I1, I8, I16, I32, I64 -> true;
            default -> false;
        };
    }

    @Override public String toString() { return toLLVM(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Type other = (Type) o;
        return kind == other.kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }
}
