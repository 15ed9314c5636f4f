package ir.type;

public enum TypeKind {
    // integer
    I1,
    I8,
    I16,
    I32,
    I64,
    // others
    VOID,
    POINTER,
    FUNC,
    LABEL
}
