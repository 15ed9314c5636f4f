package ir.value;

public enum Opcode {
    // binary
    ADD,
    SUB,
    MUL,
    SDIV,
    UDIV,
    SREM,
    UREM,
    SHL,
    LSHR,
    ASHR,
    AND,
    OR,
    XOR,

    // integer compare
    ICMP_EQ,
    ICMP_NE,
    ICMP_UGT,
    ICMP_UGE,
    ICMP_ULT,
    ICMP_ULE,
    ICMP_SGT,
    ICMP_SGE,
    ICMP_SLT,
    ICMP_SLE,

    // memory
    LOAD,
    STORE,

    // terminators
    RET,
    BR,
    SWITCH,

    // others
    PHI,
    CALL,
    ;

    public boolean isTerminator() {
        return this == RET || this == BR || this == SWITCH;
    }

    public boolean isBinary() {
        return ordinal() >= ADD.ordinal() && ordinal() <= XOR.ordinal();
    }

    public boolean isCompare() {
        return ordinal() >= ICMP_EQ.ordinal() && ordinal() <= ICMP_SLE.ordinal();
    }

    /** textual mnemonic as written in LLVM assembly; compares drop the icmp_ prefix */
    public String getMnemonic() {
        String lower = name().toLowerCase();
        return isCompare() ? lower.substring("icmp_".length()) : lower;
    }
}
