package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.User;

public abstract class Instruction extends User {
    private BasicBlock parent;

    public Instruction(Type type, String name) {
        super(type, name);
    }

    public abstract Opcode opCode();

    public BasicBlock getParent() {
        return parent;
    }

    public void setParent(BasicBlock parent) {
        this.parent = parent;
    }

    public boolean isTerminator() {
        return opCode().isTerminator();
    }

    public boolean isBinary() {
        return opCode().isBinary();
    }

    /** debug-only instructions carry no semantics and are skipped by transforms */
    public boolean isDebugInfo() {
        return false;
    }

    public abstract <T> T accept(InstructionVisitor<T> visitor);
}
