package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.PointerType;
import ir.value.Opcode;
import ir.value.Value;

public class LoadInst extends Instruction {

    public LoadInst(Value pointer, String name) {
        super(((PointerType) pointer.getType()).getPointeeType(), name);
        addOperand(pointer);
    }

    public Value getPointer() {
        return getOperand(0);
    }

    @Override
    public Opcode opCode() {
        return Opcode.LOAD;
    }

    @Override
    public String toLLVM() {
        Value pointer = getPointer();
        return "%" + getName() + " = load " + getType().toLLVM() + ", "
                + pointer.getType().toLLVM() + " " + pointer.getReference();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
