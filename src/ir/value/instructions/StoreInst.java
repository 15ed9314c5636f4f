package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.VoidType;
import ir.value.Opcode;
import ir.value.Value;

// operands: pointer, value
public class StoreInst extends Instruction {

    public StoreInst(Value pointer, Value value) {
        super(VoidType.getVoid(), "");
        addOperand(pointer);
        addOperand(value);
    }

    public Value getPointer() {
        return getOperand(0);
    }

    public Value getValue() {
        return getOperand(1);
    }

    @Override
    public Opcode opCode() {
        return Opcode.STORE;
    }

    @Override
    public String toLLVM() {
        Value pointer = getPointer();
        Value value = getValue();
        return "store " + value.getType().toLLVM() + " " + value.getReference()
                + ", " + pointer.getType().toLLVM() + " " + pointer.getReference();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
