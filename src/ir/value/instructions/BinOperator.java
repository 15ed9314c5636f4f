package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

public class BinOperator extends Instruction {
    private final Opcode opcode;

    public BinOperator(String name, Opcode opcode, Type type, Value lhs, Value rhs) {
        super(type, name);
        if (!opcode.isBinary()) {
            throw new IllegalArgumentException("not a binary opcode: " + opcode);
        }
        this.opcode = opcode;
        addOperand(lhs);
        addOperand(rhs);
    }

    @Override
    public Opcode opCode() {
        return opcode;
    }

    public boolean isCommutative() {
        return switch (opcode) {
            case ADD, MUL, AND, OR, XOR -> true;
            default -> false;
        };
    }

    @Override
    public String toLLVM() {
        return "%" + getName() + " = " + opcode.getMnemonic() + " "
                + getType().toLLVM() + " "
                + getOperand(0).getReference() + ", " + getOperand(1).getReference();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
