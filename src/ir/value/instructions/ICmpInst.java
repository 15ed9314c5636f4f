package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.IntegerType;
import ir.value.Opcode;
import ir.value.Value;

public class ICmpInst extends Instruction {
    private final Opcode predicate;

    public ICmpInst(Opcode predicate, String name, Value lhs, Value rhs) {
        super(IntegerType.getI1(), name);
        if (!predicate.isCompare()) {
            throw new IllegalArgumentException("not an icmp predicate: " + predicate);
        }
        this.predicate = predicate;
        addOperand(lhs);
        addOperand(rhs);
    }

    @Override
    public Opcode opCode() {
        return predicate;
    }

    @Override
    public String toLLVM() {
        Value lhs = getOperand(0);
        return "%" + getName() + " = icmp " + predicate.getMnemonic()
                + " " + lhs.getType().toLLVM() + " "
                + lhs.getReference() + ", " + getOperand(1).getReference();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
