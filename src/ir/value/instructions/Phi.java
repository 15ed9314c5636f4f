package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

// operands alternate: value0, block0, value1, block1, ...
public class Phi extends Instruction {
    public Phi(Type type, String name) {
        super(type, name);
    }

    public void addIncoming(Value value, BasicBlock block) {
        if (!value.getType().equals(getType())) {
            throw new IllegalArgumentException("PHI incoming value must match PHI type: "
                    + value.getType() + " vs " + getType());
        }
        addOperand(value);
        addOperand(block);
    }

    public int getNumIncoming() {
        return getNumOperands() / 2;
    }

    public Value getIncomingValue(int index) {
        return getOperand(index * 2);
    }

    public BasicBlock getIncomingBlock(int index) {
        return (BasicBlock) getOperand(index * 2 + 1);
    }

    /**
     * @return the value flowing in from {@code block}, or null if the block
     *         is not an incoming block of this phi
     */
    public Value getIncomingValueForBlock(BasicBlock block) {
        for (int i = 0; i < getNumIncoming(); i++) {
            if (getIncomingBlock(i) == block) {
                return getIncomingValue(i);
            }
        }
        return null;
    }

    @Override
    public String toLLVM() {
        StringBuilder sb = new StringBuilder();
        sb.append("%").append(getName()).append(" = phi ").append(getType().toLLVM()).append(" ");
        for (int i = 0; i < getNumIncoming(); i++) {
            if (i > 0) sb.append(", ");
            sb.append("[ ").append(getIncomingValue(i).getReference())
              .append(", %").append(getIncomingBlock(i).getName()).append(" ]");
        }
        return sb.toString();
    }

    @Override
    public Opcode opCode() {
        return Opcode.PHI;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
