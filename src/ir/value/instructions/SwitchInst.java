package ir.value.instructions;

import java.util.ArrayList;
import java.util.List;

import ir.InstructionVisitor;
import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantInt;

/**
 * Multi-way branch. Operands: condition, default destination, then one
 * (case value, case destination) pair per case.
 */
public class SwitchInst extends Instruction {

    public SwitchInst(Value condition, BasicBlock defaultDest) {
        super(VoidType.getVoid(), "");
        addOperand(condition);
        addOperand(defaultDest);
    }

    public void addCase(ConstantInt value, BasicBlock dest) {
        if (!value.getType().equals(getCondition().getType())) {
            throw new IllegalArgumentException("case value type " + value.getType()
                    + " does not match condition type " + getCondition().getType());
        }
        addOperand(value);
        addOperand(dest);
    }

    public Value getCondition() {
        return getOperand(0);
    }

    public BasicBlock getDefaultDest() {
        return (BasicBlock) getOperand(1);
    }

    public int getNumCases() {
        return (getNumOperands() - 2) / 2;
    }

    public ConstantInt getCaseValue(int index) {
        return (ConstantInt) getOperand(2 + index * 2);
    }

    public BasicBlock getCaseSuccessor(int index) {
        return (BasicBlock) getOperand(3 + index * 2);
    }

    /** default destination first, then every case destination in case order */
    public List<BasicBlock> getSuccessors() {
        List<BasicBlock> succs = new ArrayList<>();
        succs.add(getDefaultDest());
        for (int i = 0; i < getNumCases(); i++) {
            succs.add(getCaseSuccessor(i));
        }
        return succs;
    }

    @Override
    public Opcode opCode() {
        return Opcode.SWITCH;
    }

    @Override
    public String toLLVM() {
        Value cond = getCondition();
        StringBuilder sb = new StringBuilder();
        sb.append("switch ").append(cond.getType().toLLVM()).append(" ").append(cond.getReference())
          .append(", label %").append(getDefaultDest().getName()).append(" [");
        for (int i = 0; i < getNumCases(); i++) {
            sb.append(" ").append(getCaseValue(i).toLLVM())
              .append(", label %").append(getCaseSuccessor(i).getName());
        }
        return sb.append(" ]").toString();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
