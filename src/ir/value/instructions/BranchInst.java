package ir.value.instructions;

import java.util.List;

import ir.InstructionVisitor;
import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

// br label %dest | br i1 %cond, label %then, label %else
public class BranchInst extends Instruction {

    public BranchInst(BasicBlock dest) {
        super(VoidType.getVoid(), "");
        addOperand(dest);
    }

    public BranchInst(Value condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        super(VoidType.getVoid(), "");
        addOperand(condition);
        addOperand(thenBlock);
        addOperand(elseBlock);
    }

    @Override
    public Opcode opCode() {
        return Opcode.BR;
    }

    public boolean isConditional() {
        return getNumOperands() > 1;
    }

    public Value getCondition() {
        return isConditional() ? getOperand(0) : null;
    }

    public BasicBlock getThenBlock() {
        return (BasicBlock) (isConditional() ? getOperand(1) : getOperand(0));
    }

    public BasicBlock getElseBlock() {
        return isConditional() ? (BasicBlock) getOperand(2) : null;
    }

    /** targets in operand order */
    public List<BasicBlock> getSuccessors() {
        return isConditional() ? List.of(getThenBlock(), getElseBlock()) : List.of(getThenBlock());
    }

    @Override
    public String toLLVM() {
        if (isConditional()) {
            return "br i1 " + getCondition().getReference()
                + ", label %" + getThenBlock().getName()
                + ", label %" + getElseBlock().getName();
        }
        return "br label %" + getThenBlock().getName();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
