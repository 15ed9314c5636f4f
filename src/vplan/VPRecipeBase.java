package vplan;

import ir.value.instructions.Instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A recipe inside a {@link VPBasicBlock}. Every recipe is built from one
 * source instruction, and is itself the VP value of that instruction.
 */
public abstract class VPRecipeBase extends VPValue {
    private final ArrayList<VPValue> operands;
    private VPBasicBlock parent;

    protected VPRecipeBase(Instruction underlying, List<VPValue> operands) {
        super(underlying);
        this.operands = new ArrayList<>();
        for (VPValue op : operands) {
            addOperand(op);
        }
    }

    public Instruction getUnderlyingInstr() {
        return (Instruction) getUnderlyingValue();
    }

    @Override
    public VPRecipeBase getDefiningRecipe() {
        return this;
    }

    /* getter */
    public int getNumOperands() { return operands.size(); }
    public VPValue getOperand(int index) { return operands.get(index); }

    public List<VPValue> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    public void addOperand(VPValue operand) {
        if (operand == null) {
            throw new IllegalArgumentException("recipe operand cannot be null");
        }
        operands.add(operand);
        operand.addUser(this);
    }

    public VPBasicBlock getParent() {
        return parent;
    }

    void setParent(VPBasicBlock parent) {
        this.parent = parent;
    }

    /** true when the source instruction produces a value */
    public boolean isValueProducing() {
        return !getUnderlyingInstr().getType().isVoid();
    }

    @Override
    public String getReference() {
        return "vp<%" + getUnderlyingInstr().getName() + ">";
    }

    protected String operandsToString() {
        return operands.stream().map(VPValue::getReference).collect(Collectors.joining(", "));
    }

    /** one line of a plan dump */
    public abstract String print();

    @Override
    public String toString() {
        return print();
    }
}
