package vplan;

import ir.value.instructions.BranchInst;

import java.util.List;

/** Conditional branch; the targets are the successors of the parent block. */
public class VPBranchOnCondRecipe extends VPRecipeBase {

    public VPBranchOnCondRecipe(VPValue condition, BranchInst underlying) {
        super(underlying, List.of(condition));
    }

    public VPValue getCondition() {
        return getOperand(0);
    }

    @Override
    public String print() {
        return "BRANCH-ON-COND " + getCondition().getReference();
    }
}
