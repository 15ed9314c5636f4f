package vplan;

import ir.value.instructions.Phi;

import java.util.List;

/**
 * Merge recipe. Operand i is the value flowing in along the i-th
 * hierarchical predecessor of the parent block.
 */
public class VPWidenPhiRecipe extends VPRecipeBase {

    public VPWidenPhiRecipe(Phi underlying) {
        super(underlying, List.of());
    }

    public Phi getUnderlyingPhi() {
        return (Phi) getUnderlyingInstr();
    }

    public void addIncoming(VPValue value) {
        addOperand(value);
    }

    @Override
    public String print() {
        return "WIDEN-PHI " + getReference() + " = phi " + operandsToString();
    }
}
