package vplan;

import ir.value.Opcode;
import ir.value.instructions.BranchInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.Phi;

import java.util.List;

/**
 * Appends recipes at the end of the current VPBasicBlock.
 */
public class VPBuilder {
    private VPBasicBlock insertBlock;

    public void positionAtEnd(VPBasicBlock block) {
        this.insertBlock = block;
    }

    public VPBasicBlock getInsertBlock() {
        return insertBlock;
    }

    public <T extends VPRecipeBase> T insert(T recipe) {
        if (insertBlock == null) {
            throw new IllegalStateException("VPBuilder is not positioned at a block");
        }
        insertBlock.appendRecipe(recipe);
        return recipe;
    }

    public VPInstruction createNaryOp(Opcode opcode, List<VPValue> operands, Instruction underlying) {
        return insert(new VPInstruction(opcode, operands, underlying));
    }

    public VPBranchOnCondRecipe createBranchOnCond(VPValue condition, BranchInst underlying) {
        return insert(new VPBranchOnCondRecipe(condition, underlying));
    }

    public VPWidenPhiRecipe createWidenPhi(Phi underlying) {
        return insert(new VPWidenPhiRecipe(underlying));
    }
}
