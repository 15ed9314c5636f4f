package vplan.builder;

import exception.InvariantViolationException;
import ir.InstructionVisitor;
import ir.value.BasicBlock;
import ir.value.Value;
import ir.value.instructions.*;
import pass.IRPass.analysis.Loop;
import vplan.VPBasicBlock;
import vplan.VPBlockBase;
import vplan.VPBuilder;
import vplan.VPRecipeBase;
import vplan.VPValue;
import vplan.VPWidenPhiRecipe;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays the instructions of one IR block as recipes of its VPBasicBlock.
 * Visiting returns the recipe to record for the instruction, or null when
 * nothing was emitted.
 */
public class VPInstructionTranslator implements InstructionVisitor<VPRecipeBase> {
    private final LoopNestRoles roles;
    private final VPOperandResolver resolver;
    private final VPBlockRegistry registry;
    private final HeaderPhiFixer phiFixer;
    private final VPBuilder builder;

    private VPBasicBlock currentVPBB;
    private BasicBlock currentBB;

    public VPInstructionTranslator(LoopNestRoles roles, VPOperandResolver resolver, VPBlockRegistry registry,
                                   HeaderPhiFixer phiFixer) {
        this.roles = roles;
        this.resolver = resolver;
        this.registry = registry;
        this.phiFixer = phiFixer;
        this.builder = new VPBuilder();
    }

    public void translate(VPBasicBlock vpbb, BasicBlock bb) {
        currentVPBB = vpbb;
        currentBB = bb;
        builder.positionAtEnd(vpbb);
        for (Instruction inst : bb.getInstructions()) {
            if (inst.isDebugInfo()) {
                continue;
            }
            if (resolver.isMapped(inst)) {
                throw InvariantViolationException.traversalOrder("instruction visited twice", bb, inst);
            }
            VPRecipeBase recipe = inst.accept(this);
            if (recipe != null && !(inst instanceof BranchInst) && !(inst instanceof SwitchInst)) {
                resolver.record(inst, recipe);
            }
        }
    }

    private List<VPValue> resolveOperands(Instruction inst) {
        List<VPValue> operands = new ArrayList<>();
        for (Value op : inst.getOperands()) {
            operands.add(resolver.resolve(op));
        }
        return operands;
    }

    private VPRecipeBase emitGeneric(Instruction inst) {
        return builder.createNaryOp(inst.opCode(), resolveOperands(inst), inst);
    }

    @Override
    public VPRecipeBase visit(BranchInst inst) {
        // control flow leaving the loop nest or closing the outermost loop is not modelled by a recipe
        if (roles.isTheLoopLatch(currentBB)) {
            return null;
        }
        for (BasicBlock succ : inst.getSuccessors()) {
            if (!roles.inTheLoop(succ)) {
                return null;
            }
        }
        if (!inst.isConditional()) {
            return null;
        }
        return builder.createBranchOnCond(resolver.resolve(inst.getCondition()), inst);
    }

    @Override
    public VPRecipeBase visit(SwitchInst inst) {
        List<VPValue> operands = new ArrayList<>();
        operands.add(resolver.resolve(inst.getCondition()));
        for (int i = 0; i < inst.getNumCases(); i++) {
            operands.add(resolver.resolve(inst.getCaseValue(i)));
        }
        return builder.createNaryOp(inst.opCode(), operands, inst);
    }

    @Override
    public VPRecipeBase visit(Phi inst) {
        VPWidenPhiRecipe recipe = builder.createWidenPhi(inst);
        Loop loop = roles.loopFor(currentBB);
        if (LoopNestRoles.isHeader(currentBB, loop)) {
            phiFixer.defer(recipe, inst);
            return recipe;
        }

        // operands follow the VP predecessor order, not the order of the IR incoming list
        Map<VPBasicBlock, VPValue> incomingByVPBB = new HashMap<>();
        for (int i = 0; i < inst.getNumIncoming(); i++) {
            VPBasicBlock incoming = registry.lookup(inst.getIncomingBlock(i));
            if (incoming != null) {
                incomingByVPBB.put(incoming, resolver.resolve(inst.getIncomingValue(i)));
            }
        }
        for (VPBlockBase pred : currentVPBB.getPredecessors()) {
            VPValue value = incomingByVPBB.get(pred.getExitingBasicBlock());
            if (value == null) {
                throw InvariantViolationException.traversalOrder(
                        "no incoming value for predecessor " + pred.getName(), currentBB, inst);
            }
            recipe.addIncoming(value);
        }
        return recipe;
    }

    @Override
    public VPRecipeBase visit(BinOperator inst) {
        return emitGeneric(inst);
    }

    @Override
    public VPRecipeBase visit(ICmpInst inst) {
        return emitGeneric(inst);
    }

    @Override
    public VPRecipeBase visit(CallInst inst) {
        return emitGeneric(inst);
    }

    @Override
    public VPRecipeBase visit(LoadInst inst) {
        return emitGeneric(inst);
    }

    @Override
    public VPRecipeBase visit(StoreInst inst) {
        return emitGeneric(inst);
    }

    @Override
    public VPRecipeBase visit(ReturnInst inst) {
        return emitGeneric(inst);
    }
}
