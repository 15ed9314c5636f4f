package vplan.builder;

import exception.InvariantViolationException;
import ir.value.BasicBlock;
import ir.value.Value;
import ir.value.instructions.Phi;
import pass.IRPass.analysis.Loop;
import vplan.VPWidenPhiRecipe;

import java.util.ArrayList;
import java.util.List;

/**
 * Header phis are created empty because their latch operand is not
 * translated yet. Once every block is done they get two operands: the value
 * from the loop predecessor, then the value from the latch.
 */
public class HeaderPhiFixer {

    /** a header phi recipe waiting for its operands */
    public record PendingMerge(VPWidenPhiRecipe recipe, Phi phi) {}

    private final LoopNestRoles roles;
    private final VPOperandResolver resolver;
    private final List<PendingMerge> pending;

    public HeaderPhiFixer(LoopNestRoles roles, VPOperandResolver resolver) {
        this.roles = roles;
        this.resolver = resolver;
        this.pending = new ArrayList<>();
    }

    public void defer(VPWidenPhiRecipe recipe, Phi phi) {
        pending.add(new PendingMerge(recipe, phi));
    }

    public int getNumPending() {
        return pending.size();
    }

    public void fixHeaderPhis() {
        for (PendingMerge merge : pending) {
            fix(merge);
        }
        pending.clear();
    }

    private void fix(PendingMerge merge) {
        Phi phi = merge.phi();
        BasicBlock bb = phi.getParent();
        if (merge.recipe().getNumOperands() != 0) {
            throw InvariantViolationException.shape("header phi recipe already has operands", bb, phi);
        }
        Loop loop = roles.loopFor(bb);
        if (!LoopNestRoles.isHeader(bb, loop)) {
            throw InvariantViolationException.shape("deferred phi is not in a loop header", bb, phi);
        }
        if (phi.getNumIncoming() != 2) {
            throw InvariantViolationException.shape("header phi must have exactly 2 incoming values", bb, phi);
        }
        merge.recipe().addIncoming(resolver.resolve(incomingFrom(phi, loop.getLoopPredecessor())));
        merge.recipe().addIncoming(resolver.resolve(incomingFrom(phi, loop.getLoopLatch())));
    }

    private static Value incomingFrom(Phi phi, BasicBlock block) {
        Value value = block == null ? null : phi.getIncomingValueForBlock(block);
        if (value == null) {
            throw InvariantViolationException.shape("header phi has no incoming value from "
                    + (block == null ? "the loop predecessor or latch" : "%" + block.getName()), phi.getParent(), phi);
        }
        return value;
    }
}
