package vplan.analysis;

import exception.CompileException;
import util.LoggingManager;
import util.logging.Logger;
import vplan.VPBasicBlock;
import vplan.VPBlockUtils;
import vplan.VPlan;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Worklist solver. The state before a block is rebuilt from its predecessors
 * on every visit; successors are revisited whenever the state after a block
 * changes.
 */
public class VPDataFlowSolver<S> {
    private static final Logger log = LoggingManager.getLogger(VPDataFlowSolver.class);

    // visits allowed per block before the analysis is considered non-monotone
    private static final int MAX_VISITS_PER_BLOCK = 64;

    private final VPDataFlowAnalysis<S> analysis;
    private final Map<VPBasicBlock, S> before;
    private final Map<VPBasicBlock, S> after;
    private int numVisits;

    public VPDataFlowSolver(VPDataFlowAnalysis<S> analysis) {
        this.analysis = analysis;
        this.before = new LinkedHashMap<>();
        this.after = new LinkedHashMap<>();
    }

    public void initializeAndRun(VPlan plan) {
        before.clear();
        after.clear();
        numVisits = 0;

        List<VPBasicBlock> blocks = plan.getBasicBlocks();
        for (VPBasicBlock block : blocks) {
            before.put(block, analysis.initialState());
            after.put(block, analysis.initialState());
        }

        Deque<VPBasicBlock> worklist = new ArrayDeque<>(blocks);
        Set<VPBasicBlock> queued = new HashSet<>(blocks);
        int limit = Math.max(1, blocks.size()) * MAX_VISITS_PER_BLOCK;

        while (!worklist.isEmpty()) {
            VPBasicBlock block = worklist.poll();
            queued.remove(block);
            if (++numVisits > limit) {
                throw new CompileException("data-flow analysis on " + plan.getName()
                        + " did not reach a fixpoint after " + limit + " visits");
            }

            S in = analysis.initialState();
            if (block == plan.getEntry()) {
                analysis.entryState(in);
            }
            for (VPBasicBlock pred : VPBlockUtils.getFlatPredecessors(block)) {
                S predState = after.get(pred);
                if (predState != null) {
                    analysis.join(in, predState);
                }
            }
            before.put(block, in);

            if (analysis.transfer(block, in, after.get(block)).isChanged()) {
                for (VPBasicBlock succ : VPBlockUtils.getFlatSuccessors(block)) {
                    if (after.containsKey(succ) && queued.add(succ)) {
                        worklist.add(succ);
                    }
                }
            }
        }
        log.debug("data-flow on {} converged after {} visits", plan.getName(), numVisits);
    }

    public S getStateBefore(VPBasicBlock block) {
        return before.get(block);
    }

    public S getStateAfter(VPBasicBlock block) {
        return after.get(block);
    }

    public int getNumVisits() {
        return numVisits;
    }
}
