package pass.IRPass.analysis;

import ir.value.BasicBlock;
import ir.value.Function;

import java.util.*;

/**
 * Iterative dominator sets over the blocks reachable from the entry.
 */
public class DominanceAnalysisPass {
    private Function function;
    private final Map<BasicBlock, Set<BasicBlock>> dominators;
    private final Map<BasicBlock, BasicBlock> immediateDominators;

    public DominanceAnalysisPass(Function func) {
        this.function = func;
        this.dominators = new LinkedHashMap<>();
        this.immediateDominators = new HashMap<>();
    }

    // the same instance can be reused for several functions
    public void runOnFunction(Function func) {
        this.function = func;
        this.dominators.clear();
        this.immediateDominators.clear();
        run();
    }

    public void run() {
        if (function == null)
            return;
        computeDominators();
        computeImmediateDominators();
    }

    private List<BasicBlock> reachableBlocks(BasicBlock entry) {
        Set<BasicBlock> reachable = new HashSet<>();
        ArrayDeque<BasicBlock> dq = new ArrayDeque<>();
        reachable.add(entry);
        dq.add(entry);
        while (!dq.isEmpty()) {
            BasicBlock cur = dq.poll();
            for (BasicBlock succ : cur.getSuccessors()) {
                if (reachable.add(succ))
                    dq.add(succ);
            }
        }
        // layout order keeps the iteration deterministic
        List<BasicBlock> blocks = new ArrayList<>();
        for (BasicBlock bb : function.getBlocks()) {
            if (reachable.contains(bb))
                blocks.add(bb);
        }
        return blocks;
    }

    private void computeDominators() {
        // only blocks reachable from the real entry take part, unreachable ones have no dominators
        BasicBlock entry = function.getEntryBlock();
        if (entry == null)
            return;
        List<BasicBlock> blocks = reachableBlocks(entry);

        for (BasicBlock bb : blocks) {
            if (bb == entry) {
                dominators.put(bb, Set.of(bb));
            } else {
                dominators.put(bb, new HashSet<>(blocks));
            }
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (BasicBlock bb : blocks) {
                if (bb == entry)
                    continue;
                Set<BasicBlock> newDom = new HashSet<>(blocks);
                for (BasicBlock pred : bb.getPredecessors()) {
                    Set<BasicBlock> predDom = dominators.get(pred);
                    if (predDom == null)
                        continue; // unreachable pred
                    newDom.retainAll(predDom);
                }
                newDom.add(bb);
                if (!newDom.equals(dominators.get(bb))) {
                    dominators.put(bb, newDom);
                    changed = true;
                }
            }
        }
    }

    private void computeImmediateDominators() {
        BasicBlock entry = function.getEntryBlock();
        for (BasicBlock bb : dominators.keySet()) {
            if (bb == entry)
                continue;
            Set<BasicBlock> doms = new HashSet<>(dominators.get(bb));
            doms.remove(bb);
            // the strict dominator dominated by every other strict dominator
            for (BasicBlock candidate : doms) {
                boolean isImmediate = true;
                for (BasicBlock other : doms) {
                    if (other != candidate && !dominators.get(candidate).contains(other)) {
                        isImmediate = false;
                        break;
                    }
                }
                if (isImmediate) {
                    immediateDominators.put(bb, candidate);
                    break;
                }
            }
        }
    }

    public boolean dominates(BasicBlock a, BasicBlock b) {
        return dominators.getOrDefault(b, Collections.emptySet()).contains(a);
    }

    public boolean isReachable(BasicBlock bb) {
        return dominators.containsKey(bb);
    }

    public BasicBlock getImmediateDominator(BasicBlock bb) {
        return immediateDominators.get(bb);
    }
}
