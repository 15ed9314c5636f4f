package pass.IRPass.analysis;

import ir.value.BasicBlock;
import ir.value.Function;
import java.util.*;

/**
 * Loop forest of one function.
 */
public class LoopInfo {
    private final Function function;
    private final List<Loop> topLevelLoops;      // loops not contained in any other loop
    private final Map<BasicBlock, Loop> blockToLoop; // innermost loop of each block

    public LoopInfo(Function function) {
        this.function = function;
        this.topLevelLoops = new ArrayList<>();
        this.blockToLoop = new HashMap<>();
    }

    public Function getFunction() {
        return function;
    }

    public List<Loop> getTopLevelLoops() {
        return Collections.unmodifiableList(topLevelLoops);
    }

    void addTopLevelLoop(Loop loop) {
        topLevelLoops.add(loop);
    }

    /**
     * Map every block to its innermost loop. Outer loops are registered first
     * so inner loops overwrite their blocks.
     */
    void registerLoops() {
        blockToLoop.clear();
        for (Loop loop : topLevelLoops) {
            registerLoop(loop);
        }
    }

    private void registerLoop(Loop loop) {
        for (BasicBlock block : loop.getBlocks()) {
            blockToLoop.put(block, loop);
        }
        for (Loop subLoop : loop.getSubLoops()) {
            registerLoop(subLoop);
        }
    }

    /** innermost loop containing the block, or null */
    public Loop getLoopFor(BasicBlock block) {
        return blockToLoop.get(block);
    }

    public boolean isLoopHeader(BasicBlock block) {
        Loop loop = blockToLoop.get(block);
        return loop != null && loop.getHeader() == block;
    }

    /** every loop, outer loops before their sub-loops */
    public List<Loop> getAllLoops() {
        List<Loop> allLoops = new ArrayList<>();
        for (Loop topLoop : topLevelLoops) {
            collectAllLoops(topLoop, allLoops);
        }
        return allLoops;
    }

    private void collectAllLoops(Loop loop, List<Loop> result) {
        result.add(loop);
        for (Loop subLoop : loop.getSubLoops()) {
            collectAllLoops(subLoop, result);
        }
    }

    public int getLoopDepth(BasicBlock block) {
        Loop loop = blockToLoop.get(block);
        return loop != null ? loop.getLoopDepth() : 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("LoopInfo for function ").append(function.getName()).append(":\n");
        for (Loop loop : topLevelLoops) {
            printLoop(loop, sb, 0);
        }
        return sb.toString();
    }

    private void printLoop(Loop loop, StringBuilder sb, int indent) {
        for (int i = 0; i < indent; i++) {
            sb.append("  ");
        }
        sb.append(loop.toString()).append("\n");
        for (Loop subLoop : loop.getSubLoops()) {
            printLoop(subLoop, sb, indent + 1);
        }
    }
}
