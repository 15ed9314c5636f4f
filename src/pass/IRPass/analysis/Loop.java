package pass.IRPass.analysis;

import ir.value.BasicBlock;

import java.util.*;

/**
 * A natural loop. Blocks are kept in function layout order, exit blocks in
 * the order they are first reached from the loop body.
 */
public class Loop {
    private final BasicBlock header;
    private final Set<BasicBlock> blocks;
    private final Set<BasicBlock> exitBlocks;
    private final List<Loop> subLoops;
    private Loop parentLoop;

    public Loop(BasicBlock header) {
        this.header = header;
        this.blocks = new LinkedHashSet<>();
        this.exitBlocks = new LinkedHashSet<>();
        this.subLoops = new ArrayList<>();
        this.parentLoop = null;
        this.blocks.add(header);
    }

    public BasicBlock getHeader() {
        return header;
    }

    public Set<BasicBlock> getBlocks() {
        return Collections.unmodifiableSet(blocks);
    }

    public Set<BasicBlock> getExitBlocks() {
        return Collections.unmodifiableSet(exitBlocks);
    }

    public List<Loop> getSubLoops() {
        return Collections.unmodifiableList(subLoops);
    }

    public Loop getParentLoop() {
        return parentLoop;
    }

    void setParentLoop(Loop parent) {
        this.parentLoop = parent;
    }

    void addBlock(BasicBlock block) {
        blocks.add(block);
    }

    void addSubLoop(Loop subLoop) {
        subLoops.add(subLoop);
        subLoop.setParentLoop(this);
    }

    public boolean contains(BasicBlock block) {
        return blocks.contains(block);
    }

    /** true if other is this loop or nested inside it */
    public boolean contains(Loop other) {
        for (Loop l = other; l != null; l = l.parentLoop) {
            if (l == this) {
                return true;
            }
        }
        return false;
    }

    /**
     * Exit blocks are blocks outside the loop with a predecessor inside it.
     */
    void computeExitBlocks() {
        exitBlocks.clear();
        for (BasicBlock loopBlock : blocks) {
            for (BasicBlock successor : loopBlock.getSuccessors()) {
                if (!blocks.contains(successor)) {
                    exitBlocks.add(successor);
                }
            }
        }
    }

    /** nesting depth, 1 for a top-level loop */
    public int getLoopDepth() {
        int depth = 1;
        Loop parent = parentLoop;
        while (parent != null) {
            depth++;
            parent = parent.parentLoop;
        }
        return depth;
    }

    public Set<BasicBlock> getOutsidePredecessorsOfHeader() {
        Set<BasicBlock> result = new LinkedHashSet<>();
        for (BasicBlock pred : header.getPredecessors()) {
            if (!blocks.contains(pred)) {
                result.add(pred);
            }
        }
        return result;
    }

    /**
     * @return the unique predecessor of the header outside the loop, or null
     *         when there is none or more than one
     */
    public BasicBlock getLoopPredecessor() {
        Set<BasicBlock> outs = getOutsidePredecessorsOfHeader();
        return outs.size() == 1 ? outs.iterator().next() : null;
    }

    /**
     * The loop predecessor, provided the header is its only successor.
     */
    public BasicBlock getLoopPreheader() {
        BasicBlock pred = getLoopPredecessor();
        if (pred == null || pred.getSuccessors().size() != 1) {
            return null;
        }
        return pred;
    }

    /** blocks inside the loop that branch back to the header */
    public Set<BasicBlock> getLatchBlocks() {
        Set<BasicBlock> latches = new LinkedHashSet<>();
        for (BasicBlock pred : header.getPredecessors()) {
            if (blocks.contains(pred)) {
                latches.add(pred);
            }
        }
        return latches;
    }

    public BasicBlock getLoopLatch() {
        Set<BasicBlock> latches = getLatchBlocks();
        return latches.size() == 1 ? latches.iterator().next() : null;
    }

    public boolean isLoopLatch(BasicBlock block) {
        return block != null && block == getLoopLatch();
    }

    public BasicBlock getUniqueExit() {
        return exitBlocks.size() == 1 ? exitBlocks.iterator().next() : null;
    }

    /**
     * Conservative LoopSimplify form: a preheader and a single latch.
     */
    public boolean isLoopSimplifyForm() {
        return getLoopPreheader() != null && getLoopLatch() != null;
    }

    @Override
    public String toString() {
        return "Loop{header=" + header.getName() + ", blocks=" + blocks.size() +
                ", subLoops=" + subLoops.size() + "}";
    }
}
