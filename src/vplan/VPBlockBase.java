package vplan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the hierarchical CFG. Predecessor and successor lists are ordered.
 * The set* methods only touch this side of an edge and require the list to
 * be empty; {@link VPBlockUtils#connectBlocks} updates both sides.
 */
public abstract class VPBlockBase {
    private String name;
    private VPRegionBlock parent;
    private final List<VPBlockBase> predecessors;
    private final List<VPBlockBase> successors;

    protected VPBlockBase(String name) {
        this.name = name;
        this.predecessors = new ArrayList<>();
        this.successors = new ArrayList<>();
    }

    /* getter setter */
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /** the enclosing region, null at the top level */
    public VPRegionBlock getParent() {
        return parent;
    }

    public void setParent(VPRegionBlock parent) {
        this.parent = parent;
    }

    public List<VPBlockBase> getPredecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    public List<VPBlockBase> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    public int getNumPredecessors() {
        return predecessors.size();
    }

    public int getNumSuccessors() {
        return successors.size();
    }

    public VPBlockBase getSinglePredecessor() {
        return predecessors.size() == 1 ? predecessors.get(0) : null;
    }

    public VPBlockBase getSingleSuccessor() {
        return successors.size() == 1 ? successors.get(0) : null;
    }

    /** the basic block control enters this node through */
    public abstract VPBasicBlock getEntryBasicBlock();

    /** the basic block control leaves this node from */
    public abstract VPBasicBlock getExitingBasicBlock();

    public void setPredecessors(List<VPBlockBase> preds) {
        requireEmpty(predecessors, "predecessors");
        for (VPBlockBase pred : preds) {
            appendPredecessor(pred);
        }
    }

    public void setOneSuccessor(VPBlockBase succ) {
        requireEmpty(successors, "successors");
        appendSuccessor(succ);
    }

    public void setTwoSuccessors(VPBlockBase ifTrue, VPBlockBase ifFalse) {
        requireEmpty(successors, "successors");
        appendSuccessor(ifTrue);
        appendSuccessor(ifFalse);
    }

    public void setSuccessors(List<VPBlockBase> succs) {
        requireEmpty(successors, "successors");
        for (VPBlockBase succ : succs) {
            appendSuccessor(succ);
        }
    }

    void appendPredecessor(VPBlockBase pred) {
        if (pred == null) {
            throw new IllegalArgumentException("null predecessor for " + name);
        }
        predecessors.add(pred);
    }

    void appendSuccessor(VPBlockBase succ) {
        if (succ == null) {
            throw new IllegalArgumentException("null successor for " + name);
        }
        successors.add(succ);
    }

    private void requireEmpty(List<VPBlockBase> list, String what) {
        if (!list.isEmpty()) {
            throw new IllegalStateException(what + " of " + name + " already set");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
