package vplan;

/**
 * Single-entry single-exiting sub-graph standing for a loop. The entry is the
 * loop header's node and the exiting block is the latch's node; the back edge
 * between them is implicit.
 */
public class VPRegionBlock extends VPBlockBase {
    private VPBlockBase entry;
    private VPBlockBase exiting;
    private final boolean replicator;

    VPRegionBlock(String name) {
        super(name);
        this.replicator = false;
    }

    public VPBlockBase getEntry() {
        return entry;
    }

    public void setEntry(VPBlockBase entry) {
        if (entry.getNumPredecessors() != 0) {
            throw new IllegalStateException("region entry " + entry.getName() + " cannot have predecessors");
        }
        this.entry = entry;
        entry.setParent(this);
    }

    public VPBlockBase getExiting() {
        return exiting;
    }

    /** can be set once */
    public void setExiting(VPBlockBase exiting) {
        if (this.exiting != null) {
            throw new IllegalStateException("exiting block of region " + getName() + " already set to "
                    + this.exiting.getName());
        }
        if (exiting.getNumSuccessors() != 0) {
            throw new IllegalStateException("region exiting block " + exiting.getName() + " cannot have successors");
        }
        this.exiting = exiting;
        exiting.setParent(this);
    }

    public boolean isReplicator() {
        return replicator;
    }

    @Override
    public VPBasicBlock getEntryBasicBlock() {
        return entry == null ? null : entry.getEntryBasicBlock();
    }

    @Override
    public VPBasicBlock getExitingBasicBlock() {
        return exiting == null ? null : exiting.getExitingBasicBlock();
    }
}
