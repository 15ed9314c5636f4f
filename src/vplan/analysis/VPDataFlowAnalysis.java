package vplan.analysis;

import vplan.VPBasicBlock;

/**
 * A forward data-flow problem over the flattened hierarchical CFG. States are
 * mutable; every update reports whether it changed its target.
 *
 * @param <S> the per-block state
 */
public interface VPDataFlowAnalysis<S> {

    /** a fresh state for a point no information has reached yet */
    S initialState();

    /** seeds the state flowing into the plan entry */
    ChangeResult entryState(S state);

    /** merges the state at the end of a predecessor into into */
    ChangeResult join(S into, S from);

    /** computes the state after block from the state before it */
    ChangeResult transfer(VPBasicBlock block, S before, S after);
}
