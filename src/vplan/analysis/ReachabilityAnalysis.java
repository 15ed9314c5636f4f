package vplan.analysis;

import vplan.VPBasicBlock;

/**
 * Marks every block reachable from the plan entry along flattened edges.
 */
public class ReachabilityAnalysis implements VPDataFlowAnalysis<ReachabilityAnalysis.State> {

    public static final class State {
        private boolean reachable;

        public boolean isReachable() {
            return reachable;
        }

        ChangeResult set(boolean value) {
            if (reachable == value) {
                return ChangeResult.NO_CHANGE;
            }
            reachable = value;
            return ChangeResult.CHANGE;
        }

        @Override
        public String toString() {
            return reachable ? "reachable" : "unreachable";
        }
    }

    @Override
    public State initialState() {
        return new State();
    }

    @Override
    public ChangeResult entryState(State state) {
        return state.set(true);
    }

    @Override
    public ChangeResult join(State into, State from) {
        return from.reachable ? into.set(true) : ChangeResult.NO_CHANGE;
    }

    @Override
    public ChangeResult transfer(VPBasicBlock block, State before, State after) {
        return after.set(before.reachable);
    }
}
