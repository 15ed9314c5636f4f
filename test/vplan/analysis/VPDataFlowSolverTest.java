package vplan.analysis;

import exception.CompileException;
import ir.value.Function;
import org.junit.jupiter.api.Test;
import pass.IRPass.analysis.LoopInfo;
import pass.IRPass.analysis.LoopInfoFullAnalysis;
import util.llvm.LLVMIRLoader;
import vplan.VPBasicBlock;
import vplan.VPBlockUtils;
import vplan.VPlan;
import vplan.builder.VPlanHCFGBuilder;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VPDataFlowSolverTest {

    /** an integer XOR'd with the "foo" value of every block it flows through */
    static final class FooState {
        private Long value;

        boolean isUninitialized() {
            return value == null;
        }

        long getValue() {
            return value;
        }

        ChangeResult join(FooState rhs) {
            if (rhs.isUninitialized()) {
                return ChangeResult.NO_CHANGE;
            }
            return join(rhs.value);
        }

        ChangeResult join(long v) {
            if (isUninitialized()) {
                value = v;
                return ChangeResult.CHANGE;
            }
            long before = value;
            value = before ^ v;
            return ChangeResult.of(before != value);
        }

        ChangeResult set(FooState rhs) {
            if (value == null ? rhs.value == null : value.equals(rhs.value)) {
                return ChangeResult.NO_CHANGE;
            }
            value = rhs.value;
            return ChangeResult.CHANGE;
        }
    }

    static final class FooAnalysis implements VPDataFlowAnalysis<FooState> {
        private final Map<String, Long> foo;

        FooAnalysis(Map<String, Long> foo) {
            this.foo = foo;
        }

        @Override
        public FooState initialState() {
            return new FooState();
        }

        @Override
        public ChangeResult entryState(FooState state) {
            return state.join(0L);
        }

        @Override
        public ChangeResult join(FooState into, FooState from) {
            return into.join(from);
        }

        @Override
        public ChangeResult transfer(VPBasicBlock block, FooState before, FooState after) {
            FooState next = new FooState();
            next.set(before);
            Long v = foo.get(block.getName());
            if (v != null) {
                next.join(v);
            }
            return after.set(next);
        }
    }

    /** ph -> a -> {b, c} -> d */
    private static VPlan diamond() {
        VPlan plan = new VPlan("diamond");
        VPBasicBlock a = plan.createVPBasicBlock("a");
        VPBasicBlock b = plan.createVPBasicBlock("b");
        VPBasicBlock c = plan.createVPBasicBlock("c");
        VPBasicBlock d = plan.createVPBasicBlock("d");
        VPBlockUtils.connectBlocks(plan.getEntry(), a);
        VPBlockUtils.connectBlocks(a, b);
        VPBlockUtils.connectBlocks(a, c);
        VPBlockUtils.connectBlocks(b, d);
        VPBlockUtils.connectBlocks(c, d);
        return plan;
    }

    private static VPBasicBlock block(VPlan plan, String name) {
        return plan.getBasicBlocks().stream()
                .filter(b -> b.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void fooValuesAreXoredAlongEdges() {
        VPlan plan = diamond();
        VPDataFlowSolver<FooState> solver = new VPDataFlowSolver<>(
                new FooAnalysis(Map.of("a", 1L, "b", 2L, "c", 4L, "d", 8L)));
        solver.initializeAndRun(plan);

        assertEquals(0, solver.getStateAfter(plan.getEntry()).getValue());
        assertEquals(1, solver.getStateAfter(block(plan, "a")).getValue());
        assertEquals(3, solver.getStateAfter(block(plan, "b")).getValue());
        assertEquals(5, solver.getStateAfter(block(plan, "c")).getValue());
        // both predecessors are joined: 3 ^ 5
        assertEquals(6, solver.getStateBefore(block(plan, "d")).getValue());
        assertEquals(14, solver.getStateAfter(block(plan, "d")).getValue());
        assertEquals(5, solver.getNumVisits());
    }

    @Test
    void blocksWithoutFooPassTheStateThrough() {
        VPlan plan = diamond();
        VPDataFlowSolver<FooState> solver = new VPDataFlowSolver<>(new FooAnalysis(Map.of("b", 7L)));
        solver.initializeAndRun(plan);

        assertEquals(0, solver.getStateAfter(block(plan, "a")).getValue());
        assertEquals(7, solver.getStateAfter(block(plan, "d")).getValue());
    }

    @Test
    void everyBlockOfABuiltNestIsReachable() throws Exception {
        Function nest = LLVMIRLoader.loadFromTestResource("nest.ll").getFunction("nest");
        LoopInfo loopInfo = new LoopInfoFullAnalysis().runOnFunction(nest);
        VPlan plan = new VPlan("nest.outer");
        new VPlanHCFGBuilder(loopInfo.getTopLevelLoops().get(0), loopInfo, plan).buildHierarchicalCFG();

        VPDataFlowSolver<ReachabilityAnalysis.State> solver = new VPDataFlowSolver<>(new ReachabilityAnalysis());
        solver.initializeAndRun(plan);
        for (VPBasicBlock vpbb : plan.getBasicBlocks()) {
            assertTrue(solver.getStateAfter(vpbb).isReachable(), vpbb.getName());
        }
    }

    @Test
    void nonMonotoneAnalysisIsStopped() throws Exception {
        Function fn = LLVMIRLoader.loadFromTestResource("single_loop.ll").getFunction("single");
        LoopInfo loopInfo = new LoopInfoFullAnalysis().runOnFunction(fn);
        VPlan plan = new VPlan("single.loop");
        new VPlanHCFGBuilder(loopInfo.getTopLevelLoops().get(0), loopInfo, plan).buildHierarchicalCFG();

        // a counter that grows on every visit never settles on the back edge
        VPDataFlowAnalysis<int[]> counting = new VPDataFlowAnalysis<>() {
            @Override
            public int[] initialState() {
                return new int[1];
            }

            @Override
            public ChangeResult entryState(int[] state) {
                return ChangeResult.NO_CHANGE;
            }

            @Override
            public ChangeResult join(int[] into, int[] from) {
                into[0] = Math.max(into[0], from[0]);
                return ChangeResult.NO_CHANGE;
            }

            @Override
            public ChangeResult transfer(VPBasicBlock block, int[] before, int[] after) {
                after[0] = before[0] + 1;
                return ChangeResult.CHANGE;
            }
        };
        VPDataFlowSolver<int[]> solver = new VPDataFlowSolver<>(counting);
        CompileException e = assertThrows(CompileException.class, () -> solver.initializeAndRun(plan));
        assertTrue(e.getMessage().contains("did not reach a fixpoint"), e.getMessage());
    }
}
