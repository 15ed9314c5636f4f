package vplan.builder;

import exception.InvariantViolationException;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Value;
import ir.value.instructions.Instruction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pass.IRPass.analysis.Loop;
import pass.IRPass.analysis.LoopInfo;
import pass.IRPass.analysis.LoopInfoFullAnalysis;
import util.llvm.LLVMIRLoader;
import vplan.VPValue;
import vplan.VPlan;

import static org.junit.jupiter.api.Assertions.*;

class VPOperandResolverTest {
    private Function function;
    private LoopNestRoles roles;
    private VPlan plan;
    private VPOperandResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        function = LLVMIRLoader.loadFromTestResource("single_loop.ll").getFunction("single");
        LoopInfo loopInfo = new LoopInfoFullAnalysis().runOnFunction(function);
        Loop loop = loopInfo.getTopLevelLoops().get(0);
        roles = LoopNestRoles.of(loop, loopInfo);
        plan = new VPlan("single.loop");
        resolver = new VPOperandResolver(plan, roles);
    }

    private Instruction inst(String block, int index) {
        return function.getBlockByName(block).getInstructions().get(index);
    }

    @Test
    void rolesOfTheSingleLoop() {
        assertSame(function.getBlockByName("entry"), roles.preheader());
        assertSame(function.getBlockByName("loop"), roles.latch());
        assertTrue(roles.exitBlocks().contains(function.getBlockByName("exit")));
        assertTrue(roles.isTheLoopHeader(function.getBlockByName("loop")));
        assertFalse(roles.inTheLoop(function.getBlockByName("exit")));
    }

    @Test
    void externalDefinitions() {
        assertTrue(roles.isExternalDef(function.getParam(0)));
        assertTrue(roles.isExternalDef(inst("entry", 0)));
        assertTrue(roles.isExternalDef(inst("exit", 0)));
        assertFalse(roles.isExternalDef(inst("loop", 0)));
    }

    @Test
    void resolvingTwiceGivesTheSameLiveIn() {
        Value a = function.getParam(0);
        VPValue first = resolver.resolve(a);
        VPValue second = resolver.resolve(a);

        assertSame(first, second);
        assertTrue(first.isLiveIn());
        assertSame(a, first.getUnderlyingValue());
        assertEquals(1, plan.getLiveIns().size());
        assertSame(first, plan.getLiveIn(a));
    }

    @Test
    void preheaderValuesAreRegisteredUpFront() {
        Instruction lim = inst("entry", 0);
        resolver.registerLiveIn(lim);

        assertTrue(resolver.isMapped(lim));
        assertSame(plan.getLiveIn(lim), resolver.resolve(lim));
        assertSame(resolver.lookup(lim), resolver.resolve(lim));
    }

    @Test
    void untranslatedLoopValueIsNotALiveIn() {
        Instruction add = inst("loop", 2);
        InvariantViolationException e = assertThrows(InvariantViolationException.class,
                () -> resolver.resolve(add));
        assertEquals(InvariantViolationException.Kind.EXTERNAL_DEF, e.getKind());
        assertTrue(e.getMessage().contains("%s"), e.getMessage());
        assertTrue(plan.getLiveIns().isEmpty());
    }

    @Test
    void recordingTwiceIsATraversalError() {
        Instruction add = inst("loop", 2);
        VPValue value = new VPValue(add);
        resolver.record(add, value);
        assertSame(value, resolver.resolve(add));

        InvariantViolationException e = assertThrows(InvariantViolationException.class,
                () -> resolver.record(add, new VPValue(add)));
        assertEquals(InvariantViolationException.Kind.TRAVERSAL_ORDER, e.getKind());
    }
}
