package vplan.builder;

import exception.InvariantViolationException;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.constants.ConstantInt;
import ir.value.instructions.BranchInst;
import ir.value.instructions.CallInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.SwitchInst;
import org.junit.jupiter.api.Test;
import pass.IRPass.analysis.Loop;
import pass.IRPass.analysis.LoopInfo;
import pass.IRPass.analysis.LoopInfoFullAnalysis;
import util.llvm.LLVMIRLoader;
import vplan.VPBasicBlock;
import vplan.VPBlockBase;
import vplan.VPBlockUtils;
import vplan.VPBranchOnCondRecipe;
import vplan.VPInstruction;
import vplan.VPRecipeBase;
import vplan.VPRegionBlock;
import vplan.VPValue;
import vplan.VPWidenPhiRecipe;
import vplan.VPlan;
import vplan.VPlanVerifier;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class VPlanHCFGBuilderTest {

    /** a loaded function with the builder of its first top-level loop */
    private record Fixture(Function function, LoopInfo loopInfo, Loop loop, VPlanHCFGBuilder builder) {
        VPlan plan() {
            return builder.getPlan();
        }

        Map<VPBlockBase, BasicBlock> vpb2IRBB() {
            return builder.getVPB2IRBB();
        }

        BasicBlock bb(String name) {
            return function.getBlockByName(name);
        }

        VPBasicBlock vpbb(String irName) {
            BasicBlock bb = bb(irName);
            for (Map.Entry<VPBlockBase, BasicBlock> e : vpb2IRBB().entrySet()) {
                if (e.getValue() == bb) {
                    return (VPBasicBlock) e.getKey();
                }
            }
            return fail("no VPBasicBlock for %" + irName);
        }

        VPRegionBlock region(String name) {
            return plan().getRegions().stream()
                    .filter(r -> r.getName().equals(name))
                    .findFirst()
                    .orElseGet(() -> fail("no region " + name));
        }
    }

    private static Fixture prepare(String file, String functionName) throws Exception {
        Function function = LLVMIRLoader.loadFromTestResource(file).getFunction(functionName);
        LoopInfo loopInfo = new LoopInfoFullAnalysis().runOnFunction(function);
        Loop loop = loopInfo.getTopLevelLoops().get(0);
        VPlan plan = new VPlan(functionName + "." + loop.getHeader().getName());
        return new Fixture(function, loopInfo, loop, new VPlanHCFGBuilder(loop, loopInfo, plan));
    }

    private static Fixture build(String file, String functionName) throws Exception {
        Fixture f = prepare(file, functionName);
        f.builder().buildHierarchicalCFG();
        return f;
    }

    private static List<String> names(List<? extends VPBlockBase> blocks) {
        return blocks.stream().map(VPBlockBase::getName).collect(Collectors.toList());
    }

    private static Instruction underlying(VPValue value) {
        return assertInstanceOf(VPRecipeBase.class, value).getUnderlyingInstr();
    }

    /* ---------- properties every built plan has ---------- */

    private static void assertWellFormed(Fixture f) {
        assertBijection(f);
        assertRegionEntriesAreHeaders(f);
        assertPredecessorOrder(f);
        assertMergeOperandCounts(f);
        assertRecipeCounts(f);
        new VPlanVerifier().verify(f.plan());
    }

    // one VPBasicBlock per loop block, and nothing else apart from the plan entry
    private static void assertBijection(Fixture f) {
        Map<VPBlockBase, BasicBlock> map = f.vpb2IRBB();
        assertEquals(f.loop().getBlocks(), new HashSet<>(map.values()));
        assertEquals(map.size(), new HashSet<>(map.values()).size());

        List<VPBasicBlock> expected = new ArrayList<>(f.plan().getBasicBlocks());
        expected.remove(f.plan().getEntry());
        assertEquals(new HashSet<>(expected), map.keySet());
    }

    private static void assertRegionEntriesAreHeaders(Fixture f) {
        for (VPRegionBlock region : f.plan().getRegions()) {
            BasicBlock header = f.vpb2IRBB().get(region.getEntry());
            assertNotNull(header);
            Loop loop = f.loopInfo().getLoopFor(header);
            assertSame(header, loop.getHeader());
            assertNotSame(f.loop(), loop);
            assertEquals(header.getName(), region.getName());
            assertSame(f.vpb2IRBB().get(region.getExiting()), loop.getLoopLatch());
        }
    }

    // a non-header block lists its predecessors in IR order, an inner loop being seen through its latch
    private static void assertPredecessorOrder(Fixture f) {
        for (Map.Entry<VPBlockBase, BasicBlock> e : f.vpb2IRBB().entrySet()) {
            VPBasicBlock vpbb = (VPBasicBlock) e.getKey();
            BasicBlock bb = e.getValue();
            if (bb == f.loop().getHeader() || VPBlockRegistry.isRegionEntry(vpbb)) {
                continue;
            }
            List<BasicBlock> actual = vpbb.getPredecessors().stream()
                    .map(p -> f.vpb2IRBB().get(p.getExitingBasicBlock()))
                    .collect(Collectors.toList());
            assertEquals(new ArrayList<>(bb.getPredecessors()), actual, "predecessors of " + vpbb.getName());
        }
    }

    private static void assertMergeOperandCounts(Fixture f) {
        for (VPBasicBlock vpbb : f.plan().getBasicBlocks()) {
            boolean header = vpbb == f.vpbb(f.loop().getHeader().getName()) || VPBlockRegistry.isRegionEntry(vpbb);
            for (VPWidenPhiRecipe phi : vpbb.getPhis()) {
                assertEquals(VPBlockUtils.getFlatPredecessors(vpbb).size(), phi.getNumOperands());
                if (header) {
                    assertEquals(2, phi.getNumOperands());
                }
            }
        }
    }

    // every non-debug instruction gets a recipe; only branches staying inside the nest are kept
    private static void assertRecipeCounts(Fixture f) {
        BasicBlock outerLatch = f.loop().getLoopLatch();
        for (Map.Entry<VPBlockBase, BasicBlock> e : f.vpb2IRBB().entrySet()) {
            BasicBlock bb = e.getValue();
            int expected = 0;
            for (Instruction inst : bb.getInstructions()) {
                if (inst.isDebugInfo()) {
                    continue;
                }
                if (inst instanceof SwitchInst) {
                    expected++;
                } else if (inst instanceof BranchInst br) {
                    boolean staysInside = br.getSuccessors().stream().allMatch(s -> f.loop().contains(s));
                    if (br.isConditional() && staysInside && bb != outerLatch) {
                        expected++;
                    }
                } else {
                    expected++;
                }
            }
            assertEquals(expected, ((VPBasicBlock) e.getKey()).size(), "recipes of " + bb.getName());
        }
    }

    /* ---------- scenarios ---------- */

    @Test
    void singleLoop() throws Exception {
        Fixture f = build("single_loop.ll", "single");
        assertWellFormed(f);

        VPlan plan = f.plan();
        assertEquals(List.of("ph", "vector.body"), names(plan.getBlocks()));
        assertTrue(plan.getRegions().isEmpty());

        VPBasicBlock body = f.vpbb("loop");
        assertEquals("vector.body", body.getName());
        // the latch is the header: its back edge comes first, the plan entry second
        assertEquals(List.of(body, plan.getEntry()), body.getPredecessors());
        assertEquals(List.of(body), body.getSuccessors());
        assertEquals(List.of(body), plan.getEntry().getSuccessors());

        VPWidenPhiRecipe i = body.getPhis().get(0);
        ConstantInt start = assertInstanceOf(ConstantInt.class, i.getOperand(0).getUnderlyingValue());
        assertTrue(i.getOperand(0).isLiveIn());
        assertEquals(0, start.getValue());
        assertEquals("i.next", underlying(i.getOperand(1)).getName());

        // preheader values are live-ins
        Instruction lim = f.bb("entry").getInstructions().get(0);
        VPValue limLiveIn = plan.getLiveIn(lim);
        assertNotNull(limLiveIn);
        VPInstruction cmp = (VPInstruction) body.getRecipes().get(body.size() - 1);
        assertEquals(Opcode.ICMP_SLT, cmp.getOpcode());
        assertSame(limLiveIn, cmp.getOperand(1));
        assertSame(plan.getLiveIn(f.function().getParam(0)), body.getRecipes().get(1).getOperand(0));
    }

    @Test
    void nestedLoopBecomesARegion() throws Exception {
        Fixture f = build("nest.ll", "nest");
        assertWellFormed(f);

        VPlan plan = f.plan();
        assertEquals(List.of("ph", "vector.body", "inner.ph", "inner", "inner", "inner.exit", "outer.latch"),
                names(plan.getBlocks()));

        VPBasicBlock body = f.vpbb("outer");
        VPBasicBlock innerPh = f.vpbb("inner.ph");
        VPBasicBlock inner = f.vpbb("inner");
        VPBasicBlock innerExit = f.vpbb("inner.exit");
        VPBasicBlock latch = f.vpbb("outer.latch");
        VPRegionBlock region = f.region("inner");

        assertEquals(List.of(latch, plan.getEntry()), body.getPredecessors());
        assertEquals(List.of(innerPh), body.getSuccessors());
        assertEquals(List.of(region), innerPh.getSuccessors());

        assertSame(inner, region.getEntry());
        assertSame(inner, region.getExiting());
        assertSame(region, inner.getParent());
        assertNull(region.getParent());
        assertFalse(region.isReplicator());
        assertEquals(List.of(innerPh), region.getPredecessors());
        assertEquals(List.of(innerExit), region.getSuccessors());
        assertTrue(inner.getPredecessors().isEmpty());
        assertTrue(inner.getSuccessors().isEmpty());
        assertEquals(List.of(region), innerExit.getPredecessors());
        assertEquals(List.of(body), latch.getSuccessors());

        // inner header phis: value from inner.ph, then value from the inner latch
        VPWidenPhiRecipe sum = inner.getPhis().get(1);
        assertEquals("t", underlying(sum.getOperand(0)).getName());
        assertEquals("sum.next", underlying(sum.getOperand(1)).getName());

        VPWidenPhiRecipe lcssa = innerExit.getPhis().get(0);
        assertEquals(1, lcssa.getNumOperands());
        assertEquals("sum.next", underlying(lcssa.getOperand(0)).getName());

        VPBranchOnCondRecipe branch = assertInstanceOf(VPBranchOnCondRecipe.class,
                inner.getRecipes().get(inner.size() - 1));
        assertEquals("cj", underlying(branch.getCondition()).getName());

        assertEquals(List.of(inner), VPBlockUtils.getFlatSuccessors(innerPh));
        assertEquals(List.of(inner, innerExit), VPBlockUtils.getFlatSuccessors(inner));
        assertEquals(List.of(innerPh, inner), VPBlockUtils.getFlatPredecessors(inner));

        String dump = plan.print();
        assertTrue(dump.contains("<loop> inner: {"), dump);
        assertTrue(dump.contains("vector.body:"), dump);
    }

    @Test
    void siblingLoops() throws Exception {
        Fixture f = build("siblings.ll", "siblings");
        assertWellFormed(f);

        VPRegionBlock l1 = f.region("l1");
        VPRegionBlock l2 = f.region("l2");
        VPBasicBlock body = f.vpbb("outer");
        VPBasicBlock mid = f.vpbb("mid");
        VPBasicBlock latch = f.vpbb("latch");

        assertEquals(List.of(l1), body.getSuccessors());
        assertEquals(List.of(body), l1.getPredecessors());
        assertEquals(List.of(mid), l1.getSuccessors());
        assertEquals(List.of(l1), mid.getPredecessors());
        assertEquals(List.of(l2), mid.getSuccessors());
        assertEquals(List.of(mid), l2.getPredecessors());
        assertEquals(List.of(latch), l2.getSuccessors());
        assertEquals(List.of(l2), latch.getPredecessors());
        assertNull(l1.getParent());
        assertNull(l2.getParent());
    }

    @Test
    void switchKeepsCaseOrder() throws Exception {
        Fixture f = build("switch.ll", "sw");
        assertWellFormed(f);

        VPBasicBlock body = f.vpbb("loop");
        assertEquals(List.of("def", "c10", "c20", "c30"), names(body.getSuccessors()));

        VPInstruction sw = assertInstanceOf(VPInstruction.class, body.getRecipes().get(body.size() - 1));
        assertEquals(Opcode.SWITCH, sw.getOpcode());
        assertEquals(4, sw.getNumOperands());
        assertEquals("r", underlying(sw.getOperand(0)).getName());
        List<Long> caseValues = new ArrayList<>();
        for (int i = 1; i < sw.getNumOperands(); i++) {
            assertTrue(sw.getOperand(i).isLiveIn());
            caseValues.add(((ConstantInt) sw.getOperand(i).getUnderlyingValue()).getValue());
        }
        assertEquals(List.of(10L, 20L, 30L), caseValues);

        // merge operands follow the predecessor order, not the order written in the phi
        VPBasicBlock latch = f.vpbb("latch");
        assertEquals(List.of("c10", "c20", "c30", "def"), names(latch.getPredecessors()));
        VPWidenPhiRecipe merge = latch.getPhis().get(0);
        List<String> incoming = merge.getOperands().stream()
                .map(v -> underlying(v).getName())
                .collect(Collectors.toList());
        assertEquals(List.of("a10", "a20", "a30", "acc"), incoming);
    }

    @Test
    void switchEnteringAnInnerLoopHeader() throws Exception {
        Fixture f = build("swloop.ll", "swloop");
        assertWellFormed(f);

        VPBasicBlock body = f.vpbb("outer");
        VPRegionBlock inner = f.region("inner");
        // switch edges go to plain nodes, the region records the edge on its side
        assertEquals(List.of(f.vpbb("skip"), f.vpbb("inner")), body.getSuccessors());
        assertEquals(List.of(body), inner.getPredecessors());
        assertEquals(List.of(inner), f.vpbb("inner.exit").getPredecessors());
        assertEquals(List.of(f.vpbb("inner.exit"), f.vpbb("skip")), f.vpbb("latch").getPredecessors());
    }

    @Test
    void threeLevelNestGivesNestedRegions() throws Exception {
        Fixture f = build("triple.ll", "triple");
        assertWellFormed(f);

        VPlan plan = f.plan();
        assertEquals(List.of("ph", "vector.body", "l2", "l2", "l3", "l3", "l2.latch", "l1.latch"),
                names(plan.getBlocks()));

        VPRegionBlock l2 = f.region("l2");
        VPRegionBlock l3 = f.region("l3");
        VPBasicBlock l2Latch = f.vpbb("l2.latch");
        VPBasicBlock l1Latch = f.vpbb("l1.latch");

        assertNull(l2.getParent());
        assertSame(l2, l3.getParent());
        assertSame(l2, f.vpbb("l2").getParent());
        assertSame(l2, l2Latch.getParent());
        assertSame(l3, f.vpbb("l3").getParent());

        assertEquals(List.of(f.vpbb("l1")), l2.getPredecessors());
        assertEquals(List.of(l3), f.vpbb("l2").getSuccessors());
        assertEquals(List.of(f.vpbb("l2")), l3.getPredecessors());
        assertEquals(List.of(l2Latch), l3.getSuccessors());
        assertEquals(List.of(l3), l2Latch.getPredecessors());
        assertSame(l2Latch, l2.getExiting());
        assertTrue(l2Latch.getSuccessors().isEmpty());
        assertEquals(List.of(l1Latch), l2.getSuccessors());
        assertEquals(List.of(l2), l1Latch.getPredecessors());
        assertEquals(List.of(f.vpbb("l1")), l1Latch.getSuccessors());

        assertEquals(List.of(f.vpbb("l2"), f.vpbb("l3")), VPBlockUtils.getFlatPredecessors(f.vpbb("l3")));
        assertEquals(List.of(f.vpbb("l3")), VPBlockUtils.getFlatPredecessors(l2Latch));
    }

    @Test
    void ifElseInsideTheBodyAndEarlyExit() throws Exception {
        Fixture f = build("diamond.ll", "diamond");
        assertWellFormed(f);

        VPBasicBlock header = f.vpbb("loop");
        VPBasicBlock body = f.vpbb("body");
        VPBasicBlock t = f.vpbb("t");
        VPBasicBlock fl = f.vpbb("f");
        VPBasicBlock latch = f.vpbb("latch");
        assertTrue(f.plan().getRegions().isEmpty());

        // the edge to %exit is dropped and the exiting branch gets no recipe
        assertEquals(List.of(body), header.getSuccessors());
        assertEquals(3, header.size());
        VPInstruction stop = assertInstanceOf(VPInstruction.class, header.getRecipes().get(2));
        assertEquals(Opcode.ICMP_EQ, stop.getOpcode());

        assertEquals(List.of(t, fl), body.getSuccessors());
        assertEquals(List.of(body), t.getPredecessors());
        assertEquals(List.of(body), fl.getPredecessors());
        VPBranchOnCondRecipe branch = assertInstanceOf(VPBranchOnCondRecipe.class,
                body.getRecipes().get(body.size() - 1));
        assertEquals("p", underlying(branch.getCondition()).getName());
        assertEquals(1, t.size());
        assertEquals(1, fl.size());

        assertEquals(List.of(t, fl), latch.getPredecessors());
        VPWidenPhiRecipe merge = latch.getPhis().get(0);
        assertEquals(List.of("x", "y"), merge.getOperands().stream()
                .map(v -> underlying(v).getName())
                .collect(Collectors.toList()));
        assertEquals(List.of(header), latch.getSuccessors());
        assertEquals(List.of(latch, f.plan().getEntry()), header.getPredecessors());
    }

    @Test
    void debugIntrinsicsAreSkipped() throws Exception {
        Fixture f = build("dbg.ll", "dbg");
        assertWellFormed(f);

        VPBasicBlock body = f.vpbb("loop");
        assertEquals(3, body.size());
        for (VPRecipeBase recipe : body.getRecipes()) {
            assertFalse(recipe.getUnderlyingInstr() instanceof CallInst);
        }
    }

    /* ---------- rejected input ---------- */

    @Test
    void exitFromInnerHeaderIsRejected() throws Exception {
        Fixture f = prepare("early_exit.ll", "early");
        InvariantViolationException e = assertThrows(InvariantViolationException.class,
                () -> f.builder().buildHierarchicalCFG());
        assertEquals(InvariantViolationException.Kind.SHAPE, e.getKind());
        assertTrue(e.getMessage().contains("not the loop latch"), e.getMessage());
        assertTrue(e.getMessage().contains("%inner"), e.getMessage());
    }

    @Test
    void loopWithoutPreheaderIsRejected() throws Exception {
        Fixture f = prepare("no_preheader.ll", "nopre");
        InvariantViolationException e = assertThrows(InvariantViolationException.class,
                () -> f.builder().buildHierarchicalCFG());
        assertEquals(InvariantViolationException.Kind.SHAPE, e.getKind());
        assertTrue(e.getMessage().contains("no preheader"), e.getMessage());
    }

    @Test
    void repeatedSwitchTargetIsRejected() throws Exception {
        Fixture f = prepare("repeated_case.ll", "rep");
        InvariantViolationException e = assertThrows(InvariantViolationException.class,
                () -> f.builder().buildHierarchicalCFG());
        assertEquals(InvariantViolationException.Kind.SHAPE, e.getKind());
        assertTrue(e.getMessage().contains("names %one more than once"), e.getMessage());
    }

    @Test
    void buildingTwiceIsAnError() throws Exception {
        Fixture f = build("single_loop.ll", "single");
        assertThrows(IllegalStateException.class, () -> f.builder().buildHierarchicalCFG());
    }
}
