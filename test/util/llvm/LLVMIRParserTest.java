package util.llvm;

import ir.IRModule;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.UndefValue;
import ir.value.Value;
import ir.value.instructions.Instruction;
import ir.value.instructions.Phi;
import ir.value.instructions.SwitchInst;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LLVMIRParserTest {

    @Test
    void loadsNestFixture() throws Exception {
        IRModule module = LLVMIRLoader.loadFromTestResource("nest.ll");
        assertEquals("nest", module.getName());

        Function nest = module.getFunction("nest");
        assertNotNull(nest);
        assertEquals(3, nest.getArguments().size());
        assertEquals(List.of("entry", "outer", "inner.ph", "inner", "inner.exit", "outer.latch", "exit"),
                nest.getBlocks().stream().map(BasicBlock::getName).collect(Collectors.toList()));

        BasicBlock inner = nest.getBlockByName("inner");
        assertEquals(List.of(nest.getBlockByName("inner.ph"), inner), List.copyOf(inner.getPredecessors()));
        assertEquals(List.of(inner, nest.getBlockByName("inner.exit")), List.copyOf(inner.getSuccessors()));
    }

    @Test
    void forwardReferencesAreReplacedByTheirDefinition() throws Exception {
        Function nest = LLVMIRLoader.loadFromTestResource("nest.ll").getFunction("nest");
        BasicBlock outer = nest.getBlockByName("outer");
        BasicBlock latch = nest.getBlockByName("outer.latch");

        Phi i = outer.getPhis().get(0);
        Instruction iNext = latch.getInstructions().get(0);
        assertEquals("i.next", iNext.getName());
        assertSame(iNext, i.getIncomingValueForBlock(latch));

        for (BasicBlock bb : nest.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                for (Value op : inst.getOperands()) {
                    assertFalse(op instanceof UndefValue, "placeholder left in " + inst.toLLVM());
                }
            }
        }
    }

    @Test
    void multiLineSwitchIsJoined() throws Exception {
        Function sw = LLVMIRLoader.loadFromTestResource("switch.ll").getFunction("sw");
        BasicBlock loop = sw.getBlockByName("loop");

        SwitchInst inst = assertInstanceOf(SwitchInst.class, loop.getTerminator());
        assertEquals(3, inst.getNumCases());
        assertEquals(10, inst.getCaseValue(0).getValue());
        assertEquals(30, inst.getCaseValue(2).getValue());
        assertSame(sw.getBlockByName("def"), inst.getDefaultDest());
        assertEquals(List.of("def", "c10", "c20", "c30"),
                inst.getSuccessors().stream().map(BasicBlock::getName).collect(Collectors.toList()));
    }

    @Test
    void strictModeReportsTheFirstBadLine() {
        String ir = String.join("\n",
                "define i32 @f(i32 %x) {",
                "entry:",
                "  %y = add i32 %x, 1",
                "  %z = frobnicate i32 %y",
                "  ret i32 %y",
                "}");
        LLVMParseException e = assertThrows(LLVMParseException.class,
                () -> LLVMIRLoader.parseFromString(ir, "bad"));
        assertEquals(4, e.getLineNumber());
        assertTrue(e.getErrors().get(0).getErrorMessage().contains("unsupported instruction 'frobnicate'"));
    }

    @Test
    void collectingModeReportsEveryBadLine() {
        String ir = String.join("\n",
                "define i32 @f(i32 %x) {",
                "entry:",
                "  %y = frob i32 %x, 1",
                "  %z = add i32 %x, 1",
                "  %w = blah i32 %x",
                "  ret i32 %x",
                "}");
        LLVMParseException e = assertThrows(LLVMParseException.class,
                () -> LLVMIRLoader.parseFromString(ir, "bad", LoaderConfig.collectingConfig()));
        assertEquals(List.of(3, 5), e.getErrors().stream()
                .map(LLVMParseException.ParseError::getLineNumber).collect(Collectors.toList()));
    }

    @Test
    void useWithoutDefinitionIsAnError() {
        String ir = String.join("\n",
                "define i32 @f(i32 %x) {",
                "entry:",
                "  ret i32 %nope",
                "}");
        LLVMParseException e = assertThrows(LLVMParseException.class,
                () -> LLVMIRLoader.parseFromString(ir, "bad"));
        assertTrue(e.getErrors().get(0).getErrorMessage().contains("%nope"));
    }

    @Test
    void forwardReferencesCanBeDisabled() {
        LoaderConfig config = LoaderConfig.defaultConfig().setAllowForwardReferences(false);
        LLVMParseException e = assertThrows(LLVMParseException.class,
                () -> LLVMIRLoader.loadFromResource("expected/ir/nest.ll", config));
        assertTrue(e.getErrors().get(0).getErrorMessage().contains("%i.next"));
    }

    @Test
    void duplicateLabelIsRejected() {
        String ir = String.join("\n",
                "define void @f() {",
                "entry:",
                "  br label %entry",
                "entry:",
                "  ret void",
                "}");
        LLVMParseException e = assertThrows(LLVMParseException.class,
                () -> LLVMIRLoader.parseFromString(ir, "bad"));
        assertEquals(4, e.getLineNumber());
    }
}
