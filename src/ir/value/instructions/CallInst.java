package ir.value.instructions;

import java.util.ArrayList;
import java.util.List;

import ir.InstructionVisitor;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;

// the callee is kept as a field, operands are the arguments only
public class CallInst extends Instruction {
    private static final String DEBUG_INTRINSIC_PREFIX = "llvm.dbg.";

    private final Function func;

    public CallInst(Function func, List<Value> args, String name) {
        super(func.getFunctionType().getReturnType(), name);
        this.func = func;
        for (Value arg : args) {
            addOperand(arg);
        }
    }

    public Function getCalledFunction() {
        return func;
    }

    public int getNumArgs() {
        return getNumOperands();
    }

    public Value getArg(int i) {
        return getOperand(i);
    }

    @Override
    public boolean isDebugInfo() {
        return func.getName().startsWith(DEBUG_INTRINSIC_PREFIX);
    }

    @Override
    public Opcode opCode() {
        return Opcode.CALL;
    }

    @Override
    public String toLLVM() {
        List<String> argStrings = new ArrayList<>();
        for (Value arg : getOperands()) {
            argStrings.add(arg.getType().toLLVM() + " " + arg.getReference());
        }
        String call = "call " + getType().toLLVM() + " @" + func.getName()
                + "(" + String.join(", ", argStrings) + ")";
        return getType().isVoid() ? call : "%" + getName() + " = " + call;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
