package ir;

import java.util.List;

import exception.CompileException;
import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantInt;
import ir.value.instructions.BinOperator;
import ir.value.instructions.BranchInst;
import ir.value.instructions.CallInst;
import ir.value.instructions.ICmpInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoadInst;
import ir.value.instructions.Phi;
import ir.value.instructions.ReturnInst;
import ir.value.instructions.StoreInst;
import ir.value.instructions.SwitchInst;

/**
 * Appends instructions at the end of the current block. Terminators also
 * record the CFG edges, in operand order.
 */
public class Builder {
    private final IRModule module;
    private BasicBlock currentBlock;
    private Function currentFunction;

    public Builder(IRModule module) {
        this.module = module;
    }

    public IRModule getModule() {
        return module;
    }

    public void positionAtEnd(BasicBlock block) {
        this.currentBlock = block;
        this.currentFunction = block.getParent();
    }

    public Function getCurrentFunction() {
        return currentFunction;
    }

    public BasicBlock getCurrentBlock() {
        return currentBlock;
    }

    private void insertInstruction(Instruction inst) {
        if (currentBlock == null) {
            throw new IllegalStateException("Builder is not positioned at a block");
        }
        if (currentBlock.isTerminated()) {
            throw CompileException.illegalInstruction(
                    "cannot insert into terminated block %" + currentBlock.getName() + ": " + inst.toLLVM());
        }
        currentBlock.addInstruction(inst);
    }

    public Value buildBinaryOperator(Opcode opcode, Value lhs, Value rhs, String name) {
        if (!lhs.getType().equals(rhs.getType())) {
            throw CompileException.illegalOperand("lhs and rhs of " + opcode.getMnemonic()
                    + " differ in type: " + lhs.getType() + " vs " + rhs.getType());
        }
        Instruction inst = new BinOperator(name, opcode, lhs.getType(), lhs, rhs);
        insertInstruction(inst);
        return inst;
    }

    public Value buildAdd(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.ADD, lhs, rhs, name);
    }

    public Value buildSub(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.SUB, lhs, rhs, name);
    }

    public Value buildMul(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.MUL, lhs, rhs, name);
    }

    public Value buildSRem(Value lhs, Value rhs, String name) {
        return buildBinaryOperator(Opcode.SREM, lhs, rhs, name);
    }

    public Value buildICmp(Opcode pred, Value lhs, Value rhs, String name) {
        if (!lhs.getType().equals(rhs.getType()) || !lhs.getType().isInteger()) {
            throw CompileException.illegalOperand("icmp needs two integers of the same type, got "
                    + lhs.getType() + " and " + rhs.getType());
        }
        Instruction inst = new ICmpInst(pred, name, lhs, rhs);
        insertInstruction(inst);
        return inst;
    }

    public Value buildICmpSLT(Value lhs, Value rhs, String name) {
        return buildICmp(Opcode.ICMP_SLT, lhs, rhs, name);
    }

    public Value buildICmpEQ(Value lhs, Value rhs, String name) {
        return buildICmp(Opcode.ICMP_EQ, lhs, rhs, name);
    }

    public Value buildLoad(Value pointer, String name) {
        if (!pointer.getType().isPointer()) {
            throw CompileException.illegalOperand("load from non-pointer " + pointer.getReference());
        }
        Instruction inst = new LoadInst(pointer, name);
        insertInstruction(inst);
        return inst;
    }

    public void buildStore(Value value, Value pointer) {
        if (!pointer.getType().isPointer()) {
            throw CompileException.illegalOperand("store to non-pointer " + pointer.getReference());
        }
        insertInstruction(new StoreInst(pointer, value));
    }

    // --- control flow ---
    public void buildBr(BasicBlock dest) {
        Instruction inst = new BranchInst(dest);
        insertInstruction(inst);
        currentBlock.setSuccessor(dest);
    }

    public void buildCondBr(Value condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        if (!condition.getType().isI1()) {
            throw CompileException.illegalOperand("branch condition must be i1, got " + condition.getType());
        }
        Instruction inst = new BranchInst(condition, thenBlock, elseBlock);
        insertInstruction(inst);
        currentBlock.setSuccessor(thenBlock);
        currentBlock.setSuccessor(elseBlock);
    }

    /**
     * Builds a switch over {@code cases}, given as (value, destination) pairs
     * in case order.
     */
    public SwitchInst buildSwitch(Value condition, BasicBlock defaultDest, List<SwitchCase> cases) {
        if (!condition.getType().isInteger()) {
            throw CompileException.illegalOperand("switch condition must be an integer, got " + condition.getType());
        }
        SwitchInst inst = new SwitchInst(condition, defaultDest);
        for (SwitchCase c : cases) {
            inst.addCase(c.value(), c.dest());
        }
        insertInstruction(inst);
        for (BasicBlock succ : inst.getSuccessors()) {
            currentBlock.setSuccessor(succ);
        }
        return inst;
    }

    public record SwitchCase(ConstantInt value, BasicBlock dest) {}

    public void buildRet(Value value) {
        insertInstruction(new ReturnInst(value));
    }

    public void buildRetVoid() {
        insertInstruction(new ReturnInst(null));
    }

    public Value buildCall(Function function, List<Value> args, String name) {
        Instruction inst = new CallInst(function, args, function.getFunctionType().getReturnType().isVoid() ? "" : name);
        insertInstruction(inst);
        return inst;
    }

    // phis always go to the leading phi group of the block
    public Phi buildPhi(Type type, String name) {
        Phi inst = new Phi(type, name);
        currentBlock.insertPhi(inst);
        return inst;
    }
}
