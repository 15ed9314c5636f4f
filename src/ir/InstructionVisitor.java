package ir;

import ir.value.instructions.*;

public interface InstructionVisitor<T> {
    T visit(BinOperator inst);

    T visit(BranchInst inst);

    T visit(SwitchInst inst);

    T visit(CallInst inst);

    T visit(ICmpInst inst);

    T visit(LoadInst inst);

    T visit(StoreInst inst);

    T visit(Phi inst);

    T visit(ReturnInst inst);
}
