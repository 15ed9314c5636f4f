package ir.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ir.type.LabelType;
import ir.value.instructions.Instruction;
import ir.value.instructions.Phi;

/**
 * Straight-line instruction list with CFG edges. Predecessors and successors
 * keep insertion order, which is terminator order when built through
 * {@link ir.Builder} or {@link pass.IRPass.analysis.CFGAnalysisPass}.
 */
public class BasicBlock extends Value {
    private final List<Instruction> instructions;
    private final Function parent;
    private final Set<BasicBlock> predecessors;
    private final Set<BasicBlock> successors;

    BasicBlock(String name, Function parent) {
        super(LabelType.getLabel(), name);
        this.instructions = new ArrayList<>();
        this.predecessors = new LinkedHashSet<>();
        this.successors = new LinkedHashSet<>();
        this.parent = parent;
    }

    /* getter setter */
    public List<Instruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    public Set<BasicBlock> getPredecessors() {
        return Collections.unmodifiableSet(predecessors);
    }

    public Set<BasicBlock> getSuccessors() {
        return Collections.unmodifiableSet(successors);
    }

    public BasicBlock getSinglePredecessor() {
        return predecessors.size() == 1 ? predecessors.iterator().next() : null;
    }

    public Function getParent() {
        return parent;
    }

    public Instruction getFirstInstruction() {
        return instructions.isEmpty() ? null : instructions.get(0);
    }

    public void addInstruction(Instruction inst) {
        if (inst == null) {
            return;
        }
        if (inst.getName() != null && !inst.getName().isEmpty()) {
            inst.setName(parent.getUniqueName(inst.getName()));
        }
        instructions.add(inst);
        inst.setParent(this);
    }

    /* Phi can only live in the leading phi group of the block */
    public void insertPhi(Phi phi) {
        int pos = 0;
        while (pos < instructions.size() && instructions.get(pos) instanceof Phi) {
            pos++;
        }
        if (phi.getName() != null && !phi.getName().isEmpty()) {
            phi.setName(parent.getUniqueName(phi.getName()));
        }
        instructions.add(pos, phi);
        phi.setParent(this);
    }

    public boolean isTerminated() {
        return getTerminator() != null;
    }

    public Instruction getTerminator() {
        if (instructions.isEmpty()) {
            return null;
        }
        Instruction last = instructions.get(instructions.size() - 1);
        return last.isTerminator() ? last : null;
    }

    public List<Phi> getPhis() {
        List<Phi> phis = new ArrayList<>();
        for (Instruction inst : instructions) {
            if (!(inst instanceof Phi phi)) {
                break;
            }
            phis.add(phi);
        }
        return phis;
    }

    public void setSuccessor(BasicBlock succ) {
        if (succ == null || successors.contains(succ)) {
            return;
        }
        successors.add(succ);
        succ.predecessors.add(this);
    }

    public void setPredecessor(BasicBlock pred) {
        if (pred == null) {
            return;
        }
        pred.setSuccessor(this);
    }

    // drop every edge touching this block, used before the CFG is rebuilt
    public void clearEdges() {
        for (BasicBlock succ : successors) {
            succ.predecessors.remove(this);
        }
        for (BasicBlock pred : predecessors) {
            pred.successors.remove(this);
        }
        successors.clear();
        predecessors.clear();
    }

    @Override
    public String toLLVM() {
        StringBuilder sb = new StringBuilder();
        sb.append(getName()).append(":\n");
        for (Instruction inst : instructions) {
            sb.append("  ").append(inst.toLLVM()).append("\n");
        }
        return sb.toString();
    }
}
