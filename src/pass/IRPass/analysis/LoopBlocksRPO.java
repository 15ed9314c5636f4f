package pass.IRPass.analysis;

import ir.value.BasicBlock;
import ir.value.instructions.BranchInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.SwitchInst;

import java.util.*;

/**
 * Reverse postorder of the blocks of one loop, starting at its header and
 * following in-loop successors in terminator order. Back edges to the header
 * are never followed, so every non-header block comes after all of its
 * in-loop forward predecessors.
 */
public class LoopBlocksRPO implements Iterable<BasicBlock> {
    private final Loop loop;
    private final List<BasicBlock> order;

    public LoopBlocksRPO(Loop loop) {
        this.loop = loop;
        this.order = compute();
    }

    public Loop getLoop() {
        return loop;
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(order);
    }

    @Override
    public Iterator<BasicBlock> iterator() {
        return getBlocks().iterator();
    }

    private List<BasicBlock> compute() {
        List<BasicBlock> postOrder = new ArrayList<>();
        Set<BasicBlock> visited = new HashSet<>();
        // (block, its successors not visited yet)
        Deque<Map.Entry<BasicBlock, Iterator<BasicBlock>>> stack = new ArrayDeque<>();

        BasicBlock header = loop.getHeader();
        visited.add(header);
        stack.push(Map.entry(header, successorsInLoop(header).iterator()));

        while (!stack.isEmpty()) {
            Map.Entry<BasicBlock, Iterator<BasicBlock>> top = stack.peek();
            Iterator<BasicBlock> it = top.getValue();
            if (it.hasNext()) {
                BasicBlock succ = it.next();
                if (visited.add(succ)) {
                    stack.push(Map.entry(succ, successorsInLoop(succ).iterator()));
                }
            } else {
                postOrder.add(top.getKey());
                stack.pop();
            }
        }

        Collections.reverse(postOrder);
        return postOrder;
    }

    private List<BasicBlock> successorsInLoop(BasicBlock block) {
        List<BasicBlock> result = new ArrayList<>();
        for (BasicBlock succ : terminatorSuccessors(block)) {
            if (loop.contains(succ) && !result.contains(succ)) {
                result.add(succ);
            }
        }
        return result;
    }

    static List<BasicBlock> terminatorSuccessors(BasicBlock block) {
        Instruction term = block.getTerminator();
        if (term instanceof BranchInst br) {
            return br.getSuccessors();
        }
        if (term instanceof SwitchInst sw) {
            return sw.getSuccessors();
        }
        return new ArrayList<>(block.getSuccessors());
    }
}
