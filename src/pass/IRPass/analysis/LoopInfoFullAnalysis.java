package pass.IRPass.analysis;

import ir.value.BasicBlock;
import ir.value.Function;
import util.LoggingManager;
import util.logging.Logger;

import java.util.*;

/**
 * Natural loop detection on top of {@link DominanceAnalysisPass}.
 * Back edges sharing a header form one loop. Nesting is derived from block
 * set inclusion, so the result only depends on the CFG and the block layout.
 */
public class LoopInfoFullAnalysis {
    private static final Logger log = LoggingManager.getLogger(LoopInfoFullAnalysis.class);

    private Function function;
    private LoopInfo loopInfo;
    private DominanceAnalysisPass domAnalysis;
    private final Map<Function, LoopInfo> functionToLoopInfo;

    public LoopInfoFullAnalysis() {
        this.functionToLoopInfo = new HashMap<>();
    }

    public LoopInfo runOnFunction(Function function) {
        this.function = function;
        this.loopInfo = new LoopInfo(function);

        this.domAnalysis = new DominanceAnalysisPass(function);
        this.domAnalysis.run();

        identifyLoops();

        functionToLoopInfo.put(function, loopInfo);
        if (log.isDebugEnabled()) {
            log.debug(loopInfo.toString());
        }
        return loopInfo;
    }

    public LoopInfo getLoopInfo(Function function) {
        return functionToLoopInfo.get(function);
    }

    public DominanceAnalysisPass getDominanceAnalysis() {
        return domAnalysis;
    }

    private void identifyLoops() {
        List<BasicBlock> blocks = function.getBlocks();

        // header -> every block of the loop, merged over all back edges to it
        Map<BasicBlock, Set<BasicBlock>> headerToBody = new LinkedHashMap<>();
        for (BackEdge edge : findBackEdges(blocks)) {
            headerToBody.computeIfAbsent(edge.head(), h -> new HashSet<>())
                    .addAll(collectNaturalLoop(edge.tail(), edge.head()));
        }

        List<Loop> allLoops = new ArrayList<>();
        for (Map.Entry<BasicBlock, Set<BasicBlock>> e : headerToBody.entrySet()) {
            Loop loop = new Loop(e.getKey());
            for (BasicBlock bb : blocks) {
                if (e.getValue().contains(bb)) {
                    loop.addBlock(bb);
                }
            }
            allLoops.add(loop);
        }

        buildLoopNesting(allLoops);
        loopInfo.registerLoops();

        for (Loop loop : loopInfo.getAllLoops()) {
            loop.computeExitBlocks();
        }
    }

    private List<BackEdge> findBackEdges(List<BasicBlock> blocks) {
        List<BackEdge> backEdges = new ArrayList<>();
        for (BasicBlock block : blocks) {
            if (!domAnalysis.isReachable(block)) {
                continue;
            }
            for (BasicBlock successor : block.getSuccessors()) {
                // successor dominates block: a back edge
                if (domAnalysis.dominates(successor, block)) {
                    backEdges.add(new BackEdge(block, successor));
                }
            }
        }
        return backEdges;
    }

    private Set<BasicBlock> collectNaturalLoop(BasicBlock tail, BasicBlock head) {
        Set<BasicBlock> visited = new HashSet<>();
        Deque<BasicBlock> worklist = new ArrayDeque<>();

        visited.add(head);
        if (visited.add(tail)) {
            worklist.push(tail);
        }

        while (!worklist.isEmpty()) {
            BasicBlock current = worklist.pop();
            for (BasicBlock pred : current.getPredecessors()) {
                if (domAnalysis.isReachable(pred) && visited.add(pred)) {
                    worklist.push(pred);
                }
            }
        }
        return visited;
    }

    private void buildLoopNesting(List<Loop> allLoops) {
        // allLoops is in header layout order, so sibling sub-loops are too
        for (Loop loop : allLoops) {
            Loop parentLoop = null;

            // the smallest other loop containing this one
            for (Loop candidate : allLoops) {
                if (candidate == loop || !candidate.getBlocks().containsAll(loop.getBlocks())) {
                    continue;
                }
                if (parentLoop == null || candidate.getBlocks().size() < parentLoop.getBlocks().size()) {
                    parentLoop = candidate;
                }
            }

            if (parentLoop != null) {
                parentLoop.addSubLoop(loop);
            }
        }

        // top-level loops in header layout order
        for (Loop loop : allLoops) {
            if (loop.getParentLoop() == null) {
                loopInfo.addTopLevelLoop(loop);
            }
        }
    }

    private record BackEdge(BasicBlock tail, BasicBlock head) {
        @Override
        public String toString() {
            return tail.getName() + " -> " + head.getName();
        }
    }
}
