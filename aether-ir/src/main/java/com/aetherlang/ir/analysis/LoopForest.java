package com.aetherlang.ir.analysis;

import com.aetherlang.ir.dataflow.ReachingDefinitions;
import com.aetherlang.ir.mir.Cfg;
import com.aetherlang.ir.mir.MirFunction;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 函数的循环森林。
 * <p>
 * 回边 tail → header 满足 header 支配 tail；循环体为从 tail 逆向可达、
 * 且不越过 header 的块集合。同一 header 的多条回边合并为一个循环，
 * 嵌套关系由块集合的包含关系决定。
 */
public class LoopForest {

    private final MirFunction function;
    private final DominatorTree dominators;
    private final Map<Integer, List<Integer>> predecessors;
    /** header → 循环，按 header 的逆后序排列（外层先于内层） */
    private final Map<Integer, LoopInfo> loops = new LinkedHashMap<>();
    private final Map<Integer, InductionVariables> inductionVariables = new HashMap<>();
    private final List<Integer> roots = new ArrayList<>();

    private LoopForest(MirFunction function, DominatorTree dominators) {
        this.function = function;
        this.dominators = dominators;
        this.predecessors = Cfg.predecessors(function);
    }

    public static LoopForest compute(MirFunction function) {
        return compute(function, DominatorTree.compute(function));
    }

    public static LoopForest compute(MirFunction function, DominatorTree dominators) {
        LoopForest forest = new LoopForest(function, dominators);
        forest.detectLoops();
        if (forest.loops.isEmpty()) return forest;
        forest.buildNesting();

        Set<Integer> addressTaken = LocalUsage.addressTaken(function);
        boolean anyBasic = false;
        for (LoopInfo loop : forest.loops.values()) {
            InductionVariables ivs = InductionVariableAnalysis.analyze(function, loop, addressTaken);
            forest.inductionVariables.put(loop.getHeader(), ivs);
            anyBasic |= !ivs.getBasic().isEmpty();
        }
        if (anyBasic) {
            LoopBoundsAnalysis.computeBounds(function, forest, ReachingDefinitions.compute(function));
        }
        return forest;
    }

    // ==================== 循环检测 ====================

    private void detectLoops() {
        for (int header : dominators.getReversePostorder()) {
            for (int tail : predecessors.get(header)) {
                if (!dominators.isReachable(tail) || !dominators.dominates(header, tail)) continue;
                Set<Integer> body = computeLoopBody(header, tail);
                LoopInfo existing = loops.get(header);
                if (existing != null) {
                    existing.addBlocks(body);
                    existing.addLatch(tail);
                } else {
                    LoopInfo loop = new LoopInfo(header, body);
                    loop.addLatch(tail);
                    loops.put(header, loop);
                }
            }
        }

        for (LoopInfo loop : loops.values()) {
            for (int block : loop.getBlocks()) {
                for (int succ : Cfg.successors(function.getBlock(block))) {
                    if (!loop.contains(succ)) loop.addExit(block, succ);
                }
            }
            List<Integer> outside = new ArrayList<>();
            for (int p : predecessors.get(loop.getHeader())) {
                if (!loop.contains(p) && dominators.isReachable(p)) outside.add(p);
            }
            if (outside.size() == 1) loop.setPreheader(outside.get(0));
        }
    }

    /**
     * 从回边 (tail → header) 逆向 BFS 求自然循环体。
     */
    private Set<Integer> computeLoopBody(int header, int tail) {
        Set<Integer> body = new TreeSet<>();
        body.add(header);
        if (header == tail) return body;
        body.add(tail);
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(tail);
        while (!queue.isEmpty()) {
            int cur = queue.poll();
            for (int p : predecessors.get(cur)) {
                if (dominators.isReachable(p) && body.add(p)) {
                    queue.add(p);
                }
            }
        }
        return body;
    }

    // ==================== 嵌套关系 ====================

    private void buildNesting() {
        List<LoopInfo> bySize = new ArrayList<>(loops.values());
        bySize.sort(Comparator.comparingInt(l -> l.getBlocks().size()));
        for (int i = 0; i < bySize.size(); i++) {
            LoopInfo inner = bySize.get(i);
            for (int j = i + 1; j < bySize.size(); j++) {
                LoopInfo outer = bySize.get(j);
                if (outer.getHeader() != inner.getHeader()
                        && outer.getBlocks().containsAll(inner.getBlocks())) {
                    inner.setParent(outer.getHeader());
                    break;
                }
            }
        }
        for (LoopInfo loop : loops.values()) {
            if (loop.getParent() < 0) {
                roots.add(loop.getHeader());
            } else {
                loops.get(loop.getParent()).addChild(loop.getHeader());
            }
            int depth = 1;
            for (int p = loop.getParent(); p >= 0; p = loops.get(p).getParent()) depth++;
            loop.setDepth(depth);
        }
    }

    // ==================== 查询 ====================

    public MirFunction getFunction() { return function; }
    public DominatorTree getDominators() { return dominators; }
    public Map<Integer, List<Integer>> getPredecessors() { return predecessors; }

    public boolean isEmpty() {
        return loops.isEmpty();
    }

    public LoopInfo getLoop(int header) {
        return loops.get(header);
    }

    /** 所有循环，外层先于内层。 */
    public List<LoopInfo> getLoops() {
        return new ArrayList<>(loops.values());
    }

    public List<LoopInfo> getRoots() {
        List<LoopInfo> result = new ArrayList<>();
        for (int header : roots) result.add(loops.get(header));
        return result;
    }

    /** 按深度降序，内层循环先处理。 */
    public List<LoopInfo> getLoopsInnermostFirst() {
        List<LoopInfo> result = getLoops();
        Collections.reverse(result);
        result.sort(Comparator.comparingInt(LoopInfo::getDepth).reversed());
        return result;
    }

    /** 包含该块的最内层循环，不在任何循环中时为 null。 */
    public LoopInfo getInnermostLoop(int block) {
        LoopInfo best = null;
        for (LoopInfo loop : loops.values()) {
            if (loop.contains(block) && (best == null || loop.getDepth() > best.getDepth())) {
                best = loop;
            }
        }
        return best;
    }

    public int getLoopDepth(int block) {
        LoopInfo loop = getInnermostLoop(block);
        return loop == null ? 0 : loop.getDepth();
    }

    public InductionVariables getInductionVariables(int header) {
        return inductionVariables.get(header);
    }
}
