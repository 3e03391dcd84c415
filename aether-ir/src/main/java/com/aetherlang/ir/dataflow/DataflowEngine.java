package com.aetherlang.ir.dataflow;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.Cfg;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 通用不动点数据流求解器（工作表算法）。
 * <p>
 * 前向：从入口块开始，块输入为已求得的前驱出口事实的 join；
 * 后向：从所有 Return 块开始，块输出为已求得的后继入口事实的 join，
 * 终止指令先于语句（逆序）应用。
 * 只有块边界事实发生变化时才重新入队相邻块。
 */
public final class DataflowEngine {

    private static final Logger LOG = Logger.getLogger(DataflowEngine.class.getName());

    private DataflowEngine() {}

    public static <F> DataflowResults<F> solve(MirFunction function, DataflowAnalysis<F> analysis) {
        DataflowResults<F> results = new DataflowResults<>(analysis.getDirection(), analysis.bottom());
        if (analysis.getDirection() == Direction.FORWARD) {
            solveForward(function, analysis, results);
        } else {
            solveBackward(function, analysis, results);
        }
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest(function.getName() + ": " + analysis.getClass().getSimpleName()
                    + " 收敛，块访问 " + results.iterations + " 次");
        }
        return results;
    }

    // ==================== 前向 ====================

    private static <F> void solveForward(MirFunction function, DataflowAnalysis<F> analysis,
                                         DataflowResults<F> results) {
        int entry = function.getEntryBlock();
        if (!function.hasBlock(entry)) return;
        Map<Integer, List<Integer>> preds = Cfg.predecessors(function);
        Worklist worklist = new Worklist();
        worklist.add(entry);

        while (!worklist.isEmpty()) {
            int id = worklist.poll();
            BasicBlock block = function.getBlock(id);
            results.iterations++;

            List<F> inputs = new ArrayList<>();
            if (id == entry) inputs.add(analysis.initialFact());
            for (int p : preds.get(id)) {
                F exit = results.blockExit.get(p);
                if (exit != null) inputs.add(exit);
            }
            F fact = inputs.size() == 1 ? inputs.get(0) : analysis.join(inputs);
            results.blockEntry.put(id, fact);

            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                Location loc = new Location(id, i);
                fact = analysis.transferStatement(fact, stmts.get(i), loc);
                results.facts.put(loc, fact);
            }
            Location termLoc = new Location(id, stmts.size());
            fact = analysis.transferTerminator(fact, block.getTerminator(), termLoc);
            results.facts.put(termLoc, fact);
            results.statementCounts.put(id, stmts.size());

            F old = results.blockExit.get(id);
            if (old == null || !old.equals(fact)) {
                results.blockExit.put(id, fact);
                for (int succ : block.getSuccessors()) {
                    if (function.hasBlock(succ)) worklist.add(succ);
                }
            }
        }
    }

    // ==================== 后向 ====================

    private static <F> void solveBackward(MirFunction function, DataflowAnalysis<F> analysis,
                                          DataflowResults<F> results) {
        Map<Integer, List<Integer>> preds = Cfg.predecessors(function);
        Worklist worklist = new Worklist();
        for (BasicBlock block : function.getBlocks()) {
            if (block.getTerminator().getKind() == MirTerminator.Kind.RETURN) {
                worklist.add(block.getId());
            }
        }

        // 无法到达 Return 的块（如无限循环）在工作表耗尽后补种，保证每个块都有事实
        List<Integer> layout = function.getBlockIds();
        int fallback = layout.size() - 1;
        while (true) {
            while (!worklist.isEmpty()) {
                processBackward(function, analysis, results, preds, worklist, worklist.poll());
            }
            while (fallback >= 0 && results.blockEntry.containsKey(layout.get(fallback))) {
                fallback--;
            }
            if (fallback < 0) break;
            worklist.add(layout.get(fallback));
        }
    }

    private static <F> void processBackward(MirFunction function, DataflowAnalysis<F> analysis,
                                            DataflowResults<F> results, Map<Integer, List<Integer>> preds,
                                            Worklist worklist, int id) {
        BasicBlock block = function.getBlock(id);
        MirTerminator term = block.getTerminator();
        results.iterations++;

        List<F> outputs = new ArrayList<>();
        if (term.getKind() == MirTerminator.Kind.RETURN) outputs.add(analysis.initialFact());
        for (int succ : term.getSuccessors()) {
            F entry = results.blockEntry.get(succ);
            if (entry != null) outputs.add(entry);
        }
        F fact = outputs.size() == 1 ? outputs.get(0) : analysis.join(outputs);
        results.blockExit.put(id, fact);

        List<MirStatement> stmts = block.getStatements();
        Location termLoc = new Location(id, stmts.size());
        fact = analysis.transferTerminator(fact, term, termLoc);
        results.facts.put(termLoc, fact);
        for (int i = stmts.size() - 1; i >= 0; i--) {
            Location loc = new Location(id, i);
            fact = analysis.transferStatement(fact, stmts.get(i), loc);
            results.facts.put(loc, fact);
        }
        results.statementCounts.put(id, stmts.size());

        F old = results.blockEntry.get(id);
        if (old == null || !old.equals(fact)) {
            results.blockEntry.put(id, fact);
            for (int p : preds.get(id)) worklist.add(p);
        }
    }

    /** 去重 FIFO 工作表。 */
    private static final class Worklist {
        private final Deque<Integer> queue = new ArrayDeque<>();
        private final Set<Integer> queued = new HashSet<>();

        void add(int id) {
            if (queued.add(id)) queue.add(id);
        }

        int poll() {
            int id = queue.poll();
            queued.remove(id);
            return id;
        }

        boolean isEmpty() {
            return queue.isEmpty();
        }
    }
}
