package com.aetherlang.ir.pass.local;

import com.aetherlang.ir.analysis.LocalUsage;
import com.aetherlang.ir.dataflow.DataflowResults;
import com.aetherlang.ir.dataflow.LivenessAnalysis;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.Cfg;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Place;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.MirPass;
import com.aetherlang.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * 死代码消除。
 * <ol>
 *   <li>删除从入口不可达的基本块</li>
 *   <li>删除目标在之后不再被读取的赋值（带投影的写入与调用总是保留，被取地址的变量不处理）</li>
 *   <li>删除不再被提及的局部变量（参数与返回值局部变量总是保留）</li>
 * </ol>
 * 删除一条赋值可能使另一条变为死代码，因此第 2 步在 pass 内部迭代到不动点。
 */
public class DeadCodeElimination implements MirPass {

    private static final Logger LOG = Logger.getLogger(DeadCodeElimination.class.getName());

    @Override
    public String getName() {
        return "dead-code-elimination";
    }

    @Override
    public boolean runOnFunction(MirFunction function, PassContext context) {
        int blocks = removeUnreachableBlocks(function);
        int statements = 0;
        int removed;
        do {
            removed = removeDeadAssignments(function);
            statements += removed;
        } while (removed > 0);
        int locals = removeUnusedLocals(function);

        if (blocks + statements + locals > 0) {
            LOG.fine(function.getName() + ": 删除 " + blocks + " 个块, " + statements + " 条语句, "
                    + locals + " 个局部变量");
            return true;
        }
        return false;
    }

    static int removeUnreachableBlocks(MirFunction function) {
        if (!function.hasBlock(function.getEntryBlock())) return 0;
        Set<Integer> reachable = Cfg.reachable(function);
        int removed = 0;
        for (int id : function.getBlockIds()) {
            if (!reachable.contains(id)) {
                function.removeBlock(id);
                removed++;
            }
        }
        return removed;
    }

    private int removeDeadAssignments(MirFunction function) {
        DataflowResults<Set<Integer>> liveness = LivenessAnalysis.compute(function);
        Set<Integer> addressTaken = LocalUsage.addressTaken(function);
        int removed = 0;
        for (BasicBlock block : function.getBlocks()) {
            if (!liveness.isAnalyzed(block.getId())) continue;
            List<MirStatement> stmts = block.getStatements();
            List<MirStatement> kept = new ArrayList<>(stmts.size());
            for (int i = 0; i < stmts.size(); i++) {
                MirStatement stmt = stmts.get(i);
                if (isDead(stmt, liveness.after(new Location(block.getId(), i)), addressTaken)) {
                    removed++;
                } else {
                    kept.add(stmt);
                }
            }
            if (kept.size() != stmts.size()) {
                stmts.clear();
                stmts.addAll(kept);
            }
        }
        return removed;
    }

    private static boolean isDead(MirStatement stmt, Set<Integer> liveAfter, Set<Integer> addressTaken) {
        if (!(stmt instanceof MirStatement.Assign)) return false;
        MirStatement.Assign assign = (MirStatement.Assign) stmt;
        if (assign.getPlace().hasProjection()) return false;
        // 调用总是保留其副作用
        if (assign.getRvalue() instanceof Rvalue.Call) return false;
        int local = assign.getPlace().getLocal();
        return !liveAfter.contains(local) && !addressTaken.contains(local);
    }

    private static int removeUnusedLocals(MirFunction function) {
        Set<Integer> mentioned = new TreeSet<>(function.getParamLocals());
        if (function.hasReturnLocal()) mentioned.add(function.getReturnLocal());
        for (BasicBlock block : function.getBlocks()) {
            for (MirStatement stmt : block.getStatements()) {
                stmt.collectMentionedLocals(mentioned);
            }
            MirTerminator term = block.getTerminator();
            term.collectReadLocals(mentioned);
            if (term instanceof MirTerminator.Call) {
                Place dest = ((MirTerminator.Call) term).getDestination();
                if (dest != null) dest.collectLocals(mentioned);
            }
        }
        int removed = 0;
        for (int id : new ArrayList<>(function.getLocals().keySet())) {
            if (!mentioned.contains(id)) {
                function.removeLocal(id);
                removed++;
            }
        }
        return removed;
    }
}
