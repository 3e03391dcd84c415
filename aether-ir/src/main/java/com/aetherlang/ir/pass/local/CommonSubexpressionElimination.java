package com.aetherlang.ir.pass.local;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Place;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.MirPass;
import com.aetherlang.ir.pass.PassContext;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * 块内公共子表达式消除。
 * <p>
 * 对每个基本块维护“规范化纯表达式 → 首次计算它的局部变量”表，
 * 后续相同表达式改写为对该局部变量的复制。不跨块传播。
 * 常量与单个局部变量的直接复制不入表，它们本身已是最廉价的形式。
 */
public class CommonSubexpressionElimination implements MirPass {

    private static final Logger LOG = Logger.getLogger(CommonSubexpressionElimination.class.getName());

    @Override
    public String getName() {
        return "common-subexpression-elimination";
    }

    @Override
    public boolean runOnFunction(MirFunction function, PassContext context) {
        int replaced = 0;
        for (BasicBlock block : function.getBlocks()) {
            replaced += eliminateInBlock(block.getStatements());
        }
        if (replaced > 0) {
            LOG.fine(function.getName() + ": 消除 " + replaced + " 个公共子表达式");
        }
        return replaced > 0;
    }

    private int eliminateInBlock(List<MirStatement> stmts) {
        Map<Rvalue, Integer> available = new LinkedHashMap<>();
        int replaced = 0;
        for (int i = 0; i < stmts.size(); i++) {
            MirStatement stmt = stmts.get(i);
            if (stmt instanceof MirStatement.StorageDead) {
                retire(available, ((MirStatement.StorageDead) stmt).getLocal());
                continue;
            }
            if (!(stmt instanceof MirStatement.Assign)) continue;
            MirStatement.Assign assign = (MirStatement.Assign) stmt;
            Place dest = assign.getPlace();
            Rvalue rv = assign.getRvalue();

            Rvalue key = isCandidate(rv) ? normalize(rv) : null;
            Integer existing = key != null ? available.get(key) : null;
            if (existing != null && !dest.hasProjection() && existing != dest.getLocal()) {
                stmts.set(i, assign.withRvalue(Rvalue.use(Operand.copy(existing))));
                replaced++;
            }

            // 写入使相关条目失效
            if (dest.hasDeref() || rv instanceof Rvalue.Call) {
                invalidateMemoryReads(available);
            }
            retire(available, dest.getLocal());

            if (key != null && existing == null && !dest.hasProjection() && !reads(key, dest.getLocal())) {
                available.put(key, dest.getLocal());
            }
        }
        return replaced;
    }

    private static boolean isCandidate(Rvalue rv) {
        if (rv instanceof Rvalue.BinaryOp || rv instanceof Rvalue.UnaryOp) return true;
        if (rv instanceof Rvalue.Use) {
            Place place = ((Rvalue.Use) rv).getOperand().getPlace();
            return place != null && place.hasProjection();
        }
        return false;
    }

    /**
     * 规范化：Move 视同 Copy；可交换运算按操作数文本排序。
     */
    static Rvalue normalize(Rvalue rv) {
        Rvalue copied = rv.mapOperands(CommonSubexpressionElimination::asCopy);
        if (copied instanceof Rvalue.BinaryOp) {
            Rvalue.BinaryOp bin = (Rvalue.BinaryOp) copied;
            if (bin.getOp().isCommutative()
                    && bin.getLeft().toString().compareTo(bin.getRight().toString()) > 0) {
                return Rvalue.binary(bin.getOp(), bin.getRight(), bin.getLeft());
            }
        }
        return copied;
    }

    private static Operand asCopy(Operand op) {
        return op instanceof Operand.Move ? Operand.copy(op.getPlace()) : op;
    }

    private static boolean reads(Rvalue expr, int local) {
        Set<Integer> locals = new TreeSet<>();
        expr.collectReadLocals(locals);
        return locals.contains(local);
    }

    /** 删除由 local 计算或读取 local 的条目。 */
    private static void retire(Map<Rvalue, Integer> available, int local) {
        Iterator<Map.Entry<Rvalue, Integer>> it = available.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Rvalue, Integer> e = it.next();
            if (e.getValue() == local || reads(e.getKey(), local)) it.remove();
        }
    }

    /** 经指针写入或调用之后，所有经投影读取内存的条目失效。 */
    private static void invalidateMemoryReads(Map<Rvalue, Integer> available) {
        Iterator<Map.Entry<Rvalue, Integer>> it = available.entrySet().iterator();
        while (it.hasNext()) {
            for (Operand op : it.next().getKey().getOperands()) {
                if (op.getPlace() != null && op.getPlace().hasProjection()) {
                    it.remove();
                    break;
                }
            }
        }
    }
}
