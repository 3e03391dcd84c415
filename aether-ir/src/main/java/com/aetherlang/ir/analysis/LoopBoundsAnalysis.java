package com.aetherlang.ir.analysis;

import com.aetherlang.ir.dataflow.DataflowResults;
import com.aetherlang.ir.dataflow.Definition;
import com.aetherlang.ir.dataflow.ReachingDefinitions;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Rvalue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 计数循环的边界与迭代次数。
 * <p>
 * 识别的形状：头块以 SwitchInt 检查 c，c 在头块中由 iv 与整数常量比较得到；
 * iv 是该循环的基本归纳变量，其更新所在块支配所有回边尾块，
 * 且从循环外到达头块的唯一定义是整数常量赋值。
 */
public final class LoopBoundsAnalysis {

    private LoopBoundsAnalysis() {}

    static void computeBounds(MirFunction function, LoopForest forest,
                              DataflowResults<Set<Definition>> reaching) {
        for (LoopInfo loop : forest.getLoops()) {
            InductionVariables ivs = forest.getInductionVariables(loop.getHeader());
            if (ivs == null || ivs.getBasic().isEmpty()) continue;
            LoopBounds bounds = analyzeLoop(function, forest, loop, ivs, reaching);
            if (bounds == null) continue;
            BigInteger trips = tripCount(bounds.getInitial(), bounds.getLimit(), bounds.getStep(),
                    bounds.getComparison());
            if (trips == null || trips.bitLength() >= 63) continue;
            MirType ivType = function.getLocal(bounds.getInductionVariable()).getType();
            BigInteger last = bounds.getInitial().add(trips.multiply(bounds.getStep()));
            if (!fitsType(bounds.getInitial(), ivType) || !fitsType(last, ivType)) continue;
            loop.setBounds(bounds, trips.longValue());
        }
    }

    private static LoopBounds analyzeLoop(MirFunction function, LoopForest forest, LoopInfo loop,
                                          InductionVariables ivs, DataflowResults<Set<Definition>> reaching) {
        BasicBlock header = function.getBlock(loop.getHeader());
        if (!(header.getTerminator() instanceof MirTerminator.SwitchInt)) return null;
        MirTerminator.SwitchInt sw = (MirTerminator.SwitchInt) header.getTerminator();
        int cond = sw.getDiscriminant().getDirectLocal();
        if (cond < 0 || sw.getTargets().getValues().size() != 1
                || sw.getTargets().getValues().get(0).signum() != 0) {
            return null;
        }
        int falseTarget = sw.getTargets().getTargets().get(0);
        int trueTarget = sw.getTargets().getOtherwise();
        boolean trueInside = loop.contains(trueTarget);
        if (trueInside == loop.contains(falseTarget)) return null;

        // ---- 比较语句：头块中对 cond 的最后一次定义 ----
        List<MirStatement> stmts = header.getStatements();
        int condIdx = -1;
        for (int i = stmts.size() - 1; i >= 0; i--) {
            MirStatement s = stmts.get(i);
            if (s instanceof MirStatement.Assign && ((MirStatement.Assign) s).getPlace().getLocal() == cond) {
                condIdx = i;
                break;
            }
        }
        if (condIdx < 0) return null;
        MirStatement.Assign condAssign = (MirStatement.Assign) stmts.get(condIdx);
        if (condAssign.getPlace().hasProjection() || !(condAssign.getRvalue() instanceof Rvalue.BinaryOp)) {
            return null;
        }
        Rvalue.BinaryOp cmp = (Rvalue.BinaryOp) condAssign.getRvalue();
        if (!cmp.getOp().isComparison()) return null;
        BinOp op = cmp.getOp();
        int iv;
        BigInteger limit;
        if (cmp.getLeft().getDirectLocal() >= 0 && InductionVariableAnalysis.intConstant(cmp.getRight()) != null) {
            iv = cmp.getLeft().getDirectLocal();
            limit = InductionVariableAnalysis.intConstant(cmp.getRight());
        } else if (cmp.getRight().getDirectLocal() >= 0
                && InductionVariableAnalysis.intConstant(cmp.getLeft()) != null) {
            iv = cmp.getRight().getDirectLocal();
            limit = InductionVariableAnalysis.intConstant(cmp.getLeft());
            op = mirror(op);
        } else {
            return null;
        }
        if (!trueInside) op = negate(op);

        InductionVariables.Basic basic = ivs.findBasic(iv);
        if (basic == null) return null;

        // ---- 更新点：每次迭代恰好执行一次 ----
        Location inc = basic.getDefinition();
        if (inc.getBlock() == loop.getHeader() && inc.getStatementIndex() < condIdx) return null;
        LoopInfo innermost = forest.getInnermostLoop(inc.getBlock());
        if (innermost == null || innermost.getHeader() != loop.getHeader()) return null;
        for (int latch : loop.getLatches()) {
            if (!forest.getDominators().dominates(inc.getBlock(), latch)) return null;
        }

        // ---- 初值：从循环外到达头块的唯一定义 ----
        Set<Definition> incoming = new TreeSet<>();
        for (int p : outsidePredecessors(loop, forest.getPredecessors())) {
            if (!reaching.isAnalyzed(p)) continue;
            incoming.addAll(ReachingDefinitions.definitionsOf(reaching.getBlockExit(p), iv));
        }
        if (incoming.size() != 1) return null;
        Definition def = incoming.iterator().next();
        if (def.isParameter()) return null;
        BasicBlock defBlock = function.getBlock(def.getLocation().getBlock());
        if (def.getLocation().getStatementIndex() >= defBlock.getStatements().size()) return null;
        MirStatement defStmt = defBlock.getStatements().get(def.getLocation().getStatementIndex());
        if (!(defStmt instanceof MirStatement.Assign)) return null;
        Rvalue init = ((MirStatement.Assign) defStmt).getRvalue();
        if (!(init instanceof Rvalue.Use)) return null;
        BigInteger initial = InductionVariableAnalysis.intConstant(((Rvalue.Use) init).getOperand());
        if (initial == null) return null;

        int body = trueInside ? trueTarget : falseTarget;
        int exit = trueInside ? falseTarget : trueTarget;
        return new LoopBounds(iv, initial, limit, basic.getStep(), op, condIdx, body, exit);
    }

    /**
     * 继续条件 (iv op limit) 成立的次数。无法静态确定（含不终止）时返回 null。
     */
    public static BigInteger tripCount(BigInteger init, BigInteger limit, BigInteger step, BinOp op) {
        if (!holds(op, init, limit)) return BigInteger.ZERO;
        if (step.signum() == 0) return null;
        switch (op) {
            case LT:
                return step.signum() > 0 ? ceilDiv(limit.subtract(init), step) : null;
            case LE:
                return step.signum() > 0 ? ceilDiv(limit.subtract(init).add(BigInteger.ONE), step) : null;
            case GT:
                return step.signum() < 0 ? ceilDiv(init.subtract(limit), step.negate()) : null;
            case GE:
                return step.signum() < 0
                        ? ceilDiv(init.subtract(limit).add(BigInteger.ONE), step.negate()) : null;
            case NE: {
                BigInteger diff = limit.subtract(init);
                BigInteger[] qr = diff.divideAndRemainder(step);
                return qr[1].signum() == 0 && qr[0].signum() >= 0 ? qr[0] : null;
            }
            case EQ:
                return BigInteger.ONE;
            default:
                return null;
        }
    }

    static boolean holds(BinOp op, BigInteger a, BigInteger b) {
        int c = a.compareTo(b);
        switch (op) {
            case LT: return c < 0;
            case LE: return c <= 0;
            case GT: return c > 0;
            case GE: return c >= 0;
            case EQ: return c == 0;
            case NE: return c != 0;
            default: return false;
        }
    }

    static BinOp negate(BinOp op) {
        switch (op) {
            case LT: return BinOp.GE;
            case LE: return BinOp.GT;
            case GT: return BinOp.LE;
            case GE: return BinOp.LT;
            case EQ: return BinOp.NE;
            case NE: return BinOp.EQ;
            default: return op;
        }
    }

    static BinOp mirror(BinOp op) {
        switch (op) {
            case LT: return BinOp.GT;
            case LE: return BinOp.GE;
            case GT: return BinOp.LT;
            case GE: return BinOp.LE;
            default: return op;
        }
    }

    private static BigInteger ceilDiv(BigInteger a, BigInteger b) {
        return a.add(b).subtract(BigInteger.ONE).divide(b);
    }

    static boolean fitsType(BigInteger value, MirType type) {
        int bits = type.getBitWidth();
        if (bits == 0) return false;
        BigInteger min;
        BigInteger max;
        if (type.isUnsignedInteger()) {
            min = BigInteger.ZERO;
            max = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
        } else {
            min = BigInteger.ONE.shiftLeft(bits - 1).negate();
            max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
        }
        return value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }

    static List<Integer> outsidePredecessors(LoopInfo loop, Map<Integer, List<Integer>> preds) {
        List<Integer> result = new ArrayList<>();
        for (int p : preds.get(loop.getHeader())) {
            if (!loop.contains(p)) result.add(p);
        }
        return result;
    }
}
