package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 循环不变语句识别。
 * <p>
 * 不变语句：目标为无投影的局部变量且在循环内只写一次，右值为纯计算（不含调用与可能陷入的除法），
 * 每个操作数要么是常量，要么读取循环内从未写入的局部变量，要么读取已识别的不变语句结果。
 * 迭代直到不动点，结果按发现顺序排列，保证依赖在前。
 */
public final class LoopInvarianceAnalysis {

    /** 未知迭代次数时假定的次数 */
    public static final long DEFAULT_ITERATIONS = 10;
    /** 收益上限 */
    public static final long MAX_PROFIT = 1000;

    private LoopInvarianceAnalysis() {}

    public static class InvariantStatement {
        private final Location location;
        private final MirStatement.Assign statement;
        private final double profit;
        private final boolean safeToHoist;

        InvariantStatement(Location location, MirStatement.Assign statement, double profit, boolean safeToHoist) {
            this.location = location;
            this.statement = statement;
            this.profit = profit;
            this.safeToHoist = safeToHoist;
        }

        public Location getLocation() { return location; }
        public MirStatement.Assign getStatement() { return statement; }
        /** 提升后每次循环执行节省的求值次数估计。 */
        public double getProfit() { return profit; }
        /** 目标在循环头入口不活跃，提升不会改变任何可观察的值。 */
        public boolean isSafeToHoist() { return safeToHoist; }
        public int getDefinedLocal() { return statement.getDefinedLocal(); }

        @Override
        public String toString() {
            return location + ": " + statement + " (profit=" + profit + (safeToHoist ? ", safe" : "") + ")";
        }
    }

    /**
     * @param liveAtHeader 循环头入口处活跃的局部变量
     */
    public static List<InvariantStatement> analyze(MirFunction function, LoopInfo loop,
                                                   Set<Integer> liveAtHeader, Set<Integer> addressTaken) {
        Map<Integer, Integer> writes = LocalUsage.writeCounts(function, loop.getBlocks());
        Map<Location, MirStatement.Assign> invariants = new LinkedHashMap<>();
        Set<Integer> invariantDests = new HashSet<>();

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int blockId : loop.getBlocks()) {
                BasicBlock block = function.getBlock(blockId);
                List<MirStatement> stmts = block.getStatements();
                for (int i = 0; i < stmts.size(); i++) {
                    Location loc = new Location(blockId, i);
                    if (invariants.containsKey(loc)) continue;
                    if (!(stmts.get(i) instanceof MirStatement.Assign)) continue;
                    MirStatement.Assign assign = (MirStatement.Assign) stmts.get(i);
                    int dest = assign.getDefinedLocal();
                    if (dest < 0 || addressTaken.contains(dest)) continue;
                    Integer count = writes.get(dest);
                    if (count == null || count != 1) continue;
                    if (!isHoistable(assign.getRvalue())) continue;
                    if (allOperandsInvariant(assign.getRvalue(), writes, invariantDests, addressTaken)) {
                        invariants.put(loc, assign);
                        invariantDests.add(dest);
                        changed = true;
                    }
                }
            }
        }

        long iterations = loop.hasKnownTripCount() ? loop.getTripCount() : DEFAULT_ITERATIONS;
        double profit = Math.min(iterations, MAX_PROFIT);
        List<InvariantStatement> result = new ArrayList<>();
        for (Map.Entry<Location, MirStatement.Assign> e : invariants.entrySet()) {
            boolean safe = !liveAtHeader.contains(e.getValue().getDefinedLocal());
            result.add(new InvariantStatement(e.getKey(), e.getValue(), profit, safe));
        }
        return result;
    }

    private static boolean isHoistable(Rvalue rv) {
        if (rv instanceof Rvalue.BinaryOp) {
            return !((Rvalue.BinaryOp) rv).getOp().mayTrap();
        }
        return rv instanceof Rvalue.Use || rv instanceof Rvalue.UnaryOp || rv instanceof Rvalue.Cast;
    }

    private static boolean allOperandsInvariant(Rvalue rv, Map<Integer, Integer> writes,
                                                Set<Integer> invariantDests, Set<Integer> addressTaken) {
        for (Operand op : rv.getOperands()) {
            if (op.isConstant()) continue;
            if (op.getPlace().hasDeref()) return false;
            Set<Integer> read = new HashSet<>();
            op.collectReadLocals(read);
            for (int local : read) {
                if (addressTaken.contains(local)) return false;
                if (writes.containsKey(local) && !invariantDests.contains(local)) return false;
            }
        }
        return true;
    }
}
