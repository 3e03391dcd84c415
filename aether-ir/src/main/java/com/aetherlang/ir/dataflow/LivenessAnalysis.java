package com.aetherlang.ir.dataflow;

import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Place;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 活跃变量分析（后向）。事实为活跃局部变量集合。
 * <p>
 * 赋值先杀死目标局部变量（无投影时），再加入右侧读取的局部变量；
 * StorageDead 杀死对应局部变量；终止指令加入其操作数读取的局部变量。
 * 返回局部变量在 Return 处活跃。
 */
public class LivenessAnalysis implements DataflowAnalysis<Set<Integer>> {

    private final int returnLocal;

    public LivenessAnalysis(MirFunction function) {
        this.returnLocal = function.getReturnLocal();
    }

    public static DataflowResults<Set<Integer>> compute(MirFunction function) {
        return DataflowEngine.solve(function, new LivenessAnalysis(function));
    }

    @Override
    public Direction getDirection() {
        return Direction.BACKWARD;
    }

    @Override
    public Set<Integer> initialFact() {
        Set<Integer> live = new TreeSet<>();
        if (returnLocal >= 0) live.add(returnLocal);
        return live;
    }

    @Override
    public Set<Integer> bottom() {
        return Collections.emptySet();
    }

    @Override
    public Set<Integer> transferStatement(Set<Integer> fact, MirStatement statement, Location location) {
        switch (statement.getKind()) {
            case ASSIGN: {
                MirStatement.Assign assign = (MirStatement.Assign) statement;
                Set<Integer> live = new TreeSet<>(fact);
                if (!assign.getPlace().hasProjection()) {
                    live.remove(assign.getPlace().getLocal());
                }
                statement.collectReadLocals(live);
                return live;
            }
            case STORAGE_DEAD: {
                Set<Integer> live = new TreeSet<>(fact);
                live.remove(((MirStatement.StorageDead) statement).getLocal());
                return live;
            }
            default:
                return fact;
        }
    }

    @Override
    public Set<Integer> transferTerminator(Set<Integer> fact, MirTerminator terminator, Location location) {
        Set<Integer> live = new TreeSet<>(fact);
        if (terminator instanceof MirTerminator.Call) {
            Place dest = ((MirTerminator.Call) terminator).getDestination();
            if (dest != null && !dest.hasProjection()) live.remove(dest.getLocal());
        }
        terminator.collectReadLocals(live);
        return live;
    }

    @Override
    public Set<Integer> join(List<Set<Integer>> facts) {
        Set<Integer> union = new TreeSet<>();
        for (Set<Integer> f : facts) union.addAll(f);
        return union;
    }
}
