package com.aetherlang.ir.dataflow;

import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Place;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 到达定值分析（前向）。事实为 (局部变量, 定义点) 集合。
 * <p>
 * 对无投影局部变量的赋值杀死该局部变量的全部旧定义并加入自身；
 * 带投影的赋值是部分写入，只加入不杀死。StorageLive / StorageDead 杀死全部定义。
 */
public class ReachingDefinitions implements DataflowAnalysis<Set<Definition>> {

    private final Set<Integer> paramLocals;

    public ReachingDefinitions(MirFunction function) {
        this.paramLocals = function.getParamLocals();
    }

    public static DataflowResults<Set<Definition>> compute(MirFunction function) {
        return DataflowEngine.solve(function, new ReachingDefinitions(function));
    }

    /**
     * 在给定到达定值集合中筛选某个局部变量的定义。
     */
    public static List<Definition> definitionsOf(Set<Definition> fact, int local) {
        List<Definition> result = new ArrayList<>();
        for (Definition d : fact) {
            if (d.getLocal() == local) result.add(d);
        }
        return result;
    }

    @Override
    public Direction getDirection() {
        return Direction.FORWARD;
    }

    @Override
    public Set<Definition> initialFact() {
        Set<Definition> defs = new TreeSet<>();
        for (int local : paramLocals) defs.add(Definition.parameter(local));
        return defs;
    }

    @Override
    public Set<Definition> bottom() {
        return Collections.emptySet();
    }

    @Override
    public Set<Definition> transferStatement(Set<Definition> fact, MirStatement statement, Location location) {
        switch (statement.getKind()) {
            case ASSIGN: {
                Place place = ((MirStatement.Assign) statement).getPlace();
                Set<Definition> defs = new TreeSet<>(fact);
                if (!place.hasProjection()) kill(defs, place.getLocal());
                defs.add(new Definition(place.getLocal(), location));
                return defs;
            }
            case STORAGE_LIVE: {
                Set<Definition> defs = new TreeSet<>(fact);
                kill(defs, ((MirStatement.StorageLive) statement).getLocal());
                return defs;
            }
            case STORAGE_DEAD: {
                Set<Definition> defs = new TreeSet<>(fact);
                kill(defs, ((MirStatement.StorageDead) statement).getLocal());
                return defs;
            }
            default:
                return fact;
        }
    }

    @Override
    public Set<Definition> transferTerminator(Set<Definition> fact, MirTerminator terminator, Location location) {
        if (terminator instanceof MirTerminator.Call) {
            Place dest = ((MirTerminator.Call) terminator).getDestination();
            if (dest != null) {
                Set<Definition> defs = new TreeSet<>(fact);
                if (!dest.hasProjection()) kill(defs, dest.getLocal());
                defs.add(new Definition(dest.getLocal(), location));
                return defs;
            }
        }
        return fact;
    }

    @Override
    public Set<Definition> join(List<Set<Definition>> facts) {
        Set<Definition> union = new TreeSet<>();
        for (Set<Definition> f : facts) union.addAll(f);
        return union;
    }

    private static void kill(Set<Definition> defs, int local) {
        Iterator<Definition> it = defs.iterator();
        while (it.hasNext()) {
            if (it.next().getLocal() == local) it.remove();
        }
    }
}
