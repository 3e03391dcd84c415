package com.aetherlang.ir.dataflow;

import com.aetherlang.ir.mir.Location;

import java.util.HashMap;
import java.util.Map;

/**
 * 数据流求解结果。
 * <p>
 * 每个程序点保存“应用该点传递函数之后”的事实（按分析方向）；
 * {@link #before} / {@link #after} 以程序顺序给出程序点前后的事实。
 *
 * @param <F> 事实类型
 */
public class DataflowResults<F> {

    private final Direction direction;
    private final F bottom;
    final Map<Location, F> facts = new HashMap<>();
    /** 块顶部（第一条语句之前）的事实 */
    final Map<Integer, F> blockEntry = new HashMap<>();
    /** 块底部（终止指令之后）的事实 */
    final Map<Integer, F> blockExit = new HashMap<>();
    final Map<Integer, Integer> statementCounts = new HashMap<>();
    int iterations;

    DataflowResults(Direction direction, F bottom) {
        this.direction = direction;
        this.bottom = bottom;
    }

    public Direction getDirection() { return direction; }

    /** 处理过的块访问次数，用于观察收敛情况。 */
    public int getIterations() { return iterations; }

    /** 该程序点按分析方向应用传递函数后的事实。 */
    public F getFact(Location location) {
        F fact = facts.get(location);
        return fact != null ? fact : bottom;
    }

    public F getBlockEntry(int block) {
        F fact = blockEntry.get(block);
        return fact != null ? fact : bottom;
    }

    public F getBlockExit(int block) {
        F fact = blockExit.get(block);
        return fact != null ? fact : bottom;
    }

    public boolean isAnalyzed(int block) {
        return blockEntry.containsKey(block);
    }

    /**
     * 程序顺序下，该程序点执行之前的事实。
     */
    public F before(Location location) {
        if (direction == Direction.BACKWARD) {
            return getFact(location);
        }
        if (location.getStatementIndex() == 0) {
            return getBlockEntry(location.getBlock());
        }
        return getFact(new Location(location.getBlock(), location.getStatementIndex() - 1));
    }

    /**
     * 程序顺序下，该程序点执行之后的事实。
     */
    public F after(Location location) {
        if (direction == Direction.FORWARD) {
            return getFact(location);
        }
        Integer count = statementCounts.get(location.getBlock());
        if (count == null || location.getStatementIndex() >= count) {
            return getBlockExit(location.getBlock());
        }
        return getFact(new Location(location.getBlock(), location.getStatementIndex() + 1));
    }
}
