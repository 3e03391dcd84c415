package com.aetherlang.ir.dataflow;

import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;

import java.util.List;

/**
 * 数据流问题描述。
 * <p>
 * 事实类型 F 必须正确实现 equals；传递函数不得修改传入的事实，而是返回新值。
 * join 必须幂等且单调，否则不动点迭代不保证终止。
 *
 * @param <F> 事实类型
 */
public interface DataflowAnalysis<F> {

    Direction getDirection();

    /**
     * 边界事实：前向分析的入口块输入，后向分析的 Return 块输出。
     */
    F initialFact();

    /**
     * 格的最小元，join 空集合时的结果。
     */
    F bottom();

    F transferStatement(F fact, MirStatement statement, Location location);

    F transferTerminator(F fact, MirTerminator terminator, Location location);

    F join(List<F> facts);
}
