package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.BinOp;

import java.math.BigInteger;

/**
 * 计数循环的边界：归纳变量从 initial 以 step 递进，在 (iv comparison limit) 为真时继续。
 */
public class LoopBounds {

    private final int inductionVariable;
    private final BigInteger initial;
    private final BigInteger limit;
    private final BigInteger step;
    /** 归一化后的继续条件：iv comparison limit */
    private final BinOp comparison;
    /** 头块中计算比较结果的语句下标 */
    private final int conditionIndex;
    /** 比较为真时留在循环内的目标块 */
    private final int bodyTarget;
    private final int exitTarget;

    public LoopBounds(int inductionVariable, BigInteger initial, BigInteger limit, BigInteger step,
                      BinOp comparison, int conditionIndex, int bodyTarget, int exitTarget) {
        this.inductionVariable = inductionVariable;
        this.initial = initial;
        this.limit = limit;
        this.step = step;
        this.comparison = comparison;
        this.conditionIndex = conditionIndex;
        this.bodyTarget = bodyTarget;
        this.exitTarget = exitTarget;
    }

    public int getInductionVariable() { return inductionVariable; }
    public BigInteger getInitial() { return initial; }
    public BigInteger getLimit() { return limit; }
    public BigInteger getStep() { return step; }
    public BinOp getComparison() { return comparison; }
    public int getConditionIndex() { return conditionIndex; }
    public int getBodyTarget() { return bodyTarget; }
    public int getExitTarget() { return exitTarget; }

    @Override
    public String toString() {
        return "_" + inductionVariable + " = " + initial + "; _" + inductionVariable + " "
                + comparison.getSymbol() + " " + limit + "; += " + step;
    }
}
