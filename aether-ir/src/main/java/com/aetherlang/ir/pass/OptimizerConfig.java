package com.aetherlang.ir.pass;

/**
 * 优化器配置
 */
public class OptimizerConfig {
    private int maxIterations = 10;
    private boolean validateEachPass = true;
    private int inlineThreshold = 20;
    private int maxInlineCallSites = 3;
    private int wholeProgramInlineCost = 10;
    private int maxUnrollTripCount = 16;
    private int maxUnrollBlocks = 5;
    private double minHoistProfit = 10.0;
    private long hotFunctionThreshold = 1000;
    private long hotBlockThreshold = 500;
    private long coldBlockThreshold = 10;
    private int evaluationStepLimit = 10000;

    public OptimizerConfig() {
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public boolean isValidateEachPass() {
        return validateEachPass;
    }

    public void setValidateEachPass(boolean validateEachPass) {
        this.validateEachPass = validateEachPass;
    }

    /** 内联成本上限（语句数加终止指令权重） */
    public int getInlineThreshold() {
        return inlineThreshold;
    }

    public void setInlineThreshold(int inlineThreshold) {
        this.inlineThreshold = inlineThreshold;
    }

    /** 被调函数的调用点不超过该数量时才内联 */
    public int getMaxInlineCallSites() {
        return maxInlineCallSites;
    }

    public void setMaxInlineCallSites(int maxInlineCallSites) {
        this.maxInlineCallSites = maxInlineCallSites;
    }

    public int getWholeProgramInlineCost() {
        return wholeProgramInlineCost;
    }

    public void setWholeProgramInlineCost(int wholeProgramInlineCost) {
        this.wholeProgramInlineCost = wholeProgramInlineCost;
    }

    public int getMaxUnrollTripCount() {
        return maxUnrollTripCount;
    }

    public void setMaxUnrollTripCount(int maxUnrollTripCount) {
        this.maxUnrollTripCount = maxUnrollTripCount;
    }

    public int getMaxUnrollBlocks() {
        return maxUnrollBlocks;
    }

    public void setMaxUnrollBlocks(int maxUnrollBlocks) {
        this.maxUnrollBlocks = maxUnrollBlocks;
    }

    public double getMinHoistProfit() {
        return minHoistProfit;
    }

    public void setMinHoistProfit(double minHoistProfit) {
        this.minHoistProfit = minHoistProfit;
    }

    public long getHotFunctionThreshold() {
        return hotFunctionThreshold;
    }

    public void setHotFunctionThreshold(long hotFunctionThreshold) {
        this.hotFunctionThreshold = hotFunctionThreshold;
    }

    public long getHotBlockThreshold() {
        return hotBlockThreshold;
    }

    public void setHotBlockThreshold(long hotBlockThreshold) {
        this.hotBlockThreshold = hotBlockThreshold;
    }

    public long getColdBlockThreshold() {
        return coldBlockThreshold;
    }

    public void setColdBlockThreshold(long coldBlockThreshold) {
        this.coldBlockThreshold = coldBlockThreshold;
    }

    /** 编译期求值纯函数调用时的最大执行步数 */
    public int getEvaluationStepLimit() {
        return evaluationStepLimit;
    }

    public void setEvaluationStepLimit(int evaluationStepLimit) {
        this.evaluationStepLimit = evaluationStepLimit;
    }
}
