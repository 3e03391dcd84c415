package com.aetherlang.ir.profile;

import java.util.Map;

/**
 * 剖析数据的汇总统计。
 */
public class ProfileStatistics {

    private final int totalFunctions;
    private final int totalBlocks;
    private final int totalBranches;
    private final int totalCalls;
    private final int totalLoops;
    private final long totalExecutionCount;
    private final String hottestFunction;
    private final long hottestCount;
    private final int hotFunctionCount;

    private ProfileStatistics(int totalFunctions, int totalBlocks, int totalBranches, int totalCalls,
                              int totalLoops, long totalExecutionCount, String hottestFunction,
                              long hottestCount, int hotFunctionCount) {
        this.totalFunctions = totalFunctions;
        this.totalBlocks = totalBlocks;
        this.totalBranches = totalBranches;
        this.totalCalls = totalCalls;
        this.totalLoops = totalLoops;
        this.totalExecutionCount = totalExecutionCount;
        this.hottestFunction = hottestFunction;
        this.hottestCount = hottestCount;
        this.hotFunctionCount = hotFunctionCount;
    }

    /**
     * @param hotFunctionThreshold 执行次数超过该值的函数计为热函数
     */
    public static ProfileStatistics of(ProfileData data, long hotFunctionThreshold) {
        long total = 0;
        String hottest = null;
        long hottestCount = 0;
        int hot = 0;
        for (Map.Entry<String, Long> e : data.getFunctionCounts().entrySet()) {
            long count = e.getValue();
            total += count;
            if (hottest == null || count > hottestCount) {
                hottest = e.getKey();
                hottestCount = count;
            }
            if (count > hotFunctionThreshold) hot++;
        }
        return new ProfileStatistics(data.getFunctionCounts().size(), data.blockRecordCount(),
                data.branchRecordCount(), data.callRecordCount(), data.loopRecordCount(),
                total, hottest, hottestCount, hot);
    }

    public int getTotalFunctions() { return totalFunctions; }
    public int getTotalBlocks() { return totalBlocks; }
    public int getTotalBranches() { return totalBranches; }
    public int getTotalCalls() { return totalCalls; }
    public int getTotalLoops() { return totalLoops; }
    public long getTotalExecutionCount() { return totalExecutionCount; }
    /** 执行次数最多的函数，没有函数记录时为 null。 */
    public String getHottestFunction() { return hottestFunction; }
    public long getHottestCount() { return hottestCount; }
    public int getHotFunctionCount() { return hotFunctionCount; }

    @Override
    public String toString() {
        return "functions=" + totalFunctions + ", blocks=" + totalBlocks + ", branches=" + totalBranches
                + ", calls=" + totalCalls + ", loops=" + totalLoops + ", executions=" + totalExecutionCount
                + (hottestFunction != null ? ", hottest=" + hottestFunction + "(" + hottestCount + ")" : "")
                + ", hot=" + hotFunctionCount;
    }
}
