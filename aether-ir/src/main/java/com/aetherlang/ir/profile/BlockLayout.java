package com.aetherlang.ir.profile;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.Cfg;
import com.aetherlang.ir.mir.MirFunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 基于块计数的块布局。
 * <p>
 * 入口块固定在最前；其余块按执行次数降序（次数相同按块 id），冷块排在最后。
 * 对高度偏向的热分支（概率 &gt; 0.8 且总次数超过热块阈值），把计数最高的后继拉到该块之后，
 * 形成直通路径。没有计数的块按 0 次处理。
 */
public class BlockLayout {

    static final double LIKELY_BRANCH_PROBABILITY = 0.8;

    private final long hotBlockThreshold;
    private final long coldBlockThreshold;

    public BlockLayout(long hotBlockThreshold, long coldBlockThreshold) {
        this.hotBlockThreshold = hotBlockThreshold;
        this.coldBlockThreshold = coldBlockThreshold;
    }

    public boolean isHot(long count) {
        return count > hotBlockThreshold;
    }

    public boolean isCold(long count) {
        return count < coldBlockThreshold;
    }

    /**
     * 计算函数的新块顺序，结果是当前块集合的一个排列。
     */
    public List<Integer> compute(MirFunction function, ProfileData profile) {
        final String name = function.getName();
        final Map<Integer, Long> counts = profile.getBlockCounts(name);
        int entry = function.getEntryBlock();

        List<Integer> hot = new ArrayList<>();
        List<Integer> cold = new ArrayList<>();
        for (int id : function.getBlockIds()) {
            if (id == entry) continue;
            if (isCold(countOf(counts, id))) {
                cold.add(id);
            } else {
                hot.add(id);
            }
        }
        Comparator<Integer> byCount = new Comparator<Integer>() {
            @Override
            public int compare(Integer a, Integer b) {
                int c = Long.compare(countOf(counts, b), countOf(counts, a));
                return c != 0 ? c : Integer.compare(a, b);
            }
        };
        Collections.sort(hot, byCount);
        Collections.sort(cold, byCount);

        List<Integer> order = new ArrayList<>();
        if (function.hasBlock(entry)) order.add(entry);
        order.addAll(hot);
        order.addAll(cold);

        for (int id : new ArrayList<>(order)) {
            ProfileData.BranchProfile branch = profile.getBranch(name, id);
            if (branch == null || branch.getProbability() <= LIKELY_BRANCH_PROBABILITY
                    || !isHot(branch.getTotal())) {
                continue;
            }
            int likely = likelySuccessor(function.getBlock(id), counts);
            if (likely < 0 || likely == entry || likely == id || !order.contains(likely)) continue;
            order.remove(Integer.valueOf(likely));
            order.add(order.indexOf(id) + 1, likely);
        }
        return order;
    }

    /** 计数最高的后继，次数相同取先出现者；没有后继时为 -1。 */
    private static int likelySuccessor(BasicBlock block, Map<Integer, Long> counts) {
        int best = -1;
        long bestCount = -1;
        for (int succ : Cfg.successors(block)) {
            long c = countOf(counts, succ);
            if (c > bestCount) {
                best = succ;
                bestCount = c;
            }
        }
        return best;
    }

    private static long countOf(Map<Integer, Long> counts, int block) {
        Long c = counts.get(block);
        return c != null ? c : 0L;
    }
}
