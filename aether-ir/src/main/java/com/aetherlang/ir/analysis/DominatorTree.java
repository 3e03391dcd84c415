package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.Cfg;
import com.aetherlang.ir.mir.MirFunction;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 支配关系与支配树。只覆盖从入口可达的块。
 * <p>
 * 块 id 先按逆后序映射到连续索引，支配集用 BitSet 表示：
 * dom(entry) = {entry}，dom(n) = {n} ∪ ∩{dom(p) | p ∈ preds(n)}，迭代到不动点。
 */
public class DominatorTree {

    private final int entry;
    private final List<Integer> order;            // 索引 → 块 id（逆后序）
    private final Map<Integer, Integer> idToIdx;   // 块 id → 索引
    private final BitSet[] dom;
    private final int[] idom;                      // 索引 → 直接支配者索引，入口为 -1
    private final Map<Integer, List<Integer>> children = new HashMap<>();

    private DominatorTree(int entry, List<Integer> order, Map<Integer, Integer> idToIdx,
                          BitSet[] dom, int[] idom) {
        this.entry = entry;
        this.order = order;
        this.idToIdx = idToIdx;
        this.dom = dom;
        this.idom = idom;
        for (int i = 0; i < order.size(); i++) {
            children.put(order.get(i), new ArrayList<Integer>());
        }
        for (int i = 0; i < order.size(); i++) {
            if (idom[i] >= 0) children.get(order.get(idom[i])).add(order.get(i));
        }
    }

    public static DominatorTree compute(MirFunction function) {
        List<Integer> rpo = Cfg.reversePostorder(function);
        int n = rpo.size();
        Map<Integer, Integer> idToIdx = new HashMap<>();
        for (int i = 0; i < n; i++) idToIdx.put(rpo.get(i), i);

        // ---- 前驱（索引形式，只保留可达块） ----
        Map<Integer, List<Integer>> predMap = Cfg.predecessors(function);
        int[][] preds = new int[n][];
        for (int i = 0; i < n; i++) {
            List<Integer> ps = new ArrayList<>();
            for (int p : predMap.get(rpo.get(i))) {
                Integer idx = idToIdx.get(p);
                if (idx != null) ps.add(idx);
            }
            preds[i] = new int[ps.size()];
            for (int k = 0; k < ps.size(); k++) preds[i][k] = ps.get(k);
        }

        // ---- 支配集 ----
        BitSet[] dom = new BitSet[n];
        for (int i = 0; i < n; i++) {
            dom[i] = new BitSet(n);
            if (i == 0) {
                dom[i].set(0);
            } else {
                dom[i].set(0, n);
            }
        }
        BitSet temp = new BitSet(n);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 1; i < n; i++) {
                temp.set(0, n);
                for (int p : preds[i]) temp.and(dom[p]);
                temp.set(i);
                if (!temp.equals(dom[i])) {
                    dom[i] = (BitSet) temp.clone();
                    changed = true;
                }
            }
        }

        // ---- 直接支配者：严格支配者中被其余所有严格支配者支配的那一个 ----
        int[] idom = new int[n];
        for (int i = 0; i < n; i++) {
            idom[i] = -1;
            if (i == 0) continue;
            for (int d = dom[i].nextSetBit(0); d >= 0; d = dom[i].nextSetBit(d + 1)) {
                if (d == i) continue;
                boolean immediate = true;
                for (int s = dom[i].nextSetBit(0); s >= 0; s = dom[i].nextSetBit(s + 1)) {
                    if (s == i || s == d) continue;
                    if (!dom[d].get(s)) {
                        immediate = false;
                        break;
                    }
                }
                if (immediate) {
                    idom[i] = d;
                    break;
                }
            }
        }
        int entry = n > 0 ? rpo.get(0) : function.getEntryBlock();
        return new DominatorTree(entry, rpo, idToIdx, dom, idom);
    }

    public int getEntry() { return entry; }

    /** 可达块的逆后序。 */
    public List<Integer> getReversePostorder() {
        return Collections.unmodifiableList(order);
    }

    public boolean isReachable(int block) {
        return idToIdx.containsKey(block);
    }

    /** a 是否支配 b（自反）。不可达块不参与支配关系。 */
    public boolean dominates(int a, int b) {
        Integer ia = idToIdx.get(a);
        Integer ib = idToIdx.get(b);
        return ia != null && ib != null && dom[ib].get(ia);
    }

    public boolean strictlyDominates(int a, int b) {
        return a != b && dominates(a, b);
    }

    /** 直接支配者，入口或不可达块返回 -1。 */
    public int getImmediateDominator(int block) {
        Integer idx = idToIdx.get(block);
        if (idx == null || idom[idx] < 0) return -1;
        return order.get(idom[idx]);
    }

    public List<Integer> getChildren(int block) {
        List<Integer> list = children.get(block);
        return list != null ? Collections.unmodifiableList(list) : Collections.<Integer>emptyList();
    }

    /** block 的全部支配者（含自身），按逆后序。 */
    public Set<Integer> getDominators(int block) {
        Set<Integer> result = new LinkedHashSet<>();
        Integer idx = idToIdx.get(block);
        if (idx == null) return result;
        for (int d = dom[idx].nextSetBit(0); d >= 0; d = dom[idx].nextSetBit(d + 1)) {
            result.add(order.get(d));
        }
        return result;
    }
}
