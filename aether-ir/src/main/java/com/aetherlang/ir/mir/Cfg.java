package com.aetherlang.ir.mir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CFG 访问器。前驱 / 后继完全由终止指令推导。
 */
public final class Cfg {

    private Cfg() {}

    public static List<Integer> successors(BasicBlock block) {
        return block.getTerminator().getSuccessors();
    }

    /**
     * 前驱表：块 id → 前驱块 id 列表（按布局顺序，去重）。
     * 指向不存在块的边被忽略。
     */
    public static Map<Integer, List<Integer>> predecessors(MirFunction function) {
        Map<Integer, List<Integer>> preds = new LinkedHashMap<>();
        for (int id : function.getBlockIds()) {
            preds.put(id, new ArrayList<Integer>());
        }
        for (BasicBlock block : function.getBlocks()) {
            for (int succ : successors(block)) {
                List<Integer> list = preds.get(succ);
                if (list != null && !list.contains(block.getId())) {
                    list.add(block.getId());
                }
            }
        }
        return preds;
    }

    /**
     * 从入口出发可达的块集合（BFS 顺序）。
     */
    public static Set<Integer> reachable(MirFunction function) {
        Set<Integer> visited = new LinkedHashSet<>();
        if (!function.hasBlock(function.getEntryBlock())) return visited;
        Deque<Integer> worklist = new ArrayDeque<>();
        worklist.add(function.getEntryBlock());
        visited.add(function.getEntryBlock());
        while (!worklist.isEmpty()) {
            BasicBlock block = function.getBlock(worklist.poll());
            for (int succ : successors(block)) {
                if (function.hasBlock(succ) && visited.add(succ)) {
                    worklist.add(succ);
                }
            }
        }
        return visited;
    }

    /**
     * 可达块的逆后序。前向数据流按此顺序收敛最快。
     */
    public static List<Integer> reversePostorder(MirFunction function) {
        List<Integer> postorder = new ArrayList<>();
        if (!function.hasBlock(function.getEntryBlock())) return postorder;
        Set<Integer> visited = new HashSet<>();
        // 显式栈：{blockId, 下一个待访问后继的下标}
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{function.getEntryBlock(), 0});
        visited.add(function.getEntryBlock());
        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            List<Integer> succs = successors(function.getBlock(frame[0]));
            if (frame[1] < succs.size()) {
                int succ = succs.get(frame[1]++);
                if (function.hasBlock(succ) && visited.add(succ)) {
                    stack.push(new int[]{succ, 0});
                }
            } else {
                postorder.add(frame[0]);
                stack.pop();
            }
        }
        Collections.reverse(postorder);
        return postorder;
    }
}
