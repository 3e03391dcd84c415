package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirParam;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 局部变量逃逸分析。
 * <p>
 * 种子：调用参数、返回值局部变量、经 Deref 写出的值。
 * 若 d 逃逸且 d 的值来自 y（引用、复制、聚合或转换），则 y 也逃逸。
 */
public final class EscapeAnalysis {

    private EscapeAnalysis() {}

    public static Set<Integer> escapingLocals(MirFunction function) {
        Set<Integer> escaping = new TreeSet<>();
        Map<Integer, List<Integer>> flowsFrom = new HashMap<>();

        for (BasicBlock block : function.getBlocks()) {
            for (MirStatement stmt : block.getStatements()) {
                if (!(stmt instanceof MirStatement.Assign)) continue;
                MirStatement.Assign assign = (MirStatement.Assign) stmt;
                Rvalue rv = assign.getRvalue();
                if (rv instanceof Rvalue.Call) {
                    addDirectLocals(escaping, ((Rvalue.Call) rv).getArgs());
                }
                Set<Integer> sources = new TreeSet<>();
                if (rv instanceof Rvalue.Ref) {
                    sources.add(((Rvalue.Ref) rv).getPlace().getLocal());
                } else if (rv instanceof Rvalue.Use || rv instanceof Rvalue.Aggregate || rv instanceof Rvalue.Cast) {
                    for (Operand op : rv.getOperands()) {
                        if (op.getPlace() != null) sources.add(op.getPlace().getLocal());
                    }
                }
                if (assign.getPlace().hasDeref()) {
                    escaping.addAll(sources);
                } else {
                    List<Integer> list = flowsFrom.get(assign.getPlace().getLocal());
                    if (list == null) {
                        list = new ArrayList<>();
                        flowsFrom.put(assign.getPlace().getLocal(), list);
                    }
                    list.addAll(sources);
                }
            }
            MirTerminator term = block.getTerminator();
            if (term instanceof MirTerminator.Call) {
                addDirectLocals(escaping, ((MirTerminator.Call) term).getArgs());
            }
        }
        if (function.hasReturnLocal()) escaping.add(function.getReturnLocal());

        Deque<Integer> worklist = new ArrayDeque<>(escaping);
        while (!worklist.isEmpty()) {
            List<Integer> sources = flowsFrom.get(worklist.poll());
            if (sources == null) continue;
            for (int src : sources) {
                if (escaping.add(src)) worklist.add(src);
            }
        }
        return escaping;
    }

    /** 逃逸参数的下标。 */
    public static Set<Integer> escapingParameters(MirFunction function, Set<Integer> escaping) {
        Set<Integer> result = new TreeSet<>();
        List<MirParam> params = function.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (escaping.contains(params.get(i).getLocal())) result.add(i);
        }
        return result;
    }

    private static void addDirectLocals(Set<Integer> out, List<Operand> operands) {
        for (Operand op : operands) {
            if (op.getPlace() != null) out.add(op.getPlace().getLocal());
        }
    }
}
