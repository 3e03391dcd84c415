package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Place;
import com.aetherlang.ir.mir.Rvalue;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 局部变量的定义 / 使用统计。
 */
public final class LocalUsage {

    private LocalUsage() {}

    /**
     * 被取地址（出现在 Ref 中）的局部变量。这些变量可能经由指针被修改。
     */
    public static Set<Integer> addressTaken(MirFunction function) {
        Set<Integer> result = new TreeSet<>();
        for (BasicBlock block : function.getBlocks()) {
            for (MirStatement stmt : block.getStatements()) {
                if (stmt instanceof MirStatement.Assign) {
                    Rvalue rv = ((MirStatement.Assign) stmt).getRvalue();
                    if (rv instanceof Rvalue.Ref) {
                        result.add(((Rvalue.Ref) rv).getPlace().getLocal());
                    }
                }
            }
        }
        return result;
    }

    /**
     * 统计给定块内每个局部变量被写入的次数（含带投影的部分写入与 Call 目标）。
     */
    public static Map<Integer, Integer> writeCounts(MirFunction function, Collection<Integer> blockIds) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (int id : blockIds) {
            BasicBlock block = function.getBlock(id);
            if (block == null) continue;
            for (MirStatement stmt : block.getStatements()) {
                if (stmt instanceof MirStatement.Assign) {
                    counts.merge(((MirStatement.Assign) stmt).getPlace().getLocal(), 1, Integer::sum);
                }
            }
            MirTerminator term = block.getTerminator();
            if (term instanceof MirTerminator.Call) {
                Place dest = ((MirTerminator.Call) term).getDestination();
                if (dest != null) counts.merge(dest.getLocal(), 1, Integer::sum);
            }
        }
        return counts;
    }

    public static Map<Integer, Integer> writeCounts(MirFunction function) {
        return writeCounts(function, function.getBlockIds());
    }

    /**
     * 函数中被读取或以任何形式提及的局部变量（参数总是计入）。
     */
    public static Set<Integer> usedLocals(MirFunction function) {
        Set<Integer> used = new TreeSet<>(function.getParamLocals());
        for (BasicBlock block : function.getBlocks()) {
            for (MirStatement stmt : block.getStatements()) {
                switch (stmt.getKind()) {
                    case ASSIGN:
                        stmt.collectReadLocals(used);
                        break;
                    case STORAGE_LIVE:
                    case STORAGE_DEAD:
                        stmt.collectMentionedLocals(used);
                        break;
                    default:
                        break;
                }
            }
            MirTerminator term = block.getTerminator();
            term.collectReadLocals(used);
            if (term instanceof MirTerminator.Call) {
                Place dest = ((MirTerminator.Call) term).getDestination();
                if (dest != null) dest.collectLocals(used);
            } else if (term.getKind() == MirTerminator.Kind.RETURN && function.hasReturnLocal()) {
                used.add(function.getReturnLocal());
            }
        }
        return used;
    }
}
