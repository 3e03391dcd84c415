package com.aetherlang.ir.pass.local;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Rvalue;

/**
 * 内联成本估计：语句数加终止指令权重（调用 5，分支 2，其余 1）。
 */
public final class InlineCost {

    public static final int CALL_WEIGHT = 5;
    public static final int SWITCH_WEIGHT = 2;
    public static final int DEFAULT_WEIGHT = 1;

    private InlineCost() {}

    public static int cost(MirFunction function) {
        int cost = 0;
        for (BasicBlock block : function.getBlocks()) {
            cost += block.getStatements().size();
            switch (block.getTerminator().getKind()) {
                case CALL:
                    cost += CALL_WEIGHT;
                    break;
                case SWITCH_INT:
                    cost += SWITCH_WEIGHT;
                    break;
                default:
                    cost += DEFAULT_WEIGHT;
                    break;
            }
        }
        return cost;
    }

    /** 函数体内是否直接调用自身。 */
    public static boolean isSelfRecursive(MirFunction function) {
        String name = function.getName();
        for (BasicBlock block : function.getBlocks()) {
            for (MirStatement stmt : block.getStatements()) {
                if (stmt instanceof MirStatement.Assign) {
                    Rvalue rv = ((MirStatement.Assign) stmt).getRvalue();
                    if (rv instanceof Rvalue.Call && name.equals(((Rvalue.Call) rv).getCalleeName())) return true;
                }
            }
            MirTerminator term = block.getTerminator();
            if (term instanceof MirTerminator.Call && name.equals(((MirTerminator.Call) term).getCalleeName())) {
                return true;
            }
        }
        return false;
    }

    /** 单函数层面的内联门槛：成本不超过阈值且不自递归。 */
    public static boolean isCandidate(MirFunction function, int threshold) {
        return cost(function) <= threshold && !isSelfRecursive(function);
    }
}
