package com.aetherlang.ir.pass.loop;

import com.aetherlang.ir.analysis.DependenceAnalysis;
import com.aetherlang.ir.analysis.InductionVariables;
import com.aetherlang.ir.analysis.LocalUsage;
import com.aetherlang.ir.analysis.LoopForest;
import com.aetherlang.ir.analysis.LoopInfo;
import com.aetherlang.ir.dataflow.DataflowResults;
import com.aetherlang.ir.dataflow.LivenessAnalysis;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirLocal;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Place;
import com.aetherlang.ir.mir.Projection;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.MirPass;
import com.aetherlang.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 自动向量化。
 * <p>
 * MIR 没有向量类型，向量化的结果是在循环头块上记录选定的通道数，由代码生成展开为 SIMD 指令。
 * 只处理最内层循环；存在循环携带依赖或经指针访问时不向量化。
 */
public class VectorizationPass implements MirPass {

    private static final Logger LOG = Logger.getLogger(VectorizationPass.class.getName());

    /** 可向量化语句的最大通道数 */
    static final int MAX_WIDTH = 16;

    public enum AccessPattern {
        SEQUENTIAL(1.0),
        STRIDED(0.5),
        BROADCAST(0.3),
        IRREGULAR(-1.0);

        private final double bonus;

        AccessPattern(double bonus) {
            this.bonus = bonus;
        }

        public double getBonus() { return bonus; }
    }

    /** 一条候选语句。 */
    public static class Candidate {
        private final MirStatement.Assign statement;
        private final MirType elementType;
        private final AccessPattern pattern;

        Candidate(MirStatement.Assign statement, MirType elementType, AccessPattern pattern) {
            this.statement = statement;
            this.elementType = elementType;
            this.pattern = pattern;
        }

        public MirStatement.Assign getStatement() { return statement; }
        public MirType getElementType() { return elementType; }
        public AccessPattern getPattern() { return pattern; }
    }

    @Override
    public String getName() {
        return "vectorize";
    }

    @Override
    public boolean runOnFunction(MirFunction function, PassContext context) {
        LoopForest forest = LoopForest.compute(function);
        if (forest.isEmpty()) return false;
        DataflowResults<Set<Integer>> liveness = LivenessAnalysis.compute(function);
        Set<Integer> addressTaken = LocalUsage.addressTaken(function);

        boolean changed = false;
        for (LoopInfo loop : forest.getLoopsInnermostFirst()) {
            if (!loop.getChildren().isEmpty()) continue;
            InductionVariables ivs = forest.getInductionVariables(loop.getHeader());
            if (ivs == null || ivs.getBasic().isEmpty()) continue;

            List<Candidate> candidates = findCandidates(function, loop, ivs);
            if (candidates.isEmpty()) continue;
            Set<Integer> liveAtHeader = liveness.isAnalyzed(loop.getHeader())
                    ? liveness.getBlockEntry(loop.getHeader()) : new HashSet<Integer>();
            if (!isLegal(forest, loop, ivs, candidates, liveAtHeader, addressTaken)) {
                LOG.fine(function.getName() + ": 循环 B" + loop.getHeader() + " 存在循环携带依赖，不向量化");
                continue;
            }

            double score = benefitScore(candidates, loop);
            int width = vectorWidth(candidates);
            if (score <= 1.0 || width <= 1) continue;
            BasicBlock header = function.getBlock(loop.getHeader());
            if (header.getVectorWidth() != width) {
                header.setVectorWidth(width);
                changed = true;
                LOG.fine(function.getName() + ": 向量化循环 B" + loop.getHeader() + ", 宽度 " + width
                        + ", 收益 " + score);
            }
        }
        return changed;
    }

    // ==================== 候选语句 ====================

    /**
     * 循环内的算术、一元与加载语句，结果为数值或布尔类型。
     * 归纳变量的更新与循环头的分支条件不计入。
     */
    static List<Candidate> findCandidates(MirFunction function, LoopInfo loop, InductionVariables ivs) {
        Set<Integer> control = new HashSet<>();
        for (InductionVariables.Basic basic : ivs.getBasic()) control.add(basic.getLocal());
        MirTerminator headerTerm = function.getBlock(loop.getHeader()).getTerminator();
        if (headerTerm instanceof MirTerminator.SwitchInt) {
            int cond = ((MirTerminator.SwitchInt) headerTerm).getDiscriminant().getDirectLocal();
            if (cond >= 0) control.add(cond);
        }

        List<Candidate> result = new ArrayList<>();
        for (int blockId : loop.getBlocks()) {
            for (MirStatement stmt : function.getBlock(blockId).getStatements()) {
                if (!(stmt instanceof MirStatement.Assign)) continue;
                MirStatement.Assign assign = (MirStatement.Assign) stmt;
                Rvalue rv = assign.getRvalue();
                if (!(rv instanceof Rvalue.BinaryOp || rv instanceof Rvalue.UnaryOp || rv instanceof Rvalue.Use)) {
                    continue;
                }
                if (!assign.getPlace().hasProjection() && control.contains(assign.getPlace().getLocal())) continue;
                MirType type = placeType(function, assign.getPlace());
                if (type == null || !type.isVectorizable()) continue;
                result.add(new Candidate(assign, type, accessPattern(rv, ivs)));
            }
        }
        return result;
    }

    /**
     * 常量操作数为广播；以基本归纳变量为下标或不带投影为顺序访问；
     * 以派生归纳变量为下标为跨步访问；其余为不规则访问。
     */
    static AccessPattern accessPattern(Rvalue rvalue, InductionVariables ivs) {
        AccessPattern result = AccessPattern.SEQUENTIAL;
        for (Operand op : rvalue.getOperands()) {
            if (op.isConstant()) return AccessPattern.BROADCAST;
        }
        for (Operand op : rvalue.getOperands()) {
            Place place = op.getPlace();
            for (Projection proj : place.getProjection()) {
                if (proj instanceof Projection.Index) {
                    int index = ((Projection.Index) proj).getLocal();
                    if (ivs.findBasic(index) != null) continue;
                    if (isDerived(ivs, index)) {
                        result = AccessPattern.STRIDED;
                        continue;
                    }
                    return AccessPattern.IRREGULAR;
                }
                if (proj.getKind() == Projection.Kind.DEREF) return AccessPattern.IRREGULAR;
            }
        }
        return result;
    }

    private static boolean isDerived(InductionVariables ivs, int local) {
        for (InductionVariables.Derived d : ivs.getDerived()) {
            if (d.getLocal() == local) return true;
        }
        return false;
    }

    /** place 的元素类型，经过字段或无法确定时返回 null。 */
    static MirType placeType(MirFunction function, Place place) {
        MirLocal local = function.getLocal(place.getLocal());
        if (local == null) return null;
        MirType type = local.getType();
        for (Projection proj : place.getProjection()) {
            switch (proj.getKind()) {
                case INDEX:
                case DEREF:
                    type = type.getElementType();
                    break;
                case FIELD:
                    type = ((Projection.Field) proj).getType();
                    break;
                default:
                    return null;
            }
            if (type == null) return null;
        }
        return type;
    }

    // ==================== 合法性与收益 ====================

    private static boolean isLegal(LoopForest forest, LoopInfo loop, InductionVariables ivs,
                                   List<Candidate> candidates, Set<Integer> liveAtHeader,
                                   Set<Integer> addressTaken) {
        for (Candidate c : candidates) {
            if (c.getStatement().getPlace().hasDeref()) return false;
            if (addressTaken.contains(c.getStatement().getPlace().getLocal())) return false;
        }
        Set<Integer> ignored = new HashSet<>();
        for (InductionVariables.Basic basic : ivs.getBasic()) ignored.add(basic.getLocal());
        return !DependenceAnalysis.hasLoopCarried(
                DependenceAnalysis.analyzeLoop(forest, loop, liveAtHeader, addressTaken), ignored);
    }

    static double benefitScore(List<Candidate> candidates, LoopInfo loop) {
        double score = candidates.size() * 2.0;
        if (loop.hasKnownTripCount()) score *= 1.5;
        for (Candidate c : candidates) score += c.getPattern().getBonus();
        if (loop.hasKnownTripCount() && loop.getTripCount() < 8) score *= 0.5;
        return score;
    }

    static int vectorWidth(List<Candidate> candidates) {
        int width = MAX_WIDTH;
        for (Candidate c : candidates) width = Math.min(width, c.getElementType().getSimdLanes());
        return width;
    }
}
