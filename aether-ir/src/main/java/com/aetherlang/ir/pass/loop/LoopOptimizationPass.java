package com.aetherlang.ir.pass.loop;

import com.aetherlang.ir.analysis.InductionVariables;
import com.aetherlang.ir.analysis.LocalUsage;
import com.aetherlang.ir.analysis.LoopBounds;
import com.aetherlang.ir.analysis.LoopForest;
import com.aetherlang.ir.analysis.LoopInfo;
import com.aetherlang.ir.analysis.LoopInvarianceAnalysis;
import com.aetherlang.ir.dataflow.DataflowResults;
import com.aetherlang.ir.dataflow.LivenessAnalysis;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.ConstantValue;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirLocal;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.MirPass;
import com.aetherlang.ir.pass.OptimizerConfig;
import com.aetherlang.ir.pass.PassContext;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * 循环优化：不变量外提、强度削弱与完全展开。
 * <p>
 * 三种变换依次执行，每次改写 CFG 后都重新计算循环森林，
 * 不在失效的分析结果上继续修改。
 */
public class LoopOptimizationPass implements MirPass {

    private static final Logger LOG = Logger.getLogger(LoopOptimizationPass.class.getName());

    @Override
    public String getName() {
        return "loop";
    }

    @Override
    public boolean runOnFunction(MirFunction function, PassContext context) {
        OptimizerConfig config = context.getConfig();
        int hoisted = 0;
        for (int n = hoistInvariants(function, config); n > 0; n = hoistInvariants(function, config)) {
            hoisted += n;
        }
        int reduced = 0;
        while (reduceStrength(function)) reduced++;
        int unrolled = 0;
        while (unrollLoop(function, config)) unrolled++;

        if (hoisted + reduced + unrolled > 0) {
            LOG.fine(function.getName() + ": 外提 " + hoisted + " 条语句, 强度削弱 " + reduced
                    + " 处, 展开 " + unrolled + " 个循环");
            return true;
        }
        return false;
    }

    // ==================== 不变量外提 ====================

    /**
     * 处理第一个有可外提语句的循环（内层优先）。
     *
     * @return 外提的语句数
     */
    int hoistInvariants(MirFunction function, OptimizerConfig config) {
        LoopForest forest = LoopForest.compute(function);
        if (forest.isEmpty()) return 0;
        DataflowResults<Set<Integer>> liveness = LivenessAnalysis.compute(function);
        Set<Integer> addressTaken = LocalUsage.addressTaken(function);

        for (LoopInfo loop : forest.getLoopsInnermostFirst()) {
            // 不可能到达 return 的循环没有活跃性信息
            if (!liveness.isAnalyzed(loop.getHeader())) continue;
            Set<Integer> liveAtHeader = liveness.getBlockEntry(loop.getHeader());
            List<LoopInvarianceAnalysis.InvariantStatement> invariants =
                    LoopInvarianceAnalysis.analyze(function, loop, liveAtHeader, addressTaken);

            // 依赖在前，只有依赖全部外提的语句才能外提
            Set<Integer> invariantDests = new HashSet<>();
            for (LoopInvarianceAnalysis.InvariantStatement inv : invariants) {
                invariantDests.add(inv.getDefinedLocal());
            }
            Set<Integer> hoistedDests = new HashSet<>();
            List<LoopInvarianceAnalysis.InvariantStatement> selected = new ArrayList<>();
            for (LoopInvarianceAnalysis.InvariantStatement inv : invariants) {
                if (!inv.isSafeToHoist() || inv.getProfit() < config.getMinHoistProfit()) continue;
                if (readsIndexedPlace(inv.getStatement().getRvalue())) continue;
                if (!dependenciesHoisted(inv.getStatement().getRvalue(), invariantDests, hoistedDests)) continue;
                selected.add(inv);
                hoistedDests.add(inv.getDefinedLocal());
            }
            if (selected.isEmpty()) continue;

            int preheader = ensurePreheader(function, loop, forest.getPredecessors());
            BasicBlock target = function.getBlock(preheader);
            Map<Integer, List<Integer>> removals = new TreeMap<>();
            for (LoopInvarianceAnalysis.InvariantStatement inv : selected) {
                target.addStatement(inv.getStatement());
                Location loc = inv.getLocation();
                List<Integer> indices = removals.get(loc.getBlock());
                if (indices == null) {
                    indices = new ArrayList<>();
                    removals.put(loc.getBlock(), indices);
                }
                indices.add(loc.getStatementIndex());
                LOG.fine(function.getName() + ": 外提 " + inv.getStatement() + " 到 B" + preheader);
            }
            for (Map.Entry<Integer, List<Integer>> e : removals.entrySet()) {
                List<Integer> indices = e.getValue();
                Collections.sort(indices, Collections.<Integer>reverseOrder());
                List<MirStatement> stmts = function.getBlock(e.getKey()).getStatements();
                for (int index : indices) stmts.remove(index);
            }
            return selected.size();
        }
        return 0;
    }

    /** 数组下标读取可能越界，不提到可能不执行它的位置。 */
    private static boolean readsIndexedPlace(Rvalue rvalue) {
        for (Operand op : rvalue.getOperands()) {
            if (op.getPlace() == null) continue;
            Set<Integer> indexLocals = new HashSet<>();
            op.getPlace().collectIndexLocals(indexLocals);
            if (!indexLocals.isEmpty()) return true;
        }
        return false;
    }

    private static boolean dependenciesHoisted(Rvalue rvalue, Set<Integer> invariantDests, Set<Integer> hoistedDests) {
        Set<Integer> reads = new HashSet<>();
        rvalue.collectReadLocals(reads);
        for (int local : reads) {
            if (invariantDests.contains(local) && !hoistedDests.contains(local)) return false;
        }
        return true;
    }

    /**
     * 返回只跳转到循环头的循环外前驱块，不存在时新建一个并把所有循环外的入边改到它上面。
     */
    static int ensurePreheader(MirFunction function, LoopInfo loop, Map<Integer, List<Integer>> predecessors) {
        final int header = loop.getHeader();
        int existing = loop.getPreheader();
        if (existing >= 0) {
            MirTerminator term = function.getBlock(existing).getTerminator();
            if (term instanceof MirTerminator.Goto && ((MirTerminator.Goto) term).getTarget() == header) {
                return existing;
            }
        }
        final BasicBlock preheader = function.newBlock();
        preheader.setTerminator(MirTerminator.goTo(header));
        List<Integer> preds = predecessors.get(header);
        if (preds != null) {
            for (int p : preds) {
                if (loop.contains(p)) continue;
                BasicBlock block = function.getBlock(p);
                block.setTerminator(block.getTerminator().mapTargets(t -> t == header ? preheader.getId() : t));
            }
        }
        if (function.getEntryBlock() == header) {
            function.setEntryBlock(preheader.getId());
        }
        LOG.fine(function.getName() + ": 为 B" + header + " 创建前置块 B" + preheader.getId());
        return preheader.getId();
    }

    // ==================== 强度削弱 ====================

    /**
     * 将第一个 j = i * c（i 为基本归纳变量）改写为增量形式：
     * 前置块中 t = i * c，i 更新之后紧接 t = t + c*step，原语句改为 j = t。
     */
    boolean reduceStrength(MirFunction function) {
        LoopForest forest = LoopForest.compute(function);
        for (LoopInfo loop : forest.getLoopsInnermostFirst()) {
            InductionVariables ivs = forest.getInductionVariables(loop.getHeader());
            if (ivs == null || ivs.getDerived().isEmpty()) continue;
            for (InductionVariables.Derived derived : ivs.getDerived()) {
                if (derived.getOp() != BinOp.MUL) continue;
                InductionVariables.Basic basic = ivs.findBasic(derived.getBase());
                if (basic == null || !(derived.getFactor().getValue() instanceof ConstantValue.Int)) continue;
                BigInteger factor = ((ConstantValue.Int) derived.getFactor().getValue()).getValue();
                MirLocal target = function.getLocal(derived.getLocal());

                int preheader = ensurePreheader(function, loop, forest.getPredecessors());
                String name = target.getName() != null ? target.getName() + "_sr" : null;
                int t = function.newLocal(name, target.getType());
                Location def = derived.getDefinition();
                MirStatement.Assign original =
                        (MirStatement.Assign) function.getBlock(def.getBlock()).getStatements().get(def.getStatementIndex());

                function.getBlock(preheader).addStatement(MirStatement.assign(t, original.getRvalue()));
                function.getBlock(def.getBlock()).getStatements().set(def.getStatementIndex(),
                        original.withRvalue(Rvalue.use(Operand.copy(t))));
                Constant increment = Constant.ofInt(factor.multiply(basic.getStep()), target.getType());
                Location inc = basic.getDefinition();
                function.getBlock(inc.getBlock()).getStatements().add(inc.getStatementIndex() + 1,
                        MirStatement.assign(t, Rvalue.binary(BinOp.ADD, Operand.copy(t), Operand.constant(increment))));
                LOG.fine(function.getName() + ": 强度削弱 _" + derived.getLocal() + " = _" + basic.getLocal()
                        + " * " + factor + " -> _" + t + " += " + increment.getValue());
                return true;
            }
        }
        return false;
    }

    // ==================== 完全展开 ====================

    /**
     * 完全展开第一个满足条件的计数循环。
     */
    boolean unrollLoop(MirFunction function, OptimizerConfig config) {
        LoopForest forest = LoopForest.compute(function);
        for (LoopInfo loop : forest.getLoopsInnermostFirst()) {
            if (!canUnroll(loop, config)) continue;
            unroll(function, loop);
            LOG.fine(function.getName() + ": 完全展开循环 B" + loop.getHeader() + "（" + loop.getTripCount() + " 次）");
            return true;
        }
        return false;
    }

    /**
     * 只处理唯一出口在循环头、且出口唯一的计数循环。
     */
    static boolean canUnroll(LoopInfo loop, OptimizerConfig config) {
        if (!loop.hasKnownTripCount() || loop.getBounds() == null) return false;
        if (loop.getTripCount() > config.getMaxUnrollTripCount()) return false;
        if (loop.getBlocks().size() > config.getMaxUnrollBlocks()) return false;
        if (!loop.getChildren().isEmpty()) return false;
        return loop.getExitBlocks().size() == 1 && loop.getExitBlocks().contains(loop.getHeader())
                && loop.getExitTargets().size() == 1;
    }

    /**
     * 复制 tripCount 份循环体，第 k 份的回边指向第 k+1 份的头块，
     * 最后追加一份只含头块语句、直接跳到出口的块。原循环块充当第 0 份。
     */
    private static void unroll(MirFunction function, LoopInfo loop) {
        LoopBounds bounds = loop.getBounds();
        final int header = loop.getHeader();
        int trips = (int) loop.getTripCount();
        List<Integer> blocks = new ArrayList<>(loop.getBlocks());
        for (int b : blocks) function.getBlock(b).setVectorWidth(0);

        if (trips == 0) {
            function.getBlock(header).setTerminator(MirTerminator.goTo(bounds.getExitTarget()));
            return;
        }

        Map<Integer, MirTerminator> originalTerms = new HashMap<>();
        for (int b : blocks) originalTerms.put(b, function.getBlock(b).getTerminator());

        List<Map<Integer, Integer>> copies = new ArrayList<>();
        Map<Integer, Integer> identity = new HashMap<>();
        for (int b : blocks) identity.put(b, b);
        copies.add(identity);
        for (int k = 1; k < trips; k++) {
            Map<Integer, Integer> map = new HashMap<>();
            for (int b : blocks) {
                BasicBlock copy = function.newBlock();
                copy.getStatements().addAll(function.getBlock(b).getStatements());
                map.put(b, copy.getId());
            }
            copies.add(map);
        }
        BasicBlock last = function.newBlock();
        last.getStatements().addAll(function.getBlock(header).getStatements());
        last.setTerminator(MirTerminator.goTo(bounds.getExitTarget()));

        for (int k = 0; k < trips; k++) {
            final Map<Integer, Integer> map = copies.get(k);
            final int nextHeader = k + 1 < trips ? copies.get(k + 1).get(header) : last.getId();
            for (int b : blocks) {
                BasicBlock copy = function.getBlock(map.get(b));
                if (b == header) {
                    int body = bounds.getBodyTarget();
                    copy.setTerminator(MirTerminator.goTo(body == header ? nextHeader : map.get(body)));
                } else {
                    copy.setTerminator(originalTerms.get(b).mapTargets(
                            t -> t == header ? nextHeader : map.containsKey(t) ? map.get(t) : t));
                }
            }
        }
    }
}
