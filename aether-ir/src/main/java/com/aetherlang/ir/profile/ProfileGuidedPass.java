package com.aetherlang.ir.profile;

import com.aetherlang.ir.analysis.CallGraph;
import com.aetherlang.ir.analysis.CallSite;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.pass.MirPass;
import com.aetherlang.ir.pass.OptimizerConfig;
import com.aetherlang.ir.pass.PassContext;
import com.aetherlang.ir.pass.local.Inliner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * 剖析引导优化。
 * <p>
 * 1. 对每条 CALL 记录做内联决策，ALWAYS_INLINE 与热调用者上的 INLINE_HOT 真正执行内联；
 * 2. 按块计数重排每个函数的块布局。
 * 无法落实的决策（函数不存在、递归被调者、块不存在）记为警告。
 */
public class ProfileGuidedPass implements MirPass {

    private static final Logger LOG = Logger.getLogger(ProfileGuidedPass.class.getName());

    private final ProfileData profile;

    public ProfileGuidedPass(ProfileData profile) {
        this.profile = profile;
    }

    public ProfileData getProfile() {
        return profile;
    }

    @Override
    public String getName() {
        return "profile-guided";
    }

    @Override
    public boolean isProgramLevel() {
        return true;
    }

    @Override
    public boolean runOnFunction(MirFunction function, PassContext context) {
        OptimizerConfig config = context.getConfig();
        return reorderBlocks(function, new BlockLayout(config.getHotBlockThreshold(), config.getColdBlockThreshold()),
                context);
    }

    @Override
    public boolean runOnProgram(MirProgram program, PassContext context) {
        boolean changed = applyInlineDecisions(program, context);

        OptimizerConfig config = context.getConfig();
        BlockLayout layout = new BlockLayout(config.getHotBlockThreshold(), config.getColdBlockThreshold());
        for (String name : profile.getProfiledFunctions()) {
            MirFunction function = program.getFunction(name);
            if (function == null) {
                context.warn(getName() + ": 剖析数据中的函数 " + name + " 不在程序中");
                continue;
            }
            changed |= reorderBlocks(function, layout, context);
        }
        return changed;
    }

    // ==================== 内联 ====================

    /**
     * 计算所有调用边的决策。
     */
    public Map<String, Map<String, InlineDecision>> decisions(long hotFunctionThreshold) {
        Map<String, Map<String, InlineDecision>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Long>> caller : profile.getCallCounts().entrySet()) {
            Map<String, InlineDecision> row = new LinkedHashMap<>();
            long callerCount = profile.getFunctionCount(caller.getKey());
            for (Map.Entry<String, Long> call : caller.getValue().entrySet()) {
                long calleeCount = profile.getFunctionCount(call.getKey());
                row.put(call.getKey(), InlineDecision.decide(calleeCount, call.getValue(), callerCount,
                        hotFunctionThreshold));
            }
            result.put(caller.getKey(), row);
        }
        return result;
    }

    private boolean applyInlineDecisions(MirProgram program, PassContext context) {
        long hotThreshold = context.getConfig().getHotFunctionThreshold();
        CallGraph graph = CallGraph.build(program);

        Map<String, List<CallSite>> planned = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, InlineDecision>> row : decisions(hotThreshold).entrySet()) {
            String caller = row.getKey();
            for (Map.Entry<String, InlineDecision> e : row.getValue().entrySet()) {
                String callee = e.getKey();
                InlineDecision decision = e.getValue();
                boolean wanted = decision == InlineDecision.ALWAYS_INLINE
                        || (decision == InlineDecision.INLINE_HOT && profile.getFunctionCount(caller) > hotThreshold);
                if (!wanted) continue;

                if (program.getFunction(caller) == null || program.getFunction(callee) == null) {
                    context.warn(getName() + ": 无法对 " + caller + " -> " + callee + " 执行 " + decision
                            + "（函数不在程序中）");
                    continue;
                }
                if (graph.isRecursive(callee)) {
                    context.warn(getName() + ": 无法对 " + caller + " -> " + callee + " 执行 " + decision
                            + "（被调函数递归）");
                    continue;
                }
                List<CallSite> sites = new ArrayList<>();
                for (CallSite site : graph.getCallSites(callee)) {
                    if (site.getCaller().equals(caller)) sites.add(site);
                }
                if (sites.isEmpty()) {
                    LOG.fine(caller + " -> " + callee + " 已无调用点");
                    continue;
                }
                List<CallSite> list = planned.get(caller);
                if (list == null) {
                    list = new ArrayList<>();
                    planned.put(caller, list);
                }
                list.addAll(sites);
            }
        }

        // 本轮正在被内联的函数不作为调用者改写
        Set<String> inFlight = new TreeSet<>();
        for (List<CallSite> sites : planned.values()) {
            for (CallSite site : sites) inFlight.add(site.getCallee());
        }

        int inlined = 0;
        for (Map.Entry<String, List<CallSite>> e : planned.entrySet()) {
            if (inFlight.contains(e.getKey())) {
                LOG.fine("推迟改写 " + e.getKey() + "，其本身正被内联");
                continue;
            }
            inlined += Inliner.inlineSites(program, program.getFunction(e.getKey()), e.getValue(), context, getName());
        }
        if (inlined > 0) {
            LOG.fine("剖析引导内联 " + inlined + " 个调用点");
        }
        return inlined > 0;
    }

    // ==================== 块布局 ====================

    private boolean reorderBlocks(MirFunction function, BlockLayout layout, PassContext context) {
        Map<Integer, Long> counts = profile.getBlockCounts(function.getName());
        if (counts.isEmpty()) return false;
        for (int id : counts.keySet()) {
            if (!function.hasBlock(id)) {
                context.warn(getName() + ": " + function.getName() + " 中不存在剖析数据记录的块 bb" + id);
            }
        }
        List<Integer> order = layout.compute(function, profile);
        if (order.equals(function.getBlockIds())) return false;
        function.reorderBlocks(order);
        LOG.fine("重排 " + function.getName() + " 的块布局: " + order);
        return true;
    }
}
