package com.aetherlang.ir.pass.ipo;

import com.aetherlang.ir.analysis.CallGraph;
import com.aetherlang.ir.analysis.CallSite;
import com.aetherlang.ir.analysis.InterproceduralAnalysis;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.pass.MirPass;
import com.aetherlang.ir.pass.OptimizerConfig;
import com.aetherlang.ir.pass.PassContext;
import com.aetherlang.ir.pass.local.InlineCost;
import com.aetherlang.ir.pass.local.Inliner;
import com.aetherlang.ir.pass.local.InliningPass;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * 全程序优化：在完整的调用图与函数摘要上挑选小而纯的函数并内联到所有调用点。
 * <p>
 * 候选条件：被 1 到 maxInlineCallSites 处调用、代价不超过 wholeProgramInlineCost、纯函数、不在递归环中。
 */
public class WholeProgramPass implements MirPass {

    private static final Logger LOG = Logger.getLogger(WholeProgramPass.class.getName());

    @Override
    public String getName() {
        return "whole-program";
    }

    @Override
    public boolean isProgramLevel() {
        return true;
    }

    @Override
    public boolean runOnFunction(MirFunction function, PassContext context) {
        return false;
    }

    @Override
    public boolean runOnProgram(MirProgram program, PassContext context) {
        InterproceduralAnalysis analysis = InterproceduralAnalysis.analyze(program);
        Set<String> candidates = findCandidates(program, analysis, context.getConfig());
        if (candidates.isEmpty()) return false;
        LOG.fine("全程序内联候选: " + candidates);

        int inlined = 0;
        Map<String, List<CallSite>> byCaller = InliningPass.sitesByCaller(analysis.getCallGraph(), candidates);
        for (Map.Entry<String, List<CallSite>> e : byCaller.entrySet()) {
            if (candidates.contains(e.getKey())) continue;
            MirFunction caller = program.getFunction(e.getKey());
            inlined += Inliner.inlineSites(program, caller, e.getValue(), context, getName());
        }
        if (inlined > 0) {
            LOG.fine("全程序优化: 内联 " + inlined + " 个调用点");
        }
        return inlined > 0;
    }

    static Set<String> findCandidates(MirProgram program, InterproceduralAnalysis analysis, OptimizerConfig config) {
        CallGraph graph = analysis.getCallGraph();
        Set<String> result = new TreeSet<>();
        for (String name : graph.getFunctions()) {
            int sites = graph.getCallSites(name).size();
            if (sites < 1 || sites > config.getMaxInlineCallSites()) continue;
            if (graph.isRecursive(name) || !analysis.isPure(name)) continue;
            if (InlineCost.cost(program.getFunction(name)) > config.getWholeProgramInlineCost()) continue;
            result.add(name);
        }
        return result;
    }
}
