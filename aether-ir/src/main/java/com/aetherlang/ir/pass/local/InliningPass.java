package com.aetherlang.ir.pass.local;

import com.aetherlang.ir.analysis.CallGraph;
import com.aetherlang.ir.analysis.CallSite;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.pass.MirPass;
import com.aetherlang.ir.pass.OptimizerConfig;
import com.aetherlang.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * 程序级内联。
 * <p>
 * 候选：成本不超过阈值、不在递归环中、且只有少量调用点的函数。
 * 自身也是候选的函数在本轮不作为调用者被改写，避免同时改写正在被内联的函数体。
 */
public class InliningPass implements MirPass {

    private static final Logger LOG = Logger.getLogger(InliningPass.class.getName());

    @Override
    public String getName() {
        return "inline";
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
        OptimizerConfig config = context.getConfig();
        CallGraph graph = CallGraph.build(program);
        Set<String> candidates = findCandidates(program, graph, config);
        if (candidates.isEmpty()) return false;
        LOG.fine("内联候选: " + candidates);

        for (String name : graph.getFunctions()) {
            if (graph.hasIndirectCalls(name)) {
                context.warn(getName() + ": " + name + " 含间接调用，无法内联");
            }
        }

        int total = 0;
        for (Map.Entry<String, List<CallSite>> e : sitesByCaller(graph, candidates).entrySet()) {
            if (candidates.contains(e.getKey())) continue;
            total += Inliner.inlineSites(program, program.getFunction(e.getKey()), e.getValue(), context, getName());
        }
        if (total > 0) {
            LOG.fine("内联 " + total + " 个调用点");
        }
        return total > 0;
    }

    static Set<String> findCandidates(MirProgram program, CallGraph graph, OptimizerConfig config) {
        Set<String> candidates = new TreeSet<>();
        for (MirFunction function : program.getFunctions().values()) {
            String name = function.getName();
            int sites = graph.getCallSites(name).size();
            if (sites == 0 || sites > config.getMaxInlineCallSites()) continue;
            if (graph.isRecursive(name)) continue;
            if (InlineCost.isCandidate(function, config.getInlineThreshold())) {
                candidates.add(name);
            }
        }
        return candidates;
    }

    /** 将候选函数的调用点按调用者分组，调用者按名称排序。 */
    public static Map<String, List<CallSite>> sitesByCaller(CallGraph graph, Set<String> callees) {
        Map<String, List<CallSite>> result = new LinkedHashMap<>();
        for (String caller : graph.getFunctions()) {
            List<CallSite> list = new ArrayList<>();
            for (String callee : callees) {
                for (CallSite site : graph.getCallSites(callee)) {
                    if (site.getCaller().equals(caller)) list.add(site);
                }
            }
            if (!list.isEmpty()) result.put(caller, list);
        }
        return result;
    }
}
