package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Place;
import com.aetherlang.ir.mir.Rvalue;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * 过程间摘要计算。
 * <p>
 * 按调用图的拓扑序（被调者先）处理函数；同一强连通分量内反复合并直到不动点，
 * 因此递归函数的摘要同样是其所有被调者摘要的并。
 */
public class InterproceduralAnalysis {

    private static final Logger LOG = Logger.getLogger(InterproceduralAnalysis.class.getName());

    /** 间接调用在摘要 calls 集合中的占位名 */
    public static final String INDIRECT_CALLEE = "<indirect>";

    private final MirProgram program;
    private final CallGraph callGraph;
    private final Map<String, FunctionSummary> summaries = new TreeMap<>();
    private final Map<String, Set<Integer>> escapingLocals = new TreeMap<>();

    private InterproceduralAnalysis(MirProgram program, CallGraph callGraph) {
        this.program = program;
        this.callGraph = callGraph;
    }

    public static InterproceduralAnalysis analyze(MirProgram program) {
        InterproceduralAnalysis analysis = new InterproceduralAnalysis(program, CallGraph.build(program));
        analysis.computeSummaries();
        return analysis;
    }

    private void computeSummaries() {
        for (List<String> scc : callGraph.getSccs()) {
            for (String name : scc) {
                MirFunction function = program.getFunction(name);
                FunctionSummary summary = new FunctionSummary(name);
                summary.setRecursive(callGraph.isRecursive(name));
                collectLocalEffects(function, summary);
                Set<Integer> escaping = EscapeAnalysis.escapingLocals(function);
                escapingLocals.put(name, escaping);
                for (int idx : EscapeAnalysis.escapingParameters(function, escaping)) {
                    summary.addEscapingParameter(idx);
                }
                summaries.put(name, summary);
            }
            boolean changed = true;
            while (changed) {
                changed = false;
                for (String name : scc) {
                    FunctionSummary summary = summaries.get(name);
                    for (String callee : callGraph.getCallees(name)) {
                        changed |= summary.mergeCallee(summaries.get(callee));
                    }
                }
            }
        }
        for (FunctionSummary s : summaries.values()) {
            LOG.fine("摘要 " + s);
        }
    }

    // ==================== 局部效果 ====================

    private void collectLocalEffects(MirFunction function, FunctionSummary summary) {
        SideEffects effects = summary.getSideEffects();
        for (BasicBlock block : function.getBlocks()) {
            for (MirStatement stmt : block.getStatements()) {
                if (!(stmt instanceof MirStatement.Assign)) continue;
                MirStatement.Assign assign = (MirStatement.Assign) stmt;
                if (assign.getPlace().hasDeref()) effects.setWritesMemory(true);
                Rvalue rv = assign.getRvalue();
                if (rv instanceof Rvalue.Call) {
                    Rvalue.Call call = (Rvalue.Call) rv;
                    noteCall(summary, call.getCalleeName(), call.getArgs());
                }
                noteReads(summary, rv.getOperands());
                if (rv instanceof Rvalue.Ref) noteRead(effects, ((Rvalue.Ref) rv).getPlace());
                if (rv instanceof Rvalue.Len) noteRead(effects, ((Rvalue.Len) rv).getPlace());
                if (rv instanceof Rvalue.Discriminant) noteRead(effects, ((Rvalue.Discriminant) rv).getPlace());
            }
            MirTerminator term = block.getTerminator();
            if (term instanceof MirTerminator.Call) {
                MirTerminator.Call call = (MirTerminator.Call) term;
                noteCall(summary, call.getCalleeName(), call.getArgs());
                if (call.hasCleanup()) effects.setMayThrow(true);
                if (call.getDestination() != null && call.getDestination().hasDeref()) {
                    effects.setWritesMemory(true);
                }
            } else if (term instanceof MirTerminator.Assert) {
                effects.setMayThrow(true);
            } else if (term instanceof MirTerminator.Drop) {
                noteRead(effects, ((MirTerminator.Drop) term).getPlace());
            }
            noteReads(summary, term.getOperands());
        }

        LoopForest forest = LoopForest.compute(function);
        for (LoopInfo loop : forest.getLoops()) {
            if (!loop.hasKnownTripCount()) {
                summary.setMayNotTerminate(true);
                break;
            }
        }
    }

    private void noteCall(FunctionSummary summary, String callee, List<Operand> args) {
        SideEffects effects = summary.getSideEffects();
        effects.setCallsFunctions(true);
        boolean known = callee != null && program.getFunction(callee) != null;
        summary.addCall(callee != null ? callee : INDIRECT_CALLEE);
        if (!known) effects.markUnknownCall();
        for (Operand arg : args) {
            Constant c = arg.getConstant();
            if (c == null || c.getGlobalName() == null) continue;
            // 全局符号交给未知代码，视为可能被修改
            if (known) {
                summary.addReadGlobal(c.getGlobalName());
            } else {
                summary.addModifiedGlobal(c.getGlobalName());
            }
        }
    }

    private void noteReads(FunctionSummary summary, List<Operand> operands) {
        for (Operand op : operands) {
            Constant c = op.getConstant();
            if (c != null && c.getGlobalName() != null) {
                summary.addReadGlobal(c.getGlobalName());
            } else if (op.getPlace() != null) {
                noteRead(summary.getSideEffects(), op.getPlace());
            }
        }
    }

    private static void noteRead(SideEffects effects, Place place) {
        if (place.hasDeref()) effects.setReadsMemory(true);
    }

    // ==================== 查询 ====================

    public MirProgram getProgram() { return program; }
    public CallGraph getCallGraph() { return callGraph; }

    public Map<String, FunctionSummary> getSummaries() {
        return Collections.unmodifiableMap(summaries);
    }

    public FunctionSummary getSummary(String function) {
        return summaries.get(function);
    }

    public boolean isPure(String function) {
        FunctionSummary s = summaries.get(function);
        return s != null && s.isPure();
    }

    public Set<Integer> getEscapingLocals(String function) {
        Set<Integer> set = escapingLocals.get(function);
        return set != null ? set : Collections.<Integer>emptySet();
    }

    /** 被任一函数摘要标记为可能修改的全局符号。 */
    public Set<String> getModifiedGlobals() {
        Set<String> result = new TreeSet<>();
        for (FunctionSummary s : summaries.values()) result.addAll(s.getModifiesGlobals());
        return result;
    }
}
