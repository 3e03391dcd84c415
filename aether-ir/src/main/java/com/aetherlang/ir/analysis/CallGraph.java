package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 程序调用图。
 * <p>
 * 边按函数名建立，只记录程序内定义的函数之间的直接调用；
 * 对外部声明或未知名字的调用单独记录。强连通分量用 Tarjan 算法求得，
 * 其输出顺序即被调者先于调用者的拓扑序。
 */
public class CallGraph {

    private final Map<String, Set<String>> callees = new TreeMap<>();
    private final Map<String, Set<String>> callers = new TreeMap<>();
    private final Map<String, Set<String>> externalCallees = new TreeMap<>();
    private final Map<String, List<CallSite>> callSites = new TreeMap<>();
    private final Set<String> indirectCallers = new TreeSet<>();
    private final Set<String> addressTaken = new TreeSet<>();
    private final List<List<String>> sccs = new ArrayList<>();
    private final Map<String, Integer> sccIndex = new HashMap<>();
    private final List<String> topologicalOrder = new ArrayList<>();

    private CallGraph() {}

    public static CallGraph build(MirProgram program) {
        CallGraph graph = new CallGraph();
        for (String name : program.getFunctions().keySet()) {
            graph.callees.put(name, new TreeSet<String>());
            graph.callers.put(name, new TreeSet<String>());
            graph.externalCallees.put(name, new TreeSet<String>());
            graph.callSites.put(name, new ArrayList<CallSite>());
        }
        for (MirFunction function : program.getFunctions().values()) {
            graph.scanFunction(program, function);
        }
        for (Constant c : program.getConstants().values()) {
            graph.noteReference(program, c);
        }
        graph.computeSccs();
        return graph;
    }

    // ==================== 构建 ====================

    private void scanFunction(MirProgram program, MirFunction function) {
        String caller = function.getName();
        for (BasicBlock block : function.getBlocks()) {
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                if (!(stmts.get(i) instanceof MirStatement.Assign)) continue;
                Rvalue rv = ((MirStatement.Assign) stmts.get(i)).getRvalue();
                if (rv instanceof Rvalue.Call) {
                    Rvalue.Call call = (Rvalue.Call) rv;
                    addCall(program, caller, call.getCalleeName(), new Location(block.getId(), i), false,
                            call.getArgs());
                    noteReferences(program, call.getArgs());
                } else {
                    noteReferences(program, rv.getOperands());
                }
            }
            MirTerminator term = block.getTerminator();
            if (term instanceof MirTerminator.Call) {
                MirTerminator.Call call = (MirTerminator.Call) term;
                addCall(program, caller, call.getCalleeName(), new Location(block.getId(), stmts.size()), true,
                        call.getArgs());
                noteReferences(program, call.getArgs());
            } else {
                noteReferences(program, term.getOperands());
            }
        }
    }

    private void addCall(MirProgram program, String caller, String callee, Location loc, boolean terminator,
                         List<Operand> args) {
        if (callee == null) {
            indirectCallers.add(caller);
            return;
        }
        if (program.getFunction(callee) == null) {
            externalCallees.get(caller).add(callee);
            return;
        }
        callees.get(caller).add(callee);
        callers.get(callee).add(caller);
        callSites.get(callee).add(new CallSite(caller, callee, loc, terminator, args));
    }

    private void noteReferences(MirProgram program, List<Operand> operands) {
        for (Operand op : operands) {
            if (op.getConstant() != null) noteReference(program, op.getConstant());
        }
    }

    private void noteReference(MirProgram program, Constant c) {
        String name = c.getFunctionName();
        if (name != null && program.getFunction(name) != null) addressTaken.add(name);
    }

    // ==================== 强连通分量 ====================

    private int counter;
    private final Map<String, Integer> indices = new HashMap<>();
    private final Map<String, Integer> lowlinks = new HashMap<>();
    private final List<String> stack = new ArrayList<>();
    private final Set<String> onStack = new TreeSet<>();

    private void computeSccs() {
        for (String name : callees.keySet()) {
            if (!indices.containsKey(name)) strongConnect(name);
        }
        for (int i = 0; i < sccs.size(); i++) {
            for (String name : sccs.get(i)) {
                sccIndex.put(name, i);
                topologicalOrder.add(name);
            }
        }
        indices.clear();
        lowlinks.clear();
    }

    private void strongConnect(String v) {
        indices.put(v, counter);
        lowlinks.put(v, counter);
        counter++;
        stack.add(v);
        onStack.add(v);

        for (String w : callees.get(v)) {
            if (!indices.containsKey(w)) {
                strongConnect(w);
                lowlinks.put(v, Math.min(lowlinks.get(v), lowlinks.get(w)));
            } else if (onStack.contains(w)) {
                lowlinks.put(v, Math.min(lowlinks.get(v), indices.get(w)));
            }
        }

        if (lowlinks.get(v).equals(indices.get(v))) {
            List<String> component = new ArrayList<>();
            String w;
            do {
                w = stack.remove(stack.size() - 1);
                onStack.remove(w);
                component.add(w);
            } while (!w.equals(v));
            Collections.sort(component);
            sccs.add(component);
        }
    }

    // ==================== 查询 ====================

    public Set<String> getFunctions() {
        return Collections.unmodifiableSet(callees.keySet());
    }

    public Set<String> getCallees(String function) {
        Set<String> set = callees.get(function);
        return set != null ? Collections.unmodifiableSet(set) : Collections.<String>emptySet();
    }

    public Set<String> getCallers(String function) {
        Set<String> set = callers.get(function);
        return set != null ? Collections.unmodifiableSet(set) : Collections.<String>emptySet();
    }

    /** 调用的外部声明函数或未定义名字。 */
    public Set<String> getExternalCallees(String function) {
        Set<String> set = externalCallees.get(function);
        return set != null ? Collections.unmodifiableSet(set) : Collections.<String>emptySet();
    }

    /** 调用 callee 的全部调用点，按调用者名与位置排列。 */
    public List<CallSite> getCallSites(String callee) {
        List<CallSite> list = callSites.get(callee);
        return list != null ? Collections.unmodifiableList(list) : Collections.<CallSite>emptyList();
    }

    public boolean hasIndirectCalls(String function) {
        return indirectCallers.contains(function);
    }

    /** 函数符号出现在调用目标以外位置（可能经指针被调用）。 */
    public boolean isAddressTaken(String function) {
        return addressTaken.contains(function);
    }

    public Set<String> getAddressTaken() {
        return Collections.unmodifiableSet(addressTaken);
    }

    public List<List<String>> getSccs() {
        return Collections.unmodifiableList(sccs);
    }

    public List<String> getScc(String function) {
        Integer idx = sccIndex.get(function);
        return idx != null ? sccs.get(idx) : Collections.<String>emptyList();
    }

    public boolean isRecursive(String function) {
        return getScc(function).size() > 1 || getCallees(function).contains(function);
    }

    /** 被调者先于调用者。同一强连通分量内按名字排列。 */
    public List<String> getTopologicalOrder() {
        return Collections.unmodifiableList(topologicalOrder);
    }

    /** 从给定入口出发沿调用边可达的函数。 */
    public Set<String> reachableFrom(Set<String> roots) {
        Set<String> visited = new TreeSet<>();
        List<String> worklist = new ArrayList<>();
        for (String r : roots) {
            if (callees.containsKey(r) && visited.add(r)) worklist.add(r);
        }
        while (!worklist.isEmpty()) {
            String cur = worklist.remove(worklist.size() - 1);
            for (String callee : callees.get(cur)) {
                if (visited.add(callee)) worklist.add(callee);
            }
        }
        return visited;
    }
}
