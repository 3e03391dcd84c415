package com.aetherlang.ir.pass.ipo;

import com.aetherlang.ir.analysis.CallGraph;
import com.aetherlang.ir.analysis.CallSite;
import com.aetherlang.ir.analysis.DominatorTree;
import com.aetherlang.ir.analysis.InterproceduralAnalysis;
import com.aetherlang.ir.analysis.LocalUsage;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirParam;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.MirPass;
import com.aetherlang.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * 过程间优化。
 * <p>
 * 依次执行：全局常量传播、常量实参传播、单定义常量局部变量传播、纯函数调用折叠、死函数删除。
 * 入口函数为 main 与所有在外部函数表中声明的函数；地址被取用的函数同样保留。
 */
public class InterproceduralPass implements MirPass {

    private static final Logger LOG = Logger.getLogger(InterproceduralPass.class.getName());

    public static final String MAIN = "main";

    @Override
    public String getName() {
        return "interprocedural";
    }

    @Override
    public boolean isProgramLevel() {
        return true;
    }

    @Override
    public boolean runOnFunction(MirFunction function, PassContext context) {
        return propagateSingleDefinitionConstants(function) > 0;
    }

    @Override
    public boolean runOnProgram(MirProgram program, PassContext context) {
        InterproceduralAnalysis analysis = InterproceduralAnalysis.analyze(program);
        CallGraph graph = analysis.getCallGraph();
        for (String name : graph.getFunctions()) {
            if (graph.hasIndirectCalls(name)) {
                context.warn(getName() + ": " + name + " 含有间接调用，按未知函数处理");
            }
        }

        int globals = propagateGlobals(program, analysis);
        int arguments = propagateConstantArguments(program, graph);
        int locals = 0;
        for (MirFunction function : program.getFunctions().values()) {
            locals += propagateSingleDefinitionConstants(function);
        }
        ConstantEvaluator evaluator =
                new ConstantEvaluator(program, analysis, context.getConfig().getEvaluationStepLimit());
        int folded = 0;
        for (MirFunction function : program.getFunctions().values()) {
            folded += foldPureCalls(function, evaluator);
        }
        List<String> removed = eliminateDeadFunctions(program, graph);

        int total = globals + arguments + locals + folded + removed.size();
        if (total > 0) {
            LOG.fine("过程间优化: 全局常量 " + globals + ", 常量实参 " + arguments + ", 常量局部变量 " + locals
                    + ", 纯调用折叠 " + folded + ", 删除函数 " + removed);
        }
        return total > 0;
    }

    /**
     * 程序入口：main 以及在外部函数表中声明的程序内函数。
     */
    public static Set<String> entryPoints(MirProgram program) {
        Set<String> entries = new TreeSet<>();
        if (program.getFunction(MAIN) != null) entries.add(MAIN);
        for (String name : program.getExternalFunctions().keySet()) {
            if (program.getFunction(name) != null) entries.add(name);
        }
        return entries;
    }

    // ==================== 全局常量 ====================

    /**
     * 把读取程序常量的全局符号替换为常量本身。被任何摘要标记为可能修改的全局不替换。
     */
    int propagateGlobals(MirProgram program, InterproceduralAnalysis analysis) {
        final Map<String, Constant> constants = new TreeMap<>();
        Set<String> modified = analysis.getModifiedGlobals();
        for (Map.Entry<String, Constant> e : program.getConstants().entrySet()) {
            if (e.getValue().isLiteral() && !modified.contains(e.getKey())) {
                constants.put(e.getKey(), e.getValue());
            }
        }
        if (constants.isEmpty()) return 0;
        int count = 0;
        for (MirFunction function : program.getFunctions().values()) {
            count += rewriteOperands(function, new UnaryOperator<Operand>() {
                @Override
                public Operand apply(Operand op) {
                    Constant c = op.getConstant();
                    if (c == null || c.getGlobalName() == null) return op;
                    Constant value = constants.get(c.getGlobalName());
                    return value != null ? Operand.constant(value) : op;
                }
            }, null);
        }
        return count;
    }

    // ==================== 常量实参 ====================

    /**
     * 所有调用点在同一位置传入同一常量时，把被调函数中对该参数的读取替换为常量。
     */
    int propagateConstantArguments(MirProgram program, CallGraph graph) {
        Set<String> entries = entryPoints(program);
        int count = 0;
        for (MirFunction function : program.getFunctions().values()) {
            String name = function.getName();
            if (entries.contains(name) || graph.isAddressTaken(name)) continue;
            List<CallSite> sites = graph.getCallSites(name);
            if (sites.isEmpty()) continue;
            List<MirParam> params = function.getParams();
            boolean arityOk = true;
            for (CallSite site : sites) {
                if (site.getArgs().size() != params.size()) arityOk = false;
            }
            if (!arityOk) continue;

            Map<Integer, Integer> writes = LocalUsage.writeCounts(function);
            Set<Integer> addressTaken = LocalUsage.addressTaken(function);
            for (int k = 0; k < params.size(); k++) {
                final int local = params.get(k).getLocal();
                if (writes.containsKey(local) || addressTaken.contains(local)) continue;
                final Constant value = commonConstant(sites, k);
                if (value == null) continue;
                int n = replaceReads(function, local, value, null);
                if (n > 0) {
                    LOG.fine(name + ": 参数 " + params.get(k).getName() + " 恒为 " + value);
                    count += n;
                }
            }
        }
        return count;
    }

    private static Constant commonConstant(List<CallSite> sites, int index) {
        Constant common = null;
        for (CallSite site : sites) {
            Constant c = site.getArgs().get(index).getConstant();
            if (c == null || !c.isLiteral()) return null;
            if (common == null) {
                common = c;
            } else if (!common.equals(c)) {
                return null;
            }
        }
        return common;
    }

    // ==================== 单定义常量 ====================

    /**
     * 只有一处定义且定义为常量赋值的局部变量，在定义支配的读取处替换为该常量。
     */
    static int propagateSingleDefinitionConstants(MirFunction function) {
        if (!function.hasBlock(function.getEntryBlock())) return 0;
        Map<Integer, Integer> writes = LocalUsage.writeCounts(function);
        Set<Integer> addressTaken = LocalUsage.addressTaken(function);
        Map<Integer, Location> definitions = new TreeMap<>();
        Map<Integer, Constant> values = new TreeMap<>();
        for (BasicBlock block : function.getBlocks()) {
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                if (!(stmts.get(i) instanceof MirStatement.Assign)) continue;
                MirStatement.Assign assign = (MirStatement.Assign) stmts.get(i);
                int local = assign.getDefinedLocal();
                if (local < 0 || function.isParamLocal(local) || addressTaken.contains(local)) continue;
                Integer count = writes.get(local);
                if (count == null || count != 1 || !(assign.getRvalue() instanceof Rvalue.Use)) continue;
                Constant c = ((Rvalue.Use) assign.getRvalue()).getOperand().getConstant();
                if (c == null || !c.isLiteral()) continue;
                definitions.put(local, new Location(block.getId(), i));
                values.put(local, c);
            }
        }
        if (definitions.isEmpty()) return 0;

        DominatorTree dominators = DominatorTree.compute(function);
        int count = 0;
        for (Map.Entry<Integer, Location> e : definitions.entrySet()) {
            count += replaceReads(function, e.getKey(), values.get(e.getKey()), new Dominance(dominators, e.getValue()));
        }
        if (count > 0) {
            LOG.fine(function.getName() + ": 传播 " + count + " 处常量局部变量读取");
        }
        return count;
    }

    /** 定义点是否支配某个程序点。 */
    static final class Dominance {
        private final DominatorTree tree;
        private final Location definition;

        Dominance(DominatorTree tree, Location definition) {
            this.tree = tree;
            this.definition = definition;
        }

        boolean covers(Location use) {
            if (use.getBlock() == definition.getBlock()) {
                return use.getStatementIndex() > definition.getStatementIndex();
            }
            return tree.isReachable(use.getBlock()) && tree.dominates(definition.getBlock(), use.getBlock());
        }
    }

    private static int replaceReads(MirFunction function, final int local, final Constant value, Dominance guard) {
        return rewriteOperands(function, new UnaryOperator<Operand>() {
            @Override
            public Operand apply(Operand op) {
                return op.getPlace() != null && op.getDirectLocal() == local ? Operand.constant(value) : op;
            }
        }, guard);
    }

    /**
     * 对函数中所有语句与终止指令的操作数应用 mapper，返回被改写的程序点数。
     * guard 不为 null 时只改写它覆盖的程序点。
     */
    private static int rewriteOperands(MirFunction function, UnaryOperator<Operand> mapper, Dominance guard) {
        int count = 0;
        for (BasicBlock block : function.getBlocks()) {
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                if (!(stmts.get(i) instanceof MirStatement.Assign)) continue;
                if (guard != null && !guard.covers(new Location(block.getId(), i))) continue;
                MirStatement.Assign assign = (MirStatement.Assign) stmts.get(i);
                Rvalue mapped = assign.getRvalue().mapOperands(mapper);
                if (!mapped.equals(assign.getRvalue())) {
                    stmts.set(i, assign.withRvalue(mapped));
                    count++;
                }
            }
            if (guard != null && !guard.covers(new Location(block.getId(), stmts.size()))) continue;
            MirTerminator mapped = block.getTerminator().mapOperands(mapper);
            if (!mapped.equals(block.getTerminator())) {
                block.setTerminator(mapped);
                count++;
            }
        }
        return count;
    }

    // ==================== 纯函数调用折叠 ====================

    /**
     * 实参全为常量的纯函数调用在编译期求值，调用替换为结果常量。
     */
    static int foldPureCalls(MirFunction function, ConstantEvaluator evaluator) {
        int count = 0;
        for (BasicBlock block : function.getBlocks()) {
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                if (!(stmts.get(i) instanceof MirStatement.Assign)) continue;
                MirStatement.Assign assign = (MirStatement.Assign) stmts.get(i);
                if (!(assign.getRvalue() instanceof Rvalue.Call)) continue;
                Rvalue.Call call = (Rvalue.Call) assign.getRvalue();
                Constant result = evaluateCall(evaluator, call.getCalleeName(), call.getArgs());
                if (result == null) continue;
                stmts.set(i, assign.withRvalue(Rvalue.use(Operand.constant(result))));
                LOG.fine(function.getName() + ": 折叠调用 " + call + " = " + result);
                count++;
            }
            if (block.getTerminator() instanceof MirTerminator.Call) {
                MirTerminator.Call call = (MirTerminator.Call) block.getTerminator();
                if (!call.hasTarget() || call.hasCleanup() || call.getDestination() == null) continue;
                Constant result = evaluateCall(evaluator, call.getCalleeName(), call.getArgs());
                if (result == null) continue;
                block.addStatement(MirStatement.assign(call.getDestination(), Rvalue.use(Operand.constant(result))));
                block.setTerminator(MirTerminator.goTo(call.getTarget()));
                LOG.fine(function.getName() + ": 折叠调用 " + call + " = " + result);
                count++;
            }
        }
        return count;
    }

    private static Constant evaluateCall(ConstantEvaluator evaluator, String callee, List<Operand> args) {
        if (callee == null) return null;
        List<Constant> values = new ArrayList<>();
        for (Operand arg : args) {
            Constant c = arg.getConstant();
            if (c == null || !c.isLiteral()) return null;
            values.add(c);
        }
        return evaluator.evaluate(callee, values);
    }

    // ==================== 死函数删除 ====================

    /**
     * 删除从入口经调用图不可达、且地址未被取用的函数。程序没有入口时不删除。
     */
    static List<String> eliminateDeadFunctions(MirProgram program, CallGraph graph) {
        Set<String> roots = entryPoints(program);
        List<String> removed = new ArrayList<>();
        if (roots.isEmpty()) {
            LOG.fine("程序没有入口函数，跳过死函数删除");
            return removed;
        }
        roots.addAll(graph.getAddressTaken());
        Set<String> live = graph.reachableFrom(roots);
        for (String name : new ArrayList<>(program.getFunctions().keySet())) {
            if (!live.contains(name)) {
                program.getFunctions().remove(name);
                removed.add(name);
            }
        }
        return removed;
    }
}
