package com.aetherlang.ir.pass.local;

import com.aetherlang.ir.analysis.CallSite;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.Cfg;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirLocal;
import com.aetherlang.ir.mir.MirParam;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Place;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.PassContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 调用点内联（拼接被调函数体）。
 * <p>
 * 步骤：
 * <ol>
 *   <li>为被调函数的每个局部变量在调用者中分配新的局部变量，为每个可达块分配新块</li>
 *   <li>实参复制赋值给参数的副本，调用点改为跳转到副本入口</li>
 *   <li>副本中的 Return 改为“目标 = 返回值副本”加跳转到后续块</li>
 * </ol>
 * 语句形式的调用先在调用处拆分基本块，其后的语句移入新的后续块。
 * 间接调用、带 cleanup 的调用、无返回目标的调用与参数个数不符的调用点被跳过，IR 不做任何修改。
 */
public final class Inliner {

    private static final Logger LOG = Logger.getLogger(Inliner.class.getName());

    public enum Outcome {
        INLINED("已内联"),
        NOT_A_CALL("调用点不是调用"),
        INDIRECT_CALL("间接调用"),
        UNKNOWN_CALLEE("被调函数不在程序中"),
        SELF_CALL("自调用"),
        HAS_CLEANUP("调用带有 cleanup 块"),
        NO_TARGET("调用没有返回目标"),
        ARITY_MISMATCH("实参个数与形参不符"),
        MALFORMED_CALLEE("被调函数存在悬空的块引用");

        private final String description;

        Outcome(String description) {
            this.description = description;
        }

        public String getDescription() { return description; }
    }

    private Inliner() {}

    /**
     * 内联给定调用者中的一组调用点，跳过的调用点记为警告。
     * 调用点按位置从后往前处理，先处理的拆分不会移动后处理的调用点。
     *
     * @return 成功内联的调用点数
     */
    public static int inlineSites(MirProgram program, MirFunction caller, List<CallSite> sites,
                                  PassContext context, String passName) {
        List<CallSite> ordered = new ArrayList<>(sites);
        Collections.sort(ordered, new Comparator<CallSite>() {
            @Override
            public int compare(CallSite a, CallSite b) {
                return b.getLocation().compareTo(a.getLocation());
            }
        });
        int inlined = 0;
        for (CallSite site : ordered) {
            MirFunction callee = program.getFunction(site.getCallee());
            Outcome outcome = callee == null ? Outcome.UNKNOWN_CALLEE : inline(caller, site.getLocation(), callee);
            if (outcome == Outcome.INLINED) {
                LOG.fine(passName + ": 内联 " + caller.getName() + " @" + site.getLocation() + " -> " + site.getCallee());
                inlined++;
            } else {
                context.warn(passName + ": 未内联 " + caller.getName() + " @" + site.getLocation() + " -> "
                        + site.getCallee() + "（" + outcome.getDescription() + "）");
            }
        }
        return inlined;
    }

    /**
     * 将 callee 拼接到 caller 的 site 处。
     */
    public static Outcome inline(MirFunction caller, Location site, MirFunction callee) {
        BasicBlock block = caller.getBlock(site.getBlock());
        if (block == null) return Outcome.NOT_A_CALL;
        List<MirStatement> stmts = block.getStatements();
        int index = site.getStatementIndex();

        Operand func;
        List<Operand> args;
        Place destination;
        boolean isTerminator = index >= stmts.size();
        MirTerminator.Call termCall = null;
        if (isTerminator) {
            if (!(block.getTerminator() instanceof MirTerminator.Call)) return Outcome.NOT_A_CALL;
            termCall = (MirTerminator.Call) block.getTerminator();
            func = termCall.getFunc();
            args = termCall.getArgs();
            destination = termCall.getDestination();
        } else {
            MirStatement stmt = stmts.get(index);
            if (!(stmt instanceof MirStatement.Assign)
                    || !(((MirStatement.Assign) stmt).getRvalue() instanceof Rvalue.Call)) {
                return Outcome.NOT_A_CALL;
            }
            MirStatement.Assign assign = (MirStatement.Assign) stmt;
            Rvalue.Call call = (Rvalue.Call) assign.getRvalue();
            func = call.getFunc();
            args = call.getArgs();
            destination = assign.getPlace();
        }

        String calleeName = func.getConstant() != null ? func.getConstant().getFunctionName() : null;
        if (calleeName == null) return Outcome.INDIRECT_CALL;
        if (!calleeName.equals(callee.getName())) return Outcome.UNKNOWN_CALLEE;
        if (calleeName.equals(caller.getName())) return Outcome.SELF_CALL;
        if (termCall != null && termCall.hasCleanup()) return Outcome.HAS_CLEANUP;
        if (termCall != null && !termCall.hasTarget()) return Outcome.NO_TARGET;
        if (args.size() != callee.getParams().size()) return Outcome.ARITY_MISMATCH;

        Set<Integer> calleeBlocks = Cfg.reachable(callee);
        for (int id : calleeBlocks) {
            for (int succ : Cfg.successors(callee.getBlock(id))) {
                if (!callee.hasBlock(succ)) return Outcome.MALFORMED_CALLEE;
            }
        }

        // 后续块
        int continuation;
        if (isTerminator) {
            continuation = termCall.getTarget();
        } else {
            BasicBlock rest = caller.newBlock();
            rest.getStatements().addAll(stmts.subList(index + 1, stmts.size()));
            rest.setTerminator(block.getTerminator());
            stmts.subList(index, stmts.size()).clear();
            continuation = rest.getId();
        }

        final Map<Integer, Integer> localMap = new HashMap<>();
        for (MirLocal local : callee.getLocals().values()) {
            String name = local.getName() != null ? callee.getName() + "::" + local.getName() : null;
            localMap.put(local.getId(), caller.newLocal(name, local.getType(), local.getMutability(),
                    local.getSourceInfo()));
        }
        final Map<Integer, Integer> blockMap = new HashMap<>();
        for (int id : calleeBlocks) {
            blockMap.put(id, caller.newBlock().getId());
        }

        for (int id : calleeBlocks) {
            BasicBlock original = callee.getBlock(id);
            BasicBlock copy = caller.getBlock(blockMap.get(id));
            for (MirStatement stmt : original.getStatements()) {
                copy.addStatement(stmt.mapLocals(localMap::get));
            }
            copy.setVectorWidth(original.getVectorWidth());
            MirTerminator term = original.getTerminator();
            if (term.getKind() == MirTerminator.Kind.RETURN) {
                if (destination != null && callee.hasReturnLocal()) {
                    copy.addStatement(MirStatement.assign(destination,
                            Rvalue.use(Operand.copy(localMap.get(callee.getReturnLocal())))));
                }
                copy.setTerminator(MirTerminator.goTo(continuation));
            } else {
                copy.setTerminator(term.mapLocals(localMap::get).mapTargets(blockMap::get));
            }
        }

        List<MirParam> params = callee.getParams();
        for (int i = 0; i < params.size(); i++) {
            stmts.add(MirStatement.assign(localMap.get(params.get(i).getLocal()), Rvalue.use(args.get(i))));
        }
        block.setTerminator(MirTerminator.goTo(blockMap.get(callee.getEntryBlock())));
        return Outcome.INLINED;
    }
}
