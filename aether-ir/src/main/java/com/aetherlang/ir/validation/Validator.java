package com.aetherlang.ir.validation;

import com.aetherlang.ir.dataflow.DataflowResults;
import com.aetherlang.ir.dataflow.Definition;
import com.aetherlang.ir.dataflow.ReachingDefinitions;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.Cfg;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.ConstantValue;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirLocal;
import com.aetherlang.ir.mir.MirParam;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Rvalue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * MIR 良构性校验。
 * <p>
 * 错误：未声明的局部变量、悬空的块引用、可达块缺少终止指令、常量赋值与分支判别式的类型类别不符。
 * 提示：不可达块、可能未初始化的读取、同一局部变量的多次赋值（MIR 不要求 SSA）。
 * 校验从不修改函数。
 */
public class Validator {

    public ValidationReport validate(MirProgram program) {
        ValidationReport report = new ValidationReport();
        for (MirFunction function : program.getFunctions().values()) {
            report.addAll(validate(function));
        }
        return report;
    }

    public List<ValidationError> validate(MirFunction function) {
        List<ValidationError> errors = new ArrayList<>();
        checkLocals(function, errors);
        boolean entryOk = checkBlocks(function, errors);
        boolean edgesOk = checkCfg(function, errors);
        checkTypes(function, errors);
        checkMultipleAssignment(function, errors);
        if (entryOk && edgesOk && !hasUndefinedLocals(errors)) {
            checkInitialization(function, errors);
        }
        return errors;
    }

    // ==================== 局部变量 ====================

    private void checkLocals(MirFunction function, List<ValidationError> errors) {
        String fn = function.getName();
        for (MirParam param : function.getParams()) {
            if (!function.hasLocal(param.getLocal())) {
                errors.add(new ValidationError(ValidationError.Kind.UNDEFINED_LOCAL, fn, function.getEntryBlock(),
                        param.getLocal(), null, "参数 " + param.getName() + " 的局部变量 _" + param.getLocal() + " 未声明"));
            }
        }
        if (function.hasReturnLocal() && !function.hasLocal(function.getReturnLocal())) {
            errors.add(new ValidationError(ValidationError.Kind.UNDEFINED_LOCAL, fn, -1, function.getReturnLocal(),
                    null, "返回值局部变量 _" + function.getReturnLocal() + " 未声明"));
        }
        for (BasicBlock block : function.getBlocks()) {
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                Set<Integer> mentioned = new TreeSet<>();
                stmts.get(i).collectMentionedLocals(mentioned);
                reportUndefined(function, mentioned, new Location(block.getId(), i), errors);
            }
            Set<Integer> mentioned = new TreeSet<>();
            MirTerminator term = block.getTerminator();
            term.collectReadLocals(mentioned);
            if (term instanceof MirTerminator.Call && ((MirTerminator.Call) term).getDestination() != null) {
                ((MirTerminator.Call) term).getDestination().collectLocals(mentioned);
            }
            reportUndefined(function, mentioned, new Location(block.getId(), stmts.size()), errors);
        }
    }

    private void reportUndefined(MirFunction function, Set<Integer> locals, Location loc,
                                 List<ValidationError> errors) {
        for (int local : locals) {
            if (!function.hasLocal(local)) {
                errors.add(new ValidationError(ValidationError.Kind.UNDEFINED_LOCAL, function.getName(),
                        loc.getBlock(), local, loc, "使用了未声明的局部变量 _" + local));
            }
        }
    }

    private static boolean hasUndefinedLocals(List<ValidationError> errors) {
        for (ValidationError e : errors) {
            if (e.getKind() == ValidationError.Kind.UNDEFINED_LOCAL) return true;
        }
        return false;
    }

    // ==================== 块与 CFG ====================

    private boolean checkBlocks(MirFunction function, List<ValidationError> errors) {
        if (!function.hasBlock(function.getEntryBlock())) {
            errors.add(new ValidationError(ValidationError.Kind.INVALID_EDGE, function.getName(),
                    function.getEntryBlock(), -1, null, "入口块 B" + function.getEntryBlock() + " 不存在"));
            return false;
        }
        for (int id : Cfg.reachable(function)) {
            if (function.getBlock(id).getTerminator().getKind() == MirTerminator.Kind.UNREACHABLE) {
                errors.add(new ValidationError(ValidationError.Kind.MISSING_TERMINATOR, function.getName(),
                        id, -1, null, "可达块 B" + id + " 缺少终止指令"));
            }
        }
        return true;
    }

    private boolean checkCfg(MirFunction function, List<ValidationError> errors) {
        boolean ok = true;
        for (BasicBlock block : function.getBlocks()) {
            for (int succ : Cfg.successors(block)) {
                if (!function.hasBlock(succ)) {
                    errors.add(new ValidationError(ValidationError.Kind.INVALID_EDGE, function.getName(),
                            block.getId(), -1, null, "B" + block.getId() + " -> B" + succ + " 指向不存在的块"));
                    ok = false;
                }
            }
        }
        if (!function.hasBlock(function.getEntryBlock())) return ok;
        Set<Integer> reachable = Cfg.reachable(function);
        for (int id : function.getBlockIds()) {
            if (!reachable.contains(id)) {
                errors.add(new ValidationError(ValidationError.Kind.UNREACHABLE_CODE, function.getName(),
                        id, -1, null, "B" + id + " 不可达"));
            }
        }
        return ok;
    }

    // ==================== 类型 ====================

    private void checkTypes(MirFunction function, List<ValidationError> errors) {
        for (BasicBlock block : function.getBlocks()) {
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                if (!(stmts.get(i) instanceof MirStatement.Assign)) continue;
                MirStatement.Assign assign = (MirStatement.Assign) stmts.get(i);
                if (assign.getPlace().hasProjection() || !(assign.getRvalue() instanceof Rvalue.Use)) continue;
                Constant c = ((Rvalue.Use) assign.getRvalue()).getOperand().getConstant();
                MirLocal dest = function.getLocal(assign.getPlace().getLocal());
                if (c == null || dest == null || !c.isLiteral()) continue;
                if (c.getValue().getKind() == ConstantValue.Kind.NULL) continue;
                if (!compatible(dest.getType(), c.getType())) {
                    errors.add(new ValidationError(ValidationError.Kind.TYPE_MISMATCH, function.getName(),
                            block.getId(), dest.getId(), new Location(block.getId(), i),
                            "_" + dest.getId() + ": " + dest.getType() + " 被赋值为 " + c.getType() + " 常量"));
                }
            }
            MirTerminator term = block.getTerminator();
            if (term instanceof MirTerminator.SwitchInt) {
                MirTerminator.SwitchInt sw = (MirTerminator.SwitchInt) term;
                MirType switchType = sw.getSwitchType();
                MirType actual = null;
                if (sw.getDiscriminant().getConstant() != null) {
                    actual = sw.getDiscriminant().getConstant().getType();
                } else if (sw.getDiscriminant().getDirectLocal() >= 0) {
                    MirLocal local = function.getLocal(sw.getDiscriminant().getDirectLocal());
                    if (local != null) actual = local.getType();
                }
                Location loc = new Location(block.getId(), block.getStatements().size());
                if (!isSwitchable(switchType)) {
                    errors.add(new ValidationError(ValidationError.Kind.TYPE_MISMATCH, function.getName(),
                            block.getId(), -1, loc, "SwitchInt 的判别类型 " + switchType + " 不是整数类别"));
                } else if (actual != null && !compatible(switchType, actual)) {
                    errors.add(new ValidationError(ValidationError.Kind.TYPE_MISMATCH, function.getName(),
                            block.getId(), sw.getDiscriminant().getDirectLocal(), loc,
                            "SwitchInt 判别式类型 " + actual + " 与 " + switchType + " 不符"));
                }
            }
        }
    }

    private static boolean compatible(MirType expected, MirType found) {
        String a = expected.getCategory();
        String b = found.getCategory();
        return a.equals("other") || b.equals("other") || a.equals(b);
    }

    private static boolean isSwitchable(MirType type) {
        return type.isInteger() || type.isBool() || type.getKind() == MirType.Kind.CHAR;
    }

    // ==================== 赋值与初始化 ====================

    private void checkMultipleAssignment(MirFunction function, List<ValidationError> errors) {
        Map<Integer, Integer> counts = new TreeMap<>();
        Map<Integer, Location> first = new TreeMap<>();
        for (BasicBlock block : function.getBlocks()) {
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                if (!(stmts.get(i) instanceof MirStatement.Assign)) continue;
                int def = ((MirStatement.Assign) stmts.get(i)).getDefinedLocal();
                if (def < 0) continue;
                counts.merge(def, 1, Integer::sum);
                first.putIfAbsent(def, new Location(block.getId(), i));
            }
        }
        for (Map.Entry<Integer, Integer> e : counts.entrySet()) {
            if (e.getValue() > 1) {
                Location loc = first.get(e.getKey());
                errors.add(new ValidationError(ValidationError.Kind.MULTIPLE_ASSIGNMENT, function.getName(),
                        loc.getBlock(), e.getKey(), loc, "_" + e.getKey() + " 被赋值 " + e.getValue() + " 次"));
            }
        }
    }

    private void checkInitialization(MirFunction function, List<ValidationError> errors) {
        DataflowResults<Set<Definition>> reaching = ReachingDefinitions.compute(function);
        for (int id : Cfg.reachable(function)) {
            BasicBlock block = function.getBlock(id);
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                MirStatement stmt = stmts.get(i);
                if (stmt.getKind() != MirStatement.Kind.ASSIGN) continue;
                Set<Integer> reads = new TreeSet<>();
                stmt.collectReadLocals(reads);
                Rvalue rv = ((MirStatement.Assign) stmt).getRvalue();
                // 取引用不读取值
                if (rv instanceof Rvalue.Ref && !((Rvalue.Ref) rv).getPlace().hasProjection()) {
                    reads.remove(((Rvalue.Ref) rv).getPlace().getLocal());
                }
                reportUninitialized(function, reads, new Location(id, i), reaching, errors);
            }
            Set<Integer> reads = new TreeSet<>();
            MirTerminator term = block.getTerminator();
            term.collectReadLocals(reads);
            if (term.getKind() == MirTerminator.Kind.RETURN && function.hasReturnLocal()) {
                reads.add(function.getReturnLocal());
            }
            reportUninitialized(function, reads, new Location(id, stmts.size()), reaching, errors);
        }
    }

    private void reportUninitialized(MirFunction function, Set<Integer> reads, Location loc,
                                     DataflowResults<Set<Definition>> reaching, List<ValidationError> errors) {
        if (reads.isEmpty()) return;
        Set<Definition> before = reaching.before(loc);
        for (int local : reads) {
            if (function.isParamLocal(local)) continue;
            if (ReachingDefinitions.definitionsOf(before, local).isEmpty()) {
                errors.add(new ValidationError(ValidationError.Kind.UNINITIALIZED_LOCAL, function.getName(),
                        loc.getBlock(), local, loc, "_" + local + " 可能在赋值前被读取"));
            }
        }
    }
}
