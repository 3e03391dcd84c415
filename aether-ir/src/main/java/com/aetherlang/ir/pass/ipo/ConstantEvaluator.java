package com.aetherlang.ir.pass.ipo;

import com.aetherlang.ir.analysis.InterproceduralAnalysis;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.CastKind;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.ConstantValue;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.local.ConstantFolder;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 纯函数的编译期求值器。
 * <p>
 * 在常量上解释执行 MIR，支持 Use、BinaryOp、UnaryOp、数值转换、嵌套的纯函数调用，
 * 以及 Goto、SwitchInt、Return、Assert。遇到其余形式、超出步数上限、
 * 除零或断言失败时放弃求值并返回 null，不抛出异常。
 */
public class ConstantEvaluator {

    /** 嵌套调用深度上限 */
    static final int MAX_DEPTH = 64;

    private final MirProgram program;
    private final InterproceduralAnalysis analysis;
    private final int stepLimit;
    private int steps;

    public ConstantEvaluator(MirProgram program, InterproceduralAnalysis analysis, int stepLimit) {
        this.program = program;
        this.analysis = analysis;
        this.stepLimit = stepLimit;
    }

    /**
     * 以常量实参调用纯函数。
     *
     * @return 返回值常量，无法在编译期求值时为 null
     */
    public Constant evaluate(String function, List<Constant> args) {
        steps = 0;
        return call(function, args, 0);
    }

    /** 上一次求值消耗的步数。 */
    public int getSteps() { return steps; }

    private Constant call(String name, List<Constant> args, int depth) {
        if (depth > MAX_DEPTH || !analysis.isPure(name)) return null;
        MirFunction function = program.getFunction(name);
        if (function == null || args.size() != function.getParams().size()) return null;

        Map<Integer, Constant> env = new HashMap<>();
        for (int i = 0; i < args.size(); i++) {
            env.put(function.getParams().get(i).getLocal(), args.get(i));
        }

        int current = function.getEntryBlock();
        while (true) {
            BasicBlock block = function.getBlock(current);
            if (block == null) return null;
            for (MirStatement stmt : block.getStatements()) {
                if (++steps > stepLimit) return null;
                switch (stmt.getKind()) {
                    case ASSIGN: {
                        MirStatement.Assign assign = (MirStatement.Assign) stmt;
                        if (assign.getPlace().hasProjection()) return null;
                        Constant value = evalRvalue(assign.getRvalue(), env, depth);
                        if (value == null) return null;
                        env.put(assign.getPlace().getLocal(), value);
                        break;
                    }
                    case STORAGE_DEAD:
                        env.remove(((MirStatement.StorageDead) stmt).getLocal());
                        break;
                    default:
                        break;
                }
            }
            if (++steps > stepLimit) return null;
            MirTerminator term = block.getTerminator();
            switch (term.getKind()) {
                case GOTO:
                    current = ((MirTerminator.Goto) term).getTarget();
                    break;
                case SWITCH_INT: {
                    MirTerminator.SwitchInt sw = (MirTerminator.SwitchInt) term;
                    BigInteger value = discriminantValue(operand(sw.getDiscriminant(), env));
                    if (value == null) return null;
                    current = sw.getTargets().targetFor(value);
                    break;
                }
                case ASSERT: {
                    MirTerminator.Assert check = (MirTerminator.Assert) term;
                    Constant cond = operand(check.getCondition(), env);
                    if (cond == null || !(cond.getValue() instanceof ConstantValue.Bool)) return null;
                    if (((ConstantValue.Bool) cond.getValue()).getValue() != check.isExpected()) return null;
                    current = check.getTarget();
                    break;
                }
                case RETURN:
                    return function.hasReturnLocal() ? env.get(function.getReturnLocal()) : null;
                default:
                    return null;
            }
        }
    }

    private Constant evalRvalue(Rvalue rvalue, Map<Integer, Constant> env, int depth) {
        switch (rvalue.getKind()) {
            case USE:
                return operand(((Rvalue.Use) rvalue).getOperand(), env);
            case BINARY_OP: {
                Rvalue.BinaryOp bin = (Rvalue.BinaryOp) rvalue;
                Constant l = operand(bin.getLeft(), env);
                Constant r = operand(bin.getRight(), env);
                return l == null || r == null ? null : ConstantFolder.foldBinary(bin.getOp(), l, r);
            }
            case UNARY_OP: {
                Rvalue.UnaryOp un = (Rvalue.UnaryOp) rvalue;
                Constant c = operand(un.getOperand(), env);
                return c == null ? null : ConstantFolder.foldUnary(un.getOp(), c);
            }
            case CAST: {
                Rvalue.Cast cast = (Rvalue.Cast) rvalue;
                if (cast.getCastKind() != CastKind.NUMERIC) return null;
                Constant c = operand(cast.getOperand(), env);
                return c == null ? null : ConstantFolder.foldCast(c, cast.getType());
            }
            case CALL: {
                Rvalue.Call call = (Rvalue.Call) rvalue;
                String callee = call.getCalleeName();
                if (callee == null) return null;
                List<Constant> args = new ArrayList<>();
                for (Operand arg : call.getArgs()) {
                    Constant c = operand(arg, env);
                    if (c == null) return null;
                    args.add(c);
                }
                return call(callee, args, depth + 1);
            }
            default:
                return null;
        }
    }

    private static Constant operand(Operand operand, Map<Integer, Constant> env) {
        Constant c = operand.getConstant();
        if (c != null) return c.isLiteral() ? c : null;
        if (operand.getPlace().hasProjection()) return null;
        return env.get(operand.getPlace().getLocal());
    }

    static BigInteger discriminantValue(Constant c) {
        if (c == null) return null;
        ConstantValue v = c.getValue();
        if (v instanceof ConstantValue.Int) return ((ConstantValue.Int) v).getValue();
        if (v instanceof ConstantValue.Bool) return ((ConstantValue.Bool) v).getValue() ? BigInteger.ONE : BigInteger.ZERO;
        if (v instanceof ConstantValue.Char) return BigInteger.valueOf(((ConstantValue.Char) v).getCodePoint());
        return null;
    }
}
