package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.ConstantValue;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirLocal;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 归纳变量识别。
 * <p>
 * 只接受在循环内恰好被写一次、且未被取地址的整数局部变量，
 * 这样下游的边界计算与强度削弱可以依赖“每条路径上只有这一处更新”。
 */
public final class InductionVariableAnalysis {

    private InductionVariableAnalysis() {}

    public static InductionVariables analyze(MirFunction function, LoopInfo loop, Set<Integer> addressTaken) {
        InductionVariables result = new InductionVariables();
        Map<Integer, Integer> writes = LocalUsage.writeCounts(function, loop.getBlocks());

        // ---- 基本归纳变量 ----
        for (int blockId : loop.getBlocks()) {
            List<MirStatement> stmts = function.getBlock(blockId).getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                MirStatement.Assign assign = asSingleDef(function, stmts.get(i), writes, addressTaken);
                if (assign == null) continue;
                int local = assign.getDefinedLocal();
                Rvalue rv = assign.getRvalue();
                if (!(rv instanceof Rvalue.BinaryOp)) continue;
                Rvalue.BinaryOp bin = (Rvalue.BinaryOp) rv;
                BigInteger step = null;
                Constant stepConst = null;
                if (bin.getOp() == BinOp.ADD || bin.getOp() == BinOp.SUB) {
                    if (bin.getLeft().getDirectLocal() == local && intConstant(bin.getRight()) != null) {
                        stepConst = bin.getRight().getConstant();
                        step = intConstant(bin.getRight());
                        if (bin.getOp() == BinOp.SUB) step = step.negate();
                    } else if (bin.getOp() == BinOp.ADD && bin.getRight().getDirectLocal() == local
                            && intConstant(bin.getLeft()) != null) {
                        stepConst = bin.getLeft().getConstant();
                        step = intConstant(bin.getLeft());
                    }
                }
                if (step != null) {
                    result.addBasic(new InductionVariables.Basic(local, step, stepConst, new Location(blockId, i)));
                }
            }
        }
        if (result.getBasic().isEmpty()) return result;

        // ---- 派生归纳变量 ----
        for (int blockId : loop.getBlocks()) {
            BasicBlock block = function.getBlock(blockId);
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                MirStatement.Assign assign = asSingleDef(function, stmts.get(i), writes, addressTaken);
                if (assign == null) continue;
                int local = assign.getDefinedLocal();
                if (result.findBasic(local) != null) continue;
                Rvalue rv = assign.getRvalue();
                if (!(rv instanceof Rvalue.BinaryOp)) continue;
                Rvalue.BinaryOp bin = (Rvalue.BinaryOp) rv;
                if (bin.getOp() != BinOp.MUL && bin.getOp() != BinOp.ADD) continue;
                int base = -1;
                Operand factor = null;
                if (result.findBasic(bin.getLeft().getDirectLocal()) != null && intConstant(bin.getRight()) != null) {
                    base = bin.getLeft().getDirectLocal();
                    factor = bin.getRight();
                } else if (result.findBasic(bin.getRight().getDirectLocal()) != null
                        && intConstant(bin.getLeft()) != null) {
                    base = bin.getRight().getDirectLocal();
                    factor = bin.getLeft();
                }
                if (base >= 0 && base != local) {
                    result.addDerived(new InductionVariables.Derived(local, base, bin.getOp(),
                            factor.getConstant(), new Location(blockId, i)));
                }
            }
        }
        return result;
    }

    /** 整数常量操作数的值，否则 null。 */
    static BigInteger intConstant(Operand operand) {
        Constant c = operand.getConstant();
        if (c == null || !(c.getValue() instanceof ConstantValue.Int)) return null;
        return ((ConstantValue.Int) c.getValue()).getValue();
    }

    private static MirStatement.Assign asSingleDef(MirFunction function, MirStatement stmt,
                                                   Map<Integer, Integer> writes, Set<Integer> addressTaken) {
        if (!(stmt instanceof MirStatement.Assign)) return null;
        MirStatement.Assign assign = (MirStatement.Assign) stmt;
        int local = assign.getDefinedLocal();
        if (local < 0 || addressTaken.contains(local)) return null;
        Integer count = writes.get(local);
        if (count == null || count != 1) return null;
        MirLocal decl = function.getLocal(local);
        if (decl == null || !decl.getType().isInteger()) return null;
        return assign;
    }
}
