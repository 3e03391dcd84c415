package com.aetherlang.ir.pass.local;

import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.ConstantValue;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.MirPass;
import com.aetherlang.ir.pass.PassContext;

import java.math.BigInteger;
import java.util.List;
import java.util.logging.Logger;

/**
 * 常量折叠。
 * <p>
 * 将两个（或一个）常量操作数上的 BinaryOp / UnaryOp 替换为折叠后的常量；
 * 判别式为常量的 SwitchInt 改写为直接跳转，留下的不可达块由 DCE 清理。
 */
public class ConstantFolding implements MirPass {

    private static final Logger LOG = Logger.getLogger(ConstantFolding.class.getName());

    @Override
    public String getName() {
        return "constant-folding";
    }

    @Override
    public boolean runOnFunction(MirFunction function, PassContext context) {
        boolean changed = false;
        int folded = 0;
        for (BasicBlock block : function.getBlocks()) {
            List<MirStatement> stmts = block.getStatements();
            for (int i = 0; i < stmts.size(); i++) {
                if (!(stmts.get(i) instanceof MirStatement.Assign)) continue;
                MirStatement.Assign assign = (MirStatement.Assign) stmts.get(i);
                Constant result = fold(assign.getRvalue());
                if (result != null) {
                    stmts.set(i, assign.withRvalue(Rvalue.use(Operand.constant(result))));
                    folded++;
                    changed = true;
                }
            }
            MirTerminator simplified = simplifyBranch(block.getTerminator());
            if (simplified != null) {
                block.setTerminator(simplified);
                changed = true;
            }
        }
        if (folded > 0) {
            LOG.fine(function.getName() + ": 折叠 " + folded + " 个常量表达式");
        }
        return changed;
    }

    /**
     * 折叠单个 rvalue，无法折叠时返回 null。
     */
    static Constant fold(Rvalue rvalue) {
        if (rvalue instanceof Rvalue.BinaryOp) {
            Rvalue.BinaryOp bin = (Rvalue.BinaryOp) rvalue;
            Constant l = bin.getLeft().getConstant();
            Constant r = bin.getRight().getConstant();
            if (l == null || r == null) return null;
            return ConstantFolder.foldBinary(bin.getOp(), l, r);
        }
        if (rvalue instanceof Rvalue.UnaryOp) {
            Rvalue.UnaryOp un = (Rvalue.UnaryOp) rvalue;
            Constant c = un.getOperand().getConstant();
            return c != null ? ConstantFolder.foldUnary(un.getOp(), c) : null;
        }
        return null;
    }

    private static MirTerminator simplifyBranch(MirTerminator terminator) {
        if (!(terminator instanceof MirTerminator.SwitchInt)) return null;
        MirTerminator.SwitchInt sw = (MirTerminator.SwitchInt) terminator;
        Constant c = sw.getDiscriminant().getConstant();
        if (c == null) return null;
        BigInteger value;
        if (c.getValue() instanceof ConstantValue.Int) {
            value = ((ConstantValue.Int) c.getValue()).getValue();
        } else if (c.getValue() instanceof ConstantValue.Bool) {
            value = ((ConstantValue.Bool) c.getValue()).getValue() ? BigInteger.ONE : BigInteger.ZERO;
        } else {
            return null;
        }
        return MirTerminator.goTo(sw.getTargets().targetFor(value));
    }
}
