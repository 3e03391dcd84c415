package com.aetherlang.ir.pass.local;

import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.OptimizerConfig;
import com.aetherlang.ir.pass.PassContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.aetherlang.ir.TestPrograms.copy;
import static com.aetherlang.ir.TestPrograms.i64;
import static org.assertj.core.api.Assertions.*;

@DisplayName("ConstantFolding 测试")
class ConstantFoldingTest {

    private ConstantFolding pass;
    private PassContext context;

    @BeforeEach
    void setUp() {
        pass = new ConstantFolding();
        context = new PassContext(new OptimizerConfig());
    }

    @Test
    @DisplayName("常量操作数的二元运算被替换为常量")
    void testFoldsBinary() {
        MirBuilder b = new MirBuilder();
        b.startFunction("f", MirType.ofI64());
        b.assign(b.getReturnLocal(), Rvalue.binary(BinOp.ADD, i64(2), i64(3)));
        b.returnValue();
        MirFunction fn = b.finish();

        assertThat(pass.runOnFunction(fn, context)).isTrue();
        MirStatement.Assign assign = (MirStatement.Assign) fn.getEntry().getStatements().get(0);
        assertThat(assign.getRvalue()).isEqualTo(Rvalue.use(Operand.constant(Constant.ofI64(5))));
    }

    @Test
    @DisplayName("除以常量 0 保持原样")
    void testKeepsDivisionByZero() {
        MirBuilder b = new MirBuilder();
        b.startFunction("f", MirType.ofI64(), MirBuilder.param("a", MirType.ofI64()));
        Rvalue div = Rvalue.binary(BinOp.DIV, i64(1), i64(0));
        b.assign(b.getReturnLocal(), div);
        b.returnValue();
        MirFunction fn = b.finish();

        assertThat(pass.runOnFunction(fn, context)).isFalse();
        assertThat(((MirStatement.Assign) fn.getEntry().getStatements().get(0)).getRvalue()).isEqualTo(div);
    }

    @Test
    @DisplayName("读取局部变量的运算不折叠")
    void testIgnoresNonConstant() {
        MirBuilder b = new MirBuilder();
        b.startFunction("f", MirType.ofI64(), MirBuilder.param("a", MirType.ofI64()));
        b.assign(b.getReturnLocal(), Rvalue.binary(BinOp.ADD, copy(0), i64(1)));
        b.returnValue();

        assertThat(pass.runOnFunction(b.finish(), context)).isFalse();
    }

    @Test
    @DisplayName("常量判别式的 SwitchInt 改写为 goto")
    void testSimplifiesConstantBranch() {
        MirBuilder b = new MirBuilder();
        b.startFunction("f", MirType.ofUnit());
        int then = b.newBlock();
        int otherwise = b.newBlock();
        b.setTerminator(MirTerminator.ifElse(Operand.constant(Constant.ofBool(false)), then, otherwise));
        b.switchToBlock(then);
        b.returnValue();
        b.switchToBlock(otherwise);
        b.returnValue();
        MirFunction fn = b.finish();

        assertThat(pass.runOnFunction(fn, context)).isTrue();
        assertThat(fn.getEntry().getTerminator()).isEqualTo(MirTerminator.goTo(otherwise));
    }

    @Test
    @DisplayName("第二次运行不再修改")
    void testIdempotent() {
        MirBuilder b = new MirBuilder();
        b.startFunction("f", MirType.ofBool());
        int t = b.newLocal(MirType.ofI64());
        b.assign(t, Rvalue.binary(BinOp.MUL, i64(6), i64(7)));
        b.assign(b.getReturnLocal(), Rvalue.binary(BinOp.AND,
                Operand.constant(Constant.ofBool(true)), Operand.constant(Constant.ofBool(false))));
        b.returnValue();
        MirFunction fn = b.finish();

        assertThat(pass.runOnFunction(fn, context)).isTrue();
        String once = fn.toString();
        assertThat(pass.runOnFunction(fn, context)).isFalse();
        assertThat(fn.toString()).isEqualTo(once);
        assertThat(ConstantFolding.fold(Rvalue.binary(BinOp.AND,
                Operand.constant(Constant.ofBool(true)), Operand.constant(Constant.ofBool(false)))))
                .isEqualTo(Constant.ofBool(false));
    }
}
