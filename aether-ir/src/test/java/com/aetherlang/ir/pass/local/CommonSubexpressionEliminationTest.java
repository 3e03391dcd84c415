package com.aetherlang.ir.pass.local;

import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.OptimizerConfig;
import com.aetherlang.ir.pass.PassContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.aetherlang.ir.TestPrograms.add;
import static com.aetherlang.ir.TestPrograms.copy;
import static com.aetherlang.ir.TestPrograms.i64;
import static org.assertj.core.api.Assertions.*;

@DisplayName("CommonSubexpressionElimination 测试")
class CommonSubexpressionEliminationTest {

    private CommonSubexpressionElimination pass;
    private PassContext context;
    private MirBuilder builder;
    private int a;
    private int b;
    private int t1;
    private int t2;

    @BeforeEach
    void setUp() {
        pass = new CommonSubexpressionElimination();
        context = new PassContext(new OptimizerConfig());
        builder = new MirBuilder();
        builder.startFunction("cse", MirType.ofUnit());
        a = builder.newLocal("a", MirType.ofI64());
        b = builder.newLocal("b", MirType.ofI64());
        t1 = builder.newLocal("t1", MirType.ofI64());
        t2 = builder.newLocal("t2", MirType.ofI64());
        builder.assign(a, Rvalue.use(i64(10)));
        builder.assign(b, Rvalue.use(i64(20)));
    }

    private List<MirStatement> run() {
        builder.returnValue();
        MirFunction fn = builder.finish();
        pass.runOnFunction(fn, context);
        return fn.getEntry().getStatements();
    }

    @Test
    @DisplayName("重复表达式改写为复制")
    void testReplacesRepeatedExpression() {
        builder.assign(t1, add(copy(a), copy(b)));
        builder.assign(t2, add(copy(a), copy(b)));

        assertThat(run().get(3)).isEqualTo(MirStatement.assign(t2, Rvalue.use(Operand.copy(t1))));
    }

    @Test
    @DisplayName("可交换运算的操作数顺序不影响匹配")
    void testCommutativeOperands() {
        builder.assign(t1, Rvalue.binary(BinOp.MUL, copy(a), copy(b)));
        builder.assign(t2, Rvalue.binary(BinOp.MUL, Operand.move(b), copy(a)));

        assertThat(run().get(3)).isEqualTo(MirStatement.assign(t2, Rvalue.use(Operand.copy(t1))));
    }

    @Test
    @DisplayName("不可交换运算按顺序区分")
    void testNonCommutativeOperands() {
        builder.assign(t1, Rvalue.binary(BinOp.SUB, copy(a), copy(b)));
        Rvalue reversed = Rvalue.binary(BinOp.SUB, copy(b), copy(a));
        builder.assign(t2, reversed);

        assertThat(run().get(3)).isEqualTo(MirStatement.assign(t2, reversed));
    }

    @Test
    @DisplayName("操作数被重新赋值后不再复用")
    void testRedefinitionInvalidates() {
        builder.assign(t1, add(copy(a), copy(b)));
        builder.assign(a, Rvalue.use(i64(30)));
        builder.assign(t2, add(copy(a), copy(b)));

        assertThat(run().get(4)).isEqualTo(MirStatement.assign(t2, add(copy(a), copy(b))));
    }

    @Test
    @DisplayName("不跨基本块传播")
    void testDoesNotCrossBlocks() {
        builder.assign(t1, add(copy(a), copy(b)));
        int next = builder.newBlock();
        builder.goTo(next);
        builder.switchToBlock(next);
        builder.assign(t2, add(copy(a), copy(b)));
        builder.returnValue();
        MirFunction fn = builder.finish();

        assertThat(pass.runOnFunction(fn, context)).isFalse();
        assertThat(fn.getBlock(next).getStatements().get(0))
                .isEqualTo(MirStatement.assign(t2, add(copy(a), copy(b))));
    }

    @Test
    @DisplayName("第二次运行不再修改")
    void testIdempotent() {
        builder.assign(t1, add(copy(a), copy(b)));
        builder.assign(t2, add(copy(a), copy(b)));
        builder.returnValue();
        MirFunction fn = builder.finish();

        assertThat(pass.runOnFunction(fn, context)).isTrue();
        assertThat(pass.runOnFunction(fn, context)).isFalse();
    }
}
