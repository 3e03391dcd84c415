package com.aetherlang.ir.mir;

import com.aetherlang.ir.TestPrograms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MirBuilder 测试")
class MirBuilderTest {

    private MirBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new MirBuilder();
    }

    @Test
    @DisplayName("参数先于返回值局部变量编号")
    void testParamsAndReturnLocal() {
        builder.startFunction("f", MirType.ofI64(),
                MirBuilder.param("a", MirType.ofI64()), MirBuilder.param("b", MirType.ofBool()));
        builder.returnValue();
        MirFunction fn = builder.finish();

        assertThat(fn.getParamLocals()).containsExactly(0, 1);
        assertThat(fn.getLocal(1).getType()).isEqualTo(MirType.ofBool());
        assertThat(fn.getReturnLocal()).isEqualTo(2);
        assertThat(fn.isParamLocal(2)).isFalse();
    }

    @Test
    @DisplayName("unit 返回类型没有返回值局部变量")
    void testUnitReturn() {
        builder.startFunction("f", MirType.ofUnit());
        builder.returnValue();

        assertThat(builder.finish().hasReturnLocal()).isFalse();
    }

    @Test
    @DisplayName("作用域弹出时按声明逆序发射 StorageDead")
    void testScopes() {
        builder.startFunction("f", MirType.ofUnit());
        builder.pushScope();
        int a = builder.declareLocal("a", MirType.ofI64(), Mutability.MUT);
        int b = builder.declareLocal("b", MirType.ofI64(), Mutability.NOT);
        builder.popScope();
        builder.returnValue();
        List<MirStatement> stmts = builder.finish().getEntry().getStatements();

        assertThat(stmts).extracting(MirStatement::getKind).containsExactly(
                MirStatement.Kind.STORAGE_LIVE, MirStatement.Kind.STORAGE_LIVE,
                MirStatement.Kind.STORAGE_DEAD, MirStatement.Kind.STORAGE_DEAD);
        assertThat(((MirStatement.StorageDead) stmts.get(2)).getLocal()).isEqualTo(b);
        assertThat(((MirStatement.StorageDead) stmts.get(3)).getLocal()).isEqualTo(a);
    }

    @Test
    @DisplayName("构建状态错误")
    void testMisuse() {
        assertThatThrownBy(() -> builder.newBlock()).isInstanceOf(IllegalStateException.class);

        builder.startFunction("f", MirType.ofUnit());
        assertThatThrownBy(() -> builder.switchToBlock(7)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.popScope()).isInstanceOf(IllegalStateException.class);
        builder.pushScope();
        assertThatThrownBy(() -> builder.finish()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("控制流图的后继、前驱与可达性")
    void testCfg() {
        MirFunction fn = TestPrograms.diamond();

        assertThat(Cfg.successors(fn.getBlock(0))).containsExactlyInAnyOrder(1, 2);
        assertThat(Cfg.predecessors(fn).get(3)).containsExactlyInAnyOrder(1, 2);
        assertThat(Cfg.predecessors(fn).get(0)).isEmpty();
        assertThat(Cfg.reachable(fn)).containsExactlyInAnyOrder(0, 1, 2, 3);
        assertThat(Cfg.reversePostorder(fn).get(0)).isEqualTo(0);
        assertThat(Cfg.reversePostorder(fn).get(3)).isEqualTo(3);
    }

    @Test
    @DisplayName("块重排必须是现有块的排列")
    void testReorderBlocks() {
        MirFunction fn = TestPrograms.diamond();
        fn.reorderBlocks(Arrays.asList(0, 2, 1, 3));

        assertThat(fn.getBlockIds()).containsExactly(0, 2, 1, 3);
        assertThatThrownBy(() -> fn.reorderBlocks(Arrays.asList(0, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
