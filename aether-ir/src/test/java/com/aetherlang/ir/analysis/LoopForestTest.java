package com.aetherlang.ir.analysis;

import com.aetherlang.ir.TestPrograms;
import com.aetherlang.ir.mir.BinOp;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LoopForest 测试")
class LoopForestTest {

    @Test
    @DisplayName("计数循环的结构")
    void testCountedLoopStructure() {
        LoopForest forest = LoopForest.compute(TestPrograms.countedSum());

        assertThat(forest.getLoops()).hasSize(1);
        LoopInfo loop = forest.getLoop(1);
        assertThat(loop.getBlocks()).containsExactly(1, 2);
        assertThat(loop.getLatches()).containsExactly(2);
        assertThat(loop.getPreheader()).isEqualTo(0);
        assertThat(loop.getExitTargets()).containsExactly(3);
        assertThat(loop.getDepth()).isEqualTo(1);
        assertThat(forest.getRoots()).containsExactly(loop);
        assertThat(forest.getLoopDepth(2)).isEqualTo(1);
        assertThat(forest.getLoopDepth(3)).isZero();
    }

    @Test
    @DisplayName("由初值、上界与步长推出迭代次数")
    void testBoundsAndTripCount() {
        LoopInfo loop = LoopForest.compute(TestPrograms.countedSum()).getLoop(1);
        LoopBounds bounds = loop.getBounds();

        assertThat(loop.hasKnownTripCount()).isTrue();
        assertThat(loop.getTripCount()).isEqualTo(4);
        assertThat(bounds.getInductionVariable()).isEqualTo(1);
        assertThat(bounds.getInitial()).isEqualTo(BigInteger.ZERO);
        assertThat(bounds.getLimit()).isEqualTo(BigInteger.valueOf(4));
        assertThat(bounds.getComparison()).isEqualTo(BinOp.LT);
        assertThat(bounds.getBodyTarget()).isEqualTo(2);
        assertThat(bounds.getExitTarget()).isEqualTo(3);
    }

    @Test
    @DisplayName("上界是参数时迭代次数未知")
    void testUnknownTripCount() {
        LoopInfo loop = LoopForest.compute(TestPrograms.scaledIndex()).getLoop(1);

        assertThat(loop.hasKnownTripCount()).isFalse();
        assertThat(loop.getTripCount()).isEqualTo(LoopInfo.UNKNOWN_TRIP_COUNT);
    }

    @Test
    @DisplayName("基本归纳变量与派生归纳变量")
    void testInductionVariables() {
        LoopForest forest = LoopForest.compute(TestPrograms.scaledIndex());
        InductionVariables ivs = forest.getInductionVariables(1);

        assertThat(ivs.getBasic()).hasSize(1);
        InductionVariables.Basic basic = ivs.findBasic(2);
        assertThat(basic).isNotNull();
        assertThat(basic.getStep()).isEqualTo(BigInteger.ONE);
        assertThat(ivs.getDerived()).extracting(InductionVariables.Derived::getLocal).containsExactly(5);
        assertThat(ivs.getDerived().get(0).getBase()).isEqualTo(2);
        assertThat(ivs.getDerived().get(0).getOp()).isEqualTo(BinOp.MUL);
    }

    @Test
    @DisplayName("无回边的函数没有循环")
    void testNoLoops() {
        LoopForest forest = LoopForest.compute(TestPrograms.diamond());

        assertThat(forest.isEmpty()).isTrue();
        assertThat(forest.getInnermostLoop(3)).isNull();
    }
}
