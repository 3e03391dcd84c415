package com.aetherlang.ir.analysis;

import com.aetherlang.ir.TestPrograms;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Place;
import com.aetherlang.ir.mir.Projection;
import com.aetherlang.ir.mir.Rvalue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.aetherlang.ir.TestPrograms.i64;
import static com.aetherlang.ir.mir.MirBuilder.param;
import static org.assertj.core.api.Assertions.*;

@DisplayName("InterproceduralAnalysis 测试")
class InterproceduralAnalysisTest {

    private static MirFunction identity(String name) {
        MirBuilder b = new MirBuilder();
        b.startFunction(name, MirType.ofI64(), param("x", MirType.ofI64()));
        b.assign(b.getReturnLocal(), Rvalue.use(Operand.copy(0)));
        b.returnValue();
        return b.finish();
    }

    @Test
    @DisplayName("只做算术的函数是纯的")
    void testPureArithmetic() {
        InterproceduralAnalysis analysis = InterproceduralAnalysis.analyze(
                TestPrograms.programOf(TestPrograms.square("sq"), TestPrograms.caller("main", "sq", i64(2))));

        assertThat(analysis.isPure("sq")).isTrue();
        assertThat(analysis.isPure("main")).isTrue();
        assertThat(analysis.getSummary("main").getSideEffects().callsFunctions()).isTrue();
        assertThat(analysis.getSummary("main").getCalls()).containsExactly("sq");
        assertThat(analysis.isPure("missing")).isFalse();
    }

    @Test
    @DisplayName("外部调用的效果沿调用链传播")
    void testUnknownCallPropagates() {
        InterproceduralAnalysis analysis = InterproceduralAnalysis.analyze(TestPrograms.programOf(
                TestPrograms.caller("io", "print", i64(1)), TestPrograms.caller("main", "io")));

        assertThat(analysis.isPure("io")).isFalse();
        assertThat(analysis.isPure("main")).isFalse();
        assertThat(analysis.getSummary("main").getSideEffects().performsIo()).isTrue();
    }

    @Test
    @DisplayName("经指针写入标记为写内存")
    void testWriteThroughPointer() {
        MirBuilder b = new MirBuilder();
        b.startFunction("store", MirType.ofUnit(), param("p", MirType.ofPtr(MirType.ofI64())));
        b.assign(Place.of(0).project(Projection.deref()), Rvalue.use(i64(7)));
        b.returnValue();
        InterproceduralAnalysis analysis = InterproceduralAnalysis.analyze(TestPrograms.programOf(b.finish()));

        assertThat(analysis.getSummary("store").getSideEffects().writesMemory()).isTrue();
        assertThat(analysis.isPure("store")).isFalse();
    }

    @Test
    @DisplayName("交给外部函数的全局符号视为被修改")
    void testGlobalPassedToExternal() {
        InterproceduralAnalysis analysis = InterproceduralAnalysis.analyze(TestPrograms.programOf(
                TestPrograms.caller("main", "init", Operand.constant(Constant.global("counter")))));

        assertThat(analysis.getModifiedGlobals()).containsExactly("counter");
    }

    @Test
    @DisplayName("递归、不终止与参数逃逸")
    void testSummaryFlags() {
        InterproceduralAnalysis analysis = InterproceduralAnalysis.analyze(TestPrograms.programOf(
                TestPrograms.recursive("down"), TestPrograms.scaledIndex(), identity("id"),
                TestPrograms.square("sq")));

        assertThat(analysis.getSummary("down").isRecursive()).isTrue();
        assertThat(analysis.getSummary("sr").mayNotTerminate()).isTrue();
        assertThat(analysis.getSummary("id").getEscapingParameters()).containsExactly(0);
        assertThat(analysis.getSummary("sq").getEscapingParameters()).isEmpty();
    }
}
