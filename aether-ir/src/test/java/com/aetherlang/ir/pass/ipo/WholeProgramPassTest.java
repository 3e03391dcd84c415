package com.aetherlang.ir.pass.ipo;

import com.aetherlang.ir.TestPrograms;
import com.aetherlang.ir.analysis.InterproceduralAnalysis;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.OptimizerConfig;
import com.aetherlang.ir.pass.PassContext;
import com.aetherlang.ir.validation.ValidationError;
import com.aetherlang.ir.validation.Validator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.aetherlang.ir.TestPrograms.call;
import static com.aetherlang.ir.TestPrograms.copy;
import static com.aetherlang.ir.TestPrograms.i64;
import static com.aetherlang.ir.mir.MirBuilder.param;
import static org.assertj.core.api.Assertions.*;

@DisplayName("WholeProgramPass 测试")
class WholeProgramPassTest {

    /**
     * fn main(n) -> i64: x = callee(n); _ret = callee(x)
     */
    private static MirFunction twoCalls(String callee) {
        MirBuilder b = new MirBuilder();
        b.startFunction("main", MirType.ofI64(), param("n", MirType.ofI64()));
        int x = b.newLocal("x", MirType.ofI64());
        b.assign(x, call(callee, copy(0)));
        b.assign(b.getReturnLocal(), call(callee, copy(x)));
        b.returnValue();
        return b.finish();
    }

    private static int countCalls(MirFunction function) {
        int n = 0;
        for (BasicBlock block : function.getBlocks()) {
            for (MirStatement stmt : block.getStatements()) {
                if (stmt instanceof MirStatement.Assign
                        && ((MirStatement.Assign) stmt).getRvalue() instanceof Rvalue.Call) {
                    n++;
                }
            }
        }
        return n;
    }

    @Test
    @DisplayName("小而纯的函数内联到所有调用点")
    void testInlinesPureCallee() {
        MirProgram program = TestPrograms.programOf(twoCalls("sq"), TestPrograms.square("sq"));
        PassContext context = new PassContext(new OptimizerConfig());

        assertThat(new WholeProgramPass().runOnProgram(program, context)).isTrue();
        MirFunction main = program.getFunction("main");
        assertThat(countCalls(main)).isZero();
        assertThat(new Validator().validate(main)).noneMatch(ValidationError::isError);
    }

    @Test
    @DisplayName("有副作用的函数不是候选")
    void testImpureNotCandidate() {
        MirBuilder b = new MirBuilder();
        b.startFunction("io", MirType.ofI64(), param("x", MirType.ofI64()));
        b.assign(b.getReturnLocal(), call("print", copy(0)));
        b.returnValue();
        MirProgram program = TestPrograms.programOf(twoCalls("io"), b.finish());

        assertThat(WholeProgramPass.findCandidates(program, InterproceduralAnalysis.analyze(program),
                new OptimizerConfig())).isEmpty();
        assertThat(new WholeProgramPass().runOnProgram(program, new PassContext(new OptimizerConfig()))).isFalse();
    }

    @Test
    @DisplayName("调用点多于上限时不内联")
    void testCallSiteLimit() {
        OptimizerConfig config = new OptimizerConfig();
        config.setMaxInlineCallSites(1);
        MirProgram program = TestPrograms.programOf(twoCalls("sq"), TestPrograms.square("sq"));

        assertThat(WholeProgramPass.findCandidates(program, InterproceduralAnalysis.analyze(program), config))
                .isEmpty();
    }

    @Test
    @DisplayName("递归函数不是候选")
    void testRecursiveNotCandidate() {
        MirProgram program = TestPrograms.programOf(
                TestPrograms.caller("main", "down", i64(2)), TestPrograms.recursive("down"));

        assertThat(WholeProgramPass.findCandidates(program, InterproceduralAnalysis.analyze(program),
                new OptimizerConfig())).isEmpty();
    }
}
