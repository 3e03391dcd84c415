package com.aetherlang.ir.pass.local;

import com.aetherlang.ir.TestPrograms;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.OptimizerConfig;
import com.aetherlang.ir.pass.PassContext;
import com.aetherlang.ir.validation.ValidationError;
import com.aetherlang.ir.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.aetherlang.ir.TestPrograms.add;
import static com.aetherlang.ir.TestPrograms.copy;
import static com.aetherlang.ir.TestPrograms.i64;
import static org.assertj.core.api.Assertions.*;

@DisplayName("内联测试")
class InliningPassTest {

    private PassContext context;

    @BeforeEach
    void setUp() {
        context = new PassContext(new OptimizerConfig());
    }

    private static MirFunction addOne() {
        MirBuilder b = new MirBuilder();
        b.startFunction("add1", MirType.ofI64(), MirBuilder.param("x", MirType.ofI64()));
        b.assign(b.getReturnLocal(), add(copy(0), i64(1)));
        b.returnValue();
        return b.finish();
    }

    private static boolean containsCall(MirFunction function) {
        for (BasicBlock block : function.getBlocks()) {
            for (MirStatement stmt : block.getStatements()) {
                if (stmt instanceof MirStatement.Assign
                        && ((MirStatement.Assign) stmt).getRvalue() instanceof Rvalue.Call) {
                    return true;
                }
            }
        }
        return false;
    }

    @Nested
    @DisplayName("InliningPass")
    class Pass {

        @Test
        @DisplayName("小函数的调用点被展开")
        void testInlinesSmallCallee() {
            MirProgram program = TestPrograms.programOf(TestPrograms.caller("main", "add1", i64(5)), addOne());

            assertThat(new InliningPass().runOnProgram(program, context)).isTrue();
            MirFunction main = program.getFunction("main");
            assertThat(containsCall(main)).isFalse();
            assertThat(new Validator().validate(main)).noneMatch(ValidationError::isError);
            assertThat(context.hasWarnings()).isFalse();
        }

        @Test
        @DisplayName("被内联的局部变量带有被调函数名前缀")
        void testRenamesCalleeLocals() {
            MirProgram program = TestPrograms.programOf(TestPrograms.caller("main", "add1", i64(5)), addOne());
            new InliningPass().runOnProgram(program, context);

            MirFunction main = program.getFunction("main");
            boolean found = false;
            for (int id : main.getLocals().keySet()) {
                if ("add1::x".equals(main.getLocal(id).getName())) found = true;
            }
            assertThat(found).isTrue();
        }

        @Test
        @DisplayName("递归函数不内联")
        void testSkipsRecursive() {
            MirProgram program = TestPrograms.programOf(
                    TestPrograms.caller("main", "down", i64(3)), TestPrograms.recursive("down"));

            assertThat(new InliningPass().runOnProgram(program, context)).isFalse();
            assertThat(containsCall(program.getFunction("main"))).isTrue();
        }

        @Test
        @DisplayName("超过成本阈值的函数不内联")
        void testRespectsThreshold() {
            OptimizerConfig config = new OptimizerConfig();
            config.setInlineThreshold(1);
            MirProgram program = TestPrograms.programOf(TestPrograms.caller("main", "add1", i64(5)), addOne());

            assertThat(new InliningPass().runOnProgram(program, new PassContext(config))).isFalse();
        }
    }

    @Nested
    @DisplayName("Inliner")
    class Splice {

        @Test
        @DisplayName("间接调用无法内联")
        void testIndirectCall() {
            MirBuilder b = new MirBuilder();
            b.startFunction("main", MirType.ofI64(), MirBuilder.param("fp", MirType.ofFunction()));
            b.assign(b.getReturnLocal(), Rvalue.call(Operand.copy(0), Collections.<Operand>emptyList()));
            b.returnValue();
            MirFunction main = b.finish();

            assertThat(Inliner.inline(main, new Location(main.getEntryBlock(), 0), addOne()))
                    .isEqualTo(Inliner.Outcome.INDIRECT_CALL);
        }

        @Test
        @DisplayName("实参个数不符时拒绝")
        void testArityMismatch() {
            MirFunction main = TestPrograms.caller("main", "add1");

            assertThat(Inliner.inline(main, new Location(main.getEntryBlock(), 0), addOne()))
                    .isEqualTo(Inliner.Outcome.ARITY_MISMATCH);
        }

        @Test
        @DisplayName("非调用位置")
        void testNotACall() {
            MirFunction main = TestPrograms.constantReturn("main", 1);

            assertThat(Inliner.inline(main, new Location(main.getEntryBlock(), 0), addOne()))
                    .isEqualTo(Inliner.Outcome.NOT_A_CALL);
        }

        @Test
        @DisplayName("内联后调用之后的语句移入后续块")
        void testSplitsBlock() {
            MirBuilder b = new MirBuilder();
            b.startFunction("main", MirType.ofI64());
            int r = b.newLocal("r", MirType.ofI64());
            b.assign(r, TestPrograms.call("add1", i64(1)));
            b.assign(b.getReturnLocal(), add(copy(r), i64(2)));
            b.returnValue();
            MirFunction main = b.finish();
            int before = main.getBlockCount();

            assertThat(Inliner.inline(main, new Location(main.getEntryBlock(), 0), addOne()))
                    .isEqualTo(Inliner.Outcome.INLINED);
            assertThat(main.getBlockCount()).isEqualTo(before + 2);
            assertThat(new Validator().validate(main)).noneMatch(ValidationError::isError);
        }
    }
}
