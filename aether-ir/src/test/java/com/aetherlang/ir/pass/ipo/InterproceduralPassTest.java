package com.aetherlang.ir.pass.ipo;

import com.aetherlang.ir.TestPrograms;
import com.aetherlang.ir.mir.CallingConvention;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.ExternalFunction;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.pass.OptimizerConfig;
import com.aetherlang.ir.pass.PassContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.aetherlang.ir.TestPrograms.add;
import static com.aetherlang.ir.TestPrograms.call;
import static com.aetherlang.ir.TestPrograms.copy;
import static com.aetherlang.ir.TestPrograms.i64;
import static com.aetherlang.ir.mir.MirBuilder.param;
import static org.assertj.core.api.Assertions.*;

@DisplayName("InterproceduralPass 测试")
class InterproceduralPassTest {

    private InterproceduralPass pass;
    private PassContext context;

    @BeforeEach
    void setUp() {
        pass = new InterproceduralPass();
        context = new PassContext(new OptimizerConfig());
    }

    /**
     * fn helper(x) -> i64: _2 = print(x); _1 = x + 1
     */
    private static MirFunction printingHelper() {
        MirBuilder b = new MirBuilder();
        b.startFunction("helper", MirType.ofI64(), param("x", MirType.ofI64()));
        int t = b.newLocal("t", MirType.ofUnit());
        b.assign(t, call("print", copy(0)));
        b.assign(b.getReturnLocal(), add(copy(0), i64(1)));
        b.returnValue();
        return b.finish();
    }

    @Nested
    @DisplayName("死函数删除")
    class DeadFunctions {

        @Test
        @DisplayName("从 main 不可达的函数被删除")
        void testRemovesUnreachable() {
            MirProgram program = TestPrograms.programOf(TestPrograms.caller("main", "helper"),
                    TestPrograms.constantReturn("helper", 1), TestPrograms.constantReturn("unused", 2));

            assertThat(pass.runOnProgram(program, context)).isTrue();
            assertThat(program.getFunctions()).containsOnlyKeys("main", "helper");
        }

        @Test
        @DisplayName("外部函数表中声明的函数视为入口")
        void testExportedFunctionKept() {
            MirProgram program = TestPrograms.programOf(TestPrograms.constantReturn("main", 0),
                    TestPrograms.constantReturn("callback", 1));
            program.addExternalFunction(new ExternalFunction("callback", Collections.<MirType>emptyList(),
                    MirType.ofI64(), CallingConvention.C, false));

            pass.runOnProgram(program, context);
            assertThat(program.getFunctions()).containsKey("callback");
        }

        @Test
        @DisplayName("没有入口时不删除任何函数")
        void testNoEntryPoint() {
            MirProgram program = TestPrograms.programOf(TestPrograms.constantReturn("a", 1),
                    TestPrograms.constantReturn("b", 2));

            assertThat(pass.runOnProgram(program, context)).isFalse();
            assertThat(program.getFunctions()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("常量传播")
    class Constants {

        @Test
        @DisplayName("实参全为常量的纯函数调用在编译期求值")
        void testFoldsPureCall() {
            MirProgram program = TestPrograms.programOf(TestPrograms.caller("main", "square", i64(7)),
                    TestPrograms.square("square"));

            assertThat(pass.runOnProgram(program, context)).isTrue();
            MirFunction main = program.getFunction("main");
            assertThat(main.getEntry().getStatements()).containsExactly(
                    MirStatement.assign(main.getReturnLocal(), Rvalue.use(i64(49))));
        }

        @Test
        @DisplayName("所有调用点传入相同常量时替换参数读取")
        void testConstantArguments() {
            MirBuilder b = new MirBuilder();
            b.startFunction("main", MirType.ofI64());
            int a = b.newLocal("a", MirType.ofI64());
            b.assign(a, call("helper", i64(5)));
            b.assign(b.getReturnLocal(), call("helper", i64(5)));
            b.returnValue();
            MirProgram program = TestPrograms.programOf(b.finish(), printingHelper());

            assertThat(pass.runOnProgram(program, context)).isTrue();
            MirFunction helper = program.getFunction("helper");
            assertThat(helper.getEntry().getStatements()).containsExactly(
                    MirStatement.assign(2, call("print", i64(5))),
                    MirStatement.assign(helper.getReturnLocal(), add(i64(5), i64(1))));
        }

        @Test
        @DisplayName("实参不同时保留参数")
        void testDifferingArguments() {
            MirBuilder b = new MirBuilder();
            b.startFunction("main", MirType.ofI64());
            int a = b.newLocal("a", MirType.ofI64());
            b.assign(a, call("helper", i64(5)));
            b.assign(b.getReturnLocal(), call("helper", i64(6)));
            b.returnValue();
            MirProgram program = TestPrograms.programOf(b.finish(), printingHelper());

            pass.runOnProgram(program, context);
            MirFunction helper = program.getFunction("helper");
            assertThat(helper.getEntry().getStatements().get(1))
                    .isEqualTo(MirStatement.assign(helper.getReturnLocal(), add(copy(0), i64(1))));
        }

        @Test
        @DisplayName("未被修改的全局常量替换为字面量")
        void testPropagatesGlobals() {
            MirBuilder b = new MirBuilder();
            b.startFunction("main", MirType.ofI64());
            b.assign(b.getReturnLocal(), Rvalue.use(Operand.constant(Constant.global("LIMIT"))));
            b.returnValue();
            MirProgram program = TestPrograms.programOf(b.finish());
            program.addConstant("LIMIT", Constant.ofI64(10));

            assertThat(pass.runOnProgram(program, context)).isTrue();
            assertThat(program.getFunction("main").getEntry().getStatements())
                    .containsExactly(MirStatement.assign(0, Rvalue.use(i64(10))));
        }

        @Test
        @DisplayName("单一常量定义在其支配的读取处传播")
        void testSingleDefinitionConstant() {
            MirBuilder b = new MirBuilder();
            b.startFunction("f", MirType.ofI64());
            int x = b.newLocal("x", MirType.ofI64());
            b.assign(x, Rvalue.use(i64(3)));
            b.assign(b.getReturnLocal(), add(copy(x), i64(1)));
            b.returnValue();
            MirFunction fn = b.finish();

            assertThat(pass.runOnFunction(fn, context)).isTrue();
            assertThat(fn.getEntry().getStatements().get(1))
                    .isEqualTo(MirStatement.assign(fn.getReturnLocal(), add(i64(3), i64(1))));
        }
    }

    @Test
    @DisplayName("间接调用产生警告")
    void testWarnsOnIndirectCall() {
        MirBuilder b = new MirBuilder();
        b.startFunction("main", MirType.ofI64(), param("fp", MirType.ofFunction()));
        b.assign(b.getReturnLocal(), Rvalue.call(Operand.copy(0), Collections.<Operand>emptyList()));
        b.returnValue();

        pass.runOnProgram(TestPrograms.programOf(b.finish()), context);
        assertThat(context.hasWarnings()).isTrue();
        assertThat(context.getWarnings().get(0)).contains("main");
    }
}
