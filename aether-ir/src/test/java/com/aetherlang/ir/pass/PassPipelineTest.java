package com.aetherlang.ir.pass;

import com.aetherlang.ir.TestPrograms;
import com.aetherlang.ir.mir.BasicBlock;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.profile.ProfileException;
import com.aetherlang.ir.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Collections;

import static com.aetherlang.ir.TestPrograms.i64;
import static org.assertj.core.api.Assertions.*;

@DisplayName("PassPipeline 测试")
class PassPipelineTest {

    private OptimizerConfig config;

    @BeforeEach
    void setUp() {
        config = new OptimizerConfig();
    }

    /** 把入口块改为跳向不存在的块。 */
    private static MirPass edgeBreaker() {
        return new MirPass() {
            @Override
            public String getName() {
                return "breaker";
            }

            @Override
            public boolean runOnFunction(MirFunction function, PassContext context) {
                function.getEntry().setTerminator(MirTerminator.goTo(99));
                return true;
            }
        };
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
    @DisplayName("预设")
    class Presets {

        @Test
        @DisplayName("按名称创建四种预设")
        void testKnownPresets() {
            assertThat(PassPipeline.forPreset("default", config, null).getPasses())
                    .extracting(MirPass::getName)
                    .containsExactly("constant-folding", "dead-code-elimination", "common-subexpression-elimination");
            assertThat(PassPipeline.forPreset("advanced", config, null).getPasses()).hasSize(7);
            assertThat(PassPipeline.forPreset("whole-program", config, null).getPasses().get(0).getName())
                    .isEqualTo("whole-program");
        }

        @Test
        @DisplayName("未知预设")
        void testUnknownPreset() {
            assertThatThrownBy(() -> PassPipeline.forPreset("fastest", config, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("fastest");
        }

        @Test
        @DisplayName("剖析引导预设需要剖析文件")
        void testProfileGuidedNeedsProfile(@TempDir Path dir) {
            assertThatThrownBy(() -> PassPipeline.forPreset("profile-guided", config, null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> PassPipeline.forPreset("profile-guided", config, dir.resolve("none")))
                    .isInstanceOf(ProfileException.class);
        }
    }

    @Nested
    @DisplayName("执行")
    class Running {

        @Test
        @DisplayName("删除死代码后成功")
        void testSuccess() {
            OptimizationResult result = PassPipeline.createDefault(config).run(
                    TestPrograms.programOf(TestPrograms.deadStore()));

            assertThat(result.getStatus()).isEqualTo(OptimizationResult.Status.SUCCESS);
            assertThat(result.isChanged()).isTrue();
            assertThat(result.getPassChanges().get("dead-code-elimination")).isPositive();
            assertThat(result.getFailedPass()).isNull();
        }

        @Test
        @DisplayName("没有可优化之处时一轮结束")
        void testFixedPoint() {
            OptimizationResult result = PassPipeline.createDefault(config).run(
                    TestPrograms.programOf(TestPrograms.constantReturn("main", 1)));

            assertThat(result.getIterations()).isEqualTo(1);
            assertThat(result.isChanged()).isFalse();
            assertThat(result.getPassChanges()).containsOnlyKeys(
                    "constant-folding", "dead-code-elimination", "common-subexpression-elimination");
        }

        @Test
        @DisplayName("非法输入直接失败")
        void testInvalidInput() {
            OptimizationResult result = PassPipeline.createDefault(config).run(
                    TestPrograms.programOf(TestPrograms.missingTerminator()));

            assertThat(result.getStatus()).isEqualTo(OptimizationResult.Status.FAILURE);
            assertThat(result.getIterations()).isZero();
            assertThat(result.getFailedPass()).isNull();
            assertThat(result.getValidationErrors()).isNotEmpty();
        }

        @Test
        @DisplayName("破坏 IR 的 pass 被记录")
        void testFailingPass() {
            PassPipeline pipeline = PassPipeline.createDefault(config);
            pipeline.addPass(edgeBreaker());

            OptimizationResult result = pipeline.run(TestPrograms.programOf(TestPrograms.constantReturn("main", 1)));
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getFailedPass()).isEqualTo("breaker");
            assertThat(result.getIterations()).isEqualTo(1);
            assertThat(result.toString()).contains("breaker");
        }

        @Test
        @DisplayName("关闭逐 pass 校验时在最后校验")
        void testValidateAtEnd() {
            config.setValidateEachPass(false);
            config.setMaxIterations(2);
            PassPipeline pipeline = new PassPipeline(config);
            pipeline.addPass(edgeBreaker());

            OptimizationResult result = pipeline.run(TestPrograms.programOf(TestPrograms.constantReturn("main", 1)));
            assertThat(result.getStatus()).isEqualTo(OptimizationResult.Status.FAILURE);
            assertThat(result.getFailedPass()).isNull();
            assertThat(result.getIterations()).isEqualTo(2);
        }

        @Test
        @DisplayName("pass 警告使结果带警告")
        void testWarnings() {
            MirBuilder b = new MirBuilder();
            b.startFunction("main", MirType.ofI64(), MirBuilder.param("fp", MirType.ofFunction()));
            b.assign(b.getReturnLocal(), Rvalue.call(Operand.copy(0), Collections.<Operand>emptyList()));
            b.returnValue();

            OptimizationResult result = PassPipeline.createAdvanced(config).run(TestPrograms.programOf(b.finish()));
            assertThat(result.getStatus()).isEqualTo(OptimizationResult.Status.SUCCESS_WITH_WARNINGS);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getWarnings()).isNotEmpty();
        }

        @Test
        @DisplayName("全程序预设内联并折叠纯函数")
        void testWholeProgram() {
            MirProgram program = TestPrograms.programOf(TestPrograms.caller("main", "square", i64(7)),
                    TestPrograms.square("square"));

            OptimizationResult result = PassPipeline.createWholeProgram(config).run(program);
            assertThat(result.isSuccess()).isTrue();
            assertThat(containsCall(program.getFunction("main"))).isFalse();
            assertThat(new Validator().validate(program).isValid()).isTrue();
        }

        @Test
        @DisplayName("高级预设展开计数循环")
        void testAdvancedOnLoop() {
            MirProgram program = TestPrograms.programOf(TestPrograms.countedSum());

            OptimizationResult result = PassPipeline.createAdvanced(config).run(program);
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getPassChanges().get("loop")).isPositive();
        }
    }

    @Test
    @DisplayName("只对单个函数运行函数级 pass")
    void testOptimizeFunction() {
        MirFunction fn = TestPrograms.deadStore();

        OptimizationResult result = PassPipeline.createDefault(config).optimizeFunction(fn);
        assertThat(result.isSuccess()).isTrue();
        assertThat(fn.getEntry().getStatements()).hasSize(2);
    }
}
