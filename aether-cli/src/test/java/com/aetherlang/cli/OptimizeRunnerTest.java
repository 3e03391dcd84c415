package com.aetherlang.cli;

import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import com.aetherlang.ir.serial.ProgramJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OptimizeRunner 测试")
class OptimizeRunnerTest {

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;
    private OptimizeRunner runner;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        runner = new OptimizeRunner(new PrintWriter(out), new PrintWriter(err));
    }

    /**
     * fn main() -> i64: x = 2 + 3; y = 7; _ret = x
     */
    private Path writeProgram() throws IOException {
        MirBuilder b = new MirBuilder();
        b.startFunction("main", MirType.ofI64());
        int x = b.newLocal("x", MirType.ofI64());
        int y = b.newLocal("y", MirType.ofI64());
        b.assign(x, Rvalue.binary(BinOp.ADD, Operand.constant(Constant.ofI64(2)), Operand.constant(Constant.ofI64(3))));
        b.assign(y, Rvalue.use(Operand.constant(Constant.ofI64(7))));
        b.assign(b.getReturnLocal(), Rvalue.use(Operand.copy(x)));
        b.returnValue();
        MirProgram program = new MirProgram();
        program.addFunction(b.finish());
        Path file = dir.resolve("main.json");
        ProgramJson.save(program, file);
        return file;
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Nested
    @DisplayName("optimize")
    class Optimize {

        @Test
        @DisplayName("优化结果写入输出文件")
        void testWritesOutput() throws IOException {
            Path output = dir.resolve("out.json");

            assertThat(runner.optimize(writeProgram(), "default", null, null, null, output, false)).isZero();
            MirFunction main = ProgramJson.load(output).getFunction("main");
            assertThat(main.getEntry().getStatements()).contains(
                    MirStatement.assign(1, Rvalue.use(Operand.constant(Constant.ofI64(5)))));
            assertThat(main.hasLocal(2)).isFalse();
            assertThat(err.toString()).contains("SUCCESS");
        }

        @Test
        @DisplayName("未指定输出时 JSON 写到标准输出")
        void testPrintsJson() throws IOException {
            assertThat(runner.optimize(writeProgram(), "advanced", null, 3, null, null, false)).isZero();
            assertThat(out.toString()).contains("\"functions\"");
        }

        @Test
        @DisplayName("--dump 输出文本形式")
        void testDump() throws IOException {
            assertThat(runner.optimize(writeProgram(), "default", null, null, null, null, true)).isZero();
            assertThat(out.toString()).contains("main").doesNotContain("\"functions\"");
        }

        @Test
        @DisplayName("输入文件不存在")
        void testMissingInput() {
            assertThat(runner.optimize(dir.resolve("none.json"), "default", null, null, null, null, false))
                    .isEqualTo(1);
            assertThat(err.toString()).contains("none.json");
        }

        @Test
        @DisplayName("输入格式错误")
        void testMalformedInput() throws IOException {
            Path bad = write("bad.json", "{\"functions\": 3}");

            assertThat(runner.optimize(bad, "default", null, null, null, null, false)).isEqualTo(1);
            assertThat(err.toString()).contains("格式错误");
        }

        @Test
        @DisplayName("未知预设与缺少剖析文件")
        void testBadPreset() throws IOException {
            Path input = writeProgram();

            assertThat(runner.optimize(input, "turbo", null, null, null, null, false)).isEqualTo(1);
            assertThat(runner.optimize(input, "profile-guided", null, null, null, null, false)).isEqualTo(1);
            assertThat(runner.optimize(input, "profile-guided", dir.resolve("none.profdata"), null, null, null,
                    false)).isEqualTo(1);
        }

        @Test
        @DisplayName("剖析引导预设")
        void testProfileGuided() throws IOException {
            Path profile = write("run.profdata", "FUNC:main:10\nBLOCK:main:0:10\n");

            assertThat(runner.optimize(writeProgram(), "profile-guided", profile, null, null, null, false)).isZero();
        }

        @Test
        @DisplayName("配置文件覆盖默认值")
        void testConfigFile() throws IOException {
            Path config = write("config.json", "{\"maxIterations\": 1, \"validateEachPass\": false}");

            assertThat(runner.loadConfig(config).getMaxIterations()).isEqualTo(1);
            assertThat(runner.loadConfig(config).isValidateEachPass()).isFalse();
            assertThat(runner.loadConfig(null).getMaxIterations()).isEqualTo(10);
        }

        @Test
        @DisplayName("配置文件语法错误")
        void testBadConfigFile() throws IOException {
            Path config = write("config.json", "{maxIterations: [");

            assertThat(runner.optimize(writeProgram(), "default", null, null, config, null, false)).isEqualTo(1);
            assertThat(err.toString()).contains("config.json");
        }
    }

    @Test
    @DisplayName("validate 报告合法程序")
    void testValidate() throws IOException {
        assertThat(runner.validate(writeProgram())).isZero();
        assertThat(out.toString()).contains("OK");
    }

    @Test
    @DisplayName("validate 报告缺少终止指令")
    void testValidateInvalid() throws IOException {
        MirBuilder b = new MirBuilder();
        b.startFunction("broken", MirType.ofUnit());
        b.pushStatement(MirStatement.nop());
        MirProgram program = new MirProgram();
        program.addFunction(b.finish());
        Path file = dir.resolve("broken.json");
        ProgramJson.save(program, file);

        assertThat(runner.validate(file)).isEqualTo(1);
        assertThat(out.toString()).contains("MISSING_TERMINATOR");
    }

    @Test
    @DisplayName("profile-stats 打印汇总")
    void testProfileStats() throws IOException {
        Path profile = write("run.profdata", "FUNC:main:1000\nFUNC:helper:500\nCALL:main:helper:500\n");

        assertThat(runner.profileStats(profile, 800)).isZero();
        assertThat(out.toString()).contains("函数: 2").contains("总执行次数: 1500").contains("最热函数: main (1000)");
        assertThat(runner.profileStats(dir.resolve("none"), 800)).isEqualTo(1);
    }
}
