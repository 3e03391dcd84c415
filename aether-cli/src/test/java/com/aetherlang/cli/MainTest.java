package com.aetherlang.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("命令行测试")
class MainTest {

    @TempDir
    Path dir;

    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cmd = new CommandLine(new Main());
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @Test
    @DisplayName("没有输入时打印用法并返回 1")
    void testNoInput() {
        assertThat(cmd.execute()).isEqualTo(1);
        assertThat(err.toString()).contains("aether-opt");
    }

    @Test
    @DisplayName("--version")
    void testVersion() {
        assertThat(cmd.execute("--version")).isZero();
        assertThat(out.toString()).contains("Aether v0.1.0");
    }

    @Test
    @DisplayName("子命令 profile-stats")
    void testProfileStatsSubcommand() throws IOException {
        Path profile = dir.resolve("run.profdata");
        Files.write(profile, "FUNC:main:5\n".getBytes(StandardCharsets.UTF_8));

        assertThat(cmd.execute("profile-stats", profile.toString(), "--hot-threshold", "1")).isZero();
        assertThat(out.toString()).contains("热函数: 1");
    }

    @Test
    @DisplayName("子命令 validate 的输入不存在")
    void testValidateMissingFile() {
        assertThat(cmd.execute("validate", dir.resolve("none.json").toString())).isEqualTo(1);
    }

    @Test
    @DisplayName("未知预设")
    void testUnknownPreset() throws IOException {
        Path input = dir.resolve("empty.json");
        Files.write(input, "{\"functions\": []}".getBytes(StandardCharsets.UTF_8));

        assertThat(cmd.execute("--preset", "turbo", input.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("turbo");
    }
}
