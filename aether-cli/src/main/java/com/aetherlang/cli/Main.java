package com.aetherlang.cli;

import com.aetherlang.ir.pass.PassPipeline;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * aether-opt 入口点（picocli）
 */
@Command(name = "aether-opt", version = "Aether v0.1.0",
         mixinStandardHelpOptions = true,
         description = "优化 JSON 形式的 MIR 程序",
         subcommands = {ValidateCommand.class, ProfileStatsCommand.class})
public class Main implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--preset", defaultValue = PassPipeline.DEFAULT,
            description = "优化预设（default, advanced, whole-program, profile-guided）")
    String preset;

    @Option(names = "--profile", description = "剖析数据文件")
    Path profile;

    @Option(names = "--max-iterations", description = "最大迭代轮数（默认 10）")
    Integer maxIterations;

    @Option(names = "--config", description = "JSON 配置文件")
    Path config;

    @Option(names = {"-o", "--output"}, description = "输出路径（默认标准输出）")
    Path output;

    @Option(names = "--dump", description = "输出优化后 MIR 的文本形式")
    boolean dump;

    @Option(names = {"-v", "--verbose"}, description = "输出 pass 决策日志")
    boolean verbose;

    @Parameters(index = "0", arity = "0..1", description = "输入程序（JSON）")
    Path input;

    @Override
    public Integer call() {
        if (input == null) {
            spec.commandLine().usage(spec.commandLine().getErr());
            return 1;
        }
        if (verbose) enableVerboseLogging();
        OptimizeRunner runner = new OptimizeRunner(spec.commandLine().getOut(), spec.commandLine().getErr());
        return runner.optimize(input, preset, profile, maxIterations, config, output, dump);
    }

    static void enableVerboseLogging() {
        Logger.getLogger("com.aetherlang").setLevel(Level.FINE);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    static void configureLogging() {
        InputStream in = Main.class.getResourceAsStream("/logging.properties");
        if (in == null) return;
        try (InputStream config = in) {
            LogManager.getLogManager().readConfiguration(config);
        } catch (IOException e) {
            System.err.println("警告: 无法读取日志配置 - " + e.getMessage());
        }
    }

    public static void main(String[] args) {
        configureLogging();
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
