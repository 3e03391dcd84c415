package com.aetherlang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli profile-stats 子命令：打印剖析数据统计
 */
@Command(name = "profile-stats", description = "打印剖析数据统计")
public class ProfileStatsCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "剖析数据文件")
    Path file;

    @Option(names = "--hot-threshold", defaultValue = "1000", description = "热函数阈值（默认 1000）")
    long hotThreshold;

    @Override
    public Integer call() {
        return new OptimizeRunner(spec.commandLine().getOut(), spec.commandLine().getErr())
                .profileStats(file, hotThreshold);
    }
}
