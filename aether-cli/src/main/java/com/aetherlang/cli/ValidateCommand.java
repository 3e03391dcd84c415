package com.aetherlang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli validate 子命令：打印校验报告
 */
@Command(name = "validate", description = "校验 MIR 程序")
public class ValidateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "输入程序（JSON）")
    Path input;

    @Override
    public Integer call() {
        return new OptimizeRunner(spec.commandLine().getOut(), spec.commandLine().getErr()).validate(input);
    }
}
