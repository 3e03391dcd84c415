package com.aetherlang.cli;

import com.aetherlang.ir.mir.MirPrinter;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.pass.OptimizationResult;
import com.aetherlang.ir.pass.OptimizerConfig;
import com.aetherlang.ir.pass.PassPipeline;
import com.aetherlang.ir.profile.ProfileData;
import com.aetherlang.ir.profile.ProfileException;
import com.aetherlang.ir.profile.ProfileStatistics;
import com.aetherlang.ir.serial.IrFormatException;
import com.aetherlang.ir.serial.ProgramJson;
import com.aetherlang.ir.validation.ValidationError;
import com.aetherlang.ir.validation.ValidationReport;
import com.aetherlang.ir.validation.Validator;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 读取、优化、校验与输出的执行器。所有方法返回进程退出码：0 成功，1 失败。
 */
public class OptimizeRunner {

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private final PrintWriter out;
    private final PrintWriter err;

    public OptimizeRunner(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 按预设优化输入程序。
     *
     * @param maxIterations 非 null 时覆盖配置文件中的值
     * @param output 为 null 时将结果 JSON 写到标准输出
     */
    public int optimize(Path input, String preset, Path profile, Integer maxIterations, Path configFile,
                        Path output, boolean dump) {
        OptimizerConfig config = loadConfig(configFile);
        if (config == null) return 1;
        if (maxIterations != null) config.setMaxIterations(maxIterations);

        MirProgram program = loadProgram(input);
        if (program == null) return 1;

        PassPipeline pipeline;
        try {
            pipeline = PassPipeline.forPreset(preset, config, profile);
        } catch (ProfileException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }

        OptimizationResult result = pipeline.run(program);
        for (String warning : result.getWarnings()) {
            err.println("警告: " + warning);
        }
        if (!result.isSuccess()) {
            err.println("优化失败" + (result.getFailedPass() != null ? "（" + result.getFailedPass() + "）" : "") + ":");
            for (ValidationError e : result.getValidationErrors()) {
                err.println("  " + e);
            }
            return 1;
        }
        err.println(result);

        if (dump) {
            out.println(MirPrinter.print(program));
        }
        if (output != null) {
            try {
                ProgramJson.save(program, output);
            } catch (IOException e) {
                err.println("错误: 无法写入 " + output + " - " + e.getMessage());
                return 1;
            }
        } else if (!dump) {
            out.println(ProgramJson.toJson(program));
        }
        out.flush();
        return 0;
    }

    public int validate(Path input) {
        MirProgram program = loadProgram(input);
        if (program == null) return 1;
        ValidationReport report = new Validator().validate(program);
        out.print(report);
        if (report.getEntries().isEmpty()) out.println();
        out.flush();
        return report.isValid() ? 0 : 1;
    }

    public int profileStats(Path file, long hotThreshold) {
        ProfileData data;
        try {
            data = ProfileData.load(file);
        } catch (ProfileException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }
        ProfileStatistics stats = data.getStatistics(hotThreshold);
        out.println("函数: " + stats.getTotalFunctions());
        out.println("基本块: " + stats.getTotalBlocks());
        out.println("分支: " + stats.getTotalBranches());
        out.println("调用边: " + stats.getTotalCalls());
        out.println("循环: " + stats.getTotalLoops());
        out.println("总执行次数: " + stats.getTotalExecutionCount());
        if (stats.getHottestFunction() != null) {
            out.println("最热函数: " + stats.getHottestFunction() + " (" + stats.getHottestCount() + ")");
        }
        out.println("热函数: " + stats.getHotFunctionCount());
        out.flush();
        return 0;
    }

    // ==================== 加载 ====================

    OptimizerConfig loadConfig(Path configFile) {
        if (configFile == null) return new OptimizerConfig();
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            OptimizerConfig config = GSON.fromJson(reader, OptimizerConfig.class);
            return config != null ? config : new OptimizerConfig();
        } catch (IOException | JsonParseException e) {
            err.println("错误: 无法读取配置 " + configFile + " - " + e.getMessage());
            return null;
        }
    }

    private MirProgram loadProgram(Path input) {
        if (!Files.exists(input)) {
            err.println("错误: 文件不存在 - " + input);
            return null;
        }
        try {
            return ProgramJson.load(input);
        } catch (IOException e) {
            err.println("错误: 无法读取 " + input + " - " + e.getMessage());
            return null;
        } catch (IrFormatException e) {
            err.println("错误: " + input + " 格式错误 - " + e.getMessage());
            return null;
        }
    }
}
