package com.aetherlang.ir.pass;

import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.pass.ipo.InterproceduralPass;
import com.aetherlang.ir.pass.ipo.WholeProgramPass;
import com.aetherlang.ir.pass.local.CommonSubexpressionElimination;
import com.aetherlang.ir.pass.local.ConstantFolding;
import com.aetherlang.ir.pass.local.DeadCodeElimination;
import com.aetherlang.ir.pass.local.InliningPass;
import com.aetherlang.ir.pass.loop.LoopOptimizationPass;
import com.aetherlang.ir.pass.loop.VectorizationPass;
import com.aetherlang.ir.profile.ProfileData;
import com.aetherlang.ir.profile.ProfileGuidedPass;
import com.aetherlang.ir.validation.ValidationError;
import com.aetherlang.ir.validation.Validator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 优化 Pass 管线。
 * <p>
 * 按顺序反复执行 pass，直到一轮中没有 pass 报告修改，或达到迭代上限。
 * 运行前先校验输入；开启 validateEachPass 时每个修改了 IR 的 pass 之后都重新校验，
 * 校验失败立即以 FAILURE 结束并记录引入错误的 pass。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    public static final String DEFAULT = "default";
    public static final String ADVANCED = "advanced";
    public static final String WHOLE_PROGRAM = "whole-program";
    public static final String PROFILE_GUIDED = "profile-guided";

    public static final List<String> PRESETS =
            Collections.unmodifiableList(Arrays.asList(DEFAULT, ADVANCED, WHOLE_PROGRAM, PROFILE_GUIDED));

    private final OptimizerConfig config;
    private final List<MirPass> passes = new ArrayList<>();
    private final Validator validator = new Validator();

    public PassPipeline(OptimizerConfig config) {
        this.config = config;
    }

    // ==================== 预设 ====================

    /**
     * 常量折叠、死代码消除、公共子表达式消除。
     */
    public static PassPipeline createDefault(OptimizerConfig config) {
        PassPipeline pipeline = new PassPipeline(config);
        pipeline.addPass(new ConstantFolding());
        pipeline.addPass(new DeadCodeElimination());
        pipeline.addPass(new CommonSubexpressionElimination());
        return pipeline;
    }

    public static PassPipeline createAdvanced(OptimizerConfig config) {
        PassPipeline pipeline = new PassPipeline(config);
        pipeline.addPass(new ConstantFolding());
        pipeline.addPass(new DeadCodeElimination());
        pipeline.addPass(new LoopOptimizationPass());
        pipeline.addPass(new InterproceduralPass());
        pipeline.addPass(new VectorizationPass());
        pipeline.addPass(new CommonSubexpressionElimination());
        pipeline.addPass(new InliningPass());
        return pipeline;
    }

    /**
     * 全程序分析在最前，其后是过程间传播和局部清理。
     */
    public static PassPipeline createWholeProgram(OptimizerConfig config) {
        PassPipeline pipeline = new PassPipeline(config);
        pipeline.addPass(new WholeProgramPass());
        pipeline.addPass(new InterproceduralPass());
        pipeline.addPass(new ConstantFolding());
        pipeline.addPass(new DeadCodeElimination());
        pipeline.addPass(new LoopOptimizationPass());
        pipeline.addPass(new VectorizationPass());
        pipeline.addPass(new CommonSubexpressionElimination());
        return pipeline;
    }

    public static PassPipeline createProfileGuided(OptimizerConfig config, ProfileData profile) {
        PassPipeline pipeline = new PassPipeline(config);
        pipeline.addPass(new ConstantFolding());
        pipeline.addPass(new DeadCodeElimination());
        pipeline.addPass(new ProfileGuidedPass(profile));
        pipeline.addPass(new LoopOptimizationPass());
        pipeline.addPass(new VectorizationPass());
        pipeline.addPass(new CommonSubexpressionElimination());
        return pipeline;
    }

    /**
     * 读取剖析文件后创建剖析引导管线。
     *
     * @throws com.aetherlang.ir.profile.ProfileException 文件无法读取
     */
    public static PassPipeline createProfileGuided(OptimizerConfig config, Path profilePath) {
        return createProfileGuided(config, ProfileData.load(profilePath));
    }

    /**
     * 按名称创建预设管线。
     *
     * @param profilePath 仅 profile-guided 需要
     * @throws IllegalArgumentException 未知预设，或 profile-guided 缺少剖析文件
     */
    public static PassPipeline forPreset(String preset, OptimizerConfig config, Path profilePath) {
        if (DEFAULT.equals(preset)) return createDefault(config);
        if (ADVANCED.equals(preset)) return createAdvanced(config);
        if (WHOLE_PROGRAM.equals(preset)) return createWholeProgram(config);
        if (PROFILE_GUIDED.equals(preset)) {
            if (profilePath == null) {
                throw new IllegalArgumentException("预设 " + PROFILE_GUIDED + " 需要剖析文件");
            }
            return createProfileGuided(config, profilePath);
        }
        throw new IllegalArgumentException("未知预设: " + preset + "，可选 " + PRESETS);
    }

    public void addPass(MirPass pass) {
        passes.add(pass);
    }

    public List<MirPass> getPasses() { return Collections.unmodifiableList(passes); }
    public OptimizerConfig getConfig() { return config; }

    // ==================== 执行 ====================

    public OptimizationResult run(MirProgram program) {
        PassContext context = new PassContext(config, program);
        Map<String, Integer> passChanges = initialChanges();

        List<ValidationError> errors = validator.validate(program).getErrors();
        if (!errors.isEmpty()) {
            LOG.warning("输入程序校验失败: " + errors.size() + " 个错误");
            return OptimizationResult.failure(errors, context.getWarnings(), 0, passChanges, null);
        }

        int iteration = 0;
        while (iteration < config.getMaxIterations()) {
            iteration++;
            int changedPasses = 0;
            for (MirPass pass : passes) {
                boolean changed = pass.isProgramLevel()
                        ? pass.runOnProgram(program, context)
                        : runOnFunctions(pass, program, context);
                if (!changed) continue;
                changedPasses++;
                passChanges.put(pass.getName(), passChanges.get(pass.getName()) + 1);
                if (config.isValidateEachPass()) {
                    errors = validator.validate(program).getErrors();
                    if (!errors.isEmpty()) {
                        LOG.warning(pass.getName() + " 之后校验失败: " + errors.get(0));
                        return OptimizationResult.failure(errors, context.getWarnings(), iteration, passChanges,
                                pass.getName());
                    }
                }
            }
            LOG.info("第 " + iteration + " 轮: " + changedPasses + " 个 pass 修改了程序");
            if (changedPasses == 0) break;
        }

        if (!config.isValidateEachPass()) {
            errors = validator.validate(program).getErrors();
            if (!errors.isEmpty()) {
                return OptimizationResult.failure(errors, context.getWarnings(), iteration, passChanges, null);
            }
        }
        return OptimizationResult.success(context.getWarnings(), iteration, passChanges);
    }

    /**
     * 只用函数级 pass 优化单个函数。
     */
    public OptimizationResult optimizeFunction(MirFunction function) {
        PassContext context = new PassContext(config);
        Map<String, Integer> passChanges = initialChanges();

        List<ValidationError> errors = errorsOf(validator.validate(function));
        if (!errors.isEmpty()) {
            return OptimizationResult.failure(errors, context.getWarnings(), 0, passChanges, null);
        }

        int iteration = 0;
        while (iteration < config.getMaxIterations()) {
            iteration++;
            boolean any = false;
            for (MirPass pass : passes) {
                if (pass.isProgramLevel()) continue;
                if (!pass.runOnFunction(function, context)) continue;
                any = true;
                passChanges.put(pass.getName(), passChanges.get(pass.getName()) + 1);
                if (config.isValidateEachPass()) {
                    errors = errorsOf(validator.validate(function));
                    if (!errors.isEmpty()) {
                        return OptimizationResult.failure(errors, context.getWarnings(), iteration, passChanges,
                                pass.getName());
                    }
                }
            }
            if (!any) break;
        }
        LOG.fine(function.getName() + ": " + iteration + " 轮迭代");
        return OptimizationResult.success(context.getWarnings(), iteration, passChanges);
    }

    private static boolean runOnFunctions(MirPass pass, MirProgram program, PassContext context) {
        boolean changed = false;
        for (MirFunction function : new ArrayList<>(program.getFunctions().values())) {
            changed |= pass.runOnFunction(function, context);
        }
        return changed;
    }

    private Map<String, Integer> initialChanges() {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (MirPass pass : passes) result.put(pass.getName(), 0);
        return result;
    }

    private static List<ValidationError> errorsOf(List<ValidationError> entries) {
        List<ValidationError> result = new ArrayList<>();
        for (ValidationError e : entries) {
            if (e.isError()) result.add(e);
        }
        return result;
    }
}
