package com.aetherlang.ir.pass;

import com.aetherlang.ir.mir.MirProgram;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 一次管线运行中各 pass 共享的上下文：配置、所属程序与警告。
 * <p>
 * 警告按内容去重，同一个被跳过的调用点在多轮迭代中只记录一次。
 */
public class PassContext {

    private static final Logger LOG = Logger.getLogger(PassContext.class.getName());

    private final OptimizerConfig config;
    private final MirProgram program;
    private final Set<String> warnings = new LinkedHashSet<>();

    public PassContext(OptimizerConfig config, MirProgram program) {
        this.config = config;
        this.program = program;
    }

    public PassContext(OptimizerConfig config) {
        this(config, null);
    }

    public OptimizerConfig getConfig() { return config; }

    /** 所属程序，单函数优化时为 null。 */
    public MirProgram getProgram() { return program; }

    public void warn(String message) {
        if (warnings.add(message)) {
            LOG.fine("警告: " + message);
        }
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }
}
