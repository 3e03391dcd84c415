package com.aetherlang.ir.pass;

import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;

/**
 * MIR 优化 pass 接口。
 * <p>
 * 返回值表示 IR 是否被修改；管线据此判断是否到达不动点。
 * 需要整个程序视野的 pass（过程间、全程序、剖析引导）覆盖 {@link #isProgramLevel()}。
 */
public interface MirPass {

    /**
     * Pass 名称。
     */
    String getName();

    /**
     * 是否需要整个程序。为 true 时管线只调用 {@link #runOnProgram}。
     */
    default boolean isProgramLevel() {
        return false;
    }

    /**
     * 对单个函数执行优化。
     */
    boolean runOnFunction(MirFunction function, PassContext context);

    /**
     * 对整个程序执行优化，默认逐个函数调用 {@link #runOnFunction}。
     */
    default boolean runOnProgram(MirProgram program, PassContext context) {
        boolean changed = false;
        for (MirFunction function : program.getFunctions().values()) {
            changed |= runOnFunction(function, context);
        }
        return changed;
    }
}
