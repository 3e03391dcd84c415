package com.aetherlang.ir.mir;

/**
 * 外部函数调用约定。
 */
public enum CallingConvention {
    AETHER, C, SYSTEM
}
