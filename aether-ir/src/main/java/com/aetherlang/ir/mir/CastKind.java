package com.aetherlang.ir.mir;

/**
 * 类型转换种类。
 */
public enum CastKind {
    NUMERIC, POINTER, UNSIZE
}
