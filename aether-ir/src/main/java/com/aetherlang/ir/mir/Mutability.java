package com.aetherlang.ir.mir;

/**
 * 可变性标记。
 */
public enum Mutability {
    NOT, MUT
}
