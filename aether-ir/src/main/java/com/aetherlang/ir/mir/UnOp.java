package com.aetherlang.ir.mir;

/**
 * MIR 一元运算符。
 */
public enum UnOp {
    NOT, NEG
}
