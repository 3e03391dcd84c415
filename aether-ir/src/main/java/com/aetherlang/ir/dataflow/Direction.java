package com.aetherlang.ir.dataflow;

/**
 * 数据流分析方向。
 */
public enum Direction {
    FORWARD, BACKWARD
}
