package com.aetherlang.ir.profile;

/**
 * 基于剖析数据的调用边内联决策。
 */
public enum InlineDecision {
    ALWAYS_INLINE,
    /** 只在调用者本身是热函数时内联 */
    INLINE_HOT,
    NEVER_INLINE,
    DEFAULT;

    /** 被调者执行次数低于该值视为冷函数 */
    public static final long COLD_FUNCTION_COUNT = 10;

    /**
     * 调用频率 = 调用次数 / 调用者执行次数。
     */
    public static InlineDecision decide(long calleeCount, long callCount, long callerCount, long hotThreshold) {
        double frequency = callerCount > 0 ? (double) callCount / callerCount : 0.0;
        if (calleeCount > hotThreshold && frequency > 0.8) {
            return ALWAYS_INLINE;
        }
        if (calleeCount > hotThreshold / 2 && frequency > 0.5) {
            return INLINE_HOT;
        }
        if (calleeCount < COLD_FUNCTION_COUNT || frequency < 0.01) {
            return NEVER_INLINE;
        }
        return DEFAULT;
    }
}
