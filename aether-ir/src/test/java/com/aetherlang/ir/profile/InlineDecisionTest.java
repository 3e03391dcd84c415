package com.aetherlang.ir.profile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InlineDecision 测试")
class InlineDecisionTest {

    private static final long HOT = 1000;

    @Test
    @DisplayName("热被调者且几乎每次都调用时总是内联")
    void testAlwaysInline() {
        assertThat(InlineDecision.decide(2000, 900, 1000, HOT)).isEqualTo(InlineDecision.ALWAYS_INLINE);
    }

    @Test
    @DisplayName("较热且调用频繁时在热调用者中内联")
    void testInlineHot() {
        assertThat(InlineDecision.decide(600, 900, 1000, HOT)).isEqualTo(InlineDecision.INLINE_HOT);
    }

    @Test
    @DisplayName("冷函数或罕见调用不内联")
    void testNeverInline() {
        assertThat(InlineDecision.decide(600, 1, 1000, HOT)).isEqualTo(InlineDecision.NEVER_INLINE);
        assertThat(InlineDecision.decide(5, 5, 10, HOT)).isEqualTo(InlineDecision.NEVER_INLINE);
    }

    @Test
    @DisplayName("调用者次数为 0 时频率按 0 计算")
    void testZeroCallerCount() {
        assertThat(InlineDecision.decide(5000, 100, 0, HOT)).isEqualTo(InlineDecision.NEVER_INLINE);
    }

    @Test
    @DisplayName("其余情况交给默认启发式")
    void testDefault() {
        assertThat(InlineDecision.decide(50, 100, 1000, HOT)).isEqualTo(InlineDecision.DEFAULT);
    }
}
