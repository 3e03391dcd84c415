package com.aetherlang.ir.profile;

import com.aetherlang.ir.TestPrograms;
import com.aetherlang.ir.mir.MirFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BlockLayout 测试")
class BlockLayoutTest {

    private BlockLayout layout;
    private ProfileData profile;
    private MirFunction function;

    @BeforeEach
    void setUp() {
        layout = new BlockLayout(500, 10);
        profile = new ProfileData();
        function = TestPrograms.diamond();
        profile.recordBlock("branchy", 0, 1000);
        profile.recordBlock("branchy", 1, 900);
        profile.recordBlock("branchy", 2, 1);
        profile.recordBlock("branchy", 3, 1000);
    }

    @Test
    @DisplayName("入口在前，其余按次数降序，冷块在最后")
    void testOrdersByCount() {
        assertThat(layout.compute(function, profile)).containsExactly(0, 3, 1, 2);
    }

    @Test
    @DisplayName("高度偏向的分支把可能后继拉到分支块之后")
    void testLikelySuccessorFollowsBranch() {
        profile.recordBranch("branchy", 0, 1000, 900);

        assertThat(layout.compute(function, profile)).containsExactly(0, 1, 3, 2);
    }

    @Test
    @DisplayName("总次数不够热的分支不调整")
    void testLukewarmBranchIgnored() {
        profile.recordBranch("branchy", 0, 100, 90);

        assertThat(layout.compute(function, profile)).containsExactly(0, 3, 1, 2);
    }

    @Test
    @DisplayName("没有计数的块视为冷块")
    void testMissingCountsAreCold() {
        ProfileData sparse = new ProfileData();
        sparse.recordBlock("branchy", 3, 700);

        assertThat(layout.compute(function, sparse)).containsExactly(0, 3, 1, 2);
        assertThat(layout.isCold(0)).isTrue();
        assertThat(layout.isHot(700)).isTrue();
        assertThat(layout.isHot(500)).isFalse();
    }
}
