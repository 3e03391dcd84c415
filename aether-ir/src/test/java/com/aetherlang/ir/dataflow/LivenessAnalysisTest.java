package com.aetherlang.ir.dataflow;

import com.aetherlang.ir.TestPrograms;
import com.aetherlang.ir.mir.Location;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LivenessAnalysis 测试")
class LivenessAnalysisTest {

    @Test
    @DisplayName("循环中的归纳变量与累加变量在回边上活跃")
    void testLoopLiveness() {
        DataflowResults<Set<Integer>> live = LivenessAnalysis.compute(TestPrograms.countedSum());

        assertThat(live.getDirection()).isEqualTo(Direction.BACKWARD);
        assertThat(live.getBlockEntry(1)).containsExactly(1, 2);
        assertThat(live.getBlockEntry(2)).containsExactly(1, 2);
        assertThat(live.getBlockEntry(0)).isEmpty();
        assertThat(live.getIterations()).isGreaterThanOrEqualTo(4);
    }

    @Test
    @DisplayName("返回值局部变量在返回处活跃")
    void testReturnLocalLiveAtExit() {
        DataflowResults<Set<Integer>> live = LivenessAnalysis.compute(TestPrograms.countedSum());

        assertThat(live.getBlockExit(3)).contains(0);
        assertThat(live.before(new Location(3, 0))).containsExactly(2);
        assertThat(live.after(new Location(3, 0))).contains(0);
    }

    @Test
    @DisplayName("分支中赋值返回值后参数只在入口活跃")
    void testDiamond() {
        DataflowResults<Set<Integer>> live = LivenessAnalysis.compute(TestPrograms.diamond());

        assertThat(live.getBlockEntry(0)).containsExactly(0);
        assertThat(live.getBlockEntry(1)).isEmpty();
        assertThat(live.getBlockEntry(3)).containsExactly(1);
        assertThat(live.isAnalyzed(3)).isTrue();
    }
}
