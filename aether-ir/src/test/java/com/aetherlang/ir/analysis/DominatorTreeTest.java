package com.aetherlang.ir.analysis;

import com.aetherlang.ir.TestPrograms;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DominatorTree 测试")
class DominatorTreeTest {

    @Test
    @DisplayName("菱形控制流的汇合块由入口直接支配")
    void testDiamond() {
        MirFunction fn = TestPrograms.diamond();
        DominatorTree tree = DominatorTree.compute(fn);

        assertThat(tree.getEntry()).isEqualTo(0);
        assertThat(tree.getReversePostorder().get(0)).isEqualTo(0);
        assertThat(tree.getImmediateDominator(3)).isEqualTo(0);
        assertThat(tree.getImmediateDominator(1)).isEqualTo(0);
        assertThat(tree.getImmediateDominator(0)).isEqualTo(-1);
        assertThat(tree.getChildren(0)).containsExactlyInAnyOrder(1, 2, 3);
    }

    @Test
    @DisplayName("支配关系自反，分支块不支配汇合块")
    void testDominates() {
        DominatorTree tree = DominatorTree.compute(TestPrograms.diamond());

        assertThat(tree.dominates(0, 3)).isTrue();
        assertThat(tree.dominates(3, 3)).isTrue();
        assertThat(tree.strictlyDominates(3, 3)).isFalse();
        assertThat(tree.dominates(1, 3)).isFalse();
        assertThat(tree.getDominators(3)).containsExactly(0, 3);
    }

    @Test
    @DisplayName("循环头支配循环体")
    void testLoopHeaderDominatesBody() {
        DominatorTree tree = DominatorTree.compute(TestPrograms.countedSum());

        assertThat(tree.getImmediateDominator(2)).isEqualTo(1);
        assertThat(tree.getImmediateDominator(3)).isEqualTo(1);
        assertThat(tree.dominates(2, 1)).isFalse();
    }

    @Test
    @DisplayName("不可达块不参与支配关系")
    void testUnreachableBlock() {
        MirBuilder b = new MirBuilder();
        b.startFunction("f", MirType.ofUnit());
        int orphan = b.newBlock();
        b.returnValue();
        b.switchToBlock(orphan);
        b.returnValue();
        DominatorTree tree = DominatorTree.compute(b.finish());

        assertThat(tree.isReachable(orphan)).isFalse();
        assertThat(tree.dominates(0, orphan)).isFalse();
        assertThat(tree.getImmediateDominator(orphan)).isEqualTo(-1);
        assertThat(tree.getDominators(orphan)).isEmpty();
    }
}
