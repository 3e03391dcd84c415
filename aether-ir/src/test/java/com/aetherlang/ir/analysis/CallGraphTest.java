package com.aetherlang.ir.analysis;

import com.aetherlang.ir.TestPrograms;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Rvalue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static com.aetherlang.ir.TestPrograms.i64;
import static org.assertj.core.api.Assertions.*;

@DisplayName("CallGraph 测试")
class CallGraphTest {

    private CallGraph graph;

    /**
     * main → square, main → down → down, main → print（外部），table 持有 square 的地址。
     */
    @BeforeEach
    void setUp() {
        MirBuilder b = new MirBuilder();
        b.startFunction("main", MirType.ofI64());
        int x = b.newLocal("x", MirType.ofI64());
        int y = b.newLocal("y", MirType.ofI64());
        int z = b.newLocal("z", MirType.ofUnit());
        b.assign(x, TestPrograms.call("square", i64(3)));
        b.assign(y, TestPrograms.call("down", Operand.copy(x)));
        b.assign(z, TestPrograms.call("print", Operand.copy(y)));
        b.assign(b.getReturnLocal(), Rvalue.use(Operand.copy(y)));
        b.returnValue();
        MirFunction main = b.finish();

        b = new MirBuilder();
        b.startFunction("table", MirType.ofFunction());
        b.assign(b.getReturnLocal(), Rvalue.use(Operand.constant(Constant.function("square"))));
        b.returnValue();
        MirFunction table = b.finish();

        MirProgram program = TestPrograms.programOf(
                main, table, TestPrograms.square("square"), TestPrograms.recursive("down"));
        graph = CallGraph.build(program);
    }

    @Test
    @DisplayName("调用与被调关系")
    void testEdges() {
        assertThat(graph.getFunctions()).containsExactlyInAnyOrder("main", "table", "square", "down");
        assertThat(graph.getCallees("main")).containsExactly("down", "square");
        assertThat(graph.getCallers("square")).containsExactly("main");
        assertThat(graph.getExternalCallees("main")).containsExactly("print");
        assertThat(graph.getCallees("table")).isEmpty();
    }

    @Test
    @DisplayName("调用点记录位置与实参")
    void testCallSites() {
        assertThat(graph.getCallSites("square")).hasSize(1);
        CallSite site = graph.getCallSites("square").get(0);
        assertThat(site.getCaller()).isEqualTo("main");
        assertThat(site.getLocation()).isEqualTo(new Location(0, 0));
        assertThat(site.isTerminator()).isFalse();
        assertThat(site.getArgs()).containsExactly(i64(3));
    }

    @Test
    @DisplayName("自调用的函数是递归的")
    void testRecursion() {
        assertThat(graph.isRecursive("down")).isTrue();
        assertThat(graph.isRecursive("main")).isFalse();
        assertThat(graph.getScc("down")).containsExactly("down");
    }

    @Test
    @DisplayName("拓扑序中被调者在调用者之前")
    void testTopologicalOrder() {
        assertThat(graph.getTopologicalOrder()).hasSize(4);
        assertThat(graph.getTopologicalOrder().indexOf("square"))
                .isLessThan(graph.getTopologicalOrder().indexOf("main"));
        assertThat(graph.getTopologicalOrder().indexOf("down"))
                .isLessThan(graph.getTopologicalOrder().indexOf("main"));
    }

    @Test
    @DisplayName("作为值出现的函数符号被视为取地址")
    void testAddressTaken() {
        assertThat(graph.isAddressTaken("square")).isTrue();
        assertThat(graph.isAddressTaken("down")).isFalse();
        assertThat(graph.getAddressTaken()).containsExactly("square");
    }

    @Test
    @DisplayName("从入口出发的可达函数")
    void testReachableFrom() {
        assertThat(graph.reachableFrom(Collections.singleton("main")))
                .containsExactly("down", "main", "square");
        assertThat(graph.reachableFrom(Collections.singleton("unknown"))).isEmpty();
    }
}
