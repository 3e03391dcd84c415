package com.aetherlang.ir;

import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.MirBuilder;
import com.aetherlang.ir.mir.MirFunction;
import com.aetherlang.ir.mir.MirProgram;
import com.aetherlang.ir.mir.MirStatement;
import com.aetherlang.ir.mir.MirTerminator;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.Operand;
import com.aetherlang.ir.mir.Place;
import com.aetherlang.ir.mir.Projection;
import com.aetherlang.ir.mir.Rvalue;

import java.util.Arrays;

import static com.aetherlang.ir.mir.MirBuilder.param;

/**
 * 测试用 MIR 程序。注释中的 _n 为局部变量 id，Bn 为块 id。
 */
public final class TestPrograms {

    private TestPrograms() {}

    public static Operand i64(long value) {
        return Operand.constant(Constant.ofI64(value));
    }

    public static Operand copy(int local) {
        return Operand.copy(local);
    }

    public static Rvalue add(Operand l, Operand r) {
        return Rvalue.binary(BinOp.ADD, l, r);
    }

    public static Rvalue call(String callee, Operand... args) {
        return Rvalue.call(Operand.constant(Constant.function(callee)), Arrays.asList(args));
    }

    public static MirProgram programOf(MirFunction... functions) {
        MirProgram program = new MirProgram();
        for (MirFunction f : functions) program.addFunction(f);
        return program;
    }

    /**
     * fn sum() -> i64: s = 0 + 1 + 2 + 3，循环 4 次。
     * <pre>
     * B0: _1 = 0; _2 = 0; goto B1
     * B1: _3 = _1 < 4; switchInt(_3) [0 -> B3] else B2
     * B2: _2 = _2 + _1; _1 = _1 + 1; goto B1
     * B3: _0 = _2; return
     * </pre>
     */
    public static MirFunction countedSum() {
        MirBuilder b = new MirBuilder();
        b.startFunction("sum", MirType.ofI64());
        int i = b.newLocal("i", MirType.ofI64());
        int s = b.newLocal("s", MirType.ofI64());
        int c = b.newLocal("c", MirType.ofBool());
        int header = b.newBlock();
        int body = b.newBlock();
        int exit = b.newBlock();

        b.assign(i, Rvalue.use(i64(0)));
        b.assign(s, Rvalue.use(i64(0)));
        b.goTo(header);

        b.switchToBlock(header);
        b.assign(c, Rvalue.binary(BinOp.LT, copy(i), i64(4)));
        b.setTerminator(MirTerminator.ifElse(copy(c), body, exit));

        b.switchToBlock(body);
        b.assign(s, add(copy(s), copy(i)));
        b.assign(i, add(copy(i), i64(1)));
        b.goTo(header);

        b.switchToBlock(exit);
        b.assign(b.getReturnLocal(), Rvalue.use(copy(s)));
        b.returnValue();
        return b.finish();
    }

    /**
     * fn licm(n, a, b) -> i64，循环体中 t = a * b 与循环无关。
     * <pre>
     * B0: _4 = 0; _5 = 0; goto B1
     * B1: _6 = _4 < _0; switchInt(_6) [0 -> B3] else B2
     * B2: _7 = _1 * _2; _5 = _5 + _7; _4 = _4 + 1; goto B1
     * B3: _3 = _5; return
     * </pre>
     */
    public static MirFunction invariantProduct() {
        MirBuilder b = new MirBuilder();
        b.startFunction("licm", MirType.ofI64(),
                param("n", MirType.ofI64()), param("a", MirType.ofI64()), param("b", MirType.ofI64()));
        int i = b.newLocal("i", MirType.ofI64());
        int s = b.newLocal("s", MirType.ofI64());
        int c = b.newLocal("c", MirType.ofBool());
        int t = b.newLocal("t", MirType.ofI64());
        int header = b.newBlock();
        int body = b.newBlock();
        int exit = b.newBlock();

        b.assign(i, Rvalue.use(i64(0)));
        b.assign(s, Rvalue.use(i64(0)));
        b.goTo(header);

        b.switchToBlock(header);
        b.assign(c, Rvalue.binary(BinOp.LT, copy(i), copy(0)));
        b.setTerminator(MirTerminator.ifElse(copy(c), body, exit));

        b.switchToBlock(body);
        b.assign(t, Rvalue.binary(BinOp.MUL, copy(1), copy(2)));
        b.assign(s, add(copy(s), copy(t)));
        b.assign(i, add(copy(i), i64(1)));
        b.goTo(header);

        b.switchToBlock(exit);
        b.assign(b.getReturnLocal(), Rvalue.use(copy(s)));
        b.returnValue();
        return b.finish();
    }

    /**
     * fn sr(n) -> i64，循环体中 j = i * 4 可改写为增量形式。
     * <pre>
     * B0: _2 = 0; _3 = 0; goto B1
     * B1: _4 = _2 < _0; switchInt(_4) [0 -> B3] else B2
     * B2: _5 = _2 * 4; _3 = _3 + _5; _2 = _2 + 1; goto B1
     * B3: _1 = _3; return
     * </pre>
     */
    public static MirFunction scaledIndex() {
        MirBuilder b = new MirBuilder();
        b.startFunction("sr", MirType.ofI64(), param("n", MirType.ofI64()));
        int i = b.newLocal("i", MirType.ofI64());
        int s = b.newLocal("s", MirType.ofI64());
        int c = b.newLocal("c", MirType.ofBool());
        int j = b.newLocal("j", MirType.ofI64());
        int header = b.newBlock();
        int body = b.newBlock();
        int exit = b.newBlock();

        b.assign(i, Rvalue.use(i64(0)));
        b.assign(s, Rvalue.use(i64(0)));
        b.goTo(header);

        b.switchToBlock(header);
        b.assign(c, Rvalue.binary(BinOp.LT, copy(i), copy(0)));
        b.setTerminator(MirTerminator.ifElse(copy(c), body, exit));

        b.switchToBlock(body);
        b.assign(j, Rvalue.binary(BinOp.MUL, copy(i), i64(4)));
        b.assign(s, add(copy(s), copy(j)));
        b.assign(i, add(copy(i), i64(1)));
        b.goTo(header);

        b.switchToBlock(exit);
        b.assign(b.getReturnLocal(), Rvalue.use(copy(s)));
        b.returnValue();
        return b.finish();
    }

    /**
     * fn vadd(a: [f32], b: [f32], n)：b[i] = a[i] + 1.0，逐元素独立。
     * <pre>
     * B0: _3 = 0; goto B1
     * B1: _4 = _3 < _2; switchInt(_4) [0 -> B3] else B2
     * B2: _5 = _0[_3]; _1[_3] = _5 + 1.0; _3 = _3 + 1; goto B1
     * B3: return
     * </pre>
     */
    public static MirFunction elementwiseAdd() {
        MirType f32 = MirType.ofF32();
        MirBuilder b = new MirBuilder();
        b.startFunction("vadd", MirType.ofUnit(),
                param("a", MirType.ofArray(f32)), param("b", MirType.ofArray(f32)), param("n", MirType.ofI64()));
        int i = b.newLocal("i", MirType.ofI64());
        int c = b.newLocal("c", MirType.ofBool());
        int x = b.newLocal("x", f32);
        int header = b.newBlock();
        int body = b.newBlock();
        int exit = b.newBlock();

        b.assign(i, Rvalue.use(i64(0)));
        b.goTo(header);

        b.switchToBlock(header);
        b.assign(c, Rvalue.binary(BinOp.LT, copy(i), copy(2)));
        b.setTerminator(MirTerminator.ifElse(copy(c), body, exit));

        b.switchToBlock(body);
        b.assign(x, Rvalue.use(Operand.copy(Place.of(0).project(Projection.index(i)))));
        b.assign(Place.of(1).project(Projection.index(i)),
                add(copy(x), Operand.constant(Constant.ofFloat(1.0, f32))));
        b.assign(i, add(copy(i), i64(1)));
        b.goTo(header);

        b.switchToBlock(exit);
        b.returnValue();
        return b.finish();
    }

    /**
     * fn dead() -> i64: x = 1; y = 2; return y。x 的赋值是死代码。
     */
    public static MirFunction deadStore() {
        MirBuilder b = new MirBuilder();
        b.startFunction("dead", MirType.ofI64());
        int x = b.newLocal("x", MirType.ofI64());
        int y = b.newLocal("y", MirType.ofI64());
        b.assign(x, Rvalue.use(i64(1)));
        b.assign(y, Rvalue.use(i64(2)));
        b.assign(b.getReturnLocal(), Rvalue.use(copy(y)));
        b.returnValue();
        return b.finish();
    }

    /**
     * fn name() -> i64: return value，没有可优化之处。
     */
    public static MirFunction constantReturn(String name, long value) {
        MirBuilder b = new MirBuilder();
        b.startFunction(name, MirType.ofI64());
        b.assign(b.getReturnLocal(), Rvalue.use(i64(value)));
        b.returnValue();
        return b.finish();
    }

    /**
     * fn name() -> i64: _ret = callee(args...); return
     */
    public static MirFunction caller(String name, String callee, Operand... args) {
        MirBuilder b = new MirBuilder();
        b.startFunction(name, MirType.ofI64());
        b.assign(b.getReturnLocal(), call(callee, args));
        b.returnValue();
        return b.finish();
    }

    /**
     * fn name(x) -> i64: _1 = x * x; return
     */
    public static MirFunction square(String name) {
        MirBuilder b = new MirBuilder();
        b.startFunction(name, MirType.ofI64(), param("x", MirType.ofI64()));
        b.assign(b.getReturnLocal(), Rvalue.binary(BinOp.MUL, copy(0), copy(0)));
        b.returnValue();
        return b.finish();
    }

    /**
     * fn name(n) -> i64: 自递归，n == 0 时返回 0，否则返回 name(n - 1)。
     */
    public static MirFunction recursive(String name) {
        MirBuilder b = new MirBuilder();
        b.startFunction(name, MirType.ofI64(), param("n", MirType.ofI64()));
        int c = b.newLocal("c", MirType.ofBool());
        int m = b.newLocal("m", MirType.ofI64());
        int base = b.newBlock();
        int rec = b.newBlock();
        b.assign(c, Rvalue.binary(BinOp.EQ, copy(0), i64(0)));
        b.setTerminator(MirTerminator.ifElse(copy(c), base, rec));

        b.switchToBlock(base);
        b.assign(b.getReturnLocal(), Rvalue.use(i64(0)));
        b.returnValue();

        b.switchToBlock(rec);
        b.assign(m, Rvalue.binary(BinOp.SUB, copy(0), i64(1)));
        b.assign(b.getReturnLocal(), call(name, copy(m)));
        b.returnValue();
        return b.finish();
    }

    /**
     * 可达块缺少终止指令的函数，校验必然失败。
     */
    public static MirFunction missingTerminator() {
        MirBuilder b = new MirBuilder();
        b.startFunction("broken", MirType.ofUnit());
        b.pushStatement(MirStatement.nop());
        return b.finish();
    }

    /**
     * fn branchy(flag: bool) -> i64，B1 / B2 二选一后在 B3 汇合。
     */
    public static MirFunction diamond() {
        MirBuilder b = new MirBuilder();
        b.startFunction("branchy", MirType.ofI64(), param("flag", MirType.ofBool()));
        int left = b.newBlock();
        int right = b.newBlock();
        int join = b.newBlock();
        b.setTerminator(MirTerminator.ifElse(copy(0), left, right));

        b.switchToBlock(left);
        b.assign(b.getReturnLocal(), Rvalue.use(i64(1)));
        b.goTo(join);

        b.switchToBlock(right);
        b.assign(b.getReturnLocal(), Rvalue.use(i64(2)));
        b.goTo(join);

        b.switchToBlock(join);
        b.returnValue();
        return b.finish();
    }
}
