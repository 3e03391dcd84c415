package com.aetherlang.ir.pass.local;

import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.UnOp;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConstantFolder 测试")
class ConstantFolderTest {

    private static final BigInteger MAX_I128 = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    private static final BigInteger MIN_I128 = BigInteger.ONE.shiftLeft(127).negate();

    @Nested
    @DisplayName("整数")
    class Integers {

        @Test
        @DisplayName("加法溢出按 128 位回绕")
        void testAddWraps() {
            MirType i128 = MirType.of(MirType.Kind.I128);
            Constant result = ConstantFolder.foldBinary(BinOp.ADD,
                    Constant.ofInt(MAX_I128, i128), Constant.ofInt(1, i128));
            assertThat(result).isEqualTo(Constant.ofInt(MIN_I128, i128));
        }

        @Test
        @DisplayName("除数为 0 时不折叠")
        void testDivisionByZero() {
            assertThat(ConstantFolder.foldBinary(BinOp.DIV, Constant.ofI64(7), Constant.ofI64(0))).isNull();
            assertThat(ConstantFolder.foldBinary(BinOp.REM, Constant.ofI64(7), Constant.ofI64(0))).isNull();
        }

        @Test
        @DisplayName("普通算术")
        void testArithmetic() {
            assertThat(ConstantFolder.foldBinary(BinOp.MUL, Constant.ofI64(6), Constant.ofI64(7)))
                    .isEqualTo(Constant.ofI64(42));
            assertThat(ConstantFolder.foldBinary(BinOp.SUB, Constant.ofI32(1), Constant.ofI32(3)))
                    .isEqualTo(Constant.ofI32(-2));
            assertThat(ConstantFolder.foldBinary(BinOp.REM, Constant.ofI64(-7), Constant.ofI64(2)))
                    .isEqualTo(Constant.ofI64(-1));
        }

        @Test
        @DisplayName("比较结果为 bool")
        void testComparison() {
            assertThat(ConstantFolder.foldBinary(BinOp.LT, Constant.ofI64(1), Constant.ofI64(2)))
                    .isEqualTo(Constant.ofBool(true));
            assertThat(ConstantFolder.foldBinary(BinOp.GE, Constant.ofI64(1), Constant.ofI64(2)))
                    .isEqualTo(Constant.ofBool(false));
        }

        @Test
        @DisplayName("按位取反与取负")
        void testUnary() {
            assertThat(ConstantFolder.foldUnary(UnOp.NOT, Constant.ofI64(5))).isEqualTo(Constant.ofI64(-6));
            assertThat(ConstantFolder.foldUnary(UnOp.NEG, Constant.ofI64(5))).isEqualTo(Constant.ofI64(-5));
        }

        @Test
        @DisplayName("MOD 不折叠")
        void testModNotFolded() {
            assertThat(ConstantFolder.foldBinary(BinOp.MOD, Constant.ofI64(7), Constant.ofI64(3))).isNull();
        }
    }

    @Nested
    @DisplayName("布尔与浮点")
    class BoolsAndFloats {

        @Test
        @DisplayName("true AND false 为 false")
        void testBoolAnd() {
            assertThat(ConstantFolder.foldBinary(BinOp.AND, Constant.ofBool(true), Constant.ofBool(false)))
                    .isEqualTo(Constant.ofBool(false));
            assertThat(ConstantFolder.foldUnary(UnOp.NOT, Constant.ofBool(false))).isEqualTo(Constant.ofBool(true));
        }

        @Test
        @DisplayName("浮点相等比较使用 epsilon")
        void testFloatEquality() {
            assertThat(ConstantFolder.foldBinary(BinOp.EQ,
                    Constant.ofF64(0.1 + 0.2), Constant.ofF64(0.3))).isEqualTo(Constant.ofBool(true));
        }

        @Test
        @DisplayName("整数与浮点混合运算结果为浮点")
        void testMixedArithmetic() {
            assertThat(ConstantFolder.foldBinary(BinOp.ADD, Constant.ofI64(1), Constant.ofF64(0.5)))
                    .isEqualTo(Constant.ofF64(1.5));
        }
    }

    @Nested
    @DisplayName("其它")
    class Others {

        @Test
        @DisplayName("转换为窄整数时截断")
        void testCastTruncates() {
            MirType u8 = MirType.of(MirType.Kind.U8);
            assertThat(ConstantFolder.foldCast(Constant.ofI64(300), u8)).isEqualTo(Constant.ofInt(44, u8));
            MirType i8 = MirType.of(MirType.Kind.I8);
            assertThat(ConstantFolder.foldCast(Constant.ofI64(200), i8)).isEqualTo(Constant.ofInt(-56, i8));
        }

        @Test
        @DisplayName("字符串拼接")
        void testStringConcat() {
            assertThat(ConstantFolder.foldBinary(BinOp.ADD, Constant.ofStr("ab"), Constant.ofStr("cd")))
                    .isEqualTo(Constant.ofStr("abcd"));
        }

        @Test
        @DisplayName("函数符号不参与折叠")
        void testSymbolNotFolded() {
            assertThat(ConstantFolder.foldBinary(BinOp.EQ, Constant.function("f"), Constant.function("f")))
                    .isNull();
        }
    }
}
