package com.aetherlang.ir.mir;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 常量值（bool / 128 位有符号整数 / 浮点 / 字符串 / 字符 / null）。
 */
public abstract class ConstantValue {

    /** 浮点相等比较使用的容差 */
    public static final double FLOAT_EPSILON = Math.ulp(1.0);

    public enum Kind { BOOL, INTEGER, FLOAT, STRING, CHAR, NULL }

    public abstract Kind getKind();

    public static ConstantValue ofBool(boolean value) { return new Bool(value); }
    public static ConstantValue ofInteger(BigInteger value) { return new Int(value); }
    public static ConstantValue ofInteger(long value) { return new Int(BigInteger.valueOf(value)); }
    public static ConstantValue ofFloat(double value) { return new Float(value); }
    public static ConstantValue ofString(String value) { return new Str(value); }
    public static ConstantValue ofChar(int codePoint) { return new Char(codePoint); }
    public static ConstantValue ofNull() { return Null.INSTANCE; }

    /**
     * 布尔常量。
     */
    public static class Bool extends ConstantValue {
        private final boolean value;

        public Bool(boolean value) { this.value = value; }

        public boolean getValue() { return value; }

        @Override
        public Kind getKind() { return Kind.BOOL; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bool && ((Bool) o).value == value;
        }

        @Override
        public int hashCode() { return value ? 1231 : 1237; }

        @Override
        public String toString() { return String.valueOf(value); }
    }

    /**
     * 整数常量，语义上为 128 位有符号整数。
     */
    public static class Int extends ConstantValue {
        private final BigInteger value;

        public Int(BigInteger value) {
            this.value = Objects.requireNonNull(value);
        }

        public BigInteger getValue() { return value; }

        @Override
        public Kind getKind() { return Kind.INTEGER; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Int && ((Int) o).value.equals(value);
        }

        @Override
        public int hashCode() { return value.hashCode(); }

        @Override
        public String toString() { return value.toString(); }
    }

    /**
     * 浮点常量。相等比较使用 epsilon 容差。
     */
    public static class Float extends ConstantValue {
        private final double value;

        public Float(double value) { this.value = value; }

        public double getValue() { return value; }

        @Override
        public Kind getKind() { return Kind.FLOAT; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Float && Math.abs(((Float) o).value - value) < FLOAT_EPSILON;
        }

        // 近似相等的值必须落入同一个桶
        @Override
        public int hashCode() { return 0x7F4A; }

        @Override
        public String toString() { return String.valueOf(value); }
    }

    /**
     * 字符串常量。
     */
    public static class Str extends ConstantValue {
        private final String value;

        public Str(String value) {
            this.value = Objects.requireNonNull(value);
        }

        public String getValue() { return value; }

        @Override
        public Kind getKind() { return Kind.STRING; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Str && ((Str) o).value.equals(value);
        }

        @Override
        public int hashCode() { return value.hashCode(); }

        @Override
        public String toString() { return "\"" + value.replace("\"", "\\\"") + "\""; }
    }

    /**
     * 字符常量（Unicode 码点）。
     */
    public static class Char extends ConstantValue {
        private final int codePoint;

        public Char(int codePoint) { this.codePoint = codePoint; }

        public int getCodePoint() { return codePoint; }

        @Override
        public Kind getKind() { return Kind.CHAR; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Char && ((Char) o).codePoint == codePoint;
        }

        @Override
        public int hashCode() { return codePoint; }

        @Override
        public String toString() {
            return "'" + new String(Character.toChars(codePoint)) + "'";
        }
    }

    /**
     * null 常量。
     */
    public static class Null extends ConstantValue {
        static final Null INSTANCE = new Null();

        private Null() {}

        @Override
        public Kind getKind() { return Kind.NULL; }

        @Override
        public boolean equals(Object o) { return o instanceof Null; }

        @Override
        public int hashCode() { return 0; }

        @Override
        public String toString() { return "null"; }
    }
}
