package com.aetherlang.ir.mir;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 带类型的常量。
 * <p>
 * 类型为 {@link MirType.Kind#FUNCTION} 的字符串常量表示函数符号（直接调用目标），
 * 类型为 {@link MirType.Kind#GLOBAL} 的字符串常量表示对程序级常量的读取。
 */
public class Constant {

    private final MirType type;
    private final ConstantValue value;

    public Constant(MirType type, ConstantValue value) {
        this.type = Objects.requireNonNull(type);
        this.value = Objects.requireNonNull(value);
    }

    public static Constant ofInt(long value, MirType type) {
        return new Constant(type, ConstantValue.ofInteger(value));
    }

    public static Constant ofInt(BigInteger value, MirType type) {
        return new Constant(type, ConstantValue.ofInteger(value));
    }

    public static Constant ofI32(long value) { return ofInt(value, MirType.ofI32()); }
    public static Constant ofI64(long value) { return ofInt(value, MirType.ofI64()); }

    public static Constant ofBool(boolean value) {
        return new Constant(MirType.ofBool(), ConstantValue.ofBool(value));
    }

    public static Constant ofFloat(double value, MirType type) {
        return new Constant(type, ConstantValue.ofFloat(value));
    }

    public static Constant ofF64(double value) { return ofFloat(value, MirType.ofF64()); }

    public static Constant ofStr(String value) {
        return new Constant(MirType.ofStr(), ConstantValue.ofString(value));
    }

    public static Constant ofChar(int codePoint) {
        return new Constant(MirType.ofChar(), ConstantValue.ofChar(codePoint));
    }

    public static Constant ofNull(MirType type) {
        return new Constant(type, ConstantValue.ofNull());
    }

    /** 函数符号常量，作为 Call 的 func 操作数。 */
    public static Constant function(String name) {
        return new Constant(MirType.ofFunction(), ConstantValue.ofString(name));
    }

    /** 全局符号常量，读取程序级常量 name。 */
    public static Constant global(String name) {
        return new Constant(MirType.ofGlobal(), ConstantValue.ofString(name));
    }

    public MirType getType() { return type; }
    public ConstantValue getValue() { return value; }

    /**
     * 若为函数符号则返回函数名，否则返回 null。
     */
    public String getFunctionName() {
        if (type.getKind() == MirType.Kind.FUNCTION && value instanceof ConstantValue.Str) {
            return ((ConstantValue.Str) value).getValue();
        }
        return null;
    }

    /**
     * 若为全局符号则返回全局名，否则返回 null。
     */
    public String getGlobalName() {
        if (type.getKind() == MirType.Kind.GLOBAL && value instanceof ConstantValue.Str) {
            return ((ConstantValue.Str) value).getValue();
        }
        return null;
    }

    /** 是否为普通字面量（非函数 / 全局符号）。 */
    public boolean isLiteral() {
        return type.getKind() != MirType.Kind.FUNCTION && type.getKind() != MirType.Kind.GLOBAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constant)) return false;
        Constant other = (Constant) o;
        return type.equals(other.type) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        String fn = getFunctionName();
        if (fn != null) return "fn " + fn;
        String global = getGlobalName();
        if (global != null) return "global " + global;
        return value + "_" + type;
    }
}
