package com.aetherlang.ir.mir;

import java.util.Objects;

/**
 * MIR 类型。原始数值类型、引用、数组以及具名类型。
 */
public class MirType {

    public enum Kind {
        I8, I16, I32, I64, I128, ISIZE,
        U8, U16, U32, U64, U128, USIZE,
        F32, F64,
        BOOL, CHAR, STR, UNIT, NEVER,
        ARRAY, REF, PTR, NAMED,
        /** 函数符号（调用目标） */
        FUNCTION,
        /** 全局符号（程序级常量） */
        GLOBAL
    }

    /** SIMD 寄存器宽度（位） */
    public static final int SIMD_REGISTER_BITS = 128;

    private final Kind kind;
    private final String name;          // NAMED 时使用
    private final MirType elementType;  // ARRAY / REF / PTR 时使用
    private final Mutability mutability; // REF 时使用

    private MirType(Kind kind, String name, MirType elementType, Mutability mutability) {
        this.kind = kind;
        this.name = name;
        this.elementType = elementType;
        this.mutability = mutability;
    }

    public static MirType of(Kind kind) {
        switch (kind) {
            case ARRAY: case REF: case PTR: case NAMED:
                throw new IllegalArgumentException("复合类型需要使用专用工厂方法: " + kind);
            default:
                return new MirType(kind, null, null, null);
        }
    }

    public static MirType ofI32()      { return of(Kind.I32); }
    public static MirType ofI64()      { return of(Kind.I64); }
    public static MirType ofF32()      { return of(Kind.F32); }
    public static MirType ofF64()      { return of(Kind.F64); }
    public static MirType ofBool()     { return of(Kind.BOOL); }
    public static MirType ofChar()     { return of(Kind.CHAR); }
    public static MirType ofStr()      { return of(Kind.STR); }
    public static MirType ofUnit()     { return of(Kind.UNIT); }
    public static MirType ofFunction() { return of(Kind.FUNCTION); }
    public static MirType ofGlobal()   { return of(Kind.GLOBAL); }

    public static MirType ofArray(MirType elementType) {
        return new MirType(Kind.ARRAY, null, elementType, null);
    }

    public static MirType ofRef(MirType target, Mutability mutability) {
        return new MirType(Kind.REF, null, target, mutability);
    }

    public static MirType ofPtr(MirType target) {
        return new MirType(Kind.PTR, null, target, null);
    }

    public static MirType ofNamed(String name) {
        return new MirType(Kind.NAMED, name, null, null);
    }

    public Kind getKind() { return kind; }
    public String getName() { return name; }
    public MirType getElementType() { return elementType; }
    public Mutability getMutability() { return mutability; }

    public boolean isSignedInteger() {
        switch (kind) {
            case I8: case I16: case I32: case I64: case I128: case ISIZE: return true;
            default: return false;
        }
    }

    public boolean isUnsignedInteger() {
        switch (kind) {
            case U8: case U16: case U32: case U64: case U128: case USIZE: return true;
            default: return false;
        }
    }

    public boolean isInteger() {
        return isSignedInteger() || isUnsignedInteger();
    }

    public boolean isFloat() {
        return kind == Kind.F32 || kind == Kind.F64;
    }

    public boolean isNumeric() {
        return isInteger() || isFloat();
    }

    public boolean isBool() {
        return kind == Kind.BOOL;
    }

    /** 是否为可向量化的原始类型（数值或布尔）。 */
    public boolean isVectorizable() {
        return isNumeric() || isBool();
    }

    /**
     * 标量位宽，非原始类型返回 0。
     */
    public int getBitWidth() {
        switch (kind) {
            case I8: case U8: case BOOL: return 8;
            case I16: case U16: return 16;
            case I32: case U32: case F32: case CHAR: return 32;
            case I64: case U64: case F64: case ISIZE: case USIZE: return 64;
            case I128: case U128: return 128;
            default: return 0;
        }
    }

    /**
     * 128 位 SIMD 寄存器可容纳的通道数，不可向量化时返回 1。
     */
    public int getSimdLanes() {
        if (!isVectorizable()) return 1;
        int bits = getBitWidth();
        return bits == 0 ? 1 : Math.max(1, SIMD_REGISTER_BITS / bits);
    }

    /**
     * 粗粒度类型类别，用于校验时比较常量与局部变量类型。
     */
    public String getCategory() {
        if (isInteger()) return "integer";
        if (isFloat()) return "float";
        switch (kind) {
            case BOOL: return "bool";
            case CHAR: return "char";
            case STR: return "str";
            default: return "other";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MirType)) return false;
        MirType other = (MirType) o;
        return kind == other.kind
                && Objects.equals(name, other.name)
                && Objects.equals(elementType, other.elementType)
                && mutability == other.mutability;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, elementType, mutability);
    }

    @Override
    public String toString() {
        switch (kind) {
            case ARRAY: return "[" + elementType + "]";
            case REF: return (mutability == Mutability.MUT ? "&mut " : "&") + elementType;
            case PTR: return "*" + elementType;
            case NAMED: return name;
            case UNIT: return "()";
            case NEVER: return "!";
            case FUNCTION: return "fn";
            default: return kind.name().toLowerCase();
        }
    }
}
