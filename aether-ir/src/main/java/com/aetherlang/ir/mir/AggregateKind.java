package com.aetherlang.ir.mir;

import java.util.Objects;

/**
 * 聚合构造种类：数组 / 元组 / 结构体 / 枚举变体。
 */
public class AggregateKind {

    public enum Kind { ARRAY, TUPLE, STRUCT, ENUM }

    private final Kind kind;
    private final MirType elementType; // ARRAY
    private final String name;         // STRUCT / ENUM
    private final int variant;         // ENUM

    private AggregateKind(Kind kind, MirType elementType, String name, int variant) {
        this.kind = kind;
        this.elementType = elementType;
        this.name = name;
        this.variant = variant;
    }

    public static AggregateKind array(MirType elementType) {
        return new AggregateKind(Kind.ARRAY, elementType, null, -1);
    }

    public static AggregateKind tuple() {
        return new AggregateKind(Kind.TUPLE, null, null, -1);
    }

    public static AggregateKind struct(String name) {
        return new AggregateKind(Kind.STRUCT, null, name, -1);
    }

    public static AggregateKind enumVariant(String name, int variant) {
        return new AggregateKind(Kind.ENUM, null, name, variant);
    }

    public Kind getKind() { return kind; }
    public MirType getElementType() { return elementType; }
    public String getName() { return name; }
    public int getVariant() { return variant; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof AggregateKind)) return false;
        AggregateKind other = (AggregateKind) o;
        return kind == other.kind && variant == other.variant
                && Objects.equals(elementType, other.elementType)
                && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, elementType, name, variant);
    }

    @Override
    public String toString() {
        switch (kind) {
            case ARRAY: return "[" + elementType + "]";
            case TUPLE: return "tuple";
            case STRUCT: return name;
            default: return name + "::" + variant;
        }
    }
}
