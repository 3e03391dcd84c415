package com.aetherlang.ir.mir;

import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * Place 上的投影元素。
 */
public abstract class Projection {

    public enum Kind { DEREF, FIELD, INDEX, SUBSLICE }

    public abstract Kind getKind();

    /** 重映射投影中引用的局部变量（仅 Index 有）。 */
    public Projection mapLocals(IntUnaryOperator mapper) {
        return this;
    }

    public static Projection deref() { return Deref.INSTANCE; }
    public static Projection field(int index, MirType type) { return new Field(index, type); }
    public static Projection index(int local) { return new Index(local); }
    public static Projection subslice(long from, long to) { return new Subslice(from, to); }

    /**
     * 解引用。
     */
    public static class Deref extends Projection {
        static final Deref INSTANCE = new Deref();

        private Deref() {}

        @Override
        public Kind getKind() { return Kind.DEREF; }

        @Override
        public boolean equals(Object o) { return o instanceof Deref; }

        @Override
        public int hashCode() { return 17; }

        @Override
        public String toString() { return "*"; }
    }

    /**
     * 字段访问。
     */
    public static class Field extends Projection {
        private final int index;
        private final MirType type;

        public Field(int index, MirType type) {
            this.index = index;
            this.type = type;
        }

        public int getIndex() { return index; }
        public MirType getType() { return type; }

        @Override
        public Kind getKind() { return Kind.FIELD; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Field)) return false;
            Field other = (Field) o;
            return index == other.index && Objects.equals(type, other.type);
        }

        @Override
        public int hashCode() { return Objects.hash(index, type); }

        @Override
        public String toString() { return "." + index; }
    }

    /**
     * 以局部变量为下标的索引。
     */
    public static class Index extends Projection {
        private final int local;

        public Index(int local) { this.local = local; }

        public int getLocal() { return local; }

        @Override
        public Kind getKind() { return Kind.INDEX; }

        @Override
        public Projection mapLocals(IntUnaryOperator mapper) {
            int mapped = mapper.applyAsInt(local);
            return mapped == local ? this : new Index(mapped);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Index && ((Index) o).local == local;
        }

        @Override
        public int hashCode() { return 31 * local + 7; }

        @Override
        public String toString() { return "[_" + local + "]"; }
    }

    /**
     * 子切片 [from..to)。
     */
    public static class Subslice extends Projection {
        private final long from;
        private final long to;

        public Subslice(long from, long to) {
            this.from = from;
            this.to = to;
        }

        public long getFrom() { return from; }
        public long getTo() { return to; }

        @Override
        public Kind getKind() { return Kind.SUBSLICE; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Subslice)) return false;
            Subslice other = (Subslice) o;
            return from == other.from && to == other.to;
        }

        @Override
        public int hashCode() { return Objects.hash(from, to); }

        @Override
        public String toString() { return "[" + from + ".." + to + "]"; }
    }
}
