package com.aetherlang.ir.mir;

import java.util.Collection;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * 操作数：Copy（非消耗读取）、Move（消耗读取）或常量。
 */
public abstract class Operand {

    public enum Kind { COPY, MOVE, CONSTANT }

    public abstract Kind getKind();

    /** 被读取的 Place，常量返回 null。 */
    public abstract Place getPlace();

    public abstract Operand mapLocals(IntUnaryOperator mapper);

    public static Operand copy(int local) { return new Copy(Place.of(local)); }
    public static Operand copy(Place place) { return new Copy(place); }
    public static Operand move(int local) { return new Move(Place.of(local)); }
    public static Operand move(Place place) { return new Move(place); }
    public static Operand constant(Constant constant) { return new Const(constant); }

    public boolean isConstant() {
        return getKind() == Kind.CONSTANT;
    }

    /** 常量操作数的值，否则返回 null。 */
    public Constant getConstant() {
        return null;
    }

    /**
     * 若该操作数直接读取局部变量（无投影），返回局部变量 id，否则返回 -1。
     */
    public int getDirectLocal() {
        Place place = getPlace();
        return place != null && !place.hasProjection() ? place.getLocal() : -1;
    }

    public void collectReadLocals(Collection<Integer> out) {
        Place place = getPlace();
        if (place != null) place.collectLocals(out);
    }

    /**
     * 非消耗读取。
     */
    public static class Copy extends Operand {
        private final Place place;

        public Copy(Place place) { this.place = Objects.requireNonNull(place); }

        @Override
        public Kind getKind() { return Kind.COPY; }

        @Override
        public Place getPlace() { return place; }

        @Override
        public Operand mapLocals(IntUnaryOperator mapper) {
            Place mapped = place.mapLocals(mapper);
            return mapped == place ? this : new Copy(mapped);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Copy && ((Copy) o).place.equals(place);
        }

        @Override
        public int hashCode() { return place.hashCode() * 3 + 1; }

        @Override
        public String toString() { return "copy " + place; }
    }

    /**
     * 消耗读取。
     */
    public static class Move extends Operand {
        private final Place place;

        public Move(Place place) { this.place = Objects.requireNonNull(place); }

        @Override
        public Kind getKind() { return Kind.MOVE; }

        @Override
        public Place getPlace() { return place; }

        @Override
        public Operand mapLocals(IntUnaryOperator mapper) {
            Place mapped = place.mapLocals(mapper);
            return mapped == place ? this : new Move(mapped);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Move && ((Move) o).place.equals(place);
        }

        @Override
        public int hashCode() { return place.hashCode() * 3 + 2; }

        @Override
        public String toString() { return "move " + place; }
    }

    /**
     * 常量操作数。
     */
    public static class Const extends Operand {
        private final Constant constant;

        public Const(Constant constant) { this.constant = Objects.requireNonNull(constant); }

        @Override
        public Kind getKind() { return Kind.CONSTANT; }

        @Override
        public Place getPlace() { return null; }

        @Override
        public Constant getConstant() { return constant; }

        @Override
        public Operand mapLocals(IntUnaryOperator mapper) { return this; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Const && ((Const) o).constant.equals(constant);
        }

        @Override
        public int hashCode() { return constant.hashCode(); }

        @Override
        public String toString() { return "const " + constant; }
    }
}
