package com.aetherlang.ir.mir;

import java.util.Collection;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * MIR 语句：赋值、存储生命周期标记或空操作。语句对象不可变，改写时整体替换。
 */
public abstract class MirStatement {

    public enum Kind { ASSIGN, STORAGE_LIVE, STORAGE_DEAD, NOP }

    public abstract Kind getKind();

    /** 收集该语句读取的局部变量（赋值目标带投影时，基础局部变量也视为被读取）。 */
    public abstract void collectReadLocals(Collection<Integer> out);

    /** 收集该语句提及的全部局部变量，包括存储标记。 */
    public abstract void collectMentionedLocals(Collection<Integer> out);

    public abstract MirStatement mapLocals(IntUnaryOperator mapper);

    public static MirStatement assign(int local, Rvalue rvalue) {
        return new Assign(Place.of(local), rvalue, SourceInfo.UNKNOWN);
    }

    public static MirStatement assign(Place place, Rvalue rvalue) {
        return new Assign(place, rvalue, SourceInfo.UNKNOWN);
    }

    public static MirStatement nop() { return Nop.INSTANCE; }

    /**
     * 赋值 place = rvalue。
     */
    public static class Assign extends MirStatement {
        private final Place place;
        private final Rvalue rvalue;
        private final SourceInfo sourceInfo;

        public Assign(Place place, Rvalue rvalue, SourceInfo sourceInfo) {
            this.place = Objects.requireNonNull(place);
            this.rvalue = Objects.requireNonNull(rvalue);
            this.sourceInfo = sourceInfo != null ? sourceInfo : SourceInfo.UNKNOWN;
        }

        public Place getPlace() { return place; }
        public Rvalue getRvalue() { return rvalue; }
        public SourceInfo getSourceInfo() { return sourceInfo; }

        /** 用新的 rvalue 构造同目标赋值。 */
        public Assign withRvalue(Rvalue newRvalue) {
            return new Assign(place, newRvalue, sourceInfo);
        }

        /** 赋值目标为无投影局部变量时返回其 id，否则返回 -1。 */
        public int getDefinedLocal() {
            return place.hasProjection() ? -1 : place.getLocal();
        }

        @Override
        public Kind getKind() { return Kind.ASSIGN; }

        @Override
        public void collectReadLocals(Collection<Integer> out) {
            rvalue.collectReadLocals(out);
            if (place.hasProjection()) place.collectLocals(out);
        }

        @Override
        public void collectMentionedLocals(Collection<Integer> out) {
            rvalue.collectReadLocals(out);
            place.collectLocals(out);
        }

        @Override
        public MirStatement mapLocals(IntUnaryOperator mapper) {
            return new Assign(place.mapLocals(mapper), rvalue.mapLocals(mapper), sourceInfo);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Assign)) return false;
            Assign other = (Assign) o;
            return place.equals(other.place) && rvalue.equals(other.rvalue);
        }

        @Override
        public int hashCode() { return Objects.hash(place, rvalue); }

        @Override
        public String toString() { return place + " = " + rvalue; }
    }

    /**
     * 局部变量存储生命周期开始。
     */
    public static class StorageLive extends MirStatement {
        private final int local;

        public StorageLive(int local) { this.local = local; }

        public int getLocal() { return local; }

        @Override
        public Kind getKind() { return Kind.STORAGE_LIVE; }

        @Override
        public void collectReadLocals(Collection<Integer> out) {}

        @Override
        public void collectMentionedLocals(Collection<Integer> out) { out.add(local); }

        @Override
        public MirStatement mapLocals(IntUnaryOperator mapper) {
            return new StorageLive(mapper.applyAsInt(local));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StorageLive && ((StorageLive) o).local == local;
        }

        @Override
        public int hashCode() { return local * 11 + 1; }

        @Override
        public String toString() { return "StorageLive(_" + local + ")"; }
    }

    /**
     * 局部变量存储生命周期结束。
     */
    public static class StorageDead extends MirStatement {
        private final int local;

        public StorageDead(int local) { this.local = local; }

        public int getLocal() { return local; }

        @Override
        public Kind getKind() { return Kind.STORAGE_DEAD; }

        @Override
        public void collectReadLocals(Collection<Integer> out) {}

        @Override
        public void collectMentionedLocals(Collection<Integer> out) { out.add(local); }

        @Override
        public MirStatement mapLocals(IntUnaryOperator mapper) {
            return new StorageDead(mapper.applyAsInt(local));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StorageDead && ((StorageDead) o).local == local;
        }

        @Override
        public int hashCode() { return local * 11 + 2; }

        @Override
        public String toString() { return "StorageDead(_" + local + ")"; }
    }

    /**
     * 空操作。
     */
    public static class Nop extends MirStatement {
        static final Nop INSTANCE = new Nop();

        private Nop() {}

        @Override
        public Kind getKind() { return Kind.NOP; }

        @Override
        public void collectReadLocals(Collection<Integer> out) {}

        @Override
        public void collectMentionedLocals(Collection<Integer> out) {}

        @Override
        public MirStatement mapLocals(IntUnaryOperator mapper) { return this; }

        @Override
        public String toString() { return "nop"; }
    }
}
