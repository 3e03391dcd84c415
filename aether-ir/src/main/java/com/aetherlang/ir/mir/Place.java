package com.aetherlang.ir.mir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * 可寻址位置：局部变量加投影序列。投影为空时表示局部变量本身。
 */
public class Place {

    private final int local;
    private final List<Projection> projection;

    public Place(int local, List<Projection> projection) {
        this.local = local;
        this.projection = projection.isEmpty()
                ? Collections.<Projection>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(projection));
    }

    public static Place of(int local) {
        return new Place(local, Collections.<Projection>emptyList());
    }

    public int getLocal() { return local; }
    public List<Projection> getProjection() { return projection; }

    public boolean hasProjection() {
        return !projection.isEmpty();
    }

    public boolean hasDeref() {
        for (Projection p : projection) {
            if (p.getKind() == Projection.Kind.DEREF) return true;
        }
        return false;
    }

    /** 追加一个投影，返回新的 Place。 */
    public Place project(Projection elem) {
        List<Projection> list = new ArrayList<>(projection);
        list.add(elem);
        return new Place(local, list);
    }

    /**
     * 收集该 Place 作为被读取位置时涉及的全部局部变量（基础局部变量与索引局部变量）。
     */
    public void collectLocals(Collection<Integer> out) {
        out.add(local);
        collectIndexLocals(out);
    }

    /** 仅收集 Index 投影引用的局部变量。 */
    public void collectIndexLocals(Collection<Integer> out) {
        for (Projection p : projection) {
            if (p instanceof Projection.Index) {
                out.add(((Projection.Index) p).getLocal());
            }
        }
    }

    public boolean mentionsLocal(int id) {
        if (local == id) return true;
        for (Projection p : projection) {
            if (p instanceof Projection.Index && ((Projection.Index) p).getLocal() == id) return true;
        }
        return false;
    }

    public Place mapLocals(IntUnaryOperator mapper) {
        int mapped = mapper.applyAsInt(local);
        if (projection.isEmpty()) {
            return mapped == local ? this : Place.of(mapped);
        }
        List<Projection> list = new ArrayList<>(projection.size());
        for (Projection p : projection) list.add(p.mapLocals(mapper));
        return new Place(mapped, list);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Place)) return false;
        Place other = (Place) o;
        return local == other.local && projection.equals(other.projection);
    }

    @Override
    public int hashCode() {
        return 31 * local + projection.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        boolean deref = false;
        for (Projection p : projection) {
            if (p.getKind() == Projection.Kind.DEREF) deref = true;
        }
        if (deref) sb.append("(");
        sb.append("_").append(local);
        for (Projection p : projection) {
            if (p.getKind() != Projection.Kind.DEREF) sb.append(p);
        }
        if (deref) sb.insert(0, "*").append(")");
        return sb.toString();
    }
}
