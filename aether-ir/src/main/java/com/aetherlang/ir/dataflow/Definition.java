package com.aetherlang.ir.dataflow;

import com.aetherlang.ir.mir.Location;

/**
 * 一次定义：局部变量与定义点。location 为 null 表示参数在入口处的隐式定义。
 */
public final class Definition implements Comparable<Definition> {

    private final int local;
    private final Location location;

    public Definition(int local, Location location) {
        this.local = local;
        this.location = location;
    }

    public static Definition parameter(int local) {
        return new Definition(local, null);
    }

    public int getLocal() { return local; }
    public Location getLocation() { return location; }

    public boolean isParameter() {
        return location == null;
    }

    @Override
    public int compareTo(Definition o) {
        if (local != o.local) return Integer.compare(local, o.local);
        if (location == null) return o.location == null ? 0 : -1;
        if (o.location == null) return 1;
        return location.compareTo(o.location);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Definition)) return false;
        Definition other = (Definition) o;
        return local == other.local
                && (location == null ? other.location == null : location.equals(other.location));
    }

    @Override
    public int hashCode() {
        return local * 31 + (location != null ? location.hashCode() : 0);
    }

    @Override
    public String toString() {
        return "_" + local + "@" + (location != null ? location : "param");
    }
}
