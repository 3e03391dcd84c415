package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.Location;

/**
 * 两条语句之间的数据依赖。
 */
public class Dependence {

    public enum Kind {
        /** 写后读 */
        FLOW,
        /** 读后写 */
        ANTI,
        /** 写后写 */
        OUTPUT
    }

    /** 源迭代相对汇迭代的方向 */
    public enum Direction { LESS, EQUAL, GREATER, ANY }

    /** 距离无法确定 */
    public static final long UNKNOWN_DISTANCE = Long.MIN_VALUE;

    private final Kind kind;
    private final int local;
    private final Location source;
    private final Location sink;
    private final long distance;
    private final Direction direction;
    private final boolean loopCarried;

    public Dependence(Kind kind, int local, Location source, Location sink,
                      long distance, Direction direction, boolean loopCarried) {
        this.kind = kind;
        this.local = local;
        this.source = source;
        this.sink = sink;
        this.distance = distance;
        this.direction = direction;
        this.loopCarried = loopCarried;
    }

    static Dependence intraIteration(Kind kind, int local, Location source, Location sink) {
        return new Dependence(kind, local, source, sink, 0, Direction.EQUAL, false);
    }

    public Kind getKind() { return kind; }
    /** 依赖涉及的局部变量（数组访问时为基址局部变量）。 */
    public int getLocal() { return local; }
    public Location getSource() { return source; }
    public Location getSink() { return sink; }
    /** 以迭代计的依赖距离，循环无关依赖为 0。 */
    public long getDistance() { return distance; }
    public Direction getDirection() { return direction; }
    public boolean isLoopCarried() { return loopCarried; }

    @Override
    public String toString() {
        String dist = distance == UNKNOWN_DISTANCE ? "?" : String.valueOf(distance);
        return kind + "(_" + local + ", " + source + " -> " + sink + ", d=" + dist + ", " + direction
                + (loopCarried ? ", carried" : "") + ")";
    }
}
