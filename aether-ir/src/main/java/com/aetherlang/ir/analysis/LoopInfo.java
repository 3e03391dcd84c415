package com.aetherlang.ir.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 自然循环。同一头块的多条回边合并为一个循环。
 */
public class LoopInfo {

    /** 未知迭代次数 */
    public static final long UNKNOWN_TRIP_COUNT = -1;

    private final int header;
    private final Set<Integer> blocks;
    private final List<Integer> latches = new ArrayList<>();
    private final Set<Integer> exitBlocks = new TreeSet<>();
    private final Set<Integer> exitTargets = new TreeSet<>();
    private final List<Integer> children = new ArrayList<>();
    private int preheader = -1;
    private int parent = -1;
    private int depth = 1;
    private LoopBounds bounds;
    private long tripCount = UNKNOWN_TRIP_COUNT;

    public LoopInfo(int header, Set<Integer> blocks) {
        this.header = header;
        this.blocks = new TreeSet<>(blocks);
    }

    public int getHeader() { return header; }
    public Set<Integer> getBlocks() { return Collections.unmodifiableSet(blocks); }
    /** 回边尾块（tail → header）。 */
    public List<Integer> getLatches() { return Collections.unmodifiableList(latches); }
    /** 具有循环外后继的循环内块。 */
    public Set<Integer> getExitBlocks() { return Collections.unmodifiableSet(exitBlocks); }
    /** 循环外的后继块。 */
    public Set<Integer> getExitTargets() { return Collections.unmodifiableSet(exitTargets); }
    public List<Integer> getChildren() { return Collections.unmodifiableList(children); }
    /** 头块在循环外的唯一前驱，不存在时为 -1。 */
    public int getPreheader() { return preheader; }
    public int getParent() { return parent; }
    public int getDepth() { return depth; }
    public LoopBounds getBounds() { return bounds; }
    public long getTripCount() { return tripCount; }

    public boolean contains(int block) {
        return blocks.contains(block);
    }

    public boolean hasKnownTripCount() {
        return tripCount != UNKNOWN_TRIP_COUNT;
    }

    void addBlocks(Set<Integer> more) { blocks.addAll(more); }
    void addLatch(int latch) { if (!latches.contains(latch)) latches.add(latch); }
    void addExit(int from, int to) { exitBlocks.add(from); exitTargets.add(to); }
    void addChild(int childHeader) { children.add(childHeader); }
    void setPreheader(int preheader) { this.preheader = preheader; }
    void setParent(int parent) { this.parent = parent; }
    void setDepth(int depth) { this.depth = depth; }

    void setBounds(LoopBounds bounds, long tripCount) {
        this.bounds = bounds;
        this.tripCount = tripCount;
    }

    @Override
    public String toString() {
        return "loop(B" + header + ", blocks=" + blocks + ", depth=" + depth
                + (hasKnownTripCount() ? ", trip=" + tripCount : "") + ")";
    }
}
