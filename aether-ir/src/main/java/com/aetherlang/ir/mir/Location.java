package com.aetherlang.ir.mir;

/**
 * 函数内的程序点：块 id 加语句下标。下标等于语句数时表示终止指令。
 */
public final class Location implements Comparable<Location> {

    private final int block;
    private final int statementIndex;

    public Location(int block, int statementIndex) {
        this.block = block;
        this.statementIndex = statementIndex;
    }

    public int getBlock() { return block; }
    public int getStatementIndex() { return statementIndex; }

    @Override
    public int compareTo(Location o) {
        if (block != o.block) return Integer.compare(block, o.block);
        return Integer.compare(statementIndex, o.statementIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Location)) return false;
        Location other = (Location) o;
        return block == other.block && statementIndex == other.statementIndex;
    }

    @Override
    public int hashCode() {
        return block * 31 + statementIndex;
    }

    @Override
    public String toString() {
        return "B" + block + "[" + statementIndex + "]";
    }
}
