package com.aetherlang.ir.mir;

import java.util.Objects;

/**
 * 源码位置信息。
 */
public class SourceInfo {

    public static final SourceInfo UNKNOWN = new SourceInfo("<unknown>", 0, 0);

    private final String file;
    private final int line;
    private final int column;

    public SourceInfo(String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getFile() { return file; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceInfo)) return false;
        SourceInfo other = (SourceInfo) o;
        return line == other.line && column == other.column && Objects.equals(file, other.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
