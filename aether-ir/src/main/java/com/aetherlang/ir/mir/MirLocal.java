package com.aetherlang.ir.mir;

/**
 * MIR 局部变量。
 */
public class MirLocal {

    private final int id;
    private String name;
    private final MirType type;
    private final Mutability mutability;
    private final SourceInfo sourceInfo;

    public MirLocal(int id, String name, MirType type, Mutability mutability, SourceInfo sourceInfo) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.mutability = mutability;
        this.sourceInfo = sourceInfo;
    }

    public MirLocal(int id, String name, MirType type) {
        this(id, name, type, Mutability.MUT, null);
    }

    public int getId() { return id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public MirType getType() { return type; }
    public Mutability getMutability() { return mutability; }
    public SourceInfo getSourceInfo() { return sourceInfo; }

    /** 以新 id 复制，用于内联时重新编号。 */
    public MirLocal withId(int newId) {
        return new MirLocal(newId, name, type, mutability, sourceInfo);
    }

    @Override
    public String toString() {
        return "_" + id + (name != null ? ":" + name : "") + "(" + type + ")";
    }
}
