package com.aetherlang.ir.mir;

/**
 * 函数参数：名称、类型与所属局部变量。
 */
public class MirParam {

    private final String name;
    private final MirType type;
    private final int local;

    public MirParam(String name, MirType type, int local) {
        this.name = name;
        this.type = type;
        this.local = local;
    }

    public String getName() { return name; }
    public MirType getType() { return type; }
    public int getLocal() { return local; }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
