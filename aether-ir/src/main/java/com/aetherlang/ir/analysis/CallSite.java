package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.Location;
import com.aetherlang.ir.mir.Operand;

import java.util.List;

/**
 * 一个直接调用点：Call 终止指令，或右值为 Call 的赋值语句。
 */
public class CallSite {

    private final String caller;
    private final String callee;
    private final Location location;
    private final boolean terminator;
    private final List<Operand> args;

    public CallSite(String caller, String callee, Location location, boolean terminator, List<Operand> args) {
        this.caller = caller;
        this.callee = callee;
        this.location = location;
        this.terminator = terminator;
        this.args = args;
    }

    public String getCaller() { return caller; }
    public String getCallee() { return callee; }
    /** 终止指令调用点的语句下标等于块的语句数。 */
    public Location getLocation() { return location; }
    public boolean isTerminator() { return terminator; }
    public List<Operand> getArgs() { return args; }

    @Override
    public String toString() {
        return caller + "@" + location + " -> " + callee;
    }
}
