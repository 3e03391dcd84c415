package com.aetherlang.ir.analysis;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * 函数摘要：自身观察到的效果并上所有被调函数的摘要。
 */
public class FunctionSummary {

    private final String name;
    private final SideEffects sideEffects = new SideEffects();
    private final Set<Integer> escapingParameters = new TreeSet<>();
    private final Set<String> readsGlobals = new TreeSet<>();
    private final Set<String> modifiesGlobals = new TreeSet<>();
    private final Set<String> calls = new TreeSet<>();
    private boolean mayNotTerminate;
    private boolean recursive;

    public FunctionSummary(String name) {
        this.name = name;
    }

    public String getName() { return name; }
    public SideEffects getSideEffects() { return sideEffects; }
    /** 逃逸的参数下标（从 0 开始）。 */
    public Set<Integer> getEscapingParameters() { return Collections.unmodifiableSet(escapingParameters); }
    public Set<String> getReadsGlobals() { return Collections.unmodifiableSet(readsGlobals); }
    public Set<String> getModifiesGlobals() { return Collections.unmodifiableSet(modifiesGlobals); }
    /** 直接调用的函数名，含外部函数。 */
    public Set<String> getCalls() { return Collections.unmodifiableSet(calls); }
    public boolean mayNotTerminate() { return mayNotTerminate; }
    public boolean isRecursive() { return recursive; }

    public boolean isPure() {
        return sideEffects.isPure();
    }

    void addEscapingParameter(int index) { escapingParameters.add(index); }
    void addReadGlobal(String global) { readsGlobals.add(global); }
    void addModifiedGlobal(String global) { modifiesGlobals.add(global); }
    void addCall(String callee) { calls.add(callee); }
    void setMayNotTerminate(boolean mayNotTerminate) { this.mayNotTerminate = mayNotTerminate; }
    void setRecursive(boolean recursive) { this.recursive = recursive; }

    /**
     * 并入被调函数的摘要，返回是否有变化。
     */
    boolean mergeCallee(FunctionSummary callee) {
        boolean changed = sideEffects.merge(callee.sideEffects);
        changed |= readsGlobals.addAll(callee.readsGlobals);
        changed |= modifiesGlobals.addAll(callee.modifiesGlobals);
        if (callee.mayNotTerminate && !mayNotTerminate) {
            mayNotTerminate = true;
            changed = true;
        }
        return changed;
    }

    @Override
    public String toString() {
        return name + " " + sideEffects + (recursive ? " recursive" : "")
                + (mayNotTerminate ? " may-not-terminate" : "")
                + (escapingParameters.isEmpty() ? "" : " escaping=" + escapingParameters)
                + (modifiesGlobals.isEmpty() ? "" : " modifies=" + modifiesGlobals);
    }
}
