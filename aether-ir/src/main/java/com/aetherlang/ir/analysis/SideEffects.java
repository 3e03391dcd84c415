package com.aetherlang.ir.analysis;

/**
 * 函数可观察副作用的集合。合并即逐项取或。
 */
public class SideEffects {

    private boolean readsMemory;
    private boolean writesMemory;
    private boolean performsIo;
    private boolean mayThrow;
    private boolean callsFunctions;

    public boolean readsMemory() { return readsMemory; }
    public boolean writesMemory() { return writesMemory; }
    public boolean performsIo() { return performsIo; }
    public boolean mayThrow() { return mayThrow; }
    public boolean callsFunctions() { return callsFunctions; }

    public void setReadsMemory(boolean readsMemory) { this.readsMemory = readsMemory; }
    public void setWritesMemory(boolean writesMemory) { this.writesMemory = writesMemory; }
    public void setPerformsIo(boolean performsIo) { this.performsIo = performsIo; }
    public void setMayThrow(boolean mayThrow) { this.mayThrow = mayThrow; }
    public void setCallsFunctions(boolean callsFunctions) { this.callsFunctions = callsFunctions; }

    /** 未知或外部函数：读写内存并执行 I/O。 */
    void markUnknownCall() {
        callsFunctions = true;
        readsMemory = true;
        writesMemory = true;
        performsIo = true;
    }

    /**
     * 并入另一组副作用，返回是否有变化。
     */
    public boolean merge(SideEffects other) {
        int old = bits();
        readsMemory |= other.readsMemory;
        writesMemory |= other.writesMemory;
        performsIo |= other.performsIo;
        mayThrow |= other.mayThrow;
        callsFunctions |= other.callsFunctions;
        return bits() != old;
    }

    private int bits() {
        return (readsMemory ? 1 : 0) | (writesMemory ? 2 : 0) | (performsIo ? 4 : 0)
                | (mayThrow ? 8 : 0) | (callsFunctions ? 16 : 0);
    }

    /** 不读写内存也不执行 I/O。 */
    public boolean isPure() {
        return !readsMemory && !writesMemory && !performsIo;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        if (readsMemory) sb.append(" reads");
        if (writesMemory) sb.append(" writes");
        if (performsIo) sb.append(" io");
        if (mayThrow) sb.append(" throws");
        if (callsFunctions) sb.append(" calls");
        return sb.append(" }").toString();
    }
}
