package com.aetherlang.ir.mir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * MIR 函数（包含 CFG）。
 * <p>
 * 局部变量与基本块都以稠密整数 id 为键；基本块映射的迭代顺序即布局顺序。
 * id 计数器属于单个函数，单调递增，删除后不复用。
 */
public class MirFunction {

    private final String name;
    private final MirType returnType;
    private final List<MirParam> params = new ArrayList<>();
    private final Map<Integer, MirLocal> locals = new TreeMap<>();
    private final Map<Integer, BasicBlock> blocks = new LinkedHashMap<>();
    private int entryBlock;
    /** 返回值局部变量，-1 表示无返回值 */
    private int returnLocal = -1;
    private int nextLocalId;
    private int nextBlockId;

    public MirFunction(String name, MirType returnType) {
        this.name = name;
        this.returnType = returnType;
    }

    public String getName() { return name; }
    public MirType getReturnType() { return returnType; }
    public List<MirParam> getParams() { return Collections.unmodifiableList(params); }
    public Map<Integer, MirLocal> getLocals() { return locals; }
    public int getEntryBlock() { return entryBlock; }
    public void setEntryBlock(int entryBlock) { this.entryBlock = entryBlock; }
    public int getReturnLocal() { return returnLocal; }
    public void setReturnLocal(int returnLocal) { this.returnLocal = returnLocal; }
    public boolean hasReturnLocal() { return returnLocal >= 0; }

    public void addParam(MirParam param) {
        params.add(param);
    }

    // ========== 局部变量 ==========

    public int newLocal(String localName, MirType type) {
        return newLocal(localName, type, Mutability.MUT, null);
    }

    public int newLocal(String localName, MirType type, Mutability mutability, SourceInfo sourceInfo) {
        int id = nextLocalId++;
        locals.put(id, new MirLocal(id, localName, type, mutability, sourceInfo));
        return id;
    }

    /** 以既有 id 注册局部变量（反序列化等场景）。 */
    public void addLocal(MirLocal local) {
        locals.put(local.getId(), local);
        if (local.getId() >= nextLocalId) nextLocalId = local.getId() + 1;
    }

    public MirLocal getLocal(int id) { return locals.get(id); }
    public boolean hasLocal(int id) { return locals.containsKey(id); }

    public void removeLocal(int id) {
        locals.remove(id);
    }

    /** 参数局部变量永远视为被使用。 */
    public boolean isParamLocal(int id) {
        for (MirParam p : params) {
            if (p.getLocal() == id) return true;
        }
        return false;
    }

    public Set<Integer> getParamLocals() {
        Set<Integer> set = new TreeSet<>();
        for (MirParam p : params) set.add(p.getLocal());
        return set;
    }

    // ========== 基本块 ==========

    public BasicBlock newBlock() {
        BasicBlock block = new BasicBlock(nextBlockId++);
        blocks.put(block.getId(), block);
        return block;
    }

    /** 以既有 id 注册基本块（反序列化等场景），追加到布局末尾。 */
    public void addBlock(BasicBlock block) {
        blocks.put(block.getId(), block);
        if (block.getId() >= nextBlockId) nextBlockId = block.getId() + 1;
    }

    public BasicBlock getBlock(int id) { return blocks.get(id); }
    public boolean hasBlock(int id) { return blocks.containsKey(id); }
    public Collection<BasicBlock> getBlocks() { return blocks.values(); }
    public int getBlockCount() { return blocks.size(); }

    /** 按布局顺序的块 id 列表（快照）。 */
    public List<Integer> getBlockIds() {
        return new ArrayList<>(blocks.keySet());
    }

    public BasicBlock getEntry() {
        return blocks.get(entryBlock);
    }

    public void removeBlock(int id) {
        blocks.remove(id);
    }

    /**
     * 按给定顺序重排块布局。order 必须是当前块 id 集合的一个排列。
     */
    public void reorderBlocks(List<Integer> order) {
        if (order.size() != blocks.size() || !blocks.keySet().containsAll(order)) {
            throw new IllegalArgumentException("块顺序不是当前块集合的排列: " + order);
        }
        Map<Integer, BasicBlock> copy = new LinkedHashMap<>(blocks);
        blocks.clear();
        for (int id : order) blocks.put(id, copy.get(id));
    }

    public int getStatementCount() {
        int count = 0;
        for (BasicBlock block : blocks.values()) count += block.getStatements().size();
        return count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            MirParam p = params.get(i);
            sb.append("_").append(p.getLocal()).append(" ").append(p);
        }
        sb.append(") -> ").append(returnType);
        if (returnLocal >= 0) sb.append(" [ret _").append(returnLocal).append("]");
        sb.append(" {\n");
        for (MirLocal local : locals.values()) {
            sb.append("  let ").append(local).append(";\n");
        }
        for (BasicBlock block : blocks.values()) {
            sb.append(block);
        }
        sb.append("}\n");
        return sb.toString();
    }
}
