package com.aetherlang.ir.mir;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * SwitchInt 的分支表：值列表与目标块列表一一对应，另有一个 otherwise 目标。
 */
public class SwitchTargets {

    private final List<BigInteger> values;
    private final List<Integer> targets;
    private final int otherwise;

    public SwitchTargets(List<BigInteger> values, List<Integer> targets, int otherwise) {
        if (values.size() != targets.size()) {
            throw new IllegalArgumentException("SwitchInt 值与目标数量不一致: "
                    + values.size() + " vs " + targets.size());
        }
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
        this.otherwise = otherwise;
    }

    /**
     * 布尔分支：值 0（false）跳转 elseBlock，其余跳转 thenBlock。
     */
    public static SwitchTargets ifElse(int thenBlock, int elseBlock) {
        return new SwitchTargets(Collections.singletonList(BigInteger.ZERO),
                Collections.singletonList(elseBlock), thenBlock);
    }

    public List<BigInteger> getValues() { return values; }
    public List<Integer> getTargets() { return targets; }
    public int getOtherwise() { return otherwise; }

    /** 判别值对应的目标块。 */
    public int targetFor(BigInteger value) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i).equals(value)) return targets.get(i);
        }
        return otherwise;
    }

    /** 全部目标（含 otherwise），按出现顺序，可能重复。 */
    public List<Integer> allTargets() {
        List<Integer> all = new ArrayList<>(targets.size() + 1);
        all.addAll(targets);
        all.add(otherwise);
        return all;
    }

    public SwitchTargets mapTargets(IntUnaryOperator mapper) {
        List<Integer> mapped = new ArrayList<>(targets.size());
        for (int t : targets) mapped.add(mapper.applyAsInt(t));
        return new SwitchTargets(values, mapped, mapper.applyAsInt(otherwise));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SwitchTargets)) return false;
        SwitchTargets other = (SwitchTargets) o;
        return otherwise == other.otherwise && values.equals(other.values) && targets.equals(other.targets);
    }

    @Override
    public int hashCode() {
        return (values.hashCode() * 31 + targets.hashCode()) * 31 + otherwise;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.size(); i++) {
            sb.append(values.get(i)).append(": B").append(targets.get(i)).append(", ");
        }
        sb.append("otherwise: B").append(otherwise).append("]");
        return sb.toString();
    }
}
