package com.aetherlang.ir.analysis;

import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.Location;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个循环的归纳变量集合。
 */
public class InductionVariables {

    /**
     * 基本归纳变量：循环内唯一定义为 i = i + c（或 i - c、c + i）。
     */
    public static class Basic {
        private final int local;
        private final BigInteger step;
        private final Constant stepConstant;
        private final Location definition;

        public Basic(int local, BigInteger step, Constant stepConstant, Location definition) {
            this.local = local;
            this.step = step;
            this.stepConstant = stepConstant;
            this.definition = definition;
        }

        public int getLocal() { return local; }
        /** 每次迭代的有符号增量。 */
        public BigInteger getStep() { return step; }
        public Constant getStepConstant() { return stepConstant; }
        public Location getDefinition() { return definition; }

        @Override
        public String toString() {
            return "_" + local + " += " + step + " @" + definition;
        }
    }

    /**
     * 派生归纳变量：j = i * c 或 j = i + c，其中 i 为基本归纳变量。
     */
    public static class Derived {
        private final int local;
        private final int base;
        private final BinOp op;
        private final Constant factor;
        private final Location definition;

        public Derived(int local, int base, BinOp op, Constant factor, Location definition) {
            this.local = local;
            this.base = base;
            this.op = op;
            this.factor = factor;
            this.definition = definition;
        }

        public int getLocal() { return local; }
        public int getBase() { return base; }
        public BinOp getOp() { return op; }
        public Constant getFactor() { return factor; }
        public Location getDefinition() { return definition; }

        @Override
        public String toString() {
            return "_" + local + " = _" + base + " " + op.getSymbol() + " " + factor + " @" + definition;
        }
    }

    private final List<Basic> basic = new ArrayList<>();
    private final List<Derived> derived = new ArrayList<>();

    public List<Basic> getBasic() { return Collections.unmodifiableList(basic); }
    public List<Derived> getDerived() { return Collections.unmodifiableList(derived); }

    void addBasic(Basic iv) { basic.add(iv); }
    void addDerived(Derived iv) { derived.add(iv); }

    public Basic findBasic(int local) {
        for (Basic iv : basic) {
            if (iv.getLocal() == local) return iv;
        }
        return null;
    }

    public boolean isEmpty() {
        return basic.isEmpty() && derived.isEmpty();
    }
}
