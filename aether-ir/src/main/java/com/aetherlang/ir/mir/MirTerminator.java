package com.aetherlang.ir.mir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntUnaryOperator;
import java.util.function.UnaryOperator;

/**
 * MIR 基本块终止指令。每个基本块必须恰好有一个终止指令。
 * <p>
 * 可选的块目标（Call 的 target / cleanup，Drop 的 unwind，Assert 的 cleanup）用 -1 表示不存在。
 */
public abstract class MirTerminator {

    /** 不存在的块目标 */
    public static final int NO_BLOCK = -1;

    public enum Kind { GOTO, SWITCH_INT, RETURN, UNREACHABLE, CALL, DROP, ASSERT }

    public abstract Kind getKind();

    /** 全部后继块（去重，保持出现顺序）。 */
    public List<Integer> getSuccessors() {
        return Collections.emptyList();
    }

    /** 重映射全部块目标。 */
    public MirTerminator mapTargets(IntUnaryOperator mapper) {
        return this;
    }

    public MirTerminator mapLocals(IntUnaryOperator mapper) {
        return this;
    }

    public MirTerminator mapOperands(UnaryOperator<Operand> mapper) {
        return this;
    }

    /** 直接出现的操作数。 */
    public List<Operand> getOperands() {
        return Collections.emptyList();
    }

    /** 收集终止指令读取的局部变量。 */
    public void collectReadLocals(Collection<Integer> out) {
        for (Operand op : getOperands()) op.collectReadLocals(out);
    }

    public static MirTerminator goTo(int target) { return new Goto(target); }
    public static MirTerminator returnValue() { return Return.INSTANCE; }
    public static MirTerminator unreachable() { return Unreachable.INSTANCE; }

    /** 布尔条件分支。 */
    public static MirTerminator ifElse(Operand condition, int thenBlock, int elseBlock) {
        return new SwitchInt(condition, MirType.ofBool(), SwitchTargets.ifElse(thenBlock, elseBlock));
    }

    private static List<Integer> distinct(List<Integer> ids) {
        Set<Integer> set = new LinkedHashSet<>();
        for (int id : ids) {
            if (id != NO_BLOCK) set.add(id);
        }
        return new ArrayList<>(set);
    }

    private static int mapOptional(int block, IntUnaryOperator mapper) {
        return block == NO_BLOCK ? NO_BLOCK : mapper.applyAsInt(block);
    }

    /**
     * 无条件跳转。
     */
    public static class Goto extends MirTerminator {
        private final int target;

        public Goto(int target) { this.target = target; }

        public int getTarget() { return target; }

        @Override
        public Kind getKind() { return Kind.GOTO; }

        @Override
        public List<Integer> getSuccessors() { return Collections.singletonList(target); }

        @Override
        public MirTerminator mapTargets(IntUnaryOperator mapper) {
            return new Goto(mapper.applyAsInt(target));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Goto && ((Goto) o).target == target;
        }

        @Override
        public int hashCode() { return target; }

        @Override
        public String toString() { return "goto B" + target; }
    }

    /**
     * 整数多路分支。
     */
    public static class SwitchInt extends MirTerminator {
        private final Operand discriminant;
        private final MirType switchType;
        private final SwitchTargets targets;

        public SwitchInt(Operand discriminant, MirType switchType, SwitchTargets targets) {
            this.discriminant = Objects.requireNonNull(discriminant);
            this.switchType = Objects.requireNonNull(switchType);
            this.targets = Objects.requireNonNull(targets);
        }

        public Operand getDiscriminant() { return discriminant; }
        public MirType getSwitchType() { return switchType; }
        public SwitchTargets getTargets() { return targets; }

        @Override
        public Kind getKind() { return Kind.SWITCH_INT; }

        @Override
        public List<Integer> getSuccessors() { return distinct(targets.allTargets()); }

        @Override
        public MirTerminator mapTargets(IntUnaryOperator mapper) {
            return new SwitchInt(discriminant, switchType, targets.mapTargets(mapper));
        }

        @Override
        public MirTerminator mapLocals(IntUnaryOperator mapper) {
            return new SwitchInt(discriminant.mapLocals(mapper), switchType, targets);
        }

        @Override
        public MirTerminator mapOperands(UnaryOperator<Operand> mapper) {
            return new SwitchInt(mapper.apply(discriminant), switchType, targets);
        }

        @Override
        public List<Operand> getOperands() { return Collections.singletonList(discriminant); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof SwitchInt)) return false;
            SwitchInt other = (SwitchInt) o;
            return discriminant.equals(other.discriminant) && switchType.equals(other.switchType)
                    && targets.equals(other.targets);
        }

        @Override
        public int hashCode() { return Objects.hash(discriminant, switchType, targets); }

        @Override
        public String toString() { return "switchInt(" + discriminant + ") " + targets; }
    }

    /**
     * 返回。返回值由函数的返回局部变量携带。
     */
    public static class Return extends MirTerminator {
        static final Return INSTANCE = new Return();

        private Return() {}

        @Override
        public Kind getKind() { return Kind.RETURN; }

        @Override
        public boolean equals(Object o) { return o instanceof Return; }

        @Override
        public int hashCode() { return 101; }

        @Override
        public String toString() { return "return"; }
    }

    /**
     * 不可达（构建过程中的占位终止指令）。
     */
    public static class Unreachable extends MirTerminator {
        static final Unreachable INSTANCE = new Unreachable();

        private Unreachable() {}

        @Override
        public Kind getKind() { return Kind.UNREACHABLE; }

        @Override
        public boolean equals(Object o) { return o instanceof Unreachable; }

        @Override
        public int hashCode() { return 103; }

        @Override
        public String toString() { return "unreachable"; }
    }

    /**
     * 函数调用，返回后跳转到 target。
     */
    public static class Call extends MirTerminator {
        private final Operand func;
        private final List<Operand> args;
        private final Place destination; // null = 丢弃返回值
        private final int target;
        private final int cleanup;

        public Call(Operand func, List<Operand> args, Place destination, int target, int cleanup) {
            this.func = Objects.requireNonNull(func);
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
            this.destination = destination;
            this.target = target;
            this.cleanup = cleanup;
        }

        public Operand getFunc() { return func; }
        public List<Operand> getArgs() { return args; }
        public Place getDestination() { return destination; }
        public int getTarget() { return target; }
        public int getCleanup() { return cleanup; }
        public boolean hasTarget() { return target != NO_BLOCK; }
        public boolean hasCleanup() { return cleanup != NO_BLOCK; }

        /** 直接调用的函数名，间接调用返回 null。 */
        public String getCalleeName() {
            Constant c = func.getConstant();
            return c != null ? c.getFunctionName() : null;
        }

        @Override
        public Kind getKind() { return Kind.CALL; }

        @Override
        public List<Integer> getSuccessors() {
            List<Integer> ids = new ArrayList<>(2);
            ids.add(target);
            ids.add(cleanup);
            return distinct(ids);
        }

        @Override
        public MirTerminator mapTargets(IntUnaryOperator mapper) {
            return new Call(func, args, destination, mapOptional(target, mapper), mapOptional(cleanup, mapper));
        }

        @Override
        public MirTerminator mapLocals(IntUnaryOperator mapper) {
            List<Operand> mapped = new ArrayList<>(args.size());
            for (Operand arg : args) mapped.add(arg.mapLocals(mapper));
            Place dest = destination != null ? destination.mapLocals(mapper) : null;
            return new Call(func.mapLocals(mapper), mapped, dest, target, cleanup);
        }

        @Override
        public MirTerminator mapOperands(UnaryOperator<Operand> mapper) {
            List<Operand> mapped = new ArrayList<>(args.size());
            for (Operand arg : args) mapped.add(mapper.apply(arg));
            return new Call(mapper.apply(func), mapped, destination, target, cleanup);
        }

        @Override
        public List<Operand> getOperands() {
            List<Operand> ops = new ArrayList<>(args.size() + 1);
            ops.add(func);
            ops.addAll(args);
            return ops;
        }

        @Override
        public void collectReadLocals(Collection<Integer> out) {
            super.collectReadLocals(out);
            if (destination != null && destination.hasProjection()) destination.collectLocals(out);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Call)) return false;
            Call other = (Call) o;
            return func.equals(other.func) && args.equals(other.args)
                    && Objects.equals(destination, other.destination)
                    && target == other.target && cleanup == other.cleanup;
        }

        @Override
        public int hashCode() { return Objects.hash(func, args, destination, target, cleanup); }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            if (destination != null) sb.append(destination).append(" = ");
            sb.append("call ").append(func).append("(");
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(args.get(i));
            }
            sb.append(") -> ");
            sb.append(target == NO_BLOCK ? "!" : "B" + target);
            if (cleanup != NO_BLOCK) sb.append(" unwind B").append(cleanup);
            return sb.toString();
        }
    }

    /**
     * 析构 place 后跳转到 target。
     */
    public static class Drop extends MirTerminator {
        private final Place place;
        private final int target;
        private final int unwind;

        public Drop(Place place, int target, int unwind) {
            this.place = Objects.requireNonNull(place);
            this.target = target;
            this.unwind = unwind;
        }

        public Place getPlace() { return place; }
        public int getTarget() { return target; }
        public int getUnwind() { return unwind; }

        @Override
        public Kind getKind() { return Kind.DROP; }

        @Override
        public List<Integer> getSuccessors() {
            List<Integer> ids = new ArrayList<>(2);
            ids.add(target);
            ids.add(unwind);
            return distinct(ids);
        }

        @Override
        public MirTerminator mapTargets(IntUnaryOperator mapper) {
            return new Drop(place, mapper.applyAsInt(target), mapOptional(unwind, mapper));
        }

        @Override
        public MirTerminator mapLocals(IntUnaryOperator mapper) {
            return new Drop(place.mapLocals(mapper), target, unwind);
        }

        @Override
        public void collectReadLocals(Collection<Integer> out) {
            place.collectLocals(out);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Drop)) return false;
            Drop other = (Drop) o;
            return place.equals(other.place) && target == other.target && unwind == other.unwind;
        }

        @Override
        public int hashCode() { return Objects.hash(place, target, unwind); }

        @Override
        public String toString() {
            return "drop(" + place + ") -> B" + target + (unwind != NO_BLOCK ? " unwind B" + unwind : "");
        }
    }

    /**
     * 断言 condition == expected，成功跳转 target。
     */
    public static class Assert extends MirTerminator {
        private final Operand condition;
        private final boolean expected;
        private final AssertMessage message;
        private final int target;
        private final int cleanup;

        public Assert(Operand condition, boolean expected, AssertMessage message, int target, int cleanup) {
            this.condition = Objects.requireNonNull(condition);
            this.expected = expected;
            this.message = Objects.requireNonNull(message);
            this.target = target;
            this.cleanup = cleanup;
        }

        public Operand getCondition() { return condition; }
        public boolean isExpected() { return expected; }
        public AssertMessage getMessage() { return message; }
        public int getTarget() { return target; }
        public int getCleanup() { return cleanup; }

        @Override
        public Kind getKind() { return Kind.ASSERT; }

        @Override
        public List<Integer> getSuccessors() {
            List<Integer> ids = new ArrayList<>(2);
            ids.add(target);
            ids.add(cleanup);
            return distinct(ids);
        }

        @Override
        public MirTerminator mapTargets(IntUnaryOperator mapper) {
            return new Assert(condition, expected, message, mapper.applyAsInt(target), mapOptional(cleanup, mapper));
        }

        @Override
        public MirTerminator mapLocals(IntUnaryOperator mapper) {
            return new Assert(condition.mapLocals(mapper), expected, message, target, cleanup);
        }

        @Override
        public MirTerminator mapOperands(UnaryOperator<Operand> mapper) {
            return new Assert(mapper.apply(condition), expected, message, target, cleanup);
        }

        @Override
        public List<Operand> getOperands() { return Collections.singletonList(condition); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Assert)) return false;
            Assert other = (Assert) o;
            return condition.equals(other.condition) && expected == other.expected
                    && message.equals(other.message) && target == other.target && cleanup == other.cleanup;
        }

        @Override
        public int hashCode() { return Objects.hash(condition, expected, message, target, cleanup); }

        @Override
        public String toString() {
            return "assert(" + (expected ? "" : "!") + condition + ", " + message + ") -> B" + target
                    + (cleanup != NO_BLOCK ? " unwind B" + cleanup : "");
        }
    }
}
