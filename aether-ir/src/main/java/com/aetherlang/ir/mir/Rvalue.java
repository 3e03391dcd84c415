package com.aetherlang.ir.mir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;
import java.util.function.UnaryOperator;

/**
 * 赋值语句右侧的计算。
 */
public abstract class Rvalue {

    public enum Kind { USE, BINARY_OP, UNARY_OP, CALL, AGGREGATE, CAST, REF, LEN, DISCRIMINANT }

    public abstract Kind getKind();

    /** 直接出现的操作数（不含 Place 形式的 Ref/Len/Discriminant）。 */
    public abstract List<Operand> getOperands();

    /** 收集读取（或取地址）涉及的全部局部变量。 */
    public abstract void collectReadLocals(Collection<Integer> out);

    public abstract Rvalue mapLocals(IntUnaryOperator mapper);

    /** 替换操作数，Place 形式的读取保持不变。 */
    public abstract Rvalue mapOperands(UnaryOperator<Operand> mapper);

    /** 是否为纯表达式（Use / BinaryOp / UnaryOp），CSE 只处理这一类。 */
    public boolean isPureExpression() {
        Kind k = getKind();
        return k == Kind.USE || k == Kind.BINARY_OP || k == Kind.UNARY_OP;
    }

    public static Rvalue use(Operand operand) { return new Use(operand); }

    public static Rvalue binary(BinOp op, Operand left, Operand right) {
        return new BinaryOp(op, left, right);
    }

    public static Rvalue unary(UnOp op, Operand operand) { return new UnaryOp(op, operand); }

    public static Rvalue call(Operand func, List<Operand> args) { return new Call(func, args); }

    private static List<Operand> mapAll(List<Operand> ops, UnaryOperator<Operand> mapper) {
        List<Operand> result = new ArrayList<>(ops.size());
        for (Operand op : ops) result.add(mapper.apply(op));
        return result;
    }

    private static String join(List<Operand> ops) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ops.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(ops.get(i));
        }
        return sb.toString();
    }

    /**
     * 直接使用操作数。
     */
    public static class Use extends Rvalue {
        private final Operand operand;

        public Use(Operand operand) { this.operand = Objects.requireNonNull(operand); }

        public Operand getOperand() { return operand; }

        @Override
        public Kind getKind() { return Kind.USE; }

        @Override
        public List<Operand> getOperands() { return Collections.singletonList(operand); }

        @Override
        public void collectReadLocals(Collection<Integer> out) { operand.collectReadLocals(out); }

        @Override
        public Rvalue mapLocals(IntUnaryOperator mapper) { return new Use(operand.mapLocals(mapper)); }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) { return new Use(mapper.apply(operand)); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Use && ((Use) o).operand.equals(operand);
        }

        @Override
        public int hashCode() { return operand.hashCode(); }

        @Override
        public String toString() { return operand.toString(); }
    }

    /**
     * 二元运算。
     */
    public static class BinaryOp extends Rvalue {
        private final BinOp op;
        private final Operand left;
        private final Operand right;

        public BinaryOp(BinOp op, Operand left, Operand right) {
            this.op = Objects.requireNonNull(op);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        public BinOp getOp() { return op; }
        public Operand getLeft() { return left; }
        public Operand getRight() { return right; }

        @Override
        public Kind getKind() { return Kind.BINARY_OP; }

        @Override
        public List<Operand> getOperands() {
            List<Operand> ops = new ArrayList<>(2);
            ops.add(left);
            ops.add(right);
            return ops;
        }

        @Override
        public void collectReadLocals(Collection<Integer> out) {
            left.collectReadLocals(out);
            right.collectReadLocals(out);
        }

        @Override
        public Rvalue mapLocals(IntUnaryOperator mapper) {
            return new BinaryOp(op, left.mapLocals(mapper), right.mapLocals(mapper));
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) {
            return new BinaryOp(op, mapper.apply(left), mapper.apply(right));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof BinaryOp)) return false;
            BinaryOp other = (BinaryOp) o;
            return op == other.op && left.equals(other.left) && right.equals(other.right);
        }

        @Override
        public int hashCode() { return Objects.hash(op, left, right); }

        @Override
        public String toString() { return op + "(" + left + ", " + right + ")"; }
    }

    /**
     * 一元运算。
     */
    public static class UnaryOp extends Rvalue {
        private final UnOp op;
        private final Operand operand;

        public UnaryOp(UnOp op, Operand operand) {
            this.op = Objects.requireNonNull(op);
            this.operand = Objects.requireNonNull(operand);
        }

        public UnOp getOp() { return op; }
        public Operand getOperand() { return operand; }

        @Override
        public Kind getKind() { return Kind.UNARY_OP; }

        @Override
        public List<Operand> getOperands() { return Collections.singletonList(operand); }

        @Override
        public void collectReadLocals(Collection<Integer> out) { operand.collectReadLocals(out); }

        @Override
        public Rvalue mapLocals(IntUnaryOperator mapper) {
            return new UnaryOp(op, operand.mapLocals(mapper));
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) {
            return new UnaryOp(op, mapper.apply(operand));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof UnaryOp)) return false;
            UnaryOp other = (UnaryOp) o;
            return op == other.op && operand.equals(other.operand);
        }

        @Override
        public int hashCode() { return Objects.hash(op, operand); }

        @Override
        public String toString() { return op + "(" + operand + ")"; }
    }

    /**
     * 语句内的函数调用。总是被视为有副作用。
     */
    public static class Call extends Rvalue {
        private final Operand func;
        private final List<Operand> args;

        public Call(Operand func, List<Operand> args) {
            this.func = Objects.requireNonNull(func);
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        public Operand getFunc() { return func; }
        public List<Operand> getArgs() { return args; }

        /** 直接调用的函数名，间接调用返回 null。 */
        public String getCalleeName() {
            Constant c = func.getConstant();
            return c != null ? c.getFunctionName() : null;
        }

        @Override
        public Kind getKind() { return Kind.CALL; }

        @Override
        public List<Operand> getOperands() {
            List<Operand> ops = new ArrayList<>(args.size() + 1);
            ops.add(func);
            ops.addAll(args);
            return ops;
        }

        @Override
        public void collectReadLocals(Collection<Integer> out) {
            func.collectReadLocals(out);
            for (Operand arg : args) arg.collectReadLocals(out);
        }

        @Override
        public Rvalue mapLocals(IntUnaryOperator mapper) {
            List<Operand> mapped = new ArrayList<>(args.size());
            for (Operand arg : args) mapped.add(arg.mapLocals(mapper));
            return new Call(func.mapLocals(mapper), mapped);
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) {
            return new Call(mapper.apply(func), mapAll(args, mapper));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Call)) return false;
            Call other = (Call) o;
            return func.equals(other.func) && args.equals(other.args);
        }

        @Override
        public int hashCode() { return Objects.hash(func, args); }

        @Override
        public String toString() { return "call " + func + "(" + join(args) + ")"; }
    }

    /**
     * 聚合构造（数组 / 元组 / 结构体 / 枚举）。
     */
    public static class Aggregate extends Rvalue {
        private final AggregateKind aggregateKind;
        private final List<Operand> operands;

        public Aggregate(AggregateKind aggregateKind, List<Operand> operands) {
            this.aggregateKind = Objects.requireNonNull(aggregateKind);
            this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        }

        public AggregateKind getAggregateKind() { return aggregateKind; }

        @Override
        public Kind getKind() { return Kind.AGGREGATE; }

        @Override
        public List<Operand> getOperands() { return operands; }

        @Override
        public void collectReadLocals(Collection<Integer> out) {
            for (Operand op : operands) op.collectReadLocals(out);
        }

        @Override
        public Rvalue mapLocals(IntUnaryOperator mapper) {
            List<Operand> mapped = new ArrayList<>(operands.size());
            for (Operand op : operands) mapped.add(op.mapLocals(mapper));
            return new Aggregate(aggregateKind, mapped);
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) {
            return new Aggregate(aggregateKind, mapAll(operands, mapper));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Aggregate)) return false;
            Aggregate other = (Aggregate) o;
            return aggregateKind.equals(other.aggregateKind) && operands.equals(other.operands);
        }

        @Override
        public int hashCode() { return Objects.hash(aggregateKind, operands); }

        @Override
        public String toString() { return aggregateKind + " {" + join(operands) + "}"; }
    }

    /**
     * 类型转换。
     */
    public static class Cast extends Rvalue {
        private final CastKind castKind;
        private final Operand operand;
        private final MirType type;

        public Cast(CastKind castKind, Operand operand, MirType type) {
            this.castKind = Objects.requireNonNull(castKind);
            this.operand = Objects.requireNonNull(operand);
            this.type = Objects.requireNonNull(type);
        }

        public CastKind getCastKind() { return castKind; }
        public Operand getOperand() { return operand; }
        public MirType getType() { return type; }

        @Override
        public Kind getKind() { return Kind.CAST; }

        @Override
        public List<Operand> getOperands() { return Collections.singletonList(operand); }

        @Override
        public void collectReadLocals(Collection<Integer> out) { operand.collectReadLocals(out); }

        @Override
        public Rvalue mapLocals(IntUnaryOperator mapper) {
            return new Cast(castKind, operand.mapLocals(mapper), type);
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) {
            return new Cast(castKind, mapper.apply(operand), type);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Cast)) return false;
            Cast other = (Cast) o;
            return castKind == other.castKind && operand.equals(other.operand) && type.equals(other.type);
        }

        @Override
        public int hashCode() { return Objects.hash(castKind, operand, type); }

        @Override
        public String toString() { return operand + " as " + type + " (" + castKind + ")"; }
    }

    /**
     * 取引用。
     */
    public static class Ref extends Rvalue {
        private final Place place;
        private final Mutability mutability;

        public Ref(Place place, Mutability mutability) {
            this.place = Objects.requireNonNull(place);
            this.mutability = Objects.requireNonNull(mutability);
        }

        public Place getPlace() { return place; }
        public Mutability getMutability() { return mutability; }

        @Override
        public Kind getKind() { return Kind.REF; }

        @Override
        public List<Operand> getOperands() { return Collections.emptyList(); }

        @Override
        public void collectReadLocals(Collection<Integer> out) { place.collectLocals(out); }

        @Override
        public Rvalue mapLocals(IntUnaryOperator mapper) {
            return new Ref(place.mapLocals(mapper), mutability);
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) { return this; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Ref)) return false;
            Ref other = (Ref) o;
            return place.equals(other.place) && mutability == other.mutability;
        }

        @Override
        public int hashCode() { return Objects.hash(place, mutability); }

        @Override
        public String toString() { return (mutability == Mutability.MUT ? "&mut " : "&") + place; }
    }

    /**
     * 数组 / 切片长度。
     */
    public static class Len extends Rvalue {
        private final Place place;

        public Len(Place place) { this.place = Objects.requireNonNull(place); }

        public Place getPlace() { return place; }

        @Override
        public Kind getKind() { return Kind.LEN; }

        @Override
        public List<Operand> getOperands() { return Collections.emptyList(); }

        @Override
        public void collectReadLocals(Collection<Integer> out) { place.collectLocals(out); }

        @Override
        public Rvalue mapLocals(IntUnaryOperator mapper) { return new Len(place.mapLocals(mapper)); }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) { return this; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Len && ((Len) o).place.equals(place);
        }

        @Override
        public int hashCode() { return place.hashCode() * 5 + 3; }

        @Override
        public String toString() { return "len(" + place + ")"; }
    }

    /**
     * 枚举判别值。
     */
    public static class Discriminant extends Rvalue {
        private final Place place;

        public Discriminant(Place place) { this.place = Objects.requireNonNull(place); }

        public Place getPlace() { return place; }

        @Override
        public Kind getKind() { return Kind.DISCRIMINANT; }

        @Override
        public List<Operand> getOperands() { return Collections.emptyList(); }

        @Override
        public void collectReadLocals(Collection<Integer> out) { place.collectLocals(out); }

        @Override
        public Rvalue mapLocals(IntUnaryOperator mapper) {
            return new Discriminant(place.mapLocals(mapper));
        }

        @Override
        public Rvalue mapOperands(UnaryOperator<Operand> mapper) { return this; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Discriminant && ((Discriminant) o).place.equals(place);
        }

        @Override
        public int hashCode() { return place.hashCode() * 7 + 5; }

        @Override
        public String toString() { return "discriminant(" + place + ")"; }
    }
}
