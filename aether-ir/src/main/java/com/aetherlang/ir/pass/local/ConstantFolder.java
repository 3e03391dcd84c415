package com.aetherlang.ir.pass.local;

import com.aetherlang.ir.mir.BinOp;
import com.aetherlang.ir.mir.Constant;
import com.aetherlang.ir.mir.ConstantValue;
import com.aetherlang.ir.mir.MirType;
import com.aetherlang.ir.mir.UnOp;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * 常量运算求值，供常量折叠与编译期求值共用。
 * <p>
 * 整数按 128 位有符号补码回绕；除数为 0 时不折叠；移位量取低 6 位；
 * 浮点相等比较使用 epsilon；比较运算结果总是 bool；
 * 任一侧为浮点时结果为浮点，否则沿用左操作数的整数类型。
 * 无法折叠时返回 null。
 */
public final class ConstantFolder {

    private static final BigInteger MODULUS = BigInteger.ONE.shiftLeft(128);
    private static final BigInteger MAX_I128 = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    private static final BigInteger SHIFT_MASK = BigInteger.valueOf(63);

    private ConstantFolder() {}

    /** 截断到 128 位有符号整数。 */
    public static BigInteger wrap(BigInteger value) {
        BigInteger v = value.mod(MODULUS);
        return v.compareTo(MAX_I128) > 0 ? v.subtract(MODULUS) : v;
    }

    public static Constant foldBinary(BinOp op, Constant left, Constant right) {
        if (!left.isLiteral() || !right.isLiteral()) return null;
        ConstantValue l = left.getValue();
        ConstantValue r = right.getValue();

        if (l instanceof ConstantValue.Int && r instanceof ConstantValue.Int) {
            return foldInteger(op, ((ConstantValue.Int) l).getValue(), ((ConstantValue.Int) r).getValue(),
                    left.getType());
        }
        if (isNumber(l) && isNumber(r) && (l instanceof ConstantValue.Float || r instanceof ConstantValue.Float)) {
            MirType floatType = l instanceof ConstantValue.Float ? left.getType() : right.getType();
            return foldFloat(op, toDouble(l), toDouble(r), floatType);
        }
        if (l instanceof ConstantValue.Bool && r instanceof ConstantValue.Bool) {
            return foldBool(op, ((ConstantValue.Bool) l).getValue(), ((ConstantValue.Bool) r).getValue());
        }
        if (l instanceof ConstantValue.Str && r instanceof ConstantValue.Str) {
            String a = ((ConstantValue.Str) l).getValue();
            String b = ((ConstantValue.Str) r).getValue();
            switch (op) {
                case EQ: return Constant.ofBool(a.equals(b));
                case NE: return Constant.ofBool(!a.equals(b));
                case ADD: return Constant.ofStr(a + b);
                default: return null;
            }
        }
        if (l instanceof ConstantValue.Char && r instanceof ConstantValue.Char && op.isComparison()) {
            int cmp = Integer.compare(((ConstantValue.Char) l).getCodePoint(), ((ConstantValue.Char) r).getCodePoint());
            return Constant.ofBool(compare(op, cmp));
        }
        return null;
    }

    public static Constant foldUnary(UnOp op, Constant operand) {
        if (!operand.isLiteral()) return null;
        ConstantValue v = operand.getValue();
        switch (op) {
            case NOT:
                if (v instanceof ConstantValue.Bool) {
                    return Constant.ofBool(!((ConstantValue.Bool) v).getValue());
                }
                if (v instanceof ConstantValue.Int) {
                    return Constant.ofInt(((ConstantValue.Int) v).getValue().not(), operand.getType());
                }
                return null;
            case NEG:
                if (v instanceof ConstantValue.Int) {
                    return Constant.ofInt(wrap(((ConstantValue.Int) v).getValue().negate()), operand.getType());
                }
                if (v instanceof ConstantValue.Float) {
                    return Constant.ofFloat(-((ConstantValue.Float) v).getValue(), operand.getType());
                }
                return null;
            default:
                return null;
        }
    }

    /**
     * 数值转换。整数目标按目标位宽截断（有符号 / 无符号），浮点转整数向零取整。
     */
    public static Constant foldCast(Constant operand, MirType target) {
        if (!operand.isLiteral()) return null;
        ConstantValue v = operand.getValue();
        if (target.isInteger()) {
            BigInteger value;
            if (v instanceof ConstantValue.Int) {
                value = ((ConstantValue.Int) v).getValue();
            } else if (v instanceof ConstantValue.Bool) {
                value = ((ConstantValue.Bool) v).getValue() ? BigInteger.ONE : BigInteger.ZERO;
            } else if (v instanceof ConstantValue.Char) {
                value = BigInteger.valueOf(((ConstantValue.Char) v).getCodePoint());
            } else if (v instanceof ConstantValue.Float) {
                double d = ((ConstantValue.Float) v).getValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) return null;
                value = new BigDecimal(d).toBigInteger();
            } else {
                return null;
            }
            return Constant.ofInt(truncate(value, target), target);
        }
        if (target.isFloat()) {
            if (!isNumber(v)) return null;
            double d = toDouble(v);
            if (target.getKind() == MirType.Kind.F32) d = (float) d;
            return Constant.ofFloat(d, target);
        }
        if (target.isBool() && v instanceof ConstantValue.Bool) {
            return operand;
        }
        return null;
    }

    // ==================== 内部 ====================

    private static Constant foldInteger(BinOp op, BigInteger l, BigInteger r, MirType type) {
        switch (op) {
            case ADD: return Constant.ofInt(wrap(l.add(r)), type);
            case SUB: return Constant.ofInt(wrap(l.subtract(r)), type);
            case MUL: return Constant.ofInt(wrap(l.multiply(r)), type);
            case DIV: return r.signum() == 0 ? null : Constant.ofInt(wrap(l.divide(r)), type);
            case REM: return r.signum() == 0 ? null : Constant.ofInt(l.remainder(r), type);
            case BIT_AND: return Constant.ofInt(l.and(r), type);
            case BIT_OR: return Constant.ofInt(l.or(r), type);
            case BIT_XOR: return Constant.ofInt(l.xor(r), type);
            case SHL: return Constant.ofInt(wrap(l.shiftLeft(r.and(SHIFT_MASK).intValue())), type);
            case SHR: return Constant.ofInt(l.shiftRight(r.and(SHIFT_MASK).intValue()), type);
            case EQ: case NE: case LT: case LE: case GT: case GE:
                return Constant.ofBool(compare(op, l.compareTo(r)));
            default:
                return null;
        }
    }

    private static Constant foldFloat(BinOp op, double l, double r, MirType type) {
        switch (op) {
            case ADD: return Constant.ofFloat(l + r, type);
            case SUB: return Constant.ofFloat(l - r, type);
            case MUL: return Constant.ofFloat(l * r, type);
            case DIV: return r == 0.0 ? null : Constant.ofFloat(l / r, type);
            case EQ: return Constant.ofBool(Math.abs(l - r) < ConstantValue.FLOAT_EPSILON);
            case NE: return Constant.ofBool(Math.abs(l - r) >= ConstantValue.FLOAT_EPSILON);
            case LT: return Constant.ofBool(l < r);
            case LE: return Constant.ofBool(l <= r);
            case GT: return Constant.ofBool(l > r);
            case GE: return Constant.ofBool(l >= r);
            default: return null;
        }
    }

    private static Constant foldBool(BinOp op, boolean l, boolean r) {
        switch (op) {
            case EQ: return Constant.ofBool(l == r);
            case NE: return Constant.ofBool(l != r);
            case AND: case BIT_AND: return Constant.ofBool(l && r);
            case OR: case BIT_OR: return Constant.ofBool(l || r);
            case BIT_XOR: return Constant.ofBool(l ^ r);
            default: return null;
        }
    }

    private static boolean compare(BinOp op, int cmp) {
        switch (op) {
            case EQ: return cmp == 0;
            case NE: return cmp != 0;
            case LT: return cmp < 0;
            case LE: return cmp <= 0;
            case GT: return cmp > 0;
            default: return cmp >= 0;
        }
    }

    private static boolean isNumber(ConstantValue v) {
        return v instanceof ConstantValue.Int || v instanceof ConstantValue.Float;
    }

    private static double toDouble(ConstantValue v) {
        return v instanceof ConstantValue.Int
                ? ((ConstantValue.Int) v).getValue().doubleValue()
                : ((ConstantValue.Float) v).getValue();
    }

    private static BigInteger truncate(BigInteger value, MirType type) {
        int bits = type.getBitWidth();
        if (bits <= 0 || bits >= 128) return wrap(value);
        BigInteger modulus = BigInteger.ONE.shiftLeft(bits);
        BigInteger v = value.mod(modulus);
        if (type.isSignedInteger() && v.testBit(bits - 1)) v = v.subtract(modulus);
        return v;
    }
}
