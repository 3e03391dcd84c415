package com.aetherlang.ir.mir;

/**
 * MIR 二元运算符。
 */
public enum BinOp {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"), REM("%"), MOD("mod"),
    BIT_XOR("^"), BIT_AND("&"), BIT_OR("|"),
    SHL("<<"), SHR(">>"),
    EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">="),
    AND("&&"), OR("||"),
    OFFSET("offset");

    private final String symbol;

    BinOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() { return symbol; }

    public boolean isComparison() {
        switch (this) {
            case EQ: case NE: case LT: case LE: case GT: case GE: return true;
            default: return false;
        }
    }

    /** 满足交换律的运算，CSE 归一化时按操作数排序。 */
    public boolean isCommutative() {
        switch (this) {
            case ADD: case MUL: case BIT_XOR: case BIT_AND: case BIT_OR:
            case EQ: case NE: case AND: case OR:
                return true;
            default:
                return false;
        }
    }

    /** 除零时可能陷入的运算。 */
    public boolean mayTrap() {
        return this == DIV || this == REM || this == MOD;
    }
}
