package io.surfworks.graphlower.graph;

import java.util.List;

import io.surfworks.graphlower.symbolic.SymExpr;

/**
 * Arithmetic and comparison operators applied to symbolic integers during tracing
 * (the "magic methods" of a symbolic int).
 */
public enum SymbolicOp implements Target {
    ADD("add", 2),
    SUB("sub", 2),
    MUL("mul", 2),
    FLOORDIV("floordiv", 2),
    MOD("mod", 2),
    NEG("neg", 1),
    EQ("eq", 2),
    NE("ne", 2),
    LT("lt", 2),
    LE("le", 2),
    GT("gt", 2),
    GE("ge", 2),
    SYM_MIN("sym_min", 2),
    SYM_MAX("sym_max", 2);

    private final String displayName;
    private final int arity;

    SymbolicOp(String displayName, int arity) {
        this.displayName = displayName;
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }

    /**
     * Apply this operator to already-symbolic operands.
     */
    public SymExpr apply(List<SymExpr> operands) {
        if (operands.size() != arity) {
            throw new IllegalArgumentException(displayName + " expects " + arity + " operands, got " + operands.size());
        }
        if (this == NEG) {
            return operands.get(0).negate();
        }
        SymExpr a = operands.get(0);
        SymExpr b = operands.get(1);
        return switch (this) {
            case ADD -> a.plus(b);
            case SUB -> a.minus(b);
            case MUL -> a.times(b);
            case FLOORDIV -> a.floorDiv(b);
            case MOD -> a.mod(b);
            case EQ -> a.apply(SymExpr.Op.EQ, b);
            case NE -> a.apply(SymExpr.Op.NE, b);
            case LT -> a.apply(SymExpr.Op.LT, b);
            case LE -> a.apply(SymExpr.Op.LE, b);
            case GT -> a.apply(SymExpr.Op.GT, b);
            case GE -> a.apply(SymExpr.Op.GE, b);
            case SYM_MIN -> a.apply(SymExpr.Op.MIN, b);
            case SYM_MAX -> a.apply(SymExpr.Op.MAX, b);
            case NEG -> throw new AssertionError("unreachable");
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
