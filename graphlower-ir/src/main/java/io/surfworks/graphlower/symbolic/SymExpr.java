package io.surfworks.graphlower.symbolic;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Integer-valued size expressions: constants, named symbols and binary combinations.
 *
 * <p>Expressions are immutable values; two expressions built from the same symbols in the
 * same way are {@code equals}. Operations on two constants fold eagerly, as do the
 * identities {@code x + 0}, {@code x * 1} and {@code x * 0}.
 */
public sealed interface SymExpr permits SymExpr.Int, SymExpr.Sym, SymExpr.Binary {

    static SymExpr of(long value) {
        return Int.of(value);
    }

    static Sym symbol(String name) {
        return new Sym(name);
    }

    /**
     * The symbols this expression depends on, in first-use order.
     */
    Set<Sym> freeSymbols();

    /**
     * Evaluate with the given symbol bindings.
     *
     * @throws IllegalStateException if a free symbol has no binding
     */
    long evaluate(Map<Sym, Long> bindings);

    default boolean isConstant() {
        return this instanceof Int;
    }

    default SymExpr plus(SymExpr other) {
        return Binary.fold(Op.ADD, this, other);
    }

    default SymExpr minus(SymExpr other) {
        return Binary.fold(Op.SUB, this, other);
    }

    default SymExpr times(SymExpr other) {
        return Binary.fold(Op.MUL, this, other);
    }

    default SymExpr floorDiv(SymExpr other) {
        return Binary.fold(Op.FLOORDIV, this, other);
    }

    default SymExpr mod(SymExpr other) {
        return Binary.fold(Op.MOD, this, other);
    }

    default SymExpr negate() {
        return Binary.fold(Op.MUL, Int.of(-1), this);
    }

    /**
     * Combine with another expression under any operator, folding where possible.
     */
    default SymExpr apply(Op op, SymExpr other) {
        return Binary.fold(op, this, other);
    }

    // ==================== Operators ====================

    enum Op {
        ADD("+", false),
        SUB("-", false),
        MUL("*", false),
        FLOORDIV("//", false),
        MOD("%", false),
        MIN("min", false),
        MAX("max", false),
        EQ("==", true),
        NE("!=", true),
        LT("<", true),
        LE("<=", true),
        GT(">", true),
        GE(">=", true);

        private final String symbol;
        private final boolean relational;

        Op(String symbol, boolean relational) {
            this.symbol = symbol;
            this.relational = relational;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Relational operators evaluate to 1 (true) or 0 (false).
         */
        public boolean isRelational() {
            return relational;
        }

        public long apply(long a, long b) {
            return switch (this) {
                case ADD -> a + b;
                case SUB -> a - b;
                case MUL -> a * b;
                case FLOORDIV -> Math.floorDiv(a, b);
                case MOD -> Math.floorMod(a, b);
                case MIN -> Math.min(a, b);
                case MAX -> Math.max(a, b);
                case EQ -> a == b ? 1 : 0;
                case NE -> a != b ? 1 : 0;
                case LT -> a < b ? 1 : 0;
                case LE -> a <= b ? 1 : 0;
                case GT -> a > b ? 1 : 0;
                case GE -> a >= b ? 1 : 0;
            };
        }
    }

    // ==================== Variants ====================

    /**
     * A concrete integer.
     */
    record Int(long value) implements SymExpr {
        private static final Int[] SMALL = new Int[17];

        static {
            for (int i = 0; i < SMALL.length; i++) {
                SMALL[i] = new Int(i);
            }
        }

        public static Int of(long value) {
            return value >= 0 && value < SMALL.length ? SMALL[(int) value] : new Int(value);
        }

        @Override
        public Set<Sym> freeSymbols() {
            return Set.of();
        }

        @Override
        public long evaluate(Map<Sym, Long> bindings) {
            return value;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * A named size variable, e.g. {@code s0}.
     */
    record Sym(String name) implements SymExpr {
        public Sym {
            Objects.requireNonNull(name, "name cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Symbol name cannot be blank");
            }
        }

        @Override
        public Set<Sym> freeSymbols() {
            return Set.of(this);
        }

        @Override
        public long evaluate(Map<Sym, Long> bindings) {
            Long value = bindings.get(this);
            if (value == null) {
                throw new IllegalStateException("No value bound for symbol " + name);
            }
            return value;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A binary operation on two expressions.
     */
    record Binary(Op op, SymExpr lhs, SymExpr rhs) implements SymExpr {
        public Binary {
            Objects.requireNonNull(op, "op cannot be null");
            Objects.requireNonNull(lhs, "lhs cannot be null");
            Objects.requireNonNull(rhs, "rhs cannot be null");
        }

        static SymExpr fold(Op op, SymExpr lhs, SymExpr rhs) {
            if (lhs instanceof Int a && rhs instanceof Int b) {
                return Int.of(op.apply(a.value(), b.value()));
            }
            switch (op) {
                case ADD -> {
                    if (isZero(lhs)) return rhs;
                    if (isZero(rhs)) return lhs;
                }
                case SUB -> {
                    if (isZero(rhs)) return lhs;
                    if (lhs.equals(rhs)) return Int.of(0);
                }
                case MUL -> {
                    if (isZero(lhs) || isZero(rhs)) return Int.of(0);
                    if (isOne(lhs)) return rhs;
                    if (isOne(rhs)) return lhs;
                }
                case FLOORDIV -> {
                    if (isOne(rhs)) return lhs;
                    if (lhs.equals(rhs)) return Int.of(1);
                }
                case MIN, MAX -> {
                    if (lhs.equals(rhs)) return lhs;
                }
                case EQ, LE, GE -> {
                    if (lhs.equals(rhs)) return Int.of(1);
                }
                case NE, LT, GT -> {
                    if (lhs.equals(rhs)) return Int.of(0);
                }
                default -> { }
            }
            return new Binary(op, lhs, rhs);
        }

        private static boolean isZero(SymExpr e) {
            return e instanceof Int i && i.value() == 0;
        }

        private static boolean isOne(SymExpr e) {
            return e instanceof Int i && i.value() == 1;
        }

        @Override
        public Set<Sym> freeSymbols() {
            Set<Sym> symbols = new LinkedHashSet<>(lhs.freeSymbols());
            symbols.addAll(rhs.freeSymbols());
            return symbols;
        }

        @Override
        public long evaluate(Map<Sym, Long> bindings) {
            return op.apply(lhs.evaluate(bindings), rhs.evaluate(bindings));
        }

        @Override
        public String toString() {
            if (op == Op.MIN || op == Op.MAX) {
                return op.symbol() + "(" + lhs + ", " + rhs + ")";
            }
            return "(" + lhs + " " + op.symbol() + " " + rhs + ")";
        }
    }
}
