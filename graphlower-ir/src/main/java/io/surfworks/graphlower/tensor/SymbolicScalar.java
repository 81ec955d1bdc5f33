package io.surfworks.graphlower.tensor;

import java.util.Objects;

import io.surfworks.graphlower.symbolic.SymExpr;

/**
 * A symbolic integer observed while tracing, e.g. the result of a size query on a dynamic tensor.
 */
public record SymbolicScalar(SymExpr expr) implements ExampleValue {

    public SymbolicScalar {
        Objects.requireNonNull(expr, "expr cannot be null");
    }
}
