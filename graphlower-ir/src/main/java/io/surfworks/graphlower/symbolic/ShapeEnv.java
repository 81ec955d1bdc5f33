package io.surfworks.graphlower.symbolic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.surfworks.graphlower.tensor.TensorMeta;

/**
 * Shape-tracking context that allocates size symbols for dynamic tensors.
 *
 * <p>Symbols are duck-shaped: a dimension whose concrete value was seen before is assigned
 * the symbol allocated for that value, so two tensors observed with equal extents share
 * their size variables. Extents 0 and 1 are specialized to constants.
 *
 * <p>A ShapeEnv may be shared between several graph lowerings to carry symbol identity
 * across graphs. Symbol allocation is synchronized on the instance so that lowerings
 * sharing one context serialize their allocations.
 *
 * <p>Example:
 * <pre>{@code
 * ShapeEnv env = new ShapeEnv();
 * SizesStrides a = env.createSymbolicSizesStrides(metaOf(4, 8), "a");
 * SizesStrides b = env.createSymbolicSizesStrides(metaOf(4, 8), "b");
 * assert a.sizes().equals(b.sizes());   // [s0, s1]
 * }</pre>
 */
public final class ShapeEnv {

    private final Map<Long, SymExpr.Sym> valToSymbol = new HashMap<>();
    private final Map<SymExpr.Sym, Long> varToVal = new LinkedHashMap<>();
    private final Map<SymExpr.Sym, String> symbolSources = new HashMap<>();
    private final boolean duckShape;

    public ShapeEnv() {
        this(true);
    }

    /**
     * @param duckShape whether equal extents share one symbol
     */
    public ShapeEnv(boolean duckShape) {
        this.duckShape = duckShape;
    }

    /**
     * Allocate (or reuse) the symbol for a concrete extent.
     *
     * @param value  the observed extent
     * @param source provenance of the dimension, kept for diagnostics
     * @return a constant for 0 and 1, otherwise a symbol
     */
    public synchronized SymExpr createSymbol(long value, String source) {
        if (value < 0) {
            throw new IllegalArgumentException("Cannot allocate a size symbol for negative value " + value);
        }
        if (value == 0 || value == 1) {
            return SymExpr.of(value);
        }
        if (duckShape) {
            SymExpr.Sym existing = valToSymbol.get(value);
            if (existing != null) {
                return existing;
            }
        }
        SymExpr.Sym sym = SymExpr.symbol("s" + varToVal.size());
        varToVal.put(sym, value);
        symbolSources.put(sym, source);
        valToSymbol.putIfAbsent(value, sym);
        return sym;
    }

    /**
     * Resolve symbolic sizes and strides for an example tensor.
     *
     * <p>Strides are expressed through already-resolved sizes wherever the layout allows it
     * (e.g. a contiguous {@code (4, 8)} tensor gets strides {@code [s1, 1]}); strides that
     * cannot be derived get their own duck-shaped symbol.
     *
     * @param example the concrete example tensor
     * @param source  provenance prefix for new symbols
     */
    public synchronized SizesStrides createSymbolicSizesStrides(TensorMeta example, String source) {
        long[] shape = example.shape();
        long[] strides = example.strides();
        int rank = shape.length;

        List<SymExpr> sizes = new ArrayList<>(rank);
        for (int i = 0; i < rank; i++) {
            sizes.add(createSymbol(shape[i], source + ".size()[" + i + "]"));
        }

        Integer[] order = new Integer[rank];
        for (int i = 0; i < rank; i++) {
            order[i] = i;
        }
        // innermost first; ties broken toward later dims
        Arrays.sort(order, (a, b) -> strides[a] != strides[b]
                ? Long.compare(strides[a], strides[b])
                : Integer.compare(b, a));

        Map<Long, SymExpr> candidates = new HashMap<>();
        candidates.put(1L, SymExpr.of(1));
        SymExpr[] strideExprs = new SymExpr[rank];
        for (int dim : order) {
            long stride = strides[dim];
            SymExpr expr;
            if (stride == 0) {
                expr = SymExpr.of(0);
            } else if (candidates.containsKey(stride)) {
                expr = candidates.get(stride);
            } else {
                expr = createSymbol(stride, source + ".stride()[" + dim + "]");
            }
            strideExprs[dim] = expr;
            candidates.putIfAbsent(stride * shape[dim], expr.times(sizes.get(dim)));
        }
        return new SizesStrides(sizes, Arrays.asList(strideExprs));
    }

    /**
     * The expression standing for a concrete extent: the duck-shaped symbol when one was
     * allocated for that value, otherwise the constant itself.
     */
    public synchronized SymExpr exprFor(long value) {
        if (value == 0 || value == 1) {
            return SymExpr.of(value);
        }
        SymExpr.Sym sym = valToSymbol.get(value);
        return sym != null ? sym : SymExpr.of(value);
    }

    /**
     * Evaluate an expression at the example values of its symbols.
     */
    public synchronized long sizeHint(SymExpr expr) {
        return expr.evaluate(varToVal);
    }

    /**
     * The example value a symbol was allocated for.
     */
    public synchronized Optional<Long> valueOf(SymExpr.Sym symbol) {
        return Optional.ofNullable(varToVal.get(symbol));
    }

    /**
     * Provenance recorded when the symbol was allocated.
     */
    public synchronized Optional<String> sourceOf(SymExpr.Sym symbol) {
        return Optional.ofNullable(symbolSources.get(symbol));
    }

    /**
     * Number of symbols allocated so far.
     */
    public synchronized int symbolCount() {
        return varToVal.size();
    }

    /**
     * Snapshot of all symbol bindings in allocation order.
     */
    public synchronized Map<SymExpr.Sym, Long> bindings() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(varToVal));
    }

    @Override
    public synchronized String toString() {
        return String.format("ShapeEnv[symbols=%d, duckShape=%s]", varToVal.size(), duckShape);
    }
}
