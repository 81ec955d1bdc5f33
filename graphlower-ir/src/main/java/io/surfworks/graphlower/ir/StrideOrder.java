package io.surfworks.graphlower.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.ToLongFunction;

import io.surfworks.graphlower.symbolic.SymExpr;

/**
 * Stride orders: for each dimension, its rank when dimensions are sorted by stride,
 * 0 being the innermost (smallest stride).
 *
 * <p>A row-major 4-D tensor has order {@code [3, 2, 1, 0]}; channels-last (NHWC) has
 * {@link #NHWC} = {@code [3, 0, 2, 1]}.
 */
public final class StrideOrder {

    public static final int[] NHWC = {3, 0, 2, 1};

    private StrideOrder() {
    }

    /**
     * Stride order of concrete strides. Equal strides keep dimension order.
     */
    public static int[] of(long[] strides) {
        Integer[] sorted = new Integer[strides.length];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = i;
        }
        Arrays.sort(sorted, (a, b) -> Long.compare(strides[a], strides[b]));
        int[] order = new int[strides.length];
        for (int rank = 0; rank < sorted.length; rank++) {
            order[sorted[rank]] = rank;
        }
        return order;
    }

    /**
     * Stride order of symbolic strides, compared at their hinted values.
     */
    public static int[] of(List<SymExpr> strides, ToLongFunction<SymExpr> hint) {
        long[] hinted = new long[strides.size()];
        for (int i = 0; i < hinted.length; i++) {
            hinted[i] = hint.applyAsLong(strides.get(i));
        }
        return of(hinted);
    }

    /**
     * Row-major order for the given rank.
     */
    public static int[] contiguous(int rank) {
        int[] order = new int[rank];
        for (int i = 0; i < rank; i++) {
            order[i] = rank - 1 - i;
        }
        return order;
    }

    public static List<SymExpr> contiguousStrides(List<SymExpr> sizes) {
        return fillOrdered(sizes, contiguous(sizes.size()));
    }

    /**
     * Dense strides laying dimensions out innermost-first according to {@code order}.
     */
    public static List<SymExpr> fillOrdered(List<SymExpr> sizes, int[] order) {
        if (order.length != sizes.size()) {
            throw new IllegalArgumentException("Stride order " + Arrays.toString(order)
                    + " does not match rank " + sizes.size());
        }
        int[] fillOrder = new int[order.length];
        Arrays.fill(fillOrder, -1);
        for (int dim = 0; dim < order.length; dim++) {
            int rank = order[dim];
            if (rank < 0 || rank >= order.length || fillOrder[rank] != -1) {
                throw new IllegalArgumentException("Not a permutation: " + Arrays.toString(order));
            }
            fillOrder[rank] = dim;
        }
        SymExpr[] strides = new SymExpr[sizes.size()];
        SymExpr next = SymExpr.of(1);
        for (int dim : fillOrder) {
            strides[dim] = next;
            next = next.times(sizes.get(dim));
        }
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(strides)));
    }

    /**
     * True if {@code layout}'s strides follow {@code order}. Dimensions of extent 1 are
     * ignored since their stride is arbitrary.
     */
    public static boolean matches(Layout layout, int[] order, ToLongFunction<SymExpr> hint) {
        if (layout.size().size() != order.length) {
            return false;
        }
        List<Integer> dims = new ArrayList<>();
        for (int d = 0; d < order.length; d++) {
            if (hint.applyAsLong(layout.size().get(d)) != 1) {
                dims.add(d);
            }
        }
        dims.sort((a, b) -> Integer.compare(order[a], order[b]));
        long previous = -1;
        for (int d : dims) {
            long stride = hint.applyAsLong(layout.stride().get(d));
            if (stride < previous) {
                return false;
            }
            previous = stride;
        }
        return true;
    }
}
