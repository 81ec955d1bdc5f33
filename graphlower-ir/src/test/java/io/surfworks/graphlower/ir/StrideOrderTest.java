package io.surfworks.graphlower.ir;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("StrideOrder")
class StrideOrderTest {

    private static List<SymExpr> sizes(long... values) {
        return Arrays.stream(values).mapToObj(SymExpr::of).toList();
    }

    @Test
    @DisplayName("row-major strides have descending order")
    void rowMajorOrder() {
        assertArrayEquals(new int[] {3, 2, 1, 0}, StrideOrder.of(new long[] {60, 20, 5, 1}));
        assertArrayEquals(StrideOrder.contiguous(4), StrideOrder.of(new long[] {60, 20, 5, 1}));
    }

    @Test
    @DisplayName("channels-last strides map to the NHWC order")
    void channelsLastOrder() {
        // N=2, C=3, H=4, W=5
        assertArrayEquals(StrideOrder.NHWC, StrideOrder.of(new long[] {60, 1, 15, 3}));
    }

    @Test
    @DisplayName("fillOrdered lays out the innermost dimension first")
    void fillOrdered() {
        assertEquals(sizes(60, 1, 15, 3), StrideOrder.fillOrdered(sizes(2, 3, 4, 5), StrideOrder.NHWC));
        assertEquals(sizes(20, 5, 1), StrideOrder.contiguousStrides(sizes(3, 4, 5)));
    }

    @Test
    @DisplayName("fillOrdered builds symbolic products")
    void fillOrderedSymbolic() {
        SymExpr s0 = SymExpr.symbol("s0");
        SymExpr s1 = SymExpr.symbol("s1");
        assertEquals(List.of(s1, SymExpr.of(1)), StrideOrder.contiguousStrides(List.of(s0, s1)));
    }

    @Test
    @DisplayName("rejects orders that are not permutations")
    void rejectsNonPermutation() {
        assertThrows(IllegalArgumentException.class, () -> StrideOrder.fillOrdered(sizes(2, 3), new int[] {0, 0}));
        assertThrows(IllegalArgumentException.class, () -> StrideOrder.fillOrdered(sizes(2, 3), new int[] {0}));
    }

    @Test
    @DisplayName("matches ignores extent-1 dimensions")
    void matchesIgnoresUnitDims() {
        FixedLayout layout = new FixedLayout(Device.cpu(), DType.FLOAT32, sizes(1, 3, 4, 5), sizes(1, 1, 15, 3));
        assertTrue(StrideOrder.matches(layout, StrideOrder.NHWC, e -> e.evaluate(Map.of())));
        assertFalse(StrideOrder.matches(layout, StrideOrder.contiguous(4), e -> e.evaluate(Map.of())));
    }
}
