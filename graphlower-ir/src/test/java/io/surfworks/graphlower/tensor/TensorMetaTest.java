package io.surfworks.graphlower.tensor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TensorMeta")
class TensorMetaTest {

    @Nested
    @DisplayName("Layout queries")
    class LayoutQueries {

        @Test
        @DisplayName("row-major strides are contiguous and dense")
        void rowMajor() {
            TensorMeta m = TensorMeta.of(DType.FLOAT32, Device.cpu(), 2, 3, 4);
            assertArrayEquals(new long[] {12, 4, 1}, m.strides());
            assertTrue(m.isContiguous());
            assertTrue(m.isNonOverlappingAndDense());
            assertEquals(24, m.numel());
        }

        @Test
        @DisplayName("channels-last is dense but not contiguous")
        void channelsLast() {
            long[] shape = {2, 3, 4, 5};
            TensorMeta m = TensorMeta.withStrides(DType.FLOAT32, Device.cpu(), shape,
                    TensorMeta.computeChannelsLastStrides(shape));
            assertFalse(m.isContiguous());
            assertTrue(m.isNonOverlappingAndDense());
        }

        @Test
        @DisplayName("broadcast (stride 0) views overlap")
        void broadcastOverlaps() {
            TensorMeta m = TensorMeta.withStrides(DType.FLOAT32, Device.cpu(), new long[] {4, 8}, new long[] {0, 1});
            assertFalse(m.isNonOverlappingAndDense());
        }

        @Test
        @DisplayName("negative dims index from the end")
        void negativeDims() {
            TensorMeta m = TensorMeta.of(DType.FLOAT32, Device.cpu(), 2, 3);
            assertEquals(3, m.size(-1));
            assertEquals(1, m.stride(-1));
        }
    }

    @Test
    @DisplayName("equality compares array contents")
    void arrayAwareEquality() {
        TensorMeta a = TensorMeta.of(DType.FLOAT32, Device.cpu(), 2, 3);
        TensorMeta b = TensorMeta.of(DType.FLOAT32, Device.cpu(), 2, 3);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, a.asSymbolic());
    }

    @Test
    @DisplayName("rejects mismatched shape and strides")
    void mismatchedRank() {
        assertThrows(IllegalArgumentException.class,
                () -> TensorMeta.withStrides(DType.FLOAT32, Device.cpu(), new long[] {2, 3}, new long[] {1}));
    }

    @Test
    @DisplayName("constant repr is canonical for equal content")
    void constantRepr() {
        ConstantTensor a = ConstantTensor.of(DType.INT64, Device.cpu(), new long[] {2}, 1, 2);
        ConstantTensor b = ConstantTensor.of(DType.INT64, Device.cpu(), new long[] {2}, 1, 2);
        assertEquals(a.repr(), b.repr());
        assertEquals("tensor([2], stride=[1], dtype=int64, device=cpu, values=[1, 2])", a.repr());
        assertTrue(a.contentEquals(b));
        assertFalse(a.contentEquals(a.to(Device.cuda(0))));
    }

    @Test
    @DisplayName("integer constants keep exact values")
    void exactIntegers() {
        long big = (1L << 53) + 1;
        ConstantTensor a = ConstantTensor.ofLongs(DType.INT64, Device.cpu(), new long[] {1}, big);
        ConstantTensor b = ConstantTensor.ofLongs(DType.INT64, Device.cpu(), new long[] {1}, big - 1);

        assertArrayEquals(new long[] {big}, a.longValues());
        assertFalse(a.contentEquals(b));
        assertEquals("tensor([1], stride=[1], dtype=int64, device=cpu, values=[9007199254740993])", a.repr());
        assertArrayEquals(new long[] {3, -2}, ConstantTensor.of(DType.INT32, Device.cpu(), new long[] {2}, 3, -2).longValues());
        assertThrows(IllegalArgumentException.class,
                () -> ConstantTensor.ofLongs(DType.FLOAT32, Device.cpu(), new long[] {1}, 1));
        assertThrows(IllegalStateException.class,
                () -> ConstantTensor.of(DType.FLOAT32, Device.cpu(), new long[] {1}, 1).longValues());
    }

    @Test
    @DisplayName("dtype promotion prefers the wider category")
    void promotion() {
        assertEquals(DType.FLOAT32, DType.promote(DType.INT64, DType.FLOAT32));
        assertEquals(DType.FLOAT64, DType.promote(DType.FLOAT32, DType.FLOAT64));
        assertEquals(DType.INT32, DType.promote(DType.BOOL, DType.INT32));
    }

    @Test
    @DisplayName("dtype names accept long, short and torch-qualified spellings")
    void dtypeNames() {
        assertEquals(DType.FLOAT32, DType.fromName("float32"));
        assertEquals(DType.BFLOAT16, DType.fromName("bf16"));
        assertEquals(DType.INT64, DType.fromName("torch.long"));
        assertThrows(IllegalArgumentException.class, () -> DType.fromName("float8"));
    }
}
