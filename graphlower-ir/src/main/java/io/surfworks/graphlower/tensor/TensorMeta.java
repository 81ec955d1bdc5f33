package io.surfworks.graphlower.tensor;

import java.util.Arrays;
import java.util.Objects;

/**
 * Tensor example metadata: concrete shape, strides, dtype and device of the value a
 * traced node produced.
 *
 * <p>{@code symbolic} records whether the tracer saw symbolic sizes for this tensor.
 * The concrete shape then serves as the hint for the symbols the lowering allocates.
 */
public record TensorMeta(
    long[] shape,
    long[] strides,
    DType dtype,
    Device device,
    boolean symbolic
) implements ExampleValue {

    public TensorMeta {
        Objects.requireNonNull(shape, "shape cannot be null");
        Objects.requireNonNull(strides, "strides cannot be null");
        Objects.requireNonNull(dtype, "dtype cannot be null");
        Objects.requireNonNull(device, "device cannot be null");
        if (shape.length != strides.length) {
            throw new IllegalArgumentException("Shape and strides must have same length");
        }
        for (long dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
        }
        shape = shape.clone();
        strides = strides.clone();
    }

    /**
     * Create a static TensorMeta with row-major (C-contiguous) strides.
     */
    public static TensorMeta of(DType dtype, Device device, long... shape) {
        return new TensorMeta(shape, computeRowMajorStrides(shape), dtype, device, false);
    }

    /**
     * Create a static TensorMeta with explicit strides (e.g., channels-last layout).
     */
    public static TensorMeta withStrides(DType dtype, Device device, long[] shape, long[] strides) {
        return new TensorMeta(shape, strides, dtype, device, false);
    }

    /**
     * The same tensor, marked as having symbolic sizes.
     */
    public TensorMeta asSymbolic() {
        return new TensorMeta(shape, strides, dtype, device, true);
    }

    /**
     * Number of dimensions.
     */
    public int rank() {
        return shape.length;
    }

    public long size(int dim) {
        return shape[dim < 0 ? dim + shape.length : dim];
    }

    public long stride(int dim) {
        return strides[dim < 0 ? dim + strides.length : dim];
    }

    /**
     * Total number of elements.
     */
    public long numel() {
        long count = 1;
        for (long dim : shape) {
            count *= dim;
        }
        return count;
    }

    /**
     * Check if this tensor is contiguous in memory.
     */
    public boolean isContiguous() {
        long expectedStride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            if (shape[i] != 1 && strides[i] != expectedStride) {
                return false;
            }
            expectedStride *= shape[i];
        }
        return true;
    }

    /**
     * True if the elements occupy a dense block of memory with no element stored twice,
     * in some permutation of the dimensions.
     */
    public boolean isNonOverlappingAndDense() {
        if (shape.length == 0) {
            return true;
        }
        if (shape.length == 1) {
            return shape[0] < 2 || strides[0] == 1;
        }
        Integer[] perm = new Integer[shape.length];
        for (int i = 0; i < perm.length; i++) {
            perm[i] = i;
        }
        // size-1 dims sort last so they never break the chain
        Arrays.sort(perm, (a, b) -> {
            if (shape[a] < 2) return shape[b] < 2 ? 0 : 1;
            if (shape[b] < 2) return -1;
            return Long.compare(strides[a], strides[b]);
        });
        long required = 1;
        for (int dim : perm) {
            long size = shape[dim];
            if (size < 2) {
                return true;
            }
            if (strides[dim] != required) {
                return false;
            }
            required *= size;
        }
        return true;
    }

    /**
     * Compute row-major (C-contiguous) strides for a shape.
     */
    public static long[] computeRowMajorStrides(long[] shape) {
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= Math.max(shape[i], 1);
        }
        return strides;
    }

    /**
     * Compute channels-last strides for a 4-d NCHW shape.
     */
    public static long[] computeChannelsLastStrides(long[] shape) {
        if (shape.length != 4) {
            throw new IllegalArgumentException("Channels-last layout needs a 4-d shape, got rank " + shape.length);
        }
        long c = shape[1];
        long h = shape[2];
        long w = shape[3];
        return new long[] {h * w * c, 1, w * c, c};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorMeta that)) return false;
        return Arrays.equals(shape, that.shape) &&
               Arrays.equals(strides, that.strides) &&
               dtype == that.dtype &&
               device.equals(that.device) &&
               symbolic == that.symbolic;
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(shape);
        result = 31 * result + Arrays.hashCode(strides);
        result = 31 * result + dtype.hashCode();
        result = 31 * result + device.hashCode();
        result = 31 * result + Boolean.hashCode(symbolic);
        return result;
    }

    @Override
    public String toString() {
        return "TensorMeta[shape=" + Arrays.toString(shape) +
               ", strides=" + Arrays.toString(strides) +
               ", dtype=" + dtype +
               ", device=" + device +
               (symbolic ? ", symbolic" : "") + "]";
    }
}
