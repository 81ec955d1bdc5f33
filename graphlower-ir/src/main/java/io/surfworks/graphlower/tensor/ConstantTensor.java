package io.surfworks.graphlower.tensor;

import java.util.Arrays;
import java.util.Objects;

/**
 * A concrete tensor value held by the graph, typically a weight or buffer reached through
 * an attribute access.
 *
 * <p>Values are stored in logical row-major order regardless of the strides. Integer and
 * bool tensors keep exact {@code long} values; floating and complex tensors keep {@code double}s.
 */
public final class ConstantTensor {

    private final long[] shape;
    private final long[] strides;
    private final DType dtype;
    private final Device device;
    private final double[] values;
    private final long[] integers;

    private ConstantTensor(long[] shape, long[] strides, DType dtype, Device device, double[] values, long[] integers) {
        this.shape = shape;
        this.strides = strides;
        this.dtype = dtype;
        this.device = device;
        this.values = values;
        this.integers = integers;
    }

    private static boolean isIntegral(DType dtype) {
        return !dtype.isFloating() && !dtype.isComplex();
    }

    /**
     * Create a contiguous constant.
     */
    public static ConstantTensor of(DType dtype, Device device, long[] shape, double... values) {
        return withStrides(dtype, device, shape, TensorMeta.computeRowMajorStrides(shape), values);
    }

    /**
     * Create a contiguous integer or bool constant from exact values.
     */
    public static ConstantTensor ofLongs(DType dtype, Device device, long[] shape, long... values) {
        Objects.requireNonNull(dtype, "dtype cannot be null");
        if (!isIntegral(dtype)) {
            throw new IllegalArgumentException("Exact integer values need an integer dtype, got " + dtype);
        }
        long[] strides = TensorMeta.computeRowMajorStrides(shape);
        checkShape(shape, strides, values.length);
        return create(dtype, device, shape, strides, values.clone());
    }

    /**
     * Create a constant with explicit strides. Values of an integer dtype are truncated to
     * {@code long}.
     */
    public static ConstantTensor withStrides(DType dtype, Device device, long[] shape, long[] strides, double... values) {
        Objects.requireNonNull(dtype, "dtype cannot be null");
        checkShape(shape, strides, values.length);
        if (isIntegral(dtype)) {
            long[] integers = new long[values.length];
            for (int i = 0; i < values.length; i++) {
                integers[i] = (long) values[i];
            }
            return create(dtype, device, shape, strides, integers);
        }
        return new ConstantTensor(shape.clone(), strides.clone(), dtype,
                Objects.requireNonNull(device, "device cannot be null"), values.clone(), null);
    }

    /**
     * Create a zero-rank constant.
     */
    public static ConstantTensor scalar(DType dtype, Device device, double value) {
        return withStrides(dtype, device, new long[0], new long[0], value);
    }

    private static ConstantTensor create(DType dtype, Device device, long[] shape, long[] strides, long[] integers) {
        Objects.requireNonNull(device, "device cannot be null");
        double[] widened = new double[integers.length];
        for (int i = 0; i < integers.length; i++) {
            widened[i] = integers[i];
        }
        return new ConstantTensor(shape.clone(), strides.clone(), dtype, device, widened, integers);
    }

    private static void checkShape(long[] shape, long[] strides, int count) {
        if (shape.length != strides.length) {
            throw new IllegalArgumentException("Shape and strides must have same length");
        }
        long numel = 1;
        for (long d : shape) {
            numel *= d;
        }
        if (numel != count) {
            throw new IllegalArgumentException(
                "Expected " + numel + " values for shape " + Arrays.toString(shape) + ", got " + count);
        }
    }

    public long[] shape() {
        return shape.clone();
    }

    public long[] strides() {
        return strides.clone();
    }

    public DType dtype() {
        return dtype;
    }

    public Device device() {
        return device;
    }

    public int rank() {
        return shape.length;
    }

    public long numel() {
        return values.length;
    }

    /**
     * Values widened to {@code double}; exact only up to 2^53 for integer dtypes.
     */
    public double[] values() {
        return values.clone();
    }

    /**
     * Exact values of an integer or bool tensor.
     */
    public long[] longValues() {
        if (integers == null) {
            throw new IllegalStateException("longValues() needs an integer dtype, got " + dtype);
        }
        return integers.clone();
    }

    /**
     * The single value of a zero-rank tensor.
     */
    public double item() {
        if (values.length != 1) {
            throw new IllegalStateException("item() needs a single-element tensor, got " + values.length + " elements");
        }
        return values[0];
    }

    /**
     * The example metadata this value would carry in a traced graph.
     */
    public TensorMeta meta() {
        return TensorMeta.withStrides(dtype, device, shape, strides);
    }

    /**
     * Copy of this tensor on another device.
     */
    public ConstantTensor to(Device target) {
        if (device.equals(target)) {
            return this;
        }
        return new ConstantTensor(shape.clone(), strides.clone(), dtype, target, values.clone(),
                integers == null ? null : integers.clone());
    }

    /**
     * True if both tensors have the same shape, strides, dtype, device and elements.
     */
    public boolean contentEquals(ConstantTensor other) {
        return Arrays.equals(shape, other.shape)
                && Arrays.equals(strides, other.strides)
                && dtype == other.dtype
                && device.equals(other.device)
                && (integers != null
                        ? Arrays.equals(integers, other.integers)
                        : Arrays.equals(values, other.values));
    }

    /**
     * Canonical textual form; identical content always renders identically.
     */
    public String repr() {
        StringBuilder sb = new StringBuilder("tensor(");
        sb.append(Arrays.toString(shape));
        sb.append(", stride=").append(Arrays.toString(strides));
        sb.append(", dtype=").append(dtype);
        sb.append(", device=").append(device);
        sb.append(", values=[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(", ");
            if (integers != null) {
                sb.append(integers[i]);
            } else {
                sb.append(values[i]);
            }
        }
        sb.append("])");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ConstantTensor[shape=" + Arrays.toString(shape) + ", dtype=" + dtype + ", device=" + device + "]";
    }
}
