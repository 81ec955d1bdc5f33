package io.surfworks.graphlower.ir;

import java.util.List;
import java.util.Objects;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * A scalar constant that is inlined wherever it is read.
 */
public final class ConstantValue extends IrNode {

    private final double value;
    private final DType dtype;
    private final Device device;

    public ConstantValue(double value, DType dtype, Device device) {
        this.value = value;
        this.dtype = Objects.requireNonNull(dtype, "dtype cannot be null");
        this.device = Objects.requireNonNull(device, "device cannot be null");
    }

    public double value() {
        return value;
    }

    @Override
    public List<SymExpr> size() {
        return List.of();
    }

    @Override
    public DType dtype() {
        return dtype;
    }

    @Override
    public Device device() {
        return device;
    }

    @Override
    public String describe() {
        if (!dtype.isFloating() && !dtype.isComplex()) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
