package io.surfworks.graphlower.ir;

import java.util.List;
import java.util.Objects;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * Memory layout of a buffer: device, dtype, symbolic sizes, strides and storage offset.
 */
public abstract class Layout {

    protected final Device device;
    protected final DType dtype;
    protected final List<SymExpr> size;
    protected final List<SymExpr> stride;
    protected final SymExpr offset;

    protected Layout(Device device, DType dtype, List<SymExpr> size, List<SymExpr> stride, SymExpr offset) {
        this.device = device;
        this.dtype = dtype;
        this.size = List.copyOf(size);
        this.stride = List.copyOf(stride);
        this.offset = Objects.requireNonNull(offset, "offset cannot be null");
        if (this.size.size() != this.stride.size()) {
            throw new IllegalArgumentException("Size and stride must have same rank: " + size + " vs " + stride);
        }
    }

    public Device device() {
        return device;
    }

    public DType dtype() {
        return dtype;
    }

    public List<SymExpr> size() {
        return size;
    }

    public List<SymExpr> stride() {
        return stride;
    }

    public SymExpr offset() {
        return offset;
    }

    /**
     * True if the strides are final and may be relied on by consumers.
     */
    public abstract boolean isFixed();

    /**
     * True when the strides are those of a row-major tensor of this size.
     */
    public boolean isContiguous() {
        return stride.equals(StrideOrder.contiguousStrides(size));
    }

    /**
     * Concrete layout with the same sizes and the current strides.
     */
    public FixedLayout asFixed() {
        return new FixedLayout(device, dtype, size, stride, offset);
    }

    @Override
    public String toString() {
        return String.format("%s('%s', %s, size=%s, stride=%s)",
                getClass().getSimpleName(), device, dtype, size, stride);
    }
}
