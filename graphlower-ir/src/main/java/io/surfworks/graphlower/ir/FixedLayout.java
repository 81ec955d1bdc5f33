package io.surfworks.graphlower.ir;

import java.util.List;
import java.util.Objects;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * A layout whose strides are decided.
 */
public final class FixedLayout extends Layout {

    public FixedLayout(Device device, DType dtype, List<SymExpr> size, List<SymExpr> stride, SymExpr offset) {
        super(device, dtype, size, stride, offset);
    }

    public FixedLayout(Device device, DType dtype, List<SymExpr> size, List<SymExpr> stride) {
        this(device, dtype, size, stride, SymExpr.of(0));
    }

    /**
     * Row-major layout for the given sizes.
     */
    public static FixedLayout contiguous(Device device, DType dtype, List<SymExpr> size) {
        return new FixedLayout(device, dtype, size, StrideOrder.contiguousStrides(size));
    }

    @Override
    public boolean isFixed() {
        return true;
    }

    @Override
    public FixedLayout asFixed() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FixedLayout other)) return false;
        return Objects.equals(device, other.device) && dtype == other.dtype
                && size.equals(other.size) && stride.equals(other.stride) && offset.equals(other.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(device, dtype, size, stride, offset);
    }
}
