package io.surfworks.graphlower.ir;

import java.util.List;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * A layout whose strides may still change. The provisional strides are row-major until
 * the buffer is frozen to a stride order or finalized.
 */
public final class FlexibleLayout extends Layout {

    public FlexibleLayout(Device device, DType dtype, List<SymExpr> size) {
        super(device, dtype, size, StrideOrder.contiguousStrides(size), SymExpr.of(0));
    }

    @Override
    public boolean isFixed() {
        return false;
    }

    /**
     * Fixed layout with strides filled in the given stride order.
     */
    public FixedLayout asStrideOrder(int[] order) {
        return new FixedLayout(device, dtype, size, StrideOrder.fillOrdered(size, order), offset);
    }
}
