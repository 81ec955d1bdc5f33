package io.surfworks.graphlower.ir;

import java.util.List;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.Device;

/**
 * Layout of a kernel that produces several outputs; its buffer holds no data itself.
 */
public final class MultiOutputLayout extends Layout {

    public MultiOutputLayout(Device device) {
        super(device, null, List.of(), List.of(), SymExpr.of(0));
    }

    @Override
    public boolean isFixed() {
        return true;
    }

    @Override
    public String toString() {
        return "MultiOutputLayout('" + device + "')";
    }
}
