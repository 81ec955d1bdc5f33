package io.surfworks.graphlower.ir;

import java.util.List;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * Elementwise computation over {@link #size()}.
 */
public final class Pointwise extends Loops {

    private Pointwise(String op, Device device, DType dtype, List<SymExpr> ranges, List<IrNode> inputs) {
        super(op, device, dtype, ranges, inputs);
    }

    public static Pointwise create(String op, Device device, DType dtype, List<SymExpr> ranges, List<IrNode> inputs) {
        return new Pointwise(op, device, dtype, ranges, inputs);
    }
}
