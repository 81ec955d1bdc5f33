package io.surfworks.graphlower.ir;

import java.util.List;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * A graph output slot that returns {@code None}.
 */
public final class NoneAsConstantBuffer extends IrNode {

    @Override
    public List<SymExpr> size() {
        return List.of();
    }

    @Override
    public DType dtype() {
        return null;
    }

    @Override
    public Device device() {
        return null;
    }

    @Override
    public String describe() {
        return "None";
    }
}
