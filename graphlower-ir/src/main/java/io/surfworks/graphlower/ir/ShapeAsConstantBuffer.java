package io.surfworks.graphlower.ir;

import java.util.List;
import java.util.Objects;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * A graph output slot that returns a size expression.
 */
public final class ShapeAsConstantBuffer extends IrNode {

    private final SymExpr shape;

    public ShapeAsConstantBuffer(SymExpr shape) {
        this.shape = Objects.requireNonNull(shape, "shape cannot be null");
    }

    public SymExpr shape() {
        return shape;
    }

    @Override
    public List<SymExpr> size() {
        return List.of();
    }

    @Override
    public DType dtype() {
        return DType.INT64;
    }

    @Override
    public Device device() {
        return null;
    }

    @Override
    public String describe() {
        return shape.toString();
    }
}
