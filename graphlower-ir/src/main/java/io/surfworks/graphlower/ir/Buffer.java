package io.surfworks.graphlower.ir;

import java.util.List;
import java.util.Objects;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * A named, concrete storage allocation.
 */
public abstract class Buffer extends IrNode {

    private String name;
    private Layout layout;

    protected Buffer(String name, Layout layout) {
        this.name = name;
        this.layout = Objects.requireNonNull(layout, "layout cannot be null");
    }

    /**
     * Buffer name; null until registered.
     */
    public String name() {
        return name;
    }

    /**
     * Assigns the name once, on registration.
     */
    public void setName(String name) {
        if (this.name != null) {
            throw new IllegalStateException("Buffer " + this.name + " is already named");
        }
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    public Layout layout() {
        return layout;
    }

    void setLayout(Layout layout) {
        this.layout = Objects.requireNonNull(layout, "layout cannot be null");
    }

    /**
     * Turns a flexible layout into a fixed one; no-op for fixed layouts.
     */
    public void decideLayout() {
        if (layout instanceof FlexibleLayout flexible) {
            layout = flexible.asFixed();
        }
    }

    /**
     * Fixes a flexible layout to the given stride order.
     *
     * @throws IllegalStateException if the layout is already fixed
     */
    public void freezeLayoutWithStrideOrder(int[] order) {
        if (!(layout instanceof FlexibleLayout flexible)) {
            throw new IllegalStateException("Layout of " + name + " is already fixed: " + layout);
        }
        layout = flexible.asStrideOrder(order);
    }

    public boolean hasFlexibleLayout() {
        return layout instanceof FlexibleLayout;
    }

    @Override
    public List<SymExpr> size() {
        return layout.size();
    }

    @Override
    public DType dtype() {
        return layout.dtype();
    }

    @Override
    public Device device() {
        return layout.device();
    }

    @Override
    public List<String> readNames() {
        return List.of(name);
    }

    @Override
    public String describe() {
        return name;
    }
}
