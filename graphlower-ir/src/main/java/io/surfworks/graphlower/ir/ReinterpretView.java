package io.surfworks.graphlower.ir;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * Aliases a buffer's storage under another size, stride and offset.
 */
public final class ReinterpretView extends IrNode {

    private final Buffer data;
    private final FixedLayout layout;

    public ReinterpretView(Buffer data, FixedLayout layout) {
        this.data = Objects.requireNonNull(data, "data cannot be null");
        this.layout = Objects.requireNonNull(layout, "layout cannot be null");
    }

    public Buffer data() {
        return data;
    }

    public FixedLayout layout() {
        return layout;
    }

    /**
     * Name of the aliased storage.
     */
    public String name() {
        return data.name();
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
        return List.of(data.name());
    }

    /**
     * {@code reinterpret_tensor(buf0, (4, 8), (8, 1), 0)}
     */
    @Override
    public String describe() {
        return "reinterpret_tensor(" + data.name() + ", " + tuple(layout.size()) + ", "
                + tuple(layout.stride()) + ", " + layout.offset() + ")";
    }

    private static String tuple(List<SymExpr> exprs) {
        if (exprs.size() == 1) {
            return "(" + exprs.get(0) + ",)";
        }
        return exprs.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
