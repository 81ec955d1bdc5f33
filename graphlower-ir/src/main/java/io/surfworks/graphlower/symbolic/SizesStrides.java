package io.surfworks.graphlower.symbolic;

import java.util.List;

/**
 * Size and stride expressions resolved for one tensor.
 */
public record SizesStrides(List<SymExpr> sizes, List<SymExpr> strides) {

    public SizesStrides {
        sizes = List.copyOf(sizes);
        strides = List.copyOf(strides);
        if (sizes.size() != strides.size()) {
            throw new IllegalArgumentException("Sizes and strides must have same length");
        }
    }

    public int rank() {
        return sizes.size();
    }
}
