package io.surfworks.graphlower.ir;

import java.util.List;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * Reduction of its input over {@link #reductionRanges()}, producing {@link #size()}.
 */
public final class Reduction extends Loops {

    private final List<SymExpr> reductionRanges;

    private Reduction(String reductionType, Device device, DType dtype, List<SymExpr> ranges,
                      List<SymExpr> reductionRanges, List<IrNode> inputs) {
        super(reductionType, device, dtype, ranges, inputs);
        this.reductionRanges = List.copyOf(reductionRanges);
    }

    /**
     * @param reductionType {@code sum}, {@code amax}, {@code mean}, ...
     */
    public static Reduction create(String reductionType, Device device, DType dtype, List<SymExpr> ranges,
                                   List<SymExpr> reductionRanges, IrNode input) {
        return new Reduction(reductionType, device, dtype, ranges, reductionRanges, List.of(input));
    }

    public List<SymExpr> reductionRanges() {
        return reductionRanges;
    }

    @Override
    public String describe() {
        return super.describe() + " over " + reductionRanges;
    }
}
