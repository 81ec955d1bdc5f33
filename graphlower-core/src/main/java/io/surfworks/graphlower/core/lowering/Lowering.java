package io.surfworks.graphlower.core.lowering;

import java.util.List;
import java.util.Map;

/**
 * Turns one operator call into IR.
 *
 * <p>Arguments arrive already lowered: tensors as {@link io.surfworks.graphlower.ir.TensorBox},
 * sizes as {@link io.surfworks.graphlower.symbolic.SymExpr}, literals unchanged and lists
 * element-wise. The result takes the same forms.
 */
@FunctionalInterface
public interface Lowering {

    Object lower(LoweringContext ctx, List<Object> args, Map<String, Object> kwargs);
}
