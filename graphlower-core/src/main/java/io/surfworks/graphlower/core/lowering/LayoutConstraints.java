package io.surfworks.graphlower.core.lowering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.graphlower.graph.GraphNode;
import io.surfworks.graphlower.ir.ExternKernel;
import io.surfworks.graphlower.ir.StrideOrder;
import io.surfworks.graphlower.ir.TensorBox;
import io.surfworks.graphlower.tensor.TensorMeta;

/**
 * Standard {@link LayoutConstraint}s.
 */
public final class LayoutConstraints {

    private LayoutConstraints() {
    }

    /**
     * Every tensor argument becomes contiguous.
     */
    public static LayoutConstraint requireContiguous() {
        return (ctx, node, args, kwargs) -> {
            List<Object> newArgs = new ArrayList<>(args.size());
            for (Object arg : args) {
                newArgs.add(arg instanceof TensorBox box ? ExternKernel.requireContiguous(box, ctx) : arg);
            }
            Map<String, Object> newKwargs = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : kwargs.entrySet()) {
                Object v = e.getValue();
                newKwargs.put(e.getKey(), v instanceof TensorBox box ? ExternKernel.requireContiguous(box, ctx) : v);
            }
            return new LayoutConstraint.Arguments(newArgs, newKwargs);
        };
    }

    /**
     * Every tensor argument takes the stride order its traced example value had.
     */
    public static LayoutConstraint constrainToFxStrides() {
        return (ctx, node, args, kwargs) -> {
            List<Object> newArgs = new ArrayList<>(args.size());
            for (int i = 0; i < args.size(); i++) {
                Object source = i < node.args().size() ? node.args().get(i) : null;
                newArgs.add(constrain(ctx, args.get(i), source));
            }
            Map<String, Object> newKwargs = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : kwargs.entrySet()) {
                newKwargs.put(e.getKey(), constrain(ctx, e.getValue(), node.kwargs().get(e.getKey())));
            }
            return new LayoutConstraint.Arguments(newArgs, newKwargs);
        };
    }

    private static Object constrain(LoweringContext ctx, Object arg, Object source) {
        if (arg instanceof TensorBox box && source instanceof GraphNode n && n.meta() instanceof TensorMeta meta) {
            return ExternKernel.requireStrideOrder(box, StrideOrder.of(meta.strides()), ctx);
        }
        return arg;
    }
}
