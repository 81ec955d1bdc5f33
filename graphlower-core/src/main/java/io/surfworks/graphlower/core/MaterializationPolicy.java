package io.surfworks.graphlower.core;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.surfworks.graphlower.core.config.RuntimeEnvironment;
import io.surfworks.graphlower.core.lowering.AtenOps;
import io.surfworks.graphlower.core.lowering.LoweringContext;
import io.surfworks.graphlower.core.lowering.LoweringRegistry;
import io.surfworks.graphlower.graph.GraphNode;
import io.surfworks.graphlower.graph.NodeKind;
import io.surfworks.graphlower.graph.Target;
import io.surfworks.graphlower.ir.Buffer;
import io.surfworks.graphlower.ir.ComputedBuffer;
import io.surfworks.graphlower.ir.ExternKernel;
import io.surfworks.graphlower.ir.IrNode;
import io.surfworks.graphlower.ir.Loops;
import io.surfworks.graphlower.ir.MultiOutput;
import io.surfworks.graphlower.ir.Pointwise;
import io.surfworks.graphlower.ir.Reduction;
import io.surfworks.graphlower.ir.StorageBox;
import io.surfworks.graphlower.ir.StrideOrder;
import io.surfworks.graphlower.ir.TensorBox;
import io.surfworks.graphlower.tensor.TensorMeta;

/**
 * Decides, after a node is lowered, whether its value keeps its lazy form or is written to
 * a buffer, and which stride order that buffer gets.
 */
final class MaterializationPolicy {

    static final Set<Target> AS_STRIDED_OPS = Set.of(
            AtenOps.AS_STRIDED, AtenOps.AS_STRIDED_, AtenOps.AS_STRIDED_SCATTER);

    private final LoweringContext ctx;
    private final LoweringRegistry registry;
    private final Set<GraphNode> nodesPreferChannelsLast;
    private final Set<String> userVisibleOutputs;
    private final Set<Target> needFixedLayout;

    MaterializationPolicy(LoweringContext ctx, LoweringRegistry registry, boolean layoutOpt,
                          RuntimeEnvironment environment, Set<GraphNode> nodesPreferChannelsLast,
                          Set<String> userVisibleOutputs) {
        this.ctx = ctx;
        this.registry = registry;
        this.nodesPreferChannelsLast = nodesPreferChannelsLast;
        this.userVisibleOutputs = userVisibleOutputs;
        this.needFixedLayout = needFixedLayout(layoutOpt, environment);
    }

    /**
     * Consumers that read their inputs with a fixed layout. Convolution joins only when it
     * is not already choosing its own layout.
     */
    static Set<Target> needFixedLayout(boolean layoutOpt, RuntimeEnvironment environment) {
        Set<Target> targets = new HashSet<>(List.of(AtenOps.CONVOLUTION_BACKWARD, AtenOps.MM, AtenOps.INT_MM));
        if (!layoutOpt) {
            targets.add(AtenOps.CONVOLUTION);
        }
        if (environment.mkldnnAvailable()) {
            targets.addAll(AtenOps.MKLDNN_FIXED_LAYOUT);
        }
        if (environment.mklAvailable()) {
            targets.add(AtenOps.MKL_LINEAR);
        }
        return targets;
    }

    /**
     * Applies stride-order enforcement and eager realization to a freshly lowered value.
     *
     * @return the value to bind to {@code node}, possibly a new box over a relaid copy
     */
    Object apply(GraphNode node, Object result) {
        boolean isOutput = node.feedsOutput();
        boolean isInputForAsStrided = false;
        for (GraphNode user : node.users()) {
            if (user.target() != null && AS_STRIDED_OPS.contains(user.target())) {
                isInputForAsStrided = true;
                break;
            }
        }

        if ((isOutput || isInputForAsStrided) && result instanceof TensorBox box
                && node.meta() instanceof TensorMeta meta
                && meta.rank() > 0 && meta.isNonOverlappingAndDense()) {
            int[] order = StrideOrder.of(meta.strides());
            if (box.rank() == 4 && nodesPreferChannelsLast.contains(node)
                    && !userVisibleOutputs.contains(node.name()) && !isInputForAsStrided) {
                order = StrideOrder.NHWC;
            }
            result = ExternKernel.requireStrideOrder(box, order, ctx);
        }

        int numUsers = node.users().size();
        if (numUsers > 1 && result instanceof TensorBox box) {
            for (GraphNode user : node.users()) {
                Target target = user.target();
                if (target != null && registry.needsRealizedInputs(target)) {
                    box.storage().realizeHint();
                    if (needFixedLayout.contains(target) && node.meta() instanceof TensorMeta meta) {
                        box = ExternKernel.requireStrideOrder(box, StrideOrder.of(meta.strides()), ctx);
                    }
                }
                if (user.kind() == NodeKind.OUTPUT) {
                    IrNode data = box.storage().data();
                    if (data instanceof Pointwise || data instanceof Reduction) {
                        box.realize();
                    }
                }
            }
            box.storage().markReuse(numUsers);
            result = box;
        }

        if (result instanceof TensorBox box && box.storage().hasExceededMaxReads()) {
            box.storage().realizeHint();
        }
        return result;
    }

    /**
     * Records {@code node} as the origin of the value it lowered to and of the expression
     * or buffer directly underneath. Diagnostics only.
     */
    static void tagOrigin(GraphNode node, Object result) {
        if (!(result instanceof TensorBox box)) {
            return;
        }
        StorageBox storage = box.storage();
        IrNode data = storage.data();
        if (data instanceof Loops loops) {
            loops.setOriginNode(node);
        } else if (data instanceof Buffer buffer) {
            if (buffer.originNode() == null) {
                buffer.setOriginNode(node);
            }
            if (buffer instanceof ComputedBuffer computed) {
                computed.data().setOriginNode(node);
            } else if (buffer instanceof MultiOutput output && output.parent().originNode() == null) {
                output.parent().setOriginNode(node);
            }
        }
    }

    /**
     * Origins of the lazy pointwise arguments of a call, which the lowered value inherits.
     */
    static Set<GraphNode> gatherOrigins(List<Object> args, Iterable<Object> kwargValues) {
        Set<GraphNode> origins = new LinkedHashSet<>();
        for (Object arg : args) {
            addUnrealizedOrigins(arg, origins);
        }
        for (Object arg : kwargValues) {
            addUnrealizedOrigins(arg, origins);
        }
        return origins;
    }

    private static void addUnrealizedOrigins(Object arg, Set<GraphNode> origins) {
        if (arg instanceof TensorBox box && box.storage().data() instanceof Pointwise pointwise) {
            origins.addAll(pointwise.origins());
        }
    }
}
