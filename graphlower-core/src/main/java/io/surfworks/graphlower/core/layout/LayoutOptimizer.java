package io.surfworks.graphlower.core.layout;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.graphlower.core.config.LoweringConfig;
import io.surfworks.graphlower.core.config.RuntimeEnvironment;
import io.surfworks.graphlower.core.lowering.AtenOps;
import io.surfworks.graphlower.graph.GraphNode;
import io.surfworks.graphlower.graph.NodeKind;
import io.surfworks.graphlower.graph.TracedGraph;
import io.surfworks.graphlower.tensor.TensorMeta;

/**
 * Decides whether a graph is lowered with channels-last convolutions, and which nodes
 * should then prefer the channels-last stride order.
 *
 * <p>Example:
 * <pre>{@code
 * LayoutOptimizer optimizer = new LayoutOptimizer(config, RuntimeEnvironment.detect());
 * if (optimizer.decideLayoutOpt(graph)) {
 *     Set<GraphNode> preferred = LayoutOptimizer.findNodesPreferChannelsLast(graph);
 * }
 * }</pre>
 */
public final class LayoutOptimizer {

    private static final Logger LOG = Logger.getLogger(LayoutOptimizer.class.getName());

    private final LoweringConfig config;
    private final RuntimeEnvironment environment;

    public LayoutOptimizer(LoweringConfig config, RuntimeEnvironment environment) {
        this.config = config;
        this.environment = environment;
    }

    /**
     * Evaluates the layout heuristics for {@code graph}. The first rule that rejects
     * the graph decides; a graph passing every rule is optimized.
     */
    public boolean decideLayoutOpt(TracedGraph graph) {
        if (!config.layoutOptimization()) {
            return false;
        }

        List<GraphNode> convs = graph.findCalls(AtenOps.CONVOLUTION);
        int nconv = convs.size();
        if (nconv == 0) {
            return false;
        }

        if (environment.rocm() && environment.gpuAvailable()) {
            LOG.fine("Skip layout optimization on ROCm");
            return false;
        }

        if (environment.mkldnnUsable() && convs.stream().allMatch(LayoutOptimizer::operandsOnCpu)) {
            return true;
        }

        if (graph.nodes().size() >= (long) config.layoutOptNodeRatio() * nconv) {
            LOG.fine("Only a few conv, skip layout optimization");
            return false;
        }

        if (convs.stream().anyMatch(LayoutOptimizer::hasDynamicOperands)) {
            LOG.fine("See perf regression with dynamic shape, skip layout optimization");
            return false;
        }

        if (convs.stream().anyMatch(LayoutOptimizer::isGrouped)) {
            LOG.fine("Skip layout opt because found grouped convolution with >1 in_channels");
            return false;
        }

        if (convs.stream().anyMatch(LayoutOptimizer::isInOutChannel)) {
            LOG.fine("Skip layout opt because some convolutions have smaller out_channel");
            return false;
        }

        if (convs.stream().allMatch(this::isSmallChannel)) {
            LOG.fine("Skip layout opt because all convolution channels are too small");
            return false;
        }

        for (GraphNode node : graph.nodes()) {
            if (node.kind() == NodeKind.CALL_FUNCTION && AtenOps.LAYOUT_SENSITIVE_ATTENTION.contains(node.target())) {
                LOG.fine("Skip layout opt because the graph has attention");
                return false;
            }
        }
        return true;
    }

    /**
     * Nodes that should produce channels-last outputs: every convolution, every node whose
     * value eventually feeds a convolution, and every direct user of those.
     *
     * <p>The backward pass collects convolutions and their producers; the forward pass then
     * adds the users of everything collected, so that pointwise nodes between two
     * convolutions keep the layout.
     */
    public static Set<GraphNode> findNodesPreferChannelsLast(TracedGraph graph) {
        Set<GraphNode> output = new LinkedHashSet<>();
        List<GraphNode> nodes = graph.nodes();
        for (int i = nodes.size() - 1; i >= 0; i--) {
            GraphNode node = nodes.get(i);
            if (node.isCallTo(AtenOps.CONVOLUTION)) {
                output.add(node);
                continue;
            }
            for (GraphNode user : node.users()) {
                if (output.contains(user)) {
                    output.add(node);
                    break;
                }
            }
        }

        for (GraphNode node : nodes) {
            if (output.contains(node)) {
                output.addAll(node.users());
            }
        }
        return output;
    }

    // ==================== Convolution predicates ====================

    private static TensorMeta operandMeta(GraphNode conv, int index) {
        if (conv.args().size() > index && conv.args().get(index) instanceof GraphNode n
                && n.meta() instanceof TensorMeta meta) {
            return meta;
        }
        return null;
    }

    private static boolean operandsOnCpu(GraphNode conv) {
        for (int idx = 0; idx < 2; idx++) {
            TensorMeta meta = operandMeta(conv, idx);
            if (meta == null || !meta.device().isCpu()) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasDynamicOperands(GraphNode conv) {
        for (int idx = 0; idx < 2; idx++) {
            TensorMeta meta = operandMeta(conv, idx);
            if (meta != null && meta.symbolic()) {
                return true;
            }
        }
        return false;
    }

    private static long groups(GraphNode conv) {
        List<Object> args = conv.args();
        if (args.size() > 8 && args.get(8) instanceof Number n) {
            return n.longValue();
        }
        return 1;
    }

    private static boolean isGrouped(GraphNode conv) {
        TensorMeta weight = operandMeta(conv, 1);
        return groups(conv) > 1 && weight != null && weight.rank() > 1 && weight.size(1) > 1;
    }

    private static boolean isInOutChannel(GraphNode conv) {
        TensorMeta weight = operandMeta(conv, 1);
        return weight != null && weight.rank() > 2
                && weight.size(0) * 2 <= weight.size(1) && weight.size(2) > 1;
    }

    private boolean isSmallChannel(GraphNode conv) {
        TensorMeta weight = operandMeta(conv, 1);
        return weight != null && weight.rank() > 1
                && weight.size(0) <= config.layoutOptSmallChannels()
                && weight.size(1) <= config.layoutOptSmallChannels();
    }
}
