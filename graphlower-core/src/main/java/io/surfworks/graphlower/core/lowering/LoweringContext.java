package io.surfworks.graphlower.core.lowering;

import io.surfworks.graphlower.core.config.LoweringConfig;
import io.surfworks.graphlower.graph.GraphNode;
import io.surfworks.graphlower.ir.BufferRegistry;
import io.surfworks.graphlower.ir.ExternKernelNode;
import io.surfworks.graphlower.ir.FixedLayout;
import io.surfworks.graphlower.symbolic.ShapeEnv;
import io.surfworks.graphlower.tensor.TensorMeta;

/**
 * What a {@link Lowering} may see of the graph being lowered.
 */
public interface LoweringContext extends BufferRegistry {

    /**
     * The node being lowered; its example value describes the expected result.
     */
    GraphNode currentNode();

    LoweringConfig config();

    ShapeEnv shapeEnv();

    /**
     * True if channels-last layout optimization is active for this graph.
     */
    boolean layoutOpt();

    /**
     * Logs a performance hint the first time a fallback kernel for {@code name} is used.
     */
    void warnFallback(String name);

    void recordExternKernel(ExternKernelNode node);

    /**
     * Counts a convolution lowered with a channels-last output.
     */
    void noteChannelsLastConv();

    /**
     * Layout of an example tensor, using the size symbols already allocated for its extents.
     */
    FixedLayout layoutFromMeta(TensorMeta meta);
}
