package io.surfworks.graphlower.core;

import io.surfworks.graphlower.core.config.RuntimeEnvironment;
import io.surfworks.graphlower.core.lowering.AtenOps;
import io.surfworks.graphlower.core.lowering.LoweringRegistry;
import io.surfworks.graphlower.graph.OpOverload;
import io.surfworks.graphlower.graph.TracedGraph;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;
import io.surfworks.graphlower.tensor.TensorMeta;

/**
 * Shared operators, example values and builder defaults for lowering tests.
 */
final class GraphFixtures {

    static final TensorMeta STATIC = TensorMeta.of(DType.FLOAT32, Device.cpu(), 4, 8);
    static final TensorMeta DYNAMIC = STATIC.asSymbolic();

    static final OpOverload ADD = OpOverload.parse("aten.add.Tensor");
    static final OpOverload RELU = OpOverload.parse("aten.relu.default");
    static final OpOverload NEG = OpOverload.parse("aten.neg.default");
    static final OpOverload MM = AtenOps.MM;

    private GraphFixtures() {
    }

    /**
     * A builder on a fresh standard registry and a CPU-only Linux host, so tests neither
     * see nor leave implicit fallbacks in the global registry.
     */
    static GraphLowering.Builder lowering(TracedGraph graph) {
        return GraphLowering.builder(graph)
                .registry(LoweringRegistry.standard())
                .environment(RuntimeEnvironment.cpuOnly());
    }

    /**
     * {@code relu(x + y)} over two inputs with the given example value.
     */
    static TracedGraph reluOfAdd(TensorMeta meta) {
        var b = TracedGraph.builder("forward");
        var x = b.placeholder("x", meta);
        var y = b.placeholder("y", meta);
        var add = b.call(ADD, meta, x, y);
        var relu = b.call(RELU, meta, add);
        b.output(relu);
        return b.build();
    }
}
