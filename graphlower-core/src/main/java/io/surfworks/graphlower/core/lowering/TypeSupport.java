package io.surfworks.graphlower.core.lowering;

import io.surfworks.graphlower.core.config.LoweringConfig;
import io.surfworks.graphlower.graph.GraphNode;
import io.surfworks.graphlower.graph.TracedGraph;
import io.surfworks.graphlower.tensor.ExampleValue;
import io.surfworks.graphlower.tensor.TensorMeta;
import io.surfworks.graphlower.tensor.TupleValue;

/**
 * Tensor types generated code cannot handle, forcing a fallback kernel.
 */
public final class TypeSupport {

    private TypeSupport() {
    }

    public static boolean unsupportedInputTensor(TensorMeta t) {
        return t.dtype().isComplex();
    }

    /**
     * Complex tensors, and CPU tensors when C++ code generation is disabled.
     */
    public static boolean unsupportedOutputTensor(TensorMeta t, LoweringConfig config) {
        return unsupportedInputTensor(t) || (t.device().isCpu() && config.disableCppCodegen());
    }

    /**
     * True if {@code node} must run as a fallback because of the types it reads or produces.
     */
    public static boolean fallbackNodeDueToUnsupportedType(GraphNode node, LoweringConfig config) {
        if (node.isCallTo(AtenOps.VIEW_AS_COMPLEX) || node.isCallTo(AtenOps.LIFT_FRESH_COPY)) {
            return false;
        }
        for (GraphNode input : TracedGraph.inputsOf(node)) {
            if (anyTensor(input.meta(), false, config)) {
                return true;
            }
        }
        return anyTensor(node.meta(), true, config);
    }

    private static boolean anyTensor(ExampleValue value, boolean output, LoweringConfig config) {
        if (value instanceof TensorMeta t) {
            return output ? unsupportedOutputTensor(t, config) : unsupportedInputTensor(t);
        }
        if (value instanceof TupleValue tuple) {
            for (ExampleValue element : tuple.elements()) {
                if (anyTensor(element, output, config)) {
                    return true;
                }
            }
        }
        return false;
    }
}
