package io.surfworks.graphlower.core.backend;

import java.util.List;

import io.surfworks.graphlower.core.LoweredGraph;
import io.surfworks.graphlower.ir.Buffer;

/**
 * Emits the wrapper that allocates buffers, runs kernels and returns the graph outputs.
 */
public interface WrapperCodeGen {

    GeneratedCode generate(LoweredGraph graph, List<List<Buffer>> kernels);
}
