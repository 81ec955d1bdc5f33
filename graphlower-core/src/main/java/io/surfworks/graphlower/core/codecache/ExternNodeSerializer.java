package io.surfworks.graphlower.core.codecache;

import java.util.List;

import io.surfworks.graphlower.ir.ExternKernelNode;

/**
 * Serializes the extern kernel calls of a graph for ahead-of-time compiled artifacts.
 */
@FunctionalInterface
public interface ExternNodeSerializer {

    String serialize(List<ExternKernelNode> nodes);
}
