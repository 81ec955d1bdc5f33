package io.surfworks.graphlower.core.lowering;

import java.util.List;
import java.util.Map;

import io.surfworks.graphlower.graph.GraphNode;

/**
 * Coerces the arguments of an operator into the layouts it requires, before its lowering runs.
 */
@FunctionalInterface
public interface LayoutConstraint {

    Arguments apply(LoweringContext ctx, GraphNode node, List<Object> args, Map<String, Object> kwargs);

    /**
     * Constrained arguments.
     */
    record Arguments(List<Object> args, Map<String, Object> kwargs) {
    }
}
