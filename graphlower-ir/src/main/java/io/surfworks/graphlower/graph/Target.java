package io.surfworks.graphlower.graph;

/**
 * The callee of a {@link NodeKind#CALL_FUNCTION} node.
 *
 * <p>Implementations are value types: two targets naming the same operator are equal.
 */
public interface Target {

    /**
     * Display name, e.g. {@code aten.add.Tensor}.
     */
    String name();
}
