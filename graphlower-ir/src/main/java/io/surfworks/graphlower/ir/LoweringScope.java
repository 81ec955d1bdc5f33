package io.surfworks.graphlower.ir;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import io.surfworks.graphlower.graph.GraphNode;

/**
 * Thread-local record of the graph node currently being lowered.
 *
 * <p>IR nodes created while a scope is open capture its origins, so that generated code
 * can later be traced back to the graph node that produced it. Scopes nest and restore
 * the enclosing scope when closed:
 * <pre>{@code
 * try (var scope = LoweringScope.enter(node)) {
 *     Object result = lowering.lower(ctx, args, kwargs);
 * }
 * }</pre>
 *
 * <p>Failing to close a scope leaves stale origins on the current thread. Always use
 * try-with-resources.
 */
public final class LoweringScope implements AutoCloseable {

    private static final ThreadLocal<LoweringScope> CURRENT = new ThreadLocal<>();

    private final GraphNode node;
    private final Set<GraphNode> origins;
    private final LoweringScope previous;
    private boolean closed;

    private LoweringScope(GraphNode node, Set<GraphNode> origins) {
        this.node = node;
        this.origins = Collections.unmodifiableSet(origins);
        this.previous = CURRENT.get();
        CURRENT.set(this);
    }

    /**
     * Opens a scope whose only origin is {@code node}.
     */
    public static LoweringScope enter(GraphNode node) {
        Set<GraphNode> origins = new LinkedHashSet<>();
        origins.add(node);
        return new LoweringScope(node, origins);
    }

    /**
     * Opens a scope with an explicit origin set, e.g. when re-lowering a fused subgraph.
     */
    public static LoweringScope enter(GraphNode node, Set<GraphNode> origins) {
        return new LoweringScope(node, new LinkedHashSet<>(origins));
    }

    /**
     * The node being lowered on this thread, or null outside any scope.
     */
    public static GraphNode currentNode() {
        LoweringScope scope = CURRENT.get();
        return scope != null ? scope.node : null;
    }

    public static Set<GraphNode> currentOrigins() {
        LoweringScope scope = CURRENT.get();
        return scope != null ? scope.origins : Set.of();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            if (previous != null) {
                CURRENT.set(previous);
            } else {
                CURRENT.remove();
            }
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return String.format("LoweringScope[node=%s, closed=%s]", node, closed);
    }
}
