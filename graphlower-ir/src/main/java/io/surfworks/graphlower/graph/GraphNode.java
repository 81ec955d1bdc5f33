package io.surfworks.graphlower.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.surfworks.graphlower.tensor.ExampleValue;

/**
 * A node in a traced graph.
 *
 * <p>Arguments are literals ({@code Long}, {@code Double}, {@code Boolean}, {@code String},
 * {@code null}), symbolic expressions, lists of those, or references to earlier
 * {@code GraphNode}s. The set of users is filled in when the owning {@link TracedGraph}
 * is built and is ordered by the users' position in the graph.
 */
public final class GraphNode {

    private final int index;
    private final String name;
    private final NodeKind kind;
    private final Target target;
    private final String attribute;
    private final List<Object> args;
    private final Map<String, Object> kwargs;
    private final ExampleValue meta;
    private final String stackTrace;
    private final Set<GraphNode> users = new LinkedHashSet<>();

    GraphNode(int index, String name, NodeKind kind, Target target, String attribute,
              List<Object> args, Map<String, Object> kwargs, ExampleValue meta, String stackTrace) {
        this.index = index;
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.target = target;
        this.attribute = attribute;
        this.args = Collections.unmodifiableList(args);
        this.kwargs = Collections.unmodifiableMap(kwargs);
        this.meta = meta;
        this.stackTrace = stackTrace;
    }

    /**
     * Position of this node in trace order.
     */
    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * The callee for {@link NodeKind#CALL_FUNCTION} nodes, null otherwise.
     */
    public Target target() {
        return target;
    }

    /**
     * The input name for placeholders, or the attribute path for attribute accesses.
     */
    public String attribute() {
        return attribute;
    }

    public List<Object> args() {
        return args;
    }

    public Map<String, Object> kwargs() {
        return kwargs;
    }

    /**
     * The example value observed while tracing; may be null.
     */
    public ExampleValue meta() {
        return meta;
    }

    /**
     * Source location that produced this node, used for diagnostics; may be null.
     */
    public String stackTrace() {
        return stackTrace;
    }

    /**
     * Nodes consuming this node's value, in graph order.
     */
    public Set<GraphNode> users() {
        return Collections.unmodifiableSet(users);
    }

    void addUser(GraphNode user) {
        users.add(user);
    }

    public boolean isCallTo(Target t) {
        return kind == NodeKind.CALL_FUNCTION && t.equals(target);
    }

    /**
     * True if the graph output consumes this node.
     */
    public boolean feedsOutput() {
        for (GraphNode user : users) {
            if (user.kind == NodeKind.OUTPUT) {
                return true;
            }
        }
        return false;
    }

    /**
     * One-line rendering, e.g. {@code %add : call_function[target=aten.add.Tensor](args = (%x, %y))}.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append('%').append(name).append(" : ").append(kind.name().toLowerCase());
        sb.append("[target=").append(target != null ? target.toString() : attribute).append(']');
        sb.append("(args = (");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(formatArg(args.get(i)));
        }
        sb.append(")");
        if (!kwargs.isEmpty()) {
            sb.append(", kwargs = {");
            boolean first = true;
            for (Map.Entry<String, Object> e : kwargs.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(e.getKey()).append(": ").append(formatArg(e.getValue()));
                first = false;
            }
            sb.append('}');
        }
        sb.append(')');
        return sb.toString();
    }

    private static String formatArg(Object arg) {
        if (arg instanceof GraphNode n) {
            return "%" + n.name;
        }
        if (arg instanceof List<?> list) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(formatArg(list.get(i)));
            }
            return sb.append(']').toString();
        }
        return String.valueOf(arg);
    }

    @Override
    public String toString() {
        return name;
    }
}
