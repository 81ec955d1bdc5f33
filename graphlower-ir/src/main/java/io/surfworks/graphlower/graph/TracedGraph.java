package io.surfworks.graphlower.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import io.surfworks.graphlower.tensor.ConstantTensor;
import io.surfworks.graphlower.tensor.ExampleValue;

/**
 * An ordered, single-output dataflow graph produced by tracing a program.
 *
 * <p>Nodes are stored in trace order, which is also a valid topological order.
 * Attribute accesses resolve against {@link #attributes()}. Build instances with
 * {@link #builder(String)}:
 * <pre>{@code
 * var b = TracedGraph.builder("fwd");
 * GraphNode x = b.placeholder("x", TensorMeta.of(DType.FLOAT32, Device.cpu(), 4, 8));
 * GraphNode r = b.call(OpOverload.parse("aten.relu.default"), x.meta(), x);
 * b.output(r);
 * TracedGraph graph = b.build();
 * }</pre>
 */
public final class TracedGraph {

    private final String name;
    private final List<GraphNode> nodes;
    private final Map<String, ConstantTensor> attributes;

    private TracedGraph(String name, List<GraphNode> nodes, Map<String, ConstantTensor> attributes) {
        this.name = name;
        this.nodes = Collections.unmodifiableList(nodes);
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public Map<String, ConstantTensor> attributes() {
        return attributes;
    }

    /**
     * Resolves an attribute path, or null if the graph owns no such attribute.
     */
    public ConstantTensor attribute(String path) {
        return attributes.get(path);
    }

    public List<GraphNode> placeholders() {
        List<GraphNode> result = new ArrayList<>();
        for (GraphNode n : nodes) {
            if (n.kind() == NodeKind.PLACEHOLDER) {
                result.add(n);
            }
        }
        return result;
    }

    /**
     * The single output node.
     */
    public GraphNode outputNode() {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            if (nodes.get(i).kind() == NodeKind.OUTPUT) {
                return nodes.get(i);
            }
        }
        throw new IllegalStateException("Graph " + name + " has no output node");
    }

    /**
     * Returns every call to the given target, in graph order.
     */
    public List<GraphNode> findCalls(Target target) {
        List<GraphNode> result = new ArrayList<>();
        for (GraphNode n : nodes) {
            if (n.isCallTo(target)) {
                result.add(n);
            }
        }
        return result;
    }

    /**
     * Visits every node referenced by an argument structure (nested lists and maps).
     */
    public static void forEachNode(Object arg, Consumer<GraphNode> action) {
        if (arg instanceof GraphNode n) {
            action.accept(n);
        } else if (arg instanceof List<?> list) {
            for (Object o : list) {
                forEachNode(o, action);
            }
        } else if (arg instanceof Map<?, ?> map) {
            for (Object o : map.values()) {
                forEachNode(o, action);
            }
        }
    }

    /**
     * Nodes directly consumed by the given node, in argument order without duplicates.
     */
    public static List<GraphNode> inputsOf(GraphNode node) {
        List<GraphNode> inputs = new ArrayList<>();
        forEachNode(node.args(), n -> {
            if (!inputs.contains(n)) inputs.add(n);
        });
        forEachNode(node.kwargs(), n -> {
            if (!inputs.contains(n)) inputs.add(n);
        });
        return inputs;
    }

    public String format() {
        StringBuilder sb = new StringBuilder("graph ").append(name).append(":\n");
        for (GraphNode n : nodes) {
            sb.append("    ").append(n.format()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("TracedGraph[name=%s, nodes=%d]", name, nodes.size());
    }

    /**
     * Appends nodes in trace order. Node names are derived from the target and made unique
     * with a numeric suffix ({@code add}, {@code add_1}, ...).
     */
    public static final class Builder {

        private final String name;
        private final List<GraphNode> nodes = new ArrayList<>();
        private final Map<String, ConstantTensor> attributes = new LinkedHashMap<>();
        private final Map<String, Integer> nameCounts = new HashMap<>();
        private String stackTrace;
        private boolean hasOutput;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
        }

        /**
         * Sets the source location attached to subsequently added nodes.
         */
        public Builder at(String stackTrace) {
            this.stackTrace = stackTrace;
            return this;
        }

        public GraphNode placeholder(String inputName, ExampleValue meta) {
            return add(inputName, NodeKind.PLACEHOLDER, null, inputName, List.of(), Map.of(), meta);
        }

        /**
         * Registers {@code value} under {@code path} and adds a node reading it.
         */
        public GraphNode getAttr(String path, ConstantTensor value) {
            attributes.put(path, Objects.requireNonNull(value, "value cannot be null"));
            return add(path.replace('.', '_'), NodeKind.GET_ATTR, null, path, List.of(), Map.of(), value.meta());
        }

        /**
         * Adds a node reading an attribute path that need not exist.
         */
        public GraphNode getAttr(String path, ExampleValue meta) {
            return add(path.replace('.', '_'), NodeKind.GET_ATTR, null, path, List.of(), Map.of(), meta);
        }

        public GraphNode call(Target target, ExampleValue meta, Object... args) {
            return call(target, meta, Arrays.asList(args), Map.of());
        }

        public GraphNode call(Target target, ExampleValue meta, List<Object> args, Map<String, Object> kwargs) {
            Objects.requireNonNull(target, "target cannot be null");
            return add(baseName(target), NodeKind.CALL_FUNCTION, target, null, args, kwargs, meta);
        }

        public GraphNode callModule(String modulePath, ExampleValue meta, Object... args) {
            return add(modulePath.replace('.', '_'), NodeKind.CALL_MODULE, null, modulePath,
                    Arrays.asList(args), Map.of(), meta);
        }

        public GraphNode callMethod(String method, ExampleValue meta, Object... args) {
            return add(method, NodeKind.CALL_METHOD, null, method, Arrays.asList(args), Map.of(), meta);
        }

        /**
         * Adds the output node; its single argument is the list of returned values.
         */
        public GraphNode output(Object... values) {
            if (hasOutput) {
                throw new IllegalStateException("Graph " + name + " already has an output node");
            }
            hasOutput = true;
            List<Object> returned = new ArrayList<>(Arrays.asList(values));
            return add("output", NodeKind.OUTPUT, null, "output", List.of(returned), Map.of(), null);
        }

        public TracedGraph build() {
            if (!hasOutput) {
                throw new IllegalStateException("Graph " + name + " has no output node");
            }
            for (GraphNode node : nodes) {
                forEachNode(node.args(), input -> input.addUser(node));
                forEachNode(node.kwargs(), input -> input.addUser(node));
            }
            return new TracedGraph(name, nodes, attributes);
        }

        private GraphNode add(String base, NodeKind kind, Target target, String attribute,
                              List<Object> args, Map<String, Object> kwargs, ExampleValue meta) {
            if (hasOutput && kind != NodeKind.OUTPUT) {
                throw new IllegalStateException("Cannot add nodes after the output node");
            }
            GraphNode node = new GraphNode(nodes.size(), uniqueName(base), kind, target, attribute,
                    new ArrayList<>(args), new LinkedHashMap<>(kwargs), meta, stackTrace);
            nodes.add(node);
            return node;
        }

        private String uniqueName(String base) {
            int count = nameCounts.merge(base, 1, Integer::sum);
            return count == 1 ? base : base + "_" + (count - 1);
        }

        private static String baseName(Target target) {
            if (target instanceof OpOverload op) {
                return op.opName();
            }
            return target.name().toLowerCase();
        }
    }
}
