package io.surfworks.graphlower.ir;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import io.surfworks.graphlower.graph.GraphNode;
import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * Base of the lowered intermediate representation.
 *
 * <p>Every IR node remembers the graph nodes it was created for. Origins are captured from
 * the enclosing {@link LoweringScope} at construction time and are used only for
 * diagnostics.
 */
public abstract class IrNode {

    private final Set<GraphNode> origins = new LinkedHashSet<>();
    private GraphNode originNode;

    protected IrNode() {
        origins.addAll(LoweringScope.currentOrigins());
    }

    public Set<GraphNode> origins() {
        return Collections.unmodifiableSet(origins);
    }

    public void addOrigins(Set<GraphNode> more) {
        origins.addAll(more);
    }

    /**
     * The graph node whose lowering returned this value, if tagged.
     */
    public GraphNode originNode() {
        return originNode;
    }

    public void setOriginNode(GraphNode node) {
        this.originNode = node;
    }

    /**
     * Logical sizes; empty for scalars.
     */
    public abstract List<SymExpr> size();

    /**
     * Element type, or null for values that are not tensors.
     */
    public abstract DType dtype();

    /**
     * Device, or null for device-less values.
     */
    public abstract Device device();

    /**
     * Names of the buffers this value reads, one entry per read.
     */
    public List<String> readNames() {
        return List.of();
    }

    /**
     * Number of inlined operations evaluated to compute one element.
     */
    public int opCount() {
        return 0;
    }

    public int rank() {
        return size().size();
    }

    /**
     * Short textual form used in generated code and diagnostics.
     */
    public abstract String describe();

    @Override
    public String toString() {
        return describe();
    }
}
