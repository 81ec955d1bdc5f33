package io.surfworks.graphlower.ir;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.graphlower.graph.GraphNode;
import io.surfworks.graphlower.graph.OpOverload;
import io.surfworks.graphlower.graph.TracedGraph;
import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;
import io.surfworks.graphlower.tensor.TensorMeta;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("LoweringScope")
class LoweringScopeTest {

    private static final TensorMeta META = TensorMeta.of(DType.FLOAT32, Device.cpu(), 4);

    @Test
    @DisplayName("IR nodes capture the origins of the open scope")
    void capturesOrigins() {
        var b = TracedGraph.builder("g");
        GraphNode x = b.placeholder("x", META);
        GraphNode relu = b.call(OpOverload.parse("aten.relu.default"), META, x);
        b.output(relu);
        b.build();

        Pointwise value;
        try (var scope = LoweringScope.enter(relu)) {
            assertSame(relu, LoweringScope.currentNode());
            value = Pointwise.create("relu", Device.cpu(), DType.FLOAT32, List.of(SymExpr.of(4)), List.of());
        }
        assertEquals(List.of(relu), List.copyOf(value.origins()));
        assertNull(LoweringScope.currentNode());
        assertTrue(new ConstantValue(1.0, DType.FLOAT32, Device.cpu()).origins().isEmpty());
    }

    @Test
    @DisplayName("nested scopes restore the enclosing node on close")
    void nesting() {
        var b = TracedGraph.builder("g");
        GraphNode x = b.placeholder("x", META);
        GraphNode y = b.placeholder("y", META);
        b.output(x, y);
        b.build();

        try (var outer = LoweringScope.enter(x)) {
            try (var inner = LoweringScope.enter(y)) {
                assertSame(y, LoweringScope.currentNode());
            }
            assertSame(x, LoweringScope.currentNode());
            outer.close();
            assertTrue(outer.isClosed());
            assertNull(LoweringScope.currentNode());
        }
        assertNull(LoweringScope.currentNode());
    }
}
