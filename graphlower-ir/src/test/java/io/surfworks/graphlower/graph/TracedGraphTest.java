package io.surfworks.graphlower.graph;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.graphlower.tensor.ConstantTensor;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;
import io.surfworks.graphlower.tensor.TensorMeta;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TracedGraph")
class TracedGraphTest {

    private static final TensorMeta META = TensorMeta.of(DType.FLOAT32, Device.cpu(), 4, 8);
    private static final OpOverload ADD = OpOverload.parse("aten.add.Tensor");
    private static final OpOverload RELU = OpOverload.parse("aten.relu.default");

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("derives unique node names from targets")
        void uniqueNames() {
            var b = TracedGraph.builder("g");
            GraphNode x = b.placeholder("x", META);
            GraphNode a = b.call(ADD, META, x, x);
            GraphNode a1 = b.call(ADD, META, a, x);
            b.output(a1);
            TracedGraph g = b.build();

            assertEquals("add", a.name());
            assertEquals("add_1", a1.name());
            assertEquals(4, g.nodes().size());
            assertEquals(List.of(x), g.placeholders());
        }

        @Test
        @DisplayName("computes users in graph order, including the output")
        void users() {
            var b = TracedGraph.builder("g");
            GraphNode x = b.placeholder("x", META);
            GraphNode y = b.placeholder("y", META);
            GraphNode add = b.call(ADD, META, x, y);
            GraphNode relu = b.call(RELU, META, add);
            GraphNode out = b.output(relu, add);
            b.build();

            assertEquals(List.of(add), List.copyOf(x.users()));
            assertEquals(List.of(relu, out), List.copyOf(add.users()));
            assertTrue(relu.feedsOutput());
            assertFalse(x.feedsOutput());
            assertEquals(List.of(relu, add), out.args().get(0));
        }

        @Test
        @DisplayName("registers attribute values")
        void attributes() {
            var b = TracedGraph.builder("g");
            ConstantTensor w = ConstantTensor.of(DType.FLOAT32, Device.cpu(), new long[] {2}, 1, 2);
            GraphNode attr = b.getAttr("layer.weight", w);
            b.output(attr);
            TracedGraph g = b.build();

            assertEquals("layer_weight", attr.name());
            assertEquals("layer.weight", attr.attribute());
            assertSame(w, g.attribute("layer.weight"));
        }

        @Test
        @DisplayName("requires exactly one trailing output node")
        void outputRules() {
            var b = TracedGraph.builder("g");
            GraphNode x = b.placeholder("x", META);
            assertThrows(IllegalStateException.class, b::build);
            b.output(x);
            assertThrows(IllegalStateException.class, () -> b.output(x));
            assertThrows(IllegalStateException.class, () -> b.call(RELU, META, x));
        }
    }

    @Test
    @DisplayName("findCalls and inputsOf traverse arguments")
    void queries() {
        var b = TracedGraph.builder("g");
        GraphNode x = b.placeholder("x", META);
        GraphNode y = b.placeholder("y", META);
        GraphNode cat = b.call(OpOverload.parse("aten.cat.default"), META, List.of(x, y, x), 0L);
        b.output(cat);
        TracedGraph g = b.build();

        assertEquals(List.of(cat), g.findCalls(OpOverload.parse("aten.cat.default")));
        assertEquals(List.of(x, y), TracedGraph.inputsOf(cat));
        assertTrue(cat.format().contains("args = ([%x, %y, %x], 0)"));
        assertSame(g.outputNode(), g.nodes().get(3));
    }

    @Test
    @DisplayName("parses operator overloads")
    void opOverloads() {
        OpOverload op = OpOverload.parse("aten.add_.Tensor");
        assertTrue(op.isInplace());
        assertEquals("aten::add_", op.qualifiedName());
        assertEquals("aten.add_", op.packetName());
        assertEquals("default", OpOverload.parse("torchvision.roi_align").overload());
        assertFalse(OpOverload.parse("aten._to_copy.default").isInplace());
    }
}
