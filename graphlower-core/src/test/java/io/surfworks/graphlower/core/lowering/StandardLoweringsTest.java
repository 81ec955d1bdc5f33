package io.surfworks.graphlower.core.lowering;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.graphlower.core.GraphLowering;
import io.surfworks.graphlower.core.config.RuntimeEnvironment;
import io.surfworks.graphlower.core.exc.LoweringException;
import io.surfworks.graphlower.graph.OpOverload;
import io.surfworks.graphlower.graph.TracedGraph;
import io.surfworks.graphlower.ir.FixedLayout;
import io.surfworks.graphlower.ir.InputBuffer;
import io.surfworks.graphlower.ir.Pointwise;
import io.surfworks.graphlower.ir.Reduction;
import io.surfworks.graphlower.ir.ReinterpretView;
import io.surfworks.graphlower.ir.TensorBox;
import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.ConstantTensor;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;
import io.surfworks.graphlower.tensor.TensorMeta;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("StandardLowerings")
class StandardLoweringsTest {

    private static final SymExpr S0 = SymExpr.symbol("s0");

    private GraphLowering lowering;

    @BeforeEach
    void setUp() {
        TensorMeta meta = TensorMeta.of(DType.FLOAT32, Device.cpu(), 4, 8);
        var b = TracedGraph.builder("forward");
        b.output(b.placeholder("x", meta));
        lowering = GraphLowering.builder(b.build())
                .registry(LoweringRegistry.standard())
                .environment(RuntimeEnvironment.cpuOnly())
                .build();
    }

    private static List<SymExpr> sizes(long... dims) {
        SymExpr[] exprs = new SymExpr[dims.length];
        for (int i = 0; i < dims.length; i++) {
            exprs[i] = SymExpr.of(dims[i]);
        }
        return List.of(exprs);
    }

    private TensorBox input(String name, DType dtype, long... shape) {
        InputBuffer buffer = new InputBuffer(name, FixedLayout.contiguous(Device.cpu(), dtype, sizes(shape)));
        return TensorBox.create(buffer, lowering);
    }

    private TensorBox call(String op, Object... args) {
        return (TensorBox) lowering.callFunction(OpOverload.parse(op), List.of(args), Map.of());
    }

    @Nested
    @DisplayName("Helpers")
    class Helpers {

        @Test
        @DisplayName("broadcast aligns trailing dimensions and expands ones")
        void broadcast() {
            assertEquals(sizes(4, 8), StandardLowerings.broadcast(sizes(4, 1), sizes(8)));
            assertEquals(sizes(2, 4, 8), StandardLowerings.broadcast(sizes(2, 1, 1), sizes(4, 8)));
            assertEquals(sizes(4, 8), StandardLowerings.broadcast(List.of(), sizes(4, 8)));
        }

        @Test
        @DisplayName("broadcast keeps symbolic sizes against constants")
        void symbolicBroadcast() {
            assertEquals(List.of(S0), StandardLowerings.broadcast(List.of(S0), sizes(4)));
            assertEquals(List.of(S0), StandardLowerings.broadcast(sizes(1), List.of(S0)));
        }

        @Test
        @DisplayName("mismatched constant sizes do not broadcast")
        void broadcastMismatch() {
            assertThrows(IllegalArgumentException.class, () -> StandardLowerings.broadcast(sizes(3), sizes(4)));
        }

        @Test
        @DisplayName("negative dimensions count from the end")
        void normalizeDim() {
            assertEquals(2, StandardLowerings.normalizeDim(-1, 3));
            assertEquals(0, StandardLowerings.normalizeDim(0, 3));
            assertEquals(0, StandardLowerings.normalizeDim(0, 0));
            assertThrows(IndexOutOfBoundsException.class, () -> StandardLowerings.normalizeDim(3, 3));
            assertThrows(IndexOutOfBoundsException.class, () -> StandardLowerings.normalizeDim(-4, 3));
        }

        @Test
        @DisplayName("integers and booleans convert to size expressions")
        void toExpr() {
            assertEquals(SymExpr.of(5), StandardLowerings.toExpr(5));
            assertEquals(SymExpr.of(1), StandardLowerings.toExpr(true));
            assertEquals(S0, StandardLowerings.toExpr(S0));
            assertThrows(IllegalArgumentException.class, () -> StandardLowerings.toExpr("five"));
        }

        @Test
        @DisplayName("numel multiplies sizes")
        void numel() {
            assertEquals(SymExpr.of(32), StandardLowerings.numel(sizes(4, 8)));
            assertEquals(SymExpr.of(1), StandardLowerings.numel(List.of()));
        }
    }

    @Nested
    @DisplayName("Pointwise")
    class PointwiseOps {

        @Test
        @DisplayName("alpha scales the second operand")
        void alpha() {
            TensorBox x = input("x", DType.FLOAT32, 4, 8);
            TensorBox y = input("y", DType.FLOAT32, 4, 8);
            Object result = lowering.callFunction(OpOverload.parse("aten.add.Tensor"),
                    List.<Object>of(x, y), Map.of("alpha", 2));

            assertEquals("add(x, mul(y, 2.0))", ((TensorBox) result).describe());
        }

        @Test
        @DisplayName("a unit alpha is dropped")
        void unitAlpha() {
            TensorBox x = input("x", DType.FLOAT32, 4, 8);
            TensorBox y = input("y", DType.FLOAT32, 4, 8);
            Object result = lowering.callFunction(OpOverload.parse("aten.add.Tensor"),
                    List.<Object>of(x, y), Map.of("alpha", 1));

            assertEquals("add(x, y)", ((TensorBox) result).describe());
        }

        @Test
        @DisplayName("scalar operands become constants of the result dtype")
        void scalarOperand() {
            TensorBox out = call("aten.add.Scalar", input("x", DType.FLOAT32, 4, 8), 3.0);

            assertEquals("add(x, 3.0)", out.describe());
            assertEquals(DType.FLOAT32, out.dtype());
        }

        @Test
        @DisplayName("a float scalar promotes an integer tensor")
        void floatScalarPromotes() {
            TensorBox out = call("aten.mul.Scalar", input("n", DType.INT64, 4), 0.5);

            assertEquals(DType.FLOAT32, out.dtype());
        }

        @Test
        @DisplayName("true division of integers is float")
        void trueDivision() {
            TensorBox out = call("aten.div.Tensor", input("a", DType.INT64, 4), input("b", DType.INT64, 4));

            assertEquals("truediv(a, b)", out.describe());
            assertEquals(DType.FLOAT32, out.dtype());
        }

        @Test
        @DisplayName("operands broadcast to a common size")
        void broadcasting() {
            TensorBox out = call("aten.mul.Tensor", input("x", DType.FLOAT32, 4, 8), input("row", DType.FLOAT32, 8));

            assertEquals(sizes(4, 8), out.size());
            assertInstanceOf(Pointwise.class, out.data());
        }

        @Test
        @DisplayName("incompatible operands fail with the operator in the message")
        void incompatible() {
            LoweringException e = assertThrows(LoweringException.class,
                    () -> call("aten.add.Tensor", input("x", DType.FLOAT32, 4, 8), input("z", DType.FLOAT32, 3)));

            assertInstanceOf(IllegalArgumentException.class, e.getCause());
            assertTrue(e.getMessage().contains("aten.add.Tensor"));
        }

        @Test
        @DisplayName("small constants inline as a tensor literal")
        void inlineConstant() {
            ConstantTensor value = ConstantTensor.of(DType.FLOAT32, Device.cpu(), new long[] {2}, 0.5, 1.5);
            TensorBox box = StandardLowerings.inlineConstant(lowering, value);

            assertEquals("tensor(0.5, 1.5)", box.describe());
            assertEquals(sizes(2), box.size());
        }
    }

    @Nested
    @DisplayName("Reductions")
    class Reductions {

        @Test
        @DisplayName("sum over one dimension drops it")
        void sum() {
            TensorBox out = call("aten.sum.dim_IntList", input("x", DType.FLOAT32, 4, 8), List.of(-1));

            Reduction reduction = assertInstanceOf(Reduction.class, out.data());
            assertEquals(sizes(4), out.size());
            assertEquals(sizes(8), reduction.reductionRanges());
            assertEquals("sum(x) over [8]", out.describe());
        }

        @Test
        @DisplayName("keepdim keeps reduced dimensions as ones")
        void keepdim() {
            TensorBox out = call("aten.amax.default", input("x", DType.FLOAT32, 4, 8), List.of(0), true);

            assertEquals(sizes(1, 8), out.size());
        }

        @Test
        @DisplayName("an empty dimension list reduces everything")
        void full() {
            TensorBox out = call("aten.sum.dim_IntList", input("x", DType.FLOAT32, 4, 8), List.of());

            assertEquals(List.of(), out.size());
            assertEquals(sizes(4, 8), ((Reduction) out.data()).reductionRanges());
        }

        @Test
        @DisplayName("the mean of integers is float")
        void integerMean() {
            TensorBox out = call("aten.mean.dim", input("n", DType.INT64, 4, 8), List.of(1));

            assertEquals(DType.FLOAT32, out.dtype());
        }
    }

    @Nested
    @DisplayName("Views")
    class Views {

        @Test
        @DisplayName("view infers one -1 dimension")
        void view() {
            TensorBox out = call("aten.view.default", input("x", DType.FLOAT32, 4, 8), List.of(2, -1));

            assertEquals("reinterpret_tensor(x, (2, 16), (16, 1), 0)", out.describe());
            assertEquals("x", out.name());
        }

        @Test
        @DisplayName("permute reorders sizes and strides")
        void permute() {
            TensorBox out = call("aten.permute.default", input("x", DType.FLOAT32, 4, 8), List.of(1, 0));

            ReinterpretView view = assertInstanceOf(ReinterpretView.class, out.data());
            assertEquals(sizes(8, 4), view.layout().size());
            assertEquals(sizes(1, 8), view.layout().stride());
        }

        @Test
        @DisplayName("permute needs one entry per dimension")
        void permuteRank() {
            assertThrows(LoweringException.class,
                    () -> call("aten.permute.default", input("x", DType.FLOAT32, 4, 8), List.of(0)));
        }

        @Test
        @DisplayName("viewing a non-contiguous tensor copies it first")
        void viewOfPermuted() {
            TensorBox permuted = call("aten.permute.default", input("x", DType.FLOAT32, 4, 8), List.of(1, 0));
            TensorBox out = call("aten.view.default", permuted, List.of(-1));

            assertEquals(1, lowering.buffers().size());
            assertEquals("buf0 = copy(reinterpret_tensor(x, (8, 4), (1, 8), 0))",
                    lowering.buffers().get(0).describe());
            assertEquals("reinterpret_tensor(buf0, (32,), (1,), 0)", out.describe());
        }

        @Test
        @DisplayName("views of lazy values realize them with row-major strides")
        void viewOfComputed() {
            TensorBox relu = call("aten.relu.default", input("x", DType.FLOAT32, 4, 8));
            TensorBox out = call("aten.view.default", relu, List.of(32));

            assertEquals("buf0 = relu(x)", lowering.buffers().get(0).describe());
            assertTrue(lowering.buffers().get(0).layout().isContiguous());
            assertEquals("reinterpret_tensor(buf0, (32,), (1,), 0)", out.describe());
        }

        @Test
        @DisplayName("as_strided takes an explicit storage offset")
        void asStrided() {
            TensorBox out = call("aten.as_strided.default", input("x", DType.FLOAT32, 4, 8),
                    List.of(2, 2), List.of(8, 1), 3);

            assertEquals("reinterpret_tensor(x, (2, 2), (8, 1), 3)", out.describe());
        }

        @Test
        @DisplayName("sym_size and sym_numel read the tensor's sizes")
        void symbolicSizes() {
            TensorBox x = input("x", DType.FLOAT32, 4, 8);

            assertEquals(SymExpr.of(8), lowering.callFunction(AtenOps.SYM_SIZE, List.of(x, -1), Map.of()));
            assertEquals(SymExpr.of(32), lowering.callFunction(AtenOps.SYM_NUMEL, List.of(x), Map.of()));
            assertEquals(SymExpr.of(1), lowering.callFunction(AtenOps.SYM_STRIDE, List.of(x, 1), Map.of()));
        }
    }
}
