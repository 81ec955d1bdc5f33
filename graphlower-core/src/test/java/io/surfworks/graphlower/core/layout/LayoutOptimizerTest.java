package io.surfworks.graphlower.core.layout;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.surfworks.graphlower.core.config.LoweringConfig;
import io.surfworks.graphlower.core.config.RuntimeEnvironment;
import io.surfworks.graphlower.core.lowering.AtenOps;
import io.surfworks.graphlower.graph.GraphNode;
import io.surfworks.graphlower.graph.OpOverload;
import io.surfworks.graphlower.graph.TracedGraph;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;
import io.surfworks.graphlower.tensor.TensorMeta;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("LayoutOptimizer")
class LayoutOptimizerTest {

    private static final OpOverload RELU = OpOverload.parse("aten.relu.default");
    private static final OpOverload ADD = OpOverload.parse("aten.add.Tensor");

    private static final LayoutOptimizer CPU = new LayoutOptimizer(LoweringConfig.defaults(), RuntimeEnvironment.cpuOnly());

    private static TensorMeta meta(Device device, long... shape) {
        return TensorMeta.of(DType.FLOAT32, device, shape);
    }

    /**
     * {@code conv(x, w)} with the given weight shape and groups, on {@code device}.
     */
    private static TracedGraph conv(Device device, long[] weightShape, long groups, boolean dynamic) {
        TensorMeta x = meta(device, 8, weightShape[1] * groups, 32, 32);
        TensorMeta w = meta(device, weightShape);
        TensorMeta out = meta(device, 8, weightShape[0], 32, 32);
        var b = TracedGraph.builder("forward");
        var xn = b.placeholder("x", dynamic ? x.asSymbolic() : x);
        var wn = b.placeholder("w", w);
        var c = b.call(AtenOps.CONVOLUTION, out, xn, wn, null,
                List.of(1L, 1L), List.of(1L, 1L), List.of(1L, 1L), false, List.of(0L, 0L), groups);
        b.output(c);
        return b.build();
    }

    private static TracedGraph conv(long... weightShape) {
        return conv(Device.cuda(0), weightShape, 1, false);
    }

    @Nested
    @DisplayName("Decision rules")
    class DecisionRules {

        @Test
        @DisplayName("a large-channel convolution graph is optimized")
        void optimized() {
            assertTrue(CPU.decideLayoutOpt(conv(128, 128, 3, 3)));
        }

        @Test
        @DisplayName("repeated decisions on the same graph and flags agree")
        void deterministic() {
            TracedGraph enabled = conv(128, 128, 3, 3);
            TracedGraph small = conv(32, 32, 3, 3);
            LayoutOptimizer other = new LayoutOptimizer(LoweringConfig.defaults(), RuntimeEnvironment.cpuOnly());

            for (int i = 0; i < 3; i++) {
                assertTrue(CPU.decideLayoutOpt(enabled));
                assertFalse(CPU.decideLayoutOpt(small));
            }
            assertEquals(CPU.decideLayoutOpt(enabled), other.decideLayoutOpt(enabled));
            assertEquals(CPU.decideLayoutOpt(small), other.decideLayoutOpt(small));
        }

        @Test
        @DisplayName("the config switch turns the optimization off")
        void disabled() {
            LayoutOptimizer off = new LayoutOptimizer(LoweringConfig.defaults().withLayoutOptimization(false),
                    RuntimeEnvironment.cpuOnly());

            assertFalse(off.decideLayoutOpt(conv(128, 128, 3, 3)));
        }

        @Test
        @DisplayName("graphs without convolutions are not optimized")
        void noConvolution() {
            var b = TracedGraph.builder("forward");
            var x = b.placeholder("x", meta(Device.cpu(), 8, 128, 32, 32));
            b.output(b.call(RELU, meta(Device.cpu(), 8, 128, 32, 32), x));

            assertFalse(CPU.decideLayoutOpt(b.build()));
        }

        @Test
        @DisplayName("ROCm GPUs are skipped")
        void rocm() {
            LayoutOptimizer rocm = new LayoutOptimizer(LoweringConfig.defaults(),
                    RuntimeEnvironment.cpuOnly().withGpu(true, true));

            assertFalse(rocm.decideLayoutOpt(conv(128, 128, 3, 3)));
        }

        @Test
        @DisplayName("oneDNN on CPU wins over the channel rules")
        void mkldnnCpu() {
            LayoutOptimizer mkldnn = new LayoutOptimizer(LoweringConfig.defaults(),
                    RuntimeEnvironment.cpuOnly().withMkldnn(true, true));
            TracedGraph small = conv(Device.cpu(), new long[] {4, 4, 3, 3}, 1, false);

            assertTrue(mkldnn.decideLayoutOpt(small));
            assertFalse(CPU.decideLayoutOpt(small));
        }

        @Test
        @DisplayName("few convolutions in a large graph are not worth it")
        void nodeRatio() {
            LayoutOptimizer strict = new LayoutOptimizer(LoweringConfig.defaults().withLayoutOptThresholds(2, 64),
                    RuntimeEnvironment.cpuOnly());

            assertFalse(strict.decideLayoutOpt(conv(128, 128, 3, 3)));
        }

        @Test
        @DisplayName("dynamic convolution operands are skipped")
        void dynamic() {
            assertFalse(CPU.decideLayoutOpt(conv(Device.cuda(0), new long[] {128, 128, 3, 3}, 1, true)));
        }

        @Test
        @DisplayName("grouped convolutions with more than one input channel per group are skipped")
        void grouped() {
            assertFalse(CPU.decideLayoutOpt(conv(Device.cuda(0), new long[] {128, 64, 3, 3}, 2, false)));
        }

        @Test
        @DisplayName("depthwise convolutions are not grouped for this rule")
        void depthwise() {
            assertTrue(CPU.decideLayoutOpt(conv(Device.cuda(0), new long[] {128, 1, 3, 3}, 128, false)));
        }

        @Test
        @DisplayName("convolutions halving the channels are skipped")
        void inOutChannel() {
            assertFalse(CPU.decideLayoutOpt(conv(128, 256, 3, 3)));
        }

        @Test
        @DisplayName("1x1 convolutions halving the channels are kept")
        void pointwiseConvolution() {
            assertTrue(CPU.decideLayoutOpt(conv(128, 256, 1, 1)));
        }

        @Test
        @DisplayName("graphs where every convolution is small are skipped")
        void smallChannels() {
            assertFalse(CPU.decideLayoutOpt(conv(64, 64, 3, 3)));
            assertTrue(CPU.decideLayoutOpt(conv(65, 64, 3, 3)));
        }

        @ParameterizedTest(name = "weight [{0}, {1}, {2}, {2}] -> {3}")
        @CsvSource({
                "128, 128, 3, true",
                "256, 128, 3, true",
                "128, 256, 3, false",
                "128, 256, 1, true",
                "64, 32, 3, false",
                "64, 128, 3, false",
                "96, 64, 5, true"
        })
        @DisplayName("weight shapes decide single-convolution graphs")
        void weightShapes(long outChannels, long inChannels, long kernel, boolean expected) {
            assertEquals(expected, CPU.decideLayoutOpt(conv(outChannels, inChannels, kernel, kernel)));
        }

        @Test
        @DisplayName("attention ops disable the optimization")
        void attention() {
            Device gpu = Device.cuda(0);
            var b = TracedGraph.builder("forward");
            var x = b.placeholder("x", meta(gpu, 8, 128, 32, 32));
            var w = b.placeholder("w", meta(gpu, 128, 128, 3, 3));
            var c = b.call(AtenOps.CONVOLUTION, meta(gpu, 8, 128, 32, 32), x, w, null,
                    List.of(1L, 1L), List.of(1L, 1L), List.of(1L, 1L), false, List.of(0L, 0L), 1L);
            var q = b.placeholder("q", meta(gpu, 2, 4, 16, 32));
            var attn = b.call(AtenOps.SDPA_FLASH, null, q, q, q);
            b.output(c, attn);

            assertFalse(CPU.decideLayoutOpt(b.build()));
        }
    }

    @Nested
    @DisplayName("Channels-last preference")
    class Preference {

        @Test
        @DisplayName("convolutions with their producers and everything downstream prefer channels last")
        void propagation() {
            Device gpu = Device.cuda(0);
            TensorMeta act = meta(gpu, 8, 128, 32, 32);
            var b = TracedGraph.builder("forward");
            var x = b.placeholder("x", act);
            var w = b.placeholder("w", meta(gpu, 128, 128, 3, 3));
            var other = b.placeholder("other", act);
            var relu = b.call(RELU, act, x);
            var c = b.call(AtenOps.CONVOLUTION, act, relu, w, null,
                    List.of(1L, 1L), List.of(1L, 1L), List.of(1L, 1L), false, List.of(0L, 0L), 1L);
            var add = b.call(ADD, act, c, other);
            GraphNode out = b.output(add);
            Set<GraphNode> prefer = LayoutOptimizer.findNodesPreferChannelsLast(b.build());

            assertTrue(prefer.containsAll(List.of(x, w, relu, c, add, out)));
            assertFalse(prefer.contains(other));
        }

        @Test
        @DisplayName("a graph without convolutions prefers nothing")
        void empty() {
            var b = TracedGraph.builder("forward");
            var x = b.placeholder("x", meta(Device.cpu(), 4, 8));
            b.output(b.call(RELU, meta(Device.cpu(), 4, 8), x));

            assertEquals(Set.of(), LayoutOptimizer.findNodesPreferChannelsLast(b.build()));
        }
    }
}
