package io.surfworks.graphlower.core.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.graphlower.core.GraphLowering;
import io.surfworks.graphlower.core.config.RuntimeEnvironment;
import io.surfworks.graphlower.core.lowering.LoweringRegistry;
import io.surfworks.graphlower.graph.OpOverload;
import io.surfworks.graphlower.graph.TracedGraph;
import io.surfworks.graphlower.ir.Buffer;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;
import io.surfworks.graphlower.tensor.TensorMeta;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BackendRegistry")
class BackendRegistryTest {

    @AfterEach
    void restoreDefaults() {
        BackendRegistry.clear();
        GraphLowering.initBackendRegistration();
    }

    @Test
    @DisplayName("lowering registers cpu and cuda by default")
    void defaults() {
        BackendRegistry.clear();
        GraphLowering.initBackendRegistration();

        assertEquals(Set.of("cpu", "cuda"), BackendRegistry.registeredDevices());
        assertInstanceOf(SequentialScheduling.class, BackendRegistry.schedulingFor("cpu"));
        assertInstanceOf(TextWrapperCodeGen.class, BackendRegistry.wrapperCodegenFor("cuda"));
    }

    @Test
    @DisplayName("unknown devices have no backend")
    void unknown() {
        assertFalse(BackendRegistry.isRegistered("npu"));
        assertNull(BackendRegistry.schedulingFor("npu"));
        assertNull(BackendRegistry.wrapperCodegenFor("npu"));
    }

    @Test
    @DisplayName("every lookup returns a new instance")
    void freshInstances() {
        GraphLowering.initBackendRegistration();

        assertNotSame(BackendRegistry.wrapperCodegenFor("cpu"), BackendRegistry.wrapperCodegenFor("cpu"));
    }

    @Test
    @DisplayName("registerBackendForDevice replaces, registerIfAbsent does not")
    void replacement() {
        BackendRegistry.registerBackendForDevice("cpu", SequentialScheduling::new, CppWrapperCodeGen::new);
        GraphLowering.initBackendRegistration();

        assertInstanceOf(CppWrapperCodeGen.class, BackendRegistry.wrapperCodegenFor("cpu"));

        BackendRegistry.registerBackendForDevice("cpu", SequentialScheduling::new, TextWrapperCodeGen::new);
        assertFalse(BackendRegistry.wrapperCodegenFor("cpu") instanceof CppWrapperCodeGen);
    }

    @Test
    @DisplayName("a registered device's scheduling and wrapper are used for code generation")
    void customDevice() {
        List<Integer> scheduled = new ArrayList<>();
        BackendRegistry.registerBackendForDevice("npu",
                () -> buffers -> {
                    scheduled.add(buffers.size());
                    return List.of(List.copyOf(buffers));
                },
                () -> (graph, kernels) -> {
                    StringBuilder sb = new StringBuilder("npu:");
                    for (List<Buffer> kernel : kernels) {
                        for (Buffer buffer : kernel) {
                            sb.append(' ').append(buffer.name());
                        }
                    }
                    return new GeneratedCode(sb.toString(), List.of());
                });

        Device npu = Device.parse("npu:0");
        TensorMeta meta = TensorMeta.of(DType.FLOAT32, npu, 4, 8);
        var b = TracedGraph.builder("forward");
        var x = b.placeholder("x", meta);
        var w = b.placeholder("w", TensorMeta.of(DType.FLOAT32, npu, 8, 4));
        var relu = b.call(OpOverload.parse("aten.relu.default"), meta, x);
        b.output(b.call(OpOverload.parse("aten.mm.default"), TensorMeta.of(DType.FLOAT32, npu, 4, 4), relu, w));
        GraphLowering lowering = GraphLowering.builder(b.build())
                .registry(LoweringRegistry.standard())
                .environment(RuntimeEnvironment.cpuOnly())
                .build();
        lowering.run();

        assertTrue(BackendRegistry.isRegistered("npu"));
        assertEquals("npu: buf0 buf1", lowering.codegen().code());
        assertEquals(List.of(2), scheduled);
    }
}
