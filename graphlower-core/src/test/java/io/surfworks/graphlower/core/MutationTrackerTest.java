package io.surfworks.graphlower.core;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.graphlower.ir.FixedLayout;
import io.surfworks.graphlower.ir.InputBuffer;
import io.surfworks.graphlower.ir.Pointwise;
import io.surfworks.graphlower.ir.TensorBox;
import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

import static io.surfworks.graphlower.core.GraphFixtures.STATIC;
import static io.surfworks.graphlower.core.GraphFixtures.lowering;
import static io.surfworks.graphlower.core.GraphFixtures.reluOfAdd;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MutationTracker")
class MutationTrackerTest {

    private static final List<SymExpr> SIZE = List.of(SymExpr.of(4), SymExpr.of(8));

    private GraphLowering registry;
    private TensorBox x;
    private MutationTracker tracker;

    @BeforeEach
    void setUp() {
        registry = lowering(reluOfAdd(STATIC)).build();
        x = TensorBox.create(new InputBuffer("x", FixedLayout.contiguous(Device.cpu(), DType.FLOAT32, SIZE)), registry);
        tracker = new MutationTracker();
    }

    private TensorBox pointwise(String op, TensorBox... inputs) {
        return TensorBox.create(Pointwise.create(op, Device.cpu(), DType.FLOAT32, SIZE, List.of(inputs)), registry);
    }

    @Test
    @DisplayName("readers recorded before a mutation are realized")
    void realizesEarlierReaders() {
        TensorBox reader = pointwise("relu", x);
        tracker.registerUsersOf(reader);

        tracker.markBufferMutated("x");

        assertTrue(reader.isRealized());
        assertEquals("buf0 = relu(x)", registry.buffers().get(0).describe());
        assertEquals(Set.of("x"), tracker.mutatedBuffers());
    }

    @Test
    @DisplayName("readers recorded after a mutation stay lazy")
    void laterReadersUntouched() {
        tracker.markBufferMutated("x");
        TensorBox reader = pointwise("relu", x);
        tracker.registerUsersOf(reader);

        assertFalse(reader.isRealized());
        assertTrue(registry.buffers().isEmpty());
    }

    @Test
    @DisplayName("a value reading a buffer twice is recorded once")
    void distinctReads() {
        TensorBox reader = pointwise("add", x, x);
        tracker.registerUsersOf(reader);

        assertEquals(1, tracker.usersOf("x").size());
        assertSame(reader, tracker.usersOf("x").get(0));
    }

    @Test
    @DisplayName("each tensor of a list value is recorded")
    void listValues() {
        TensorBox first = pointwise("relu", x);
        TensorBox second = pointwise("neg", x);
        tracker.registerUsersOf(List.of(first, second));

        assertEquals(List.of(first, second), tracker.usersOf("x"));
        assertTrue(tracker.usersOf("y").isEmpty());
    }
}
