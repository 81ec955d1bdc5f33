package io.surfworks.graphlower.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.ConstantTensor;

/**
 * Buffer registry for IR tests: names buffers in order and records mutations.
 */
final class RecordingRegistry implements BufferRegistry {

    final List<Buffer> buffers = new ArrayList<>();
    final List<String> mutated = new ArrayList<>();
    final List<ConstantTensor> constants = new ArrayList<>();
    private final RealizeThresholds thresholds;

    RecordingRegistry() {
        this(RealizeThresholds.DEFAULT);
    }

    RecordingRegistry(RealizeThresholds thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public String registerBuffer(Buffer buffer) {
        String name = "buf" + buffers.size();
        buffer.setName(name);
        buffers.add(buffer);
        return name;
    }

    @Override
    public void markBufferMutated(String name) {
        mutated.add(name);
    }

    @Override
    public TensorBox addTensorConstant(ConstantTensor value, String name) {
        constants.add(value);
        String constantName = "constant" + (constants.size() - 1);
        FixedLayout layout = new FixedLayout(value.device(), value.dtype(), List.of(), List.of());
        return TensorBox.create(new ConstantBuffer(constantName, layout), this);
    }

    @Override
    public long sizeHint(SymExpr expr) {
        return expr.evaluate(Map.of());
    }

    @Override
    public RealizeThresholds thresholds() {
        return thresholds;
    }
}
