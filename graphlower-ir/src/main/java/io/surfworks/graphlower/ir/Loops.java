package io.surfworks.graphlower.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * A deferred per-element computation over a loop nest.
 *
 * <p>The computation is kept as an operation name applied to operand values. Operands that
 * are not yet realized are inlined: their reads and operations count towards this node's.
 * Tensor operands are held through their {@link StorageBox}.
 */
public abstract class Loops extends IrNode {

    private final String op;
    private final Device device;
    private final DType dtype;
    private final List<SymExpr> ranges;
    private final List<IrNode> inputs;

    protected Loops(String op, Device device, DType dtype, List<SymExpr> ranges, List<IrNode> inputs) {
        this.op = Objects.requireNonNull(op, "op cannot be null");
        this.device = device;
        this.dtype = dtype;
        this.ranges = List.copyOf(ranges);
        List<IrNode> operands = new ArrayList<>(inputs.size());
        for (IrNode input : inputs) {
            // bind to the current storage so a later in-place rebinding of the tensor is not observed
            operands.add(input instanceof TensorBox box ? box.storage() : input);
        }
        this.inputs = List.copyOf(operands);
    }

    /**
     * Name of the elementwise operation, e.g. {@code add} or {@code relu}.
     */
    public String op() {
        return op;
    }

    public List<IrNode> inputs() {
        return inputs;
    }

    @Override
    public List<SymExpr> size() {
        return ranges;
    }

    @Override
    public DType dtype() {
        return dtype;
    }

    @Override
    public Device device() {
        return device;
    }

    @Override
    public List<String> readNames() {
        List<String> reads = new ArrayList<>();
        for (IrNode input : inputs) {
            reads.addAll(input.readNames());
        }
        return reads;
    }

    @Override
    public int opCount() {
        int count = 1;
        for (IrNode input : inputs) {
            count += input.opCount();
        }
        return count;
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder(op).append('(');
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(inputs.get(i).describe());
        }
        return sb.append(')').toString();
    }
}
