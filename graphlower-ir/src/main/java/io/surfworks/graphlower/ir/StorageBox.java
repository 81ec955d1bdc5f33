package io.surfworks.graphlower.ir;

import java.util.List;
import java.util.Objects;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * Mutable indirection between a tensor and its storage.
 *
 * <p>Holds either a lazy {@link Loops} expression or, once realized, the buffer (or view)
 * that stores the value. Realizing registers a {@link ComputedBuffer} with the owning
 * {@link BufferRegistry}; every reader of this box sees the buffer from then on.
 */
public final class StorageBox extends IrNode {

    private final BufferRegistry owner;
    private IrNode data;

    public StorageBox(IrNode data, BufferRegistry owner) {
        this.data = Objects.requireNonNull(data, "data cannot be null");
        this.owner = Objects.requireNonNull(owner, "owner cannot be null");
    }

    public IrNode data() {
        return data;
    }

    public boolean isRealized() {
        return data instanceof Buffer || data instanceof ReinterpretView;
    }

    /**
     * Materializes the stored computation into a named buffer.
     *
     * @return the storage name, or null for values that have no storage
     */
    public String realize() {
        if (data instanceof Buffer buffer) {
            return buffer.name();
        }
        if (data instanceof ReinterpretView view) {
            return view.name();
        }
        if (data instanceof Loops loops) {
            ComputedBuffer buffer = new ComputedBuffer(new FlexibleLayout(loops.device(), loops.dtype(), loops.size()), loops);
            buffer.addOrigins(loops.origins());
            buffer.setOriginNode(loops.originNode());
            String name = owner.registerBuffer(buffer);
            data = buffer;
            return name;
        }
        return null;
    }

    /**
     * Realizes values that read from several buffers; called when a consumer prefers
     * realized inputs.
     */
    public void realizeHint() {
        if (data instanceof Loops && numReads() > 1) {
            realize();
        }
    }

    /**
     * Realizes a value consumed {@code users} times whose recomputation per consumer would
     * be too expensive.
     */
    public void markReuse(int users) {
        if (users <= 1 || !(data instanceof Loops)) {
            return;
        }
        RealizeThresholds t = owner.thresholds();
        if (numReads() > t.reads() || hasLargeInnerFn()) {
            realize();
        }
    }

    /**
     * True if inlining this value into further pointwise consumers would read too much.
     */
    public boolean hasExceededMaxReads() {
        RealizeThresholds t = owner.thresholds();
        return data instanceof Pointwise && (numReads() > t.accReads() || hasLargeInnerFn());
    }

    public int numReads() {
        return data.readNames().size();
    }

    public boolean hasLargeInnerFn() {
        return data.opCount() > owner.thresholds().opcount();
    }

    @Override
    public List<SymExpr> size() {
        return data.size();
    }

    @Override
    public DType dtype() {
        return data.dtype();
    }

    @Override
    public Device device() {
        return data.device();
    }

    @Override
    public List<String> readNames() {
        return data.readNames();
    }

    @Override
    public int opCount() {
        return isRealized() ? 0 : data.opCount();
    }

    @Override
    public String describe() {
        if (data instanceof Buffer buffer) {
            return buffer.name();
        }
        return data.describe();
    }
}
