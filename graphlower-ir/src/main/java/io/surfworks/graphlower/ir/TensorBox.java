package io.surfworks.graphlower.ir;

import java.util.List;
import java.util.Objects;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * The value a lowering returns for a tensor. Wraps a {@link StorageBox}; in-place
 * operators rebind the box to a new storage.
 */
public final class TensorBox extends IrNode {

    private StorageBox storage;

    public TensorBox(StorageBox storage) {
        this.storage = Objects.requireNonNull(storage, "storage cannot be null");
    }

    public static TensorBox create(IrNode data, BufferRegistry owner) {
        return new TensorBox(new StorageBox(data, owner));
    }

    public StorageBox storage() {
        return storage;
    }

    /**
     * The innermost value: an expression, buffer or view.
     */
    public IrNode data() {
        return storage.data();
    }

    /**
     * Rebinds this tensor to new storage, used by in-place operators.
     */
    public void setStorage(StorageBox storage) {
        this.storage = Objects.requireNonNull(storage, "storage cannot be null");
    }

    public String realize() {
        return storage.realize();
    }

    public boolean isRealized() {
        return storage.isRealized();
    }

    /**
     * Storage name if realized, otherwise null.
     */
    public String name() {
        IrNode data = storage.data();
        if (data instanceof Buffer buffer) {
            return buffer.name();
        }
        if (data instanceof ReinterpretView view) {
            return view.name();
        }
        return null;
    }

    @Override
    public List<SymExpr> size() {
        return storage.size();
    }

    @Override
    public DType dtype() {
        return storage.dtype();
    }

    @Override
    public Device device() {
        return storage.device();
    }

    @Override
    public List<String> readNames() {
        return storage.readNames();
    }

    @Override
    public int opCount() {
        return storage.opCount();
    }

    @Override
    public String describe() {
        return storage.describe();
    }
}
