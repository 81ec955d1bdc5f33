package io.surfworks.graphlower.ir;

import java.util.List;
import java.util.Objects;

/**
 * Layout of a buffer whose result is written into another buffer's storage.
 */
public final class MutationLayout extends Layout {

    private final Buffer target;

    public MutationLayout(Buffer target) {
        super(target.device(), target.dtype(), target.size(), target.layout().stride(), target.layout().offset());
        this.target = Objects.requireNonNull(target, "target cannot be null");
    }

    /**
     * The buffer that receives the writes.
     */
    public Buffer target() {
        return target;
    }

    @Override
    public boolean isFixed() {
        return true;
    }

    @Override
    public FixedLayout asFixed() {
        return target.layout().asFixed();
    }

    /**
     * Copies {@code src} into {@code dst} in place.
     *
     * <p>{@code dst} is marked mutated in {@code registry}, so its readers so far are realized
     * first. A copy of {@code src} is realized into a new buffer whose layout then redirects
     * into {@code dst}.
     *
     * @return the buffer performing the copy
     */
    public static ComputedBuffer realizeInto(IrNode src, Buffer dst, BufferRegistry registry) {
        registry.markBufferMutated(dst.name());
        IrNode value = src instanceof TensorBox box ? box.storage() : src;
        if (value instanceof StorageBox storage) {
            storage.realizeHint();
        }
        Pointwise copy = Pointwise.create("copy", dst.device(), dst.dtype(), dst.size(), List.of(value));
        StorageBox box = new StorageBox(copy, registry);
        box.realize();
        ComputedBuffer result = (ComputedBuffer) box.data();
        result.setLayout(new MutationLayout(dst));
        return result;
    }

    @Override
    public String toString() {
        return "MutationLayout(" + target.name() + ")";
    }
}
