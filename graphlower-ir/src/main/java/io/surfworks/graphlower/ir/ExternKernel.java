package io.surfworks.graphlower.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.surfworks.graphlower.tensor.ConstantTensor;

/**
 * A buffer produced by calling an opaque kernel (a library GEMM, a convolution or a
 * fallback to the reference operator implementation).
 *
 * <p>Tensor inputs are always realized. The static helpers here coerce arbitrary lowered
 * values into that form.
 */
public final class ExternKernel extends Buffer {

    private final String kernel;
    private final List<IrNode> inputs;
    private final List<Object> constantArgs;
    private final Map<String, Object> kwargs;
    private final boolean fallback;

    public ExternKernel(Layout layout, String kernel, List<IrNode> inputs, List<Object> constantArgs,
                        Map<String, Object> kwargs, boolean fallback) {
        super(null, layout);
        this.kernel = Objects.requireNonNull(kernel, "kernel cannot be null");
        this.inputs = List.copyOf(inputs);
        this.constantArgs = new ArrayList<>(constantArgs);
        this.kwargs = new LinkedHashMap<>(kwargs);
        this.fallback = fallback;
    }

    /**
     * Kernel called, e.g. {@code extern_kernels.mm} or {@code aten.sort.default}.
     */
    public String kernel() {
        return kernel;
    }

    public List<IrNode> inputs() {
        return inputs;
    }

    public List<Object> constantArgs() {
        return Collections.unmodifiableList(constantArgs);
    }

    public Map<String, Object> kwargs() {
        return Collections.unmodifiableMap(kwargs);
    }

    /**
     * True if this kernel falls back to the reference operator implementation.
     */
    public boolean isFallback() {
        return fallback;
    }

    /**
     * Buffers this kernel reads.
     */
    public List<String> inputNames() {
        List<String> names = new ArrayList<>();
        for (IrNode input : inputs) {
            names.addAll(input.readNames());
        }
        return names;
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder(name()).append(" = ").append(kernel).append('(');
        List<String> parts = new ArrayList<>();
        for (IrNode input : inputs) {
            parts.add(input.describe());
        }
        for (Object arg : constantArgs) {
            parts.add(String.valueOf(arg));
        }
        for (Map.Entry<String, Object> e : kwargs.entrySet()) {
            parts.add(e.getKey() + "=" + e.getValue());
        }
        return sb.append(String.join(", ", parts)).append(')').toString();
    }

    // ==================== Input coercion ====================

    /**
     * Realizes a lowered value so that it can be passed to an opaque kernel.
     *
     * @return a {@link Buffer} or {@link ReinterpretView}
     */
    public static IrNode realizeInput(Object value, BufferRegistry registry) {
        if (value instanceof TensorBox box) {
            return realizeInput(box.storage(), registry);
        }
        if (value instanceof StorageBox storage) {
            storage.realize();
            return storage.data();
        }
        if (value instanceof Buffer || value instanceof ReinterpretView) {
            return (IrNode) value;
        }
        if (value instanceof ConstantValue constant) {
            ConstantTensor tensor = ConstantTensor.scalar(constant.dtype(), constant.device(), constant.value());
            return realizeInput(registry.addTensorConstant(tensor, null), registry);
        }
        throw new IllegalArgumentException("Cannot realize "
                + (value == null ? "null" : value.getClass().getSimpleName()) + " as a kernel input");
    }

    /**
     * Returns a box over a realized buffer holding a copy of {@code value}.
     */
    public static TensorBox copyInput(IrNode value, BufferRegistry registry) {
        Pointwise copy = Pointwise.create("copy", value.device(), value.dtype(), value.size(), List.of(value));
        TensorBox box = TensorBox.create(copy, registry);
        box.realize();
        return box;
    }

    /**
     * Ensures {@code value} is realized with strides in {@code order}, copying if its
     * layout is already fixed differently.
     */
    public static TensorBox requireStrideOrder(TensorBox value, int[] order, BufferRegistry registry) {
        StorageBox storage = value.storage();
        if (!storage.isRealized()) {
            storage.realize();
        }
        IrNode data = storage.data();
        if (data instanceof Buffer buffer) {
            if (buffer.hasFlexibleLayout()) {
                buffer.freezeLayoutWithStrideOrder(order);
                return value;
            }
            if (StrideOrder.matches(buffer.layout(), order, registry::sizeHint)) {
                return value;
            }
        } else if (data instanceof ReinterpretView view
                && StrideOrder.matches(view.layout(), order, registry::sizeHint)) {
            return value;
        }
        FixedLayout layout = new FixedLayout(data.device(), data.dtype(), data.size(),
                StrideOrder.fillOrdered(data.size(), order));
        Pointwise copy = Pointwise.create("copy", data.device(), data.dtype(), data.size(), List.of(data));
        ComputedBuffer buffer = new ComputedBuffer(layout, copy);
        registry.registerBuffer(buffer);
        return TensorBox.create(buffer, registry);
    }

    public static TensorBox requireContiguous(TensorBox value, BufferRegistry registry) {
        return requireStrideOrder(value, StrideOrder.contiguous(value.rank()), registry);
    }
}
