package io.surfworks.graphlower.core.lowering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import io.surfworks.graphlower.graph.OpOverload;
import io.surfworks.graphlower.graph.SymbolicOp;
import io.surfworks.graphlower.ir.Buffer;
import io.surfworks.graphlower.ir.ConstantValue;
import io.surfworks.graphlower.ir.ExternKernel;
import io.surfworks.graphlower.ir.FixedLayout;
import io.surfworks.graphlower.ir.IrNode;
import io.surfworks.graphlower.ir.Pointwise;
import io.surfworks.graphlower.ir.Reduction;
import io.surfworks.graphlower.ir.ReinterpretView;
import io.surfworks.graphlower.ir.ShapeAsConstantBuffer;
import io.surfworks.graphlower.ir.StrideOrder;
import io.surfworks.graphlower.ir.TensorBox;
import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.ConstantTensor;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;

/**
 * The lowerings every registry starts with.
 *
 * <p>Pointwise operators and reductions become lazy {@link Pointwise} / {@link Reduction}
 * expressions; views reinterpret a realized buffer; GEMM and convolution become extern
 * kernels; a handful of operators fall back to the reference implementation.
 */
public final class StandardLowerings {

    private StandardLowerings() {
    }

    public static void registerAll(LoweringRegistry r) {
        registerPointwise(r);
        registerReductions(r);
        registerViews(r);
        registerInplace(r);
        registerExternKernels(r);
        registerSymbolic(r);
        registerFallbacks(r);
    }

    // ==================== Pointwise ====================

    private static void registerPointwise(LoweringRegistry r) {
        binary(r, "aten.add.Tensor", "add");
        binary(r, "aten.add.Scalar", "add");
        binary(r, "aten.sub.Tensor", "sub");
        binary(r, "aten.mul.Tensor", "mul");
        binary(r, "aten.mul.Scalar", "mul");
        binary(r, "aten.maximum.default", "maximum");
        binary(r, "aten.minimum.default", "minimum");
        r.register(op("aten.div.Tensor"), (ctx, args, kwargs) -> pointwise(ctx, "truediv", true, args));
        for (String name : new String[] {"relu", "sigmoid", "tanh", "exp", "neg", "abs", "sqrt", "clone"}) {
            r.register(op("aten." + name + ".default"), (ctx, args, kwargs) -> pointwise(ctx, name, false, args.subList(0, 1)));
        }
    }

    private static void binary(LoweringRegistry r, String target, String name) {
        r.register(op(target), (ctx, args, kwargs) -> {
            Object alpha = kwargs.get("alpha");
            List<Object> operands = new ArrayList<>(args.subList(0, 2));
            if (alpha != null && !isOne(alpha)) {
                Object other = operands.get(1);
                operands.set(1, other instanceof Number n && alpha instanceof Number a
                        ? (Object) (n.doubleValue() * a.doubleValue())
                        : pointwise(ctx, "mul", false, List.of(other, alpha)));
            }
            return pointwise(ctx, name, false, operands);
        });
    }

    /**
     * A lazy elementwise expression over broadcast operands.
     *
     * @param floatResult promote integer results to {@code float32}
     */
    static TensorBox pointwise(LoweringContext ctx, String name, boolean floatResult, List<Object> operands) {
        TensorBox first = null;
        DType dtype = null;
        List<SymExpr> size = List.of();
        boolean floatScalar = false;
        for (Object operand : operands) {
            if (operand instanceof TensorBox box) {
                if (first == null) {
                    first = box;
                }
                dtype = dtype == null ? box.dtype() : DType.promote(dtype, box.dtype());
                size = broadcast(size, box.size());
            } else if (operand instanceof Double || operand instanceof Float) {
                floatScalar = true;
            }
        }
        if (first == null) {
            throw new IllegalArgumentException(name + " needs at least one tensor operand");
        }
        if ((floatScalar || floatResult) && !dtype.isFloating() && !dtype.isComplex()) {
            dtype = DType.FLOAT32;
        }
        Device device = first.device();
        List<IrNode> inputs = new ArrayList<>(operands.size());
        for (Object operand : operands) {
            inputs.add(asOperand(operand, dtype, device));
        }
        return TensorBox.create(Pointwise.create(name, device, dtype, size, inputs), ctx);
    }

    private static IrNode asOperand(Object operand, DType dtype, Device device) {
        if (operand instanceof IrNode node) {
            return node;
        }
        if (operand instanceof SymExpr expr) {
            return new ShapeAsConstantBuffer(expr);
        }
        if (operand instanceof Boolean b) {
            return new ConstantValue(b ? 1 : 0, dtype, device);
        }
        if (operand instanceof Number n) {
            return new ConstantValue(n.doubleValue(), dtype, device);
        }
        throw new IllegalArgumentException("Unsupported pointwise operand: " + operand);
    }

    /**
     * Broadcast two shapes, aligning trailing dimensions.
     */
    static List<SymExpr> broadcast(List<SymExpr> a, List<SymExpr> b) {
        int rank = Math.max(a.size(), b.size());
        List<SymExpr> result = new ArrayList<>(rank);
        for (int i = 0; i < rank; i++) {
            int ia = i - (rank - a.size());
            int ib = i - (rank - b.size());
            SymExpr x = ia >= 0 ? a.get(ia) : SymExpr.of(1);
            SymExpr y = ib >= 0 ? b.get(ib) : SymExpr.of(1);
            if (x.equals(SymExpr.of(1))) {
                result.add(y);
            } else if (y.equals(SymExpr.of(1)) || x.equals(y)) {
                result.add(x);
            } else if (x.isConstant() && y.isConstant()) {
                throw new IllegalArgumentException("Cannot broadcast " + a + " with " + b);
            } else {
                result.add(x);
            }
        }
        return result;
    }

    /**
     * A small constant inlined as a lazy {@code tensor(...)} expression.
     */
    public static TensorBox inlineConstant(LoweringContext ctx, ConstantTensor value) {
        List<IrNode> elements = new ArrayList<>();
        for (double v : value.values()) {
            elements.add(new ConstantValue(v, value.dtype(), value.device()));
        }
        List<SymExpr> size = new ArrayList<>();
        for (long d : value.shape()) {
            size.add(SymExpr.of(d));
        }
        return TensorBox.create(Pointwise.create("tensor", value.device(), value.dtype(), size, elements), ctx);
    }

    // ==================== Reductions ====================

    private static void registerReductions(LoweringRegistry r) {
        r.register(op("aten.sum.dim_IntList"), (ctx, args, kwargs) -> reduction(ctx, "sum", args, kwargs));
        r.register(op("aten.amax.default"), (ctx, args, kwargs) -> reduction(ctx, "amax", args, kwargs));
        r.register(op("aten.mean.dim"), (ctx, args, kwargs) -> reduction(ctx, "mean", args, kwargs));
    }

    private static TensorBox reduction(LoweringContext ctx, String type, List<Object> args, Map<String, Object> kwargs) {
        TensorBox x = (TensorBox) args.get(0);
        Object dimsArg = args.size() > 1 ? args.get(1) : kwargs.get("dim");
        Object keepArg = args.size() > 2 ? args.get(2) : kwargs.get("keepdim");
        boolean keepdim = Boolean.TRUE.equals(keepArg);

        int rank = x.rank();
        boolean[] reduced = new boolean[rank];
        if (dimsArg instanceof List<?> dims && !dims.isEmpty()) {
            for (Object d : dims) {
                reduced[normalizeDim(((Number) d).intValue(), rank)] = true;
            }
        } else {
            Arrays.fill(reduced, true);
        }

        List<SymExpr> ranges = new ArrayList<>();
        List<SymExpr> reductionRanges = new ArrayList<>();
        for (int d = 0; d < rank; d++) {
            if (reduced[d]) {
                reductionRanges.add(x.size().get(d));
                if (keepdim) {
                    ranges.add(SymExpr.of(1));
                }
            } else {
                ranges.add(x.size().get(d));
            }
        }
        DType dtype = "mean".equals(type) && !x.dtype().isFloating() ? DType.FLOAT32 : x.dtype();
        return TensorBox.create(Reduction.create(type, x.device(), dtype, ranges, reductionRanges, x), ctx);
    }

    // ==================== Views ====================

    private static void registerViews(LoweringRegistry r) {
        r.register(AtenOps.VIEW, StandardLowerings::view);
        r.register(AtenOps.PERMUTE, StandardLowerings::permute);
        r.register(AtenOps.AS_STRIDED, StandardLowerings::asStrided);
    }

    private static Object view(LoweringContext ctx, List<Object> args, Map<String, Object> kwargs) {
        TensorBox x = (TensorBox) args.get(0);
        List<SymExpr> size = inferSize(toExprs((List<?>) args.get(1)), numel(x.size()));
        ReinterpretView base = baseView(ctx, x);
        if (!base.layout().isContiguous()) {
            base = baseView(ctx, ExternKernel.copyInput(base, ctx));
        }
        FixedLayout layout = new FixedLayout(base.device(), base.dtype(), size,
                StrideOrder.contiguousStrides(size), base.layout().offset());
        return TensorBox.create(new ReinterpretView(base.data(), layout), ctx);
    }

    private static Object permute(LoweringContext ctx, List<Object> args, Map<String, Object> kwargs) {
        TensorBox x = (TensorBox) args.get(0);
        List<?> dims = (List<?>) args.get(1);
        ReinterpretView base = baseView(ctx, x);
        int rank = base.rank();
        if (dims.size() != rank) {
            throw new IllegalArgumentException("permute expects " + rank + " dims, got " + dims);
        }
        List<SymExpr> size = new ArrayList<>(rank);
        List<SymExpr> stride = new ArrayList<>(rank);
        for (Object d : dims) {
            int dim = normalizeDim(((Number) d).intValue(), rank);
            size.add(base.layout().size().get(dim));
            stride.add(base.layout().stride().get(dim));
        }
        FixedLayout layout = new FixedLayout(base.device(), base.dtype(), size, stride, base.layout().offset());
        return TensorBox.create(new ReinterpretView(base.data(), layout), ctx);
    }

    private static Object asStrided(LoweringContext ctx, List<Object> args, Map<String, Object> kwargs) {
        TensorBox x = (TensorBox) args.get(0);
        List<SymExpr> size = toExprs((List<?>) args.get(1));
        List<SymExpr> stride = toExprs((List<?>) args.get(2));
        ReinterpretView base = baseView(ctx, x);
        Object offsetArg = args.size() > 3 ? args.get(3) : kwargs.get("storage_offset");
        SymExpr offset = offsetArg != null ? toExpr(offsetArg) : base.layout().offset();
        FixedLayout layout = new FixedLayout(base.device(), base.dtype(), size, stride, offset);
        return TensorBox.create(new ReinterpretView(base.data(), layout), ctx);
    }

    /**
     * A view covering the whole realized storage of {@code x}. Flexible layouts are fixed
     * to row-major first.
     */
    private static ReinterpretView baseView(LoweringContext ctx, IrNode x) {
        IrNode data = ExternKernel.realizeInput(x, ctx);
        if (data instanceof ReinterpretView view) {
            return view;
        }
        Buffer buffer = (Buffer) data;
        if (buffer.hasFlexibleLayout()) {
            buffer.freezeLayoutWithStrideOrder(StrideOrder.contiguous(buffer.rank()));
        }
        return new ReinterpretView(buffer, buffer.layout().asFixed());
    }

    private static List<SymExpr> inferSize(List<SymExpr> requested, SymExpr numel) {
        int inferred = -1;
        SymExpr known = SymExpr.of(1);
        for (int i = 0; i < requested.size(); i++) {
            if (requested.get(i).equals(SymExpr.of(-1))) {
                if (inferred >= 0) {
                    throw new IllegalArgumentException("Only one dimension can be inferred: " + requested);
                }
                inferred = i;
            } else {
                known = known.times(requested.get(i));
            }
        }
        if (inferred < 0) {
            return requested;
        }
        List<SymExpr> size = new ArrayList<>(requested);
        size.set(inferred, numel.floorDiv(known));
        return size;
    }

    // ==================== In-place ====================

    private static void registerInplace(LoweringRegistry r) {
        r.register(AtenOps.COPY_, (ctx, args, kwargs) -> {
            TensorBox dst = (TensorBox) args.get(0);
            // always a fresh copy: dst never shares the source's storage
            IrNode input = asOperand(args.get(1), dst.dtype(), dst.device());
            TensorBox value = TensorBox.create(
                    Pointwise.create("copy", dst.device(), dst.dtype(), dst.size(), List.of(input)), ctx);
            return mutate(ctx, dst, value);
        });
        r.register(AtenOps.ADD_, (ctx, args, kwargs) -> {
            TensorBox self = (TensorBox) args.get(0);
            return mutate(ctx, self, (TensorBox) r.get(op("aten.add.Tensor")).lower(ctx, args, kwargs));
        });
    }

    /**
     * Rebinds {@code dst} to {@code value}. Storage that already exists is marked mutated
     * first, which realizes its readers so far.
     */
    private static TensorBox mutate(LoweringContext ctx, TensorBox dst, TensorBox value) {
        if (dst.isRealized()) {
            ctx.markBufferMutated(dst.name());
        }
        dst.setStorage(value.storage());
        return dst;
    }

    // ==================== Extern kernels ====================

    private static void registerExternKernels(LoweringRegistry r) {
        r.register(AtenOps.MM, ExternKernels::mm);
        r.register(AtenOps.INT_MM, ExternKernels::intMm);
        r.register(AtenOps.ADDMM, ExternKernels::addmm);
        r.register(AtenOps.BMM, ExternKernels::bmm);
        r.register(AtenOps.CONVOLUTION, ExternKernels::convolution);
        for (OpOverload op : List.of(AtenOps.MM, AtenOps.INT_MM, AtenOps.ADDMM, AtenOps.BMM, AtenOps.CONVOLUTION)) {
            r.addNeedsRealizedInputs(op);
        }
    }

    // ==================== Symbolic sizes ====================

    private static void registerSymbolic(LoweringRegistry r) {
        r.register(AtenOps.SYM_SIZE, (ctx, args, kwargs) -> {
            IrNode x = (IrNode) args.get(0);
            return x.size().get(normalizeDim(((Number) args.get(1)).intValue(), x.rank()));
        });
        r.register(AtenOps.SYM_STRIDE, (ctx, args, kwargs) -> {
            ReinterpretView base = baseView(ctx, (IrNode) args.get(0));
            return base.layout().stride().get(normalizeDim(((Number) args.get(1)).intValue(), base.rank()));
        });
        r.register(AtenOps.SYM_NUMEL, (ctx, args, kwargs) -> numel(((IrNode) args.get(0)).size()));
        for (SymbolicOp op : SymbolicOp.values()) {
            r.register(op, (ctx, args, kwargs) -> op.apply(toExprs(args)));
        }
    }

    // ==================== Fallbacks ====================

    private static void registerFallbacks(LoweringRegistry r) {
        r.makeFallback(AtenOps.CONVOLUTION_BACKWARD, LayoutConstraints.constrainToFxStrides());
        r.makeFallback(op("aten._cudnn_rnn.default"), LayoutConstraints.requireContiguous());
        r.makeFallback(op("aten.sort.default"));
        r.makeFallback(op("aten.topk.default"));
        for (OpOverload attention : AtenOps.LAYOUT_SENSITIVE_ATTENTION) {
            r.makeFallback(attention, LayoutConstraints.requireContiguous());
        }
    }

    // ==================== Helpers ====================

    private static OpOverload op(String name) {
        return OpOverload.parse(name);
    }

    private static boolean isOne(Object value) {
        return value instanceof Number n && n.doubleValue() == 1.0;
    }

    static int normalizeDim(int dim, int rank) {
        int d = dim < 0 ? dim + rank : dim;
        if (d < 0 || d >= Math.max(rank, 1)) {
            throw new IndexOutOfBoundsException("Dimension " + dim + " out of range for rank " + rank);
        }
        return d;
    }

    static SymExpr numel(List<SymExpr> size) {
        SymExpr n = SymExpr.of(1);
        for (SymExpr d : size) {
            n = n.times(d);
        }
        return n;
    }

    public static SymExpr toExpr(Object value) {
        if (value instanceof SymExpr expr) {
            return expr;
        }
        if (value instanceof Boolean b) {
            return SymExpr.of(b ? 1 : 0);
        }
        if (value instanceof Number n) {
            return SymExpr.of(n.longValue());
        }
        throw new IllegalArgumentException("Not an integer size: " + value);
    }

    static List<SymExpr> toExprs(List<?> values) {
        List<SymExpr> exprs = new ArrayList<>(values.size());
        for (Object v : values) {
            exprs.add(toExpr(v));
        }
        return exprs;
    }
}
