package io.surfworks.graphlower.core.lowering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.graphlower.graph.GraphNode;
import io.surfworks.graphlower.graph.OpOverload;
import io.surfworks.graphlower.ir.Buffer;
import io.surfworks.graphlower.ir.ExternKernel;
import io.surfworks.graphlower.ir.ExternKernelNode;
import io.surfworks.graphlower.ir.FixedLayout;
import io.surfworks.graphlower.ir.IrNode;
import io.surfworks.graphlower.ir.Layout;
import io.surfworks.graphlower.ir.MultiOutput;
import io.surfworks.graphlower.ir.MultiOutputLayout;
import io.surfworks.graphlower.ir.MutationLayout;
import io.surfworks.graphlower.ir.ReinterpretView;
import io.surfworks.graphlower.ir.StrideOrder;
import io.surfworks.graphlower.ir.TensorBox;
import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;
import io.surfworks.graphlower.tensor.ExampleValue;
import io.surfworks.graphlower.tensor.TensorMeta;
import io.surfworks.graphlower.tensor.TupleValue;

/**
 * Lowerings that produce {@link ExternKernel} buffers: library GEMMs, convolution and
 * fallbacks to the reference operator implementation.
 */
final class ExternKernels {

    private ExternKernels() {
    }

    /**
     * Calls {@code op}'s reference implementation. The result layout comes from the example
     * value of the node being lowered; tuple results yield one {@link MultiOutput} per
     * tensor element. In-place operators write into their first argument and return it.
     */
    static Object fallback(LoweringContext ctx, OpOverload op, List<Object> args, Map<String, Object> kwargs) {
        ctx.warnFallback(op.packetName());

        List<IrNode> inputs = new ArrayList<>();
        List<Object> constantArgs = new ArrayList<>();
        for (Object arg : args) {
            collect(ctx, arg, inputs, constantArgs);
        }
        Map<String, Object> constantKwargs = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : kwargs.entrySet()) {
            if (e.getValue() instanceof TensorBox box) {
                inputs.add(ExternKernel.realizeInput(box, ctx));
            } else {
                constantKwargs.put(e.getKey(), e.getValue());
            }
        }

        if (op.isInplace() && !args.isEmpty() && args.get(0) instanceof TensorBox self) {
            Buffer target = storageOf(inputs.get(0));
            ctx.markBufferMutated(target.name());
            register(ctx, new ExternKernel(new MutationLayout(target), op.name(), inputs, constantArgs,
                    constantKwargs, true));
            return self;
        }

        GraphNode node = ctx.currentNode();
        ExampleValue meta = node != null ? node.meta() : null;
        if (meta instanceof TensorMeta t) {
            ExternKernel kernel = new ExternKernel(ctx.layoutFromMeta(t), op.name(), inputs, constantArgs,
                    constantKwargs, true);
            register(ctx, kernel);
            return TensorBox.create(kernel, ctx);
        }

        Device device = inputs.isEmpty() ? Device.cpu() : inputs.get(0).device();
        ExternKernel kernel = new ExternKernel(new MultiOutputLayout(device), op.name(), inputs, constantArgs,
                constantKwargs, true);
        register(ctx, kernel);
        if (meta instanceof TupleValue tuple) {
            List<Object> outputs = new ArrayList<>(tuple.size());
            for (int i = 0; i < tuple.size(); i++) {
                if (tuple.get(i) instanceof TensorMeta element) {
                    MultiOutput output = new MultiOutput(ctx.layoutFromMeta(element), kernel, i);
                    ctx.registerBuffer(output);
                    outputs.add(TensorBox.create(output, ctx));
                } else {
                    outputs.add(null);
                }
            }
            return outputs;
        }
        return null;
    }

    /**
     * {@code mm(a, b)}: {@code [m, k] x [k, n] -> [m, n]}.
     */
    static Object mm(LoweringContext ctx, List<Object> args, Map<String, Object> kwargs) {
        IrNode a = ExternKernel.realizeInput(args.get(0), ctx);
        IrNode b = ExternKernel.realizeInput(args.get(1), ctx);
        List<SymExpr> size = List.of(a.size().get(0), b.size().get(1));
        return gemm(ctx, "extern_kernels.mm", List.of(a, b), size, DType.promote(a.dtype(), b.dtype()));
    }

    /**
     * {@code _int_mm(a, b)}: int8 operands with an int32 result.
     */
    static Object intMm(LoweringContext ctx, List<Object> args, Map<String, Object> kwargs) {
        IrNode a = ExternKernel.realizeInput(args.get(0), ctx);
        IrNode b = ExternKernel.realizeInput(args.get(1), ctx);
        List<SymExpr> size = List.of(a.size().get(0), b.size().get(1));
        return gemm(ctx, "extern_kernels._int_mm", List.of(a, b), size, DType.INT32);
    }

    /**
     * {@code addmm(bias, a, b)}: {@code bias + a x b}.
     */
    static Object addmm(LoweringContext ctx, List<Object> args, Map<String, Object> kwargs) {
        IrNode bias = ExternKernel.realizeInput(args.get(0), ctx);
        IrNode a = ExternKernel.realizeInput(args.get(1), ctx);
        IrNode b = ExternKernel.realizeInput(args.get(2), ctx);
        List<SymExpr> size = List.of(a.size().get(0), b.size().get(1));
        return gemm(ctx, "extern_kernels.addmm", List.of(bias, a, b), size, DType.promote(a.dtype(), b.dtype()));
    }

    /**
     * {@code bmm(a, b)}: {@code [B, m, k] x [B, k, n] -> [B, m, n]}.
     */
    static Object bmm(LoweringContext ctx, List<Object> args, Map<String, Object> kwargs) {
        IrNode a = ExternKernel.realizeInput(args.get(0), ctx);
        IrNode b = ExternKernel.realizeInput(args.get(1), ctx);
        List<SymExpr> size = List.of(a.size().get(0), a.size().get(1), b.size().get(2));
        return gemm(ctx, "extern_kernels.bmm", List.of(a, b), size, DType.promote(a.dtype(), b.dtype()));
    }

    /**
     * {@code convolution(x, weight, bias, stride, padding, dilation, transposed, output_padding, groups)}.
     *
     * <p>With layout optimization active, 4-D convolutions read and write channels-last.
     */
    static Object convolution(LoweringContext ctx, List<Object> args, Map<String, Object> kwargs) {
        GraphNode node = ctx.currentNode();
        if (node == null || !(node.meta() instanceof TensorMeta meta)) {
            throw new IllegalStateException("convolution needs a tensor example value to size its output");
        }
        List<SymExpr> size = ctx.layoutFromMeta(meta).size();
        boolean channelsLast = ctx.layoutOpt() && size.size() == 4;

        TensorBox x = (TensorBox) args.get(0);
        if (channelsLast) {
            x = ExternKernel.requireStrideOrder(x, StrideOrder.NHWC, ctx);
        }
        List<IrNode> inputs = new ArrayList<>();
        inputs.add(ExternKernel.realizeInput(x, ctx));
        inputs.add(ExternKernel.realizeInput(args.get(1), ctx));
        if (args.size() > 2 && args.get(2) != null) {
            inputs.add(ExternKernel.realizeInput(args.get(2), ctx));
        }
        List<Object> constantArgs = args.size() > 3 ? new ArrayList<>(args.subList(3, args.size())) : List.of();

        int[] order = channelsLast ? StrideOrder.NHWC : StrideOrder.contiguous(size.size());
        FixedLayout layout = new FixedLayout(meta.device(), meta.dtype(), size, StrideOrder.fillOrdered(size, order));
        ExternKernel kernel = new ExternKernel(layout, "extern_kernels.convolution", inputs, constantArgs,
                Map.of(), false);
        register(ctx, kernel);
        if (channelsLast) {
            ctx.noteChannelsLastConv();
        }
        return TensorBox.create(kernel, ctx);
    }

    private static TensorBox gemm(LoweringContext ctx, String name, List<IrNode> inputs, List<SymExpr> size,
                                  DType dtype) {
        Layout layout = FixedLayout.contiguous(inputs.get(0).device(), dtype, size);
        ExternKernel kernel = new ExternKernel(layout, name, inputs, List.of(), Map.of(), false);
        register(ctx, kernel);
        return TensorBox.create(kernel, ctx);
    }

    private static void register(LoweringContext ctx, ExternKernel kernel) {
        String name = ctx.registerBuffer(kernel);
        List<String> rendered = new ArrayList<>();
        for (Object arg : kernel.constantArgs()) {
            rendered.add(String.valueOf(arg));
        }
        for (Map.Entry<String, Object> e : kernel.kwargs().entrySet()) {
            rendered.add(e.getKey() + "=" + e.getValue());
        }
        ctx.recordExternKernel(new ExternKernelNode(name, kernel.kernel(), kernel.inputNames(), rendered));
    }

    private static void collect(LoweringContext ctx, Object arg, List<IrNode> inputs, List<Object> constantArgs) {
        if (arg instanceof TensorBox box) {
            inputs.add(ExternKernel.realizeInput(box, ctx));
        } else if (arg instanceof List<?> list && list.stream().anyMatch(TensorBox.class::isInstance)) {
            for (Object element : list) {
                collect(ctx, element, inputs, constantArgs);
            }
        } else {
            constantArgs.add(arg);
        }
    }

    private static Buffer storageOf(IrNode realized) {
        if (realized instanceof ReinterpretView view) {
            return view.data();
        }
        return (Buffer) realized;
    }
}
