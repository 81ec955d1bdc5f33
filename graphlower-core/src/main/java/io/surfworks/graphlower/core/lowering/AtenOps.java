package io.surfworks.graphlower.core.lowering;

import java.util.List;

import io.surfworks.graphlower.graph.OpOverload;

/**
 * Operator overloads that lowering treats specially.
 */
public final class AtenOps {

    private AtenOps() {
    }

    public static final OpOverload CONVOLUTION = op("aten.convolution.default");
    public static final OpOverload CONVOLUTION_BACKWARD = op("aten.convolution_backward.default");
    public static final OpOverload MM = op("aten.mm.default");
    public static final OpOverload INT_MM = op("aten._int_mm.default");
    public static final OpOverload ADDMM = op("aten.addmm.default");
    public static final OpOverload BMM = op("aten.bmm.default");

    public static final OpOverload AS_STRIDED = op("aten.as_strided.default");
    public static final OpOverload AS_STRIDED_ = op("aten.as_strided_.default");
    public static final OpOverload AS_STRIDED_SCATTER = op("aten.as_strided_scatter.default");
    public static final OpOverload VIEW = op("aten.view.default");
    public static final OpOverload PERMUTE = op("aten.permute.default");

    public static final OpOverload SYM_SIZE = op("aten.sym_size.int");
    public static final OpOverload SYM_STRIDE = op("aten.sym_stride.int");
    public static final OpOverload SYM_NUMEL = op("aten.sym_numel.default");

    public static final OpOverload COPY_ = op("aten.copy_.default");
    public static final OpOverload ADD_ = op("aten.add_.Tensor");
    public static final OpOverload VIEW_AS_COMPLEX = op("aten.view_as_complex.default");
    public static final OpOverload LIFT_FRESH_COPY = op("aten.lift_fresh_copy.default");

    public static final OpOverload SDPA_FLASH = op("aten._scaled_dot_product_flash_attention.default");
    public static final OpOverload SDPA_FLASH_BACKWARD = op("aten._scaled_dot_product_flash_attention_backward.default");
    public static final OpOverload SDPA_EFFICIENT = op("aten._scaled_dot_product_efficient_attention.default");
    public static final OpOverload SDPA_EFFICIENT_BACKWARD = op("aten._scaled_dot_product_efficient_attention_backward.default");

    /** Attention kernels that need contiguous inputs, which channels-last would defeat */
    public static final List<OpOverload> LAYOUT_SENSITIVE_ATTENTION = List.of(
            SDPA_FLASH, SDPA_FLASH_BACKWARD, SDPA_EFFICIENT, SDPA_EFFICIENT_BACKWARD);

    public static final OpOverload MKL_LINEAR = op("mkl._mkl_linear.default");

    /** Fused oneDNN kernels that read their inputs with a fixed layout */
    public static final List<OpOverload> MKLDNN_FIXED_LAYOUT = List.of(
            op("mkldnn._convolution_pointwise.default"),
            op("mkldnn._convolution_pointwise.binary"),
            op("mkldnn._convolution_pointwise_.binary"),
            op("mkldnn._convolution_transpose_pointwise.default"),
            op("mkldnn._linear_pointwise.default"),
            op("mkldnn._linear_pointwise.binary"),
            op("aten.mkldnn_rnn_layer.default"),
            op("onednn.qconv2d_pointwise.default"),
            op("onednn.qconv2d_pointwise.binary"),
            op("onednn.qlinear_pointwise.default"));

    private static OpOverload op(String name) {
        return OpOverload.parse(name);
    }
}
