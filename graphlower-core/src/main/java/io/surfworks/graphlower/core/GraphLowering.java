package io.surfworks.graphlower.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.surfworks.graphlower.core.backend.BackendRegistry;
import io.surfworks.graphlower.core.backend.CppWrapperCodeGen;
import io.surfworks.graphlower.core.backend.CudaWrapperCodeGen;
import io.surfworks.graphlower.core.backend.GeneratedCode;
import io.surfworks.graphlower.core.backend.Scheduling;
import io.surfworks.graphlower.core.backend.SequentialScheduling;
import io.surfworks.graphlower.core.backend.TextWrapperCodeGen;
import io.surfworks.graphlower.core.backend.WrapperCodeGen;
import io.surfworks.graphlower.core.codecache.CodeCache;
import io.surfworks.graphlower.core.codecache.CompiledModule;
import io.surfworks.graphlower.core.codecache.ExternNodeSerializer;
import io.surfworks.graphlower.core.codecache.GsonExternNodeSerializer;
import io.surfworks.graphlower.core.config.LoweringConfig;
import io.surfworks.graphlower.core.config.RuntimeEnvironment;
import io.surfworks.graphlower.core.constants.ConstantTable;
import io.surfworks.graphlower.core.exc.CodeGenPreconditionException;
import io.surfworks.graphlower.core.exc.GraphLoweringError;
import io.surfworks.graphlower.core.exc.LoweringException;
import io.surfworks.graphlower.core.exc.MissingOperatorWithDecomp;
import io.surfworks.graphlower.core.exc.MissingOperatorWithoutDecomp;
import io.surfworks.graphlower.core.jfr.GraphLoweringEvent;
import io.surfworks.graphlower.core.layout.LayoutOptimizer;
import io.surfworks.graphlower.core.lowering.AtenOps;
import io.surfworks.graphlower.core.lowering.LayoutConstraint;
import io.surfworks.graphlower.core.lowering.Lowering;
import io.surfworks.graphlower.core.lowering.LoweringContext;
import io.surfworks.graphlower.core.lowering.LoweringRegistry;
import io.surfworks.graphlower.core.lowering.PassthroughTarget;
import io.surfworks.graphlower.core.lowering.StandardLowerings;
import io.surfworks.graphlower.core.lowering.TypeSupport;
import io.surfworks.graphlower.graph.Builtin;
import io.surfworks.graphlower.graph.GraphNode;
import io.surfworks.graphlower.graph.NodeKind;
import io.surfworks.graphlower.graph.OpOverload;
import io.surfworks.graphlower.graph.SymbolicOp;
import io.surfworks.graphlower.graph.Target;
import io.surfworks.graphlower.graph.TracedGraph;
import io.surfworks.graphlower.ir.Buffer;
import io.surfworks.graphlower.ir.ConstantBuffer;
import io.surfworks.graphlower.ir.ConstantValue;
import io.surfworks.graphlower.ir.ExternKernel;
import io.surfworks.graphlower.ir.ExternKernelNode;
import io.surfworks.graphlower.ir.FixedLayout;
import io.surfworks.graphlower.ir.InputBuffer;
import io.surfworks.graphlower.ir.IrNode;
import io.surfworks.graphlower.ir.LoweringScope;
import io.surfworks.graphlower.ir.MultiOutputLayout;
import io.surfworks.graphlower.ir.MutationLayout;
import io.surfworks.graphlower.ir.NoneAsConstantBuffer;
import io.surfworks.graphlower.ir.RealizeThresholds;
import io.surfworks.graphlower.ir.ReinterpretView;
import io.surfworks.graphlower.ir.ShapeAsConstantBuffer;
import io.surfworks.graphlower.ir.StorageBox;
import io.surfworks.graphlower.ir.TensorBox;
import io.surfworks.graphlower.symbolic.ShapeEnv;
import io.surfworks.graphlower.symbolic.SizesStrides;
import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.ConstantScalar;
import io.surfworks.graphlower.tensor.ConstantTensor;
import io.surfworks.graphlower.tensor.DType;
import io.surfworks.graphlower.tensor.Device;
import io.surfworks.graphlower.tensor.ExampleValue;
import io.surfworks.graphlower.tensor.SymbolicScalar;
import io.surfworks.graphlower.tensor.TensorMeta;

/**
 * Lowers one traced graph to IR buffers and hands them to a backend.
 *
 * <p>Nodes are visited once, in trace order. Each node is lowered through the
 * {@link LoweringRegistry}; the value it produces then goes through the materialization
 * policy, which may realize it into a buffer or fix its stride order. The output node
 * realizes every returned value, writes back inputs that were updated in place, and fixes
 * the layout of every buffer.
 *
 * <p>Usage:
 * <pre>{@code
 * GraphLowering lowering = GraphLowering.builder(graph)
 *     .config(LoweringConfigLoader.load())
 *     .build();
 * lowering.run();
 * CompiledModule module = lowering.compileToModule();
 * }</pre>
 *
 * <p>An instance lowers a single graph on a single thread. Separate instances may run
 * concurrently; instances sharing a {@link ShapeEnv} serialize their symbol allocation
 * through it.
 */
public final class GraphLowering implements LoweringContext {

    private static final Logger LOG = Logger.getLogger(GraphLowering.class.getName());
    private static final Logger PERF_HINTS = Logger.getLogger("io.surfworks.graphlower.perf_hints");
    private static final Logger OUTPUT_CODE = Logger.getLogger("io.surfworks.graphlower.output_code");

    private static final Pattern VIEW_REFERENCE = Pattern.compile("(as_strided|reinterpret_tensor)\\(([a-zA-Z0-9_]+),");

    /** Input dtypes the C++ wrapper accepts; float16 only with CUDA */
    private static final Set<DType> CPP_WRAPPER_DTYPES = Set.of(
            DType.FLOAT32, DType.FLOAT64, DType.INT64, DType.INT32, DType.INT16, DType.INT8,
            DType.UINT8, DType.BOOL, DType.BFLOAT16, DType.COMPLEX64);

    private final TracedGraph graph;
    private final ShapeEnv shapeEnv;
    private final boolean reuseShapeEnv;
    private final int numStaticInputs;
    private final int graphId;
    private final boolean cppWrapper;
    private final boolean aotMode;
    private final Set<String> userVisibleOutputs;
    private final LoweringRegistry registry;
    private final LoweringConfig config;
    private final RuntimeEnvironment environment;
    private final CodeCache codeCache;
    private final ExternNodeSerializer externNodeSerializer;
    private final boolean layoutOpt;
    private final Set<GraphNode> nodesPreferChannelsLast;

    private final Map<String, Object> graphInputs = new LinkedHashMap<>();
    private final Map<String, InputBuffer> graphInputsOriginal = new LinkedHashMap<>();
    private final List<String> graphInputNames = new ArrayList<>();
    private final List<Buffer> buffers = new ArrayList<>();
    private final Map<String, Buffer> nameToBuffer = new HashMap<>();
    private final ConstantTable constants = new ConstantTable();
    private final Map<String, List<String>> lists = new LinkedHashMap<>();
    private final Map<GraphNode, Object> env = new HashMap<>();
    private final Set<String> deviceTypes = new TreeSet<>();
    private final Set<Integer> deviceIdxs = new TreeSet<>();
    private final Set<String> mutatedInputs = new LinkedHashSet<>();
    private final List<Integer> mutatedInputIdxs = new ArrayList<>();
    private final List<ExternKernelNode> externKernelNodes = new ArrayList<>();
    private final Set<String> warnedFallbacks = new HashSet<>(Set.of("aten.convolution_backward"));
    private final MutationTracker mutations = new MutationTracker();
    private final MaterializationPolicy policy;

    private List<IrNode> graphOutputs;
    private int numChannelsLastConv;
    private int placeholderIndex;
    private WrapperCodeGen wrapperCode;
    private String cacheKey;
    private Path cachePath;
    private List<GeneratedCode.LineOrigin> cacheLinemap;

    private GraphLowering(Builder b) {
        this.graph = b.graph;
        this.reuseShapeEnv = b.shapeEnv != null;
        this.shapeEnv = b.shapeEnv != null ? b.shapeEnv : new ShapeEnv();
        this.numStaticInputs = b.numStaticInputs;
        this.graphId = b.graphId;
        this.cppWrapper = b.cppWrapper;
        this.aotMode = b.aotMode;
        this.userVisibleOutputs = Set.copyOf(b.userVisibleOutputs);
        this.registry = b.registry != null ? b.registry : LoweringRegistry.global();
        this.config = b.config;
        this.environment = b.environment;
        this.codeCache = b.codeCache != null ? b.codeCache : CodeCache.defaultCache();
        this.externNodeSerializer = b.externNodeSerializer;

        initBackendRegistration();
        this.layoutOpt = b.layoutOpt != null
                ? b.layoutOpt
                : new LayoutOptimizer(config, environment).decideLayoutOpt(graph);
        this.nodesPreferChannelsLast = layoutOpt
                ? LayoutOptimizer.findNodesPreferChannelsLast(graph)
                : Set.of();
        LOG.fine(() -> "Graph " + graph.name() + ": layout optimization " + (layoutOpt ? "on" : "off"));
        this.policy = new MaterializationPolicy(this, registry, layoutOpt, environment,
                nodesPreferChannelsLast, userVisibleOutputs);
    }

    public static Builder builder(TracedGraph graph) {
        return new Builder(graph);
    }

    /**
     * Registers the default backends for {@code cpu} and {@code cuda} unless a backend is
     * already registered for them.
     */
    public static void initBackendRegistration() {
        BackendRegistry.registerIfAbsent("cpu", SequentialScheduling::new, TextWrapperCodeGen::new);
        BackendRegistry.registerIfAbsent("cuda", SequentialScheduling::new, TextWrapperCodeGen::new);
    }

    // ==================== Graph walk ====================

    /**
     * Lowers every node of the graph.
     *
     * @return the graph outputs
     * @throws IllegalStateException if the graph was already lowered
     */
    public List<IrNode> run() {
        if (graphOutputs != null || !env.isEmpty()) {
            throw new IllegalStateException("Graph " + graph.name() + " was already lowered");
        }
        GraphLoweringEvent event = new GraphLoweringEvent();
        event.begin();
        for (GraphNode node : graph.nodes()) {
            env.put(node, runNode(node));
        }
        if (graphOutputs == null) {
            throw new IllegalStateException("Graph " + graph.name() + " has no output node");
        }
        event.graphName = graph.name();
        event.phase = "run";
        event.nodeCount = graph.nodes().size();
        event.bufferCount = buffers.size();
        event.layoutOptimization = layoutOpt;
        event.channelsLastConvs = numChannelsLastConv;
        event.commit();
        return graphOutputs;
    }

    Object runNode(GraphNode node) {
        LOG.fine(() -> "lowering " + node.format());
        Set<GraphNode> origins = new LinkedHashSet<>();
        origins.add(node);
        List<Object> args = List.of();
        Map<String, Object> kwargs = Map.of();
        if (node.kind() == NodeKind.CALL_FUNCTION) {
            args = fetchArgs(node.args());
            kwargs = fetchKwargs(node.kwargs());
            origins.addAll(MaterializationPolicy.gatherOrigins(args, kwargs.values()));
        }

        Object result;
        try (LoweringScope scope = LoweringScope.enter(node, origins)) {
            switch (node.kind()) {
                case PLACEHOLDER -> result = placeholder(node);
                case GET_ATTR -> result = getAttr(node);
                case CALL_FUNCTION -> result = lowerCall(node, args, kwargs);
                case OUTPUT -> {
                    output(node);
                    return null;
                }
                default -> throw new IllegalArgumentException(
                        node.kind() + " nodes cannot be lowered: " + node.name());
            }
            result = policy.apply(node, result);
            MaterializationPolicy.tagOrigin(node, result);
        }
        mutations.registerUsersOf(result);
        return result;
    }

    private Object lowerCall(GraphNode node, List<Object> args, Map<String, Object> kwargs) {
        Target target = node.target();
        if (target instanceof OpOverload op && TypeSupport.fallbackNodeDueToUnsupportedType(node, config)) {
            LOG.fine("  via fallback_handler");
            return registry.fallbackHandler(op, false).lower(this, args, kwargs);
        }
        LayoutConstraint constraint = registry.layoutConstraint(target);
        if (constraint != null) {
            LOG.fine("  via layout_constraints");
            LayoutConstraint.Arguments constrained = constraint.apply(this, node, args, kwargs);
            return callFunction(target, constrained.args(), constrained.kwargs());
        }
        if ((AtenOps.SYM_STRIDE.equals(target) || target instanceof SymbolicOp)
                && node.meta() instanceof SymbolicScalar scalar) {
            return scalar.expr();
        }
        return callFunction(target, args, kwargs);
    }

    // ==================== Node kinds ====================

    /**
     * Binds a graph input. Symbolic scalars bind their expression; integral and boolean
     * literals a constant expression; floating point literals their value. Tensors become
     * an {@link InputBuffer} with symbolic sizes, or static sizes for the first
     * {@code numStaticInputs} inputs and for tensors the tracer saw as static.
     */
    Object placeholder(GraphNode node) {
        String target = node.attribute();
        int index = placeholderIndex++;
        ExampleValue example = node.meta();
        if (example instanceof SymbolicScalar scalar) {
            return bindInput(target, scalar.expr());
        }
        if (example instanceof ConstantScalar scalar) {
            return bindInput(target, scalar.isIntegral() ? SymExpr.of(scalar.longValue()) : scalar.value());
        }
        if (!(example instanceof TensorMeta meta)) {
            throw new IllegalArgumentException("Input " + target + " needs a tensor or scalar example value, got "
                    + example);
        }
        SizesStrides sizesStrides = !meta.symbolic() || index < numStaticInputs
                ? staticSizesStrides(meta)
                : symbolicSizesStrides(meta, target);
        InputBuffer buffer = new InputBuffer(target, new FixedLayout(meta.device(), meta.dtype(),
                sizesStrides.sizes(), sizesStrides.strides()));
        TensorBox tensor = TensorBox.create(buffer, this);
        graphInputsOriginal.put(target, buffer);
        addDevice(meta.device());
        return bindInput(target, tensor);
    }

    private Object bindInput(String name, Object value) {
        if (graphInputs.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate graph input " + name);
        }
        graphInputs.put(name, value);
        graphInputNames.add(name);
        return value;
    }

    /**
     * Symbolic sizes and strides, allocated in the caller's shape environment when one was
     * supplied and in this graph's own environment otherwise.
     */
    SizesStrides symbolicSizesStrides(TensorMeta example, String inputName) {
        String source = reuseShapeEnv
                ? inputName
                : "__unknown_tensor_" + shapeEnv.symbolCount();
        return shapeEnv.createSymbolicSizesStrides(example, source);
    }

    /**
     * Concrete sizes and strides; used for weights and constants, which never vary.
     */
    static SizesStrides staticSizesStrides(TensorMeta example) {
        List<SymExpr> sizes = new ArrayList<>(example.rank());
        List<SymExpr> strides = new ArrayList<>(example.rank());
        for (int i = 0; i < example.rank(); i++) {
            sizes.add(SymExpr.of(example.size(i)));
            strides.add(SymExpr.of(example.stride(i)));
        }
        return new SizesStrides(sizes, strides);
    }

    /**
     * Resolves a constant attribute. Scalars become a {@link ConstantValue}, short vectors
     * are inlined, everything else goes to the constant table.
     */
    Object getAttr(GraphNode node) {
        String path = node.attribute();
        ConstantTensor value = graph.attribute(path);
        if (value == null) {
            throw new IllegalArgumentException("Graph " + graph.name() + " has no attribute " + path);
        }
        if (config.alwaysKeepTensorConstants() || TypeSupport.unsupportedOutputTensor(value.meta(), config)) {
            return addTensorConstant(value, path);
        }
        if (value.rank() == 0) {
            return new ConstantValue(value.item(), value.dtype(), value.device());
        }
        if (value.rank() == 1 && value.numel() <= 8) {
            return StandardLowerings.inlineConstant(this, value);
        }
        return addTensorConstant(value, path);
    }

    /**
     * Dispatches an operator call to its lowering.
     *
     * @throws MissingOperatorWithDecomp    no lowering, implicit fallbacks off, a decomposition exists
     * @throws MissingOperatorWithoutDecomp no lowering, implicit fallbacks off, no decomposition
     * @throws LoweringException            the lowering itself failed
     */
    public Object callFunction(Target target, List<Object> args, Map<String, Object> kwargs) {
        if (target == Builtin.GETITEM && !args.isEmpty() && args.get(0) instanceof List<?> list) {
            return list.get(((Number) args.get(1)).intValue());
        }
        if (target instanceof PassthroughTarget passthrough) {
            return passthrough.lowering().lower(this, args, kwargs);
        }

        Lowering lowering = registry.get(target);
        if (lowering == null) {
            if (!(target instanceof OpOverload op)) {
                throw new IllegalArgumentException(target + " is not an OpOverload");
            }
            if (LoweringRegistry.FALLBACK_ALLOW_LIST.contains(op.qualifiedName())) {
                registry.makeFallback(op);
            } else if (config.implicitFallbacks()) {
                LOG.info("Creating implicit fallback for:\n" + GraphLoweringError.operatorStr(op, args, kwargs));
                registry.makeFallback(op);
            } else if (registry.decompositions().hasDecomposition(op)) {
                throw new MissingOperatorWithDecomp(op, args, kwargs);
            } else {
                throw new MissingOperatorWithoutDecomp(op, args, kwargs);
            }
            lowering = registry.get(op);
        }

        try {
            LOG.fine(() -> "  via " + target);
            return lowering.lower(this, args, kwargs);
        } catch (RuntimeException e) {
            throw new LoweringException(e, target, args, kwargs);
        }
    }

    /**
     * Realizes the returned values, writes back inputs updated in place and fixes every
     * buffer's layout.
     */
    void output(GraphNode node) {
        List<?> returned = (List<?>) node.args().get(0);
        List<IrNode> outputs = new ArrayList<>(returned.size());
        for (Object arg : returned) {
            outputs.add(realizeOutput(fetch(arg)));
        }
        graphOutputs = outputs;

        for (Map.Entry<String, Object> e : graphInputs.entrySet()) {
            if (!(e.getValue() instanceof TensorBox value)) {
                continue;
            }
            String name = e.getKey();
            value.realize();
            StorageBox storage = value.storage();
            if (storage.data() instanceof InputBuffer input && input.name().equals(name)) {
                continue;
            }
            InputBuffer original = graphInputsOriginal.get(name);
            MutationLayout.realizeInto(value, original, this);
            for (int i = 0; i < graphOutputs.size(); i++) {
                if (graphOutputs.get(i) == storage) {
                    graphOutputs.set(i, original);
                }
            }
        }

        finalizeLayouts();
        LOG.fine(() -> String.format("Force channels last inputs for %d conv for the current graph with id %d",
                numChannelsLastConv, graphId));
    }

    private IrNode realizeOutput(Object value) {
        if (value == null) {
            return new NoneAsConstantBuffer();
        }
        if (value instanceof SymExpr || value instanceof Long || value instanceof Integer
                || value instanceof Boolean) {
            return new ShapeAsConstantBuffer(StandardLowerings.toExpr(value));
        }
        if (value instanceof ConstantValue || value instanceof ConstantBuffer) {
            return ExternKernel.realizeInput(value, this);
        }
        if (value instanceof TensorBox box) {
            box.storage().realize();
            return box.storage();
        }
        throw new IllegalArgumentException("Unsupported graph output type: "
                + value.getClass().getSimpleName());
    }

    /**
     * Fixes the layout of every buffer; flexible layouts become row-major.
     */
    void finalizeLayouts() {
        for (Buffer buffer : buffers) {
            buffer.decideLayout();
        }
    }

    // ==================== Argument fetching ====================

    private Object fetch(Object arg) {
        if (arg instanceof GraphNode n) {
            if (!env.containsKey(n)) {
                throw new IllegalStateException("Node " + n.name() + " is used before it is lowered");
            }
            return env.get(n);
        }
        if (arg instanceof List<?> list) {
            List<Object> values = new ArrayList<>(list.size());
            for (Object o : list) {
                values.add(fetch(o));
            }
            return values;
        }
        return arg;
    }

    private List<Object> fetchArgs(List<Object> args) {
        List<Object> values = new ArrayList<>(args.size());
        for (Object arg : args) {
            values.add(fetch(arg));
        }
        return values;
    }

    private Map<String, Object> fetchKwargs(Map<String, Object> kwargs) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : kwargs.entrySet()) {
            values.put(e.getKey(), fetch(e.getValue()));
        }
        return values;
    }

    // ==================== Buffer registry ====================

    @Override
    public String registerBuffer(Buffer buffer) {
        String name = "buf" + buffers.size();
        buffer.setName(name);
        buffers.add(buffer);
        nameToBuffer.put(name, buffer);
        addDevice(buffer.device());
        return name;
    }

    @Override
    public void markBufferMutated(String name) {
        mutations.markBufferMutated(name);
        int index = graphInputNames.indexOf(name);
        if (index >= 0 && mutatedInputs.add(name)) {
            mutatedInputIdxs.add(index);
        }
    }

    @Override
    public TensorBox addTensorConstant(ConstantTensor value, String name) {
        String allocated = constants.add(value, name);
        SizesStrides sizesStrides = staticSizesStrides(value.meta());
        ConstantBuffer buffer = new ConstantBuffer(allocated, new FixedLayout(value.device(), value.dtype(),
                sizesStrides.sizes(), sizesStrides.strides()));
        addDevice(value.device());
        return TensorBox.create(buffer, this);
    }

    @Override
    public long sizeHint(SymExpr expr) {
        return shapeEnv.sizeHint(expr);
    }

    @Override
    public RealizeThresholds thresholds() {
        return config.thresholds();
    }

    /**
     * Name of constant {@code name} on {@code device}, copying it there on first use.
     */
    public String constantName(String name, Device device) {
        return constants.constantName(name, device);
    }

    /**
     * Registers a list of buffer names that kernels receive as one argument.
     *
     * @return the list's name, {@code list_<a>_<b>...}
     */
    public String registerList(List<String> bufferNames) {
        String name = "list_" + String.join("_", bufferNames);
        lists.put(name, List.copyOf(bufferNames));
        return name;
    }

    /**
     * A realized buffer or a graph input, or null if neither has that name.
     */
    public Object getBuffer(String name) {
        Buffer buffer = nameToBuffer.get(name);
        if (buffer != null) {
            return buffer;
        }
        return graphInputs.get(name);
    }

    /**
     * The dtype of a buffer, constant or input. Also resolves view expressions such as
     * {@code reinterpret_tensor(buf0, ...)} to their base buffer.
     *
     * @throws IllegalArgumentException if nothing by that name exists
     */
    public DType getDtype(String name) {
        if (constants.contains(name)) {
            return constants.get(name).dtype();
        }
        Buffer buffer = nameToBuffer.get(name);
        if (buffer != null) {
            return buffer.dtype();
        }
        Object input = graphInputs.get(name);
        if (input instanceof TensorBox box) {
            return box.dtype();
        }
        if (input instanceof SymExpr) {
            return DType.INT64;
        }
        Matcher m = VIEW_REFERENCE.matcher(name);
        if (m.find()) {
            return getDtype(m.group(2));
        }
        throw new IllegalArgumentException("could not find " + name);
    }

    /**
     * Number of elements of a buffer, constant or input; 1 for multi-output buffers.
     */
    public SymExpr getNumel(String name) {
        if (constants.contains(name)) {
            return SymExpr.of(constants.get(name).numel());
        }
        Buffer buffer = nameToBuffer.get(name);
        if (buffer != null) {
            if (buffer.layout() instanceof MultiOutputLayout) {
                return SymExpr.of(1);
            }
            return numel(buffer.size());
        }
        Object input = graphInputs.get(name);
        if (input instanceof TensorBox box) {
            return numel(box.size());
        }
        throw new IllegalArgumentException("could not find " + name);
    }

    /**
     * True if input {@code name} is a single-element CPU tensor, passed as a scalar.
     */
    public boolean isUnspecArg(String name) {
        return graphInputs.get(name) instanceof TensorBox box
                && numel(box.size()).equals(SymExpr.of(1))
                && box.device().isCpu();
    }

    private static SymExpr numel(List<SymExpr> size) {
        SymExpr n = SymExpr.of(1);
        for (SymExpr d : size) {
            n = n.times(d);
        }
        return n;
    }

    /**
     * Names of the buffers returned by the graph; none and shape outputs have no buffer.
     */
    public List<String> getOutputNames() {
        requireLowered();
        List<String> names = new ArrayList<>();
        for (IrNode output : graphOutputs) {
            if (output instanceof NoneAsConstantBuffer || output instanceof ShapeAsConstantBuffer) {
                continue;
            }
            names.add(storageName(output));
        }
        return names;
    }

    private static String storageName(IrNode node) {
        if (node instanceof StorageBox storage) {
            return storageName(storage.data());
        }
        if (node instanceof Buffer buffer) {
            return buffer.name();
        }
        if (node instanceof ReinterpretView view) {
            return view.name();
        }
        throw new IllegalArgumentException("Output " + node.describe() + " has no storage");
    }

    private void addDevice(Device device) {
        if (device == null) {
            return;
        }
        deviceTypes.add(device.type());
        if (device.hasIndex()) {
            deviceIdxs.add(device.index());
        }
    }

    // ==================== LoweringContext ====================

    @Override
    public GraphNode currentNode() {
        return LoweringScope.currentNode();
    }

    @Override
    public LoweringConfig config() {
        return config;
    }

    @Override
    public ShapeEnv shapeEnv() {
        return shapeEnv;
    }

    @Override
    public boolean layoutOpt() {
        return layoutOpt;
    }

    @Override
    public void warnFallback(String name) {
        if (warnedFallbacks.add(name)) {
            PERF_HINTS.info("Using FallbackKernel: " + name);
        }
    }

    @Override
    public void recordExternKernel(ExternKernelNode node) {
        externKernelNodes.add(node);
    }

    @Override
    public void noteChannelsLastConv() {
        numChannelsLastConv++;
    }

    @Override
    public FixedLayout layoutFromMeta(TensorMeta meta) {
        if (!meta.symbolic()) {
            SizesStrides s = staticSizesStrides(meta);
            return new FixedLayout(meta.device(), meta.dtype(), s.sizes(), s.strides());
        }
        List<SymExpr> sizes = new ArrayList<>(meta.rank());
        List<SymExpr> strides = new ArrayList<>(meta.rank());
        for (int i = 0; i < meta.rank(); i++) {
            sizes.add(shapeEnv.exprFor(meta.size(i)));
            strides.add(shapeEnv.exprFor(meta.stride(i)));
        }
        return new FixedLayout(meta.device(), meta.dtype(), sizes, strides);
    }

    // ==================== Code generation ====================

    /**
     * Selects the wrapper generator from the device types the graph touches.
     *
     * @throws CodeGenPreconditionException if two non-CPU device types are mixed, no backend
     *                                      is registered, or the C++ wrapper cannot be used
     */
    public void initWrapperCode() {
        if (cppWrapper) {
            validateCanGenerateCppWrapper();
            wrapperCode = deviceTypes.contains("cuda") ? new CudaWrapperCodeGen() : new CppWrapperCodeGen();
            return;
        }
        String deviceType = primaryDeviceType();
        WrapperCodeGen codegen = BackendRegistry.wrapperCodegenFor(deviceType);
        if (codegen == null) {
            throw new CodeGenPreconditionException("Device " + deviceType + " not supported");
        }
        wrapperCode = codegen;
    }

    private String primaryDeviceType() {
        Set<String> types = new TreeSet<>(deviceTypes);
        types.remove("cpu");
        if (types.size() > 1) {
            throw new CodeGenPreconditionException("Does not support mixing " + String.join("+", types));
        }
        return types.isEmpty() ? "cpu" : types.iterator().next();
    }

    /**
     * @throws CodeGenPreconditionException if C++ codegen is disabled, the host is not
     *                                      Linux, or an input has a dtype the wrapper cannot pass
     */
    public void validateCanGenerateCppWrapper() {
        if (config.disableCppCodegen()) {
            throw CodeGenPreconditionException.cppWrapper("C++ codegen is disabled");
        }
        if (!environment.isLinux()) {
            throw CodeGenPreconditionException.cppWrapper("Unsupported platform " + environment.osName());
        }
        boolean cuda = deviceTypes.contains("cuda");
        for (Object value : graphInputs.values()) {
            DType dtype = null;
            if (value instanceof TensorBox box) {
                dtype = box.dtype();
            } else if (value instanceof SymExpr) {
                dtype = DType.INT64;
            } else if (value instanceof Double) {
                dtype = DType.FLOAT64;
            }
            boolean supported = dtype != null
                    && (CPP_WRAPPER_DTYPES.contains(dtype) || (cuda && dtype == DType.FLOAT16));
            if (!supported) {
                throw CodeGenPreconditionException.cppWrapper("Unsupported input dtype " + dtype);
            }
        }
    }

    /**
     * Schedules the buffers and generates the wrapper.
     */
    public GeneratedCode codegen() {
        requireLowered();
        initWrapperCode();
        Scheduling scheduling = BackendRegistry.schedulingFor(primaryDeviceType());
        if (scheduling == null) {
            scheduling = new SequentialScheduling();
        }
        return wrapperCode.generate(handoff(), scheduling.schedule(buffers));
    }

    /**
     * Generates code and stores it in the code cache.
     */
    public CompiledModule compileToModule() {
        GraphLoweringEvent event = new GraphLoweringEvent();
        event.begin();
        GeneratedCode code = codegen();
        OUTPUT_CODE.fine(code::code);

        CompiledModule module = codeCache.load(code, constants.hashes().values());
        cacheKey = module.key();
        cachePath = module.path();
        cacheLinemap = module.lineMap();
        OUTPUT_CODE.fine(() -> "Output code written to: " + module.path());

        event.graphName = graph.name();
        event.phase = "compile";
        event.nodeCount = graph.nodes().size();
        event.bufferCount = buffers.size();
        event.layoutOptimization = layoutOpt;
        event.channelsLastConvs = numChannelsLastConv;
        event.commit();
        return module;
    }

    /**
     * Compiles the graph. Ahead-of-time compilation also serializes the extern kernel calls.
     *
     * @throws IllegalStateException in ahead-of-time mode without the C++ wrapper
     */
    public CompiledModule compileToFn() {
        if (!aotMode) {
            return compileToModule();
        }
        if (!cppWrapper) {
            throw new IllegalStateException("AOT mode only supports C++ wrapper");
        }
        CompiledModule module = compileToModule();
        return module.withExternKernelNodes(externNodeSerializer.serialize(externKernelNodes));
    }

    /**
     * The lowered graph as handed to the backend.
     */
    public LoweredGraph handoff() {
        requireLowered();
        return new LoweredGraph(graph.name(), graphInputs, buffers, graphOutputs, constants,
                userVisibleOutputs, mutatedInputs, mutatedInputIdxs, externKernelNodes, deviceTypes);
    }

    private void requireLowered() {
        if (graphOutputs == null) {
            throw new IllegalStateException("Graph " + graph.name() + " has not been lowered; call run() first");
        }
    }

    // ==================== Accessors ====================

    public TracedGraph graph() {
        return graph;
    }

    public int graphId() {
        return graphId;
    }

    public Map<String, Object> graphInputs() {
        return Collections.unmodifiableMap(graphInputs);
    }

    public List<String> graphInputNames() {
        return Collections.unmodifiableList(graphInputNames);
    }

    public List<Buffer> buffers() {
        return Collections.unmodifiableList(buffers);
    }

    /**
     * @return the outputs, or null before the output node is lowered
     */
    public List<IrNode> graphOutputs() {
        return graphOutputs == null ? null : Collections.unmodifiableList(graphOutputs);
    }

    public ConstantTable constants() {
        return constants;
    }

    public Map<String, List<String>> lists() {
        return Collections.unmodifiableMap(lists);
    }

    public Set<String> deviceTypes() {
        return Collections.unmodifiableSet(deviceTypes);
    }

    public Set<Integer> deviceIdxs() {
        return Collections.unmodifiableSet(deviceIdxs);
    }

    public Set<String> mutatedInputs() {
        return Collections.unmodifiableSet(mutatedInputs);
    }

    public List<Integer> mutatedInputIdxs() {
        return Collections.unmodifiableList(mutatedInputIdxs);
    }

    public Set<String> mutatedBuffers() {
        return mutations.mutatedBuffers();
    }

    public List<ExternKernelNode> externKernelNodes() {
        return Collections.unmodifiableList(externKernelNodes);
    }

    public Set<GraphNode> nodesPreferChannelsLast() {
        return Collections.unmodifiableSet(nodesPreferChannelsLast);
    }

    public int numChannelsLastConv() {
        return numChannelsLastConv;
    }

    /**
     * Readers recorded for buffer {@code name}.
     */
    public List<TensorBox> usersOf(String name) {
        return mutations.usersOf(name);
    }

    public String cacheKey() {
        return cacheKey;
    }

    public Path cachePath() {
        return cachePath;
    }

    public List<GeneratedCode.LineOrigin> cacheLinemap() {
        return cacheLinemap;
    }

    @Override
    public String toString() {
        return String.format("GraphLowering[graph=%s, buffers=%d, layoutOpt=%s]",
                graph.name(), buffers.size(), layoutOpt);
    }

    // ==================== Builder ====================

    /**
     * Options for one lowering. Only the graph is required.
     */
    public static final class Builder {

        private final TracedGraph graph;
        private ShapeEnv shapeEnv;
        private int numStaticInputs;
        private int graphId;
        private boolean cppWrapper;
        private boolean aotMode;
        private Set<String> userVisibleOutputs = Set.of();
        private Boolean layoutOpt;
        private LoweringRegistry registry;
        private LoweringConfig config = LoweringConfig.defaults();
        private RuntimeEnvironment environment = RuntimeEnvironment.detect();
        private CodeCache codeCache;
        private ExternNodeSerializer externNodeSerializer = new GsonExternNodeSerializer();

        private Builder(TracedGraph graph) {
            this.graph = Objects.requireNonNull(graph, "graph cannot be null");
        }

        /**
         * A shape environment shared with other lowerings, so that their size symbols agree.
         */
        public Builder shapeEnv(ShapeEnv shapeEnv) {
            this.shapeEnv = shapeEnv;
            return this;
        }

        /**
         * The first {@code n} inputs are weights and take static sizes.
         */
        public Builder numStaticInputs(int n) {
            if (n < 0) {
                throw new IllegalArgumentException("numStaticInputs must be non-negative, got " + n);
            }
            this.numStaticInputs = n;
            return this;
        }

        public Builder graphId(int graphId) {
            this.graphId = graphId;
            return this;
        }

        public Builder cppWrapper(boolean cppWrapper) {
            this.cppWrapper = cppWrapper;
            return this;
        }

        public Builder aotMode(boolean aotMode) {
            this.aotMode = aotMode;
            return this;
        }

        public Builder userVisibleOutputs(Set<String> names) {
            this.userVisibleOutputs = Objects.requireNonNull(names, "names cannot be null");
            return this;
        }

        /**
         * Forces the layout decision instead of running the heuristics.
         */
        public Builder layoutOpt(boolean layoutOpt) {
            this.layoutOpt = layoutOpt;
            return this;
        }

        public Builder registry(LoweringRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder config(LoweringConfig config) {
            this.config = Objects.requireNonNull(config, "config cannot be null");
            return this;
        }

        public Builder environment(RuntimeEnvironment environment) {
            this.environment = Objects.requireNonNull(environment, "environment cannot be null");
            return this;
        }

        public Builder codeCache(CodeCache codeCache) {
            this.codeCache = codeCache;
            return this;
        }

        public Builder externNodeSerializer(ExternNodeSerializer serializer) {
            this.externNodeSerializer = Objects.requireNonNull(serializer, "serializer cannot be null");
            return this;
        }

        public GraphLowering build() {
            return new GraphLowering(this);
        }
    }
}
