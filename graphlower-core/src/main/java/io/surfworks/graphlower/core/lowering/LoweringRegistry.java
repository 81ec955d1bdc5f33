package io.surfworks.graphlower.core.lowering;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.surfworks.graphlower.graph.OpOverload;
import io.surfworks.graphlower.graph.Target;

/**
 * Operator lowerings, keyed by call target.
 *
 * <p>The {@linkplain #global() global} registry is populated with {@link StandardLowerings}
 * on first use. Fallbacks registered while lowering a graph stay registered for every later
 * graph sharing the registry. Registration is insert-if-absent, so concurrent lowerings
 * racing to register the same fallback keep the first handler.
 */
public final class LoweringRegistry {

    /** Operators (namespace::name) that always fall back to the reference implementation */
    public static final Set<String> FALLBACK_ALLOW_LIST = Set.of("torchvision::roi_align");

    private final Map<Target, Lowering> lowerings = new ConcurrentHashMap<>();
    private final Set<Target> needsRealizedInputs = ConcurrentHashMap.newKeySet();
    private final Map<Target, LayoutConstraint> layoutConstraints = new ConcurrentHashMap<>();
    private final Set<Target> fallbacks = ConcurrentHashMap.newKeySet();
    private final DecompositionTable decompositions;

    public LoweringRegistry(DecompositionTable decompositions) {
        this.decompositions = Objects.requireNonNull(decompositions, "decompositions cannot be null");
    }

    private static final class Holder {
        private static final LoweringRegistry GLOBAL = standard();
    }

    /**
     * The process-wide registry.
     */
    public static LoweringRegistry global() {
        return Holder.GLOBAL;
    }

    /**
     * A new registry with the standard lowerings and decompositions, independent of
     * {@link #global()}.
     */
    public static LoweringRegistry standard() {
        LoweringRegistry registry = new LoweringRegistry(DecompositionTable.standard());
        StandardLowerings.registerAll(registry);
        return registry;
    }

    public void register(Target target, Lowering lowering) {
        lowerings.putIfAbsent(Objects.requireNonNull(target, "target cannot be null"),
                Objects.requireNonNull(lowering, "lowering cannot be null"));
    }

    public boolean contains(Target target) {
        return lowerings.containsKey(target);
    }

    /**
     * @return the lowering, or null if none is registered
     */
    public Lowering get(Target target) {
        return lowerings.get(target);
    }

    public DecompositionTable decompositions() {
        return decompositions;
    }

    /**
     * Marks {@code target} as preferring realized inputs, so that producers feeding it
     * several times materialize.
     */
    public void addNeedsRealizedInputs(Target target) {
        needsRealizedInputs.add(target);
    }

    public boolean needsRealizedInputs(Target target) {
        return needsRealizedInputs.contains(target);
    }

    public void addLayoutConstraint(Target target, LayoutConstraint constraint) {
        layoutConstraints.putIfAbsent(target, constraint);
    }

    /**
     * @return the constraint, or null if {@code target} has none
     */
    public LayoutConstraint layoutConstraint(Target target) {
        return layoutConstraints.get(target);
    }

    /**
     * True if {@code target} is lowered by falling back to the reference implementation.
     */
    public boolean isFallback(Target target) {
        return fallbacks.contains(target);
    }

    /**
     * Registers a fallback lowering for {@code op}.
     *
     * @return the registered lowering
     */
    public Lowering makeFallback(OpOverload op) {
        return makeFallback(op, null);
    }

    public Lowering makeFallback(OpOverload op, LayoutConstraint constraint) {
        addNeedsRealizedInputs(op);
        if (constraint != null) {
            addLayoutConstraint(op, constraint);
        }
        register(op, fallbackHandler(op, true));
        return lowerings.get(op);
    }

    /**
     * A lowering that calls the reference implementation of {@code op} as an extern kernel.
     *
     * @param addToFallbackSet whether to record {@code op} as a fallback operator
     */
    public Lowering fallbackHandler(OpOverload op, boolean addToFallbackSet) {
        if (addToFallbackSet) {
            fallbacks.add(op);
        }
        return (ctx, args, kwargs) -> ExternKernels.fallback(ctx, op, args, kwargs);
    }

    public int size() {
        return lowerings.size();
    }

    @Override
    public String toString() {
        return String.format("LoweringRegistry[lowerings=%d, fallbacks=%d]", lowerings.size(), fallbacks.size());
    }
}
