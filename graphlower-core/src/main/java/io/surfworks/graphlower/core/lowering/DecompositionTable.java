package io.surfworks.graphlower.core.lowering;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.surfworks.graphlower.graph.OpOverload;
import io.surfworks.graphlower.graph.Target;

/**
 * The operators for which a decomposition into simpler operators is known.
 *
 * <p>Lowering does not apply decompositions; it only consults the table to tell a caller
 * that decomposing first would have avoided a missing lowering.
 */
public final class DecompositionTable {

    private final Set<Target> decomposed = ConcurrentHashMap.newKeySet();

    public static DecompositionTable empty() {
        return new DecompositionTable();
    }

    /**
     * Decompositions that ship with the reference operator library.
     */
    public static DecompositionTable standard() {
        DecompositionTable table = new DecompositionTable();
        for (String op : new String[] {
                "aten.addcmul.default", "aten.addcdiv.default", "aten.hardswish.default",
                "aten.hardsigmoid.default", "aten.silu.default", "aten.gelu.default",
                "aten.native_layer_norm.default", "aten.native_batch_norm.default",
                "aten._softmax.default", "aten._log_softmax.default", "aten.logit.default",
                "aten.leaky_relu.default", "aten.elu.default", "aten.mse_loss.default"}) {
            table.register(OpOverload.parse(op));
        }
        return table;
    }

    public void register(Target op) {
        decomposed.add(op);
    }

    public boolean hasDecomposition(Target op) {
        return decomposed.contains(op);
    }

    public int size() {
        return decomposed.size();
    }
}
