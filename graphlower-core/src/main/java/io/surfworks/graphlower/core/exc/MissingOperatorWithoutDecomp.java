package io.surfworks.graphlower.core.exc;

import java.util.List;
import java.util.Map;

import io.surfworks.graphlower.graph.Target;

/**
 * No lowering and no decomposition exist for an operator.
 */
public final class MissingOperatorWithoutDecomp extends MissingOperatorException {

    public MissingOperatorWithoutDecomp(Target target, List<?> args, Map<String, ?> kwargs) {
        super("missing lowering", target, args, kwargs);
    }
}
