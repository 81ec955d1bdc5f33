package io.surfworks.graphlower.core.exc;

import java.util.List;
import java.util.Map;

import io.surfworks.graphlower.graph.Target;

/**
 * No lowering exists, but a decomposition does: the caller should decompose the operator
 * before lowering, or register a lowering for it.
 */
public final class MissingOperatorWithDecomp extends MissingOperatorException {

    public MissingOperatorWithDecomp(Target target, List<?> args, Map<String, ?> kwargs) {
        super("missing decomposition", target, args, kwargs);
    }

    @Override
    public String getMessage() {
        return super.getMessage() + "\n\nThere is a decomposition available for " + target()
                + ". Add the operator to the decompositions applied before lowering, or register a lowering for it.";
    }
}
