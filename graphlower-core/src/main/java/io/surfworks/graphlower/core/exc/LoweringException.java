package io.surfworks.graphlower.core.exc;

import java.util.List;
import java.util.Map;

import io.surfworks.graphlower.graph.Target;

/**
 * A lowering failed. The message names the operator and its arguments; the original
 * failure is the cause.
 */
public final class LoweringException extends GraphLoweringError {

    private final Target target;

    public LoweringException(Throwable cause, Target target, List<?> args, Map<String, ?> kwargs) {
        super(cause.getClass().getSimpleName() + ": " + cause.getMessage() + "\n"
                + operatorStr(target, args, kwargs), cause);
        this.target = target;
    }

    public Target target() {
        return target;
    }
}
