package io.surfworks.graphlower.core.exc;

import java.util.List;
import java.util.Map;

import io.surfworks.graphlower.graph.Target;

/**
 * Root of the failures raised while lowering a graph.
 */
public abstract class GraphLoweringError extends RuntimeException {

    protected GraphLoweringError(String message) {
        super(message);
    }

    protected GraphLoweringError(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Renders a call for error messages, one line per argument, indented by two spaces.
     */
    public static String operatorStr(Target target, List<?> args, Map<String, ?> kwargs) {
        StringBuilder sb = new StringBuilder();
        sb.append("  target: ").append(target);
        for (int i = 0; i < args.size(); i++) {
            sb.append("\n  args[").append(i).append("]: ").append(args.get(i));
        }
        if (kwargs != null && !kwargs.isEmpty()) {
            sb.append("\n  kwargs: ").append(kwargs);
        }
        return sb.toString();
    }
}
