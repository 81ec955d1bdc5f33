package io.surfworks.graphlower.core.exc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.surfworks.graphlower.graph.Target;

/**
 * An operator reached lowering with no lowering registered for it.
 */
public abstract class MissingOperatorException extends GraphLoweringError {

    private final Target target;
    private final List<Object> args;
    private final Map<String, Object> kwargs;

    protected MissingOperatorException(String headline, Target target, List<?> args, Map<String, ?> kwargs) {
        super(headline + "\n" + operatorStr(target, args, kwargs));
        this.target = target;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public Target target() {
        return target;
    }

    public List<Object> args() {
        return args;
    }

    public Map<String, Object> kwargs() {
        return kwargs;
    }
}
