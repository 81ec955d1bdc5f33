package io.surfworks.graphlower.ir;

import java.util.List;
import java.util.Objects;

/**
 * One output of a multi-output {@link ExternKernel}.
 */
public final class MultiOutput extends Buffer {

    private final ExternKernel parent;
    private final int index;

    public MultiOutput(FixedLayout layout, ExternKernel parent, int index) {
        super(null, layout);
        this.parent = Objects.requireNonNull(parent, "parent cannot be null");
        this.index = index;
    }

    public ExternKernel parent() {
        return parent;
    }

    public int index() {
        return index;
    }

    public List<String> inputNames() {
        return List.of(parent.name());
    }

    @Override
    public String describe() {
        return name() + " = " + parent.name() + "[" + index + "]";
    }
}
