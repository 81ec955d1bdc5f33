package io.surfworks.graphlower.graph;

/**
 * Builtin (non-operator) call targets.
 */
public enum Builtin implements Target {
    /** Element access on a tuple-valued node: {@code getitem(value, index)}. */
    GETITEM("getitem");

    private final String displayName;

    Builtin(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
