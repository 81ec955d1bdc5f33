package io.surfworks.graphlower.core.lowering;

import java.util.Objects;

import io.surfworks.graphlower.graph.Target;

/**
 * A call target that carries its own lowering, e.g. one bound by a pattern rewrite.
 * Dispatch invokes it directly without consulting the registry.
 */
public record PassthroughTarget(String name, Lowering lowering) implements Target {

    public PassthroughTarget {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(lowering, "lowering cannot be null");
    }

    @Override
    public String toString() {
        return name;
    }
}
