package io.surfworks.graphlower.graph;

import java.util.Objects;

/**
 * A specific overload of a registered tensor operator, e.g. {@code aten.add.Tensor}.
 *
 * @param namespace operator namespace ("aten", "mkldnn", "torchvision", ...)
 * @param opName    operator name without namespace ("add", "convolution")
 * @param overload  overload name ("default", "Tensor", "int")
 */
public record OpOverload(String namespace, String opName, String overload) implements Target {

    public OpOverload {
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(opName, "opName cannot be null");
        Objects.requireNonNull(overload, "overload cannot be null");
        if (namespace.isBlank() || opName.isBlank() || overload.isBlank()) {
            throw new IllegalArgumentException("Operator name parts cannot be blank");
        }
    }

    /**
     * Parse {@code namespace.name.overload}; a missing overload means "default".
     */
    public static OpOverload parse(String text) {
        String[] parts = text.split("\\.");
        if (parts.length == 2) {
            return new OpOverload(parts[0], parts[1], "default");
        }
        if (parts.length == 3) {
            return new OpOverload(parts[0], parts[1], parts[2]);
        }
        throw new IllegalArgumentException("Expected namespace.name[.overload], got: " + text);
    }

    /**
     * Operator name qualified with its namespace, without overload: {@code aten::add}.
     */
    public String qualifiedName() {
        return namespace + "::" + opName;
    }

    /**
     * Name of the overload packet: {@code aten.add}.
     */
    public String packetName() {
        return namespace + "." + opName;
    }

    /**
     * True for in-place variants such as {@code add_}.
     */
    public boolean isInplace() {
        return opName.endsWith("_") && !opName.startsWith("_");
    }

    @Override
    public String name() {
        return namespace + "." + opName + "." + overload;
    }

    @Override
    public String toString() {
        return name();
    }
}
