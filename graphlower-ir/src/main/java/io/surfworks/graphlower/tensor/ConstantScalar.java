package io.surfworks.graphlower.tensor;

import java.util.Objects;

/**
 * A concrete scalar (integer, floating point or boolean) observed while tracing.
 */
public record ConstantScalar(Object value) implements ExampleValue {

    public ConstantScalar {
        Objects.requireNonNull(value, "value cannot be null");
        if (!(value instanceof Number) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Scalar must be a Number or Boolean, got " + value.getClass().getSimpleName());
        }
    }

    public boolean isIntegral() {
        return value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof Boolean;
    }

    public long longValue() {
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        return ((Number) value).longValue();
    }
}
