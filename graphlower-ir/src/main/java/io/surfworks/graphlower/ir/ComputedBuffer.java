package io.surfworks.graphlower.ir;

import java.util.List;
import java.util.Objects;

/**
 * A buffer filled by evaluating a {@link Loops} expression.
 */
public final class ComputedBuffer extends Buffer {

    private final Loops data;

    public ComputedBuffer(Layout layout, Loops data) {
        super(null, layout);
        this.data = Objects.requireNonNull(data, "data cannot be null");
    }

    public Loops data() {
        return data;
    }

    /**
     * Buffers this computation reads when the buffer is filled.
     */
    public List<String> computeReads() {
        return data.readNames();
    }

    @Override
    public String describe() {
        return name() + " = " + data.describe();
    }
}
