package io.surfworks.graphlower.ir;

/**
 * Limits that force a lazily computed value into a buffer.
 *
 * @param reads    distinct-consumer values with more reads than this are realized on reuse
 * @param accReads pointwise values accumulating more reads than this are realized
 * @param opcount  values whose inlined expression has more operations than this are realized
 */
public record RealizeThresholds(int reads, int accReads, int opcount) {

    public static final RealizeThresholds DEFAULT = new RealizeThresholds(4, 8, 30);

    public RealizeThresholds {
        if (reads < 0 || accReads < 0 || opcount < 0) {
            throw new IllegalArgumentException("Thresholds must be non-negative");
        }
    }
}
