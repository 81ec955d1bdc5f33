package io.surfworks.graphlower.ir;

/**
 * Storage of an entry in the constant table, possibly a per-device copy.
 */
public final class ConstantBuffer extends Buffer {

    public ConstantBuffer(String name, FixedLayout layout) {
        super(name, layout);
    }
}
