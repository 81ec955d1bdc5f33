package io.surfworks.graphlower.ir;

/**
 * Storage of a graph input.
 */
public final class InputBuffer extends Buffer {

    public InputBuffer(String name, FixedLayout layout) {
        super(name, layout);
    }
}
