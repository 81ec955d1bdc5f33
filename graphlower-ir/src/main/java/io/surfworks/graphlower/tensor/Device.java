package io.surfworks.graphlower.tensor;

import java.util.Objects;

/**
 * A device a tensor lives on: a device class ("cpu", "cuda", ...) and an optional index.
 *
 * @param type  the device class
 * @param index the device index, or -1 when unspecified
 */
public record Device(String type, int index) {

    public Device {
        Objects.requireNonNull(type, "type cannot be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type cannot be blank");
        }
        if (index < -1) {
            throw new IllegalArgumentException("index must be >= -1, got " + index);
        }
    }

    public static Device cpu() {
        return new Device("cpu", -1);
    }

    public static Device cuda(int index) {
        return new Device("cuda", index);
    }

    /**
     * Parse "cpu", "cuda", "cuda:1".
     */
    public static Device parse(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            return new Device(text, -1);
        }
        return new Device(text.substring(0, colon), Integer.parseInt(text.substring(colon + 1)));
    }

    public boolean isCpu() {
        return "cpu".equals(type);
    }

    public boolean hasIndex() {
        return index >= 0;
    }

    @Override
    public String toString() {
        return hasIndex() ? type + ":" + index : type;
    }
}
