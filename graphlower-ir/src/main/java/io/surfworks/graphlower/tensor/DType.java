package io.surfworks.graphlower.tensor;

/**
 * Element types for tensors seen in traced graphs.
 * Provides byte size information and the promotion order used by pointwise lowerings.
 */
public enum DType {
    BOOL("bool", 1, false, false, false),
    UINT8("uint8", 1, true, false, false),
    INT8("int8", 1, true, false, false),
    INT16("int16", 2, true, false, false),
    INT32("int32", 4, true, false, false),
    INT64("int64", 8, true, false, false),
    FLOAT16("float16", 2, false, true, false),
    BFLOAT16("bfloat16", 2, false, true, false),
    FLOAT32("float32", 4, false, true, false),
    FLOAT64("float64", 8, false, true, false),
    COMPLEX64("complex64", 8, false, false, true),
    COMPLEX128("complex128", 16, false, false, true);

    private final String typeName;
    private final int byteSize;
    private final boolean isInteger;
    private final boolean isFloating;
    private final boolean isComplex;

    DType(String typeName, int byteSize, boolean isInteger, boolean isFloating, boolean isComplex) {
        this.typeName = typeName;
        this.byteSize = byteSize;
        this.isInteger = isInteger;
        this.isFloating = isFloating;
        this.isComplex = isComplex;
    }

    public String typeName() {
        return typeName;
    }

    public int byteSize() {
        return byteSize;
    }

    public boolean isInteger() {
        return isInteger;
    }

    public boolean isFloating() {
        return isFloating;
    }

    public boolean isComplex() {
        return isComplex;
    }

    /**
     * Result type of a binary pointwise op. Complex beats floating beats integer beats bool;
     * within a category the wider type wins.
     */
    public static DType promote(DType a, DType b) {
        if (a == b) {
            return a;
        }
        int ca = category(a);
        int cb = category(b);
        if (ca != cb) {
            return ca > cb ? a : b;
        }
        if (a.byteSize != b.byteSize) {
            return a.byteSize > b.byteSize ? a : b;
        }
        // float16 vs bfloat16 and uint8 vs int8 have no lossless common type of equal width
        return a.ordinal() > b.ordinal() ? a : b;
    }

    private static int category(DType t) {
        if (t.isComplex) return 3;
        if (t.isFloating) return 2;
        if (t.isInteger) return 1;
        return 0;
    }

    /**
     * Parse a dtype name, accepting both long ("float32") and short ("f32") spellings.
     */
    public static DType fromName(String name) {
        String n = name.startsWith("torch.") ? name.substring(6) : name;
        return switch (n) {
            case "bool", "i1" -> BOOL;
            case "uint8", "u8" -> UINT8;
            case "int8", "i8" -> INT8;
            case "int16", "i16", "short" -> INT16;
            case "int32", "i32", "int" -> INT32;
            case "int64", "i64", "long" -> INT64;
            case "float16", "f16", "half" -> FLOAT16;
            case "bfloat16", "bf16" -> BFLOAT16;
            case "float32", "f32", "float" -> FLOAT32;
            case "float64", "f64", "double" -> FLOAT64;
            case "complex64", "c64" -> COMPLEX64;
            case "complex128", "c128" -> COMPLEX128;
            default -> throw new IllegalArgumentException("Unknown dtype: " + name);
        };
    }

    @Override
    public String toString() {
        return typeName;
    }
}
