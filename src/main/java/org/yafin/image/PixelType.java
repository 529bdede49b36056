package org.yafin.image;

/**
 * Element type of a {@link PixelBuffer}.
 */
public enum PixelType {
    UINT8("uint8", 8, false),
    UINT16("uint16", 16, false),
    UINT32("uint32", 32, false),
    FLOAT32("float32", 32, true),
    FLOAT64("float64", 64, true);

    private final String label;
    private final int bits;
    private final boolean floatingPoint;

    PixelType(String label, int bits, boolean floatingPoint) {
        this.label = label;
        this.bits = bits;
        this.floatingPoint = floatingPoint;
    }

    public String label() {
        return label;
    }

    public boolean isFloatingPoint() {
        return floatingPoint;
    }

    /**
     * True for unsigned integer types wider than 8 bits, the types percentile normalization applies to.
     */
    public boolean isWideInteger() {
        return !floatingPoint && bits > 8;
    }

    /**
     * Largest representable value for integer types, {@code Double.MAX_VALUE} otherwise.
     */
    public double maxValue() {
        return floatingPoint ? Double.MAX_VALUE : Math.pow(2, bits) - 1;
    }

    /**
     * Smallest integer type able to hold samples of the given bit width.
     */
    public static PixelType forIntegerBits(int bits) {
        if (bits <= 8) return UINT8;
        if (bits <= 16) return UINT16;
        if (bits <= 32) return UINT32;
        throw new IllegalArgumentException("Unsupported integer sample size: " + bits + " bits");
    }

    @Override
    public String toString() {
        return label;
    }
}
