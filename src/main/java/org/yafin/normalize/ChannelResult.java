package org.yafin.normalize;

import org.yafin.image.PixelBuffer;

/**
 * Result of {@link ChannelNormalizer#normalize(PixelBuffer)}: a canonical RGB 8-bit buffer, or an
 * unsupported signal with its reason.
 */
public record ChannelResult(PixelBuffer buffer, Conversion conversion, String reason) {

    public static ChannelResult of(PixelBuffer buffer, Conversion conversion) {
        return new ChannelResult(buffer, conversion, null);
    }

    public static ChannelResult unsupported(String reason) {
        return new ChannelResult(null, Conversion.UNSUPPORTED, reason);
    }

    public boolean isSupported() {
        return conversion != Conversion.UNSUPPORTED;
    }

    /**
     * True when the bit depth was reduced (percentile normalization or float range mapping), which is
     * when the pipeline writes an output image.
     */
    public boolean wasNormalized() {
        return conversion == Conversion.PERCENTILE || conversion == Conversion.RANGE_MAPPED;
    }
}
