package org.yafin.image;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable dense pixel array of shape (H, W) or (H, W, C), samples interleaved per pixel.
 * Samples are held as doubles so that every supported {@link PixelType}, including 32-bit
 * unsigned integers, is represented exactly.
 */
public final class PixelBuffer {

    private final PixelType type;
    private final int height;
    private final int width;
    private final int channels;
    private final boolean channelAxis;
    private final double[] data;

    private PixelBuffer(PixelType type, int height, int width, int channels, boolean channelAxis, double[] data) {
        this.type = Objects.requireNonNull(type, "type");
        if (height <= 0 || width <= 0 || channels <= 0) {
            throw new IllegalArgumentException("Invalid shape: " + height + "x" + width + "x" + channels);
        }
        if (data.length != height * width * channels) {
            throw new IllegalArgumentException("Data length " + data.length + " does not match shape "
                    + height + "x" + width + "x" + channels);
        }
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.channelAxis = channelAxis;
        this.data = data;
        checkRange();
    }

    /**
     * Creates a 2-D (single channel) buffer. The array is copied.
     */
    public static PixelBuffer of(PixelType type, int height, int width, double[] data) {
        return new PixelBuffer(type, height, width, 1, false, data.clone());
    }

    /**
     * Creates a 3-D buffer with an explicit channel axis. The array is copied.
     */
    public static PixelBuffer of(PixelType type, int height, int width, int channels, double[] data) {
        return new PixelBuffer(type, height, width, channels, true, data.clone());
    }

    /**
     * Wraps an array without copying. The caller hands over ownership and must not modify it afterwards.
     */
    public static PixelBuffer wrap(PixelType type, int height, int width, int channels, boolean channelAxis, double[] data) {
        return new PixelBuffer(type, height, width, channels, channelAxis, data);
    }

    private void checkRange() {
        if (type.isFloatingPoint()) return;
        final double max = type.maxValue();
        for (int i = 0; i < data.length; i++) {
            double v = data[i];
            if (v < 0 || v > max || v != Math.rint(v)) {
                throw new IllegalArgumentException("Sample " + v + " at index " + i + " does not fit " + type);
            }
        }
    }

    public PixelType type() {
        return type;
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    public int channels() {
        return channels;
    }

    /**
     * Whether the shape carries a channel axis, i.e. is (H, W, C) rather than (H, W).
     */
    public boolean hasChannelAxis() {
        return channelAxis;
    }

    public int dimensions() {
        return channelAxis ? 3 : 2;
    }

    /**
     * (H, W) or (H, W, C), in the order of the numpy-style shape tuple.
     */
    public int[] shape() {
        return channelAxis ? new int[]{height, width, channels} : new int[]{height, width};
    }

    /**
     * Single channel means a 2-D buffer or a 3-D buffer with one channel.
     */
    public boolean isSingleChannel() {
        return channels == 1;
    }

    public int pixelCount() {
        return height * width;
    }

    public int sampleCount() {
        return data.length;
    }

    public double sample(int index) {
        return data[index];
    }

    public double get(int y, int x, int c) {
        return data[(y * width + x) * channels + c];
    }

    public double get(int y, int x) {
        return get(y, x, 0);
    }

    /**
     * Copy of the interleaved sample array.
     */
    public double[] samples() {
        return data.clone();
    }

    /**
     * Copy of one channel's samples in row-major order.
     */
    public double[] channel(int c) {
        if (c < 0 || c >= channels) throw new IndexOutOfBoundsException("Channel " + c + " of " + channels);
        double[] out = new double[pixelCount()];
        for (int i = 0, j = c; i < out.length; i++, j += channels) {
            out[i] = data[j];
        }
        return out;
    }

    public double min() {
        double min = Double.POSITIVE_INFINITY;
        for (double v : data) {
            if (v < min) min = v;
        }
        return min;
    }

    public double max() {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : data) {
            if (v > max) max = v;
        }
        return max;
    }

    public String shapeString() {
        return Arrays.toString(shape());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer)) return false;
        PixelBuffer other = (PixelBuffer) o;
        return type == other.type && height == other.height && width == other.width
                && channels == other.channels && channelAxis == other.channelAxis
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, height, width, channels, channelAxis, Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        return "PixelBuffer{" + type + ", shape=" + shapeString() + "}";
    }
}
