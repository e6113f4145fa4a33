package com.phillippitts.styleswap.domain;

import java.util.Objects;

/**
 * Dense float tensor of shape channels × height × width, stored channel-major (CHW).
 *
 * <p>Used for every tensor that flows through the pipeline: the normalized image fed to the
 * feature extractor, the feature maps it produces, the reconstructed feature map, and the
 * 3-channel pixel tensor returned by the inverse network.
 *
 * <p>The backing array is shared, not copied: {@link #data()} exposes it so adapters can hand it
 * to native runtimes without an extra copy. Callers that need isolation should {@link #copy()}.
 */
public final class FeatureMap {

    private final int channels;
    private final int height;
    private final int width;
    private final float[] data;

    /**
     * Creates a zero-filled tensor.
     */
    public FeatureMap(int channels, int height, int width) {
        this(channels, height, width, new float[checkedSize(channels, height, width)]);
    }

    /**
     * Wraps an existing CHW array.
     *
     * @throws IllegalArgumentException if a dimension is not positive or the array length does not match
     */
    public FeatureMap(int channels, int height, int width, float[] data) {
        Objects.requireNonNull(data, "data must not be null");
        int expected = checkedSize(channels, height, width);
        if (data.length != expected) {
            throw new IllegalArgumentException(
                    "Data length " + data.length + " does not match shape "
                            + channels + "x" + height + "x" + width);
        }
        this.channels = channels;
        this.height = height;
        this.width = width;
        this.data = data;
    }

    private static int checkedSize(int channels, int height, int width) {
        if (channels <= 0 || height <= 0 || width <= 0) {
            throw new IllegalArgumentException(
                    "Dimensions must be positive, got " + channels + "x" + height + "x" + width);
        }
        return Math.multiplyExact(Math.multiplyExact(channels, height), width);
    }

    public int channels() {
        return channels;
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    /** Number of elements in one channel plane. */
    public int planeSize() {
        return height * width;
    }

    public float[] data() {
        return data;
    }

    public int index(int channel, int y, int x) {
        return (channel * height + y) * width + x;
    }

    public float get(int channel, int y, int x) {
        return data[index(channel, y, x)];
    }

    public void set(int channel, int y, int x, float value) {
        data[index(channel, y, x)] = value;
    }

    public FeatureMap copy() {
        return new FeatureMap(channels, height, width, data.clone());
    }

    /** Shape as {@code CxHxW}, for log and error messages. */
    public String shape() {
        return channels + "x" + height + "x" + width;
    }

    @Override
    public String toString() {
        return "FeatureMap[" + shape() + "]";
    }
}
