package com.phillippitts.styleswap.domain;

import java.util.Objects;

/**
 * All unit-stride square patches of a feature map, in canonical row-major order of their
 * top-left corner.
 *
 * <p>Patch {@code k} originates at row {@code k / cols} and column {@code k % cols}, where
 * {@code rows = H - s + 1} and {@code cols = W - s + 1}. Each patch is stored contiguously as a
 * {@code channels × s × s} block in channel-major order, so a patch is also a plain vector of
 * length {@link #patchLength()}.
 */
public final class PatchSet {

    private final int channels;
    private final int patchSize;
    private final int rows;
    private final int cols;
    private final float[] data;

    public PatchSet(int channels, int patchSize, int rows, int cols, float[] data) {
        Objects.requireNonNull(data, "data must not be null");
        if (channels <= 0 || patchSize <= 0 || rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("PatchSet dimensions must be positive");
        }
        long expected = (long) rows * cols * channels * patchSize * patchSize;
        if (data.length != expected) {
            throw new IllegalArgumentException(
                    "Data length " + data.length + " does not match " + rows * cols + " patches of "
                            + channels + "x" + patchSize + "x" + patchSize);
        }
        this.channels = channels;
        this.patchSize = patchSize;
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    public int channels() {
        return channels;
    }

    public int patchSize() {
        return patchSize;
    }

    /** Number of patch origins along the vertical axis. */
    public int rows() {
        return rows;
    }

    /** Number of patch origins along the horizontal axis. */
    public int cols() {
        return cols;
    }

    public int count() {
        return rows * cols;
    }

    public int patchLength() {
        return channels * patchSize * patchSize;
    }

    public float[] data() {
        return data;
    }

    /** Offset of the first element of patch {@code k} in {@link #data()}. */
    public int offset(int k) {
        return k * patchLength();
    }

    public float get(int k, int channel, int dy, int dx) {
        return data[offset(k) + (channel * patchSize + dy) * patchSize + dx];
    }

    public int originRow(int k) {
        return k / cols;
    }

    public int originCol(int k) {
        return k % cols;
    }

    public int indexOf(int originRow, int originCol) {
        return originRow * cols + originCol;
    }
}
