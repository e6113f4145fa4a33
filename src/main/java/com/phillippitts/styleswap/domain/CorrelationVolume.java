package com.phillippitts.styleswap.domain;

import java.util.Objects;

/**
 * Dot products of every content patch position against every normalized style patch,
 * laid out as {@code numPatches × rows × cols}.
 */
public final class CorrelationVolume {

    private final int numPatches;
    private final int rows;
    private final int cols;
    private final float[] values;

    public CorrelationVolume(int numPatches, int rows, int cols, float[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if ((long) numPatches * rows * cols != values.length) {
            throw new IllegalArgumentException("Volume length " + values.length + " does not match "
                    + numPatches + "x" + rows + "x" + cols);
        }
        this.numPatches = numPatches;
        this.rows = rows;
        this.cols = cols;
        this.values = values;
    }

    public int numPatches() {
        return numPatches;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public float get(int patch, int row, int col) {
        return values[(patch * rows + row) * cols + col];
    }
}
