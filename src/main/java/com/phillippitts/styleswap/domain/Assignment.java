package com.phillippitts.styleswap.domain;

import java.util.Objects;

/**
 * Winning style patch for every content patch position, with its correlation score.
 *
 * <p>The grid has one cell per content patch origin: {@code rows = Hc - s + 1},
 * {@code cols = Wc - s + 1}.
 */
public final class Assignment {

    private final int rows;
    private final int cols;
    private final int[] patchIndices;
    private final float[] scores;

    public Assignment(int rows, int cols, int[] patchIndices, float[] scores) {
        Objects.requireNonNull(patchIndices, "patchIndices must not be null");
        Objects.requireNonNull(scores, "scores must not be null");
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Assignment grid must be non-empty, got " + rows + "x" + cols);
        }
        if (patchIndices.length != rows * cols || scores.length != rows * cols) {
            throw new IllegalArgumentException("Assignment arrays must hold " + rows * cols + " entries");
        }
        this.rows = rows;
        this.cols = cols;
        this.patchIndices = patchIndices;
        this.scores = scores;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int patchIndex(int row, int col) {
        return patchIndices[row * cols + col];
    }

    public float score(int row, int col) {
        return scores[row * cols + col];
    }

    public int[] patchIndices() {
        return patchIndices;
    }
}
