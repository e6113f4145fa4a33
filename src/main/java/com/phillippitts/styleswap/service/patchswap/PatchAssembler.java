package com.phillippitts.styleswap.service.patchswap;

import com.phillippitts.styleswap.domain.Assignment;
import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.domain.PatchSet;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Rebuilds a feature map from matched style patches by overlap-add.
 *
 * <p>Each content position {@code (i, j)} contributes its winning raw style patch to the output
 * window {@code [i, i + s) × [j, j + s)}. The sums and the per-pixel coverage counts are
 * accumulated in one pass, then every output value is divided by its count. This is the
 * transposed convolution of a one-hot indicator volume with the style patches, followed by
 * division by the transposed convolution of an all-ones patch, without building either volume.
 */
@Component
public class PatchAssembler {

    /**
     * Reconstructs the swapped feature map.
     *
     * @param assignment   winning style patch per content position
     * @param stylePatches raw (unnormalized) style patches, in the order used for matching
     * @return feature map of shape {@code C × (rows + s - 1) × (cols + s - 1)}
     * @throws IllegalArgumentException if the assignment references a patch outside the set
     * @throws IllegalStateException if some output position ends up uncovered
     */
    public FeatureMap reconstruct(Assignment assignment, PatchSet stylePatches) {
        Objects.requireNonNull(assignment, "assignment must not be null");
        Objects.requireNonNull(stylePatches, "stylePatches must not be null");

        int s = stylePatches.patchSize();
        int channels = stylePatches.channels();
        int height = assignment.rows() + s - 1;
        int width = assignment.cols() + s - 1;
        FeatureMap result = new FeatureMap(channels, height, width);
        float[] out = result.data();
        float[] patches = stylePatches.data();
        int[] counts = new int[height * width];

        for (int i = 0; i < assignment.rows(); i++) {
            for (int j = 0; j < assignment.cols(); j++) {
                int k = assignment.patchIndex(i, j);
                if (k < 0 || k >= stylePatches.count()) {
                    throw new IllegalArgumentException("Assignment at (" + i + ", " + j
                            + ") references patch " + k + " of " + stylePatches.count());
                }
                int src = stylePatches.offset(k);
                for (int c = 0; c < channels; c++) {
                    for (int dy = 0; dy < s; dy++) {
                        int dst = result.index(c, i + dy, j);
                        for (int dx = 0; dx < s; dx++) {
                            out[dst + dx] += patches[src++];
                        }
                    }
                }
                for (int dy = 0; dy < s; dy++) {
                    int row = (i + dy) * width + j;
                    for (int dx = 0; dx < s; dx++) {
                        counts[row + dx]++;
                    }
                }
            }
        }

        divideByCoverage(result, counts);
        return result;
    }

    /**
     * Coverage grid for an assignment of {@code rows × cols} positions: how many {@code s × s}
     * patches overlap each output pixel.
     *
     * @return counts indexed {@code [y][x]}, of size {@code (rows + s - 1) × (cols + s - 1)}
     */
    public int[][] overlapCount(int rows, int cols, int patchSize) {
        if (rows <= 0 || cols <= 0 || patchSize <= 0) {
            throw new IllegalArgumentException("rows, cols and patchSize must be positive");
        }
        int[][] counts = new int[rows + patchSize - 1][cols + patchSize - 1];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                for (int dy = 0; dy < patchSize; dy++) {
                    for (int dx = 0; dx < patchSize; dx++) {
                        counts[i + dy][j + dx]++;
                    }
                }
            }
        }
        return counts;
    }

    private static void divideByCoverage(FeatureMap result, int[] counts) {
        float[] out = result.data();
        int plane = result.planeSize();
        for (int p = 0; p < plane; p++) {
            int count = counts[p];
            if (count == 0) {
                throw new IllegalStateException("Output position " + (p / result.width()) + ","
                        + (p % result.width()) + " is not covered by any patch");
            }
            for (int c = 0; c < result.channels(); c++) {
                out[c * plane + p] /= count;
            }
        }
    }
}
