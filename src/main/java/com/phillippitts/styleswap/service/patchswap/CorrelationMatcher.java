package com.phillippitts.styleswap.service.patchswap;

import com.phillippitts.styleswap.domain.Assignment;
import com.phillippitts.styleswap.domain.CorrelationVolume;
import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.domain.PatchSet;
import com.phillippitts.styleswap.exception.ShapeMismatchException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Matches every content patch position to the style patch with the highest correlation.
 *
 * <p>Correlation at content position {@code (i, j)} against style patch {@code k} is the dot
 * product of the content window starting at {@code (i, j)} with normalized patch {@code k},
 * i.e. a stride-1, unpadded convolution using the normalized patches as kernels.
 *
 * <p>Ties always resolve to the lowest patch index.
 */
@Component
public class CorrelationMatcher {

    private static final int PATCH_BLOCK = 4;

    /**
     * Computes the full correlation volume. Memory grows with
     * {@code numPatches × positions}; the pipeline uses {@link #match} instead.
     */
    public CorrelationVolume computeCorrelation(FeatureMap content, PatchSet normalizedPatches) {
        checkShapes(content, normalizedPatches);
        int s = normalizedPatches.patchSize();
        int rows = content.height() - s + 1;
        int cols = content.width() - s + 1;
        int numPatches = normalizedPatches.count();
        float[] values = new float[numPatches * rows * cols];

        IntStream.range(0, rows).parallel().forEach(i -> {
            RowScratch scratch = new RowScratch(normalizedPatches.patchLength(), cols);
            scratch.unfold(content, s, i);
            for (int k = 0; k < numPatches; k += PATCH_BLOCK) {
                int block = Math.min(PATCH_BLOCK, numPatches - k);
                scratch.correlate(normalizedPatches, k, block);
                for (int b = 0; b < block; b++) {
                    System.arraycopy(scratch.acc[b], 0, values, ((k + b) * rows + i) * cols, cols);
                }
            }
        });
        return new CorrelationVolume(numPatches, rows, cols, values);
    }

    /**
     * Takes the argmax over the patch axis at every position.
     */
    public Assignment selectBestMatch(CorrelationVolume volume) {
        Objects.requireNonNull(volume, "volume must not be null");
        int rows = volume.rows();
        int cols = volume.cols();
        int[] indices = new int[rows * cols];
        float[] scores = new float[rows * cols];

        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                int best = 0;
                float bestScore = volume.get(0, i, j);
                for (int k = 1; k < volume.numPatches(); k++) {
                    float score = volume.get(k, i, j);
                    if (score > bestScore) {
                        best = k;
                        bestScore = score;
                    }
                }
                indices[i * cols + j] = best;
                scores[i * cols + j] = bestScore;
            }
        }
        return new Assignment(rows, cols, indices, scores);
    }

    /**
     * Correlation and argmax in one pass, without materializing the volume.
     * Produces the same assignment and scores as {@code selectBestMatch(computeCorrelation(...))}.
     *
     * <p>Output rows are scored in parallel. Within a row, all windows are unfolded into a
     * {@code patchLength × cols} matrix and four patches are accumulated at a time, so the inner
     * loop is a contiguous multiply-add over the row's positions.
     */
    public Assignment match(FeatureMap content, PatchSet normalizedPatches) {
        checkShapes(content, normalizedPatches);
        int s = normalizedPatches.patchSize();
        int rows = content.height() - s + 1;
        int cols = content.width() - s + 1;
        int numPatches = normalizedPatches.count();
        int[] indices = new int[rows * cols];
        float[] scores = new float[rows * cols];

        IntStream.range(0, rows).parallel().forEach(i -> {
            RowScratch scratch = new RowScratch(normalizedPatches.patchLength(), cols);
            scratch.unfold(content, s, i);
            int rowStart = i * cols;
            for (int k = 0; k < numPatches; k += PATCH_BLOCK) {
                int block = Math.min(PATCH_BLOCK, numPatches - k);
                scratch.correlate(normalizedPatches, k, block);
                for (int b = 0; b < block; b++) {
                    float[] acc = scratch.acc[b];
                    for (int j = 0; j < cols; j++) {
                        if (k + b == 0 || acc[j] > scores[rowStart + j]) {
                            indices[rowStart + j] = k + b;
                            scores[rowStart + j] = acc[j];
                        }
                    }
                }
            }
        });
        return new Assignment(rows, cols, indices, scores);
    }

    private static void checkShapes(FeatureMap content, PatchSet patches) {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(patches, "patches must not be null");
        if (content.channels() != patches.channels()) {
            throw new ShapeMismatchException("Content feature map has " + content.channels()
                    + " channels but style patches have " + patches.channels());
        }
        PatchExtractor.requireAtLeastOnePatch(content, patches.patchSize());
    }

    /**
     * Per-row working buffers. Row {@code l} of {@code windows} holds element {@code l} of every
     * window in the output row, in the CHW order of a patch.
     */
    private static final class RowScratch {

        private final int length;
        private final int cols;
        private final float[] windows;
        private final float[][] acc;

        RowScratch(int length, int cols) {
            this.length = length;
            this.cols = cols;
            this.windows = new float[length * cols];
            this.acc = new float[PATCH_BLOCK][cols];
        }

        void unfold(FeatureMap content, int s, int row) {
            float[] src = content.data();
            int l = 0;
            for (int c = 0; c < content.channels(); c++) {
                for (int dy = 0; dy < s; dy++) {
                    for (int dx = 0; dx < s; dx++) {
                        System.arraycopy(src, content.index(c, row + dy, dx), windows, l * cols, cols);
                        l++;
                    }
                }
            }
        }

        // Every patch is summed in the same element order, whichever block it falls in.
        void correlate(PatchSet patches, int first, int block) {
            float[] data = patches.data();
            if (block == PATCH_BLOCK) {
                correlateFour(data, patches.offset(first), patches.offset(first + 1),
                        patches.offset(first + 2), patches.offset(first + 3));
                return;
            }
            for (int b = 0; b < block; b++) {
                correlateOne(data, patches.offset(first + b), acc[b]);
            }
        }

        private void correlateFour(float[] data, int o0, int o1, int o2, int o3) {
            float[] a0 = acc[0];
            float[] a1 = acc[1];
            float[] a2 = acc[2];
            float[] a3 = acc[3];
            Arrays.fill(a0, 0f);
            Arrays.fill(a1, 0f);
            Arrays.fill(a2, 0f);
            Arrays.fill(a3, 0f);
            for (int l = 0; l < length; l++) {
                float w0 = data[o0 + l];
                float w1 = data[o1 + l];
                float w2 = data[o2 + l];
                float w3 = data[o3 + l];
                int base = l * cols;
                for (int j = 0; j < cols; j++) {
                    float x = windows[base + j];
                    a0[j] += w0 * x;
                    a1[j] += w1 * x;
                    a2[j] += w2 * x;
                    a3[j] += w3 * x;
                }
            }
        }

        private void correlateOne(float[] data, int offset, float[] out) {
            Arrays.fill(out, 0f);
            for (int l = 0; l < length; l++) {
                float w = data[offset + l];
                int base = l * cols;
                for (int j = 0; j < cols; j++) {
                    out[j] += w * windows[base + j];
                }
            }
        }
    }
}
