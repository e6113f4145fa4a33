package com.phillippitts.styleswap.service.patchswap;

import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.domain.PatchSet;
import com.phillippitts.styleswap.exception.ShapeMismatchException;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Decomposes a feature map into overlapping unit-stride patches and L2-normalizes them.
 *
 * <p>Enumeration is row-major over patch origins, and patch {@code k} is stored at
 * {@link PatchSet#offset(int)}. {@link PatchAssembler} relies on the same index-to-offset order
 * when it pastes the patch an assignment names.
 */
@Component
public class PatchExtractor {

    /**
     * Extracts all {@code s × s} patches of the feature map.
     *
     * @param featureMap source tensor
     * @param patchSize  side length {@code s}
     * @return patch set with {@code (H - s + 1) × (W - s + 1)} patches
     * @throws ShapeMismatchException if the map is smaller than one patch
     */
    public PatchSet extractPatches(FeatureMap featureMap, int patchSize) {
        Objects.requireNonNull(featureMap, "featureMap must not be null");
        if (patchSize <= 0) {
            throw new IllegalArgumentException("patchSize must be positive, got " + patchSize);
        }
        requireAtLeastOnePatch(featureMap, patchSize);

        int channels = featureMap.channels();
        int rows = featureMap.height() - patchSize + 1;
        int cols = featureMap.width() - patchSize + 1;
        int patchLength = channels * patchSize * patchSize;
        float[] src = featureMap.data();
        float[] out = new float[rows * cols * patchLength];

        int k = 0;
        for (int a = 0; a < rows; a++) {
            for (int b = 0; b < cols; b++) {
                int dst = k * patchLength;
                for (int c = 0; c < channels; c++) {
                    for (int dy = 0; dy < patchSize; dy++) {
                        System.arraycopy(src, featureMap.index(c, a + dy, b), out, dst, patchSize);
                        dst += patchSize;
                    }
                }
                k++;
            }
        }
        return new PatchSet(channels, patchSize, rows, cols, out);
    }

    /**
     * Returns a copy of the patch set with every patch scaled to unit L2 norm, treating all
     * {@code channels × s × s} elements as one vector. A zero patch stays zero.
     */
    public PatchSet normalize(PatchSet patches) {
        Objects.requireNonNull(patches, "patches must not be null");
        int length = patches.patchLength();
        float[] src = patches.data();
        float[] out = new float[src.length];

        for (int k = 0; k < patches.count(); k++) {
            int offset = patches.offset(k);
            double sumSquares = 0.0;
            for (int i = offset; i < offset + length; i++) {
                sumSquares += (double) src[i] * src[i];
            }
            double norm = Math.max(Math.sqrt(sumSquares), PatchSwapConstants.NORM_EPSILON);
            for (int i = offset; i < offset + length; i++) {
                out[i] = (float) (src[i] / norm);
            }
        }
        return new PatchSet(patches.channels(), patches.patchSize(), patches.rows(), patches.cols(), out);
    }

    static void requireAtLeastOnePatch(FeatureMap featureMap, int patchSize) {
        if (featureMap.height() < patchSize || featureMap.width() < patchSize) {
            throw new ShapeMismatchException("Feature map " + featureMap.shape()
                    + " is smaller than a " + patchSize + "x" + patchSize + " patch");
        }
    }
}
