package com.phillippitts.styleswap.service.image;

import com.phillippitts.styleswap.domain.FeatureMap;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Conversions between RGB images and normalized float tensors.
 *
 * <p>Normalization uses the ImageNet statistics the extractor was trained with:
 * {@code (v / 255 - MEAN[c]) / STD[c]}.
 */
public final class ImageTensors {

    public static final float[] MEAN = {0.485f, 0.456f, 0.406f};
    public static final float[] STD = {0.229f, 0.224f, 0.225f};

    private ImageTensors() {
    }

    /**
     * @return {@code 3 × H × W} normalized tensor
     */
    public static FeatureMap toNormalizedTensor(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        int width = image.getWidth();
        int height = image.getHeight();
        int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
        FeatureMap tensor = new FeatureMap(3, height, width);
        float[] data = tensor.data();
        int plane = tensor.planeSize();

        for (int p = 0; p < plane; p++) {
            int pixel = rgb[p];
            data[p] = ((((pixel >> 16) & 0xFF) / 255f) - MEAN[0]) / STD[0];
            data[plane + p] = ((((pixel >> 8) & 0xFF) / 255f) - MEAN[1]) / STD[1];
            data[2 * plane + p] = (((pixel & 0xFF) / 255f) - MEAN[2]) / STD[2];
        }
        return tensor;
    }

    /**
     * @return {@code 3 × H × W} tensor with channel values in [0, 1]
     */
    public static FeatureMap toUnitTensor(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        int width = image.getWidth();
        int height = image.getHeight();
        int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
        FeatureMap tensor = new FeatureMap(3, height, width);
        float[] data = tensor.data();
        int plane = tensor.planeSize();

        for (int p = 0; p < plane; p++) {
            int pixel = rgb[p];
            data[p] = ((pixel >> 16) & 0xFF) / 255f;
            data[plane + p] = ((pixel >> 8) & 0xFF) / 255f;
            data[2 * plane + p] = (pixel & 0xFF) / 255f;
        }
        return tensor;
    }
}
