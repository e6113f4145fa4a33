package com.phillippitts.styleswap.service.postprocess;

import com.phillippitts.styleswap.domain.FeatureMap;
import com.phillippitts.styleswap.exception.ShapeMismatchException;
import com.phillippitts.styleswap.service.image.ImageTensors;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Turns the inverse network's output back into a displayable image.
 *
 * <p>Every step returns a new tensor; inputs are never modified.
 */
@Component
public class PixelPostProcessor {

    private static final int RGB_CHANNELS = 3;

    /**
     * Reverses input normalization ({@code x * STD[c] + MEAN[c]}) and clamps to [0, 1].
     *
     * @param tensor 3-channel tensor in normalized space
     * @return tensor in [0, 1]
     */
    public FeatureMap denormalize(FeatureMap tensor) {
        requireRgb(tensor, "denormalize");
        FeatureMap out = new FeatureMap(RGB_CHANNELS, tensor.height(), tensor.width());
        float[] src = tensor.data();
        float[] dst = out.data();
        int plane = tensor.planeSize();
        for (int c = 0; c < RGB_CHANNELS; c++) {
            float std = ImageTensors.STD[c];
            float mean = ImageTensors.MEAN[c];
            int base = c * plane;
            for (int p = 0; p < plane; p++) {
                dst[base + p] = clampUnit(src[base + p] * std + mean);
            }
        }
        return out;
    }

    /**
     * Global moment match against the raw style image scaled to [0, 1].
     *
     * @see #colorMatch(FeatureMap, FeatureMap)
     */
    public FeatureMap colorMatch(FeatureMap result, BufferedImage style) {
        Objects.requireNonNull(style, "style must not be null");
        return colorMatch(result, ImageTensors.toUnitTensor(style));
    }

    /**
     * Rescales {@code result} so that its mean and standard deviation, taken over all pixels and
     * channels together, equal those of {@code style}; then clips to [0, 1].
     *
     * <p>A uniform result (standard deviation 0) only has its mean shifted.
     *
     * @param result tensor in [0, 1]
     * @param style  style tensor in [0, 1], any spatial size
     * @return colour-matched tensor
     */
    public FeatureMap colorMatch(FeatureMap result, FeatureMap style) {
        requireRgb(result, "colorMatch");
        requireRgb(style, "colorMatch");

        double[] resultMoments = moments(result.data());
        double[] styleMoments = moments(style.data());
        double resultMean = resultMoments[0];
        double resultStd = resultMoments[1];
        double styleMean = styleMoments[0];
        double styleStd = styleMoments[1];

        FeatureMap out = new FeatureMap(RGB_CHANNELS, result.height(), result.width());
        float[] src = result.data();
        float[] dst = out.data();
        for (int i = 0; i < src.length; i++) {
            double centred = src[i] - resultMean;
            double value = resultStd > 0
                    ? centred / resultStd * styleStd + styleMean
                    : centred + styleMean;
            dst[i] = clampUnit((float) value);
        }
        return out;
    }

    /**
     * Scales to 0..255, rounds to the nearest integer and packs an RGB image.
     */
    public BufferedImage toImage(FeatureMap tensor) {
        requireRgb(tensor, "toImage");
        int width = tensor.width();
        int height = tensor.height();
        int plane = tensor.planeSize();
        float[] data = tensor.data();
        int[] rgb = new int[plane];
        for (int p = 0; p < plane; p++) {
            int r = toByte(data[p]);
            int g = toByte(data[plane + p]);
            int b = toByte(data[2 * plane + p]);
            rgb[p] = (r << 16) | (g << 8) | b;
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, rgb, 0, width);
        return image;
    }

    /**
     * @return {mean, population standard deviation}
     */
    static double[] moments(float[] values) {
        double sum = 0.0;
        for (float v : values) {
            sum += v;
        }
        double mean = sum / values.length;
        double squares = 0.0;
        for (float v : values) {
            double d = v - mean;
            squares += d * d;
        }
        return new double[]{mean, Math.sqrt(squares / values.length)};
    }

    private static int toByte(float unit) {
        int value = Math.round(unit * 255f);
        return Math.max(0, Math.min(255, value));
    }

    private static float clampUnit(float value) {
        if (value < 0f) {
            return 0f;
        }
        return Math.min(value, 1f);
    }

    private static void requireRgb(FeatureMap tensor, String operation) {
        Objects.requireNonNull(tensor, "tensor must not be null");
        if (tensor.channels() != RGB_CHANNELS) {
            throw new ShapeMismatchException(operation + " expects a 3-channel tensor, got " + tensor.shape());
        }
    }
}
