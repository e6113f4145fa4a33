package com.phillippitts.styleswap.service.image;

import com.phillippitts.styleswap.config.properties.ImageBoundsProperties;
import org.springframework.stereotype.Component;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Keeps image dimensions within the configured pixel bounds.
 *
 * <p>Both bounds are corrected in two independent passes, height first, then width, each scaling
 * both dimensions and truncating to whole pixels. The second pass looks only at the width, so an
 * image that was below the minimum in both dimensions can end up a pixel short in height or
 * slightly off its original aspect ratio. Result sizes must stay exactly as computed here.
 */
@Component
public class ImageSizeNormalizer {

    private final ImageBoundsProperties bounds;

    public ImageSizeNormalizer(ImageBoundsProperties bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds must not be null");
    }

    public BufferedImage enforceMinimum(BufferedImage image) {
        return enforceMinimum(image, bounds.getMinSize());
    }

    /**
     * Upscales the image until height, then width, reach {@code minSize}.
     * Returns the same instance when no pass applies.
     */
    public BufferedImage enforceMinimum(BufferedImage image, int minSize) {
        Objects.requireNonNull(image, "image must not be null");
        BufferedImage result = image;
        if (result.getHeight() < minSize) {
            result = scale(result, (double) minSize / result.getHeight());
        }
        if (result.getWidth() < minSize) {
            result = scale(result, (double) minSize / result.getWidth());
        }
        return result;
    }

    public BufferedImage enforceMaximum(BufferedImage image) {
        return enforceMaximum(image, bounds.getMaxSize());
    }

    /**
     * Downscales the image until height, then width, fall to {@code maxSize}.
     * Returns the same instance when no pass applies.
     */
    public BufferedImage enforceMaximum(BufferedImage image, int maxSize) {
        Objects.requireNonNull(image, "image must not be null");
        BufferedImage result = image;
        if (result.getHeight() > maxSize) {
            result = scale(result, (double) maxSize / result.getHeight());
        }
        if (result.getWidth() > maxSize) {
            result = scale(result, (double) maxSize / result.getWidth());
        }
        return result;
    }

    /**
     * Applies both bounds, minimum first.
     */
    public BufferedImage normalize(BufferedImage image) {
        return enforceMaximum(enforceMinimum(image));
    }

    /**
     * Resizes a result back to the original content dimensions if the original was upscaled by
     * {@link #enforceMinimum}, so the upscaling is invisible to the caller. Otherwise the result
     * is returned unchanged.
     */
    public BufferedImage restoreOriginalSize(BufferedImage result, int originalWidth, int originalHeight) {
        Objects.requireNonNull(result, "result must not be null");
        int minSize = bounds.getMinSize();
        if (originalHeight < minSize || originalWidth < minSize) {
            return resize(result, originalWidth, originalHeight);
        }
        return result;
    }

    private static BufferedImage scale(BufferedImage image, double factor) {
        int width = (int) (image.getWidth() * factor);
        int height = (int) (image.getHeight() * factor);
        return resize(image, width, height);
    }

    /**
     * Bicubic resize to exactly {@code width × height}.
     */
    public static BufferedImage resize(BufferedImage image, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Target size must be positive, got " + width + "x" + height);
        }
        if (image.getWidth() == width && image.getHeight() == height) {
            return image;
        }
        BufferedImage resized = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = resized.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.drawImage(image, 0, 0, width, height, null);
        } finally {
            g2d.dispose();
        }
        return resized;
    }
}
