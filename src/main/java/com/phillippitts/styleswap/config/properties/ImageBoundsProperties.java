package com.phillippitts.styleswap.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pixel size bounds applied to both input images before feature extraction.
 *
 * <p>Example application.properties:
 * <pre>
 * transfer.image.min-size=228
 * transfer.image.max-size=512
 * </pre>
 */
@ConfigurationProperties(prefix = "transfer.image")
@Validated
public class ImageBoundsProperties {

    /** Smallest allowed height and width; smaller images are upscaled. */
    @Positive(message = "Minimum image size must be positive")
    private int minSize = 228;

    /** Largest allowed height and width; larger images are downscaled. */
    @Positive(message = "Maximum image size must be positive")
    private int maxSize = 512;

    public int getMinSize() {
        return minSize;
    }

    public void setMinSize(int minSize) {
        this.minSize = minSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(int maxSize) {
        this.maxSize = maxSize;
    }

    @AssertTrue(message = "Minimum image size must not exceed maximum image size")
    public boolean isMinSizeWithinMax() {
        return minSize <= maxSize;
    }
}
