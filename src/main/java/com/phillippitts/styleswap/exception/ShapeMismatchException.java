package com.phillippitts.styleswap.exception;

/**
 * Thrown when two tensors that must agree in shape do not, e.g. content and style feature maps
 * with different channel depths, or a feature map smaller than the swap patch.
 *
 * <p>With a fixed feature extractor this should be unreachable; it guards against misconfigured models.
 */
public class ShapeMismatchException extends StyleSwapException {

    public ShapeMismatchException(String message) {
        super(message);
    }
}
