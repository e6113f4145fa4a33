package com.phillippitts.styleswap.config.model;

/**
 * Constants for network model validation.
 */
public final class ModelConstants {

    /**
     * Smallest plausible ONNX graph with weights (64 KB). Anything smaller is most likely a
     * Git LFS pointer or a truncated download.
     */
    public static final long MIN_MODEL_SIZE_BYTES = 64L * 1024;

    private ModelConstants() {
        // Constants class - prevent instantiation
    }
}
