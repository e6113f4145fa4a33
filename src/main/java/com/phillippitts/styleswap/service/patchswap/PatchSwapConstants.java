package com.phillippitts.styleswap.service.patchswap;

/**
 * Fixed geometry of the patch swap.
 */
public final class PatchSwapConstants {

    /** Side length of the square swap patch. Stride is always 1. */
    public static final int PATCH_SIZE = 3;

    /** Lower bound on a patch norm during L2 normalization; keeps zero patches at zero. */
    public static final float NORM_EPSILON = 1e-12f;

    private PatchSwapConstants() {
        // Constants class - prevent instantiation
    }
}
