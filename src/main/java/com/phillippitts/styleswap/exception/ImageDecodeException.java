package com.phillippitts.styleswap.exception;

/**
 * Thrown when an input image cannot be read or decoded (missing file, unsupported or corrupt format).
 */
public class ImageDecodeException extends StyleSwapException {

    private final String imagePath;

    public ImageDecodeException(String imagePath, String reason) {
        super("Cannot decode image " + imagePath + ": " + reason);
        this.imagePath = imagePath;
    }

    public ImageDecodeException(String imagePath, String reason, Throwable cause) {
        super("Cannot decode image " + imagePath + ": " + reason, cause);
        this.imagePath = imagePath;
    }

    public String getImagePath() {
        return imagePath;
    }
}
