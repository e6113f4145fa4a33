package com.phillippitts.styleswap.exception;

/**
 * Thrown when a network model file cannot be found at the configured path.
 * This is a fatal error that prevents the service from starting.
 */
public class ModelNotFoundException extends StyleSwapException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Network model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, Throwable cause) {
        super("Network model not found at path: " + modelPath, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
