package com.phillippitts.styleswap.exception;

/**
 * Thrown when a local resource is unavailable: the transient output file cannot be created or
 * written, or no transfer slot frees up in time.
 */
public class ResourceException extends StyleSwapException {

    public ResourceException(String message) {
        super(message);
    }

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
