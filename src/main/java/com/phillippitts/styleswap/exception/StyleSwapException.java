package com.phillippitts.styleswap.exception;

/**
 * Base exception for all StyleSwap application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class StyleSwapException extends RuntimeException {

    public StyleSwapException(String message) {
        super(message);
    }

    public StyleSwapException(String message, Throwable cause) {
        super(message, cause);
    }

    public StyleSwapException(Throwable cause) {
        super(cause);
    }
}
