package com.phillippitts.styleswap.exception;

/**
 * Thrown when a forward pass through one of the external networks fails.
 * This covers session creation, tensor conversion and inference errors.
 */
public class ExternalModelException extends StyleSwapException {

    private final String networkName;

    public ExternalModelException(String message) {
        super(message);
        this.networkName = "unknown";
    }

    public ExternalModelException(String message, String networkName) {
        super(message + " (network: " + networkName + ")");
        this.networkName = networkName;
    }

    public ExternalModelException(String message, Throwable cause) {
        super(message, cause);
        this.networkName = "unknown";
    }

    public ExternalModelException(String message, String networkName, Throwable cause) {
        super(message + " (network: " + networkName + ")", cause);
        this.networkName = networkName;
    }

    public String getNetworkName() {
        return networkName;
    }
}
