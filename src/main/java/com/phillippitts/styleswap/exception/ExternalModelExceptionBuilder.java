package com.phillippitts.styleswap.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ExternalModelException} with contextual details.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ExternalModelExceptionBuilder.create("Forward pass failed")
 *         .network("extractor")
 *         .cause(exception)
 *         .metadata("inputShape", "1x3x228x342")
 *         .build();
 * </pre>
 */
public final class ExternalModelExceptionBuilder {

    private final String message;
    private String networkName;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ExternalModelExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ExternalModelExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ExternalModelExceptionBuilder(message);
    }

    public ExternalModelExceptionBuilder network(String networkName) {
        this.networkName = networkName;
        return this;
    }

    public ExternalModelExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ExternalModelExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are skipped.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ExternalModelExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (durationMs={ms}, {key1}={val1}, ...) (network: {network})
     * </pre>
     *
     * @return constructed ExternalModelException
     */
    public ExternalModelException build() {
        String detailedMessage = buildDetailedMessage();
        String network = networkName != null ? networkName : "unknown";

        if (cause != null) {
            return new ExternalModelException(detailedMessage, network, cause);
        }
        return new ExternalModelException(detailedMessage, network);
    }

    private String buildDetailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
