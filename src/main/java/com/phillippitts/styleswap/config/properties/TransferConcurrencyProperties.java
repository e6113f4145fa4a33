package com.phillippitts.styleswap.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Limits on concurrent style transfers.
 *
 * <p>The network sessions are shared between requests, so the default of one transfer at a time
 * serializes access to them. Raise it only for runtimes known to be reentrant.
 */
@ConfigurationProperties(prefix = "transfer.concurrency")
@Validated
public class TransferConcurrencyProperties {

    @Positive(message = "Max concurrent transfers must be positive")
    private int maxConcurrent = 1;

    /** How long a request waits for a free slot before failing. Covers several queued 512 px transfers. */
    @Min(value = 0, message = "Acquire timeout must not be negative")
    private long acquireTimeoutMs = 300_000;

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public long getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }
}
