package com.phillippitts.styleswap.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for style transfers.
 *
 * <p>Provides:
 * <ul>
 *   <li>end-to-end transfer latency</li>
 *   <li>success count</li>
 *   <li>failure count tagged with the failure reason</li>
 * </ul>
 *
 * <p>Exposed at /actuator/prometheus.
 */
@Component
public class TransferMetrics {

    private static final String METRIC_PREFIX = "styleswap.transfer";

    private final MeterRegistry registry;

    public TransferMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to run one style transfer")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess() {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful style transfers")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason (image_decode, shape_mismatch, external_model, resource, unexpected)
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed style transfers")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
