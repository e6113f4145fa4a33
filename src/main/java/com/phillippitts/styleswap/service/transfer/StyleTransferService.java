package com.phillippitts.styleswap.service.transfer;

import com.phillippitts.styleswap.config.logging.TransferMdcFilter;
import com.phillippitts.styleswap.config.properties.TransferConcurrencyProperties;
import com.phillippitts.styleswap.exception.ExternalModelException;
import com.phillippitts.styleswap.exception.ImageDecodeException;
import com.phillippitts.styleswap.exception.ModelNotFoundException;
import com.phillippitts.styleswap.exception.ResourceException;
import com.phillippitts.styleswap.exception.ShapeMismatchException;
import com.phillippitts.styleswap.service.metrics.TransferMetrics;
import com.phillippitts.styleswap.service.model.FeatureExtractor;
import com.phillippitts.styleswap.service.model.InverseNetwork;
import com.phillippitts.styleswap.service.orchestration.StyleTransferOrchestrator;
import com.phillippitts.styleswap.service.storage.TransientImageFile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Caller-side entry point for style transfers.
 *
 * <p>Wraps the orchestrator with a bound on concurrent transfers, lazy network initialization,
 * metrics and timing logs. The outcome is written to the logging context under
 * {@link TransferMdcFilter#TRANSFER_OUTCOME}. Failures propagate unchanged after being counted.
 */
@Service
public class StyleTransferService {

    private static final Logger LOG = LogManager.getLogger(StyleTransferService.class);

    private final StyleTransferOrchestrator orchestrator;
    private final FeatureExtractor extractor;
    private final InverseNetwork inverse;
    private final TransferMetrics metrics;
    private final ConcurrencyGuard guard;

    public StyleTransferService(StyleTransferOrchestrator orchestrator,
                                FeatureExtractor extractor,
                                InverseNetwork inverse,
                                TransferMetrics metrics,
                                TransferConcurrencyProperties concurrency) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.inverse = Objects.requireNonNull(inverse, "inverse must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(concurrency, "concurrency must not be null");
        this.guard = new ConcurrencyGuard(concurrency.getMaxConcurrent(), concurrency.getAcquireTimeoutMs());
    }

    /**
     * Runs one transfer once a concurrency slot is free.
     *
     * @return owning handle to the result PNG; the caller must close it
     */
    public TransientImageFile transfer(Path contentPath, Path stylePath) {
        long startTime = System.nanoTime();
        guard.acquire();
        try {
            extractor.initialize();
            inverse.initialize();
            TransientImageFile result = orchestrator.transferStyle(contentPath, stylePath);
            metrics.recordLatency(System.nanoTime() - startTime);
            metrics.incrementSuccess();
            ThreadContext.put(TransferMdcFilter.TRANSFER_OUTCOME, "success");
            LOG.info("Transfer completed in {} ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
            return result;
        } catch (RuntimeException e) {
            String reason = failureReason(e);
            metrics.incrementFailure(reason);
            ThreadContext.put(TransferMdcFilter.TRANSFER_OUTCOME, reason);
            if ("unexpected".equals(reason)) {
                LOG.error("Unexpected error during style transfer", e);
            } else {
                LOG.warn("Style transfer failed ({}) after {} ms: {}",
                        reason, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime), e.getMessage());
            }
            throw e;
        } finally {
            guard.release();
        }
    }

    int availablePermits() {
        return guard.availablePermits();
    }

    static String failureReason(RuntimeException e) {
        if (e instanceof ImageDecodeException) {
            return "image_decode";
        }
        if (e instanceof ShapeMismatchException) {
            return "shape_mismatch";
        }
        if (e instanceof ExternalModelException || e instanceof ModelNotFoundException) {
            return "external_model";
        }
        if (e instanceof ResourceException) {
            return "resource";
        }
        return "unexpected";
    }
}
