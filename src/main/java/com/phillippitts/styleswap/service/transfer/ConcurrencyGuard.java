package com.phillippitts.styleswap.service.transfer;

import com.phillippitts.styleswap.exception.ResourceException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds the number of style transfers running at once.
 *
 * <p>Network sessions are shared between calls, so transfers queue here for up to the configured
 * timeout instead of hitting the adapters concurrently.
 *
 * <pre>{@code
 * guard.acquire(); // blocks until a permit is free or the timeout expires
 * try {
 *     // ... run transfer ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> thread-safe; the {@link Semaphore} is fair so callers are served in
 * arrival order.
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final long timeoutMs;

    /**
     * @param permits   maximum concurrent holders
     * @param timeoutMs maximum wait for a permit in milliseconds
     */
    public ConcurrencyGuard(int permits, long timeoutMs) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive, got " + permits);
        }
        this.semaphore = new Semaphore(permits, true);
        this.timeoutMs = timeoutMs;
    }

    /**
     * @throws ResourceException if no permit frees up within the timeout or the thread is
     *         interrupted while waiting
     */
    public void acquire() {
        try {
            boolean acquired = semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new ResourceException(
                        "Style transfer concurrency limit reached after " + timeoutMs + "ms wait");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceException("Interrupted while waiting for a style transfer slot", e);
        }
    }

    /**
     * Releases a permit taken by {@link #acquire()}. Call from a finally block.
     */
    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
