package com.phillippitts.selfconsistency.service.provider;

import com.phillippitts.selfconsistency.exception.ProviderException;
import com.phillippitts.selfconsistency.util.Deadline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds the number of model calls in flight across all requests.
 *
 * <p>Waiting is bounded by the caller's request deadline: a call that cannot get a permit
 * before the deadline fails with {@link ProviderException} instead of queueing forever.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. The underlying {@link Semaphore}
 * handles concurrent acquire/release operations safely.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * guard.acquire(deadline);
 * try {
 *     client.complete(request);
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 */
public final class ProviderCallGuard {

    private static final Logger LOG = LogManager.getLogger(ProviderCallGuard.class);

    private final Semaphore semaphore;
    private final int maxInFlight;

    public ProviderCallGuard(int maxInFlight) {
        if (maxInFlight <= 0) {
            throw new IllegalArgumentException("maxInFlight must be positive, got: " + maxInFlight);
        }
        this.maxInFlight = maxInFlight;
        this.semaphore = new Semaphore(maxInFlight, true);
    }

    /**
     * Acquires a call permit, blocking at most until the deadline expires.
     *
     * @throws ProviderException if no permit was available before the deadline
     *         or the thread was interrupted while waiting
     */
    public void acquire(Deadline deadline) {
        long waitMs = deadline.remainingMillis();
        try {
            boolean acquired = semaphore.tryAcquire(waitMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                LOG.warn("Provider call limit ({}) still saturated after {}ms wait", maxInFlight, waitMs);
                throw new ProviderException("Provider call limit reached; no permit before request deadline");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while waiting for a provider call permit", e);
        }
    }

    /**
     * Releases a previously acquired permit. Call from a finally block.
     */
    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int maxInFlight() {
        return maxInFlight;
    }
}
