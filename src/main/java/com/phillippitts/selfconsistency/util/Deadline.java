package com.phillippitts.selfconsistency.util;

/**
 * Absolute point in time after which a request must stop issuing model calls.
 *
 * <p>Immutable and safe to share between the sample tasks of one request; each task polls
 * {@link #isExpired()} between steps, which is how in-flight paths are cancelled cooperatively.
 */
public final class Deadline {

    private final long budgetMs;
    private final long expiresAtNanos;

    private Deadline(long budgetMs, long expiresAtNanos) {
        this.budgetMs = budgetMs;
        this.expiresAtNanos = expiresAtNanos;
    }

    /**
     * Creates a deadline {@code budgetMs} milliseconds from now.
     *
     * @param budgetMs time budget in milliseconds (must be positive)
     */
    public static Deadline after(long budgetMs) {
        if (budgetMs <= 0) {
            throw new IllegalArgumentException("budgetMs must be positive, got: " + budgetMs);
        }
        return new Deadline(budgetMs, System.nanoTime() + budgetMs * TimeUtils.NANOS_PER_MILLI);
    }

    public long budgetMs() {
        return budgetMs;
    }

    public boolean isExpired() {
        return System.nanoTime() - expiresAtNanos >= 0;
    }

    /**
     * @return milliseconds left before expiry, never negative
     */
    public long remainingMillis() {
        long left = expiresAtNanos - System.nanoTime();
        return left <= 0 ? 0 : TimeUtils.nanosToMillis(left);
    }
}
