package com.phillippitts.selfconsistency.service.accounting;

import com.phillippitts.selfconsistency.domain.TimingBreakdown;
import com.phillippitts.selfconsistency.util.TimeUtils;

import java.util.function.Supplier;

/**
 * Phase timer for one request. Used only by the request thread, so it is not thread-safe.
 */
public final class RequestStopwatch {

    private final long startNanos;
    private long fanOutNanos;
    private long reflectionNanos;

    private RequestStopwatch(long startNanos) {
        this.startNanos = startNanos;
    }

    public static RequestStopwatch start() {
        return new RequestStopwatch(System.nanoTime());
    }

    public <T> T timeFanOut(Supplier<T> phase) {
        long t0 = System.nanoTime();
        try {
            return phase.get();
        } finally {
            fanOutNanos += System.nanoTime() - t0;
        }
    }

    public <T> T timeReflection(Supplier<T> phase) {
        long t0 = System.nanoTime();
        try {
            return phase.get();
        } finally {
            reflectionNanos += System.nanoTime() - t0;
        }
    }

    public long elapsedNanos() {
        return System.nanoTime() - startNanos;
    }

    public TimingBreakdown snapshot() {
        return new TimingBreakdown(
                TimeUtils.nanosToMillis(fanOutNanos),
                TimeUtils.nanosToMillis(reflectionNanos),
                TimeUtils.nanosToMillis(elapsedNanos()));
    }
}
