package com.phillippitts.selfconsistency.domain;

/**
 * Wall-clock durations of the request phases, in milliseconds.
 */
public record TimingBreakdown(long fanOutMs, long reflectionMs, long totalMs) {
}
