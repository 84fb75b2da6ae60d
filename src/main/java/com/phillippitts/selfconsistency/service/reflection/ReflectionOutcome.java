package com.phillippitts.selfconsistency.service.reflection;

import com.phillippitts.selfconsistency.domain.UsageRecord;

import java.util.Objects;

/**
 * Result of the reflection pass. When {@code skipped}, the answer is the preliminary answer
 * unchanged and {@code reasoning}/{@code confidence} are null.
 */
public record ReflectionOutcome(
        String finalAnswer,
        String reasoning,
        Double confidence,
        boolean skipped,
        String skipReason,
        UsageRecord usage,
        long durationMs
) {

    public ReflectionOutcome {
        Objects.requireNonNull(finalAnswer, "finalAnswer");
        usage = usage == null ? UsageRecord.ZERO : usage;
    }

    public static ReflectionOutcome completed(String refinedAnswer, String reasoning, double confidence,
                                              UsageRecord usage, long durationMs) {
        return new ReflectionOutcome(refinedAnswer, reasoning, confidence, false, null, usage, durationMs);
    }

    public static ReflectionOutcome skipped(String preliminaryAnswer, String reason, UsageRecord usage,
                                            long durationMs) {
        return new ReflectionOutcome(preliminaryAnswer, null, null, true, reason, usage, durationMs);
    }
}
