package com.phillippitts.selfconsistency.domain;

import java.util.List;
import java.util.Objects;

/**
 * A completed, independent chain-of-thought attempt (one "sample").
 *
 * @param sampleIndex    1-based index assigned at fan-out time
 * @param steps          ordered reasoning steps
 * @param finalAnswer    final answer extracted from the last step
 * @param selfConfidence model self-reported confidence (0-100)
 * @param usage          token usage of every model call made for this path, in call order
 * @param durationMs     wall-clock time spent producing the path
 */
public record ReasoningPath(
        int sampleIndex,
        List<ReasoningStep> steps,
        String finalAnswer,
        double selfConfidence,
        List<UsageRecord> usage,
        long durationMs
) {

    public ReasoningPath {
        if (sampleIndex < 1) {
            throw new IllegalArgumentException("sampleIndex must be >= 1, got: " + sampleIndex);
        }
        Objects.requireNonNull(finalAnswer, "finalAnswer");
        if (selfConfidence < 0.0 || selfConfidence > 100.0) {
            throw new IllegalArgumentException("selfConfidence must be between 0 and 100, got: " + selfConfidence);
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
        usage = usage == null ? List.of() : List.copyOf(usage);
    }

    public UsageRecord totalUsage() {
        return UsageRecord.sum(usage);
    }
}
