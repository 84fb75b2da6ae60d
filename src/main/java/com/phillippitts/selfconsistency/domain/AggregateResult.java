package com.phillippitts.selfconsistency.domain;

import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of one aggregation request.
 *
 * <p>Reflection fields are {@code null} when {@code reflectionSkipped} is true; in that case
 * {@code finalAnswer} equals {@code preliminaryAnswer}.
 *
 * @param prompt               the caller's prompt (without document text)
 * @param modelUsed            concrete model name resolved from the tier
 * @param modelTier            requested tier
 * @param preliminaryAnswer    answer selected by the consistency vote
 * @param finalAnswer          answer after reflection
 * @param chainOfThought       steps of a representative path from the winning group
 * @param samples              all successful paths, in sample-index order
 * @param consistencyGroups    answer groups, winner first
 * @param agreementConfidence  winning group size / successful samples, in [0,1]
 * @param meanSelfConfidence   mean self-reported confidence of the winning group (0-100)
 * @param reflectionReasoning  reflection analysis text (nullable)
 * @param reflectionConfidence reflection self-reported confidence 0-100 (nullable)
 * @param reflectionSkipped    whether the reflection pass was skipped
 * @param reflectionSkipReason why reflection was skipped (nullable)
 * @param confidenceScore      blended confidence in [0,1]
 * @param reasoningSummary     human-readable digest of the vote
 * @param requestedSamples     K as requested
 * @param obtainedSamples      number of successful paths
 * @param degraded             fewer samples obtained than requested
 * @param timedOut             the request deadline expired during fan-out
 * @param tokenUsage           cumulative token usage of every model call
 * @param costAnalysis         cost computed from the tier price table
 * @param timing               phase durations
 */
public record AggregateResult(
        String prompt,
        String modelUsed,
        ModelTier modelTier,
        String preliminaryAnswer,
        String finalAnswer,
        List<ReasoningStep> chainOfThought,
        List<ReasoningPath> samples,
        List<ConsistencyGroup> consistencyGroups,
        double agreementConfidence,
        double meanSelfConfidence,
        String reflectionReasoning,
        Double reflectionConfidence,
        boolean reflectionSkipped,
        String reflectionSkipReason,
        double confidenceScore,
        String reasoningSummary,
        int requestedSamples,
        int obtainedSamples,
        boolean degraded,
        boolean timedOut,
        UsageRecord tokenUsage,
        CostBreakdown costAnalysis,
        TimingBreakdown timing
) {

    public AggregateResult {
        Objects.requireNonNull(finalAnswer, "finalAnswer");
        if (agreementConfidence < 0.0 || agreementConfidence > 1.0) {
            throw new IllegalArgumentException("agreementConfidence must be in [0,1], got: " + agreementConfidence);
        }
        chainOfThought = chainOfThought == null ? List.of() : List.copyOf(chainOfThought);
        samples = samples == null ? List.of() : List.copyOf(samples);
        consistencyGroups = consistencyGroups == null ? List.of() : List.copyOf(consistencyGroups);
    }
}
