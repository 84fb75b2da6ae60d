package com.phillippitts.selfconsistency.service.step;

import com.phillippitts.selfconsistency.domain.ReasoningStep;
import com.phillippitts.selfconsistency.domain.UsageRecord;

import java.util.List;
import java.util.Objects;

/**
 * A successfully parsed step.
 *
 * @param step           the reasoning step
 * @param finalAnswer    final answer (final step only, else null)
 * @param selfConfidence self-reported confidence 0-100 (final step only, else null)
 * @param callUsage      usage of every call made for this step, retries included
 */
public record GeneratedStep(ReasoningStep step, String finalAnswer, Double selfConfidence, List<UsageRecord> callUsage) {

    public GeneratedStep {
        Objects.requireNonNull(step, "step");
        callUsage = callUsage == null ? List.of() : List.copyOf(callUsage);
    }

    public boolean isFinal() {
        return finalAnswer != null;
    }

    public int attempts() {
        return callUsage.size();
    }
}
