package com.phillippitts.selfconsistency.exception;

import com.phillippitts.selfconsistency.domain.ReasoningStep;
import com.phillippitts.selfconsistency.domain.UsageRecord;

import java.util.List;

/**
 * Thrown when a single reasoning path (sample) fails. Isolated by the fan-out: sibling
 * paths keep running. Carries the steps completed before the failure and the tokens spent.
 */
public class ReasoningPathException extends ReasoningEngineException {

    private final int sampleIndex;
    private final transient List<ReasoningStep> completedSteps;
    private final UsageRecord usage;

    public ReasoningPathException(int sampleIndex, List<ReasoningStep> completedSteps,
                                  UsageRecord usage, String message, Throwable cause) {
        super("Reasoning path " + sampleIndex + " failed: " + message, cause);
        this.sampleIndex = sampleIndex;
        this.completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        this.usage = usage == null ? UsageRecord.ZERO : usage;
    }

    public int getSampleIndex() {
        return sampleIndex;
    }

    public List<ReasoningStep> getCompletedSteps() {
        return completedSteps;
    }

    public UsageRecord getUsage() {
        return usage;
    }
}
