package com.phillippitts.selfconsistency.exception;

import com.phillippitts.selfconsistency.domain.UsageRecord;

/**
 * Thrown when model output for a reasoning step cannot be parsed after all formatting retries.
 * Carries the tokens consumed by the failed attempts so they can still be accounted.
 */
public class MalformedStepException extends ReasoningEngineException {

    private final int stepIndex;
    private final int attempts;
    private final UsageRecord usage;

    public MalformedStepException(int stepIndex, int attempts, UsageRecord usage, String reason) {
        super("Step " + stepIndex + " output malformed after " + attempts + " attempt(s): " + reason);
        this.stepIndex = stepIndex;
        this.attempts = attempts;
        this.usage = usage == null ? UsageRecord.ZERO : usage;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public int getAttempts() {
        return attempts;
    }

    public UsageRecord getUsage() {
        return usage;
    }
}
