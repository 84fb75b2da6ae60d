package com.phillippitts.selfconsistency.exception;

/**
 * Thrown when the request deadline expired before enough reasoning paths completed.
 */
public class AggregationTimeoutException extends ReasoningEngineException {

    private final long deadlineMs;
    private final int obtained;
    private final int required;

    public AggregationTimeoutException(long deadlineMs, int obtained, int required) {
        super("Request deadline of " + deadlineMs + " ms exceeded with " + obtained
                + " completed sample(s); at least " + required + " required");
        this.deadlineMs = deadlineMs;
        this.obtained = obtained;
        this.required = required;
    }

    public long getDeadlineMs() {
        return deadlineMs;
    }

    public int getObtained() {
        return obtained;
    }

    public int getRequired() {
        return required;
    }
}
