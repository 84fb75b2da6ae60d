package com.phillippitts.selfconsistency.exception;

/**
 * Thrown when fewer reasoning paths succeeded than the configured minimum.
 * Fatal for the request; no reflection call is made.
 */
public class AggregationException extends ReasoningEngineException {

    private final int requested;
    private final int obtained;

    public AggregationException(String message, int requested, int obtained) {
        super(message + " (requested=" + requested + ", obtained=" + obtained + ")");
        this.requested = requested;
        this.obtained = obtained;
    }

    public int getRequested() {
        return requested;
    }

    public int getObtained() {
        return obtained;
    }
}
