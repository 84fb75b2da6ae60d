package com.phillippitts.selfconsistency.exception;

/**
 * Base exception for all reasoning engine errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class ReasoningEngineException extends RuntimeException {

    public ReasoningEngineException(String message) {
        super(message);
    }

    public ReasoningEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public ReasoningEngineException(Throwable cause) {
        super(cause);
    }
}
