package com.phillippitts.selfconsistency.exception;

/**
 * Thrown when text cannot be extracted from an uploaded document.
 */
public class DocumentExtractionException extends ReasoningEngineException {

    public DocumentExtractionException(String message) {
        super(message);
    }

    public DocumentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
