package com.phillippitts.selfconsistency.exception;

/**
 * Thrown when the model backend call fails (transport, authentication, quota or rate limit).
 * The engine does not retry these; a failed step fails its reasoning path.
 */
public class ProviderException extends ReasoningEngineException {

    private final String model;

    public ProviderException(String message) {
        super(message);
        this.model = "unknown";
    }

    public ProviderException(String message, String model) {
        super(message + " (model: " + model + ")");
        this.model = model;
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.model = "unknown";
    }

    public ProviderException(String message, String model, Throwable cause) {
        super(message + " (model: " + model + ")", cause);
        this.model = model;
    }

    public String getModel() {
        return model;
    }
}
