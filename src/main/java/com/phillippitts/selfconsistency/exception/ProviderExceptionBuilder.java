package com.phillippitts.selfconsistency.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ProviderException} with contextual details.
 *
 * <pre>
 * throw ProviderExceptionBuilder.create("Model call failed")
 *         .model("gpt-4o-mini")
 *         .cause(e)
 *         .durationMs(1500)
 *         .metadata("tier", "fast")
 *         .build();
 * </pre>
 */
public final class ProviderExceptionBuilder {

    private final String message;
    private String model;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProviderExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ProviderExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProviderExceptionBuilder(message);
    }

    public ProviderExceptionBuilder model(String model) {
        this.model = model;
        return this;
    }

    public ProviderExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ProviderExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public ProviderExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (durationMs={ms}, {key1}={val1}, ...) (model: {model})
     * </pre>
     *
     * @return constructed ProviderException
     */
    public ProviderException build() {
        String detailedMessage = buildDetailedMessage();
        String m = model != null ? model : "unknown";

        if (cause != null) {
            return new ProviderException(detailedMessage, m, cause);
        }
        return new ProviderException(detailedMessage, m);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
