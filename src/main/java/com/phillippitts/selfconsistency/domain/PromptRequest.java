package com.phillippitts.selfconsistency.domain;

/**
 * A single aggregation request as accepted by the engine.
 *
 * <p>The record itself does not enforce bounds: requests are checked by
 * {@link com.phillippitts.selfconsistency.service.validation.PromptRequestValidator}
 * so that every violation is reported with the offending field name.
 *
 * @param prompt       question text (required, non-blank)
 * @param systemPrompt optional system instruction (nullable)
 * @param documentText optional attached document text, prepended to the prompt (nullable)
 * @param sampleCount  number of independent reasoning paths K
 * @param stepCount    number of chain-of-thought steps N per path
 * @param modelTier    model tier selector
 * @param temperature  sampling temperature
 */
public record PromptRequest(
        String prompt,
        String systemPrompt,
        String documentText,
        int sampleCount,
        int stepCount,
        ModelTier modelTier,
        double temperature
) {

    /**
     * Returns the question text as sent to the model: document text (if any) followed by the prompt.
     */
    public String effectivePrompt() {
        if (!hasDocument()) {
            return prompt;
        }
        return "Document content:\n" + documentText + "\n\nQuestion: " + prompt;
    }

    public boolean hasDocument() {
        return documentText != null && !documentText.isBlank();
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isBlank();
    }
}
