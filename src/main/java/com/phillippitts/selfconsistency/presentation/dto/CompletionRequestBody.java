package com.phillippitts.selfconsistency.presentation.dto;

/**
 * JSON body of {@code POST /v1/completions}. Omitted fields fall back to configured defaults.
 */
public record CompletionRequestBody(
        String prompt,
        String systemPrompt,
        Integer numSelfConsistency,
        Integer numCot,
        String model,
        Double temperature
) {
}
