package com.phillippitts.selfconsistency.service.provider;

import com.phillippitts.selfconsistency.domain.ModelTier;

import java.util.Objects;

/**
 * One outbound model call.
 *
 * @param tier         model tier, resolved to a concrete model by the client
 * @param systemPrompt system instruction (nullable)
 * @param userPrompt   user message text
 * @param temperature  sampling temperature
 * @param maxTokens    completion token limit
 */
public record CompletionRequest(
        ModelTier tier,
        String systemPrompt,
        String userPrompt,
        double temperature,
        int maxTokens
) {

    public CompletionRequest {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(userPrompt, "userPrompt");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got: " + maxTokens);
        }
    }
}
