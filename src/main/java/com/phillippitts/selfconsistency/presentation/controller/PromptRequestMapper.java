package com.phillippitts.selfconsistency.presentation.controller;

import com.phillippitts.selfconsistency.config.properties.ReasoningProperties;
import com.phillippitts.selfconsistency.domain.ModelTier;
import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.exception.ValidationException;

/**
 * Applies configured defaults to wire parameters and builds a {@link PromptRequest}.
 * Range checks are left to the engine's validator.
 */
final class PromptRequestMapper {

    private final ReasoningProperties.Defaults defaults;

    PromptRequestMapper(ReasoningProperties.Defaults defaults) {
        this.defaults = defaults;
    }

    PromptRequest toRequest(String prompt, String systemPrompt, String documentText, Integer samples,
                            Integer steps, String model, Double temperature) {
        return new PromptRequest(
                prompt,
                blankToNull(systemPrompt),
                documentText,
                samples == null ? defaults.getSampleCount() : samples,
                steps == null ? defaults.getStepCount() : steps,
                tier(model),
                temperature == null ? defaults.getTemperature() : temperature);
    }

    private ModelTier tier(String model) {
        if (model == null || model.isBlank()) {
            return defaults.getModelTier();
        }
        try {
            return ModelTier.fromValue(model);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("model", "must be one of fast, slow, got '" + model + "'");
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
