package com.phillippitts.selfconsistency.service.validation;

import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.exception.ValidationException;
import org.springframework.stereotype.Component;

/**
 * Checks a {@link PromptRequest} against the declared bounds before any model call is made.
 *
 * <p>The first violation found is reported, naming the offending field by its wire name.
 */
@Component
public class PromptRequestValidator {

    public static final int MIN_SAMPLES = 1;
    public static final int MAX_SAMPLES = 15;
    public static final int MIN_STEPS = 1;
    public static final int MAX_STEPS = 10;
    public static final double MIN_TEMPERATURE = 0.0;
    public static final double MAX_TEMPERATURE = 2.0;

    /**
     * @throws ValidationException when a field is missing or out of bounds
     */
    public void validate(PromptRequest request) {
        if (request == null) {
            throw new ValidationException("request", "must not be null");
        }
        if (request.prompt() == null || request.prompt().isBlank()) {
            throw new ValidationException("prompt", "must not be blank");
        }
        if (request.sampleCount() < MIN_SAMPLES || request.sampleCount() > MAX_SAMPLES) {
            throw new ValidationException("num_self_consistency",
                    "must be between " + MIN_SAMPLES + " and " + MAX_SAMPLES + ", got " + request.sampleCount());
        }
        if (request.stepCount() < MIN_STEPS || request.stepCount() > MAX_STEPS) {
            throw new ValidationException("num_cot",
                    "must be between " + MIN_STEPS + " and " + MAX_STEPS + ", got " + request.stepCount());
        }
        if (request.modelTier() == null) {
            throw new ValidationException("model", "must be one of fast, slow");
        }
        double t = request.temperature();
        if (Double.isNaN(t) || t < MIN_TEMPERATURE || t > MAX_TEMPERATURE) {
            throw new ValidationException("temperature",
                    "must be between " + MIN_TEMPERATURE + " and " + MAX_TEMPERATURE + ", got " + t);
        }
    }
}
