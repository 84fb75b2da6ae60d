package com.phillippitts.selfconsistency.service.validation;

import com.phillippitts.selfconsistency.domain.ModelTier;
import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptRequestValidatorTest {

    private final PromptRequestValidator validator = new PromptRequestValidator();

    private static PromptRequest request(String prompt, int samples, int steps, ModelTier tier, double temperature) {
        return new PromptRequest(prompt, null, null, samples, steps, tier, temperature);
    }

    private void assertRejected(PromptRequest request, String field) {
        assertThatThrownBy(() -> validator.validate(request))
                .isInstanceOf(ValidationException.class)
                .extracting("field")
                .isEqualTo(field);
    }

    @Test
    void acceptsBoundaryValues() {
        assertThatCode(() -> validator.validate(request("Q", 1, 1, ModelTier.FAST, 0.0))).doesNotThrowAnyException();
        assertThatCode(() -> validator.validate(request("Q", 15, 10, ModelTier.SLOW, 2.0))).doesNotThrowAnyException();
    }

    @Test
    void rejectsBlankPrompt() {
        assertRejected(request("  ", 3, 3, ModelTier.FAST, 0.7), "prompt");
        assertRejected(request(null, 3, 3, ModelTier.FAST, 0.7), "prompt");
    }

    @Test
    void rejectsSampleCountOutOfRange() {
        assertRejected(request("Q", 0, 3, ModelTier.FAST, 0.7), "num_self_consistency");
        assertRejected(request("Q", 16, 3, ModelTier.FAST, 0.7), "num_self_consistency");
    }

    @Test
    void rejectsStepCountOutOfRange() {
        assertRejected(request("Q", 3, 0, ModelTier.FAST, 0.7), "num_cot");
        assertRejected(request("Q", 3, 11, ModelTier.FAST, 0.7), "num_cot");
    }

    @Test
    void rejectsMissingTier() {
        assertRejected(request("Q", 3, 3, null, 0.7), "model");
    }

    @Test
    void rejectsBadTemperature() {
        assertRejected(request("Q", 3, 3, ModelTier.FAST, -0.1), "temperature");
        assertRejected(request("Q", 3, 3, ModelTier.FAST, 2.1), "temperature");
        assertRejected(request("Q", 3, 3, ModelTier.FAST, Double.NaN), "temperature");
    }

    @Test
    void rejectsNullRequest() {
        assertRejected(null, "request");
    }
}
