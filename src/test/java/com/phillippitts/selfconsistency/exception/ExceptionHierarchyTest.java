package com.phillippitts.selfconsistency.exception;

import com.phillippitts.selfconsistency.domain.ReasoningStep;
import com.phillippitts.selfconsistency.domain.UsageRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allEngineExceptionsShareTheRoot() {
        assertThat(new ValidationException("prompt", "blank")).isInstanceOf(ReasoningEngineException.class);
        assertThat(new ProviderException("x")).isInstanceOf(ReasoningEngineException.class);
        assertThat(new MalformedStepException(1, 3, null, "bad")).isInstanceOf(ReasoningEngineException.class);
        assertThat(new AggregationException("insufficient samples", 3, 0)).isInstanceOf(ReasoningEngineException.class);
        assertThat(new AggregationTimeoutException(1000, 0, 1)).isInstanceOf(ReasoningEngineException.class);
        assertThat(new DocumentExtractionException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void validationExceptionNamesTheField() {
        ValidationException ex = new ValidationException("num_cot", "must be between 1 and 10");

        assertThat(ex.getField()).isEqualTo("num_cot");
        assertThat(ex.getReason()).isEqualTo("must be between 1 and 10");
        assertThat(ex.getMessage()).isEqualTo("Invalid request field 'num_cot': must be between 1 and 10");
    }

    @Test
    void providerExceptionIncludesModel() {
        IOException cause = new IOException("connection reset");
        ProviderException ex = new ProviderException("Model call failed", "gpt-4o-mini", cause);

        assertThat(ex.getMessage()).contains("(model: gpt-4o-mini)");
        assertThat(ex.getModel()).isEqualTo("gpt-4o-mini");
        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(new ProviderException("x").getModel()).isEqualTo("unknown");
    }

    @Test
    void providerExceptionBuilderAddsContext() {
        ProviderException ex = ProviderExceptionBuilder.create("Model call failed")
                .model("gpt-4")
                .durationMs(1500)
                .metadata("tier", "slow")
                .metadata("ignored", null)
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Model call failed (durationMs=1500, tier=slow) (model: gpt-4)");
    }

    @Test
    void malformedStepCarriesUsage() {
        MalformedStepException ex = new MalformedStepException(2, 3, new UsageRecord(30, 60), "no JSON object");

        assertThat(ex.getStepIndex()).isEqualTo(2);
        assertThat(ex.getAttempts()).isEqualTo(3);
        assertThat(ex.getUsage()).isEqualTo(new UsageRecord(30, 60));
        assertThat(ex.getMessage()).contains("Step 2").contains("3 attempt(s)").contains("no JSON object");
        assertThat(new MalformedStepException(1, 1, null, "x").getUsage()).isEqualTo(UsageRecord.ZERO);
    }

    @Test
    void reasoningPathExceptionCarriesCompletedSteps() {
        ReasoningPathException ex = new ReasoningPathException(4,
                List.of(new ReasoningStep(1, "r", "c")), new UsageRecord(5, 5), "step 2 failed", null);

        assertThat(ex.getSampleIndex()).isEqualTo(4);
        assertThat(ex.getCompletedSteps()).hasSize(1);
        assertThat(ex.getUsage().totalTokens()).isEqualTo(10);
        assertThat(ex.getMessage()).isEqualTo("Reasoning path 4 failed: step 2 failed");
    }

    @Test
    void aggregationExceptionReportsCounts() {
        AggregationException ex = new AggregationException("insufficient samples", 5, 0);

        assertThat(ex.getMessage()).isEqualTo("insufficient samples (requested=5, obtained=0)");
        assertThat(ex.getRequested()).isEqualTo(5);
        assertThat(ex.getObtained()).isZero();
    }
}
