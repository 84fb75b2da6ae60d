package com.phillippitts.selfconsistency.config.properties;

import com.phillippitts.selfconsistency.domain.ModelTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the reasoning aggregation engine.
 *
 * <p>Properties:
 * <ul>
 *   <li>reasoning.deadline-ms - Per-request deadline covering fan-out and reflection (default: 120000)</li>
 *   <li>reasoning.min-successful-samples - Samples that must succeed for a vote (default: 1)</li>
 *   <li>reasoning.max-in-flight-calls - Concurrent model calls across all requests (default: 8)</li>
 *   <li>reasoning.step.* - Step generation limits</li>
 *   <li>reasoning.reflection.* - Reflection pass switch and limits</li>
 *   <li>reasoning.defaults.* - Values used when a request omits a parameter</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "reasoning")
public class ReasoningProperties {

    @Positive(message = "Deadline must be positive")
    private long deadlineMs = 120_000;

    @Min(value = 1, message = "At least one sample must be required to succeed")
    private int minSuccessfulSamples = 1;

    @Positive(message = "Max in-flight calls must be positive")
    private int maxInFlightCalls = 8;

    @Valid
    private Step step = new Step();

    @Valid
    private Reflection reflection = new Reflection();

    @Valid
    private Defaults defaults = new Defaults();

    public long getDeadlineMs() {
        return deadlineMs;
    }

    public void setDeadlineMs(long deadlineMs) {
        this.deadlineMs = deadlineMs;
    }

    public int getMinSuccessfulSamples() {
        return minSuccessfulSamples;
    }

    public void setMinSuccessfulSamples(int minSuccessfulSamples) {
        this.minSuccessfulSamples = minSuccessfulSamples;
    }

    public int getMaxInFlightCalls() {
        return maxInFlightCalls;
    }

    public void setMaxInFlightCalls(int maxInFlightCalls) {
        this.maxInFlightCalls = maxInFlightCalls;
    }

    public Step getStep() {
        return step;
    }

    public void setStep(Step step) {
        this.step = step;
    }

    public Reflection getReflection() {
        return reflection;
    }

    public void setReflection(Reflection reflection) {
        this.reflection = reflection;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    /**
     * Step generation limits.
     */
    public static class Step {

        /** Re-asks after a response fails step parsing. */
        @Min(0)
        @Max(5)
        private int maxParseRetries = 2;

        @Positive
        private int maxTokens = 1024;

        public int getMaxParseRetries() {
            return maxParseRetries;
        }

        public void setMaxParseRetries(int maxParseRetries) {
            this.maxParseRetries = maxParseRetries;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    /**
     * Reflection pass settings.
     */
    public static class Reflection {

        private boolean enabled = true;

        @Positive
        private int maxTokens = 2048;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    /**
     * Request defaults applied at the HTTP boundary.
     */
    public static class Defaults {

        @Min(1)
        @Max(15)
        private int sampleCount = 3;

        @Min(1)
        @Max(10)
        private int stepCount = 3;

        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.7;

        @NotNull
        private ModelTier modelTier = ModelTier.FAST;

        public int getSampleCount() {
            return sampleCount;
        }

        public void setSampleCount(int sampleCount) {
            this.sampleCount = sampleCount;
        }

        public int getStepCount() {
            return stepCount;
        }

        public void setStepCount(int stepCount) {
            this.stepCount = stepCount;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public ModelTier getModelTier() {
            return modelTier;
        }

        public void setModelTier(ModelTier modelTier) {
            this.modelTier = modelTier;
        }
    }
}
