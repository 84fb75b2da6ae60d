package com.phillippitts.selfconsistency.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Weights of the blended confidence score. Weights need not sum to 1; they are normalized
 * over the terms that are present (the reflection term drops out when reflection is skipped).
 */
@Validated
@ConfigurationProperties(prefix = "reasoning.confidence")
public class ConfidenceProperties {

    private final double agreementWeight;
    private final double selfReportedWeight;
    private final double reflectionWeight;

    @ConstructorBinding
    public ConfidenceProperties(Double agreementWeight, Double selfReportedWeight, Double reflectionWeight) {
        this.agreementWeight = requireWeight("agreement-weight", agreementWeight == null ? 0.4 : agreementWeight);
        this.selfReportedWeight = requireWeight("self-reported-weight", selfReportedWeight == null ? 0.3 : selfReportedWeight);
        this.reflectionWeight = requireWeight("reflection-weight", reflectionWeight == null ? 0.3 : reflectionWeight);
        if (this.agreementWeight + this.selfReportedWeight <= 0.0) {
            throw new IllegalArgumentException(
                    "reasoning.confidence agreement and self-reported weights must not both be zero");
        }
    }

    private static double requireWeight(String name, double value) {
        if (value < 0.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException("reasoning.confidence." + name + " must be >= 0");
        }
        return value;
    }

    public double getAgreementWeight() {
        return agreementWeight;
    }

    public double getSelfReportedWeight() {
        return selfReportedWeight;
    }

    public double getReflectionWeight() {
        return reflectionWeight;
    }
}
