package com.phillippitts.selfconsistency.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reasoning.voting")
public class VotingProperties {

    public enum Strategy { NORMALIZED, OVERLAP }

    /** How final answers are judged equivalent. */
    @NotNull
    private final Strategy strategy;

    /** Content-token Jaccard similarity at or above which two answers are merged (0..1). */
    @Min(0)
    @Max(1)
    private final double overlapThreshold;

    @ConstructorBinding
    public VotingProperties(Strategy strategy, Double overlapThreshold) {
        this.strategy = strategy == null ? Strategy.OVERLAP : strategy;
        double t = overlapThreshold == null ? 0.5 : overlapThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("reasoning.voting.overlap-threshold must be in [0,1]");
        }
        this.overlapThreshold = t;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public double getOverlapThreshold() {
        return overlapThreshold;
    }
}
