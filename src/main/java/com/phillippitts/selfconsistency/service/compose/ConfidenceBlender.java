package com.phillippitts.selfconsistency.service.compose;

import com.phillippitts.selfconsistency.config.properties.ConfidenceProperties;
import org.springframework.stereotype.Component;

/**
 * Weighted blend of agreement, self-reported and reflection confidence into one score in [0,1].
 *
 * <p>When reflection was skipped its term is dropped and the remaining weights are renormalized,
 * so the default 0.4 / 0.3 / 0.3 becomes 4/7 agreement and 3/7 self-reported.
 */
@Component
public class ConfidenceBlender {

    private final double agreementWeight;
    private final double selfReportedWeight;
    private final double reflectionWeight;

    public ConfidenceBlender(ConfidenceProperties properties) {
        this.agreementWeight = properties.getAgreementWeight();
        this.selfReportedWeight = properties.getSelfReportedWeight();
        this.reflectionWeight = properties.getReflectionWeight();
    }

    /**
     * @param agreement            agreement confidence in [0,1]
     * @param meanSelfConfidence   mean self-reported confidence 0-100
     * @param reflectionConfidence reflection confidence 0-100, or null when reflection was skipped
     * @return blended score in [0,1]
     */
    public double blend(double agreement, double meanSelfConfidence, Double reflectionConfidence) {
        double weighted = agreementWeight * agreement + selfReportedWeight * (meanSelfConfidence / 100.0);
        double totalWeight = agreementWeight + selfReportedWeight;
        if (reflectionConfidence != null) {
            weighted += reflectionWeight * (reflectionConfidence / 100.0);
            totalWeight += reflectionWeight;
        }
        if (totalWeight <= 0.0) {
            return 0.0;
        }
        return clamp(weighted / totalWeight);
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
