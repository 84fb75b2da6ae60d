package com.phillippitts.selfconsistency.service.compose;

import com.phillippitts.selfconsistency.config.properties.ConfidenceProperties;
import com.phillippitts.selfconsistency.testutil.TestRequests;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConfidenceBlenderTest {

    private final ConfidenceBlender blender = new ConfidenceBlender(TestRequests.defaultWeights());

    @Test
    void blendsAllThreeTerms() {
        // 0.4 * 0.8 + 0.3 * 0.9 + 0.3 * 0.95
        assertThat(blender.blend(0.8, 90, 95.0)).isCloseTo(0.875, within(1e-9));
    }

    @Test
    void renormalizesWhenReflectionSkipped() {
        // 4/7 * 0.8 + 3/7 * 0.9
        assertThat(blender.blend(0.8, 90, null)).isCloseTo((4 * 0.8 + 3 * 0.9) / 7, within(1e-9));
    }

    @Test
    void customWeights() {
        ConfidenceBlender agreementOnly = new ConfidenceBlender(new ConfidenceProperties(1.0, 0.0, 0.0));

        assertThat(agreementOnly.blend(0.6, 100, 100.0)).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void resultStaysInUnitRange() {
        assertThat(blender.blend(1.0, 100, 100.0)).isEqualTo(1.0);
        assertThat(blender.blend(0.0, 0, 0.0)).isZero();
    }
}
