package com.phillippitts.selfconsistency.service.voting;

/**
 * Groups answers whose normalized keys are identical.
 */
public final class NormalizedMatchClusterer extends AbstractAnswerClusterer {

    @Override
    protected boolean matches(String key, String representativeKey) {
        return key.equals(representativeKey);
    }
}
