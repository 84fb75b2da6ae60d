package com.phillippitts.selfconsistency.service.step;

import com.phillippitts.selfconsistency.exception.MalformedStepException;
import com.phillippitts.selfconsistency.exception.ProviderException;

/**
 * Produces one reasoning step from the question and the steps before it.
 */
public interface StepGenerator {

    /**
     * @throws MalformedStepException when the output stays unparseable after all retries
     * @throws ProviderException      when the model call fails
     */
    GeneratedStep generate(StepContext context);
}
