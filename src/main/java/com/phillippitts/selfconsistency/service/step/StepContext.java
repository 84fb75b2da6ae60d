package com.phillippitts.selfconsistency.service.step;

import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.domain.ReasoningStep;
import com.phillippitts.selfconsistency.domain.UsageRecord;
import com.phillippitts.selfconsistency.util.Deadline;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Input for generating step {@code stepIndex} of a path.
 *
 * @param request      the originating request
 * @param stepIndex    1-based index of the step to generate
 * @param priorSteps   steps already produced by this path, in order
 * @param deadline     request deadline
 * @param callListener receives the usage of each model call as soon as it returns
 */
public record StepContext(PromptRequest request, int stepIndex, List<ReasoningStep> priorSteps, Deadline deadline,
                          Consumer<UsageRecord> callListener) {

    public StepContext {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(deadline, "deadline");
        if (stepIndex < 1 || stepIndex > request.stepCount()) {
            throw new IllegalArgumentException("stepIndex out of range: " + stepIndex);
        }
        priorSteps = priorSteps == null ? List.of() : List.copyOf(priorSteps);
        callListener = callListener == null ? usage -> { } : callListener;
    }

    public StepContext(PromptRequest request, int stepIndex, List<ReasoningStep> priorSteps, Deadline deadline) {
        this(request, stepIndex, priorSteps, deadline, null);
    }

    public boolean isFinalStep() {
        return stepIndex == request.stepCount();
    }
}
