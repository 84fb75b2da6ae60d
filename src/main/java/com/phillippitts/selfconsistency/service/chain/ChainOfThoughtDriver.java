package com.phillippitts.selfconsistency.service.chain;

import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.domain.ReasoningPath;
import com.phillippitts.selfconsistency.domain.ReasoningStep;
import com.phillippitts.selfconsistency.exception.MalformedStepException;
import com.phillippitts.selfconsistency.exception.ProviderException;
import com.phillippitts.selfconsistency.exception.ReasoningPathException;
import com.phillippitts.selfconsistency.service.parse.ModelOutputParser;
import com.phillippitts.selfconsistency.service.step.GeneratedStep;
import com.phillippitts.selfconsistency.service.step.StepContext;
import com.phillippitts.selfconsistency.service.step.StepGenerator;
import com.phillippitts.selfconsistency.util.Deadline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

import static com.phillippitts.selfconsistency.util.TimeUtils.elapsedMillis;

/**
 * Produces one complete reasoning path by generating its N steps strictly in order.
 *
 * <p>Each step sees every earlier step of the same path and nothing from sibling paths.
 * The request deadline is checked before each step; an expired deadline or a failed step
 * ends the path with {@link ReasoningPathException}, which carries the steps completed so far
 * and the tokens already spent.
 */
@Component
public class ChainOfThoughtDriver {

    private static final Logger LOG = LogManager.getLogger(ChainOfThoughtDriver.class);

    private final StepGenerator stepGenerator;

    public ChainOfThoughtDriver(StepGenerator stepGenerator) {
        this.stepGenerator = Objects.requireNonNull(stepGenerator, "stepGenerator");
    }

    /**
     * Runs one path, tracking its progress privately.
     *
     * @see #run(PromptRequest, int, Deadline, PathProgress)
     */
    public ReasoningPath run(PromptRequest request, int sampleIndex, Deadline deadline) {
        return run(request, sampleIndex, deadline, new PathProgress());
    }

    /**
     * Runs one path.
     *
     * @param request     the request being answered
     * @param sampleIndex 1-based sample index of this path
     * @param deadline    request deadline
     * @param progress    updated after every model call and step; readable by other threads
     * @return the completed path
     * @throws ReasoningPathException when any step fails or the deadline expires
     */
    public ReasoningPath run(PromptRequest request, int sampleIndex, Deadline deadline, PathProgress progress) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(progress, "progress");
        long startNanos = System.nanoTime();
        int stepCount = request.stepCount();

        String finalAnswer = null;
        double selfConfidence = ModelOutputParser.DEFAULT_CONFIDENCE;

        for (int stepIndex = 1; stepIndex <= stepCount; stepIndex++) {
            if (deadline.isExpired() || Thread.currentThread().isInterrupted()) {
                throw new ReasoningPathException(sampleIndex, progress.steps(), progress.usage(),
                        "deadline expired before step " + stepIndex, null);
            }

            GeneratedStep generated;
            try {
                generated = stepGenerator.generate(
                        new StepContext(request, stepIndex, progress.steps(), deadline, progress::recordCall));
            } catch (MalformedStepException e) {
                progress.stepFailed(e.getUsage());
                throw new ReasoningPathException(sampleIndex, progress.steps(), progress.usage(), e.getMessage(), e);
            } catch (ProviderException e) {
                // calls of this step that returned before the failure are still billed
                progress.stepFailed(null);
                throw new ReasoningPathException(sampleIndex, progress.steps(), progress.usage(), e.getMessage(), e);
            }

            progress.stepCompleted(generated.step(), generated.callUsage());
            if (generated.isFinal()) {
                finalAnswer = generated.finalAnswer();
                if (generated.selfConfidence() != null) {
                    selfConfidence = generated.selfConfidence();
                }
            }
        }

        if (finalAnswer == null) {
            // generator contract: the final step always carries an answer
            throw new ReasoningPathException(sampleIndex, progress.steps(), progress.usage(),
                    "final step produced no answer", null);
        }

        long durationMs = elapsedMillis(startNanos);
        List<ReasoningStep> steps = progress.steps();
        LOG.debug("Path {} completed: steps={}, confidence={}, durationMs={}",
                sampleIndex, steps.size(), selfConfidence, durationMs);
        return new ReasoningPath(sampleIndex, steps, finalAnswer, selfConfidence, progress.settledUsage(), durationMs);
    }
}
