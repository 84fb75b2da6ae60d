package com.phillippitts.selfconsistency.service.prompt;

import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.domain.ReasoningPath;
import com.phillippitts.selfconsistency.domain.ReasoningStep;

import java.util.List;

/**
 * Prompt texts for step generation and reflection.
 */
public final class PromptTemplates {

    static final String STEP_SYSTEM = "You are a careful analytical assistant. You solve problems one reasoning "
            + "step at a time and always answer with a single JSON object.";

    static final String REFLECTION_SYSTEM = "You are a critical reviewer. You check several independent "
            + "solutions to the same question and produce the most defensible answer as a single JSON object.";

    private PromptTemplates() {}

    public static String stepSystemPrompt(PromptRequest request) {
        if (request.hasSystemPrompt()) {
            return request.systemPrompt() + "\n\n" + STEP_SYSTEM;
        }
        return STEP_SYSTEM;
    }

    /**
     * Builds the user message for step {@code stepIndex} of {@code stepCount}.
     *
     * @param retryReason parse failure of the previous attempt, or null on the first attempt
     */
    public static String stepPrompt(PromptRequest request, int stepIndex, List<ReasoningStep> priorSteps,
                                    String retryReason) {
        int stepCount = request.stepCount();
        boolean finalStep = stepIndex == stepCount;
        StringBuilder sb = new StringBuilder();
        sb.append(request.effectivePrompt()).append("\n\n");

        if (!priorSteps.isEmpty()) {
            sb.append("Previous steps:\n");
            for (ReasoningStep step : priorSteps) {
                sb.append("Step ").append(step.index()).append(": ").append(step.reasoning()).append('\n');
                if (step.intermediateConclusion() != null) {
                    sb.append("Conclusion: ").append(step.intermediateConclusion()).append('\n');
                }
            }
            sb.append('\n');
        }

        sb.append("This is step ").append(stepIndex).append(" of ").append(stepCount)
                .append(". Produce only this step of the reasoning.\n");
        if (finalStep) {
            sb.append("This is the final step. Respond with a JSON object with the fields ")
                    .append("\"reasoning\", \"intermediate_conclusion\", \"final_answer\" and \"confidence\" ")
                    .append("(a number from 0 to 100). Put the answer itself in the first sentence of ")
                    .append("\"final_answer\".");
        } else {
            sb.append("Respond with a JSON object with the fields \"reasoning\" and \"intermediate_conclusion\".");
        }

        if (retryReason != null) {
            sb.append("\n\nYour previous response could not be used (").append(retryReason)
                    .append("). Respond with ONLY the JSON object: no markdown, no text before or after it.");
        }
        return sb.toString();
    }

    public static String reflectionPrompt(PromptRequest request, List<ReasoningPath> paths,
                                          String preliminaryAnswer, String summary) {
        StringBuilder sb = new StringBuilder();
        sb.append("Question:\n").append(request.effectivePrompt()).append("\n\n");
        sb.append("Independent solutions:\n");
        for (ReasoningPath path : paths) {
            sb.append("Solution ").append(path.sampleIndex())
                    .append(" (self-confidence ").append(Math.round(path.selfConfidence())).append("%):\n");
            for (ReasoningStep step : path.steps()) {
                if (step.intermediateConclusion() != null) {
                    sb.append("  - ").append(step.intermediateConclusion()).append('\n');
                }
            }
            sb.append("  Final answer: ").append(path.finalAnswer()).append('\n');
        }
        sb.append("\nMajority answer: ").append(preliminaryAnswer).append('\n');
        sb.append("Summary: ").append(summary).append("\n\n");
        sb.append("Check the majority answer against the solutions, fix any error you find, and respond ")
                .append("with a JSON object with the fields \"refined_answer\", \"reflection_reasoning\" and ")
                .append("\"confidence\" (a number from 0 to 100).");
        return sb.toString();
    }

    public static String reflectionSystemPrompt(PromptRequest request) {
        if (request.hasSystemPrompt()) {
            return request.systemPrompt() + "\n\n" + REFLECTION_SYSTEM;
        }
        return REFLECTION_SYSTEM;
    }
}
