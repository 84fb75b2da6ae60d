package com.phillippitts.selfconsistency.service.parse;

/**
 * Fields read from a step response. {@code finalAnswer} and {@code confidence} are only
 * present for the final step.
 */
public record ParsedStep(String reasoning, String intermediateConclusion, String finalAnswer, Double confidence) {
}
