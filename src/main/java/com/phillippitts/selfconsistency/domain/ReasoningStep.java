package com.phillippitts.selfconsistency.domain;

import java.util.Objects;

/**
 * One step of a chain-of-thought path.
 *
 * @param index                  1-based step index, strictly increasing within a path
 * @param reasoning              reasoning text (never null)
 * @param intermediateConclusion conclusion reached at this step (nullable)
 */
public record ReasoningStep(int index, String reasoning, String intermediateConclusion) {

    public ReasoningStep {
        if (index < 1) {
            throw new IllegalArgumentException("step index must be >= 1, got: " + index);
        }
        Objects.requireNonNull(reasoning, "reasoning");
    }
}
