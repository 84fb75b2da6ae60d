package com.phillippitts.selfconsistency.testutil;

import org.json.JSONObject;

/**
 * Builders for well-formed model outputs.
 */
public final class ModelResponses {

    private ModelResponses() {}

    public static String step(String reasoning, String conclusion) {
        return new JSONObject()
                .put("reasoning", reasoning)
                .put("intermediate_conclusion", conclusion)
                .toString();
    }

    public static String finalStep(String answer, double confidence) {
        return new JSONObject()
                .put("reasoning", "Checked the facts for " + answer)
                .put("intermediate_conclusion", answer)
                .put("final_answer", answer)
                .put("confidence", confidence)
                .toString();
    }

    public static String reflection(String refined, String reasoning, double confidence) {
        return new JSONObject()
                .put("refined_answer", refined)
                .put("reflection_reasoning", reasoning)
                .put("confidence", confidence)
                .toString();
    }
}
