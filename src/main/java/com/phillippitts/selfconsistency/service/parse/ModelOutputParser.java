package com.phillippitts.selfconsistency.service.parse;

import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses the JSON objects the model is instructed to return.
 *
 * <p>Tolerant of the usual wrapping: markdown code fences and prose before or after the
 * object are ignored. Never throws; failures are reported through {@link ParseOutcome}.
 */
public final class ModelOutputParser {

    public static final double DEFAULT_CONFIDENCE = 50.0;

    private ModelOutputParser() {}

    /**
     * Parses a reasoning step response.
     *
     * @param raw       model output text
     * @param finalStep whether {@code final_answer} and {@code confidence} are expected
     */
    public static ParseOutcome<ParsedStep> parseStep(String raw, boolean finalStep) {
        ParseOutcome<JSONObject> json = extractObject(raw);
        if (!json.isSuccess()) {
            return ParseOutcome.failure(json.error());
        }
        JSONObject obj = json.value();

        String reasoning = text(obj, "reasoning");
        if (reasoning == null) {
            return ParseOutcome.failure("missing field 'reasoning'");
        }
        String conclusion = text(obj, "intermediate_conclusion");
        if (!finalStep) {
            return ParseOutcome.success(new ParsedStep(reasoning, conclusion, null, null));
        }

        String finalAnswer = text(obj, "final_answer");
        if (finalAnswer == null) {
            return ParseOutcome.failure("missing field 'final_answer' on final step");
        }
        return ParseOutcome.success(new ParsedStep(reasoning, conclusion, finalAnswer, confidence(obj)));
    }

    /**
     * Parses a reflection response.
     */
    public static ParseOutcome<ParsedReflection> parseReflection(String raw) {
        ParseOutcome<JSONObject> json = extractObject(raw);
        if (!json.isSuccess()) {
            return ParseOutcome.failure(json.error());
        }
        JSONObject obj = json.value();
        String refined = text(obj, "refined_answer");
        if (refined == null) {
            return ParseOutcome.failure("missing field 'refined_answer'");
        }
        String reasoning = text(obj, "reflection_reasoning");
        return ParseOutcome.success(new ParsedReflection(refined, reasoning == null ? "" : reasoning, confidence(obj)));
    }

    static ParseOutcome<JSONObject> extractObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParseOutcome.failure("empty response");
        }
        String body = stripCodeFences(raw.trim());
        int start = body.indexOf('{');
        int end = body.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return ParseOutcome.failure("no JSON object in response");
        }
        try {
            return ParseOutcome.success(new JSONObject(body.substring(start, end + 1)));
        } catch (JSONException e) {
            return ParseOutcome.failure("invalid JSON: " + e.getMessage());
        }
    }

    static String stripCodeFences(String s) {
        if (!s.startsWith("```")) {
            return s;
        }
        int firstNewline = s.indexOf('\n');
        String inner = firstNewline < 0 ? s.substring(3) : s.substring(firstNewline + 1);
        int closing = inner.lastIndexOf("```");
        return (closing >= 0 ? inner.substring(0, closing) : inner).trim();
    }

    private static String text(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        String v = obj.optString(key, "").trim();
        return v.isEmpty() ? null : v;
    }

    /**
     * Reads {@code confidence} as a number or numeric string (a trailing % is allowed),
     * clamped to 0-100. Missing or unreadable values default to 50.
     */
    static double confidence(JSONObject obj) {
        Object v = obj.opt("confidence");
        double c;
        if (v instanceof Number n) {
            c = n.doubleValue();
        } else if (v instanceof String s) {
            try {
                c = Double.parseDouble(s.replace("%", "").trim());
            } catch (NumberFormatException e) {
                c = DEFAULT_CONFIDENCE;
            }
        } else {
            c = DEFAULT_CONFIDENCE;
        }
        if (Double.isNaN(c)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(100.0, c));
    }
}
