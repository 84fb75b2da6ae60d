package com.phillippitts.selfconsistency.service.parse;

public record ParsedReflection(String refinedAnswer, String reflectionReasoning, double confidence) {
}
