package com.phillippitts.selfconsistency.presentation.dto;

import java.util.List;

/**
 * JSON body of {@code POST /v1/chat/completions}. The last {@code user} message is the prompt
 * and the first {@code system} message, if any, the system prompt.
 */
public record ChatCompletionRequestBody(
        List<ChatMessage> messages,
        Integer numSelfConsistency,
        Integer numCot,
        String model,
        Double temperature
) {
}
