package com.phillippitts.selfconsistency.presentation.dto;

import com.phillippitts.selfconsistency.domain.AggregateResult;

import java.util.List;

/**
 * OpenAI-style chat completion response; the full aggregate result travels in
 * {@code agentic_metadata}.
 */
public record ChatCompletionResponseBody(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices,
        Usage usage,
        AggregateResult agenticMetadata
) {

    public record Choice(int index, ChatMessage message, String finishReason) {
    }

    public record Usage(long promptTokens, long completionTokens, long totalTokens) {
    }
}
