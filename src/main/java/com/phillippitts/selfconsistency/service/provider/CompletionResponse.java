package com.phillippitts.selfconsistency.service.provider;

import com.phillippitts.selfconsistency.domain.UsageRecord;

/**
 * Raw text returned by the model plus the tokens the call consumed.
 */
public record CompletionResponse(String text, UsageRecord usage, String model) {

    public CompletionResponse {
        text = text == null ? "" : text;
        usage = usage == null ? UsageRecord.ZERO : usage;
    }
}
