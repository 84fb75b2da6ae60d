package com.phillippitts.selfconsistency.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Token counts reported for one or more model calls.
 *
 * @param promptTokens     input tokens
 * @param completionTokens output tokens
 */
public record UsageRecord(long promptTokens, long completionTokens) {

    public static final UsageRecord ZERO = new UsageRecord(0, 0);

    public UsageRecord {
        if (promptTokens < 0 || completionTokens < 0) {
            throw new IllegalArgumentException("token counts must be non-negative");
        }
    }

    @JsonProperty
    public long totalTokens() {
        return promptTokens + completionTokens;
    }

    public UsageRecord plus(UsageRecord other) {
        if (other == null) {
            return this;
        }
        return new UsageRecord(promptTokens + other.promptTokens, completionTokens + other.completionTokens);
    }

    public static UsageRecord sum(Collection<UsageRecord> records) {
        UsageRecord total = ZERO;
        if (records != null) {
            for (UsageRecord r : records) {
                total = total.plus(r);
            }
        }
        return total;
    }
}
