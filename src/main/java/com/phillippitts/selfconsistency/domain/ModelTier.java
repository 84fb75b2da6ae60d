package com.phillippitts.selfconsistency.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Quality/cost class of the model backend. Each tier maps to a concrete model name
 * and a price entry through configuration.
 */
public enum ModelTier {
    FAST("fast"),
    SLOW("slow");

    private final String value;

    ModelTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a tier from its wire value (case-insensitive).
     *
     * @param value "fast" or "slow"
     * @return matching tier
     * @throws IllegalArgumentException if the value names no tier
     */
    public static ModelTier fromValue(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (ModelTier tier : values()) {
                if (tier.value.equals(v)) {
                    return tier;
                }
            }
        }
        throw new IllegalArgumentException("Unknown model tier: " + value);
    }
}
