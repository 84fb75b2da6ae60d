package com.phillippitts.selfconsistency.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps model tiers to concrete provider model names.
 *
 * <pre>
 * provider.models.fast=gpt-4o-mini
 * provider.models.slow=gpt-4
 * </pre>
 */
@ConfigurationProperties(prefix = "provider")
public class ProviderProperties {

    private Map<String, String> models = new LinkedHashMap<>(Map.of(
            "fast", "gpt-4o-mini",
            "slow", "gpt-4"
    ));

    public Map<String, String> getModels() {
        return models;
    }

    public void setModels(Map<String, String> models) {
        this.models = models;
    }
}
