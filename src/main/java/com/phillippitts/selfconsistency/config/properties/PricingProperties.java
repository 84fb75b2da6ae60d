package com.phillippitts.selfconsistency.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Price table per model tier, in currency units per one million tokens.
 *
 * <pre>
 * pricing.currency=USD
 * pricing.tiers.fast.input-per-million=0.15
 * pricing.tiers.fast.output-per-million=0.60
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "pricing")
public class PricingProperties {

    @NotBlank
    private String currency = "USD";

    /** Keyed by tier wire value ("fast", "slow"). */
    private Map<String, TierPrice> tiers = new LinkedHashMap<>();

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public Map<String, TierPrice> getTiers() {
        return tiers;
    }

    public void setTiers(Map<String, TierPrice> tiers) {
        this.tiers = tiers;
    }

    public static class TierPrice {
        private BigDecimal inputPerMillion = BigDecimal.ZERO;
        private BigDecimal outputPerMillion = BigDecimal.ZERO;

        public TierPrice() {
        }

        public TierPrice(BigDecimal inputPerMillion, BigDecimal outputPerMillion) {
            this.inputPerMillion = inputPerMillion;
            this.outputPerMillion = outputPerMillion;
        }

        public BigDecimal getInputPerMillion() {
            return inputPerMillion;
        }

        public void setInputPerMillion(BigDecimal inputPerMillion) {
            this.inputPerMillion = inputPerMillion;
        }

        public BigDecimal getOutputPerMillion() {
            return outputPerMillion;
        }

        public void setOutputPerMillion(BigDecimal outputPerMillion) {
            this.outputPerMillion = outputPerMillion;
        }
    }
}
