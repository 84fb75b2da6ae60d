package com.phillippitts.selfconsistency.service.accounting;

import com.phillippitts.selfconsistency.config.properties.PricingProperties;
import com.phillippitts.selfconsistency.domain.ModelTier;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable per-tier token prices, in currency units per one million tokens.
 */
public final class PriceTable {

    public record TierPrice(BigDecimal inputPerMillion, BigDecimal outputPerMillion) {
        public TierPrice {
            Objects.requireNonNull(inputPerMillion, "inputPerMillion");
            Objects.requireNonNull(outputPerMillion, "outputPerMillion");
            if (inputPerMillion.signum() < 0 || outputPerMillion.signum() < 0) {
                throw new IllegalArgumentException("prices must not be negative");
            }
        }
    }

    private final String currency;
    private final Map<ModelTier, TierPrice> prices;

    public PriceTable(String currency, Map<ModelTier, TierPrice> prices) {
        this.currency = Objects.requireNonNull(currency, "currency");
        this.prices = prices.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(prices));
    }

    /**
     * Builds the table from {@code pricing.*} properties. Tier keys must be tier wire values.
     *
     * @throws IllegalArgumentException on an unknown tier key
     */
    public static PriceTable from(PricingProperties properties) {
        Map<ModelTier, TierPrice> prices = new EnumMap<>(ModelTier.class);
        properties.getTiers().forEach((key, p) -> prices.put(ModelTier.fromValue(key),
                new TierPrice(p.getInputPerMillion(), p.getOutputPerMillion())));
        return new PriceTable(properties.getCurrency(), prices);
    }

    public String currency() {
        return currency;
    }

    /**
     * @throws IllegalStateException if no price is configured for the tier
     */
    public TierPrice priceFor(ModelTier tier) {
        TierPrice price = prices.get(tier);
        if (price == null) {
            throw new IllegalStateException("No price configured for tier '" + tier.value() + "'");
        }
        return price;
    }
}
