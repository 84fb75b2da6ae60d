package com.phillippitts.selfconsistency.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Monetary cost of all model calls made for one request.
 *
 * @param inputCost              cost of prompt tokens
 * @param outputCost             cost of completion tokens
 * @param totalCost              input + output
 * @param currency               ISO currency code of the price table
 * @param pricingModel           model name the prices belong to
 * @param inputPricePerMillion   price per one million prompt tokens
 * @param outputPricePerMillion  price per one million completion tokens
 */
public record CostBreakdown(
        BigDecimal inputCost,
        BigDecimal outputCost,
        BigDecimal totalCost,
        String currency,
        String pricingModel,
        BigDecimal inputPricePerMillion,
        BigDecimal outputPricePerMillion
) {
    public CostBreakdown {
        Objects.requireNonNull(inputCost, "inputCost");
        Objects.requireNonNull(outputCost, "outputCost");
        Objects.requireNonNull(totalCost, "totalCost");
        Objects.requireNonNull(currency, "currency");
    }
}
