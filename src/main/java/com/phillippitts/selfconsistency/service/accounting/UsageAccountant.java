package com.phillippitts.selfconsistency.service.accounting;

import com.phillippitts.selfconsistency.domain.CostBreakdown;
import com.phillippitts.selfconsistency.domain.ModelTier;
import com.phillippitts.selfconsistency.domain.UsageRecord;
import com.phillippitts.selfconsistency.service.provider.ModelProviderClient;
import com.phillippitts.selfconsistency.service.sampling.FanOutResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Totals token usage for a request and prices it.
 *
 * <p>Costs are exact decimals: {@code tokens x pricePerMillion / 10^6}, no rounding.
 */
@Component
public class UsageAccountant {

    private final PriceTable priceTable;
    private final ModelProviderClient client;

    public UsageAccountant(PriceTable priceTable, ModelProviderClient client) {
        this.priceTable = Objects.requireNonNull(priceTable, "priceTable");
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * @param tier            tier the request ran on
     * @param fanOut          fan-out result, including the usage of failed samples
     * @param reflectionUsage usage of the reflection call ({@link UsageRecord#ZERO} if none returned)
     * @param stopwatch       the request's stopwatch
     */
    public AccountingReport account(ModelTier tier, FanOutResult fanOut, UsageRecord reflectionUsage,
                                    RequestStopwatch stopwatch) {
        UsageRecord total = UsageRecord.sum(List.of(fanOut.totalUsage(),
                reflectionUsage == null ? UsageRecord.ZERO : reflectionUsage));
        return new AccountingReport(total, cost(tier, total), stopwatch.snapshot());
    }

    public CostBreakdown cost(ModelTier tier, UsageRecord usage) {
        PriceTable.TierPrice price = priceTable.priceFor(tier);
        BigDecimal input = BigDecimal.valueOf(usage.promptTokens())
                .multiply(price.inputPerMillion()).movePointLeft(6);
        BigDecimal output = BigDecimal.valueOf(usage.completionTokens())
                .multiply(price.outputPerMillion()).movePointLeft(6);
        return new CostBreakdown(input, output, input.add(output), priceTable.currency(),
                client.modelName(tier), price.inputPerMillion(), price.outputPerMillion());
    }
}
