package com.phillippitts.selfconsistency.service.accounting;

import com.phillippitts.selfconsistency.domain.CostBreakdown;
import com.phillippitts.selfconsistency.domain.ModelTier;
import com.phillippitts.selfconsistency.domain.UsageRecord;
import com.phillippitts.selfconsistency.service.sampling.FanOutResult;
import com.phillippitts.selfconsistency.service.sampling.SampleFailure;
import com.phillippitts.selfconsistency.testutil.ScriptedModelProviderClient;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.phillippitts.selfconsistency.testutil.TestRequests.path;
import static org.assertj.core.api.Assertions.assertThat;

class UsageAccountantTest {

    private final PriceTable prices = new PriceTable("USD", Map.of(
            ModelTier.FAST, new PriceTable.TierPrice(new BigDecimal("0.15"), new BigDecimal("0.60")),
            ModelTier.SLOW, new PriceTable.TierPrice(new BigDecimal("30"), new BigDecimal("60"))));
    private final UsageAccountant accountant =
            new UsageAccountant(prices, ScriptedModelProviderClient.constant("unused"));

    @Test
    void pricesTokensExactly() {
        CostBreakdown cost = accountant.cost(ModelTier.FAST, new UsageRecord(100, 200));

        assertThat(cost.inputCost()).isEqualByComparingTo("0.000015");
        assertThat(cost.outputCost()).isEqualByComparingTo("0.00012");
        assertThat(cost.totalCost()).isEqualByComparingTo("0.000135");
        assertThat(cost.currency()).isEqualTo("USD");
        assertThat(cost.pricingModel()).isEqualTo("gpt-4o-mini");
    }

    @Test
    void usesTierPrices() {
        CostBreakdown cost = accountant.cost(ModelTier.SLOW, new UsageRecord(1_000_000, 500_000));

        assertThat(cost.totalCost()).isEqualByComparingTo("60");
        assertThat(cost.pricingModel()).isEqualTo("gpt-4");
    }

    @Test
    void totalsIncludeFailedSamplesAndReflection() {
        FanOutResult fanOut = new FanOutResult(
                List.of(path(1, "Paris", 80), path(2, "Paris", 70)),
                List.of(new SampleFailure(3, "malformed", 1, new UsageRecord(30, 60))),
                3, false, 100);

        AccountingReport report = accountant.account(ModelTier.FAST, fanOut, new UsageRecord(50, 40),
                RequestStopwatch.start());

        assertThat(report.tokenUsage()).isEqualTo(new UsageRecord(100, 140));
        assertThat(report.tokenUsage().totalTokens()).isEqualTo(240);
        assertThat(report.cost().totalCost()).isEqualByComparingTo("0.000099");
        assertThat(report.timing()).isNotNull();
    }

    @Test
    void zeroUsageCostsNothing() {
        assertThat(accountant.cost(ModelTier.FAST, UsageRecord.ZERO).totalCost()).isEqualByComparingTo(BigDecimal.ZERO);
    }
}
