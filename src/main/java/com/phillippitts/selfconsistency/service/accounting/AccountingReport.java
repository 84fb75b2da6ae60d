package com.phillippitts.selfconsistency.service.accounting;

import com.phillippitts.selfconsistency.domain.CostBreakdown;
import com.phillippitts.selfconsistency.domain.TimingBreakdown;
import com.phillippitts.selfconsistency.domain.UsageRecord;

public record AccountingReport(UsageRecord tokenUsage, CostBreakdown cost, TimingBreakdown timing) {
}
