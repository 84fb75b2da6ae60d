package com.phillippitts.selfconsistency.service.sampling;

import com.phillippitts.selfconsistency.domain.UsageRecord;

/**
 * A sample that produced no path.
 *
 * @param sampleIndex    1-based sample index
 * @param reason         failure description
 * @param completedSteps steps finished before the failure
 * @param usage          tokens spent by the sample before it failed
 */
public record SampleFailure(int sampleIndex, String reason, int completedSteps, UsageRecord usage) {

    public SampleFailure {
        usage = usage == null ? UsageRecord.ZERO : usage;
    }
}
