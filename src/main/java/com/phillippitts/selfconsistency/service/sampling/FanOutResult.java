package com.phillippitts.selfconsistency.service.sampling;

import com.phillippitts.selfconsistency.domain.ReasoningPath;
import com.phillippitts.selfconsistency.domain.UsageRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Outcome of running K samples for one request.
 *
 * @param paths     successful paths, ascending sample index
 * @param failures  failed or cancelled samples, ascending sample index
 * @param requested K as requested
 * @param timedOut  whether the deadline expired before every sample finished
 * @param durationMs wall-clock duration of the fan-out
 */
public record FanOutResult(
        List<ReasoningPath> paths,
        List<SampleFailure> failures,
        int requested,
        boolean timedOut,
        long durationMs
) {

    public FanOutResult {
        paths = paths == null ? List.of()
                : paths.stream().sorted(Comparator.comparingInt(ReasoningPath::sampleIndex)).toList();
        failures = failures == null ? List.of()
                : failures.stream().sorted(Comparator.comparingInt(SampleFailure::sampleIndex)).toList();
    }

    public int obtained() {
        return paths.size();
    }

    public boolean degraded() {
        return obtained() < requested;
    }

    /**
     * Usage of every call made during the fan-out, by successful and failed samples alike.
     */
    public UsageRecord totalUsage() {
        List<UsageRecord> all = new ArrayList<>(paths.size() + failures.size());
        paths.forEach(p -> all.add(p.totalUsage()));
        failures.forEach(f -> all.add(f.usage()));
        return UsageRecord.sum(all);
    }
}
