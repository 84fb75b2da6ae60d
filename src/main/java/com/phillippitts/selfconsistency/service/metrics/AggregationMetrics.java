package com.phillippitts.selfconsistency.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for aggregation requests.
 *
 * <p>Provides:
 * <ul>
 *   <li>End-to-end latency per model tier</li>
 *   <li>Success/failure counts (failures tagged by reason)</li>
 *   <li>Failed samples and skipped reflections</li>
 *   <li>Token usage per request</li>
 * </ul>
 *
 * <p>Exposed through actuator at /actuator/metrics.
 */
@Component
public class AggregationMetrics {

    private static final String METRIC_PREFIX = "selfconsistency.aggregation";

    private final MeterRegistry registry;

    public AggregationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(String tier, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("End-to-end aggregation time")
                .tag("tier", tier)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String tier, boolean degraded) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of completed aggregations")
                .tag("tier", tier)
                .tag("degraded", String.valueOf(degraded))
                .register(registry)
                .increment();
    }

    /**
     * @param reason short failure reason (validation, insufficient_samples, timeout, error)
     */
    public void incrementFailure(String tier, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed aggregations")
                .tag("tier", tier)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordFailedSamples(String tier, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".samples.failed")
                .description("Reasoning paths that failed or were cancelled")
                .tag("tier", tier)
                .register(registry)
                .increment(count);
    }

    public void incrementReflectionSkipped(String tier) {
        Counter.builder(METRIC_PREFIX + ".reflection.skipped")
                .description("Requests whose reflection pass was skipped")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void recordTokens(String tier, long totalTokens) {
        DistributionSummary.builder(METRIC_PREFIX + ".tokens")
                .description("Tokens consumed per request")
                .baseUnit("tokens")
                .tag("tier", tier)
                .register(registry)
                .record(totalTokens);
    }
}
