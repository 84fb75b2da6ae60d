package com.phillippitts.selfconsistency.service.sampling;

import com.phillippitts.selfconsistency.config.properties.ReasoningProperties;
import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.domain.ReasoningPath;
import com.phillippitts.selfconsistency.domain.ReasoningStep;
import com.phillippitts.selfconsistency.domain.UsageRecord;
import com.phillippitts.selfconsistency.exception.AggregationException;
import com.phillippitts.selfconsistency.exception.AggregationTimeoutException;
import com.phillippitts.selfconsistency.exception.ReasoningPathException;
import com.phillippitts.selfconsistency.service.chain.ChainOfThoughtDriver;
import com.phillippitts.selfconsistency.service.chain.PathProgress;
import com.phillippitts.selfconsistency.service.step.GeneratedStep;
import com.phillippitts.selfconsistency.testutil.TestRequests;
import com.phillippitts.selfconsistency.util.Deadline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class DefaultSampleFanOutTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /** Driver whose behaviour per sample index is scripted. */
    private static ChainOfThoughtDriver driver(IntFunction<ReasoningPath> bySample) {
        return new ChainOfThoughtDriver(ctx -> {
            throw new UnsupportedOperationException();
        }) {
            @Override
            public ReasoningPath run(PromptRequest request, int sampleIndex, Deadline deadline,
                                     PathProgress progress) {
                return bySample.apply(sampleIndex);
            }
        };
    }

    private static ReasoningPath failing(int sampleIndex) {
        throw new ReasoningPathException(sampleIndex, List.of(new ReasoningStep(1, "r", "c")),
                new UsageRecord(10, 20), "Step 2 output malformed", null);
    }

    private static ReasoningPath slow(int sampleIndex) {
        try {
            Thread.sleep(2_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return TestRequests.path(sampleIndex, "late", 50);
    }

    private DefaultSampleFanOut fanOut(IntFunction<ReasoningPath> bySample) {
        return new DefaultSampleFanOut(driver(bySample), executor, TestRequests.properties());
    }

    @Test
    void collectsAllPathsInSampleOrder() {
        FanOutResult result = fanOut(i -> TestRequests.path(i, "Paris", 80))
                .fanOut(TestRequests.request(4, 1), Deadline.after(5_000));

        assertThat(result.obtained()).isEqualTo(4);
        assertThat(result.degraded()).isFalse();
        assertThat(result.timedOut()).isFalse();
        assertThat(result.paths()).extracting(ReasoningPath::sampleIndex).containsExactly(1, 2, 3, 4);
        assertThat(result.totalUsage()).isEqualTo(new UsageRecord(40, 80));
    }

    @Test
    void failedSamplesAreIsolatedAndReported() {
        Set<Integer> failingSamples = Set.of(2, 4);

        FanOutResult result = fanOut(i -> failingSamples.contains(i) ? failing(i) : TestRequests.path(i, "Paris", 80))
                .fanOut(TestRequests.request(5, 3), Deadline.after(5_000));

        assertThat(result.requested()).isEqualTo(5);
        assertThat(result.obtained()).isEqualTo(3);
        assertThat(result.degraded()).isTrue();
        assertThat(result.failures()).extracting(SampleFailure::sampleIndex).containsExactly(2, 4);
        assertThat(result.failures()).allSatisfy(f -> {
            assertThat(f.completedSteps()).isEqualTo(1);
            assertThat(f.reason()).contains("malformed");
        });
        // failed samples' tokens are still counted
        assertThat(result.totalUsage()).isEqualTo(new UsageRecord(50, 100));
    }

    @Test
    void allSamplesFailingIsAnAggregationError() {
        assertThatThrownBy(() -> fanOut(DefaultSampleFanOutTest::failing)
                .fanOut(TestRequests.request(3, 1), Deadline.after(5_000)))
                .isInstanceOfSatisfying(AggregationException.class, e -> {
                    assertThat(e.getRequested()).isEqualTo(3);
                    assertThat(e.getObtained()).isZero();
                });
    }

    @Test
    void minimumSuccessesIsConfigurable() {
        ReasoningProperties props = TestRequests.properties();
        props.setMinSuccessfulSamples(4);
        DefaultSampleFanOut fanOut = new DefaultSampleFanOut(
                driver(i -> i == 1 ? failing(i) : TestRequests.path(i, "Paris", 80)), executor, props);

        assertThatThrownBy(() -> fanOut.fanOut(TestRequests.request(4, 1), Deadline.after(5_000)))
                .isInstanceOf(AggregationException.class)
                .hasMessageContaining("obtained=3");
    }

    @Test
    void minimumIsCappedAtRequestedSamples() {
        ReasoningProperties props = TestRequests.properties();
        props.setMinSuccessfulSamples(5);
        DefaultSampleFanOut fanOut = new DefaultSampleFanOut(
                driver(i -> TestRequests.path(i, "Paris", 80)), executor, props);

        assertThat(fanOut.fanOut(TestRequests.request(2, 1), Deadline.after(5_000)).obtained()).isEqualTo(2);
    }

    @Test
    void deadlineWithNoCompletedPathsTimesOut() {
        assertThatThrownBy(() -> fanOut(DefaultSampleFanOutTest::slow)
                .fanOut(TestRequests.request(3, 1), Deadline.after(100)))
                .isInstanceOfSatisfying(AggregationTimeoutException.class, e -> {
                    assertThat(e.getObtained()).isZero();
                    assertThat(e.getRequired()).isEqualTo(1);
                    assertThat(e.getDeadlineMs()).isEqualTo(100);
                });
    }

    @Test
    void deadlineKeepsPathsCompletedInTime() {
        PromptRequest request = TestRequests.request(3, 3);
        ChainOfThoughtDriver partlyDone = new ChainOfThoughtDriver(ctx -> {
            throw new UnsupportedOperationException();
        }) {
            @Override
            public ReasoningPath run(PromptRequest request, int sampleIndex, Deadline deadline,
                                     PathProgress progress) {
                if (sampleIndex == 1) {
                    return TestRequests.path(sampleIndex, "Paris", 80);
                }
                // one billed step, a second call in flight when the deadline passes
                progress.stepCompleted(new ReasoningStep(1, "r", "c"), List.of(new UsageRecord(7, 9)));
                progress.recordCall(new UsageRecord(3, 1));
                return slow(sampleIndex);
            }
        };

        FanOutResult result = new DefaultSampleFanOut(partlyDone, executor, TestRequests.properties())
                .fanOut(request, Deadline.after(300));

        assertThat(result.timedOut()).isTrue();
        assertThat(result.obtained()).isEqualTo(1);
        assertThat(result.failures()).extracting(SampleFailure::reason)
                .containsOnly("cancelled: request deadline expired");
        assertThat(result.failures()).allSatisfy(f -> {
            assertThat(f.completedSteps()).isEqualTo(1);
            assertThat(f.usage()).isEqualTo(new UsageRecord(10, 10));
        });
        // the completed path plus what both cancelled samples had spent
        assertThat(result.totalUsage()).isEqualTo(new UsageRecord(30, 40));
    }

    @Test
    void expiredPathsStopAtNextStepBoundary() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger stepCalls = new AtomicInteger();
        ChainOfThoughtDriver slowSteps = new ChainOfThoughtDriver(ctx -> {
            inFlight.incrementAndGet();
            stepCalls.incrementAndGet();
            try {
                Thread.sleep(150);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            ReasoningStep step = new ReasoningStep(ctx.stepIndex(), "r", "c");
            return ctx.isFinalStep()
                    ? new GeneratedStep(step, "Paris", 80.0, List.of(new UsageRecord(1, 1)))
                    : new GeneratedStep(step, null, null, List.of(new UsageRecord(1, 1)));
        });
        DefaultSampleFanOut fanOut = new DefaultSampleFanOut(slowSteps, executor, TestRequests.properties());

        assertThatThrownBy(() -> fanOut.fanOut(TestRequests.request(2, 10), Deadline.after(200)))
                .isInstanceOf(AggregationTimeoutException.class);

        await().atMost(Duration.ofSeconds(2)).until(() -> inFlight.get() == 0);
        // each path sees the expired deadline after at most its third step
        assertThat(stepCalls.get()).isLessThanOrEqualTo(2 * 3);
    }
}
