package com.phillippitts.selfconsistency.service.sampling;

import com.phillippitts.selfconsistency.config.properties.ReasoningProperties;
import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.domain.ReasoningPath;
import com.phillippitts.selfconsistency.exception.AggregationException;
import com.phillippitts.selfconsistency.exception.AggregationTimeoutException;
import com.phillippitts.selfconsistency.exception.ReasoningPathException;
import com.phillippitts.selfconsistency.service.chain.ChainOfThoughtDriver;
import com.phillippitts.selfconsistency.service.chain.PathProgress;
import com.phillippitts.selfconsistency.util.Deadline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.phillippitts.selfconsistency.util.TimeUtils.elapsedMillis;

/**
 * Default fan-out: one {@link CompletableFuture} per sample on the {@code reasoningExecutor}.
 *
 * <p><b>Thread Model:</b> each sample runs one {@link ChainOfThoughtDriver#run} to completion on
 * a pool thread and returns its own immutable outcome. The only state shared with the calling
 * thread is the sample's {@link PathProgress}; nothing is shared between samples. The
 * calling thread joins on all K futures, bounded by the request deadline.
 *
 * <p><b>Deadline:</b> when the join times out, futures still running are cancelled and reported
 * as failures with the steps and tokens their progress shows at that moment. Their worker threads
 * stop at the next step boundary because the driver checks the same deadline. A model call still
 * in flight at the deadline is not part of the response; its tokens appear in the sample's
 * failure log line. Paths completed before the deadline are kept.
 *
 * <p><b>Error Handling:</b> per-sample failures are caught and recorded with the tokens they
 * spent. Only when fewer than {@code reasoning.min-successful-samples} paths succeed does the
 * fan-out itself fail.
 */
@Service
public class DefaultSampleFanOut implements SampleFanOut {

    private static final Logger LOG = LogManager.getLogger(DefaultSampleFanOut.class);

    private final ChainOfThoughtDriver driver;
    private final Executor executor;
    private final int minSuccessfulSamples;

    public DefaultSampleFanOut(ChainOfThoughtDriver driver,
                               @Qualifier("reasoningExecutor") Executor executor,
                               ReasoningProperties properties) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.minSuccessfulSamples = properties.getMinSuccessfulSamples();
    }

    @Override
    public FanOutResult fanOut(PromptRequest request, Deadline deadline) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(deadline, "deadline");
        long startNanos = System.nanoTime();
        int k = request.sampleCount();

        List<PathProgress> progress = new ArrayList<>(k);
        List<CompletableFuture<SampleOutcome>> futures = new ArrayList<>(k);
        for (int i = 1; i <= k; i++) {
            final int sampleIndex = i;
            final PathProgress sampleProgress = new PathProgress();
            progress.add(sampleProgress);
            futures.add(CompletableFuture.supplyAsync(
                    () -> runSample(request, sampleIndex, deadline, sampleProgress), executor));
        }

        boolean timedOut = false;
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            timedOut = true;
            LOG.warn("Fan-out deadline of {} ms expired; cancelling unfinished samples", deadline.budgetMs());
            futures.forEach(f -> f.cancel(true));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Fan-out interrupted; cancelling unfinished samples");
            futures.forEach(f -> f.cancel(true));
        } catch (ExecutionException ee) {
            // runSample never completes exceptionally; collected below as a failure if it did
            LOG.error("Unexpected sample task failure", ee.getCause());
        }

        List<ReasoningPath> paths = new ArrayList<>(k);
        List<SampleFailure> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            SampleOutcome outcome = completedOutcome(futures.get(i));
            if (outcome == null) {
                // the path may still be running; report what it has spent up to now
                PathProgress unfinished = progress.get(i);
                String reason = timedOut ? "cancelled: request deadline expired" : "cancelled";
                failures.add(new SampleFailure(i + 1, reason, unfinished.completedSteps(), unfinished.usage()));
            } else if (outcome.path() != null) {
                paths.add(outcome.path());
            } else {
                failures.add(outcome.failure());
            }
        }

        FanOutResult result = new FanOutResult(paths, failures, k, timedOut, elapsedMillis(startNanos));
        int required = Math.min(minSuccessfulSamples, k);
        if (result.obtained() < required) {
            if (timedOut) {
                throw new AggregationTimeoutException(deadline.budgetMs(), result.obtained(), required);
            }
            throw new AggregationException("insufficient samples", k, result.obtained());
        }
        if (result.degraded()) {
            LOG.warn("Degraded fan-out: requested={}, obtained={}, timedOut={}", k, result.obtained(), timedOut);
        }
        return result;
    }

    private static SampleOutcome completedOutcome(CompletableFuture<SampleOutcome> f) {
        if (!f.isDone() || f.isCancelled() || f.isCompletedExceptionally()) {
            return null;
        }
        return f.getNow(null);
    }

    private SampleOutcome runSample(PromptRequest request, int sampleIndex, Deadline deadline, PathProgress progress) {
        try {
            return SampleOutcome.success(driver.run(request, sampleIndex, deadline, progress));
        } catch (ReasoningPathException e) {
            LOG.warn("Sample {} failed after {} step(s), tokens={}: {}", sampleIndex, e.getCompletedSteps().size(),
                    e.getUsage().totalTokens(), e.getMessage());
            return SampleOutcome.failed(new SampleFailure(sampleIndex, e.getMessage(),
                    e.getCompletedSteps().size(), e.getUsage()));
        } catch (RuntimeException e) {
            LOG.error("Sample {} unexpected error", sampleIndex, e);
            return SampleOutcome.failed(new SampleFailure(sampleIndex,
                    "unexpected error: " + e.getClass().getSimpleName(), progress.completedSteps(), progress.usage()));
        }
    }

    private record SampleOutcome(ReasoningPath path, SampleFailure failure) {
        static SampleOutcome success(ReasoningPath path) {
            return new SampleOutcome(path, null);
        }

        static SampleOutcome failed(SampleFailure failure) {
            return new SampleOutcome(null, failure);
        }
    }
}
