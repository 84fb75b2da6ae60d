package com.phillippitts.selfconsistency.service.aggregation;

import com.phillippitts.selfconsistency.config.properties.ReasoningProperties;
import com.phillippitts.selfconsistency.domain.AggregateResult;
import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.exception.AggregationException;
import com.phillippitts.selfconsistency.exception.AggregationTimeoutException;
import com.phillippitts.selfconsistency.exception.ValidationException;
import com.phillippitts.selfconsistency.service.accounting.AccountingReport;
import com.phillippitts.selfconsistency.service.accounting.RequestStopwatch;
import com.phillippitts.selfconsistency.service.accounting.UsageAccountant;
import com.phillippitts.selfconsistency.service.compose.ResultComposer;
import com.phillippitts.selfconsistency.service.metrics.AggregationMetrics;
import com.phillippitts.selfconsistency.service.provider.ModelProviderClient;
import com.phillippitts.selfconsistency.service.reflection.ReflectionOutcome;
import com.phillippitts.selfconsistency.service.reflection.ReflectionStage;
import com.phillippitts.selfconsistency.service.sampling.FanOutResult;
import com.phillippitts.selfconsistency.service.sampling.SampleFanOut;
import com.phillippitts.selfconsistency.service.validation.PromptRequestValidator;
import com.phillippitts.selfconsistency.service.voting.ConsistencyVoter;
import com.phillippitts.selfconsistency.service.voting.VoteOutcome;
import com.phillippitts.selfconsistency.util.Deadline;
import com.phillippitts.selfconsistency.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Default pipeline. Stages run strictly in sequence on the calling thread except the fan-out,
 * which joins before the vote: validate, fan out, vote, summarize, reflect, account, compose.
 */
@Service
public class DefaultReasoningAggregationService implements ReasoningAggregationService {

    private static final Logger LOG = LogManager.getLogger(DefaultReasoningAggregationService.class);

    private final PromptRequestValidator validator;
    private final SampleFanOut fanOut;
    private final ConsistencyVoter voter;
    private final ReflectionStage reflection;
    private final UsageAccountant accountant;
    private final ResultComposer composer;
    private final ModelProviderClient client;
    private final AggregationMetrics metrics;
    private final long deadlineMs;

    public DefaultReasoningAggregationService(PromptRequestValidator validator,
                                              SampleFanOut fanOut,
                                              ConsistencyVoter voter,
                                              ReflectionStage reflection,
                                              UsageAccountant accountant,
                                              ResultComposer composer,
                                              ModelProviderClient client,
                                              AggregationMetrics metrics,
                                              ReasoningProperties properties) {
        this.validator = Objects.requireNonNull(validator);
        this.fanOut = Objects.requireNonNull(fanOut);
        this.voter = Objects.requireNonNull(voter);
        this.reflection = Objects.requireNonNull(reflection);
        this.accountant = Objects.requireNonNull(accountant);
        this.composer = Objects.requireNonNull(composer);
        this.client = Objects.requireNonNull(client);
        this.metrics = Objects.requireNonNull(metrics);
        this.deadlineMs = properties.getDeadlineMs();
    }

    @Override
    public AggregateResult runAggregation(PromptRequest request) {
        String tier = request == null || request.modelTier() == null ? "unknown" : request.modelTier().value();
        try {
            validator.validate(request);
        } catch (ValidationException e) {
            metrics.incrementFailure(tier, "validation");
            throw e;
        }

        LOG.info("Aggregation started: samples={}, steps={}, tier={}, temperature={}, document={}, prompt='{}'",
                request.sampleCount(), request.stepCount(), tier, request.temperature(), request.hasDocument(),
                LogSanitizer.truncate(request.prompt(), 80));

        RequestStopwatch stopwatch = RequestStopwatch.start();
        Deadline deadline = Deadline.after(deadlineMs);

        FanOutResult samples;
        try {
            samples = stopwatch.timeFanOut(() -> fanOut.fanOut(request, deadline));
        } catch (AggregationTimeoutException e) {
            metrics.incrementFailure(tier, "timeout");
            LOG.error("Aggregation timed out: {}", e.getMessage());
            throw e;
        } catch (AggregationException e) {
            metrics.incrementFailure(tier, "insufficient_samples");
            LOG.error("Aggregation failed: {}", e.getMessage());
            throw e;
        }
        metrics.recordFailedSamples(tier, samples.failures().size());

        VoteOutcome vote = voter.vote(samples.paths());
        String summary = composer.summarize(samples, vote);

        ReflectionOutcome reflected = stopwatch.timeReflection(
                () -> reflection.reflect(request, samples.paths(), vote, summary, deadline));
        if (reflected.skipped()) {
            metrics.incrementReflectionSkipped(tier);
        }

        AccountingReport accounting = accountant.account(request.modelTier(), samples, reflected.usage(), stopwatch);
        AggregateResult result = composer.compose(request, client.modelName(request.modelTier()), samples, vote,
                summary, reflected, accounting);

        metrics.recordLatency(tier, stopwatch.elapsedNanos());
        metrics.incrementSuccess(tier, result.degraded());
        metrics.recordTokens(tier, result.tokenUsage().totalTokens());
        LOG.info("Aggregation completed: agreement={}/{}, confidence={}, reflectionSkipped={}, degraded={}, "
                        + "tokens={}, cost={} {}, totalMs={}",
                vote.winner().size(), samples.obtained(), String.format("%.3f", result.confidenceScore()),
                result.reflectionSkipped(), result.degraded(), result.tokenUsage().totalTokens(),
                result.costAnalysis().totalCost().toPlainString(), result.costAnalysis().currency(),
                result.timing().totalMs());
        return result;
    }
}
