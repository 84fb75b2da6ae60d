package com.phillippitts.selfconsistency.service.reflection;

import com.phillippitts.selfconsistency.config.properties.ReasoningProperties;
import com.phillippitts.selfconsistency.domain.PromptRequest;
import com.phillippitts.selfconsistency.domain.ReasoningPath;
import com.phillippitts.selfconsistency.exception.ProviderException;
import com.phillippitts.selfconsistency.service.parse.ModelOutputParser;
import com.phillippitts.selfconsistency.service.parse.ParseOutcome;
import com.phillippitts.selfconsistency.service.parse.ParsedReflection;
import com.phillippitts.selfconsistency.service.prompt.PromptTemplates;
import com.phillippitts.selfconsistency.service.provider.CompletionRequest;
import com.phillippitts.selfconsistency.service.provider.CompletionResponse;
import com.phillippitts.selfconsistency.service.provider.ModelProviderClient;
import com.phillippitts.selfconsistency.service.provider.ProviderCallGuard;
import com.phillippitts.selfconsistency.service.voting.VoteOutcome;
import com.phillippitts.selfconsistency.util.Deadline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

import static com.phillippitts.selfconsistency.util.TimeUtils.elapsedMillis;

/**
 * Single critical-review call over the voted answer.
 *
 * <p>Never fails the request: a provider failure, unparseable output or an expired deadline
 * leaves the preliminary answer in place and marks the pass as skipped. Tokens of a call
 * that returned are reported either way.
 */
@Component
public class ReflectionStage {

    private static final Logger LOG = LogManager.getLogger(ReflectionStage.class);

    private final ModelProviderClient client;
    private final ProviderCallGuard callGuard;
    private final boolean enabled;
    private final int maxTokens;

    public ReflectionStage(ModelProviderClient client, ProviderCallGuard callGuard, ReasoningProperties properties) {
        this.client = Objects.requireNonNull(client, "client");
        this.callGuard = Objects.requireNonNull(callGuard, "callGuard");
        this.enabled = properties.getReflection().isEnabled();
        this.maxTokens = properties.getReflection().getMaxTokens();
    }

    /**
     * @param request  originating request
     * @param paths    successful paths, sample-index order
     * @param vote     outcome of the consistency vote
     * @param summary  reasoning summary text shown to the reviewer
     * @param deadline request deadline
     */
    public ReflectionOutcome reflect(PromptRequest request, List<ReasoningPath> paths, VoteOutcome vote,
                                     String summary, Deadline deadline) {
        String preliminary = vote.preliminaryAnswer();
        long startNanos = System.nanoTime();
        if (!enabled) {
            return ReflectionOutcome.skipped(preliminary, "reflection disabled", null, 0);
        }
        if (deadline.isExpired()) {
            LOG.warn("Skipping reflection: request deadline already expired");
            return ReflectionOutcome.skipped(preliminary, "request deadline expired", null, 0);
        }

        CompletionRequest call = new CompletionRequest(
                request.modelTier(),
                PromptTemplates.reflectionSystemPrompt(request),
                PromptTemplates.reflectionPrompt(request, paths, preliminary, summary),
                request.temperature(),
                maxTokens);

        CompletionResponse response;
        try {
            callGuard.acquire(deadline);
            try {
                response = client.complete(call);
            } finally {
                callGuard.release();
            }
        } catch (ProviderException e) {
            LOG.warn("Reflection call failed, keeping voted answer: {}", e.getMessage());
            return ReflectionOutcome.skipped(preliminary, "provider error: " + e.getMessage(), null,
                    elapsedMillis(startNanos));
        }

        ParseOutcome<ParsedReflection> parsed = ModelOutputParser.parseReflection(response.text());
        if (!parsed.isSuccess()) {
            LOG.warn("Reflection output unparseable, keeping voted answer: {}", parsed.error());
            return ReflectionOutcome.skipped(preliminary, "unparseable reflection: " + parsed.error(),
                    response.usage(), elapsedMillis(startNanos));
        }

        ParsedReflection r = parsed.value();
        long durationMs = elapsedMillis(startNanos);
        LOG.debug("Reflection completed: confidence={}, changed={}, durationMs={}",
                r.confidence(), !r.refinedAnswer().equals(preliminary), durationMs);
        return ReflectionOutcome.completed(r.refinedAnswer(), r.reflectionReasoning(), r.confidence(),
                response.usage(), durationMs);
    }
}
