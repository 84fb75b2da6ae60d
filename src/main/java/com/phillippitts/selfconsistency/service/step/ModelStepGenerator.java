package com.phillippitts.selfconsistency.service.step;

import com.phillippitts.selfconsistency.config.properties.ReasoningProperties;
import com.phillippitts.selfconsistency.domain.ReasoningStep;
import com.phillippitts.selfconsistency.domain.UsageRecord;
import com.phillippitts.selfconsistency.exception.MalformedStepException;
import com.phillippitts.selfconsistency.service.parse.ModelOutputParser;
import com.phillippitts.selfconsistency.service.parse.ParseOutcome;
import com.phillippitts.selfconsistency.service.parse.ParsedStep;
import com.phillippitts.selfconsistency.service.prompt.PromptTemplates;
import com.phillippitts.selfconsistency.service.provider.CompletionRequest;
import com.phillippitts.selfconsistency.service.provider.CompletionResponse;
import com.phillippitts.selfconsistency.service.provider.ModelProviderClient;
import com.phillippitts.selfconsistency.service.provider.ProviderCallGuard;
import com.phillippitts.selfconsistency.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generates a step with one model call, re-asking with a stricter format instruction
 * when the response cannot be parsed.
 *
 * <p>The usage of every call is handed to {@link StepContext#callListener()} as soon as the call
 * returns, so tokens stay accounted for when a later attempt of the same step fails.
 */
@Component
public class ModelStepGenerator implements StepGenerator {

    private static final Logger LOG = LogManager.getLogger(ModelStepGenerator.class);

    private final ModelProviderClient client;
    private final ProviderCallGuard callGuard;
    private final int maxParseRetries;
    private final int maxTokens;

    public ModelStepGenerator(ModelProviderClient client, ProviderCallGuard callGuard, ReasoningProperties properties) {
        this.client = Objects.requireNonNull(client, "client");
        this.callGuard = Objects.requireNonNull(callGuard, "callGuard");
        this.maxParseRetries = properties.getStep().getMaxParseRetries();
        this.maxTokens = properties.getStep().getMaxTokens();
    }

    @Override
    public GeneratedStep generate(StepContext context) {
        Objects.requireNonNull(context, "context");
        int maxAttempts = maxParseRetries + 1;
        List<UsageRecord> callUsage = new ArrayList<>(maxAttempts);
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            CompletionRequest request = new CompletionRequest(
                    context.request().modelTier(),
                    PromptTemplates.stepSystemPrompt(context.request()),
                    PromptTemplates.stepPrompt(context.request(), context.stepIndex(), context.priorSteps(), lastError),
                    context.request().temperature(),
                    maxTokens);

            CompletionResponse response = call(request, context);
            callUsage.add(response.usage());
            context.callListener().accept(response.usage());

            ParseOutcome<ParsedStep> outcome = ModelOutputParser.parseStep(response.text(), context.isFinalStep());
            if (outcome.isSuccess()) {
                ParsedStep parsed = outcome.value();
                ReasoningStep step = new ReasoningStep(context.stepIndex(), parsed.reasoning(),
                        parsed.intermediateConclusion());
                return new GeneratedStep(step, parsed.finalAnswer(), parsed.confidence(), callUsage);
            }

            lastError = outcome.error();
            LOG.debug("Step {} attempt {}/{} unparseable: {} (output: '{}')", context.stepIndex(), attempt,
                    maxAttempts, lastError, LogSanitizer.truncate(response.text(), 120));
        }

        throw new MalformedStepException(context.stepIndex(), maxAttempts, UsageRecord.sum(callUsage), lastError);
    }

    private CompletionResponse call(CompletionRequest request, StepContext context) {
        callGuard.acquire(context.deadline());
        try {
            return client.complete(request);
        } finally {
            callGuard.release();
        }
    }
}
