package com.phillippitts.selfconsistency.service.provider;

import com.phillippitts.selfconsistency.config.properties.ProviderProperties;
import com.phillippitts.selfconsistency.domain.ModelTier;
import com.phillippitts.selfconsistency.domain.UsageRecord;
import com.phillippitts.selfconsistency.exception.ProviderException;
import com.phillippitts.selfconsistency.exception.ProviderExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.openai.OpenAiChatOptions;

import java.util.Objects;

import static com.phillippitts.selfconsistency.util.TimeUtils.elapsedMillis;

/**
 * {@link ModelProviderClient} backed by a Spring AI {@link ChatClient}.
 *
 * <p>Each call carries its own {@link OpenAiChatOptions} (model, temperature, max tokens), so a
 * single shared client serves both tiers. Spring AI's retry template is expected to be disabled
 * ({@code spring.ai.retry.max-attempts=1}); a failed call fails the step it belongs to.
 */
public class SpringAiModelProviderClient implements ModelProviderClient {

    private static final Logger LOG = LogManager.getLogger(SpringAiModelProviderClient.class);

    private final ChatClient chatClient;
    private final ProviderProperties properties;

    public SpringAiModelProviderClient(ChatClient chatClient, ProviderProperties properties) {
        this.chatClient = Objects.requireNonNull(chatClient, "chatClient");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        Objects.requireNonNull(request, "request");
        String model = modelName(request.tier());
        long startNanos = System.nanoTime();
        try {
            OpenAiChatOptions options = OpenAiChatOptions.builder()
                    .model(model)
                    .temperature(request.temperature())
                    .maxTokens(request.maxTokens())
                    .build();

            ChatClient.ChatClientRequestSpec spec = chatClient.prompt();
            if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
                spec = spec.system(request.systemPrompt());
            }
            ChatResponse response = spec.user(request.userPrompt())
                    .options(options)
                    .call()
                    .chatResponse();

            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                throw ProviderExceptionBuilder.create("Model returned no completion")
                        .model(model)
                        .durationMs(elapsedMillis(startNanos))
                        .build();
            }
            String text = response.getResult().getOutput().getText();
            UsageRecord usage = toUsage(response);
            LOG.debug("Model call completed: model={}, promptTokens={}, completionTokens={}, durationMs={}",
                    model, usage.promptTokens(), usage.completionTokens(), elapsedMillis(startNanos));
            return new CompletionResponse(text, usage, model);
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ProviderExceptionBuilder.create("Model call failed")
                    .model(model)
                    .cause(e)
                    .durationMs(elapsedMillis(startNanos))
                    .metadata("tier", request.tier().value())
                    .build();
        }
    }

    @Override
    public String modelName(ModelTier tier) {
        Objects.requireNonNull(tier, "tier");
        String configured = properties.getModels().get(tier.value());
        if (configured == null || configured.isBlank()) {
            throw new ProviderException("No model configured for tier '" + tier.value() + "'");
        }
        return configured;
    }

    private static UsageRecord toUsage(ChatResponse response) {
        if (response.getMetadata() == null) {
            return UsageRecord.ZERO;
        }
        Usage usage = response.getMetadata().getUsage();
        if (usage == null) {
            return UsageRecord.ZERO;
        }
        return new UsageRecord(orZero(usage.getPromptTokens()), orZero(usage.getCompletionTokens()));
    }

    private static long orZero(Integer value) {
        return value == null ? 0L : value.longValue();
    }
}
