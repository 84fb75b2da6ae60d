package com.phillippitts.selfconsistency.config.provider;

import com.phillippitts.selfconsistency.config.properties.ProviderProperties;
import com.phillippitts.selfconsistency.config.properties.ReasoningProperties;
import com.phillippitts.selfconsistency.service.provider.ModelProviderClient;
import com.phillippitts.selfconsistency.service.provider.ProviderCallGuard;
import com.phillippitts.selfconsistency.service.provider.SpringAiModelProviderClient;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the model backend: a Spring AI {@link ChatClient} over the OpenAI chat model, wrapped
 * in the engine's {@link ModelProviderClient} port, plus the shared in-flight call limit.
 */
@Configuration
public class ProviderConfig {

    /**
     * Fails fast with a clear message when no chat model could be created
     * (typically a missing {@code spring.ai.openai.api-key} / {@code OPENAI_API_KEY}).
     */
    @Bean
    public ChatClient reasoningChatClient(ObjectProvider<OpenAiChatModel> chatModelProvider) {
        OpenAiChatModel model = chatModelProvider.getIfAvailable();
        if (model == null) {
            throw new IllegalStateException(
                    "No OpenAI ChatModel bean available. Set spring.ai.openai.api-key or OPENAI_API_KEY.");
        }
        return ChatClient.builder(model).build();
    }

    @Bean
    public ModelProviderClient modelProviderClient(ChatClient reasoningChatClient, ProviderProperties properties) {
        return new SpringAiModelProviderClient(reasoningChatClient, properties);
    }

    @Bean
    public ProviderCallGuard providerCallGuard(ReasoningProperties properties) {
        return new ProviderCallGuard(properties.getMaxInFlightCalls());
    }
}
