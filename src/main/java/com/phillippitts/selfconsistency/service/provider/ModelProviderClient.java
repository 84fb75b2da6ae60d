package com.phillippitts.selfconsistency.service.provider;

import com.phillippitts.selfconsistency.domain.ModelTier;
import com.phillippitts.selfconsistency.exception.ProviderException;

/**
 * Outbound port to a chat-completion model backend.
 *
 * <p>Implementations must be thread-safe: the fan-out calls {@link #complete(CompletionRequest)}
 * from many worker threads at once. Implementations do not retry; every failure (transport,
 * rate limit, empty response) surfaces as {@link ProviderException}.
 */
public interface ModelProviderClient {

    /**
     * Performs a single completion call.
     *
     * @param request call parameters
     * @return text and token usage of the call
     * @throws ProviderException when the backend call fails
     */
    CompletionResponse complete(CompletionRequest request);

    /**
     * Resolves the concrete model name used for a tier.
     */
    String modelName(ModelTier tier);
}
