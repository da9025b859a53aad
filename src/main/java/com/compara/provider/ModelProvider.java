package com.compara.provider;

import com.compara.model.UsageResult;

/**
 * Interface for model providers.
 * Implementations handle provider-specific authentication, request mapping
 * and stream parsing.
 */
public interface ModelProvider {

    /**
     * Get provider name (e.g., "openrouter", "mock").
     *
     * @return provider name
     */
    String getName();

    /**
     * Check if this provider can serve the given model.
     *
     * @param modelId model identifier
     * @return true if supported
     */
    boolean supports(String modelId);

    /**
     * Check if provider is enabled and configured.
     *
     * @return true if ready to use
     */
    boolean isEnabled();

    /**
     * Stream a completion, blocking the calling thread until the stream ends.
     * Fragments are pushed to {@code sink} as they arrive. An interrupt of the
     * calling thread aborts the stream.
     *
     * @param call what to ask
     * @param sink receiver for generated text
     * @return token usage for the call
     * @throws com.compara.exception.ProviderException on any provider failure
     */
    UsageResult streamCompletion(ProviderCall call, FragmentSink sink);
}
