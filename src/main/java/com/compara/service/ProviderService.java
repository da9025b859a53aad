package com.compara.service;

import com.compara.config.ComparaProperties;
import com.compara.exception.ProviderException;
import com.compara.model.UsageResult;
import com.compara.provider.FragmentSink;
import com.compara.provider.ModelProvider;
import com.compara.provider.ProviderCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Service for routing model calls to providers using the provider adapter pattern.
 * The provider named in the model's registry entry wins; otherwise the first
 * enabled provider that supports the model is used.
 */
@Slf4j
@Service
public class ProviderService {

    private final List<ModelProvider> providers;
    private final ModelRegistry registry;

    public ProviderService(List<ModelProvider> providers, ModelRegistry registry) {
        this.providers = providers;
        this.registry = registry;
        log.info("Initialized ProviderService with {} providers: {}",
                providers.size(),
                providers.stream().map(ModelProvider::getName).toList());
    }

    /**
     * Stream a completion from whichever provider serves the model. Blocks the calling thread.
     */
    public UsageResult stream(ProviderCall call, FragmentSink sink) {
        ModelProvider provider = resolve(call.getModelId());
        log.debug("Routing model '{}' to provider '{}'", call.getModelId(), provider.getName());
        return provider.streamCompletion(call, sink);
    }

    public ModelProvider resolve(String modelId) {
        Optional<ModelProvider> configured = registry.find(modelId)
                .map(ComparaProperties.ModelConfig::getProvider)
                .flatMap(this::getEnabledProvider);
        if (configured.isPresent()) {
            return configured.get();
        }

        return providers.stream()
                .filter(ModelProvider::isEnabled)
                .filter(p -> p.supports(modelId))
                .findFirst()
                .orElseThrow(() -> {
                    log.error("No enabled provider found for model: {}", modelId);
                    return new ProviderException("No provider available for model: " + modelId
                            + ". Enabled providers: "
                            + providers.stream().filter(ModelProvider::isEnabled).map(ModelProvider::getName).toList(),
                            404, null, null, null);
                });
    }

    private Optional<ModelProvider> getEnabledProvider(String name) {
        return providers.stream()
                .filter(p -> p.getName().equals(name))
                .filter(ModelProvider::isEnabled)
                .findFirst();
    }
}
