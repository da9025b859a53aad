package com.compara.service;

import com.compara.config.ComparaProperties;
import com.compara.config.ComparaProperties.ModelConfig;
import com.compara.model.SubscriptionTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Catalogue of the models callers may compare, as configured under {@code compara.models}.
 */
@Slf4j
@Component
public class ModelRegistry {

    private final Map<String, ModelConfig> models = new LinkedHashMap<>();

    public ModelRegistry(ComparaProperties properties) {
        for (ModelConfig model : properties.getModels()) {
            if (model.getId() == null || model.getId().isBlank()) {
                log.warn("Ignoring model entry without id: {}", model);
                continue;
            }
            models.put(model.getId(), model);
        }
        log.info("Loaded {} models into registry", models.size());
    }

    public Optional<ModelConfig> find(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    public boolean contains(String modelId) {
        return models.containsKey(modelId);
    }

    public Collection<ModelConfig> getAll() {
        return Collections.unmodifiableCollection(models.values());
    }

    public long maxInputTokens(String modelId) {
        return find(modelId).map(ModelConfig::getMaxInputTokens).orElse(0L);
    }

    public int maxOutputTokens(String modelId) {
        return find(modelId).map(ModelConfig::getMaxOutputTokens).orElse(0);
    }

    public boolean supportsWebSearch(String modelId) {
        return find(modelId).map(ModelConfig::isSupportsWebSearch).orElse(false);
    }

    /**
     * Tiers are ordered from least to most privileged.
     */
    public boolean isAvailableTo(String modelId, SubscriptionTier tier) {
        return find(modelId)
                .map(model -> model.getMinTier() == null || tier.ordinal() >= model.getMinTier().ordinal())
                .orElse(false);
    }
}
