package com.compara.controller;

import com.compara.config.ComparaProperties.ModelConfig;
import com.compara.model.SubscriptionTier;
import com.compara.model.dto.ModelInfo;
import com.compara.service.IdentityResolver;
import com.compara.service.ModelRegistry;
import com.compara.service.ModelStatsTracker;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Model catalogue and per-model reliability counters.
 */
@RestController
@RequestMapping("/api/models")
public class ModelsController {

    private final ModelRegistry registry;
    private final ModelStatsTracker statsTracker;

    public ModelsController(ModelRegistry registry, ModelStatsTracker statsTracker) {
        this.registry = registry;
        this.statsTracker = statsTracker;
    }

    /**
     * Catalogue, with availability evaluated for the caller's tier.
     */
    @GetMapping
    public ResponseEntity<List<ModelInfo>> getModels(@RequestHeader HttpHeaders headers) {
        SubscriptionTier tier = headers.getFirst(IdentityResolver.USER_ID_HEADER) != null
                ? SubscriptionTier.fromId(headers.getFirst(IdentityResolver.USER_TIER_HEADER))
                : SubscriptionTier.UNREGISTERED;

        List<ModelInfo> models = registry.getAll().stream()
                .map(model -> toInfo(model, tier))
                .toList();
        return ResponseEntity.ok(models);
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, ModelStatsTracker.ModelStats>> getStats() {
        return ResponseEntity.ok(statsTracker.snapshot());
    }

    private ModelInfo toInfo(ModelConfig model, SubscriptionTier tier) {
        return ModelInfo.builder()
                .id(model.getId())
                .name(model.getName())
                .provider(model.getProvider())
                .maxInputTokens(model.getMaxInputTokens())
                .maxOutputTokens(model.getMaxOutputTokens())
                .minTier(model.getMinTier() != null ? model.getMinTier().getId() : null)
                .supportsWebSearch(model.isSupportsWebSearch())
                .available(registry.isAvailableTo(model.getId(), tier))
                .build();
    }
}
