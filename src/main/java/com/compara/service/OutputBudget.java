package com.compara.service;

import com.compara.config.ComparaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Caps {@code max_tokens} per model when the caller is close to running out of
 * credits, so that one comparison cannot overspend by much.
 */
@Slf4j
@Component
public class OutputBudget {

    /**
     * Below this many credits per model the output limit is reduced.
     */
    static final double LOW_CREDITS_PER_MODEL = 2.0;

    private final ComparaProperties properties;
    private final ModelRegistry registry;

    public OutputBudget(ComparaProperties properties, ModelRegistry registry) {
        this.properties = properties;
        this.registry = registry;
    }

    /**
     * @param modelId         model being called
     * @param creditsRemaining balance at admission
     * @param modelCount      models in the comparison
     * @param inputTokens     estimated prompt size including history
     * @return max output tokens to request
     */
    public int maxOutputTokens(String modelId, long creditsRemaining, int modelCount, long inputTokens) {
        int modelMax = registry.maxOutputTokens(modelId);
        if (creditsRemaining <= 0 || modelCount <= 0) {
            return modelMax;
        }

        ComparaProperties.CreditsConfig credits = properties.getCredits();
        double creditsPerModel = (double) creditsRemaining / modelCount;
        if (creditsPerModel >= LOW_CREDITS_PER_MODEL) {
            return modelMax;
        }

        double affordable = (creditsPerModel * credits.getTokensPerCredit() - inputTokens) / credits.getOutputTokenWeight();
        int limit = Math.max(credits.getMinUsableOutputTokens(), (int) affordable);
        int capped = Math.min(modelMax, limit);
        if (capped < modelMax) {
            log.info("Low credits ({} per model), limiting {} to {} output tokens",
                    String.format("%.2f", creditsPerModel), modelId, capped);
        }
        return capped;
    }
}
