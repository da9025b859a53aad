package com.compara.service;

import com.compara.config.ComparaProperties.ModelConfig;
import com.compara.exception.InputValidationException;
import com.compara.exception.ModelAccessDeniedException;
import com.compara.model.ComparisonRequest;
import com.compara.model.SubscriptionTier;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rejects comparison requests that cannot be served, before any credits are checked.
 */
@Component
public class ComparisonValidator {

    static final double MIN_TEMPERATURE = 0.0;
    static final double MAX_TEMPERATURE = 2.0;

    private final ModelRegistry registry;

    public ComparisonValidator(ModelRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws InputValidationException   for malformed input or limits exceeded
     * @throws ModelAccessDeniedException when a model is above the caller's tier
     */
    public void validate(ComparisonRequest request, SubscriptionTier tier) {
        if (request.getInputData() == null || request.getInputData().isBlank()) {
            throw new InputValidationException("Input data cannot be empty");
        }

        List<String> models = request.getModels();
        if (models == null || models.isEmpty()) {
            throw new InputValidationException("At least one model must be selected");
        }

        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (String model : models) {
            if (!seen.add(model)) {
                duplicates.add(model);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new InputValidationException("Duplicate models selected: " + String.join(", ", duplicates));
        }

        List<String> unknown = models.stream().filter(model -> !registry.contains(model)).toList();
        if (!unknown.isEmpty()) {
            throw new InputValidationException("Unknown models: " + String.join(", ", unknown));
        }

        Double temperature = request.getTemperature();
        if (temperature != null && (temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE)) {
            throw new InputValidationException("Temperature must be between 0 and 2, got " + temperature);
        }

        List<String> restricted = models.stream().filter(model -> !registry.isAvailableTo(model, tier)).toList();
        if (!restricted.isEmpty()) {
            throw new ModelAccessDeniedException("The following models are not available for " + tier.getId()
                    + " tier: " + String.join(", ", restricted) + "." + accessUpgradeHint(tier), restricted);
        }

        if (models.size() > tier.getModelLimit()) {
            throw new InputValidationException("Your " + tier.getId() + " tier allows maximum " + tier.getModelLimit()
                    + " models per comparison. You selected " + models.size() + " models." + limitUpgradeHint(tier));
        }

        validateContextWindow(request, models);
    }

    private void validateContextWindow(ComparisonRequest request, List<String> models) {
        long inputTokens = TokenEstimator.estimateInputTokens(request.getInputData(), request.getConversationHistory());
        long smallestWindow = models.stream().mapToLong(registry::maxInputTokens).min().orElse(Long.MAX_VALUE);
        if (inputTokens <= smallestWindow) {
            return;
        }

        List<String> problemModels = models.stream()
                .filter(model -> registry.maxInputTokens(model) < inputTokens)
                .map(model -> registry.find(model).map(ModelConfig::getName).orElse(model))
                .toList();

        throw new InputValidationException(String.format(Locale.ROOT,
                "Your input is too long for one or more of the selected models. "
                        + "The maximum input length is approximately %,d characters, "
                        + "but your input is approximately %,d characters. "
                        + "Problem model(s): %s. Please shorten your input or select different models.",
                smallestWindow * TokenEstimator.CHARS_PER_TOKEN,
                inputTokens * TokenEstimator.CHARS_PER_TOKEN,
                String.join(", ", problemModels)));
    }

    private static String accessUpgradeHint(SubscriptionTier tier) {
        return tier == SubscriptionTier.UNREGISTERED
                ? " Sign up for a free account to access more models!"
                : " Upgrade your plan to access more models.";
    }

    private static String limitUpgradeHint(SubscriptionTier tier) {
        return tier == SubscriptionTier.UNREGISTERED
                ? " Sign up for a free account to compare up to " + SubscriptionTier.FREE.getModelLimit() + " models."
                : "";
    }
}
