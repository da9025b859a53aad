package com.compara.provider;

import com.compara.config.ComparaProperties;
import com.compara.model.ChatMessage;
import com.compara.model.HistoryMessage;
import com.compara.model.UsageResult;
import com.compara.service.TokenEstimator;

import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for model providers with common functionality.
 */
public abstract class AbstractModelProvider implements ModelProvider {

    static final String SYSTEM_PROMPT = "Provide complete responses. Finish your thoughts and explanations fully.\n\n"
            + "Answer questions directly without asking clarifying questions. If you need to make reasonable "
            + "assumptions about context or details not specified, make those assumptions based on common "
            + "practices and state them clearly in your response.";

    protected final ComparaProperties properties;
    protected final ComparaProperties.ProviderConfig config;

    protected AbstractModelProvider(ComparaProperties properties, String providerName) {
        this.properties = properties;
        this.config = properties.getProviders().get(providerName);
    }

    @Override
    public boolean isEnabled() {
        return config != null && config.isEnabled();
    }

    /**
     * System prompt (first turn only), replayed history, then the new prompt.
     */
    protected List<ChatMessage> buildMessages(ProviderCall call) {
        List<ChatMessage> messages = new ArrayList<>();
        if (call.getHistory().isEmpty()) {
            String system = SYSTEM_PROMPT;
            if (call.getTimezone() != null) {
                system += "\n\nUser timezone: " + call.getTimezone()
                        + ". When providing time-sensitive information or referring to times, use this timezone as context.";
            }
            messages.add(ChatMessage.of("system", system));
        }
        for (HistoryMessage turn : call.getHistory()) {
            messages.add(ChatMessage.of(turn.getRole(), turn.getContent()));
        }
        messages.add(ChatMessage.of(HistoryMessage.ROLE_USER, call.getPrompt()));
        return messages;
    }

    protected UsageResult usage(long inputTokens, long outputTokens) {
        return UsageResult.of(inputTokens, outputTokens, properties.getCredits().getOutputTokenWeight());
    }

    /**
     * Fallback when the provider reports no usage.
     */
    protected UsageResult estimatedUsage(ProviderCall call, String output) {
        long input = TokenEstimator.estimateInputTokens(call.getPrompt(), call.getHistory());
        return usage(input, TokenEstimator.estimateTokens(output));
    }

    protected ComparaProperties.ProviderConfig getConfig() {
        return config;
    }
}
