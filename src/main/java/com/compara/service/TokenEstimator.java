package com.compara.service;

import com.compara.model.HistoryMessage;

import java.util.List;

/**
 * Character-based token estimate: roughly four characters per token, plus a
 * fixed overhead for each replayed conversation turn.
 */
public final class TokenEstimator {

    static final int CHARS_PER_TOKEN = 4;
    static final int PER_MESSAGE_OVERHEAD = 4;

    private TokenEstimator() {
    }

    public static long estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return text.length() / CHARS_PER_TOKEN;
    }

    public static long estimateHistoryTokens(List<HistoryMessage> history) {
        if (history == null) {
            return 0;
        }
        long total = 0;
        for (HistoryMessage message : history) {
            total += estimateTokens(message.getContent()) + PER_MESSAGE_OVERHEAD;
        }
        return total;
    }

    public static long estimateInputTokens(String prompt, List<HistoryMessage> history) {
        return estimateTokens(prompt) + estimateHistoryTokens(history);
    }
}
