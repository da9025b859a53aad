package com.compara.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Token usage reported by a provider for one model call.
 */
@Data
@AllArgsConstructor
public class UsageResult {

    private long inputTokens;
    private long outputTokens;

    /**
     * input + floor(output x outputWeight); output is priced higher than input.
     */
    private long effectiveTokens;

    public static UsageResult of(long inputTokens, long outputTokens, double outputWeight) {
        long effective = inputTokens + (long) Math.floor(outputTokens * outputWeight);
        return new UsageResult(inputTokens, outputTokens, effective);
    }
}
