package com.compara.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Current credit balance of the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditBalance {

    @JsonProperty("credits_allocated")
    private long creditsAllocated;

    @JsonProperty("credits_remaining")
    private long creditsRemaining;

    @JsonProperty("credits_used")
    private long creditsUsed;

    @JsonProperty("period")
    private String period; // daily, monthly

    @JsonProperty("reset_at")
    private Instant resetAt;

    @JsonProperty("tier")
    private String tier;
}
