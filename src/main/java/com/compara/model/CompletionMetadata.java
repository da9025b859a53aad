package com.compara.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate figures carried by the terminal {@code complete} event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompletionMetadata {

    @JsonProperty("input_length")
    private int inputLength;

    @JsonProperty("models_requested")
    private int modelsRequested;

    @JsonProperty("models_successful")
    private int modelsSuccessful;

    @JsonProperty("models_failed")
    private int modelsFailed;

    /**
     * ISO-8601 timestamp of completion.
     */
    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("processing_time_ms")
    private long processingTimeMs;

    @JsonProperty("credits_used")
    private double creditsUsed;

    @JsonProperty("credits_remaining")
    private long creditsRemaining;

    /**
     * Set only when the stream ended after an unexpected failure.
     */
    @JsonProperty("error")
    private String error;
}
