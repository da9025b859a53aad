package com.compara.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public view of a catalogue entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelInfo {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("provider")
    private String provider;

    @JsonProperty("max_input_tokens")
    private long maxInputTokens;

    @JsonProperty("max_output_tokens")
    private int maxOutputTokens;

    @JsonProperty("min_tier")
    private String minTier;

    @JsonProperty("supports_web_search")
    private boolean supportsWebSearch;

    @JsonProperty("available")
    private boolean available;
}
