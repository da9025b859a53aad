package com.compara.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inbound comparison request: one prompt fanned out to several models.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComparisonRequest {

    @JsonProperty("input_data")
    private String inputData;

    @JsonProperty("models")
    private List<String> models;

    @JsonProperty("conversation_history")
    private List<HistoryMessage> conversationHistory;

    @JsonProperty("browser_fingerprint")
    private String browserFingerprint;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("enable_web_search")
    private Boolean enableWebSearch;

    /**
     * IANA time zone of the caller, used for daily credit resets.
     */
    @JsonProperty("timezone")
    private String timezone;

    @JsonProperty("conversation_id")
    private Long conversationId;

    public boolean hasHistory() {
        return conversationHistory != null && !conversationHistory.isEmpty();
    }

    public boolean isWebSearchEnabled() {
        return Boolean.TRUE.equals(enableWebSearch);
    }
}
