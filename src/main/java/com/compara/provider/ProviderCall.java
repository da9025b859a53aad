package com.compara.provider;

import com.compara.model.HistoryMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything a provider needs to stream one model's answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderCall {

    private String modelId;
    private String prompt;

    /**
     * History already filtered to the user's turns and this model's own replies.
     */
    @Builder.Default
    private List<HistoryMessage> history = List.of();

    private Integer maxTokens;
    private Double temperature;
    private boolean webSearch;

    /**
     * Caller's IANA time zone, passed to the model as context when known.
     */
    private String timezone;
}
