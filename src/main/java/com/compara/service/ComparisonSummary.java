package com.compara.service;

import com.compara.credit.SettlementResult;
import com.compara.model.ComparisonRequest;
import com.compara.model.Identity;
import com.compara.stream.MultiplexOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything known about a finished comparison, handed to persistence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonSummary {

    private Identity identity;
    private ComparisonRequest request;
    private MultiplexOutcome outcome;
    private SettlementResult settlement;
    private long estimatedInputTokens;
    private long processingTimeMs;
}
