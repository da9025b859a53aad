package com.compara.service;

import com.compara.credit.AdmissionDecision;
import com.compara.model.ComparisonRequest;
import com.compara.model.Identity;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A validated and admitted comparison, ready to stream.
 */
@Data
@AllArgsConstructor
public class PreparedComparison {

    private ComparisonRequest request;
    private Identity identity;
    private AdmissionDecision admission;
    private long estimatedInputTokens;
}
