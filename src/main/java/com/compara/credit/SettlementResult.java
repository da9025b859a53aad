package com.compara.credit;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Credits charged for a comparison and the balance left afterwards.
 * {@code settled} is false when the ledger write failed and the remaining figure is an estimate.
 */
@Data
@AllArgsConstructor
public class SettlementResult {

    private long effectiveTokens;
    private long creditsCharged;
    private long creditsRemaining;
    private boolean settled;
}
