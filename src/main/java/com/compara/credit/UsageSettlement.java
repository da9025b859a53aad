package com.compara.credit;

import com.compara.config.ComparaProperties;
import com.compara.model.Identity;
import com.compara.model.UsageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service converting the token usage of a finished comparison into credits and
 * charging them to the caller's ledger buckets.
 */
@Slf4j
@Service
public class UsageSettlement {

    private final CreditLedger ledger;
    private final ComparaProperties properties;

    public UsageSettlement(CreditLedger ledger, ComparaProperties properties) {
        this.ledger = ledger;
        this.properties = properties;
    }

    /**
     * Sum of effective tokens over the successful models.
     */
    public long effectiveTokens(List<UsageResult> usages) {
        return usages.stream().mapToLong(UsageResult::getEffectiveTokens).sum();
    }

    /**
     * At least one credit once any model succeeded, nothing otherwise.
     */
    public long creditsFor(long effectiveTokens, int successfulModels) {
        if (successfulModels <= 0) {
            return 0;
        }
        long tokensPerCredit = properties.getCredits().getTokensPerCredit();
        long credits = (effectiveTokens + tokensPerCredit - 1) / tokensPerCredit;
        return Math.max(1, credits);
    }

    /**
     * Charge the caller. Ledger failures are logged and never thrown; in that case the
     * remaining balance is re-read from the ledger or, failing that, estimated.
     *
     * @param usages           reported usage of the successful models; may be shorter than
     *                         {@code successfulModels} when a provider reported none
     * @param successfulModels number of models that finished without error
     * @param remainingBefore  balance observed at admission
     */
    public SettlementResult settle(Identity identity, List<UsageResult> usages, int successfulModels,
                                   long remainingBefore) {
        long effective = effectiveTokens(usages);
        long credits = creditsFor(effective, successfulModels);
        List<CreditBucket> buckets = CreditBucket.forIdentity(identity);

        try {
            long remaining = Long.MAX_VALUE;
            for (CreditBucket bucket : buckets) {
                LedgerEntry entry = credits > 0 ? ledger.deduct(bucket, credits) : ledger.balance(bucket);
                remaining = Math.min(remaining, entry.getRemaining());
            }
            if (credits > 0) {
                log.info("Settled {} credits ({} effective tokens, {} models) for {}",
                        credits, effective, successfulModels, buckets.get(0).getKey());
            }
            return new SettlementResult(effective, credits, remaining, true);
        } catch (RuntimeException e) {
            log.error("Failed to settle {} credits for {}", credits, buckets.get(0).getKey(), e);
            return new SettlementResult(effective, credits, recomputeRemaining(buckets, remainingBefore, credits), false);
        }
    }

    private long recomputeRemaining(List<CreditBucket> buckets, long remainingBefore, long credits) {
        try {
            return buckets.stream()
                    .mapToLong(bucket -> ledger.balance(bucket).getRemaining())
                    .min()
                    .orElse(0);
        } catch (RuntimeException e) {
            log.warn("Could not re-read balance after settlement failure: {}", e.getMessage());
            return Math.max(0, remainingBefore - credits);
        }
    }
}
