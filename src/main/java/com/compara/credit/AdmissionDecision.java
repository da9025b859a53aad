package com.compara.credit;

import com.compara.model.PeriodKind;
import com.compara.model.SubscriptionTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of an admission check. For anonymous callers the figures come from
 * whichever bucket (IP or fingerprint) has the fewest credits left.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdmissionDecision {

    private boolean allowed;
    private long remaining;
    private long allocated;
    private SubscriptionTier tier;
    private PeriodKind periodKind;
    private Instant resetAt;

    public long getUsed() {
        return Math.max(0, allocated - remaining);
    }
}
