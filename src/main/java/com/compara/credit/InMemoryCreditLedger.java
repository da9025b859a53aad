package com.compara.credit;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node ledger. {@link ConcurrentHashMap#compute} serializes all operations
 * on the same bucket key, so reset-then-read and reset-then-deduct cannot race.
 */
@Slf4j
public class InMemoryCreditLedger implements CreditLedger {

    private final Map<String, LedgerEntry> entries = new ConcurrentHashMap<>();
    private final CreditPolicy policy;

    public InMemoryCreditLedger(CreditPolicy policy) {
        this.policy = policy;
    }

    @Override
    public LedgerEntry balance(CreditBucket bucket) {
        Instant now = policy.now();
        return entries.compute(bucket.getKey(), (key, existing) -> policy.refresh(existing, bucket, now));
    }

    @Override
    public LedgerEntry deduct(CreditBucket bucket, long credits) {
        if (credits < 0) {
            throw new IllegalArgumentException("credits must be non-negative: " + credits);
        }
        Instant now = policy.now();
        LedgerEntry updated = entries.compute(bucket.getKey(), (key, existing) -> {
            LedgerEntry current = policy.refresh(existing, bucket, now);
            long used = Math.min(current.getAllocated(), current.getUsed() + credits);
            return current.toBuilder().used(used).build();
        });
        log.debug("Deducted {} credits from {}: used={}/{}",
                credits, bucket.getKey(), updated.getUsed(), updated.getAllocated());
        return updated;
    }

    @Override
    public LedgerEntry reset(CreditBucket bucket) {
        Instant now = policy.now();
        LedgerEntry fresh = policy.freshEntry(bucket, now);
        entries.put(bucket.getKey(), fresh);
        log.info("Reset credits for {}", bucket.getKey());
        return fresh;
    }
}
