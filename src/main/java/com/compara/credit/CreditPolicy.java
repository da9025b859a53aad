package com.compara.credit;

import com.compara.model.PeriodKind;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Period arithmetic shared by the ledger backends.
 */
@Component
public class CreditPolicy {

    static final Duration BILLING_PERIOD = Duration.ofDays(30);

    private final Clock clock;

    public CreditPolicy(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Daily periods end at the next local midnight in the bucket's zone,
     * monthly periods 30 days after they start.
     */
    public Instant nextReset(PeriodKind periodKind, ZoneId zone, Instant from) {
        if (periodKind == PeriodKind.DAILY) {
            ZoneId effectiveZone = zone != null ? zone : ZoneId.of("UTC");
            LocalDate today = from.atZone(effectiveZone).toLocalDate();
            return today.plusDays(1).atStartOfDay(effectiveZone).toInstant();
        }
        return from.plus(BILLING_PERIOD);
    }

    public boolean isExpired(LedgerEntry entry, Instant now) {
        return entry.getResetAt() == null || !now.isBefore(entry.getResetAt());
    }

    public LedgerEntry freshEntry(CreditBucket bucket, Instant now) {
        return LedgerEntry.builder()
                .key(bucket.getKey())
                .periodKind(bucket.getPeriodKind())
                .allocated(bucket.getAllocation())
                .used(0)
                .resetAt(nextReset(bucket.getPeriodKind(), bucket.getZone(), now))
                .build();
    }

    /**
     * Roll the entry over if its period has elapsed and align its allocation
     * with the bucket's current tier.
     */
    public LedgerEntry refresh(LedgerEntry existing, CreditBucket bucket, Instant now) {
        if (existing == null || isExpired(existing, now)) {
            return freshEntry(bucket, now);
        }
        if (existing.getAllocated() != bucket.getAllocation()) {
            return existing.toBuilder()
                    .allocated(bucket.getAllocation())
                    .used(Math.min(existing.getUsed(), bucket.getAllocation()))
                    .build();
        }
        return existing;
    }
}
