package com.compara.credit;

import com.compara.model.PeriodKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Snapshot of one bucket for the current period. {@code used} never exceeds {@code allocated}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntry {

    private String key;
    private PeriodKind periodKind;
    private long allocated;
    private long used;
    private Instant resetAt;

    public long getRemaining() {
        return Math.max(0, allocated - used);
    }
}
