package com.compara.model;

/**
 * Cadence at which a credit allocation is replenished.
 */
public enum PeriodKind {
    /**
     * Reset at local midnight in the caller's time zone.
     */
    DAILY,

    /**
     * Reset at the end of a 30-day billing period.
     */
    MONTHLY
}
