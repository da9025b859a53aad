package com.compara.credit;

/**
 * Per-bucket credit accounting. Every operation first resets the bucket if its
 * period has elapsed; the reset and the read or write happen as one atomic step.
 */
public interface CreditLedger {

    /**
     * Current balance. Repeated calls without an intervening deduction return the same values.
     */
    LedgerEntry balance(CreditBucket bucket);

    /**
     * Add {@code credits} to the used amount, capped at the allocation.
     */
    LedgerEntry deduct(CreditBucket bucket, long credits);

    /**
     * Start a fresh period immediately, regardless of the stored reset time.
     */
    LedgerEntry reset(CreditBucket bucket);
}
