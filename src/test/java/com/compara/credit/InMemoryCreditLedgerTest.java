package com.compara.credit;

import com.compara.model.SubscriptionTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryCreditLedger.
 */
class InMemoryCreditLedgerTest {

    private MutableClock clock;
    private InMemoryCreditLedger ledger;
    private CreditBucket freeUser;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"));
        ledger = new InMemoryCreditLedger(new CreditPolicy(clock));
        freeUser = CreditBucket.forUser("user-1", SubscriptionTier.FREE, ZoneOffset.UTC);
    }

    @Test
    void testNewBucketStartsWithFullAllocation() {
        LedgerEntry entry = ledger.balance(freeUser);

        assertEquals(100, entry.getAllocated());
        assertEquals(0, entry.getUsed());
        assertEquals(100, entry.getRemaining());
        assertEquals(Instant.parse("2026-03-11T00:00:00Z"), entry.getResetAt());
    }

    @Test
    void testBalanceIsIdempotent() {
        ledger.deduct(freeUser, 7);

        LedgerEntry first = ledger.balance(freeUser);
        LedgerEntry second = ledger.balance(freeUser);

        assertEquals(first, second, "Reading twice without a deduction must not change anything");
        assertEquals(93, second.getRemaining());
    }

    @Test
    void testDeductIsCappedAtAllocation() {
        ledger.deduct(freeUser, 95);
        LedgerEntry entry = ledger.deduct(freeUser, 20);

        assertEquals(100, entry.getUsed());
        assertEquals(0, entry.getRemaining());
    }

    @Test
    void testNegativeDeductRejected() {
        assertThrows(IllegalArgumentException.class, () -> ledger.deduct(freeUser, -1));
    }

    @Test
    void testLazyResetAfterPeriodEnds() {
        ledger.deduct(freeUser, 100);
        assertEquals(0, ledger.balance(freeUser).getRemaining());

        clock.advance(Duration.ofHours(12));

        LedgerEntry entry = ledger.balance(freeUser);
        assertEquals(100, entry.getRemaining());
        assertEquals(Instant.parse("2026-03-12T00:00:00Z"), entry.getResetAt());
    }

    @Test
    void testDeductAfterExpiryStartsFromFreshPeriod() {
        ledger.deduct(freeUser, 60);
        clock.advance(Duration.ofDays(1));

        LedgerEntry entry = ledger.deduct(freeUser, 5);

        assertEquals(5, entry.getUsed());
    }

    @Test
    void testForcedReset() {
        ledger.deduct(freeUser, 80);

        LedgerEntry entry = ledger.reset(freeUser);

        assertEquals(0, entry.getUsed());
        assertEquals(100, ledger.balance(freeUser).getRemaining());
    }

    @Test
    void testBucketsAreIndependent() {
        CreditBucket other = CreditBucket.forUser("user-2", SubscriptionTier.FREE, ZoneOffset.UTC);
        ledger.deduct(freeUser, 30);

        assertEquals(100, ledger.balance(other).getRemaining());
    }

    @Test
    void testConcurrentDeductionsDoNotLoseUpdates() throws Exception {
        CreditBucket pro = CreditBucket.forUser("user-pro", SubscriptionTier.PRO, ZoneOffset.UTC);
        int threads = 8;
        int perThread = 250;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        ledger.deduct(pro, 1);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(2000, ledger.balance(pro).getUsed());
    }

    @Test
    void testConcurrentDeductionsNeverExceedAllocation() throws Exception {
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    ledger.deduct(freeUser, 15);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        LedgerEntry entry = ledger.balance(freeUser);
        assertEquals(100, entry.getUsed());
        assertEquals(0, entry.getRemaining());
    }
}
