package com.compara.credit;

import com.compara.exception.InsufficientCreditsException;
import com.compara.model.Identity;
import com.compara.model.PeriodKind;
import com.compara.model.SubscriptionTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AdmissionGate.
 */
class AdmissionGateTest {

    private MutableClock clock;
    private InMemoryCreditLedger ledger;
    private AdmissionGate gate;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"));
        ledger = new InMemoryCreditLedger(new CreditPolicy(clock));
        gate = new AdmissionGate(ledger);
    }

    @Test
    void testFreshUserIsAdmitted() {
        Identity user = Identity.user("u1", SubscriptionTier.FREE, "10.0.0.1", ZoneOffset.UTC);

        AdmissionDecision decision = gate.admit(user, 3);

        assertTrue(decision.isAllowed());
        assertEquals(100, decision.getRemaining());
        assertEquals(100, decision.getAllocated());
        assertEquals(0, decision.getUsed());
        assertEquals(PeriodKind.DAILY, decision.getPeriodKind());
    }

    @Test
    void testExhaustedDailyUserIsRejected() {
        Identity user = Identity.user("u1", SubscriptionTier.FREE, "10.0.0.1", ZoneOffset.UTC);
        ledger.deduct(CreditBucket.forUser("u1", SubscriptionTier.FREE, ZoneOffset.UTC), 100);

        InsufficientCreditsException error = assertThrows(InsufficientCreditsException.class,
                () -> gate.admit(user, 2));

        assertEquals("INSUFFICIENT_CREDITS", error.getErrorCode());
        assertEquals(100, error.getCreditsAllocated());
        assertTrue(error.getMessage().contains("reset to 100 tomorrow"), error.getMessage());
    }

    @Test
    void testExhaustedMonthlyUserMessageNamesResetDate() {
        Identity user = Identity.user("u2", SubscriptionTier.STARTER, "10.0.0.1", ZoneOffset.UTC);
        ledger.deduct(CreditBucket.forUser("u2", SubscriptionTier.STARTER, ZoneOffset.UTC), 1200);

        InsufficientCreditsException error = assertThrows(InsufficientCreditsException.class,
                () -> gate.admit(user, 1));

        assertEquals("You've run out of credits which will reset on 2026-04-09.", error.getMessage());
    }

    @Test
    void testCheckDoesNotThrowWhenExhausted() {
        Identity user = Identity.user("u1", SubscriptionTier.FREE, "10.0.0.1", ZoneOffset.UTC);
        ledger.deduct(CreditBucket.forUser("u1", SubscriptionTier.FREE, ZoneOffset.UTC), 100);

        AdmissionDecision decision = gate.check(user, 1);

        assertFalse(decision.isAllowed());
        assertEquals(0, decision.getRemaining());
    }

    @Test
    void testAnonymousUsesMinimumOfIpAndFingerprint() {
        Identity anonymous = Identity.anonymous("203.0.113.7", "fp-abc", ZoneOffset.UTC);
        ledger.deduct(CreditBucket.forIp("203.0.113.7", ZoneOffset.UTC), 10);
        ledger.deduct(CreditBucket.forFingerprint("fp-abc", ZoneOffset.UTC), 35);

        AdmissionDecision decision = gate.check(anonymous, 2);

        assertEquals(15, decision.getRemaining());
        assertEquals(50, decision.getAllocated());
        assertEquals(SubscriptionTier.UNREGISTERED, decision.getTier());
    }

    @Test
    void testAnonymousBlockedByFingerprintEvenWithFreshIp() {
        Identity anonymous = Identity.anonymous("198.51.100.20", "fp-shared", ZoneOffset.UTC);
        ledger.deduct(CreditBucket.forFingerprint("fp-shared", ZoneOffset.UTC), 50);

        assertThrows(InsufficientCreditsException.class, () -> gate.admit(anonymous, 1));
    }

    @Test
    void testAnonymousWithoutFingerprintUsesIpOnly() {
        Identity anonymous = Identity.anonymous("203.0.113.9", null, ZoneOffset.UTC);
        ledger.deduct(CreditBucket.forIp("203.0.113.9", ZoneOffset.UTC), 20);

        assertEquals(30, gate.check(anonymous, 1).getRemaining());
    }

    @Test
    void testRepeatedChecksAreIdempotent() {
        Identity user = Identity.user("u3", SubscriptionTier.PRO, "10.0.0.1", ZoneOffset.UTC);

        AdmissionDecision first = gate.check(user, 9);
        AdmissionDecision second = gate.check(user, 9);

        assertEquals(first, second);
        assertEquals(5000, second.getRemaining());
    }

    @Test
    void testAdmittedAgainAfterDailyReset() {
        Identity user = Identity.user("u1", SubscriptionTier.FREE, "10.0.0.1", ZoneOffset.UTC);
        ledger.deduct(CreditBucket.forUser("u1", SubscriptionTier.FREE, ZoneOffset.UTC), 100);
        assertThrows(InsufficientCreditsException.class, () -> gate.admit(user, 1));

        clock.advance(Duration.ofHours(13));

        assertEquals(100, gate.admit(user, 1).getRemaining());
    }
}
