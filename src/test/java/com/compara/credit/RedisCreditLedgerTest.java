package com.compara.credit;

import com.compara.exception.LedgerException;
import com.compara.model.SubscriptionTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for RedisCreditLedger against a mocked template.
 */
class RedisCreditLedgerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final Instant NEXT_MIDNIGHT = Instant.parse("2026-03-11T00:00:00Z");

    private StringRedisTemplate redisTemplate;
    private RedisCreditLedger ledger;
    private CreditBucket bucket;

    @BeforeEach
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        ledger = new RedisCreditLedger(redisTemplate, new CreditPolicy(new MutableClock(NOW)));
        bucket = CreditBucket.forUser("u1", SubscriptionTier.FREE, ZoneOffset.UTC);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testBalanceParsesScriptResult() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any(), any(), any()))
                .thenReturn(List.of(100L, 42L, NEXT_MIDNIGHT.toEpochMilli()));

        LedgerEntry entry = ledger.balance(bucket);

        assertEquals(100, entry.getAllocated());
        assertEquals(42, entry.getUsed());
        assertEquals(58, entry.getRemaining());
        assertEquals(NEXT_MIDNIGHT, entry.getResetAt());
        assertEquals("user:u1", entry.getKey());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testDeductPassesArguments() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any(), any(), any()))
                .thenReturn(List.of(100L, 5L, NEXT_MIDNIGHT.toEpochMilli()));

        ledger.deduct(bucket, 5);

        verify(redisTemplate).execute(any(RedisScript.class),
                eq(List.of("compara:credits:user:u1")),
                eq(String.valueOf(NOW.toEpochMilli())),
                eq("100"),
                eq(String.valueOf(NEXT_MIDNIGHT.toEpochMilli())),
                eq("5"),
                eq("0"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testResetForcesRollover() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any(), any(), any()))
                .thenReturn(List.of(100L, 0L, NEXT_MIDNIGHT.toEpochMilli()));

        LedgerEntry entry = ledger.reset(bucket);

        assertEquals(0, entry.getUsed());
        verify(redisTemplate).execute(any(RedisScript.class), anyList(), any(), any(), any(), eq("0"), eq("1"));
    }

    @Test
    void testNegativeDeductRejected() {
        assertThrows(IllegalArgumentException.class, () -> ledger.deduct(bucket, -3));
        verifyNoInteractions(redisTemplate);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testRedisFailureBecomesLedgerException() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any(), any(), any()))
                .thenThrow(new QueryTimeoutException("timeout"));

        LedgerException error = assertThrows(LedgerException.class, () -> ledger.balance(bucket));
        assertEquals("LEDGER_ERROR", error.getErrorCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testMalformedResultRejected() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any(), any(), any()))
                .thenReturn(List.of(100L));

        assertThrows(LedgerException.class, () -> ledger.balance(bucket));
    }
}
