package com.compara.credit;

import com.compara.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

import java.time.Instant;
import java.util.List;

/**
 * Ledger shared by all nodes. Each operation is one Lua script over a Redis hash
 * ({@code allocated}, {@code used}, {@code reset_at}), which Redis runs atomically.
 */
@Slf4j
public class RedisCreditLedger implements CreditLedger {

    private static final String KEY_PREFIX = "compara:credits:";

    private final StringRedisTemplate redisTemplate;
    private final CreditPolicy policy;
    private final DefaultRedisScript<List> script;

    public RedisCreditLedger(StringRedisTemplate redisTemplate, CreditPolicy policy) {
        this.redisTemplate = redisTemplate;
        this.policy = policy;
        this.script = new DefaultRedisScript<>();
        this.script.setScriptSource(new ResourceScriptSource(new ClassPathResource("redis/credit-ledger.lua")));
        this.script.setResultType(List.class);
    }

    @Override
    public LedgerEntry balance(CreditBucket bucket) {
        return execute(bucket, 0, false);
    }

    @Override
    public LedgerEntry deduct(CreditBucket bucket, long credits) {
        if (credits < 0) {
            throw new IllegalArgumentException("credits must be non-negative: " + credits);
        }
        LedgerEntry updated = execute(bucket, credits, false);
        log.debug("Deducted {} credits from {}: used={}/{}",
                credits, bucket.getKey(), updated.getUsed(), updated.getAllocated());
        return updated;
    }

    @Override
    public LedgerEntry reset(CreditBucket bucket) {
        LedgerEntry fresh = execute(bucket, 0, true);
        log.info("Reset credits for {}", bucket.getKey());
        return fresh;
    }

    private LedgerEntry execute(CreditBucket bucket, long credits, boolean forceReset) {
        Instant now = policy.now();
        Instant nextReset = policy.nextReset(bucket.getPeriodKind(), bucket.getZone(), now);
        try {
            List<?> result = redisTemplate.execute(script,
                    List.of(KEY_PREFIX + bucket.getKey()),
                    String.valueOf(now.toEpochMilli()),
                    String.valueOf(bucket.getAllocation()),
                    String.valueOf(nextReset.toEpochMilli()),
                    String.valueOf(credits),
                    forceReset ? "1" : "0");

            if (result == null || result.size() < 3) {
                throw new LedgerException("Unexpected ledger script result for " + bucket.getKey(), null);
            }

            return LedgerEntry.builder()
                    .key(bucket.getKey())
                    .periodKind(bucket.getPeriodKind())
                    .allocated(toLong(result.get(0)))
                    .used(toLong(result.get(1)))
                    .resetAt(Instant.ofEpochMilli(toLong(result.get(2))))
                    .build();
        } catch (DataAccessException e) {
            log.error("Redis ledger operation failed for {}", bucket.getKey(), e);
            throw new LedgerException("Credit ledger unavailable", e);
        }
    }

    private static long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
