package com.compara.config;

import com.compara.credit.CreditLedger;
import com.compara.credit.CreditPolicy;
import com.compara.credit.InMemoryCreditLedger;
import com.compara.credit.RedisCreditLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Selects the credit ledger backend from {@code compara.credits.storage-type}.
 */
@Slf4j
@Configuration
public class CreditLedgerConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "compara.credits", name = "storage-type", havingValue = "memory", matchIfMissing = true)
    public CreditLedger inMemoryCreditLedger(CreditPolicy policy) {
        log.info("Using in-memory credit ledger");
        return new InMemoryCreditLedger(policy);
    }

    @Bean
    @ConditionalOnProperty(prefix = "compara.credits", name = "storage-type", havingValue = "redis")
    public CreditLedger redisCreditLedger(StringRedisTemplate ledgerRedisTemplate, CreditPolicy policy) {
        log.info("Using Redis credit ledger");
        return new RedisCreditLedger(ledgerRedisTemplate, policy);
    }
}
