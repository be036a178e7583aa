package com.flagship.remittance_ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Engine wiring: the clock every timestamp is taken from and the retry policy
 * wrapped around lock-acquiring transactions.
 */
@Configuration
@EnableScheduling
@Slf4j
public class SettlementConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Retries lock timeouts, deadlocks and optimistic-version clashes.
     * Business exceptions are never retried.
     */
    @Bean
    public RetryTemplate settlementRetryTemplate(SettlementProperties properties) {
        SettlementProperties.Retry retry = properties.getRetry();
        log.info("Settlement retry policy: maxAttempts={}, backoff={}..{}ms",
                retry.getMaxAttempts(), retry.getInitialBackoffMs(), retry.getMaxBackoffMs());
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, retry.getMaxAttempts()))
                .exponentialBackoff(retry.getInitialBackoffMs(), 2.0, retry.getMaxBackoffMs())
                .retryOn(ConcurrencyFailureException.class)
                .traversingCauses()
                .build();
    }
}
