package com.flagship.remittance_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables under the {@code settlement.*} prefix.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    private final Retry retry = new Retry();
    private final Suggestion suggestion = new Suggestion();
    private final Idempotency idempotency = new Idempotency();

    @Getter
    @Setter
    public static class Retry {
        /** Total attempts for a settlement, including the first one. */
        private int maxAttempts = 3;
        private long initialBackoffMs = 50;
        private long maxBackoffMs = 500;
    }

    @Getter
    @Setter
    public static class Suggestion {
        /** Used when a suggestion request does not specify a limit. 0 means unlimited. */
        private int defaultLimit = 20;
    }

    @Getter
    @Setter
    public static class Idempotency {
        private Duration ttl = Duration.ofDays(7);
    }
}
