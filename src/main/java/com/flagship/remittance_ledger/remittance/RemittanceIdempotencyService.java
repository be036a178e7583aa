package com.flagship.remittance_ledger.remittance;

import com.flagship.remittance_ledger.config.SettlementProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for remittance creation.
 *
 * Redis is the fast path, the unique {@code (tenant_id, idempotency_key)} column
 * is the source of truth. Redis failures are logged and fall through to the database.
 */
@Service
@Slf4j
public class RemittanceIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";

    private final OutgoingRemittanceRepository outgoingRepository;
    private final IncomingRemittanceRepository incomingRepository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public RemittanceIdempotencyService(OutgoingRemittanceRepository outgoingRepository,
                                        IncomingRemittanceRepository incomingRepository,
                                        Optional<StringRedisTemplate> redisTemplate,
                                        SettlementProperties properties) {
        this.outgoingRepository = outgoingRepository;
        this.incomingRepository = incomingRepository;
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getIdempotency().getTtl();
    }

    /**
     * @return id of the remittance previously created with this key, if any
     */
    public Optional<UUID> lookup(RemittanceDirection direction, UUID tenantId, String idempotencyKey) {
        String redisKey = redisKey(direction, tenantId, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", redisKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for {}, falling back to database: {}", redisKey, e.getMessage());
            }
        }

        Optional<UUID> stored = direction == RemittanceDirection.OUTGOING
            ? outgoingRepository.findByTenantIdAndIdempotencyKey(tenantId, idempotencyKey).map(OutgoingRemittanceEntity::getId)
            : incomingRepository.findByTenantIdAndIdempotencyKey(tenantId, idempotencyKey).map(IncomingRemittanceEntity::getId);

        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", redisKey);
            cache(redisKey, id);
        });
        return stored;
    }

    /**
     * Caches the mapping once the surrounding transaction commits, so a rolled-back
     * creation never leaves a dangling key behind.
     */
    public void rememberAfterCommit(RemittanceDirection direction, UUID tenantId, String idempotencyKey, UUID remittanceId) {
        String redisKey = redisKey(direction, tenantId, idempotencyKey);
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            cache(redisKey, remittanceId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache(redisKey, remittanceId);
            }
        });
    }

    private void cache(String redisKey, UUID remittanceId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, remittanceId.toString(), ttl);
        } catch (RuntimeException e) {
            log.debug("Failed to cache idempotency key {} in Redis: {}", redisKey, e.getMessage());
        }
    }

    private static String redisKey(RemittanceDirection direction, UUID tenantId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + direction.name().toLowerCase(Locale.ROOT) + ":" + tenantId + ":" + idempotencyKey;
    }
}
