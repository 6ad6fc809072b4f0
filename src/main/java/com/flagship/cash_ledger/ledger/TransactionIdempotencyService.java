package com.flagship.cash_ledger.ledger;

import com.flagship.cash_ledger.config.CashLedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves Idempotency-Key headers of manual cash transactions.
 *
 * Redis is the fast path; the unique {@code cash_transactions.idempotency_key}
 * column is the source of truth, so a Redis outage only costs a database lookup.
 */
@Service
@Slf4j
public class TransactionIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "cash-ledger:idempotency:";

    private final CashTransactionService transactionService;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final CashLedgerProperties properties;

    public TransactionIdempotencyService(CashTransactionService transactionService,
                                         Optional<StringRedisTemplate> redisTemplate,
                                         CashLedgerProperties properties) {
        this.transactionService = transactionService;
        this.redisTemplate = redisTemplate;
        this.properties = properties;
    }

    /**
     * Finds the transaction previously recorded under {@code idempotencyKey}.
     */
    public Optional<UUID> findTransactionId(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = transactionService.findByIdempotencyKey(idempotencyKey)
                .map(CashTransaction::getId);
        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return stored;
    }

    /**
     * Caches a key that was just written to the database. Failures are logged only:
     * the database row already guarantees idempotency.
     */
    public void remember(String idempotencyKey, UUID transactionId) {
        requireKey(idempotencyKey);
        if (transactionId == null) {
            throw new IllegalArgumentException("Transaction id cannot be null");
        }
        cache(idempotencyKey, transactionId);
    }

    private void cache(String idempotencyKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(
                    REDIS_KEY_PREFIX + idempotencyKey, transactionId.toString(), properties.getIdempotencyTtl());
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (idempotencyKey.length() > 255) {
            throw new IllegalArgumentException("Idempotency key must be at most 255 characters");
        }
    }
}
