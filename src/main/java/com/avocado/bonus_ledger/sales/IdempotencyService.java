package com.avocado.bonus_ledger.sales;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps Idempotency-Key headers of the sales API to the transaction they created.
 *
 * Redis is a fast path only. The key is stored on the transaction row, so the database
 * answers whenever Redis is missing, down or has expired the entry.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final SaleTransactionRepository saleRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(SaleTransactionRepository saleRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.saleRepository = saleRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the transaction id recorded under the key, empty for a new key
     */
    public Optional<Long> checkIdempotencyKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(Long.valueOf(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<Long> transactionId = saleRepository.findByIdempotencyKey(idempotencyKey)
                .map(SaleTransactionEntity::getTransactionId);
        if (transactionId.isPresent()) {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, transactionId.get());
        }
        return transactionId;
    }

    /**
     * Caches the key in Redis. The database copy is written with the sale itself, so
     * inside a transaction the cache entry is written only once that transaction commits.
     */
    public void storeIdempotencyKey(String idempotencyKey, Long transactionId) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (transactionId == null) {
            throw new IllegalArgumentException("Transaction ID cannot be null");
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            cache(idempotencyKey, transactionId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache(idempotencyKey, transactionId);
            }
        });
    }

    /**
     * Drops a cached entry that points to a transaction the database does not have.
     */
    public void evictIdempotencyKey(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().delete(REDIS_KEY_PREFIX + idempotencyKey);
        } catch (Exception e) {
            log.warn("Failed to evict idempotency key from Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private void cache(String idempotencyKey, Long transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                    .set(REDIS_KEY_PREFIX + idempotencyKey, transactionId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }
}
