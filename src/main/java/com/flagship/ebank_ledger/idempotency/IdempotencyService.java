package com.flagship.ebank_ledger.idempotency;

import com.flagship.ebank_ledger.ledger.LedgerTransaction;
import com.flagship.ebank_ledger.ledger.TransactionRepository;
import com.flagship.ebank_ledger.ledger.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * Maps client Idempotency-Key values to the transaction they produced.
 *
 * Strategy:
 * 1. Try Redis first (fast, but may be absent or down)
 * 2. Fall back to transactions.idempotency_key (source of truth)
 * 3. Cache database hits back into Redis
 *
 * A key is only "used" once its transaction has committed; a concurrent
 * duplicate that slips past the check fails on the unique constraint.
 */
@Service
@Slf4j
public class IdempotencyService {

    static final String REDIS_KEY_PREFIX = "idempotency:ledger:";
    static final int MAX_KEY_LENGTH = 100;
    private static final Duration REDIS_TTL = Duration.ofDays(7);
    private static final String SEPARATOR = "|";

    private final TransactionRepository transactionRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(TransactionRepository transactionRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.transactionRepository = transactionRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return what was recorded under this key, if the key was used before
     */
    public Optional<IdempotencyRecord> findRecord(String idempotencyKey) {
        validateKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    Optional<IdempotencyRecord> record = decode(cached);
                    if (record.isPresent()) {
                        log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                        return record;
                    }
                    log.warn("Ignoring unreadable Redis entry for idempotency key {}", idempotencyKey);
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            }
        }

        Optional<IdempotencyRecord> record = transactionRepository.findByIdempotencyKey(idempotencyKey)
            .map(entity -> new IdempotencyRecord(entity.getId(), entity.getType(), entity.getAmount()));
        record.ifPresent(found -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, found);
        });
        return record;
    }

    /**
     * Caches a committed key/transaction pair. Best effort: the database row
     * already carries the key.
     */
    public void remember(String idempotencyKey, LedgerTransaction transaction) {
        cache(idempotencyKey,
            new IdempotencyRecord(transaction.getId(), transaction.getType(), transaction.getAmount()));
    }

    private void cache(String idempotencyKey, IdempotencyRecord record) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                .set(REDIS_KEY_PREFIX + idempotencyKey, encode(record), REDIS_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    // type|amount|transactionId, e.g. "deposit|100.00|42"
    static String encode(IdempotencyRecord record) {
        return record.getType().getWireValue() + SEPARATOR
            + record.getAmount().toPlainString() + SEPARATOR
            + record.getTransactionId();
    }

    static Optional<IdempotencyRecord> decode(String value) {
        String[] parts = value.split("\\|");
        if (parts.length != 3) {
            return Optional.empty();
        }
        try {
            return Optional.of(new IdempotencyRecord(
                Long.valueOf(parts[2]),
                TransactionType.fromWireValue(parts[0]),
                new BigDecimal(parts[1])));
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            return Optional.empty();
        }
    }

    private static void validateKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException(
                "Idempotency key must be at most " + MAX_KEY_LENGTH + " characters");
        }
    }
}
