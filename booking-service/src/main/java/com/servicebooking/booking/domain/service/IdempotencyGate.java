package com.servicebooking.booking.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicebooking.booking.domain.model.IdempotencyRecord;
import com.servicebooking.booking.domain.repository.IdempotencyRecordRepository;
import com.servicebooking.booking.exception.IdempotencyInProgressException;
import com.servicebooking.common.exception.BusinessException;
import com.servicebooking.common.exception.ServiceUnavailableException;
import com.servicebooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs an operation at most once per (tenant, idempotency key) within the TTL and replays
 * its stored result afterwards.
 *
 * Race safety comes from the store, not from this process: the first caller claims the key by
 * inserting an IN_PROGRESS row (unique on tenant_id + idempotency_key), so a concurrent caller's
 * insert fails and it waits for the winner's result instead of running the operation.
 * On failure the claim is deleted, so errors are never cached and the key can be retried.
 *
 * Every caller, including the first, receives the result deserialized from the stored JSON,
 * which keeps replays byte-identical to the original response.
 *
 * Redis is an optional read-through cache in front of the table: hits skip the database,
 * misses and Redis errors fall back to it.
 * Call this outside any surrounding transaction; claims commit on their own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyGate {

    private static final String IDEMPOTENCY_UNAVAILABLE_MSG =
            "Idempotency check temporarily unavailable. Retry with same key later.";
    private static final long POLL_INTERVAL_MS = 50;
    private static final int MAX_KEY_LENGTH = 255;
    private static final String CLAIM_CONSTRAINT = "uk_idempotency_tenant_key";

    private final IdempotencyRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final PlatformTransactionManager transactionManager;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${booking.idempotency.ttl-minutes:60}")
    private long ttlMinutes;

    @Value("${booking.idempotency.redis-cache:true}")
    private boolean redisCacheEnabled;

    @Value("${booking.idempotency.wait-timeout-ms:5000}")
    private long waitTimeoutMs;

    public <T> T execute(String tenantId, String idempotencyKey, Class<T> resultType, Supplier<T> operation) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return operation.get();
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new BusinessException(
                    "Idempotency key must not exceed " + MAX_KEY_LENGTH + " characters", "INVALID_IDEMPOTENCY_KEY");
        }

        Optional<T> cached = readCache(tenantId, idempotencyKey, resultType);
        if (cached.isPresent()) {
            return cached.get();
        }

        long deadline = System.currentTimeMillis() + waitTimeoutMs;
        while (true) {
            Optional<IdempotencyRecord> existing = findRecord(tenantId, idempotencyKey);
            if (existing.isPresent()) {
                IdempotencyRecord record = existing.get();
                if (record.isExpired(LocalDateTime.now())) {
                    log.debug("Idempotency key {} of tenant {} expired, reclaiming", idempotencyKey, tenantId);
                    inNewTransaction(() -> repository.deleteIfExpired(record.getId(), LocalDateTime.now()));
                    continue;
                }
                if (record.isCompleted()) {
                    log.info("Idempotency hit for key {} of tenant {}, replaying stored result", idempotencyKey, tenantId);
                    warmCache(tenantId, idempotencyKey, record.getResponseJson(), record.getExpiresAt());
                    return deserialize(record.getResponseJson(), resultType, idempotencyKey);
                }
                awaitOtherCaller(idempotencyKey, deadline);
                continue;
            }

            Optional<IdempotencyRecord> claim = tryClaim(tenantId, idempotencyKey);
            if (claim.isEmpty()) {
                // lost the insert race; the winner's row is visible on the next read
                awaitOtherCaller(idempotencyKey, deadline);
                continue;
            }
            return runClaimed(claim.get(), resultType, operation);
        }
    }

    /**
     * Deterministic key for server-initiated operations: {@code prefix_} followed by the first
     * 32 hex characters of SHA-256 over the parts joined with '|'.
     */
    public static String generateKey(String prefix, String... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(String.join("|", parts).getBytes(StandardCharsets.UTF_8));
            return prefix + "_" + HexFormat.of().formatHex(hash).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Deletes expired records. Returns the number removed.
     */
    public int purgeExpired() {
        Integer deleted = inNewTransaction(() -> repository.deleteAllExpired(LocalDateTime.now()));
        return deleted == null ? 0 : deleted;
    }

    private <T> T runClaimed(IdempotencyRecord claim, Class<T> resultType, Supplier<T> operation) {
        String key = claim.getIdempotencyKey();
        String json;
        try {
            T result = operation.get();
            json = objectMapper.writeValueAsString(result);
        } catch (RuntimeException e) {
            releaseClaim(claim);
            throw e;
        } catch (JsonProcessingException e) {
            releaseClaim(claim);
            throw new IllegalStateException("Failed to serialize result for idempotency key " + key, e);
        }

        Integer updated = inNewTransaction(() -> repository.complete(claim.getId(), json));
        if (updated == null || updated == 0) {
            log.warn("Idempotency claim {} for key {} vanished before completion", claim.getId(), key);
        }
        warmCache(claim.getTenantId(), key, json, claim.getExpiresAt());
        return deserialize(json, resultType, key);
    }

    private Optional<IdempotencyRecord> tryClaim(String tenantId, String idempotencyKey) {
        LocalDateTime now = LocalDateTime.now();
        IdempotencyRecord claim = IdempotencyRecord.claim(tenantId, idempotencyKey, now, now.plusMinutes(ttlMinutes));
        try {
            return Optional.ofNullable(inNewTransaction(() -> repository.saveAndFlush(claim)));
        } catch (DataIntegrityViolationException e) {
            if (!isClaimViolation(e)) {
                throw e;
            }
            log.debug("Concurrent claim for idempotency key {} of tenant {}", idempotencyKey, tenantId);
            return Optional.empty();
        } catch (DataAccessException e) {
            log.warn("Idempotency store unavailable while claiming key {}", idempotencyKey, e);
            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
        }
    }

    private boolean isClaimViolation(DataIntegrityViolationException e) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.toLowerCase().contains(CLAIM_CONSTRAINT);
    }

    private void releaseClaim(IdempotencyRecord claim) {
        try {
            inNewTransaction(() -> repository.releaseClaim(claim.getId()));
            log.debug("Released idempotency claim for key {} after failed operation", claim.getIdempotencyKey());
        } catch (DataAccessException e) {
            // the claim expires with its TTL; until then retries see IN_PROGRESS
            log.error("Failed to release idempotency claim {} for key {}", claim.getId(), claim.getIdempotencyKey(), e);
        }
    }

    private Optional<IdempotencyRecord> findRecord(String tenantId, String idempotencyKey) {
        try {
            return repository.findByTenantIdAndIdempotencyKey(tenantId, idempotencyKey);
        } catch (DataAccessException e) {
            log.warn("Idempotency store (DB) unavailable for key: {}", idempotencyKey, e);
            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
        }
    }

    private void awaitOtherCaller(String idempotencyKey, long deadline) {
        if (System.currentTimeMillis() >= deadline) {
            throw new IdempotencyInProgressException(idempotencyKey);
        }
        try {
            Thread.sleep(POLL_INTERVAL_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdempotencyInProgressException(idempotencyKey);
        }
    }

    private <T> T deserialize(String json, Class<T> resultType, String idempotencyKey) {
        try {
            return objectMapper.readValue(json, resultType);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize stored result for key: {}", idempotencyKey, e);
            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
        }
    }

    private <T> Optional<T> readCache(String tenantId, String idempotencyKey, Class<T> resultType) {
        if (!redisCacheEnabled || stringRedisTemplate == null) return Optional.empty();
        try {
            String json = stringRedisTemplate.opsForValue().get(cacheKey(tenantId, idempotencyKey));
            if (json != null) {
                log.debug("Idempotency hit from Redis for key: {}", idempotencyKey);
                return Optional.of(objectMapper.readValue(json, resultType));
            }
        } catch (Exception e) {
            log.debug("Redis idempotency read missed or failed, falling back to DB: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private void warmCache(String tenantId, String idempotencyKey, String json, LocalDateTime expiresAt) {
        if (!redisCacheEnabled || stringRedisTemplate == null) return;
        Duration ttl = Duration.between(LocalDateTime.now(), expiresAt);
        if (ttl.isNegative() || ttl.isZero()) return;
        try {
            stringRedisTemplate.opsForValue().set(cacheKey(tenantId, idempotencyKey), json, ttl);
        } catch (Exception e) {
            log.warn("Failed to warm Redis idempotency cache for key: {} (non-fatal)", idempotencyKey, e);
        }
    }

    private String cacheKey(String tenantId, String idempotencyKey) {
        return Constants.CACHE_IDEMPOTENCY_PREFIX + tenantId + ":" + idempotencyKey;
    }

    private <R> R inNewTransaction(Supplier<R> work) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template.execute(status -> work.get());
    }
}
