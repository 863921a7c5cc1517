package com.deepansh.foundry.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed replay protection for chat turns.
 *
 * A browser that retries POST /api/mcp/chat after a timeout would otherwise
 * start a second run, and tools like create_issue or create_pull_request
 * are not safe to execute twice. The client sends an Idempotency-Key header;
 * the serialized ChatResponse is cached under it for 24 hours.
 *
 * Key pattern: mcp:chat:idempotency:{key}
 *
 * Requests without the header always run.
 */
@Service
@Slf4j
public class IdempotencyService {

    static final String KEY_PREFIX = "mcp:chat:idempotency:";
    static final Duration TTL = Duration.ofHours(24);
    static final String IN_FLIGHT = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the cached response body when this key already completed,
     *         empty when the key is new or a previous attempt is still running
     */
    public Optional<String> findCompleted(String idempotencyKey) {
        String cached = redisTemplate.opsForValue().get(KEY_PREFIX + idempotencyKey);
        if (cached == null) {
            return Optional.empty();
        }
        if (IN_FLIGHT.equals(cached)) {
            log.warn("Idempotency key {} is still in flight", idempotencyKey);
            return Optional.empty();
        }
        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(cached);
    }

    /** SET NX of the in-flight marker. False when another request already holds the key. */
    public boolean claim(String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + idempotencyKey, IN_FLIGHT, TTL);
        return Boolean.TRUE.equals(claimed);
    }

    public void complete(String idempotencyKey, String responseJson) {
        redisTemplate.opsForValue().set(KEY_PREFIX + idempotencyKey, responseJson, TTL);
        log.debug("Cached chat response for key={}", idempotencyKey);
    }

    /** Drops the marker of a failed turn so the client can retry. */
    public void release(String idempotencyKey) {
        redisTemplate.delete(KEY_PREFIX + idempotencyKey);
    }
}
