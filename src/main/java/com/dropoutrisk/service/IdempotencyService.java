package com.dropoutrisk.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis-backed duplicate detection for inbound Kafka events.
 *
 * KEYS:
 * =====
 * {@code idempotency:{eventType}:{eventId}}, e.g. {@code idempotency:TrainingDatasetSubmitted:ds-2024-06},
 * written with SET NX and a 7 day TTL (Kafka's default retention).
 *
 * FAILOVER:
 * =========
 * If Redis is unreachable the event is treated as new. Re-assessing a student is harmless
 * (assessments are append-only) and a repeated training run is rejected or promoted on merit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    private static final Duration IDEMPOTENCY_TTL = Duration.ofDays(7);
    private static final String IDEMPOTENCY_PREFIX = "idempotency:";

    private final RedisTemplate<String, Object> redisTemplate;

    /**
     * Atomically claims an event for processing.
     *
     * @return true if this is the first time the event is seen (process it), false for a duplicate
     */
    public boolean tryAcquire(String eventType, String eventId, String consumerName) {
        String key = buildKey(eventType, eventId);
        try {
            String value = String.format("%s:%d", consumerName, System.currentTimeMillis());
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, value, IDEMPOTENCY_TTL);

            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Claimed event {}:{} for {}", eventType, eventId, consumerName);
                return true;
            }
            log.warn("Event already processed: {}:{}", eventType, eventId);
            return false;
        } catch (Exception e) {
            log.error("Redis error during idempotency check, treating as new: {}:{}", eventType, eventId, e);
            return true;
        }
    }

    /**
     * Releases a claim so a redelivery of the event is processed again. Used when processing
     * failed with an error worth retrying.
     */
    public void release(String eventType, String eventId) {
        try {
            redisTemplate.delete(buildKey(eventType, eventId));
        } catch (Exception e) {
            log.error("Redis error releasing idempotency key: {}:{}", eventType, eventId, e);
        }
    }

    private String buildKey(String eventType, String eventId) {
        return IDEMPOTENCY_PREFIX + eventType + ":" + eventId;
    }
}
