package com.company.scheduler.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared cache for multi-instance deployments. Every entry is written with the
 * configured TTL; Redis failures degrade to a miss.
 */
@Slf4j
public class RedisCompletionCache implements CompletionCache {

    private final RedisTemplate<String, CachedCompletion> redisTemplate;
    private final Duration ttl;

    public RedisCompletionCache(RedisTemplate<String, CachedCompletion> redisTemplate, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
        log.info("Completion cache: redis (ttl={})", ttl);
    }

    @Override
    public Optional<CachedCompletion> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (Exception e) {
            log.warn("Failed to read completion {} from Redis: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, CachedCompletion completion) {
        try {
            redisTemplate.opsForValue().set(key, completion, ttl);
        } catch (Exception e) {
            log.warn("Failed to cache completion {} in Redis: {}", key, e.getMessage());
        }
    }
}
