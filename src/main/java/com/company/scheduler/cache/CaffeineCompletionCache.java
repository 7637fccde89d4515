package com.company.scheduler.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process cache, entries expire a fixed time after being written.
 */
@Slf4j
public class CaffeineCompletionCache implements CompletionCache {

    private final Cache<String, CachedCompletion> cache;

    public CaffeineCompletionCache(Duration ttl, long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        log.info("Completion cache: caffeine (ttl={}, maximumSize={})", ttl, maximumSize);
    }

    @Override
    public Optional<CachedCompletion> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, CachedCompletion completion) {
        cache.put(key, completion);
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
