package com.company.scheduler.config;

import com.company.scheduler.cache.CachedCompletion;
import com.company.scheduler.cache.CaffeineCompletionCache;
import com.company.scheduler.cache.CompletionCache;
import com.company.scheduler.cache.NoOpCompletionCache;
import com.company.scheduler.cache.RedisCompletionCache;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Picks the completion cache from scheduler.text-generation.cache.type.
 */
@Configuration
@RequiredArgsConstructor
public class CompletionCacheConfig {

    private static final String CACHE_TYPE = "scheduler.text-generation.cache.type";

    private final SchedulerProperties properties;

    @Bean
    @ConditionalOnProperty(name = CACHE_TYPE, havingValue = "caffeine", matchIfMissing = true)
    public CompletionCache caffeineCompletionCache() {
        SchedulerProperties.TextGeneration.Cache cache = properties.getTextGeneration().getCache();
        return new CaffeineCompletionCache(cache.getTtl(), cache.getMaximumSize());
    }

    @Bean
    @ConditionalOnProperty(name = CACHE_TYPE, havingValue = "redis")
    public CompletionCache redisCompletionCache(RedisTemplate<String, CachedCompletion> completionRedisTemplate) {
        return new RedisCompletionCache(completionRedisTemplate, properties.getTextGeneration().getCache().getTtl());
    }

    @Bean
    @ConditionalOnProperty(name = CACHE_TYPE, havingValue = "none")
    public CompletionCache noOpCompletionCache() {
        return new NoOpCompletionCache();
    }
}
