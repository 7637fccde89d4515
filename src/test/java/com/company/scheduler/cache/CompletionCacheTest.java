package com.company.scheduler.cache;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompletionCacheTest {

    private static CachedCompletion completion(String text) {
        return CachedCompletion.builder().model("kimi").text(text).createdAt(Instant.now()).build();
    }

    @Test
    void keyShouldDependOnEveryPartOfTheRequest() {
        String key = CompletionCache.keyOf("kimi", "system", "user");

        assertThat(key).startsWith(CompletionCache.KEY_PREFIX).hasSize(CompletionCache.KEY_PREFIX.length() + 32);
        assertThat(CompletionCache.keyOf("kimi", "system", "user")).isEqualTo(key);
        assertThat(CompletionCache.keyOf("glm", "system", "user")).isNotEqualTo(key);
        assertThat(CompletionCache.keyOf("kimi", "system", "user2")).isNotEqualTo(key);
        assertThat(CompletionCache.keyOf("kimi", "systemu", "ser")).isNotEqualTo(key);
    }

    @Test
    void caffeineCacheShouldReturnStoredCompletion() {
        CaffeineCompletionCache cache = new CaffeineCompletionCache(Duration.ofMinutes(5), 10);

        cache.put("k1", completion("hello"));

        assertThat(cache.get("k1")).map(CachedCompletion::getText).contains("hello");
        assertThat(cache.get("k2")).isEmpty();
        assertThat(cache.estimatedSize()).isEqualTo(1);
    }

    @Test
    void noOpCacheShouldAlwaysMiss() {
        NoOpCompletionCache cache = new NoOpCompletionCache();

        cache.put("k1", completion("hello"));

        assertThat(cache.get("k1")).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void redisCacheShouldWriteWithTtl() {
        RedisTemplate<String, CachedCompletion> template = mock(RedisTemplate.class);
        ValueOperations<String, CachedCompletion> ops = mock(ValueOperations.class);
        when(template.opsForValue()).thenReturn(ops);
        RedisCompletionCache cache = new RedisCompletionCache(template, Duration.ofMinutes(5));
        CachedCompletion value = completion("hello");

        cache.put("k1", value);

        verify(ops).set("k1", value, Duration.ofMinutes(5));
    }

    @Test
    @SuppressWarnings("unchecked")
    void redisFailuresShouldDegradeToMiss() {
        RedisTemplate<String, CachedCompletion> template = mock(RedisTemplate.class);
        ValueOperations<String, CachedCompletion> ops = mock(ValueOperations.class);
        when(template.opsForValue()).thenReturn(ops);
        when(ops.get(anyString())).thenThrow(new RedisConnectionFailureException("refused"));
        doThrow(new RedisConnectionFailureException("refused")).when(ops).set(anyString(), any(), eq(Duration.ofMinutes(5)));
        RedisCompletionCache cache = new RedisCompletionCache(template, Duration.ofMinutes(5));

        assertThat(cache.get("k1")).isEmpty();
        assertThatCode(() -> cache.put("k1", completion("hello"))).doesNotThrowAnyException();
    }
}
