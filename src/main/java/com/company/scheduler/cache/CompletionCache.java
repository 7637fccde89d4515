package com.company.scheduler.cache;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Time-bounded store of text-generation replies keyed by the exact request.
 * Implementations must never fail the caller; a miss only costs latency.
 */
public interface CompletionCache {

    String KEY_PREFIX = "sched:completion:";

    Optional<CachedCompletion> get(String key);

    void put(String key, CachedCompletion completion);

    static String keyOf(String model, String systemPrompt, String userPrompt) {
        String material = model + '\u0000' + systemPrompt + '\u0000' + userPrompt;
        return KEY_PREFIX + DigestUtils.md5DigestAsHex(material.getBytes(StandardCharsets.UTF_8));
    }
}
