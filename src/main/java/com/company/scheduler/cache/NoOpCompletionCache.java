package com.company.scheduler.cache;

import java.util.Optional;

public class NoOpCompletionCache implements CompletionCache {

    @Override
    public Optional<CachedCompletion> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, CachedCompletion completion) {
        // caching disabled
    }
}
