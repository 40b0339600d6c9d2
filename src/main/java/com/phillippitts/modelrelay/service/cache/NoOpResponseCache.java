package com.phillippitts.modelrelay.service.cache;

import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ChatResponse;

import java.util.List;
import java.util.Optional;

/**
 * Cache used when caching is disabled: every lookup misses and nothing is stored.
 */
public final class NoOpResponseCache implements ResponseCache {

    public static final NoOpResponseCache INSTANCE = new NoOpResponseCache();

    private NoOpResponseCache() {
    }

    @Override
    public Optional<ChatResponse> get(List<ChatMessage> messages, String model) {
        return Optional.empty();
    }

    @Override
    public void put(List<ChatMessage> messages, String model, ChatResponse response) {
        // disabled
    }

    @Override
    public int invalidateModel(String model) {
        return 0;
    }

    @Override
    public void clear() {
        // disabled
    }

    @Override
    public CacheStats stats() {
        return CacheStats.EMPTY;
    }
}
