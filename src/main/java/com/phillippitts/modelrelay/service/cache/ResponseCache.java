package com.phillippitts.modelrelay.service.cache;

import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ChatResponse;

import java.util.List;
import java.util.Optional;

/**
 * Cache of chat completions keyed by model, transcript and sampling parameters.
 *
 * <p>Implementations never throw for storage problems; a broken store behaves like a miss.
 */
public interface ResponseCache {

    /**
     * Looks up a live entry. Expired entries are removed and reported as a miss.
     */
    Optional<ChatResponse> get(List<ChatMessage> messages, String model);

    /**
     * Stores or replaces the entry for the request, evicting the oldest entries when over capacity.
     */
    void put(List<ChatMessage> messages, String model, ChatResponse response);

    /**
     * Removes every entry stored for a model.
     *
     * @return number of in-memory entries removed
     */
    int invalidateModel(String model);

    /** Removes all entries and resets the counters. */
    void clear();

    CacheStats stats();
}
