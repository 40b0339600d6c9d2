package com.phillippitts.modelrelay.service.cache;

import com.phillippitts.modelrelay.domain.ChatResponse;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached chat response.
 *
 * @param inputHash   request key, see {@link InputHasher}
 * @param model       requested model (the response may name a different one)
 * @param response    cached response
 * @param timestamp   when the entry was stored; TTL is measured from here
 * @param accessCount stores plus hits
 * @param lastAccess  most recent store or hit
 * @param sequence    insertion order, breaks timestamp ties during eviction
 */
public record CacheEntry(long inputHash,
                         String model,
                         ChatResponse response,
                         Instant timestamp,
                         long accessCount,
                         Instant lastAccess,
                         long sequence) {

    public boolean isExpired(Instant now, Duration ttl) {
        return !Duration.between(timestamp, now).minus(ttl).isNegative();
    }

    CacheEntry touched(Instant now) {
        return new CacheEntry(inputHash, model, response, timestamp, accessCount + 1, now, sequence);
    }
}
