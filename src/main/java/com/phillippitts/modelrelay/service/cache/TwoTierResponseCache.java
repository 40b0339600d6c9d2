package com.phillippitts.modelrelay.service.cache;

import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ChatResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Response cache with a bounded in-memory tier and an optional SQLite tier.
 *
 * <p>Lookup order: memory, then the durable tier. A live durable row is promoted into memory, so a
 * restarted process serves earlier responses without a provider call. Expired entries are removed
 * lazily on lookup and, in the durable tier, on every store.
 *
 * <p>When memory holds more than {@code maxEntries} entries, the oldest (by store time, then
 * insertion order) are evicted until 80% of capacity remains. The durable tier is trimmed to
 * {@code maxEntries} rows.
 *
 * <p>Durable tier errors are logged and otherwise ignored: they never fail a lookup or a store.
 */
public class TwoTierResponseCache implements ResponseCache {

    private static final Logger LOG = LogManager.getLogger(TwoTierResponseCache.class);

    private static final Comparator<CacheEntry> OLDEST_FIRST = Comparator
            .comparing(CacheEntry::timestamp)
            .thenComparingLong(CacheEntry::sequence);

    private final Map<Long, CacheEntry> memory = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private final ResponseCacheRepository repository;
    private final Duration ttl;
    private final int maxEntries;
    private final double temperature;
    private final double topP;
    private final Clock clock;

    /**
     * @param repository durable tier, {@code null} for a memory-only cache
     */
    public TwoTierResponseCache(ResponseCacheRepository repository,
                                Duration ttl,
                                int maxEntries,
                                double temperature,
                                double topP,
                                Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        this.repository = repository;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.temperature = temperature;
        this.topP = topP;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<ChatResponse> get(List<ChatMessage> messages, String model) {
        long hash = key(messages, model);
        Instant now = clock.instant();

        CacheEntry hit = null;
        lock.lock();
        try {
            CacheEntry entry = memory.get(hash);
            if (entry != null) {
                if (entry.isExpired(now, ttl)) {
                    memory.remove(hash);
                } else {
                    hit = entry.touched(now);
                    memory.put(hash, hit);
                }
            }
        } finally {
            lock.unlock();
        }

        if (hit != null) {
            hits.incrementAndGet();
            touchDurable(hash, now);
            return Optional.of(hit.response());
        }

        Optional<CacheEntry> promoted = loadDurable(hash, now);
        if (promoted.isPresent()) {
            hits.incrementAndGet();
            return Optional.of(promoted.get().response());
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    @Override
    public void put(List<ChatMessage> messages, String model, ChatResponse response) {
        Objects.requireNonNull(response, "response");
        long hash = key(messages, model);
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(hash, model, response, now, 1, now, sequence.incrementAndGet());

        lock.lock();
        try {
            memory.put(hash, entry);
            evictOverflow();
        } finally {
            lock.unlock();
        }

        if (repository != null) {
            try {
                repository.upsert(entry, messages);
                int expired = repository.deleteStoredBefore(now.minus(ttl));
                int trimmed = repository.trimTo(maxEntries);
                if (expired + trimmed > 0) {
                    LOG.debug("Durable cache purge: expired={}, trimmed={}", expired, trimmed);
                }
            } catch (DataAccessException e) {
                LOG.warn("Durable cache store failed for model {}: {}", model, e.getMessage());
            }
        }
    }

    @Override
    public int invalidateModel(String model) {
        int removed = 0;
        lock.lock();
        try {
            Iterator<CacheEntry> it = memory.values().iterator();
            while (it.hasNext()) {
                if (it.next().model().equals(model)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (repository != null) {
            try {
                repository.deleteByModel(model);
            } catch (DataAccessException e) {
                LOG.warn("Durable cache invalidation failed for model {}: {}", model, e.getMessage());
            }
        }
        LOG.info("Invalidated {} cached response(s) for model {}", removed, model);
        return removed;
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            memory.clear();
            hits.set(0);
            misses.set(0);
        } finally {
            lock.unlock();
        }
        if (repository != null) {
            try {
                repository.deleteAll();
            } catch (DataAccessException e) {
                LOG.warn("Durable cache clear failed: {}", e.getMessage());
            }
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(memory.size(), maxEntries, hits.get(), misses.get());
        } finally {
            lock.unlock();
        }
    }

    long key(List<ChatMessage> messages, String model) {
        return InputHasher.hash(messages, model, temperature, topP);
    }

    private Optional<CacheEntry> loadDurable(long hash, Instant now) {
        if (repository == null) {
            return Optional.empty();
        }
        try {
            Optional<CacheEntry> row = repository.find(hash);
            if (row.isEmpty()) {
                return Optional.empty();
            }
            if (row.get().isExpired(now, ttl)) {
                repository.delete(hash);
                return Optional.empty();
            }
            repository.touch(hash, now);
            CacheEntry stored = row.get();
            CacheEntry promoted = new CacheEntry(hash, stored.model(), stored.response(), stored.timestamp(),
                    stored.accessCount() + 1, now, sequence.incrementAndGet());
            lock.lock();
            try {
                memory.put(hash, promoted);
                evictOverflow();
            } finally {
                lock.unlock();
            }
            LOG.debug("Promoted durable cache entry for model {}", stored.model());
            return Optional.of(promoted);
        } catch (DataAccessException e) {
            LOG.warn("Durable cache lookup failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void touchDurable(long hash, Instant now) {
        if (repository == null) {
            return;
        }
        try {
            repository.touch(hash, now);
        } catch (DataAccessException e) {
            LOG.warn("Durable cache access update failed: {}", e.getMessage());
        }
    }

    // caller holds lock
    private void evictOverflow() {
        if (memory.size() <= maxEntries) {
            return;
        }
        int target = maxEntries - maxEntries / 5;
        List<CacheEntry> byAge = new ArrayList<>(memory.values());
        byAge.sort(OLDEST_FIRST);
        int toRemove = memory.size() - target;
        for (int i = 0; i < toRemove; i++) {
            memory.remove(byAge.get(i).inputHash());
        }
        LOG.debug("Evicted {} cache entries (capacity {})", toRemove, maxEntries);
    }
}
