package com.phillippitts.modelrelay.service.cache;

import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ChatResponse;
import com.phillippitts.modelrelay.domain.Usage;
import com.phillippitts.modelrelay.testutil.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TwoTierResponseCacheTest {

    private static final Duration TTL = Duration.ofSeconds(60);

    private final MutableClock clock = new MutableClock();

    private static List<ChatMessage> prompt(String text) {
        return List.of(ChatMessage.user(text));
    }

    private TwoTierResponseCache memoryCache(int maxEntries) {
        return new TwoTierResponseCache(null, TTL, maxEntries, 0.7, 0.9, clock);
    }

    private static ResponseCacheRepository repository(Path dir) {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + dir.resolve("cache.db"));
        ResponseCacheRepository repository = new ResponseCacheRepository(new JdbcTemplate(dataSource));
        repository.initSchema();
        return repository;
    }

    @Test
    void shouldReturnStoredResponse() {
        TwoTierResponseCache cache = memoryCache(100);
        ChatResponse response = new ChatResponse("Mutexes serialize access.", "gpt-4", Usage.of(12, 5));

        assertThat(cache.get(prompt("Explain mutexes"), "gpt-4")).isEmpty();
        cache.put(prompt("Explain mutexes"), "gpt-4", response);

        assertThat(cache.get(prompt("Explain mutexes"), "gpt-4")).contains(response);
        assertThat(cache.get(prompt("Explain mutexes"), "claude-3")).isEmpty();
        CacheStats stats = cache.stats();
        assertThat(stats.entries()).isEqualTo(1);
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(2);
        assertThat(stats.hitRate()).isCloseTo(1.0 / 3, within(1e-9));
    }

    @Test
    void shouldExpireEntriesAfterTtl() {
        TwoTierResponseCache cache = memoryCache(100);
        cache.put(prompt("hi"), "m", ChatResponse.of("hello", "m"));

        clock.advance(TTL.minusMillis(1));
        assertThat(cache.get(prompt("hi"), "m")).isPresent();

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.get(prompt("hi"), "m")).isEmpty();
        assertThat(cache.stats().entries()).isZero();
    }

    @Test
    void shouldExpireWithWallClock() throws InterruptedException {
        TwoTierResponseCache cache = new TwoTierResponseCache(null, Duration.ofSeconds(1), 10, 0.7, 0.9,
                Clock.systemUTC());
        cache.put(prompt("hi"), "m", ChatResponse.of("hello", "m"));
        assertThat(cache.get(prompt("hi"), "m")).isPresent();

        Thread.sleep(2_000);

        assertThat(cache.get(prompt("hi"), "m")).isEmpty();
    }

    @Test
    void shouldEvictOldestEntriesWhenFull() {
        TwoTierResponseCache cache = memoryCache(10);
        for (int i = 0; i < 10; i++) {
            cache.put(prompt("q" + i), "m", ChatResponse.of("a" + i, "m"));
            clock.advance(Duration.ofMillis(10));
        }
        assertThat(cache.stats().entries()).isEqualTo(10);

        cache.put(prompt("q10"), "m", ChatResponse.of("a10", "m"));

        assertThat(cache.stats().entries()).isEqualTo(8);
        assertThat(cache.get(prompt("q0"), "m")).isEmpty();
        assertThat(cache.get(prompt("q2"), "m")).isEmpty();
        assertThat(cache.get(prompt("q3"), "m")).isPresent();
        assertThat(cache.get(prompt("q10"), "m")).isPresent();
    }

    @Test
    void shouldBreakTimestampTiesByInsertionOrder() {
        TwoTierResponseCache cache = memoryCache(5);
        for (int i = 0; i < 6; i++) {
            cache.put(prompt("q" + i), "m", ChatResponse.of("a" + i, "m"));
        }

        assertThat(cache.stats().entries()).isEqualTo(4);
        assertThat(cache.get(prompt("q1"), "m")).isEmpty();
        assertThat(cache.get(prompt("q2"), "m")).isPresent();
    }

    @Test
    void shouldInvalidateSingleModel() {
        TwoTierResponseCache cache = memoryCache(100);
        cache.put(prompt("a"), "gpt-4", ChatResponse.of("1", "gpt-4"));
        cache.put(prompt("b"), "gpt-4", ChatResponse.of("2", "gpt-4"));
        cache.put(prompt("a"), "claude-3", ChatResponse.of("3", "claude-3"));

        assertThat(cache.invalidateModel("gpt-4")).isEqualTo(2);

        assertThat(cache.get(prompt("a"), "gpt-4")).isEmpty();
        assertThat(cache.get(prompt("a"), "claude-3")).isPresent();
    }

    @Test
    void clearShouldDropEntriesAndCounters() {
        TwoTierResponseCache cache = memoryCache(100);
        cache.put(prompt("a"), "m", ChatResponse.of("1", "m"));
        cache.get(prompt("a"), "m");

        cache.clear();

        assertThat(cache.stats()).isEqualTo(new CacheStats(0, 100, 0, 0));
    }

    @Test
    void shouldKeySeparatelyPerSamplingParameters() {
        TwoTierResponseCache warm = new TwoTierResponseCache(null, TTL, 10, 0.7, 0.9, clock);
        TwoTierResponseCache cold = new TwoTierResponseCache(null, TTL, 10, 0.2, 0.9, clock);

        assertThat(warm.key(prompt("a"), "m")).isNotEqualTo(cold.key(prompt("a"), "m"));
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new TwoTierResponseCache(null, TTL, 0, 0.7, 0.9, clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TwoTierResponseCache(null, Duration.ZERO, 10, 0.7, 0.9, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldServeDurableEntriesAfterRestart(@TempDir Path dir) {
        ChatResponse response = new ChatResponse("persisted", "gpt-4", Usage.of(3, 4));
        TwoTierResponseCache before = new TwoTierResponseCache(repository(dir), TTL, 100, 0.7, 0.9, clock);
        before.put(prompt("remember me"), "gpt-4", response);

        TwoTierResponseCache after = new TwoTierResponseCache(repository(dir), TTL, 100, 0.7, 0.9, clock);

        assertThat(after.stats().entries()).isZero();
        assertThat(after.get(prompt("remember me"), "gpt-4")).contains(response);
        assertThat(after.stats().entries()).isEqualTo(1);
        assertThat(after.stats().hits()).isEqualTo(1);
    }

    @Test
    void shouldDropExpiredDurableEntriesOnLookup(@TempDir Path dir) {
        ResponseCacheRepository repository = repository(dir);
        TwoTierResponseCache before = new TwoTierResponseCache(repository, TTL, 100, 0.7, 0.9, clock);
        before.put(prompt("old"), "m", ChatResponse.of("stale", "m"));

        clock.advance(TTL.plusSeconds(1));
        TwoTierResponseCache after = new TwoTierResponseCache(repository, TTL, 100, 0.7, 0.9, clock);

        assertThat(after.get(prompt("old"), "m")).isEmpty();
        assertThat(repository.count()).isZero();
    }

    @Test
    void shouldTrimDurableTierToCapacity(@TempDir Path dir) {
        ResponseCacheRepository repository = repository(dir);
        TwoTierResponseCache cache = new TwoTierResponseCache(repository, TTL, 3, 0.7, 0.9, clock);

        for (int i = 0; i < 5; i++) {
            cache.put(prompt("q" + i), "m", ChatResponse.of("a" + i, "m"));
            clock.advance(Duration.ofMillis(5));
        }

        assertThat(repository.count()).isEqualTo(3);
    }

    @Test
    void shouldInvalidateDurableRowsForModel(@TempDir Path dir) {
        ResponseCacheRepository repository = repository(dir);
        TwoTierResponseCache cache = new TwoTierResponseCache(repository, TTL, 10, 0.7, 0.9, clock);
        cache.put(prompt("a"), "gpt-4", ChatResponse.of("1", "gpt-4"));
        cache.put(prompt("a"), "claude-3", ChatResponse.of("2", "claude-3"));

        cache.invalidateModel("gpt-4");

        assertThat(repository.count()).isEqualTo(1);
        TwoTierResponseCache restarted = new TwoTierResponseCache(repository, TTL, 10, 0.7, 0.9, clock);
        assertThat(restarted.get(prompt("a"), "gpt-4")).isEmpty();
        assertThat(restarted.get(prompt("a"), "claude-3")).isPresent();
    }
}
