package com.phillippitts.modelrelay.config;

import com.phillippitts.modelrelay.config.properties.ResponseCacheProperties;
import com.phillippitts.modelrelay.service.cache.NoOpResponseCache;
import com.phillippitts.modelrelay.service.cache.ResponseCache;
import com.phillippitts.modelrelay.service.cache.ResponseCacheRepository;
import com.phillippitts.modelrelay.service.cache.TwoTierResponseCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the response cache from {@code relay.cache.*}.
 *
 * <p>The SQLite tier is optional: when the database cannot be opened the cache runs memory-only
 * and logs a warning instead of failing startup.
 */
@Configuration
public class ResponseCacheConfig {

    private static final Logger LOG = LogManager.getLogger(ResponseCacheConfig.class);

    static final int SQLITE_BUSY_TIMEOUT_MS = 5_000;

    @Bean
    public ResponseCache responseCache(ResponseCacheProperties props) {
        if (!props.isEnabled()) {
            LOG.info("Response cache disabled");
            return NoOpResponseCache.INSTANCE;
        }
        ResponseCacheRepository repository = props.isPersistent() ? openRepository(props.getDbPath()) : null;
        LOG.info("Response cache enabled: ttl={}s, maxEntries={}, durable={}",
                props.getTtlSeconds(), props.getMaxEntries(), repository != null);
        return new TwoTierResponseCache(
                repository,
                Duration.ofSeconds(props.getTtlSeconds()),
                props.getMaxEntries(),
                props.getTemperature(),
                props.getTopP(),
                Clock.systemUTC());
    }

    /**
     * Opens (creating if needed) the SQLite cache database.
     *
     * @return repository with its schema in place, or null when the database is unusable
     */
    static ResponseCacheRepository openRepository(String dbPath) {
        try {
            Path parent = Path.of(dbPath).toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            LOG.warn("Cannot create cache directory for {}: {}; continuing memory-only", dbPath, e.toString());
            return null;
        }

        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setBusyTimeout(SQLITE_BUSY_TIMEOUT_MS);
        sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        SQLiteDataSource dataSource = new SQLiteDataSource(sqliteConfig);
        dataSource.setUrl("jdbc:sqlite:" + dbPath);

        ResponseCacheRepository repository = new ResponseCacheRepository(new JdbcTemplate(dataSource));
        try {
            repository.initSchema();
        } catch (DataAccessException e) {
            LOG.warn("Cannot open cache database {}: {}; continuing memory-only", dbPath, e.getMessage());
            return null;
        }
        return repository;
    }
}
