package com.phillippitts.modelrelay.service.cache;

import com.phillippitts.modelrelay.domain.ChatMessage;
import com.phillippitts.modelrelay.domain.ChatResponse;
import com.phillippitts.modelrelay.domain.Usage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SQLite-backed durable tier of the response cache.
 *
 * <p>{@code timestamp} and {@code last_access} hold whole seconds since the epoch; sub-second
 * precision is dropped on write. All statements are parameterized.
 * Methods propagate {@link org.springframework.dao.DataAccessException}; the caller decides
 * whether a failure matters.
 */
public class ResponseCacheRepository {

    private static final Logger LOG = LogManager.getLogger(ResponseCacheRepository.class);

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS response_cache (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                input_hash BIGINT NOT NULL UNIQUE,
                model TEXT NOT NULL,
                input_text TEXT NOT NULL,
                response_content TEXT NOT NULL,
                response_model TEXT NOT NULL,
                prompt_tokens INTEGER,
                completion_tokens INTEGER,
                total_tokens INTEGER,
                timestamp INTEGER NOT NULL,
                access_count INTEGER DEFAULT 1,
                last_access INTEGER NOT NULL
            )""";

    private static final List<String> CREATE_INDEXES = List.of(
            "CREATE INDEX IF NOT EXISTS idx_response_cache_hash ON response_cache(input_hash)",
            "CREATE INDEX IF NOT EXISTS idx_response_cache_model ON response_cache(model)",
            "CREATE INDEX IF NOT EXISTS idx_response_cache_timestamp ON response_cache(timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_response_cache_access ON response_cache(access_count)");

    private static final String SELECT_BY_HASH = """
            SELECT id, input_hash, model, response_content, response_model, prompt_tokens,
                   completion_tokens, total_tokens, timestamp, access_count, last_access
            FROM response_cache WHERE input_hash = ?""";

    private static final String UPSERT = """
            INSERT OR REPLACE INTO response_cache
                (input_hash, model, input_text, response_content, response_model, prompt_tokens,
                 completion_tokens, total_tokens, timestamp, access_count, last_access)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 1, ?)""";

    private static final RowMapper<CacheEntry> ENTRY_MAPPER = (rs, rowNum) -> new CacheEntry(
            rs.getLong("input_hash"),
            rs.getString("model"),
            new ChatResponse(
                    rs.getString("response_content"),
                    rs.getString("response_model"),
                    new Usage(rs.getInt("prompt_tokens"), rs.getInt("completion_tokens"), rs.getInt("total_tokens"))),
            Instant.ofEpochSecond(rs.getLong("timestamp")),
            rs.getLong("access_count"),
            Instant.ofEpochSecond(rs.getLong("last_access")),
            rs.getLong("id"));

    private final JdbcTemplate jdbcTemplate;

    public ResponseCacheRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    }

    /** Creates the table and its indexes if they do not exist. */
    public void initSchema() {
        jdbcTemplate.execute(CREATE_TABLE);
        CREATE_INDEXES.forEach(jdbcTemplate::execute);
        LOG.info("Response cache schema ready ({} rows)", count());
    }

    public Optional<CacheEntry> find(long inputHash) {
        List<CacheEntry> rows = jdbcTemplate.query(SELECT_BY_HASH, ENTRY_MAPPER, inputHash);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public void upsert(CacheEntry entry, List<ChatMessage> messages) {
        ChatResponse response = entry.response();
        jdbcTemplate.update(UPSERT,
                entry.inputHash(),
                entry.model(),
                toInputText(messages),
                response.content(),
                response.model(),
                response.usage().promptTokens(),
                response.usage().completionTokens(),
                response.usage().totalTokens(),
                entry.timestamp().getEpochSecond(),
                entry.lastAccess().getEpochSecond());
    }

    /** Records a hit: bumps the access count and last access time. */
    public void touch(long inputHash, Instant now) {
        jdbcTemplate.update(
                "UPDATE response_cache SET access_count = access_count + 1, last_access = ? WHERE input_hash = ?",
                now.getEpochSecond(), inputHash);
    }

    public int delete(long inputHash) {
        return jdbcTemplate.update("DELETE FROM response_cache WHERE input_hash = ?", inputHash);
    }

    /**
     * Deletes rows stored at or before the cutoff.
     */
    public int deleteStoredBefore(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM response_cache WHERE timestamp <= ?", cutoff.getEpochSecond());
    }

    /**
     * Deletes the oldest rows until at most {@code maxRows} remain.
     */
    public int trimTo(int maxRows) {
        int excess = count() - maxRows;
        if (excess <= 0) {
            return 0;
        }
        return jdbcTemplate.update("""
                DELETE FROM response_cache WHERE id IN (
                    SELECT id FROM response_cache ORDER BY timestamp ASC, id ASC LIMIT ?)""", excess);
    }

    public int deleteByModel(String model) {
        return jdbcTemplate.update("DELETE FROM response_cache WHERE model = ?", model);
    }

    public int deleteAll() {
        return jdbcTemplate.update("DELETE FROM response_cache");
    }

    public int count() {
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM response_cache", Integer.class);
        return rows == null ? 0 : rows;
    }

    /**
     * JSON transcript stored alongside each row, e.g. {@code [{"role":"user","content":"hi"}]}.
     */
    static String toInputText(List<ChatMessage> messages) {
        JSONArray array = new JSONArray();
        for (ChatMessage message : messages) {
            array.put(new JSONObject()
                    .put("role", message.role())
                    .put("content", message.content()));
        }
        return array.toString();
    }
}
