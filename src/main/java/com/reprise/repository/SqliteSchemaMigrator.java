package com.reprise.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.exception.CacheDeserializationException;
import com.reprise.exception.CacheMigrationException;
import com.reprise.model.CacheEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Brings a cache database to the current schema version.
 *
 * Versions (stored in PRAGMA user_version):
 * 0 - empty file, or the legacy key/value table data(key, value) holding entry JSON
 * 1 - one row per entry in cache_entries, one column per entry field
 *
 * Must run inside a transaction. Running it on a current store changes nothing.
 */
@Slf4j
public class SqliteSchemaMigrator {

    public static final int CURRENT_VERSION = 1;

    static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS cache_entries (
                key           TEXT PRIMARY KEY,
                model         TEXT NOT NULL,
                parameters    TEXT NOT NULL,
                system_prompt TEXT NOT NULL,
                user_prompt   TEXT NOT NULL,
                iteration     INTEGER NOT NULL,
                output        TEXT NOT NULL,
                timestamp     INTEGER NOT NULL,
                service       TEXT,
                validated     INTEGER NOT NULL DEFAULT 0
            )
            """;

    private static final String LEGACY_TABLE = "data";

    private final ObjectMapper objectMapper;
    private final SqliteCacheRepository repository;

    SqliteSchemaMigrator(ObjectMapper objectMapper, SqliteCacheRepository repository) {
        this.objectMapper = objectMapper;
        this.repository = repository;
    }

    /**
     * @return number of legacy rows copied into the current table
     * @throws CacheMigrationException if the store has a schema version newer than this code knows
     */
    public int migrate(JdbcTemplate jdbc, String source) {
        Integer version = jdbc.queryForObject("PRAGMA user_version", Integer.class);
        int current = version != null ? version : 0;

        if (current > CURRENT_VERSION) {
            throw new CacheMigrationException("Unknown cache schema version " + current + " in " + source
                    + " (this build supports up to " + CURRENT_VERSION + ")");
        }
        if (current == CURRENT_VERSION) {
            return 0;
        }

        jdbc.execute(CREATE_TABLE);

        int migrated = 0;
        if (tableExists(jdbc, LEGACY_TABLE)) {
            List<CacheEntry> legacy = jdbc.query("SELECT key, value FROM " + LEGACY_TABLE, (rs, rowNum) -> {
                String key = rs.getString("key");
                try {
                    return CacheEntry.fromJson(objectMapper.readTree(rs.getString("value")));
                } catch (JsonProcessingException e) {
                    throw new CacheDeserializationException(source, key, "legacy row is not valid JSON", e);
                } catch (CacheDeserializationException e) {
                    throw e.at(source, key);
                }
            });
            repository.upsert(jdbc, legacy);
            jdbc.execute("DROP TABLE " + LEGACY_TABLE);
            migrated = legacy.size();
        }

        jdbc.execute("PRAGMA user_version = " + CURRENT_VERSION);
        log.info("Migrated cache store {} from schema version {} to {} ({} legacy rows)",
                source, current, CURRENT_VERSION, migrated);
        return migrated;
    }

    private static boolean tableExists(JdbcTemplate jdbc, String table) {
        Integer count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?", Integer.class, table);
        return count != null && count > 0;
    }
}
