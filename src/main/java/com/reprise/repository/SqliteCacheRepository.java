package com.reprise.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.cache.Cache;
import com.reprise.exception.CacheDeserializationException;
import com.reprise.exception.CacheException;
import com.reprise.model.CacheEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Relational encoding: a SQLite file with one row per entry in table cache_entries,
 * primary key = cache key.
 *
 * Every operation opens the file, migrates it to the current schema and works inside
 * a single transaction. Writes upsert, so pointing at an existing database keeps rows
 * for keys the cache does not hold.
 */
@Slf4j
public class SqliteCacheRepository {

    private static final String UPSERT = """
            INSERT OR REPLACE INTO cache_entries
                (key, model, parameters, system_prompt, user_prompt, iteration, output, timestamp, service, validated)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_ALL = """
            SELECT key, model, parameters, system_prompt, user_prompt, iteration, output, timestamp, service, validated
            FROM cache_entries
            """;

    private final ObjectMapper objectMapper;
    private final SqliteSchemaMigrator migrator;

    public SqliteCacheRepository() {
        this(new ObjectMapper());
    }

    public SqliteCacheRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.migrator = new SqliteSchemaMigrator(objectMapper, this);
    }

    /**
     * Load every row into a new cache.
     */
    public Cache read(Path path) {
        return new Cache(readEntries(path), true);
    }

    public Map<String, CacheEntry> readEntries(Path path) {
        Map<String, CacheEntry> entries = withSchema(path, jdbc -> {
            Map<String, CacheEntry> loaded = new LinkedHashMap<>();
            jdbc.query(SELECT_ALL, rs -> {
                CacheEntry entry = mapRow(rs, path);
                loaded.put(entry.getKey(), entry);
            });
            return loaded;
        });
        log.info("Loaded {} cache entries from {}", entries.size(), path);
        return entries;
    }

    /**
     * Upsert every entry of the cache.
     */
    public void write(Cache cache, Path path) {
        upsert(cache.entries(), path);
    }

    /**
     * Upsert the given entries, leaving other rows in place.
     */
    public void upsert(Collection<CacheEntry> entries, Path path) {
        int written = withSchema(path, jdbc -> upsert(jdbc, entries));
        log.info("Wrote {} cache entries to {}", written, path);
    }

    /**
     * Upgrade the file to the current schema.
     *
     * @return number of legacy rows migrated
     */
    public int migrate(Path path) {
        return inTransaction(path, jdbc -> migrator.migrate(jdbc, path.toString()));
    }

    public int count(Path path) {
        return withSchema(path, jdbc -> {
            Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM cache_entries", Integer.class);
            return count != null ? count : 0;
        });
    }

    int upsert(JdbcTemplate jdbc, Collection<CacheEntry> entries) {
        List<Object[]> rows = new ArrayList<>(entries.size());
        for (CacheEntry entry : entries) {
            rows.add(new Object[]{
                    entry.getKey(),
                    entry.getModel(),
                    writeParameters(entry),
                    entry.getSystemPrompt(),
                    entry.getUserPrompt(),
                    entry.getIteration(),
                    entry.getOutput(),
                    entry.getTimestamp(),
                    entry.getService(),
                    entry.isValidated() ? 1 : 0
            });
        }
        jdbc.batchUpdate(UPSERT, rows);
        return rows.size();
    }

    private <T> T withSchema(Path path, Function<JdbcTemplate, T> work) {
        return inTransaction(path, jdbc -> {
            migrator.migrate(jdbc, path.toString());
            return work.apply(jdbc);
        });
    }

    private <T> T inTransaction(Path path, Function<JdbcTemplate, T> work) {
        createParentDirectories(path);
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + path, true);
        try {
            JdbcTemplate jdbc = new JdbcTemplate(dataSource);
            TransactionTemplate transaction = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
            return transaction.execute(status -> work.apply(jdbc));
        } catch (DataAccessException e) {
            throw new CacheException("Cache database error on " + path + ": " + e.getMostSpecificCause().getMessage(), e);
        } finally {
            dataSource.destroy();
        }
    }

    private CacheEntry mapRow(ResultSet rs, Path path) throws SQLException {
        String key = rs.getString("key");
        try {
            return CacheEntry.builder()
                    .model(requireColumn(rs.getString("model"), "model"))
                    .parameters(objectMapper.readTree(requireColumn(rs.getString("parameters"), "parameters")))
                    .systemPrompt(requireColumn(rs.getString("system_prompt"), "system_prompt"))
                    .userPrompt(requireColumn(rs.getString("user_prompt"), "user_prompt"))
                    .iteration(rs.getInt("iteration"))
                    .output(checkedOutput(rs.getString("output")))
                    .timestamp(rs.getLong("timestamp"))
                    .service(rs.getString("service"))
                    .validated(rs.getInt("validated") != 0)
                    .build();
        } catch (JsonProcessingException e) {
            throw new CacheDeserializationException(path.toString(), key, "parameters column is not valid JSON", e);
        } catch (CacheDeserializationException e) {
            throw e.at(path.toString(), key);
        }
    }

    private String writeParameters(CacheEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry.getParameters());
        } catch (JsonProcessingException e) {
            throw new CacheException("Cannot serialize parameters of entry " + entry.getKey(), e);
        }
    }

    private static String requireColumn(String value, String column) {
        if (value == null) {
            throw new CacheDeserializationException("missing column '" + column + "'");
        }
        return value;
    }

    private static String checkedOutput(String output) {
        CacheEntry.parseOutput(requireColumn(output, "output"));
        return output;
    }

    private static void createParentDirectories(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new CacheException("Cannot create directory " + parent, e);
        }
    }
}
