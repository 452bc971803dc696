package com.reprise.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.cache.Cache;
import com.reprise.cache.CacheSink;
import com.reprise.model.CacheEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;

/**
 * Reads and writes caches in whichever encoding the file extension selects.
 */
@Slf4j
@Repository
public class CacheFileRepository {

    private final JsonlCacheCodec jsonl;
    private final SqliteCacheRepository sqlite;

    public CacheFileRepository(ObjectMapper objectMapper) {
        this.jsonl = new JsonlCacheCodec(objectMapper);
        this.sqlite = new SqliteCacheRepository(objectMapper);
    }

    /**
     * Open a cache bound to {@code path}. An existing file is loaded; a missing one
     * starts empty and is created on the first write.
     */
    public Cache open(Path path, boolean immediateWrite) {
        CacheFileFormat format = CacheFileFormat.of(path);
        Cache cache;
        if (Files.exists(path)) {
            cache = new Cache(readEntries(path, format), immediateWrite);
        } else {
            log.info("Cache file {} not found, will write to this location", path);
            cache = new Cache(immediateWrite);
        }
        cache.bind(sinkFor(path));
        return cache;
    }

    public Cache read(Path path) {
        return new Cache(readEntries(path, CacheFileFormat.of(path)), true);
    }

    /**
     * Write every entry. JSONL files are rewritten; databases are upserted.
     */
    public void write(Cache cache, Path path) {
        switch (CacheFileFormat.of(path)) {
            case JSONL -> jsonl.write(cache, path);
            case SQLITE -> sqlite.write(cache, path);
        }
    }

    /**
     * Add entries without touching the ones already stored.
     */
    public void append(Collection<CacheEntry> entries, Path path) {
        if (entries.isEmpty()) {
            return;
        }
        switch (CacheFileFormat.of(path)) {
            case JSONL -> jsonl.append(entries, path);
            case SQLITE -> sqlite.upsert(entries, path);
        }
    }

    /**
     * Upgrade a database file to the current schema; JSONL files need no migration.
     */
    public int migrate(Path path) {
        if (CacheFileFormat.of(path) == CacheFileFormat.SQLITE) {
            return sqlite.migrate(path);
        }
        return 0;
    }

    /**
     * Append-log text of the whole cache, for shipping a cache alongside a result set.
     */
    public String exportJsonl(Cache cache) {
        return jsonl.encode(cache.entries());
    }

    public CacheSink sinkFor(Path path) {
        return new CacheSink() {
            @Override
            public void write(Cache cache) {
                CacheFileRepository.this.write(cache, path);
            }

            @Override
            public void append(Collection<CacheEntry> entries) {
                CacheFileRepository.this.append(entries, path);
            }

            @Override
            public String describe() {
                return path.toString();
            }
        };
    }

    private Map<String, CacheEntry> readEntries(Path path, CacheFileFormat format) {
        return switch (format) {
            case JSONL -> jsonl.readEntries(path);
            case SQLITE -> sqlite.readEntries(path);
        };
    }
}
