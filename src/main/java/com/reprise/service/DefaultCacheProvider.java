package com.reprise.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.cache.Cache;
import com.reprise.cache.CacheSink;
import com.reprise.config.RepriseProperties;
import com.reprise.exception.CacheDeserializationException;
import com.reprise.exception.CacheException;
import com.reprise.exception.CacheInitializationException;
import com.reprise.exception.CacheMigrationException;
import com.reprise.model.CacheEntry;
import com.reprise.repository.CacheFileFormat;
import com.reprise.repository.CacheFileRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Locates (or creates) the persistent cache that callers use when they do not supply one.
 *
 * Flow on first {@link #getCache()}:
 * 1. Resolve the configured path, falling back to the fallback path (with a warning) if unwritable
 * 2. Upgrade a legacy database layout
 * 3. Import a legacy plain-dict JSON export, then rename it so the import runs once
 * 4. Open the store and keep the cache for later calls
 */
@Slf4j
@Service
public class DefaultCacheProvider {

    static final String SQLITE_URL_PREFIX = "sqlite:///";
    static final String MIGRATED_SUFFIX = ".migrated";

    private final RepriseProperties properties;
    private final CacheFileRepository fileRepository;
    private final ObjectMapper objectMapper;

    private final Map<String, CacheEntry> flushed = new HashMap<>();
    private Cache cache;
    private Path location;
    private boolean usingFallback;

    public DefaultCacheProvider(RepriseProperties properties,
                                CacheFileRepository fileRepository,
                                ObjectMapper objectMapper) {
        this.properties = properties;
        this.fileRepository = fileRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * The process-default persistent cache.
     *
     * @throws CacheInitializationException if neither the configured path nor a fallback is usable
     * @throws CacheMigrationException if a legacy store cannot be upgraded
     */
    public synchronized Cache getCache() {
        if (cache != null) {
            return cache;
        }

        Path resolved = resolveLocation();
        fileRepository.migrate(resolved);
        migrateLegacyJson(resolved);

        Cache opened;
        try {
            opened = fileRepository.open(resolved, properties.getCache().isImmediateWrite());
        } catch (CacheDeserializationException | CacheMigrationException e) {
            throw e;
        } catch (CacheException e) {
            throw new CacheInitializationException("Cannot open cache at " + resolved, e);
        }

        // Loaded entries are already on disk; re-adding them unchanged needs no write
        markFlushed(opened.entries());
        opened.bind(trackingSink(resolved));

        log.info("Using cache at {} ({} entries{})", resolved, opened.size(), usingFallback ? ", fallback" : "");
        this.location = resolved;
        this.cache = opened;
        return opened;
    }

    public synchronized Path getLocation() {
        return location;
    }

    public synchronized boolean isUsingFallback() {
        return usingFallback;
    }

    /**
     * Persist the entries this session added that are not yet on disk.
     *
     * @return number of entries written
     */
    public synchronized int flushNewEntries() {
        if (cache == null) {
            return 0;
        }

        List<CacheEntry> unflushed = new ArrayList<>();
        for (CacheEntry entry : cache.newEntries()) {
            if (!entry.equals(flushed.get(entry.getKey()))) {
                unflushed.add(entry);
            }
        }
        if (unflushed.isEmpty()) {
            return 0;
        }

        fileRepository.append(unflushed, location);
        markFlushed(unflushed);
        log.info("Flushed {} new cache entries to {}", unflushed.size(), location);
        return unflushed.size();
    }

    @PreDestroy
    public void shutdown() {
        flushNewEntries();
    }

    /**
     * Sink that remembers what batches already persisted, so the shutdown flush skips it.
     */
    private CacheSink trackingSink(Path path) {
        CacheSink files = fileRepository.sinkFor(path);
        return new CacheSink() {
            @Override
            public void write(Cache cache) {
                files.write(cache);
                markFlushed(cache.newEntries());
            }

            @Override
            public void append(Collection<CacheEntry> entries) {
                files.append(entries);
                markFlushed(entries);
            }

            @Override
            public String describe() {
                return files.describe();
            }
        };
    }

    private synchronized void markFlushed(Collection<CacheEntry> entries) {
        entries.forEach(entry -> flushed.put(entry.getKey(), entry));
    }

    private Path resolveLocation() {
        Path primary = toPath(properties.getCache().getPath());
        if (isWritable(primary)) {
            usingFallback = false;
            return primary;
        }

        String fallbackSetting = properties.getCache().getFallbackPath();
        if (fallbackSetting == null || fallbackSetting.isBlank()) {
            throw new CacheInitializationException("Cache location " + primary
                    + " is not writable and no fallback location is configured");
        }

        Path fallback = toPath(fallbackSetting);
        if (!isWritable(fallback)) {
            throw new CacheInitializationException("Neither cache location " + primary
                    + " nor fallback " + fallback + " is writable");
        }

        log.warn("Cache location {} is not writable, using fallback {}", primary, fallback);
        usingFallback = true;
        return fallback;
    }

    private Path toPath(String setting) {
        String value = setting.startsWith(SQLITE_URL_PREFIX) ? setting.substring(SQLITE_URL_PREFIX.length()) : setting;
        Path path = Paths.get(value);
        try {
            CacheFileFormat.of(path);
        } catch (CacheException e) {
            throw new CacheInitializationException(e.getMessage(), e);
        }
        return path;
    }

    private static boolean isWritable(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException | SecurityException e) {
            log.debug("Cannot create cache directory {}: {}", parent, e.getMessage());
            return false;
        }
        if (Files.exists(path)) {
            return Files.isWritable(path);
        }
        return parent == null || Files.isWritable(parent);
    }

    /**
     * Import a plain-dict JSON export ({key: entry, ...}) into the store and rename it.
     */
    private void migrateLegacyJson(Path store) {
        String setting = properties.getCache().getLegacyJsonPath();
        if (setting == null || setting.isBlank()) {
            return;
        }
        Path legacy = Paths.get(setting);
        if (!Files.exists(legacy)) {
            return;
        }

        List<CacheEntry> entries = new ArrayList<>();
        try {
            JsonNode root = objectMapper.readTree(legacy.toFile());
            if (root == null || !root.isObject()) {
                throw new CacheMigrationException("Legacy cache export " + legacy + " is not a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                // Version markers sit next to the entries as plain strings
                if (!field.getValue().isObject()) {
                    continue;
                }
                try {
                    entries.add(CacheEntry.fromJson(field.getValue()));
                } catch (CacheDeserializationException e) {
                    throw new CacheMigrationException("Cannot migrate legacy cache export", e.at(legacy.toString(), field.getKey()));
                }
            }
        } catch (IOException e) {
            throw new CacheMigrationException("Cannot read legacy cache export " + legacy, e);
        }

        fileRepository.append(entries, store);
        Path done = legacy.resolveSibling(legacy.getFileName() + MIGRATED_SUFFIX);
        try {
            Files.move(legacy, done, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new CacheMigrationException("Imported " + entries.size() + " entries but cannot rename " + legacy, e);
        }
        log.info("Migrated {} entries from legacy export {} into {}", entries.size(), legacy, store);
    }
}
