package com.reprise.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.cache.Cache;
import com.reprise.exception.CacheDeserializationException;
import com.reprise.exception.CacheException;
import com.reprise.exception.CacheFileNotFoundException;
import com.reprise.model.CacheEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-log encoding: one JSON object per line, each the {@link CacheEntry#toJson()} form.
 *
 * Lines are keyed by the key recomputed from the entry, never by a stored key. Lines of the
 * older keyed layout ({"key": {entry}}) are unwrapped on read.
 */
@Slf4j
public class JsonlCacheCodec {

    private final ObjectMapper objectMapper;

    public JsonlCacheCodec() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public JsonlCacheCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load a cache from an append-log file.
     *
     * @throws CacheFileNotFoundException if the file does not exist
     * @throws CacheDeserializationException naming file and line of the first bad record
     */
    public Cache read(Path path) {
        return new Cache(readEntries(path), true);
    }

    public Map<String, CacheEntry> readEntries(Path path) {
        if (!Files.exists(path)) {
            throw new CacheFileNotFoundException("File " + path + " not found");
        }

        Map<String, CacheEntry> entries = new LinkedHashMap<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                CacheEntry entry = parseLine(line, path, lineNumber);
                entries.put(entry.getKey(), entry);
            }
        } catch (IOException e) {
            throw new CacheException("Failed to read cache file " + path, e);
        }

        log.info("Loaded {} cache entries from {}", entries.size(), path);
        return entries;
    }

    /**
     * Overwrite the file with every entry of the cache.
     */
    public void write(Cache cache, Path path) {
        writeLines(cache.entries(), path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        log.info("Wrote {} cache entries to {}", cache.size(), path);
    }

    /**
     * Append entries to the file, creating it if needed.
     */
    public void append(Collection<CacheEntry> entries, Path path) {
        writeLines(entries, path, StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        log.info("Appended {} cache entries to {}", entries.size(), path);
    }

    /**
     * Append-log text for the entries, one line each.
     */
    public String encode(Collection<CacheEntry> entries) {
        StringBuilder sb = new StringBuilder();
        try {
            for (CacheEntry entry : entries) {
                sb.append(objectMapper.writeValueAsString(entry.toJson())).append('\n');
            }
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to encode cache entries", e);
        }
        return sb.toString();
    }

    private void writeLines(Collection<CacheEntry> entries, Path path, StandardOpenOption... options) {
        try {
            createParentDirectories(path);
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8, options)) {
                for (CacheEntry entry : entries) {
                    writer.write(objectMapper.writeValueAsString(entry.toJson()));
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            throw new CacheException("Failed to write cache file " + path, e);
        }
    }

    private CacheEntry parseLine(String line, Path path, int lineNumber) {
        try {
            JsonNode node = objectMapper.readTree(line);
            return CacheEntry.fromJson(unwrapKeyedLine(node));
        } catch (JsonProcessingException e) {
            throw new CacheDeserializationException(path.toString(), String.valueOf(lineNumber),
                    "line is not valid JSON", e);
        } catch (CacheDeserializationException e) {
            throw e.at(path.toString(), String.valueOf(lineNumber));
        }
    }

    /**
     * A keyed line holds exactly one field whose value is the entry object.
     */
    private static JsonNode unwrapKeyedLine(JsonNode node) {
        if (node.isObject() && node.size() == 1 && !node.has("model")) {
            JsonNode inner = node.elements().next();
            if (inner.isObject()) {
                return inner;
            }
        }
        return node;
    }

    private static void createParentDirectories(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
