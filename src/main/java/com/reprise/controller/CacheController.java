package com.reprise.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.reprise.cache.Cache;
import com.reprise.cache.FetchResult;
import com.reprise.model.CacheRequest;
import com.reprise.model.StoreRequest;
import com.reprise.repository.CacheFileRepository;
import com.reprise.service.DefaultCacheProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cache access over HTTP, backed by the process-default cache.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    static final MediaType JSONL = MediaType.parseMediaType("application/jsonl");

    private final DefaultCacheProvider cacheProvider;
    private final CacheFileRepository fileRepository;

    public CacheController(DefaultCacheProvider cacheProvider, CacheFileRepository fileRepository) {
        this.cacheProvider = cacheProvider;
        this.fileRepository = fileRepository;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Cache cache = cacheProvider.getCache();

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("entries", cache.size());
        stats.put("new_entries", cache.newEntries().size());
        stats.put("pending_entries", cache.pendingCount());
        stats.put("path", String.valueOf(cacheProvider.getLocation()));
        stats.put("fallback", cacheProvider.isUsingFallback());
        return ResponseEntity.ok(stats);
    }

    /**
     * Look up the cached output for a request identity.
     *
     * @return the entry, or 404 with the computed key on a miss
     */
    @PostMapping("/fetch")
    public ResponseEntity<JsonNode> fetch(@RequestBody CacheRequest request) {
        FetchResult result = cacheProvider.getCache().fetch(request);
        return result.entry()
                .<ResponseEntity<JsonNode>>map(entry -> ResponseEntity.ok(entry.toJson().put("key", result.getKey())))
                .orElseGet(() -> ResponseEntity.status(404).build());
    }

    @PostMapping("/store")
    public ResponseEntity<Map<String, String>> store(@RequestBody StoreRequest request) {
        String key = cacheProvider.getCache().store(request);
        log.debug("Stored entry via API: key={}, model={}", key, request.getModel());
        return ResponseEntity.ok(Map.of("key", key));
    }

    @GetMapping("/entries/{key}")
    public ResponseEntity<JsonNode> getEntry(@PathVariable String key) {
        return cacheProvider.getCache().get(key)
                .<ResponseEntity<JsonNode>>map(entry -> ResponseEntity.ok(entry.toJson()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Export the entries for the given keys as append-log text. Unknown keys are skipped.
     */
    @PostMapping("/export")
    public ResponseEntity<String> export(@RequestBody ExportRequest request) {
        List<String> keys = request.getKeys() != null ? request.getKeys() : List.of();
        Cache subset = cacheProvider.getCache().subset(keys);
        log.info("Exporting {} of {} requested cache entries", subset.size(), keys.size());
        return ResponseEntity.ok()
                .contentType(JSONL)
                .body(fileRepository.exportJsonl(subset));
    }

    /**
     * Persist entries added since startup.
     */
    @PostMapping("/flush")
    public ResponseEntity<Map<String, Object>> flush() {
        int flushed = cacheProvider.flushNewEntries();
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "flushed", flushed
        ));
    }
}
