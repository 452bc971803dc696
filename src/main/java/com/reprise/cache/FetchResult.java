package com.reprise.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.reprise.model.CacheEntry;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * Outcome of a cache lookup. A miss carries the computed key and nothing else.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchResult {

    @Getter
    private final String key;
    private final JsonNode output;
    private final CacheEntry entry;

    static FetchResult hit(String key, CacheEntry entry) {
        return new FetchResult(key, entry.parsedOutput(), entry);
    }

    static FetchResult miss(String key) {
        return new FetchResult(key, null, null);
    }

    public boolean isHit() {
        return entry != null;
    }

    public Optional<JsonNode> output() {
        return Optional.ofNullable(output);
    }

    public Optional<CacheEntry> entry() {
        return Optional.ofNullable(entry);
    }
}
