package com.reprise.cache;

import com.reprise.model.CacheEntry;

import java.util.Collection;

/**
 * Persistence target a cache is bound to when it was opened from a file.
 */
public interface CacheSink {

    /**
     * Write the full contents of the cache.
     */
    void write(Cache cache);

    /**
     * Persist entries a batch just committed, leaving stored entries in place.
     */
    void append(Collection<CacheEntry> entries);

    /**
     * Human-readable location, used in log lines.
     */
    String describe();
}
