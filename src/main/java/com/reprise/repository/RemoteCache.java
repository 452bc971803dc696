package com.reprise.repository;

import com.reprise.model.CacheEntry;

import java.util.Collection;
import java.util.Optional;

/**
 * Cache shared between machines, consulted after the local cache misses.
 *
 * Implementations never throw for an unreachable backend; a failed lookup is a miss.
 */
public interface RemoteCache {

    Optional<CacheEntry> fetch(String key);

    void storeAll(Collection<CacheEntry> entries);
}
