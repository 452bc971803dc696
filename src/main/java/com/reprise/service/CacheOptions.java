package com.reprise.service;

import com.reprise.cache.Cache;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * How a run wants its cache chosen.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CacheOptions {

    public enum Mode {
        /** Use the cache the caller supplies. */
        PROVIDED,
        /** Fresh throwaway cache; nothing is persisted. */
        DISABLED,
        /** The process-default persistent cache. */
        DEFAULT
    }

    private final Mode mode;
    private final Cache cache;
    private final boolean remote;

    public static CacheOptions provided(Cache cache, boolean remote) {
        if (cache == null) {
            throw new IllegalArgumentException("Provided cache must not be null");
        }
        return new CacheOptions(Mode.PROVIDED, cache, remote);
    }

    public static CacheOptions disabled() {
        return new CacheOptions(Mode.DISABLED, null, false);
    }

    public static CacheOptions defaults(boolean remote) {
        return new CacheOptions(Mode.DEFAULT, null, remote);
    }
}
