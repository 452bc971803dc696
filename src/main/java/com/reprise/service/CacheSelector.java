package com.reprise.service;

import com.reprise.cache.Cache;
import com.reprise.config.RepriseProperties;
import com.reprise.repository.RemoteCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Picks the cache for a run from the caller's options.
 */
@Slf4j
@Service
public class CacheSelector {

    private final DefaultCacheProvider cacheProvider;
    private final RepriseProperties properties;
    private final ObjectProvider<RemoteCache> remoteCache;

    public CacheSelector(DefaultCacheProvider cacheProvider,
                         RepriseProperties properties,
                         ObjectProvider<RemoteCache> remoteCache) {
        this.cacheProvider = cacheProvider;
        this.properties = properties;
        this.remoteCache = remoteCache;
    }

    public CacheSelection select(CacheOptions options) {
        Cache cache = switch (options.getMode()) {
            case PROVIDED -> options.getCache();
            // Buffered and unbound: entries live only as long as the run
            case DISABLED -> new Cache(false);
            case DEFAULT -> cacheProvider.getCache();
        };

        boolean useRemote = options.isRemote() && remoteAvailable();
        if (options.isRemote() && !useRemote) {
            log.info("Remote cache requested but not enabled; using local cache only");
        }
        log.debug("Selected {} cache ({} entries), remote={}", options.getMode(), cache.size(), useRemote);
        return new CacheSelection(cache, useRemote);
    }

    private boolean remoteAvailable() {
        return properties.getRemote().isEnabled() && remoteCache.getIfAvailable() != null;
    }
}
