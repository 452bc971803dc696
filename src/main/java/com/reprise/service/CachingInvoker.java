package com.reprise.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.reprise.cache.Cache;
import com.reprise.cache.FetchResult;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheRequest;
import com.reprise.repository.RemoteCache;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Fetch-or-compute for model calls.
 *
 * Flow:
 * 1. Local cache lookup
 * 2. Remote cache lookup (if the selection allows it); a hit is copied into the local cache
 * 3. Provider call; the response is stored locally, then uploaded to the remote cache
 *
 * On a cache without immediate writes the stored entry stays buffered until the
 * caller's {@link com.reprise.cache.CacheBatch} commits.
 */
@Slf4j
@Service
public class CachingInvoker {

    private final ObjectProvider<RemoteCache> remoteCache;

    public CachingInvoker(ObjectProvider<RemoteCache> remoteCache) {
        this.remoteCache = remoteCache;
    }

    public InvocationResult invoke(CacheSelection selection, CacheRequest request, String service,
                                   Supplier<JsonNode> call) {
        Cache cache = selection.getCache();

        FetchResult local = cache.fetch(request);
        if (local.isHit()) {
            return InvocationResult.builder()
                    .key(local.getKey())
                    .output(local.output().orElseThrow())
                    .source(Source.LOCAL)
                    .build();
        }

        Optional<RemoteCache> remote = selection.isUseRemote()
                ? Optional.ofNullable(remoteCache.getIfAvailable())
                : Optional.empty();

        if (remote.isPresent()) {
            Optional<CacheEntry> remoteEntry = remote.get().fetch(local.getKey());
            if (remoteEntry.isPresent()) {
                CacheEntry entry = remoteEntry.get();
                cache.addAll(List.of(entry), cache.isImmediateWrite());
                log.debug("Remote hit copied into local cache: key={}", local.getKey());
                return InvocationResult.builder()
                        .key(local.getKey())
                        .output(entry.parsedOutput())
                        .source(Source.REMOTE)
                        .build();
            }
        }

        JsonNode response = call.get();
        String key = cache.store(request, response, service, false);
        remote.ifPresent(r -> r.storeAll(List.of(CacheEntry.forResponse(request, response, service, false))));
        log.debug("Provider response cached: key={}, service={}", key, service);

        return InvocationResult.builder()
                .key(key)
                .output(response)
                .source(Source.PROVIDER)
                .build();
    }

    public enum Source {
        LOCAL,
        REMOTE,
        PROVIDER
    }

    /**
     * Output of an invocation and where it came from.
     */
    @Data
    @Builder
    public static class InvocationResult {
        private JsonNode output;
        private String key;
        private Source source;
    }
}
