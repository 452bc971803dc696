package com.reprise.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.config.RepriseProperties;
import com.reprise.model.CacheEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Redis-backed remote cache with compression.
 * Key pattern: {prefix}{cacheKey}, default reprise:entry:{md5}
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "reprise.remote", name = "enabled", havingValue = "true")
public class RedisRemoteCacheRepository implements RemoteCache {

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final RepriseProperties properties;

    public RedisRemoteCacheRepository(
            RedisTemplate<String, byte[]> remoteCacheTemplate,
            ObjectMapper objectMapper,
            RepriseProperties properties) {
        this.redisTemplate = remoteCacheTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Get an entry by cache key.
     *
     * @return the entry, or empty on a miss or any Redis failure
     */
    @Override
    public Optional<CacheEntry> fetch(String key) {
        String redisKey = buildKey(key);
        try {
            byte[] compressed = redisTemplate.opsForValue().get(redisKey);

            if (compressed == null) {
                log.debug("Remote cache miss: {}", redisKey);
                return Optional.empty();
            }

            CacheEntry entry = decompress(compressed);
            if (!key.equals(entry.getKey())) {
                log.warn("Remote entry under {} hashes to {}; ignoring it", redisKey, entry.getKey());
                return Optional.empty();
            }

            log.debug("Remote cache hit: {}", redisKey);
            return Optional.of(entry);

        } catch (Exception e) {
            log.warn("Error reading remote cache: key={}", redisKey, e);
            return Optional.empty();
        }
    }

    /**
     * Upload entries with the configured TTL. Failures are logged per entry.
     */
    @Override
    public void storeAll(Collection<CacheEntry> entries) {
        Duration ttl = properties.getRemote().getTtl();
        int stored = 0;
        for (CacheEntry entry : entries) {
            String redisKey = buildKey(entry.getKey());
            try {
                byte[] compressed = compress(entry);
                redisTemplate.opsForValue().set(redisKey, compressed, ttl);
                stored++;
                log.debug("Stored in remote cache: key={}, ttl={}, size={}B", redisKey, ttl, compressed.length);
            } catch (Exception e) {
                // Remote failures must not break the caller
                log.warn("Error storing to remote cache: key={}", redisKey, e);
            }
        }
        if (stored > 0) {
            log.info("Uploaded {} of {} entries to remote cache", stored, entries.size());
        }
    }

    private String buildKey(String key) {
        return properties.getRemote().getKeyPrefix() + key;
    }

    private byte[] compress(CacheEntry entry) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {

            gzipOut.write(objectMapper.writeValueAsBytes(entry.toJson()));
            gzipOut.finish();

            return baos.toByteArray();
        }
    }

    private CacheEntry decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return CacheEntry.fromJson(objectMapper.readTree(gzipIn.readAllBytes()));
        }
    }
}
