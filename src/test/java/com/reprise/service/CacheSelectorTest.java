package com.reprise.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.cache.Cache;
import com.reprise.config.RepriseProperties;
import com.reprise.repository.CacheFileRepository;
import com.reprise.repository.RemoteCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for CacheSelector.
 */
class CacheSelectorTest {

    @TempDir
    Path tempDir;

    private RepriseProperties properties;
    private DefaultCacheProvider provider;
    private ObjectProvider<RemoteCache> remoteProvider;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new RepriseProperties();
        properties.getCache().setPath(tempDir.resolve("cache.db").toString());
        ObjectMapper objectMapper = new ObjectMapper();
        provider = new DefaultCacheProvider(properties, new CacheFileRepository(objectMapper), objectMapper);
        remoteProvider = mock(ObjectProvider.class);
    }

    @Test
    void testProvidedCacheIsUsedAsIs() {
        Cache mine = Cache.example();

        CacheSelection selection = selector().select(CacheOptions.provided(mine, false));

        assertSame(mine, selection.getCache());
        assertFalse(selection.isUseRemote());
    }

    @Test
    void testDisabledGivesFreshBufferedCache() {
        CacheSelector selector = selector();

        CacheSelection first = selector.select(CacheOptions.disabled());
        CacheSelection second = selector.select(CacheOptions.disabled());

        assertNotSame(first.getCache(), second.getCache());
        assertFalse(first.getCache().isImmediateWrite());
        assertTrue(first.getCache().getSink().isEmpty());
    }

    @Test
    void testDefaultUsesProviderCache() {
        CacheSelection selection = selector().select(CacheOptions.defaults(false));

        assertSame(provider.getCache(), selection.getCache());
    }

    @Test
    void testRemoteNeedsConfigurationAndBean() {
        when(remoteProvider.getIfAvailable()).thenReturn(mock(RemoteCache.class));

        assertFalse(selector().select(CacheOptions.defaults(true)).isUseRemote());

        properties.getRemote().setEnabled(true);
        assertTrue(selector().select(CacheOptions.defaults(true)).isUseRemote());
        assertFalse(selector().select(CacheOptions.defaults(false)).isUseRemote());

        when(remoteProvider.getIfAvailable()).thenReturn(null);
        assertFalse(selector().select(CacheOptions.defaults(true)).isUseRemote());
    }

    @Test
    void testProvidedRequiresCache() {
        assertThrows(IllegalArgumentException.class, () -> CacheOptions.provided(null, false));
    }

    private CacheSelector selector() {
        return new CacheSelector(provider, properties, remoteProvider);
    }
}
