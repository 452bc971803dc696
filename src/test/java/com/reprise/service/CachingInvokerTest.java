package com.reprise.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.reprise.cache.Cache;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheRequest;
import com.reprise.repository.RemoteCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

/**
 * Tests for CachingInvoker.
 */
class CachingInvokerTest {

    private RemoteCache remote;
    private CachingInvoker invoker;
    private final CacheRequest request = CacheEntry.example().toCacheRequest();

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        remote = mock(RemoteCache.class);
        ObjectProvider<RemoteCache> remoteProvider = mock(ObjectProvider.class);
        when(remoteProvider.getIfAvailable()).thenReturn(remote);
        invoker = new CachingInvoker(remoteProvider);
    }

    @Test
    void testProviderCalledOnceThenLocalHit() {
        Cache cache = new Cache();
        CacheSelection selection = new CacheSelection(cache, false);
        AtomicInteger calls = new AtomicInteger();
        Supplier<JsonNode> call = () -> {
            calls.incrementAndGet();
            return TextNode.valueOf("answer");
        };

        CachingInvoker.InvocationResult first = invoker.invoke(selection, request, "openai", call);
        CachingInvoker.InvocationResult second = invoker.invoke(selection, request, "openai", call);

        assertEquals(CachingInvoker.Source.PROVIDER, first.getSource());
        assertEquals(CachingInvoker.Source.LOCAL, second.getSource());
        assertEquals(TextNode.valueOf("answer"), second.getOutput());
        assertEquals(first.getKey(), second.getKey());
        assertEquals(1, calls.get());
        verifyNoInteractions(remote);
    }

    @Test
    void testRemoteHitIsCopiedLocally() {
        Cache cache = new Cache();
        when(remote.fetch(request.getKey())).thenReturn(Optional.of(CacheEntry.example()));

        CachingInvoker.InvocationResult result = invoker.invoke(new CacheSelection(cache, true), request, "openai",
                () -> fail("provider must not be called"));

        assertEquals(CachingInvoker.Source.REMOTE, result.getSource());
        assertEquals(TextNode.valueOf("The fox says 'hello'"), result.getOutput());
        assertTrue(cache.contains(request.getKey()));
        verify(remote, never()).storeAll(anyCollection());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testProviderResultUploadedToRemote() {
        Cache cache = new Cache();
        when(remote.fetch(any())).thenReturn(Optional.empty());

        invoker.invoke(new CacheSelection(cache, true), request, "openai", () -> TextNode.valueOf("fresh"));

        verify(remote).storeAll(argThat((Collection<CacheEntry> entries) ->
                entries.size() == 1 && entries.iterator().next().getKey().equals(request.getKey())));
        assertTrue(cache.contains(request.getKey()));
    }

    @Test
    void testDelayedCacheBuffersUntilBatch() {
        Cache cache = new Cache(false);
        CacheSelection selection = new CacheSelection(cache, false);

        cache.withBatch(c -> invoker.invoke(selection, request, "openai", () -> TextNode.valueOf("x")));

        assertEquals(List.of(request.getKey()), List.copyOf(cache.keys()));
    }
}
