package com.reprise.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.reprise.exception.CacheDeserializationException;
import com.reprise.exception.CacheException;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheRequest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Cache.
 */
class CacheTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testFetchOnEmptyCacheIsMiss() {
        Cache cache = new Cache();
        CacheRequest request = CacheEntry.example().toCacheRequest();

        FetchResult result = cache.fetch(request);

        assertFalse(result.isHit());
        assertEquals(request.getKey(), result.getKey());
        assertTrue(result.output().isEmpty());
        assertTrue(result.entry().isEmpty());
    }

    @Test
    void testStringParametersScenario() {
        Cache cache = new Cache();
        JsonNode parameters = TextNode.valueOf("{'temperature': 0.5}");

        FetchResult miss = cache.fetch("gpt-3.5-turbo", parameters,
                "The quick brown fox jumps over the lazy dog.", "What does the fox say?", 1);
        assertFalse(miss.isHit());
        assertEquals("5ee60636048b05b4f7b6995a0cf9b78e", miss.getKey());

        cache.store("gpt-3.5-turbo", parameters,
                "The quick brown fox jumps over the lazy dog.", "What does the fox say?", 1,
                TextNode.valueOf("The fox says 'hello'"));
        FetchResult hit = cache.fetch("gpt-3.5-turbo", parameters,
                "The quick brown fox jumps over the lazy dog.", "What does the fox say?", 1);

        assertEquals(TextNode.valueOf("The fox says 'hello'"), hit.output().orElseThrow());
    }

    @Test
    void testStoreThenFetch() throws Exception {
        Cache cache = new Cache();
        CacheRequest request = CacheEntry.example().toCacheRequest();
        JsonNode response = objectMapper.readTree("{\"choices\": [{\"text\": \"hi\"}]}");

        String key = cache.store(request, response, "openai", false);
        FetchResult result = cache.fetch(request);

        assertEquals(request.getKey(), key);
        assertTrue(result.isHit());
        assertEquals(response, result.output().orElseThrow());
        assertEquals("openai", result.entry().orElseThrow().getService());
        assertEquals(1, cache.size());
    }

    @Test
    void testStoreIsIdempotentForSameIdentity() {
        Cache cache = new Cache();
        CacheRequest request = CacheEntry.example().toCacheRequest();
        JsonNode response = objectMapper.getNodeFactory().textNode("same");

        cache.store(request, response, null, false);
        cache.store(request, response, null, false);

        assertEquals(1, cache.size());
    }

    @Test
    void testLastWriteWinsOnConflict() {
        Cache cache = new Cache();
        CacheRequest request = CacheEntry.example().toCacheRequest();

        cache.store(request, objectMapper.getNodeFactory().textNode("first"), null, false);
        cache.store(request, objectMapper.getNodeFactory().textNode("second"), null, false);

        assertEquals("second", cache.fetch(request).output().orElseThrow().textValue());
    }

    @Test
    void testDelayedWriteInvisibleUntilBatchCommits() {
        Cache cache = new Cache(false);
        CacheRequest request = CacheEntry.example().toCacheRequest();

        try (CacheBatch batch = cache.beginBatch()) {
            cache.store(request, objectMapper.getNodeFactory().textNode("later"), null, false);

            assertFalse(cache.fetch(request).isHit());
            assertEquals(1, cache.pendingCount());
            assertFalse(batch.isFinished());
        }

        assertTrue(cache.fetch(request).isHit());
        assertEquals(0, cache.pendingCount());
        assertEquals(1, cache.newEntries().size());
    }

    @Test
    void testDelayedWriteOutsideBatchCommittedByNextBatch() {
        Cache cache = new Cache(false);
        CacheRequest request = CacheEntry.example().toCacheRequest();

        cache.store(request, objectMapper.getNodeFactory().textNode("buffered"), null, false);
        assertFalse(cache.fetch(request).isHit());

        int committed = cache.beginBatch().commit();

        assertEquals(1, committed);
        assertTrue(cache.fetch(request).isHit());
    }

    @Test
    void testRollbackDiscardsPending() {
        Cache cache = new Cache(false);
        CacheBatch batch = cache.beginBatch();
        cache.addAll(List.of(CacheEntry.example()), false);

        assertEquals(1, batch.rollback());
        batch.close();

        assertTrue(cache.isEmpty());
        assertEquals(0, cache.pendingCount());
    }

    @Test
    void testBatchFinishesOnce() {
        CacheBatch batch = new Cache(false).beginBatch();
        batch.commit();

        assertThrows(IllegalStateException.class, batch::commit);
        assertThrows(IllegalStateException.class, batch::rollback);
    }

    @Test
    void testWithBatchRollsBackOnException() {
        Cache cache = new Cache(false);

        assertThrows(IllegalArgumentException.class, () -> cache.withBatch(c -> {
            c.addAll(List.of(CacheEntry.example()), false);
            throw new IllegalArgumentException("boom");
        }));
        assertTrue(cache.isEmpty());

        String key = cache.withBatch(c -> c.store(CacheEntry.example().toStoreRequest()));
        assertTrue(cache.contains(key));
    }

    @Test
    void testWithBatchWrapsCheckedException() {
        Cache cache = new Cache(false);

        CacheException e = assertThrows(CacheException.class, () -> cache.withBatch(c -> {
            throw new Exception("checked");
        }));
        assertEquals("checked", e.getCause().getMessage());
    }

    @Test
    void testBatchCommitAppendsToSink() {
        Cache cache = new Cache(false);
        RecordingSink sink = new RecordingSink();
        cache.bind(sink);

        try (CacheBatch ignored = cache.beginBatch()) {
            cache.addAll(List.of(CacheEntry.example()), false);
        }

        assertEquals(List.of(CacheEntry.example()), sink.appended);
        assertEquals(0, sink.fullWrites);
    }

    @Test
    void testFlushRequiresSink() {
        Cache cache = Cache.example();
        assertThrows(CacheException.class, cache::flush);

        RecordingSink sink = new RecordingSink();
        cache.bind(sink);
        cache.flush();
        assertEquals(1, sink.fullWrites);
    }

    @Test
    void testConstructorRekeysMismatchedKeys() {
        Cache cache = new Cache(Map.of("wrong-key", CacheEntry.example()), true);

        assertFalse(cache.contains("wrong-key"));
        assertTrue(cache.contains(CacheEntry.example().getKey()));
        assertTrue(cache.newEntries().isEmpty());
    }

    @Test
    void testAddFromJson() {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set(CacheEntry.example().getKey(), CacheEntry.example().toJson());
        Cache cache = new Cache();

        cache.addFromJson(payload, true);

        assertEquals(Cache.example(), cache);
    }

    @Test
    void testAddFromJsonNamesBadKey() {
        ObjectNode bad = CacheEntry.example().toJson();
        bad.remove("model");
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("k1", bad);

        CacheDeserializationException e = assertThrows(CacheDeserializationException.class,
                () -> new Cache().addFromJson(payload, true));
        assertEquals("k1", e.getRecord());
    }

    @Test
    void testMergeIdentityAndLeftPrecedence() {
        Cache a = Cache.example();
        Cache empty = new Cache();

        assertEquals(a, a.merge(empty));
        assertEquals(a, empty.merge(a));

        CacheEntry leftVersion = CacheEntry.example().toBuilder().output("\"left\"").build();
        CacheEntry rightVersion = CacheEntry.example().toBuilder().output("\"right\"").build();
        Cache merged = new Cache(List.of(leftVersion), true).merge(new Cache(List.of(rightVersion), true));

        assertEquals(1, merged.size());
        assertEquals("\"left\"", merged.get(leftVersion.getKey()).orElseThrow().getOutput());
    }

    @Test
    void testMergeUnion() {
        CacheEntry a = CacheEntry.example(true);
        CacheEntry b = CacheEntry.example(true);

        Cache merged = new Cache(List.of(a), true).merge(new Cache(List.of(b), true));

        assertEquals(2, merged.size());
    }

    @Test
    void testDifference() {
        CacheEntry a = CacheEntry.example(true);
        CacheEntry b = CacheEntry.example(true);
        Cache both = new Cache(List.of(a, b), true);

        Cache diff = both.difference(new Cache(List.of(b), true));

        assertEquals(Set.of(a.getKey()), diff.keys());
        assertTrue(both.difference(both).isEmpty());
    }

    @Test
    void testSubsetIgnoresUnknownKeys() {
        CacheEntry a = CacheEntry.example(true);
        CacheEntry b = CacheEntry.example(true);
        Cache cache = new Cache(List.of(a, b), true);

        Cache subset = cache.subset(List.of(a.getKey(), "not-a-key"));

        assertEquals(1, subset.size());
        assertTrue(subset.contains(a.getKey()));
    }

    @Test
    void testNewAndUsedEntries() {
        CacheEntry loaded = CacheEntry.example(true);
        CacheEntry untouched = CacheEntry.example(true);
        Cache cache = new Cache(List.of(loaded, untouched), true);

        cache.fetch(loaded.toCacheRequest());
        CacheEntry added = CacheEntry.example(true);
        cache.addAll(List.of(added), true);

        assertEquals(List.of(added.getKey()), new ArrayList<>(cache.newEntriesCache().keys()));
        assertEquals(Set.of(loaded.getKey(), added.getKey()), cache.usedEntriesCache().keys());
    }

    @Test
    void testLastInsertionTimestamp() {
        Cache cache = new Cache();
        assertThrows(CacheException.class, cache::lastInsertionTimestamp);

        cache.addAll(List.of(CacheEntry.example(true).toBuilder().timestamp(10L).build()), true);
        cache.addAll(List.of(CacheEntry.example(true).toBuilder().timestamp(20L).build()), true);

        assertEquals(20L, cache.lastInsertionTimestamp());
    }

    @Test
    void testIterationFollowsInsertionOrder() {
        CacheEntry a = CacheEntry.example(true);
        CacheEntry b = CacheEntry.example(true);
        Cache cache = new Cache(List.of(a, b), true);

        List<CacheEntry> seen = new ArrayList<>();
        cache.forEach(seen::add);

        assertEquals(List.of(a, b), seen);
    }

    @Test
    void testConcurrentStoreAndFetch() throws Exception {
        int threads = 8;
        int perThread = 50;
        Cache cache = new Cache();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    int hits = 0;
                    for (int i = 0; i < perThread; i++) {
                        CacheRequest request = identity(thread, i);
                        cache.store(request, TextNode.valueOf("answer " + thread + "/" + i), null, false);
                        if (cache.fetch(request).isHit()) {
                            hits++;
                        }
                    }
                    return hits;
                }));
            }

            for (Future<Integer> future : futures) {
                assertEquals(perThread, future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * perThread, cache.size());
        assertEquals(threads * perThread, cache.newEntries().size());
    }

    @Test
    void testConcurrentBatchCommitsOnDelayedCache() throws Exception {
        int threads = 8;
        int perThread = 25;
        Cache cache = new Cache(false);
        RecordingSink sink = new RecordingSink();
        cache.bind(sink);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        CacheBatch batch = cache.beginBatch();
                        cache.store(identity(thread, i), TextNode.valueOf("late"), null, false);
                        cache.fetch(identity(thread, i));
                        batch.commit();
                    }
                }));
            }

            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * perThread, cache.size());
        assertEquals(threads * perThread, cache.newEntries().size());
        assertEquals(0, cache.pendingCount());
        assertEquals(threads * perThread, sink.appended.size());
    }

    private static CacheRequest identity(int thread, int index) {
        return CacheRequest.builder()
                .model("gpt-4")
                .parameters(CacheEntry.parametersOf(Map.of("temperature", 0.5)))
                .systemPrompt("worker " + thread)
                .userPrompt("question " + index)
                .iteration(0)
                .build();
    }

    private static final class RecordingSink implements CacheSink {
        final List<CacheEntry> appended = Collections.synchronizedList(new ArrayList<>());
        volatile int fullWrites;

        @Override
        public void write(Cache cache) {
            fullWrites++;
        }

        @Override
        public void append(Collection<CacheEntry> entries) {
            appended.addAll(entries);
        }

        @Override
        public String describe() {
            return "recording";
        }
    }
}
