package com.reprise.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.reprise.exception.CacheDeserializationException;
import com.reprise.exception.CacheException;
import com.reprise.model.CacheEntry;
import com.reprise.model.CacheRequest;
import com.reprise.model.StoreRequest;
import com.reprise.repository.JsonlCacheCodec;
import com.reprise.repository.SqliteCacheRepository;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Keyed collection of {@link CacheEntry} values, one per request identity.
 *
 * Write modes:
 * 1. immediateWrite = true: store() is visible to fetch() at once
 * 2. immediateWrite = false: store() is buffered and only committed when a
 *    {@link CacheBatch} opened with {@link #beginBatch()} commits
 *
 * Besides the entries themselves the cache tracks what the current session
 * added (new entries) and what it served (fetched entries), so a run can ship
 * or persist only the part of the cache it actually touched.
 *
 * All public operations are safe to call from several threads.
 */
@Slf4j
public class Cache implements Iterable<CacheEntry> {

    private final Map<String, CacheEntry> data = new LinkedHashMap<>();
    private final Map<String, CacheEntry> newEntries = new LinkedHashMap<>();
    private final Map<String, CacheEntry> fetchedEntries = new LinkedHashMap<>();
    private final Map<String, CacheEntry> pending = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final boolean immediateWrite;

    private int openBatches;
    private volatile CacheSink sink;

    public Cache() {
        this(true);
    }

    public Cache(boolean immediateWrite) {
        this.immediateWrite = immediateWrite;
    }

    /**
     * Cache pre-populated from an in-memory mapping. Entries are re-keyed by their own key
     * and are not counted as new entries.
     */
    public Cache(Map<String, CacheEntry> entries, boolean immediateWrite) {
        this(immediateWrite);
        entries.forEach((suppliedKey, entry) -> data.put(checkedKey(suppliedKey, entry), entry));
    }

    public Cache(Collection<CacheEntry> entries, boolean immediateWrite) {
        this(immediateWrite);
        entries.forEach(entry -> data.put(entry.getKey(), entry));
    }

    public boolean isImmediateWrite() {
        return immediateWrite;
    }

    // ---------------------------------------------------------------- read

    /**
     * Look up the cached output for a request identity.
     *
     * @return a hit with the parsed output and entry, or a miss carrying only the key
     */
    public FetchResult fetch(CacheRequest request) {
        String key = request.getKey();
        CacheEntry entry;

        lock.readLock().lock();
        try {
            entry = data.get(key);
        } finally {
            lock.readLock().unlock();
        }

        if (entry == null) {
            log.debug("Cache miss: key={}", key);
            return FetchResult.miss(key);
        }

        lock.writeLock().lock();
        try {
            fetchedEntries.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Cache hit: key={}, model={}", key, entry.getModel());
        return FetchResult.hit(key, entry);
    }

    public FetchResult fetch(String model, JsonNode parameters, String systemPrompt,
                             String userPrompt, int iteration) {
        return fetch(CacheRequest.builder()
                .model(model)
                .parameters(parameters)
                .systemPrompt(systemPrompt)
                .userPrompt(userPrompt)
                .iteration(iteration)
                .build());
    }

    public Optional<CacheEntry> get(String key) {
        return read(() -> Optional.ofNullable(data.get(key)));
    }

    public boolean contains(String key) {
        return read(() -> data.containsKey(key));
    }

    public Set<String> keys() {
        return read(() -> Collections.unmodifiableSet(new LinkedHashSet<>(data.keySet())));
    }

    public List<CacheEntry> entries() {
        return read(() -> List.copyOf(data.values()));
    }

    /**
     * Snapshot of the key to entry mapping.
     */
    public Map<String, CacheEntry> asMap() {
        return read(() -> Collections.unmodifiableMap(new LinkedHashMap<>(data)));
    }

    @Override
    public Iterator<CacheEntry> iterator() {
        return entries().iterator();
    }

    public int size() {
        return read(data::size);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Number of delayed writes waiting for a batch commit.
     */
    public int pendingCount() {
        return read(pending::size);
    }

    /**
     * Timestamp of the most recently inserted entry.
     *
     * @throws CacheException if the cache is empty
     */
    public long lastInsertionTimestamp() {
        return read(() -> {
            if (data.isEmpty()) {
                throw new CacheException("Cache is empty");
            }
            CacheEntry last = null;
            for (CacheEntry entry : data.values()) {
                last = entry;
            }
            return last.getTimestamp();
        });
    }

    // ---------------------------------------------------------------- write

    /**
     * Record a completed response for a request identity.
     *
     * @return the key the entry was stored under
     */
    public String store(CacheRequest request, JsonNode response, String service, boolean validated) {
        CacheEntry entry = CacheEntry.forResponse(request, response, service, validated);
        String key = entry.getKey();
        insert(Map.of(key, entry), immediateWrite);
        return key;
    }

    public String store(StoreRequest request) {
        return store(request.toCacheRequest(), request.getResponse(), request.getService(), request.isValidated());
    }

    public String store(String model, JsonNode parameters, String systemPrompt, String userPrompt,
                        int iteration, JsonNode response) {
        return store(CacheRequest.builder()
                .model(model)
                .parameters(parameters)
                .systemPrompt(systemPrompt)
                .userPrompt(userPrompt)
                .iteration(iteration)
                .build(), response, null, false);
    }

    /**
     * Bulk import, e.g. from a remote sync payload.
     *
     * @param writeNow commit at once; otherwise hold until the next batch commit
     */
    public void addFromMap(Map<String, CacheEntry> entries, boolean writeNow) {
        Map<String, CacheEntry> rekeyed = new LinkedHashMap<>();
        entries.forEach((suppliedKey, entry) -> rekeyed.put(checkedKey(suppliedKey, entry), entry));
        insert(rekeyed, writeNow);
    }

    public void addFromMap(Map<String, CacheEntry> entries) {
        addFromMap(entries, true);
    }

    public void addAll(Collection<CacheEntry> entries, boolean writeNow) {
        Map<String, CacheEntry> keyed = new LinkedHashMap<>();
        entries.forEach(entry -> keyed.put(entry.getKey(), entry));
        insert(keyed, writeNow);
    }

    /**
     * Bulk import from a JSON object mapping keys to entry objects.
     *
     * @throws CacheDeserializationException naming the offending key
     */
    public void addFromJson(JsonNode payload, boolean writeNow) {
        if (payload == null || !payload.isObject()) {
            throw new CacheDeserializationException("cache payload must be a JSON object of key to entry");
        }
        Map<String, CacheEntry> entries = new LinkedHashMap<>();
        payload.fields().forEachRemaining(field -> {
            try {
                entries.put(field.getKey(), CacheEntry.fromJson(field.getValue()));
            } catch (CacheDeserializationException e) {
                throw e.at("payload", field.getKey());
            }
        });
        addFromMap(entries, writeNow);
    }

    private void insert(Map<String, CacheEntry> entries, boolean writeNow) {
        boolean buffered = false;

        lock.writeLock().lock();
        try {
            if (writeNow) {
                entries.forEach(this::commitEntry);
            } else {
                pending.putAll(entries);
                buffered = openBatches == 0;
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (buffered) {
            log.warn("Buffered {} delayed write(s) with no open batch; they stay invisible until a batch commits",
                    entries.size());
        }
    }

    private void commitEntry(String key, CacheEntry entry) {
        CacheEntry previous = data.put(key, entry);
        if (previous != null && !previous.equals(entry)) {
            log.warn("Replaced cache entry with different content: key={}", key);
        }
        newEntries.put(key, entry);
    }

    private static String checkedKey(String suppliedKey, CacheEntry entry) {
        String key = entry.getKey();
        if (suppliedKey != null && !suppliedKey.equals(key)) {
            log.warn("Supplied key {} does not match entry key {}; using entry key", suppliedKey, key);
        }
        return key;
    }

    // ---------------------------------------------------------------- batches

    /**
     * Open a write batch. Close it with try-with-resources; pending entries are
     * committed on close unless {@link CacheBatch#rollback()} was called.
     */
    public CacheBatch beginBatch() {
        lock.writeLock().lock();
        try {
            openBatches++;
        } finally {
            lock.writeLock().unlock();
        }
        return new CacheBatch(this);
    }

    /**
     * Run work inside a batch: commit when it returns, roll back when it throws.
     */
    public <T> T withBatch(CacheWork<T> work) {
        CacheBatch batch = beginBatch();
        try {
            T result = work.run(this);
            batch.commit();
            return result;
        } catch (RuntimeException e) {
            batch.rollback();
            throw e;
        } catch (Exception e) {
            batch.rollback();
            throw new CacheException("Cache batch failed", e);
        }
    }

    int commitPending() {
        List<CacheEntry> committed;
        lock.writeLock().lock();
        try {
            committed = new ArrayList<>(pending.values());
            pending.forEach(this::commitEntry);
            pending.clear();
            openBatches--;
        } finally {
            lock.writeLock().unlock();
        }

        if (sink != null && !committed.isEmpty()) {
            sink.append(committed);
        }
        return committed.size();
    }

    int discardPending() {
        lock.writeLock().lock();
        try {
            int discarded = pending.size();
            pending.clear();
            openBatches--;
            return discarded;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------- derived caches

    /**
     * Entries whose key is in {@code keys}; unknown keys are ignored.
     */
    public Cache subset(Collection<String> keys) {
        Map<String, CacheEntry> selected = new LinkedHashMap<>();
        lock.readLock().lock();
        try {
            for (String key : keys) {
                CacheEntry entry = data.get(key);
                if (entry != null) {
                    selected.put(key, entry);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return new Cache(selected, immediateWrite);
    }

    /**
     * Union of both caches. On a key present in both, this cache's entry is kept.
     */
    public Cache merge(Cache other) {
        Map<String, CacheEntry> union = new LinkedHashMap<>(asMap());
        other.asMap().forEach(union::putIfAbsent);
        return new Cache(union, immediateWrite);
    }

    /**
     * Entries of this cache whose key is absent from {@code other}.
     */
    public Cache difference(Cache other) {
        Set<String> otherKeys = other.keys();
        Map<String, CacheEntry> diff = new LinkedHashMap<>();
        asMap().forEach((key, entry) -> {
            if (!otherKeys.contains(key)) {
                diff.put(key, entry);
            }
        });
        return new Cache(diff, immediateWrite);
    }

    /**
     * Entries committed by store/add during this session, excluding those loaded at construction.
     */
    public Cache newEntriesCache() {
        return new Cache(read(() -> new LinkedHashMap<>(newEntries)), true);
    }

    /**
     * Entries this session added or served from cache: the relevant subset of a run.
     */
    public Cache usedEntriesCache() {
        return new Cache(read(() -> {
            Map<String, CacheEntry> used = new LinkedHashMap<>(fetchedEntries);
            used.putAll(newEntries);
            return used;
        }), true);
    }

    public List<CacheEntry> newEntries() {
        return read(() -> new ArrayList<>(newEntries.values()));
    }

    // ---------------------------------------------------------------- persistence

    public void bind(CacheSink sink) {
        this.sink = sink;
    }

    public Optional<CacheSink> getSink() {
        return Optional.ofNullable(sink);
    }

    /**
     * Write the whole cache to the file it was opened from.
     */
    public void flush() {
        if (sink == null) {
            throw new CacheException("Cache is not bound to a file");
        }
        sink.write(this);
    }

    public void writeJsonl(Path path) {
        new JsonlCacheCodec().write(this, path);
    }

    public void writeSqliteDb(Path path) {
        new SqliteCacheRepository().write(this, path);
    }

    public static Cache fromJsonl(Path path) {
        return new JsonlCacheCodec().read(path);
    }

    public static Cache fromSqliteDb(Path path) {
        return new SqliteCacheRepository().read(path);
    }

    // ---------------------------------------------------------------- equality

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cache)) {
            return false;
        }
        return asMap().equals(((Cache) o).asMap());
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        return "Cache(entries=" + size() + ", immediateWrite=" + immediateWrite + ")";
    }

    private <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Example cache holding {@link CacheEntry#example()}.
     */
    public static Cache example() {
        return new Cache(List.of(CacheEntry.example()), true);
    }
}
