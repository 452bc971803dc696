package com.reprise.cache;

import lombok.extern.slf4j.Slf4j;

/**
 * Scoped commit handle for delayed writes.
 *
 * <pre>
 * try (CacheBatch batch = cache.beginBatch()) {
 *     cache.store(...);
 * }   // buffered entries are committed here
 * </pre>
 *
 * A batch finishes exactly once: by {@link #commit()}, {@link #rollback()} or {@link #close()}.
 */
@Slf4j
public class CacheBatch implements AutoCloseable {

    private final Cache cache;
    private boolean finished;

    CacheBatch(Cache cache) {
        this.cache = cache;
    }

    /**
     * Move every buffered entry into the cache and persist it if the cache is bound to a file.
     *
     * @return number of entries committed
     */
    public int commit() {
        ensureOpen();
        finished = true;
        int committed = cache.commitPending();
        log.debug("Committed {} buffered cache entries", committed);
        return committed;
    }

    /**
     * Discard every buffered entry.
     *
     * @return number of entries discarded
     */
    public int rollback() {
        ensureOpen();
        finished = true;
        int discarded = cache.discardPending();
        if (discarded > 0) {
            log.info("Rolled back {} buffered cache entries", discarded);
        }
        return discarded;
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * Commits unless the batch already finished.
     */
    @Override
    public void close() {
        if (!finished) {
            commit();
        }
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("Cache batch already finished");
        }
    }
}
