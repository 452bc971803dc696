package com.reprise.cache;

/**
 * Body of a write batch; see {@link Cache#withBatch(CacheWork)}.
 */
@FunctionalInterface
public interface CacheWork<T> {

    T run(Cache cache) throws Exception;
}
