package com.reprise.service;

import com.reprise.cache.Cache;
import lombok.Value;

/**
 * The cache a run will use and whether the remote cache takes part.
 */
@Value
public class CacheSelection {
    Cache cache;
    boolean useRemote;
}
