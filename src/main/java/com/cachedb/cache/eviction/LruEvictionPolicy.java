package com.cachedb.cache.eviction;

/**
 * Least recently used first.
 */
public class LruEvictionPolicy extends OrderedEvictionPolicy {
    public static final String NAME = "lru";

    public LruEvictionPolicy() {
        super(NAME, "last_access_time");
    }
}
