package com.cachedb.cache.eviction;

/**
 * Least frequently used first.
 */
public class LfuEvictionPolicy extends OrderedEvictionPolicy {
    public static final String NAME = "lfu";

    public LfuEvictionPolicy() {
        super(NAME, "access_count");
    }
}
