package com.cachedb.cache.eviction;

/**
 * Oldest insertion first. Overwriting a live key keeps its original store time.
 */
public class FifoEvictionPolicy extends OrderedEvictionPolicy {
    public static final String NAME = "fifo";

    public FifoEvictionPolicy() {
        super(NAME, "store_time");
    }
}
