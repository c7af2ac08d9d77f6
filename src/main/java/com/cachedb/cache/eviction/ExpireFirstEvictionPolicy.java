package com.cachedb.cache.eviction;

import java.sql.Connection;

/**
 * Nearest expiry first, never-expiring rows last. Registered as {@code "default"};
 * it needs no index of its own since the schema always indexes expire_time.
 */
public class ExpireFirstEvictionPolicy extends OrderedEvictionPolicy {
    public static final String NAME = "default";

    public ExpireFirstEvictionPolicy() {
        super(NAME, "expire_time", "expire_time IS NULL, expire_time");
    }

    @Override
    public String indexName() {
        return null;
    }

    @Override
    public void createIndex(Connection connection) {
    }
}
