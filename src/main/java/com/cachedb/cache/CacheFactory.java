package com.cachedb.cache;

import com.cachedb.exception.CacheDBException;

/**
 * Deferred construction of a cache.
 */
@FunctionalInterface
public interface CacheFactory {
    Cache create() throws CacheDBException;
}
