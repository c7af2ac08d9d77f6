package com.cachedb.cache;

import com.cachedb.exception.CacheDBException;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Cache interface for CacheDB.
 *
 * A {@code null} timeout means the entry never expires. Misses are reported
 * through return values, never exceptions.
 */
public interface Cache extends AutoCloseable {

    boolean set(Object key, Object value, Duration timeout) throws CacheDBException;

    default boolean set(Object key, Object value) throws CacheDBException {
        return set(key, value, null);
    }

    /**
     * Stores the entry only if the key is absent or expired.
     */
    boolean exSet(Object key, Object value, Duration timeout) throws CacheDBException;

    default boolean exSet(Object key, Object value) throws CacheDBException {
        return exSet(key, value, null);
    }

    /**
     * The live value of {@code key}, or {@code defaultValue}.
     *
     * Numbers come back widened: {@code Byte}, {@code Short}, {@code Integer} and
     * {@code Long} load as {@code Long}, {@code Float} and {@code Double} as
     * {@code Double}. A stored {@code Integer} is therefore not {@code equals} to
     * what {@code get} returns.
     */
    Object get(Object key, Object defaultValue) throws CacheDBException;

    default Object get(Object key) throws CacheDBException {
        return get(key, null);
    }

    /**
     * Live entries among {@code keys}; missing ones are left out.
     */
    Map<Object, Object> getMany(Collection<?> keys) throws CacheDBException;

    Number incr(Object key, Number delta) throws CacheDBException;

    default Number incr(Object key) throws CacheDBException {
        return incr(key, 1L);
    }

    Number decr(Object key, Number delta) throws CacheDBException;

    default Number decr(Object key) throws CacheDBException {
        return decr(key, 1L);
    }

    boolean touch(Object key, Duration timeout) throws CacheDBException;

    boolean delete(Object key) throws CacheDBException;

    Object pop(Object key, Object defaultValue) throws CacheDBException;

    default Object pop(Object key) throws CacheDBException {
        return pop(key, null);
    }

    /**
     * Seconds left to live: {@code -1} when absent or expired, {@code null} when
     * the entry never expires.
     */
    Double ttl(Object key) throws CacheDBException;

    Optional<CacheRecord> inspect(Object key) throws CacheDBException;

    boolean exists(Object key) throws CacheDBException;

    Iterable<Object> keys() throws CacheDBException;

    Iterable<Object> values() throws CacheDBException;

    Iterable<Map.Entry<Object, Object>> items() throws CacheDBException;

    boolean clear() throws CacheDBException;

    /**
     * Approximate number of live entries.
     */
    long size();

    @Override
    void close() throws CacheDBException;
}
