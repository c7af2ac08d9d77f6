package com.cachedb.cache;

import com.cachedb.exception.CacheDBException;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A cache whose backing store is opened on first use.
 */
public class LazyCache implements Cache {
    private final CacheFactory factory;
    private final ReentrantLock initLock;
    private volatile Cache delegate;

    public LazyCache(CacheFactory factory) {
        this.factory = factory;
        this.initLock = new ReentrantLock();
    }

    public boolean isInitialized() {
        return delegate != null;
    }

    Cache delegate() throws CacheDBException {
        Cache cache = delegate;
        if (cache != null) {
            return cache;
        }
        initLock.lock();
        try {
            if (delegate == null) {
                delegate = factory.create();
            }
            return delegate;
        } finally {
            initLock.unlock();
        }
    }

    @Override
    public boolean set(Object key, Object value, Duration timeout) throws CacheDBException {
        return delegate().set(key, value, timeout);
    }

    @Override
    public boolean exSet(Object key, Object value, Duration timeout) throws CacheDBException {
        return delegate().exSet(key, value, timeout);
    }

    @Override
    public Object get(Object key, Object defaultValue) throws CacheDBException {
        return delegate().get(key, defaultValue);
    }

    @Override
    public Map<Object, Object> getMany(Collection<?> keys) throws CacheDBException {
        return delegate().getMany(keys);
    }

    @Override
    public Number incr(Object key, Number delta) throws CacheDBException {
        return delegate().incr(key, delta);
    }

    @Override
    public Number decr(Object key, Number delta) throws CacheDBException {
        return delegate().decr(key, delta);
    }

    @Override
    public boolean touch(Object key, Duration timeout) throws CacheDBException {
        return delegate().touch(key, timeout);
    }

    @Override
    public boolean delete(Object key) throws CacheDBException {
        return delegate().delete(key);
    }

    @Override
    public Object pop(Object key, Object defaultValue) throws CacheDBException {
        return delegate().pop(key, defaultValue);
    }

    @Override
    public Double ttl(Object key) throws CacheDBException {
        return delegate().ttl(key);
    }

    @Override
    public Optional<CacheRecord> inspect(Object key) throws CacheDBException {
        return delegate().inspect(key);
    }

    @Override
    public boolean exists(Object key) throws CacheDBException {
        return delegate().exists(key);
    }

    @Override
    public Iterable<Object> keys() throws CacheDBException {
        return delegate().keys();
    }

    @Override
    public Iterable<Object> values() throws CacheDBException {
        return delegate().values();
    }

    @Override
    public Iterable<Map.Entry<Object, Object>> items() throws CacheDBException {
        return delegate().items();
    }

    @Override
    public boolean clear() throws CacheDBException {
        return delegate().clear();
    }

    /**
     * Zero until the backing cache has been opened.
     */
    @Override
    public long size() {
        Cache cache = delegate;
        return cache != null ? cache.size() : 0L;
    }

    @Override
    public void close() throws CacheDBException {
        Cache cache = delegate;
        if (cache != null) {
            cache.close();
        }
    }

    @Override
    public String toString() {
        Cache cache = delegate;
        return "LazyCache{" + (cache != null ? cache : "uninitialized") + "}";
    }
}
