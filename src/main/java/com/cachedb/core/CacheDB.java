package com.cachedb.core;

import com.cachedb.cache.Cache;
import com.cachedb.cache.CacheRecord;
import com.cachedb.config.CacheDBConfig;
import com.cachedb.exception.CacheDBException;
import com.cachedb.exception.EngineException;
import com.cachedb.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main CacheDB entry point. Routes every operation to the {@link CacheEngine}
 * of a tag; untagged calls go to {@link CacheDBConfig#DEFAULT_TAG}.
 *
 * Each tag is stored in its own file {@code <directory>/<tag>:<name>}, opened
 * the first time the tag is used.
 */
public class CacheDB implements Cache {
    private static final Logger logger = LoggerFactory.getLogger(CacheDB.class);

    private final CacheDBConfig config;
    private final ConcurrentMap<String, CacheEngine> engines;
    private final ReentrantLock engineLock;
    private volatile boolean closed = false;

    public CacheDB(CacheDBConfig config) {
        this.config = config;
        this.engines = new ConcurrentHashMap<>();
        this.engineLock = new ReentrantLock();
    }

    /**
     * The engine for {@code tag}, opening its store on first use.
     */
    public CacheEngine engine(String tag) throws CacheDBException {
        validateTag(tag);
        CacheEngine engine = engines.get(tag);
        if (engine != null) {
            return engine;
        }

        engineLock.lock();
        try {
            if (closed) {
                throw new EngineException("CacheDB is closed: " + config.getDirectory());
            }
            engine = engines.get(tag);
            if (engine == null) {
                engine = new CacheEngine(tagConfig(tag));
                engines.put(tag, engine);
                logger.debug("Opened namespace {}", tag);
            }
            return engine;
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Releases the overflow files held by {@code tag}, closes its engine and
     * deletes its store.
     *
     * @return false if the tag has no store on disk
     */
    public boolean drop(String tag) throws CacheDBException {
        validateTag(tag);
        engineLock.lock();
        try {
            CacheDBConfig dropped = tagConfig(tag);
            CacheEngine engine = engines.remove(tag);
            if (engine == null) {
                if (!Files.exists(dropped.getStorePath())) {
                    return false;
                }
                engine = new CacheEngine(dropped);
            }
            engine.destroy();
            logger.info("Dropped namespace {}", tag);
            return true;
        } finally {
            engineLock.unlock();
        }
    }

    /**
     * Tags opened by this instance.
     */
    public Set<String> tags() {
        return Collections.unmodifiableSet(new TreeSet<>(engines.keySet()));
    }

    public CacheDBConfig getConfig() {
        return config;
    }

    // default tag

    @Override
    public boolean set(Object key, Object value, Duration timeout) throws CacheDBException {
        return set(CacheDBConfig.DEFAULT_TAG, key, value, timeout);
    }

    @Override
    public boolean exSet(Object key, Object value, Duration timeout) throws CacheDBException {
        return exSet(CacheDBConfig.DEFAULT_TAG, key, value, timeout);
    }

    @Override
    public Object get(Object key, Object defaultValue) throws CacheDBException {
        return get(CacheDBConfig.DEFAULT_TAG, key, defaultValue);
    }

    @Override
    public Map<Object, Object> getMany(Collection<?> keys) throws CacheDBException {
        return getMany(CacheDBConfig.DEFAULT_TAG, keys);
    }

    @Override
    public Number incr(Object key, Number delta) throws CacheDBException {
        return incr(CacheDBConfig.DEFAULT_TAG, key, delta);
    }

    @Override
    public Number decr(Object key, Number delta) throws CacheDBException {
        return decr(CacheDBConfig.DEFAULT_TAG, key, delta);
    }

    @Override
    public boolean touch(Object key, Duration timeout) throws CacheDBException {
        return touch(CacheDBConfig.DEFAULT_TAG, key, timeout);
    }

    @Override
    public boolean delete(Object key) throws CacheDBException {
        return delete(CacheDBConfig.DEFAULT_TAG, key);
    }

    @Override
    public Object pop(Object key, Object defaultValue) throws CacheDBException {
        return pop(CacheDBConfig.DEFAULT_TAG, key, defaultValue);
    }

    @Override
    public Double ttl(Object key) throws CacheDBException {
        return ttl(CacheDBConfig.DEFAULT_TAG, key);
    }

    @Override
    public Optional<CacheRecord> inspect(Object key) throws CacheDBException {
        return inspect(CacheDBConfig.DEFAULT_TAG, key);
    }

    @Override
    public boolean exists(Object key) throws CacheDBException {
        return exists(CacheDBConfig.DEFAULT_TAG, key);
    }

    @Override
    public Iterable<Object> keys() throws CacheDBException {
        return keys(CacheDBConfig.DEFAULT_TAG);
    }

    @Override
    public Iterable<Object> values() throws CacheDBException {
        return values(CacheDBConfig.DEFAULT_TAG);
    }

    @Override
    public Iterable<Map.Entry<Object, Object>> items() throws CacheDBException {
        return items(CacheDBConfig.DEFAULT_TAG);
    }

    /**
     * Clears every namespace opened so far.
     */
    @Override
    public boolean clear() throws CacheDBException {
        for (CacheEngine engine : engines.values()) {
            engine.clear();
        }
        return true;
    }

    /**
     * Sum of the approximate sizes of the open namespaces.
     */
    @Override
    public long size() {
        long total = 0;
        for (CacheEngine engine : engines.values()) {
            total += engine.size();
        }
        return total;
    }

    @Override
    public void close() {
        engineLock.lock();
        try {
            closed = true;
            for (CacheEngine engine : engines.values()) {
                engine.close();
            }
            engines.clear();
        } finally {
            engineLock.unlock();
        }
    }

    // tagged

    public boolean set(String tag, Object key, Object value, Duration timeout) throws CacheDBException {
        return engine(tag).set(key, value, timeout);
    }

    public boolean exSet(String tag, Object key, Object value, Duration timeout) throws CacheDBException {
        return engine(tag).exSet(key, value, timeout);
    }

    public Object get(String tag, Object key, Object defaultValue) throws CacheDBException {
        return engine(tag).get(key, defaultValue);
    }

    public Map<Object, Object> getMany(String tag, Collection<?> keys) throws CacheDBException {
        return engine(tag).getMany(keys);
    }

    public Number incr(String tag, Object key, Number delta) throws CacheDBException {
        return engine(tag).incr(key, delta);
    }

    public Number decr(String tag, Object key, Number delta) throws CacheDBException {
        return engine(tag).decr(key, delta);
    }

    public boolean touch(String tag, Object key, Duration timeout) throws CacheDBException {
        return engine(tag).touch(key, timeout);
    }

    public boolean delete(String tag, Object key) throws CacheDBException {
        return engine(tag).delete(key);
    }

    public Object pop(String tag, Object key, Object defaultValue) throws CacheDBException {
        return engine(tag).pop(key, defaultValue);
    }

    public Double ttl(String tag, Object key) throws CacheDBException {
        return engine(tag).ttl(key);
    }

    public Optional<CacheRecord> inspect(String tag, Object key) throws CacheDBException {
        return engine(tag).inspect(key);
    }

    public boolean exists(String tag, Object key) throws CacheDBException {
        return engine(tag).exists(key);
    }

    public Iterable<Object> keys(String tag) throws CacheDBException {
        return engine(tag).keys();
    }

    public Iterable<Object> values(String tag) throws CacheDBException {
        return engine(tag).values();
    }

    public Iterable<Map.Entry<Object, Object>> items(String tag) throws CacheDBException {
        return engine(tag).items();
    }

    /**
     * Clears {@code tag}; a tag with no store on disk is left uncreated.
     */
    public boolean clear(String tag) throws CacheDBException {
        CacheEngine engine = existingEngine(tag);
        return engine == null || engine.clear();
    }

    /**
     * Size of {@code tag}; 0 for a tag with no store on disk, which stays uncreated.
     */
    public long size(String tag) throws CacheDBException {
        CacheEngine engine = existingEngine(tag);
        return engine == null ? 0L : engine.size();
    }

    private CacheEngine existingEngine(String tag) throws CacheDBException {
        validateTag(tag);
        CacheEngine engine = engines.get(tag);
        if (engine != null) {
            return engine;
        }
        if (!Files.exists(tagConfig(tag).getStorePath())) {
            return null;
        }
        return engine(tag);
    }

    private CacheDBConfig tagConfig(String tag) {
        return config.withName(tag + ":" + config.getName());
    }

    private static void validateTag(String tag) {
        if (tag == null || tag.isEmpty()) {
            throw new ValidationException("Tag must not be empty");
        }
        if (tag.indexOf('/') >= 0 || tag.indexOf('\\') >= 0 || tag.indexOf(':') >= 0
                || tag.equals(".") || tag.equals("..")) {
            throw new ValidationException("Tag must be a plain file name component: " + tag);
        }
    }
}
