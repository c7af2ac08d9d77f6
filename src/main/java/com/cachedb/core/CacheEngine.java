package com.cachedb.core;

import com.cachedb.cache.Cache;
import com.cachedb.cache.CacheRecord;
import com.cachedb.cache.eviction.EvictionPolicies;
import com.cachedb.cache.eviction.EvictionPolicy;
import com.cachedb.config.CacheDBConfig;
import com.cachedb.exception.CacheDBException;
import com.cachedb.exception.EngineException;
import com.cachedb.exception.KeyNotFoundException;
import com.cachedb.exception.TypeMismatchException;
import com.cachedb.exception.UncheckedCacheDBException;
import com.cachedb.storage.SQLiteStorageManager;
import com.cachedb.store.JsonObjectCodec;
import com.cachedb.store.ObjectCodec;
import com.cachedb.store.OverflowFileStore;
import com.cachedb.store.OverflowReferences;
import com.cachedb.store.StoreFormat;
import com.cachedb.store.StoredValue;
import com.cachedb.store.ValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Durable cache for one namespace: one SQLite store file plus shared overflow files.
 *
 * Every public operation is a single statement or a single transaction. Expired
 * rows stay on disk until an eviction sweep removes them but are never returned.
 */
public class CacheEngine implements Cache {
    private static final Logger logger = LoggerFactory.getLogger(CacheEngine.class);

    static final String POLICY_KEY = "eviction_policy";

    private static final Object MISSING = new Object();
    private static final String LIVE = "(expire_time IS NULL OR expire_time > ?)";
    private static final String ROW_COLUMNS = "rowid, key, key_format, value, value_format, "
            + "store_time, expire_time, last_access_time, access_count";

    private final CacheDBConfig config;
    private final SQLiteStorageManager storage;
    private final ValueStore store;
    private final ApproximateCounter counter;
    private final EvictionPolicy evictionPolicy;
    private final Clock clock;
    private final int evictBatch;

    public CacheEngine(CacheDBConfig config) throws CacheDBException {
        this(config, new JsonObjectCodec());
    }

    public CacheEngine(CacheDBConfig config, ObjectCodec codec) throws CacheDBException {
        this.config = config;
        this.evictionPolicy = EvictionPolicies.resolve(config.getEvictionPolicy());
        this.clock = config.getClock();
        this.store = new ValueStore(new OverflowFileStore(config.getDirectory()), codec,
                config.getRawMaxSize(), config.getCharset());
        this.counter = new ApproximateCounter(config.getMaxSize());
        this.evictBatch = (int) Math.min(Integer.MAX_VALUE, Math.max(config.getMaxSize() / 100, 2));
        this.storage = new SQLiteStorageManager(config);

        releaseAll(storage.drainOrphanedReferences());
        try {
            installEvictionPolicy();
            counter.align(storage.countLive(now()));
        } catch (CacheDBException | RuntimeException e) {
            storage.close();
            throw e;
        }
        logger.info("Opened cache {} (policy={}, maxSize={}, live={})",
                storage.getPath(), evictionPolicy.name(), config.getMaxSize(), counter.count());
    }

    private void installEvictionPolicy() throws CacheDBException {
        Optional<String> previous = storage.meta(POLICY_KEY);
        if (previous.isPresent() && previous.get().equals(evictionPolicy.name())) {
            return;
        }
        storage.transact(connection -> {
            EvictionPolicies.install(connection, evictionPolicy);
            storage.meta(POLICY_KEY, evictionPolicy.name());
            return null;
        });
        logger.info("Eviction policy of {} set to {} (was {})",
                storage.getPath(), evictionPolicy.name(), previous.orElse("none"));
    }

    @Override
    public boolean set(Object key, Object value, Duration timeout) throws CacheDBException {
        return write(key, value, timeout, false);
    }

    @Override
    public boolean exSet(Object key, Object value, Duration timeout) throws CacheDBException {
        return write(key, value, timeout, true);
    }

    private boolean write(Object key, Object value, Duration timeout, boolean onlyIfAbsent)
            throws CacheDBException {
        StoredValue storedKey = probe(key);
        StoredValue storedValue = dump(value);
        List<StoredValue> acquired = new ArrayList<>();
        List<StoredValue> released = new ArrayList<>();
        OverflowReferences.addIfFile(acquired, storedValue.getPayload(), storedValue.getFormat());

        boolean written;
        try {
            written = storage.transact(connection -> {
                double now = now();
                Double expire = expireAt(timeout, now);
                Row row = findRow(connection, storedKey);

                if (row != null) {
                    boolean expired = row.isExpired(now);
                    if (onlyIfAbsent && !expired) {
                        return false;
                    }
                    if (expired) {
                        resetRow(connection, row.rowid, storedValue, now, expire);
                    } else {
                        updateRow(connection, row.rowid, storedValue, now, expire);
                    }
                    OverflowReferences.addIfFile(released, row.value, row.valueFormat);
                    return true;
                }

                StoredValue rowKey = storedKey;
                if (storedKey.getFormat().isFile()) {
                    rowKey = dump(key);
                    acquired.add(rowKey);
                }
                insertRow(connection, rowKey, storedValue, now, expire);
                if (!counter.add(1)) {
                    sweep(connection, now, released);
                }
                return true;
            });
        } catch (CacheDBException | RuntimeException e) {
            releaseAll(acquired);
            throw e;
        }

        if (!written) {
            releaseAll(acquired);
        }
        releaseAll(released);
        return written;
    }

    @Override
    public Object get(Object key, Object defaultValue) throws CacheDBException {
        StoredValue storedKey = probe(key);
        List<StoredValue> released = new ArrayList<>();
        Object value = storage.transact(connection -> lookup(connection, storedKey, now(), released));
        releaseAll(released);
        return value == MISSING ? defaultValue : value;
    }

    @Override
    public Map<Object, Object> getMany(Collection<?> keys) throws CacheDBException {
        List<Object> originals = new ArrayList<>(keys);
        List<StoredValue> storedKeys = new ArrayList<>(originals.size());
        for (Object key : originals) {
            storedKeys.add(probe(key));
        }
        List<StoredValue> released = new ArrayList<>();
        Map<Object, Object> result = storage.transact(connection -> {
            double now = now();
            Map<Object, Object> found = new LinkedHashMap<>();
            for (int i = 0; i < originals.size(); i++) {
                Object value = lookup(connection, storedKeys.get(i), now, released);
                if (value != MISSING) {
                    found.put(originals.get(i), value);
                }
            }
            return found;
        });
        releaseAll(released);
        return result;
    }

    /**
     * Reads a live value and records the access; a row whose overflow file is gone
     * is deleted and reported as missing.
     */
    private Object lookup(Connection connection, StoredValue storedKey, double now, List<StoredValue> released)
            throws SQLException, CacheDBException {
        Row row = findRow(connection, storedKey);
        if (row == null || row.isExpired(now)) {
            return MISSING;
        }
        Object value = load(row.value, row.valueFormat);
        if (value == ValueStore.ABSENT) {
            removeRow(connection, row, released);
            return MISSING;
        }
        recordAccess(connection, row.rowid, now);
        return value;
    }

    @Override
    public Number incr(Object key, Number delta) throws CacheDBException {
        requireNumber(delta);
        StoredValue storedKey = probe(key);
        return storage.transact(connection -> {
            Row row = findRow(connection, storedKey);
            if (row == null || row.isExpired(now())) {
                throw new KeyNotFoundException(key);
            }
            if (row.valueFormat != StoreFormat.NUMBER) {
                throw new TypeMismatchException("Cannot add " + delta.getClass().getSimpleName()
                        + " to a non-numeric value stored under " + key);
            }
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE cache SET value = value + ? WHERE rowid = ?")) {
                new StoredValue(delta, StoreFormat.NUMBER).bind(statement, 1);
                statement.setLong(2, row.rowid);
                expectOne(statement.executeUpdate(), "increment " + key);
            }
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT value FROM cache WHERE rowid = ?")) {
                statement.setLong(1, row.rowid);
                try (ResultSet rs = statement.executeQuery()) {
                    if (!rs.next()) {
                        throw new EngineException("Row of " + key + " vanished during increment");
                    }
                    return (Number) load(rs.getObject(1), StoreFormat.NUMBER);
                }
            }
        });
    }

    @Override
    public Number decr(Object key, Number delta) throws CacheDBException {
        requireNumber(delta);
        if (delta instanceof Double || delta instanceof Float) {
            return incr(key, Double.valueOf(-delta.doubleValue()));
        }
        return incr(key, Long.valueOf(-delta.longValue()));
    }

    @Override
    public boolean touch(Object key, Duration timeout) throws CacheDBException {
        StoredValue storedKey = probe(key);
        return storage.transact(connection -> {
            double now = now();
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE cache SET expire_time = ? WHERE key = ? AND key_format = ? AND " + LIVE)) {
                bindNullableDouble(statement, 1, expireAt(timeout, now));
                storedKey.bind(statement, 2);
                statement.setInt(3, storedKey.getFormat().getCode());
                statement.setDouble(4, now);
                return statement.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean delete(Object key) throws CacheDBException {
        StoredValue storedKey = probe(key);
        List<StoredValue> released = new ArrayList<>();
        boolean deleted = storage.transact(connection -> {
            Row row = findRow(connection, storedKey);
            if (row == null) {
                return false;
            }
            removeRow(connection, row, released);
            return true;
        });
        releaseAll(released);
        return deleted;
    }

    @Override
    public Object pop(Object key, Object defaultValue) throws CacheDBException {
        StoredValue storedKey = probe(key);
        List<StoredValue> released = new ArrayList<>();
        Object value = storage.transact(connection -> {
            Row row = findRow(connection, storedKey);
            if (row == null || row.isExpired(now())) {
                return MISSING;
            }
            Object loaded = load(row.value, row.valueFormat);
            removeRow(connection, row, released);
            return loaded == ValueStore.ABSENT ? MISSING : loaded;
        });
        releaseAll(released);
        return value == MISSING ? defaultValue : value;
    }

    /**
     * Also counts as an access of the entry.
     */
    @Override
    public Double ttl(Object key) throws CacheDBException {
        StoredValue storedKey = probe(key);
        return storage.transact(connection -> {
            double now = now();
            Row row = findRow(connection, storedKey);
            if (row == null || row.isExpired(now)) {
                return -1.0;
            }
            recordAccess(connection, row.rowid, now);
            return row.expireTime == null ? null : row.expireTime - now;
        });
    }

    /**
     * The stored row for {@code key}, expired or not.
     */
    @Override
    public Optional<CacheRecord> inspect(Object key) throws CacheDBException {
        StoredValue storedKey = probe(key);
        Row row = storage.read(connection -> findRow(connection, storedKey));
        if (row == null) {
            return Optional.empty();
        }
        Object loadedKey = load(row.key, row.keyFormat);
        Object value = load(row.value, row.valueFormat);
        return Optional.of(new CacheRecord(loadedKey == ValueStore.ABSENT ? null : loadedKey, row.key, row.keyFormat,
                value == ValueStore.ABSENT ? null : value, row.value, row.valueFormat,
                row.storeTime, row.expireTime, row.lastAccessTime, row.accessCount));
    }

    @Override
    public boolean exists(Object key) throws CacheDBException {
        StoredValue storedKey = probe(key);
        return storage.read(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT 1 FROM cache WHERE key = ? AND key_format = ? AND " + LIVE)) {
                storedKey.bind(statement, 1);
                statement.setInt(2, storedKey.getFormat().getCode());
                statement.setDouble(3, now());
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public Iterable<Object> keys() {
        return () -> new ScanIterator<>(true, false);
    }

    @Override
    public Iterable<Object> values() {
        return () -> new ScanIterator<>(false, true);
    }

    @Override
    public Iterable<Map.Entry<Object, Object>> items() {
        return () -> new ScanIterator<>(true, true);
    }

    @Override
    public boolean clear() throws CacheDBException {
        List<StoredValue> released = new ArrayList<>();
        int removed = storage.transact(connection -> {
            released.addAll(OverflowReferences.collect(connection, "1 = 1"));
            try (PreparedStatement statement = connection.prepareStatement("DELETE FROM cache")) {
                int count = statement.executeUpdate();
                counter.reset();
                return count;
            }
        });
        releaseAll(released);
        logger.debug("Cleared {} rows from {}", removed, storage.getPath());
        return true;
    }

    @Override
    public long size() {
        return counter.count();
    }

    @Override
    public void close() {
        storage.close();
    }

    /**
     * Releases every overflow reference held by this namespace, then deletes its store files.
     */
    public void destroy() throws CacheDBException {
        List<StoredValue> released = storage.read(connection -> OverflowReferences.collect(connection, "1 = 1"));
        releaseAll(released);
        storage.destroy();
    }

    /**
     * Two-phase sweep run when the counter signals: drop expired rows, then, if the
     * namespace is still full, let the eviction policy remove a batch.
     */
    private void sweep(Connection connection, double now, List<StoredValue> released) throws SQLException {
        String expiredRows = "expire_time IS NOT NULL AND expire_time <= ?";
        released.addAll(OverflowReferences.collect(connection, expiredRows, now));
        int expired;
        try (PreparedStatement statement = connection.prepareStatement("DELETE FROM cache WHERE " + expiredRows)) {
            statement.setDouble(1, now);
            expired = statement.executeUpdate();
        }
        counter.add(-expired);
        if (counter.spinExceeded()) {
            counter.align(countLive(connection, now));
        }

        int evicted = 0;
        if (counter.count() >= config.getMaxSize()) {
            evicted = evictionPolicy.run(connection, evictBatch, released);
            counter.add(-evicted);
        }
        logger.debug("Sweep of {}: {} expired, {} evicted by {}, ~{} live",
                storage.getPath(), expired, evicted, evictionPolicy.name(), counter.count());
    }

    private static long countLive(Connection connection, double now) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT COUNT(*) FROM cache WHERE " + LIVE)) {
            statement.setDouble(1, now);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    private static Row findRow(Connection connection, StoredValue storedKey) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT " + ROW_COLUMNS + " FROM cache WHERE key = ? AND key_format = ?")) {
            storedKey.bind(statement, 1);
            statement.setInt(2, storedKey.getFormat().getCode());
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Row.from(rs) : null;
            }
        }
    }

    private static void insertRow(Connection connection, StoredValue key, StoredValue value,
                                  double now, Double expire) throws SQLException, EngineException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO cache(key, key_format, value, value_format, store_time, expire_time, "
                        + "last_access_time, access_count) VALUES (?, ?, ?, ?, ?, ?, ?, 0)")) {
            key.bind(statement, 1);
            statement.setInt(2, key.getFormat().getCode());
            value.bind(statement, 3);
            statement.setInt(4, value.getFormat().getCode());
            statement.setDouble(5, now);
            bindNullableDouble(statement, 6, expire);
            statement.setDouble(7, now);
            expectOne(statement.executeUpdate(), "insert");
        }
    }

    // expired row: start over as if freshly inserted
    private static void resetRow(Connection connection, long rowid, StoredValue value,
                                 double now, Double expire) throws SQLException, EngineException {
        try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE cache SET value = ?, value_format = ?, store_time = ?, expire_time = ?, "
                        + "last_access_time = ?, access_count = 0 WHERE rowid = ?")) {
            value.bind(statement, 1);
            statement.setInt(2, value.getFormat().getCode());
            statement.setDouble(3, now);
            bindNullableDouble(statement, 4, expire);
            statement.setDouble(5, now);
            statement.setLong(6, rowid);
            expectOne(statement.executeUpdate(), "reset");
        }
    }

    // live row: store_time is kept so FIFO order reflects the first insertion
    private static void updateRow(Connection connection, long rowid, StoredValue value,
                                  double now, Double expire) throws SQLException, EngineException {
        try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE cache SET value = ?, value_format = ?, expire_time = ?, "
                        + "last_access_time = ?, access_count = access_count + 1 WHERE rowid = ?")) {
            value.bind(statement, 1);
            statement.setInt(2, value.getFormat().getCode());
            bindNullableDouble(statement, 3, expire);
            statement.setDouble(4, now);
            statement.setLong(5, rowid);
            expectOne(statement.executeUpdate(), "update");
        }
    }

    private static void recordAccess(Connection connection, long rowid, double now)
            throws SQLException, EngineException {
        try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE cache SET access_count = access_count + 1, last_access_time = ? WHERE rowid = ?")) {
            statement.setDouble(1, now);
            statement.setLong(2, rowid);
            expectOne(statement.executeUpdate(), "record access");
        }
    }

    private void removeRow(Connection connection, Row row, List<StoredValue> released)
            throws SQLException, EngineException {
        try (PreparedStatement statement = connection.prepareStatement("DELETE FROM cache WHERE rowid = ?")) {
            statement.setLong(1, row.rowid);
            expectOne(statement.executeUpdate(), "delete");
        }
        counter.add(-1);
        OverflowReferences.addIfFile(released, row.key, row.keyFormat);
        OverflowReferences.addIfFile(released, row.value, row.valueFormat);
    }

    private static void expectOne(int affected, String operation) throws EngineException {
        if (affected != 1) {
            throw new EngineException("Expected one row for " + operation + " but " + affected + " changed");
        }
    }

    private static void bindNullableDouble(PreparedStatement statement, int index, Double value)
            throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.REAL);
        } else {
            statement.setDouble(index, value);
        }
    }

    private static void requireNumber(Number delta) throws TypeMismatchException {
        if (!(delta instanceof Long || delta instanceof Integer || delta instanceof Short
                || delta instanceof Byte || delta instanceof Double || delta instanceof Float)) {
            throw new TypeMismatchException("Unsupported delta: "
                    + (delta == null ? "null" : delta.getClass().getName()));
        }
    }

    private StoredValue probe(Object key) throws EngineException {
        try {
            return store.probe(key);
        } catch (IOException e) {
            throw new EngineException("Cannot serialize key " + key, e);
        }
    }

    private StoredValue dump(Object value) throws EngineException {
        try {
            return store.dump(value);
        } catch (IOException e) {
            throw new EngineException("Cannot serialize value of type "
                    + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    private Object load(Object payload, StoreFormat format) throws EngineException {
        try {
            return store.load(payload, format);
        } catch (IOException | RuntimeException e) {
            throw new EngineException("Cannot deserialize " + format + " payload", e);
        }
    }

    // file references are released after commit; a failure only leaves a stray file behind
    private void releaseAll(List<StoredValue> refs) {
        for (StoredValue ref : refs) {
            try {
                store.release(ref);
            } catch (IOException e) {
                logger.warn("Failed to release overflow file {}: {}", ref.getPayload(), e.getMessage());
            }
        }
    }

    private double now() {
        return clock.millis() / 1000.0;
    }

    private static Double expireAt(Duration timeout, double now) {
        if (timeout == null) {
            return null;
        }
        return now + timeout.getSeconds() + timeout.getNano() / 1e9;
    }

    public CacheDBConfig getConfig() { return config; }
    public SQLiteStorageManager getStorage() { return storage; }
    public EvictionPolicy getEvictionPolicy() { return evictionPolicy; }
    public ApproximateCounter getCounter() { return counter; }

    @Override
    public String toString() {
        return "CacheEngine{" + storage.getPath() + "}";
    }

    private static final class Row {
        private long rowid;
        private Object key;
        private StoreFormat keyFormat;
        private Object value;
        private StoreFormat valueFormat;
        private double storeTime;
        private Double expireTime;
        private double lastAccessTime;
        private long accessCount;

        static Row from(ResultSet rs) throws SQLException {
            Row row = new Row();
            row.rowid = rs.getLong(1);
            row.key = rs.getObject(2);
            row.keyFormat = StoreFormat.fromCode(rs.getInt(3));
            row.value = rs.getObject(4);
            row.valueFormat = StoreFormat.fromCode(rs.getInt(5));
            row.storeTime = rs.getDouble(6);
            row.expireTime = rs.getObject(7) == null ? null : rs.getDouble(7);
            row.lastAccessTime = rs.getDouble(8);
            row.accessCount = rs.getLong(9);
            return row;
        }

        boolean isExpired(double now) {
            return expireTime != null && expireTime <= now;
        }
    }

    /**
     * Pages through live rows in store order, {@code iterSize} rows per query.
     * Rows whose overflow content is gone are deleted as they are met.
     */
    private final class ScanIterator<T> implements Iterator<T> {
        private final boolean withKeys;
        private final boolean withValues;
        private final double snapshot;
        private final Deque<Object> buffer = new ArrayDeque<>();
        private long offset;
        private boolean exhausted;

        ScanIterator(boolean withKeys, boolean withValues) {
            this.withKeys = withKeys;
            this.withValues = withValues;
            this.snapshot = now();
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !exhausted) {
                try {
                    fetch();
                } catch (CacheDBException e) {
                    throw new UncheckedCacheDBException(e);
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        @SuppressWarnings("unchecked")
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return (T) buffer.poll();
        }

        private void fetch() throws CacheDBException {
            int pageSize = config.getIterSize();
            List<Row> rows = storage.read(connection -> {
                try (PreparedStatement statement = connection.prepareStatement(
                        "SELECT " + ROW_COLUMNS + " FROM cache WHERE " + LIVE
                                + " ORDER BY store_time, rowid LIMIT ? OFFSET ?")) {
                    statement.setDouble(1, snapshot);
                    statement.setInt(2, pageSize);
                    statement.setLong(3, offset);
                    List<Row> page = new ArrayList<>();
                    try (ResultSet rs = statement.executeQuery()) {
                        while (rs.next()) {
                            page.add(Row.from(rs));
                        }
                    }
                    return page;
                }
            });
            if (rows.size() < pageSize) {
                exhausted = true;
            }

            int removed = 0;
            for (Row row : rows) {
                Object key = withKeys ? load(row.key, row.keyFormat) : null;
                Object value = withValues ? load(row.value, row.valueFormat) : null;
                boolean broken = key == ValueStore.ABSENT || value == ValueStore.ABSENT
                        || (!withKeys && !store.isPresent(row.key, row.keyFormat))
                        || (!withValues && !store.isPresent(row.value, row.valueFormat));
                if (broken) {
                    if (removeTombstone(row)) {
                        removed++;
                    }
                    continue;
                }
                if (withKeys && withValues) {
                    buffer.add(new AbstractMap.SimpleImmutableEntry<>(key, value));
                } else {
                    buffer.add(withKeys ? key : value);
                }
            }
            // deleted rows no longer occupy the window
            offset += rows.size() - removed;
        }

        private boolean removeTombstone(Row row) throws CacheDBException {
            List<StoredValue> released = new ArrayList<>();
            boolean removed = storage.transact(connection -> {
                Row current = findRow(connection, new StoredValue(row.key, row.keyFormat));
                if (current == null || current.rowid != row.rowid) {
                    return false;
                }
                removeRow(connection, current, released);
                return true;
            });
            releaseAll(released);
            return removed;
        }
    }
}
