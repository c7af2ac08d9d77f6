package com.cachedb.cache;

import com.cachedb.store.StoreFormat;

/**
 * Raw view of one cache row
 */
public class CacheRecord {
    private final Object key;
    private final Object storedKey;
    private final StoreFormat keyFormat;
    private final Object value;
    private final Object storedValue;
    private final StoreFormat valueFormat;
    private final double storeTime;
    private final Double expireTime;
    private final double lastAccessTime;
    private final long accessCount;

    public CacheRecord(Object key, Object storedKey, StoreFormat keyFormat,
                       Object value, Object storedValue, StoreFormat valueFormat,
                       double storeTime, Double expireTime, double lastAccessTime, long accessCount) {
        this.key = key;
        this.storedKey = storedKey;
        this.keyFormat = keyFormat;
        this.value = value;
        this.storedValue = storedValue;
        this.valueFormat = valueFormat;
        this.storeTime = storeTime;
        this.expireTime = expireTime;
        this.lastAccessTime = lastAccessTime;
        this.accessCount = accessCount;
    }

    public Object getKey() { return key; }
    public Object getStoredKey() { return storedKey; }
    public StoreFormat getKeyFormat() { return keyFormat; }
    public Object getValue() { return value; }
    public Object getStoredValue() { return storedValue; }
    public StoreFormat getValueFormat() { return valueFormat; }
    public double getStoreTime() { return storeTime; }
    public Double getExpireTime() { return expireTime; }
    public double getLastAccessTime() { return lastAccessTime; }
    public long getAccessCount() { return accessCount; }

    public boolean isExpired(double now) {
        return expireTime != null && expireTime <= now;
    }

    @Override
    public String toString() {
        return String.format("CacheRecord{key=%s, keyFormat=%s, valueFormat=%s, store=%.3f, expire=%s, "
                        + "access=%.3f, accessCount=%d}",
                key, keyFormat, valueFormat, storeTime, expireTime, lastAccessTime, accessCount);
    }
}
