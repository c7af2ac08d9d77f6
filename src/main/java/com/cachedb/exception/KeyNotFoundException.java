package com.cachedb.exception;

/**
 * Raised by incr/decr when the key is absent or already expired.
 */
public class KeyNotFoundException extends CacheDBException {

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super("Key not found in cache: " + key);
        this.key = key;
    }

    public Object getKey() { return key; }
}
