package com.cachedb.exception;

/**
 * Base checked exception for CacheDB operations
 */
public class CacheDBException extends Exception {

    public CacheDBException(String message) {
        super(message);
    }

    public CacheDBException(String message, Throwable cause) {
        super(message, cause);
    }

    public CacheDBException(Throwable cause) {
        super(cause);
    }
}
