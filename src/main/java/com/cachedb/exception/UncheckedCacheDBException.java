package com.cachedb.exception;

/**
 * Wraps a {@link CacheDBException} where the calling API cannot declare it,
 * e.g. inside an {@link java.util.Iterator}.
 */
public class UncheckedCacheDBException extends RuntimeException {

    public UncheckedCacheDBException(CacheDBException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized CacheDBException getCause() {
        return (CacheDBException) super.getCause();
    }
}
