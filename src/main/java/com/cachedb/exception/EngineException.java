package com.cachedb.exception;

/**
 * An SQL operation that was expected to succeed failed or touched no rows.
 */
public class EngineException extends CacheDBException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
