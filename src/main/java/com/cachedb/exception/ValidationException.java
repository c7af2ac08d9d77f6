package com.cachedb.exception;

/**
 * Malformed configuration: bad directory, unknown eviction policy, invalid pragma set.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
