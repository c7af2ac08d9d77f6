package com.cachedb.exception;

import java.time.Duration;

/**
 * The write lock of a store could not be acquired within the configured window.
 */
public class LockTimeoutException extends CacheDBException {
    private final Duration timeout;

    public LockTimeoutException(Duration timeout, Throwable cause) {
        super("Transaction lock not acquired within " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() { return timeout; }
}
