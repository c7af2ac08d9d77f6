package com.cachedb.core;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Cheap running count of live rows in one namespace.
 *
 * Only the in-memory numbers are guarded here; other processes writing the same
 * store are not seen until the next {@link #align(long)}.
 */
public class ApproximateCounter {
    static final long MIN_SPIN_LIMIT = 1 << 10;

    private final long maxSize;
    private final long spinLimit;
    private final ReentrantLock lock;
    private long count;
    private long spins;

    public ApproximateCounter(long maxSize) {
        this.maxSize = maxSize;
        this.spinLimit = Math.max(maxSize / 10, MIN_SPIN_LIMIT);
        this.lock = new ReentrantLock();
    }

    /**
     * Applies {@code delta} to the count.
     *
     * @return false when eviction should run now: the count went over
     *         {@code maxSize} or too many writes happened since the last alignment
     */
    public boolean add(long delta) {
        lock.lock();
        try {
            count = Math.max(0, count + delta);
            spins++;
            return count <= maxSize && spins <= spinLimit;
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        align(0);
    }

    /**
     * Replaces the count with an authoritative value and restarts the spin window.
     */
    public void align(long authoritative) {
        lock.lock();
        try {
            count = Math.max(0, authoritative);
            spins = 0;
        } finally {
            lock.unlock();
        }
    }

    public boolean spinExceeded() {
        lock.lock();
        try {
            return spins > spinLimit;
        } finally {
            lock.unlock();
        }
    }

    public long count() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

    public long getMaxSize() { return maxSize; }
    public long getSpinLimit() { return spinLimit; }

    @Override
    public String toString() {
        return "ApproximateCounter{count=" + count() + ", maxSize=" + maxSize + ", spinLimit=" + spinLimit + "}";
    }
}
