package com.cachedb.cache;

import com.cachedb.exception.CacheDBException;
import com.cachedb.exception.UncheckedCacheDBException;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Wraps computations so their results are served from a cache until they expire.
 * Numbers come back in their stored form ({@link Long} / {@link Double}).
 */
public final class Memoizer {
    private static final Object MISSING = new Object();

    private Memoizer() {
    }

    public static <T> Supplier<T> memoize(Cache cache, Object key, Duration timeout, Supplier<? extends T> loader) {
        return () -> lookupOrLoad(cache, key, timeout, loader);
    }

    /**
     * Caches each distinct argument under {@code name + ":" + argument}.
     */
    public static <A, T> Function<A, T> memoize(Cache cache, String name, Duration timeout,
                                                Function<? super A, ? extends T> function) {
        return argument -> lookupOrLoad(cache, name + ":" + argument, timeout, () -> function.apply(argument));
    }

    @SuppressWarnings("unchecked")
    private static <T> T lookupOrLoad(Cache cache, Object key, Duration timeout, Supplier<? extends T> loader) {
        try {
            Object cached = cache.get(key, MISSING);
            if (cached != MISSING) {
                return (T) cached;
            }
            T value = loader.get();
            cache.set(key, value, timeout);
            return value;
        } catch (CacheDBException e) {
            throw new UncheckedCacheDBException(e);
        }
    }
}
