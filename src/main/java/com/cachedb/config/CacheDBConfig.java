package com.cachedb.config;

import com.cachedb.exception.ValidationException;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Configuration for a CacheDB store directory and the namespaces inside it
 */
public class CacheDBConfig {
    public static final String DEFAULT_TAG = "default";
    public static final String DEFAULT_NAME = "default.sqlite3";
    public static final String DEFAULT_EVICTION_POLICY = "lru";

    private static final Pattern PRAGMA_NAME = Pattern.compile("[A-Za-z_]+");
    private static final Pattern PRAGMA_VALUE = Pattern.compile("-?[A-Za-z0-9_]+");

    private final Path directory;
    private final String name;
    private final long maxSize;
    private final int iterSize;
    private final String evictionPolicy;
    private final int rawMaxSize;
    private final Charset charset;
    private final Duration lockTimeout;
    private final Duration busyTimeout;
    private final Map<String, Object> pragmas;
    private final Clock clock;

    private CacheDBConfig(Path directory, String name, long maxSize, int iterSize, String evictionPolicy,
                          int rawMaxSize, Charset charset, Duration lockTimeout, Duration busyTimeout,
                          Map<String, Object> pragmas, Clock clock) {
        this.directory = directory;
        this.name = name;
        this.maxSize = maxSize;
        this.iterSize = iterSize;
        this.evictionPolicy = evictionPolicy;
        this.rawMaxSize = rawMaxSize;
        this.charset = charset;
        this.lockTimeout = lockTimeout;
        this.busyTimeout = busyTimeout;
        this.pragmas = Collections.unmodifiableMap(new LinkedHashMap<>(pragmas));
        this.clock = clock;
    }

    /**
     * SQLite pragmas applied to every new connection unless overridden.
     */
    public static Map<String, Object> defaultPragmas() {
        Map<String, Object> pragmas = new LinkedHashMap<>();
        pragmas.put("auto_vacuum", 1);
        pragmas.put("cache_size", 1 << 13); // 8,192 pages
        pragmas.put("journal_mode", "wal");
        pragmas.put("temp_store", 2);       // memory
        pragmas.put("mmap_size", 1 << 26);  // 64MB
        pragmas.put("synchronous", 1);
        return pragmas;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this configuration pointing at another store file in the same directory.
     */
    public CacheDBConfig withName(String newName) {
        requireName(newName);
        return new CacheDBConfig(directory, newName, maxSize, iterSize, evictionPolicy, rawMaxSize,
                charset, lockTimeout, busyTimeout, pragmas, clock);
    }

    public static class Builder {
        private Path directory = Paths.get(System.getProperty("user.home"), ".cachedb");
        private String name = DEFAULT_NAME;
        private long maxSize = 1L << 30;
        private int iterSize = 1 << 8;
        private String evictionPolicy = DEFAULT_EVICTION_POLICY;
        private int rawMaxSize = 1 << 17;
        private Charset charset = StandardCharsets.UTF_8;
        private Duration lockTimeout;
        private Duration busyTimeout = Duration.ofSeconds(5);
        private Map<String, Object> pragmas = defaultPragmas();
        private Clock clock = Clock.systemUTC();

        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        public Builder directory(String directory) {
            if (directory == null) {
                throw new ValidationException("directory must not be null");
            }
            String expanded = directory.startsWith("~")
                    ? System.getProperty("user.home") + directory.substring(1)
                    : directory;
            this.directory = Paths.get(expanded);
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder iterSize(int iterSize) {
            this.iterSize = iterSize;
            return this;
        }

        public Builder evictionPolicy(String policy) {
            this.evictionPolicy = policy;
            return this;
        }

        public Builder rawMaxSize(int rawMaxSize) {
            this.rawMaxSize = rawMaxSize;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        /**
         * Upper bound on waiting for a write lock; {@code null} retries forever.
         * A lock timeout shorter than {@link #busyTimeout(Duration)} also caps the
         * driver's busy wait.
         */
        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public Builder busyTimeout(Duration busyTimeout) {
            this.busyTimeout = busyTimeout;
            return this;
        }

        public Builder pragmas(Map<String, ?> pragmas) {
            if (pragmas == null) {
                throw new ValidationException("pragmas must be a map, got null");
            }
            this.pragmas = new LinkedHashMap<>(pragmas);
            return this;
        }

        public Builder pragma(String key, Object value) {
            this.pragmas.put(key, value);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CacheDBConfig build() {
            if (directory == null) {
                throw new ValidationException("directory must not be null");
            }
            requireName(name);
            if (maxSize <= 0) {
                throw new ValidationException("maxSize must be positive: " + maxSize);
            }
            if (iterSize <= 0) {
                throw new ValidationException("iterSize must be positive: " + iterSize);
            }
            if (rawMaxSize <= 0) {
                throw new ValidationException("rawMaxSize must be positive: " + rawMaxSize);
            }
            if (evictionPolicy == null || evictionPolicy.isEmpty()) {
                throw new ValidationException("evictionPolicy must not be empty");
            }
            if (charset == null || clock == null) {
                throw new ValidationException("charset and clock are required");
            }
            if (busyTimeout == null || busyTimeout.isNegative()) {
                throw new ValidationException("busyTimeout must be a non-negative duration");
            }
            if (lockTimeout != null && lockTimeout.isNegative()) {
                throw new ValidationException("lockTimeout must not be negative: " + lockTimeout);
            }
            validatePragmas(pragmas);

            Path absolute = directory.toAbsolutePath().normalize();
            if (Files.exists(absolute) && !Files.isDirectory(absolute)) {
                throw new ValidationException("Not a directory: " + absolute);
            }
            try {
                Files.createDirectories(absolute);
            } catch (IOException e) {
                throw new ValidationException("Cannot create cache directory: " + absolute, e);
            }

            return new CacheDBConfig(absolute, name, maxSize, iterSize, evictionPolicy, rawMaxSize,
                    charset, lockTimeout, busyTimeout, pragmas, clock);
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isEmpty() || name.contains("/") || name.contains("\\")) {
            throw new ValidationException("Invalid store name: " + name);
        }
    }

    private static void validatePragmas(Map<String, Object> pragmas) {
        for (Map.Entry<String, Object> entry : pragmas.entrySet()) {
            Object value = entry.getValue();
            if (entry.getKey() == null || !PRAGMA_NAME.matcher(entry.getKey()).matches()) {
                throw new ValidationException("Invalid pragma name: " + entry.getKey());
            }
            if (!(value instanceof Number || value instanceof String)
                    || !PRAGMA_VALUE.matcher(String.valueOf(value)).matches()) {
                throw new ValidationException("Invalid value for pragma " + entry.getKey() + ": " + value);
            }
        }
    }

    // Getters
    public Path getDirectory() { return directory; }
    public String getName() { return name; }
    public Path getStorePath() { return directory.resolve(name); }
    public long getMaxSize() { return maxSize; }
    public int getIterSize() { return iterSize; }
    public String getEvictionPolicy() { return evictionPolicy; }
    public int getRawMaxSize() { return rawMaxSize; }
    public Charset getCharset() { return charset; }
    public Duration getLockTimeout() { return lockTimeout; }
    public Duration getBusyTimeout() { return busyTimeout; }
    public Map<String, Object> getPragmas() { return pragmas; }
    public Clock getClock() { return clock; }
}
