package com.cachedb.storage;

import com.cachedb.config.CacheDBConfig;
import com.cachedb.exception.CacheDBException;
import com.cachedb.exception.EngineException;
import com.cachedb.exception.LockTimeoutException;
import com.cachedb.store.StoredValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.io.IOException;
import java.lang.ref.WeakReference;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SQLite storage manager: connections, schema and transactions for one store file
 */
public class SQLiteStorageManager {
    private static final Logger logger = LoggerFactory.getLogger(SQLiteStorageManager.class);

    private static final Duration SETUP_TIMEOUT = Duration.ofSeconds(60);
    private static final String[] COMPANION_SUFFIXES = {"", "-wal", "-shm", "-journal"};

    private final CacheDBConfig config;
    private final Path path;
    private final String url;
    private final Map<ConnectionKey, Session> sessions;
    private final List<StoredValue> orphanedReferences = new ArrayList<>();
    private volatile long ownerPid;
    private volatile boolean closed = false;

    public SQLiteStorageManager(CacheDBConfig config) throws CacheDBException {
        this.config = config;
        this.path = config.getStorePath();
        this.url = "jdbc:sqlite:" + path;
        this.sessions = new ConcurrentHashMap<>();
        this.ownerPid = currentPid();

        try {
            initializeSchema();
        } catch (CacheDBException | RuntimeException e) {
            close();
            throw e;
        }
    }

    /**
     * Runs {@code work} inside a write transaction.
     *
     * Reentrant per thread: only the outermost call issues BEGIN IMMEDIATE and
     * COMMIT; any exception escaping the block rolls the whole transaction back.
     */
    public <T> T transact(SqlWork<T> work) throws CacheDBException {
        Session session = session();
        Connection connection = session.connection;

        if (session.depth > 0) {
            session.depth++;
            try {
                return work.execute(connection);
            } catch (SQLException e) {
                throw new EngineException("Statement failed on " + path, e);
            } finally {
                session.depth--;
            }
        }

        begin(connection);
        session.depth = 1;
        T result;
        try {
            result = work.execute(connection);
        } catch (SQLException e) {
            EngineException failure = new EngineException("Transaction failed on " + path, e);
            rollback(connection, failure);
            throw failure;
        } catch (CacheDBException | RuntimeException | Error e) {
            rollback(connection, e);
            throw e;
        } finally {
            session.depth = 0;
        }

        try (Statement statement = connection.createStatement()) {
            statement.execute("COMMIT");
        } catch (SQLException e) {
            EngineException failure = new EngineException("Commit failed on " + path, e);
            rollback(connection, failure);
            throw failure;
        }
        return result;
    }

    /**
     * Runs {@code work} on the thread's connection without opening a transaction.
     */
    public <T> T read(SqlWork<T> work) throws CacheDBException {
        try {
            return work.execute(session().connection);
        } catch (SQLException e) {
            throw new EngineException("Query failed on " + path, e);
        }
    }

    public Optional<String> meta(String key) throws CacheDBException {
        return read(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT value FROM meta WHERE key = ?")) {
                statement.setString(1, key);
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.<String>empty();
                }
            }
        });
    }

    public void meta(String key, String value) throws CacheDBException {
        transact(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO meta(key, value) VALUES (?, ?) "
                            + "ON CONFLICT(key) DO UPDATE SET value = excluded.value")) {
                statement.setString(1, key);
                statement.setString(2, value);
                return statement.executeUpdate();
            }
        });
    }

    /**
     * Authoritative count of rows that have not expired at {@code now}.
     */
    public long countLive(double now) throws CacheDBException {
        return read(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT COUNT(*) FROM cache WHERE expire_time IS NULL OR expire_time > ?")) {
                statement.setDouble(1, now);
                try (ResultSet rs = statement.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            }
        });
    }

    /**
     * Overflow references held by rows that opening the store deleted. The
     * caller owns the overflow files and releases them; the list is emptied.
     */
    public List<StoredValue> drainOrphanedReferences() {
        List<StoredValue> drained = new ArrayList<>(orphanedReferences);
        orphanedReferences.clear();
        return drained;
    }

    public Path getPath() {
        return path;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes every connection opened by this manager, whichever thread owns it.
     */
    public void close() {
        closed = true;
        closeSessions();
    }

    /**
     * Closes the manager and removes the store file together with its WAL companions.
     */
    public void destroy() throws CacheDBException {
        close();
        for (String suffix : COMPANION_SUFFIXES) {
            Path file = Paths.get(path + suffix);
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new EngineException("Failed to delete store file: " + file, e);
            }
        }
        logger.info("Destroyed cache store {}", path);
    }

    private void initializeSchema() throws CacheDBException {
        transact(connection -> {
            boolean hasCache = tableExists(connection, "cache");
            boolean hasMeta = tableExists(connection, "meta");

            if (!hasCache) {
                try (Statement statement = connection.createStatement()) {
                    for (String sql : SchemaMigrations.CREATE_STATEMENTS) {
                        statement.execute(sql);
                    }
                }
                writeVersion(connection, SchemaMigrations.CURRENT_VERSION);
                logger.info("Created cache store {} (schema {})", path, SchemaMigrations.CURRENT_VERSION);
                return null;
            }

            int stored = hasMeta ? readVersion(connection) : 0;
            if (stored != SchemaMigrations.CURRENT_VERSION) {
                SchemaMigrations.migrate(connection, stored, orphanedReferences);
                writeVersion(connection, SchemaMigrations.CURRENT_VERSION);
            }
            return null;
        });
    }

    private static boolean tableExists(Connection connection, String table) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            statement.setString(1, table);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getInt(1) == 1;
            }
        }
    }

    private static int readVersion(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT value FROM meta WHERE key = ?")) {
            statement.setString(1, SchemaMigrations.VERSION_KEY);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Integer.parseInt(rs.getString(1)) : 0;
            }
        }
    }

    private static void writeVersion(Connection connection, int version) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO meta(key, value) VALUES (?, ?) "
                        + "ON CONFLICT(key) DO UPDATE SET value = excluded.value")) {
            statement.setString(1, SchemaMigrations.VERSION_KEY);
            statement.setString(2, String.valueOf(version));
            statement.executeUpdate();
        }
    }

    private Session session() throws CacheDBException {
        if (closed) {
            throw new EngineException("Storage manager is closed: " + path);
        }

        long pid = currentPid();
        if (pid != ownerPid) {
            // connections must never be shared with a forked child
            synchronized (this) {
                if (pid != ownerPid) {
                    sessions.clear();
                    ownerPid = pid;
                }
            }
        }

        Thread current = Thread.currentThread();
        ConnectionKey key = new ConnectionKey(pid, current.getId());
        Session session = sessions.get(key);
        if (session == null || !session.isOwnedBy(current)) {
            pruneDeadSessions();
            session = new Session(connect(), current);
            sessions.put(key, session);
        }
        return session;
    }

    /**
     * Closes the connections of threads that have terminated.
     */
    void pruneDeadSessions() {
        Iterator<Map.Entry<ConnectionKey, Session>> entries = sessions.entrySet().iterator();
        while (entries.hasNext()) {
            Session session = entries.next().getValue();
            if (session.isOwnerAlive()) {
                continue;
            }
            entries.remove();
            try {
                session.connection.close();
                logger.debug("Closed connection of terminated thread on {}", path);
            } catch (SQLException e) {
                logger.warn("Failed to close connection to {}: {}", path, e.getMessage());
            }
        }
    }

    int openSessions() {
        return sessions.size();
    }

    private Connection connect() throws CacheDBException {
        SQLiteConfig sqliteConfig = new SQLiteConfig();
        sqliteConfig.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, driverBusyTimeout(config).toMillis()));

        Connection connection;
        try {
            connection = DriverManager.getConnection(url, sqliteConfig.toProperties());
        } catch (SQLException e) {
            throw new EngineException("Failed to open cache store: " + path, e);
        }

        long start = System.nanoTime();
        while (true) {
            try {
                applyPragmas(connection);
                return connection;
            } catch (SQLException e) {
                boolean expired = System.nanoTime() - start > SETUP_TIMEOUT.toNanos();
                if (!isBusy(e) || expired) {
                    closeQuietly(connection, e);
                    throw new EngineException("Failed to configure connection for " + path, e);
                }
                pause(1);
            }
        }
    }

    /**
     * The driver waits this long inside each BEGIN IMMEDIATE attempt, so it never
     * exceeds the lock timeout.
     */
    static Duration driverBusyTimeout(CacheDBConfig config) {
        Duration busy = config.getBusyTimeout();
        Duration lock = config.getLockTimeout();
        return lock != null && lock.compareTo(busy) < 0 ? lock : busy;
    }

    private void applyPragmas(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (Map.Entry<String, Object> pragma : config.getPragmas().entrySet()) {
                statement.execute("PRAGMA " + pragma.getKey() + " = " + pragma.getValue());
            }
        }
    }

    private void begin(Connection connection) throws CacheDBException {
        Duration lockTimeout = config.getLockTimeout();
        long start = System.nanoTime();
        while (true) {
            try (Statement statement = connection.createStatement()) {
                statement.execute("BEGIN IMMEDIATE");
                return;
            } catch (SQLException e) {
                if (!isBusy(e)) {
                    throw new EngineException("Failed to begin transaction on " + path, e);
                }
                if (lockTimeout != null && System.nanoTime() - start > lockTimeout.toNanos()) {
                    throw new LockTimeoutException(lockTimeout, e);
                }
                pause(1);
            }
        }
    }

    private void rollback(Connection connection, Throwable primary) {
        try (Statement statement = connection.createStatement()) {
            statement.execute("ROLLBACK");
        } catch (SQLException e) {
            primary.addSuppressed(e);
            logger.warn("Rollback failed on {}: {}", path, e.getMessage());
        }
    }

    private void closeSessions() {
        List<Session> open = new ArrayList<>(sessions.values());
        sessions.clear();
        for (Session session : open) {
            try {
                session.connection.close();
            } catch (SQLException e) {
                logger.warn("Failed to close connection to {}: {}", path, e.getMessage());
            }
        }
    }

    private static void closeQuietly(Connection connection, Throwable primary) {
        try {
            connection.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }

    private static void pause(long millis) throws EngineException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException("Interrupted while waiting for the store lock", e);
        }
    }

    static boolean isBusy(SQLException e) {
        int code = e.getErrorCode();
        if (e instanceof SQLiteException) {
            code = ((SQLiteException) e).getResultCode().code;
        }
        int primary = code & 0xFF;
        if (primary == SQLiteErrorCode.SQLITE_BUSY.code || primary == SQLiteErrorCode.SQLITE_LOCKED.code) {
            return true;
        }
        String message = e.getMessage();
        return message != null && message.contains("database is locked");
    }

    private static long currentPid() {
        return ProcessHandle.current().pid();
    }

    private static final class ConnectionKey {
        private final long pid;
        private final long threadId;

        ConnectionKey(long pid, long threadId) {
            this.pid = pid;
            this.threadId = threadId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ConnectionKey)) return false;
            ConnectionKey other = (ConnectionKey) o;
            return pid == other.pid && threadId == other.threadId;
        }

        @Override
        public int hashCode() {
            return Objects.hash(pid, threadId);
        }
    }

    private static final class Session {
        private final Connection connection;
        private final WeakReference<Thread> owner;
        private int depth; // transaction nesting, touched by the owning thread only

        Session(Connection connection, Thread owner) {
            this.connection = connection;
            this.owner = new WeakReference<>(owner);
        }

        boolean isOwnedBy(Thread thread) {
            return owner.get() == thread;
        }

        boolean isOwnerAlive() {
            Thread thread = owner.get();
            return thread != null && thread.isAlive();
        }
    }
}
