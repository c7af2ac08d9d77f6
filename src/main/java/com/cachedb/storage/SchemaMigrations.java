package com.cachedb.storage;

import com.cachedb.exception.EngineException;
import com.cachedb.store.OverflowReferences;
import com.cachedb.store.StoredValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;

/**
 * Table definitions and the upgrade chain between schema major versions.
 *
 * Version 0 stores predate the meta table and indexed the cache table over
 * (key, key_format, expire_time), which allowed several rows per key.
 */
final class SchemaMigrations {
    private static final Logger logger = LoggerFactory.getLogger(SchemaMigrations.class);

    static final int CURRENT_VERSION = 1;
    static final String VERSION_KEY = "schema_version";

    static final List<String> CREATE_STATEMENTS = Arrays.asList(
            "CREATE TABLE IF NOT EXISTS cache("
                    + "key BLOB NOT NULL, "
                    + "key_format INTEGER NOT NULL, "
                    + "value BLOB, "
                    + "value_format INTEGER NOT NULL, "
                    + "store_time REAL NOT NULL, "
                    + "expire_time REAL, "
                    + "last_access_time REAL NOT NULL, "
                    + "access_count INTEGER NOT NULL DEFAULT 0)",
            "CREATE UNIQUE INDEX IF NOT EXISTS idx_cache_key ON cache(key, key_format)",
            "CREATE INDEX IF NOT EXISTS idx_cache_expire_time ON cache(expire_time)",
            "CREATE TABLE IF NOT EXISTS meta(key TEXT PRIMARY KEY, value TEXT)"
    );

    private SchemaMigrations() {
    }

    /**
     * Upgrades a store from {@code fromVersion} to {@link #CURRENT_VERSION}, one step at a time.
     * Overflow payloads of rows the upgrade deletes are added to {@code orphaned}.
     */
    static void migrate(Connection connection, int fromVersion, List<StoredValue> orphaned)
            throws SQLException, EngineException {
        if (fromVersion > CURRENT_VERSION) {
            throw new EngineException("Cannot downgrade store schema from version "
                    + fromVersion + " to " + CURRENT_VERSION);
        }
        for (int version = fromVersion; version < CURRENT_VERSION; version++) {
            logger.info("Migrating cache schema {} -> {}", version, version + 1);
            switch (version) {
                case 0:
                    migrate0to1(connection, orphaned);
                    break;
                default:
                    throw new EngineException("No migration step from schema version " + version);
            }
        }
    }

    private static void migrate0to1(Connection connection, List<StoredValue> orphaned) throws SQLException {
        // keep the newest row of each key before enforcing uniqueness
        String duplicates = "rowid NOT IN (SELECT MAX(rowid) FROM cache GROUP BY key, key_format)";
        orphaned.addAll(OverflowReferences.collect(connection, duplicates));
        try (Statement statement = connection.createStatement()) {
            statement.execute("DROP INDEX IF EXISTS idx_key");
            int removed = statement.executeUpdate("DELETE FROM cache WHERE " + duplicates);
            if (removed > 0) {
                logger.info("Removed {} duplicate rows while migrating to schema 1", removed);
            }
            for (String sql : CREATE_STATEMENTS) {
                statement.execute(sql);
            }
        }
    }
}
