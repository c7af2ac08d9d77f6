package com.cachedb.cache.eviction;

import com.cachedb.store.StoredValue;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Strategy choosing which live rows to remove once a namespace is over capacity.
 * Implementations are stateless; only the name is persisted.
 */
public interface EvictionPolicy {

    String name();

    /**
     * Name of the supporting index this policy owns, or {@code null} if it relies on
     * an index the schema always has.
     */
    String indexName();

    void createIndex(Connection connection) throws SQLException;

    /**
     * Removes up to {@code batchSize} rows in one ordered, limited delete.
     *
     * @param released receives the overflow payloads of removed rows
     * @return number of rows removed
     */
    int run(Connection connection, int batchSize, List<StoredValue> released) throws SQLException;
}
