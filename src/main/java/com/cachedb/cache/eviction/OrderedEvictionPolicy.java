package com.cachedb.cache.eviction;

import com.cachedb.store.OverflowReferences;
import com.cachedb.store.StoredValue;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Evicts the rows ranked lowest by a single column, ascending.
 */
public abstract class OrderedEvictionPolicy implements EvictionPolicy {
    static final String INDEX_PREFIX = "idx_evict_";

    private final String name;
    private final String rankColumn;
    private final String victims;

    protected OrderedEvictionPolicy(String name, String rankColumn, String ordering) {
        this.name = name;
        this.rankColumn = rankColumn;
        // rowid breaks ties so both statements below pick the same rows
        this.victims = "rowid IN (SELECT rowid FROM cache ORDER BY " + ordering + ", rowid LIMIT ?)";
    }

    protected OrderedEvictionPolicy(String name, String rankColumn) {
        this(name, rankColumn, rankColumn);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String indexName() {
        return INDEX_PREFIX + name;
    }

    public String getRankColumn() {
        return rankColumn;
    }

    @Override
    public void createIndex(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("CREATE INDEX IF NOT EXISTS " + indexName() + " ON cache(" + rankColumn + ")");
        }
    }

    @Override
    public int run(Connection connection, int batchSize, List<StoredValue> released) throws SQLException {
        released.addAll(OverflowReferences.collect(connection, victims, batchSize));
        try (PreparedStatement statement = connection.prepareStatement("DELETE FROM cache WHERE " + victims)) {
            statement.setInt(1, batchSize);
            return statement.executeUpdate();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + " by " + rankColumn + "}";
    }
}
