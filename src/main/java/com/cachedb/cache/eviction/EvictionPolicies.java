package com.cachedb.cache.eviction;

import com.cachedb.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide registry of eviction policies by name
 */
public final class EvictionPolicies {
    private static final Logger logger = LoggerFactory.getLogger(EvictionPolicies.class);

    private static final ConcurrentMap<String, EvictionPolicy> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(new LruEvictionPolicy());
        register(new LfuEvictionPolicy());
        register(new FifoEvictionPolicy());
        register(new ExpireFirstEvictionPolicy());
    }

    private EvictionPolicies() {
    }

    /**
     * @return false if a policy with the same name is already registered
     */
    public static boolean register(EvictionPolicy policy) {
        if (policy == null || policy.name() == null || policy.name().isEmpty()) {
            throw new ValidationException("Eviction policy must have a name");
        }
        return REGISTRY.putIfAbsent(policy.name(), policy) == null;
    }

    public static Optional<EvictionPolicy> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(REGISTRY.get(name));
    }

    public static EvictionPolicy resolve(String name) {
        return lookup(name).orElseThrow(() ->
                new ValidationException("No eviction policy registered under '" + name + "', known: " + names()));
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(REGISTRY.keySet()));
    }

    /**
     * Drops every eviction index that does not belong to {@code active} and
     * creates the one it needs, so at most one such index exists per store.
     */
    public static void install(Connection connection, EvictionPolicy active) throws SQLException {
        for (String index : existingIndexes(connection)) {
            if (!index.equals(active.indexName())) {
                try (Statement statement = connection.createStatement()) {
                    statement.execute("DROP INDEX IF EXISTS " + index);
                }
                logger.debug("Dropped eviction index {}", index);
            }
        }
        active.createIndex(connection);
    }

    static List<String> existingIndexes(Connection connection) throws SQLException {
        List<String> indexes = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT name FROM sqlite_master WHERE type = 'index' AND tbl_name = 'cache' "
                        + "AND substr(name, 1, ?) = ?")) {
            statement.setInt(1, OrderedEvictionPolicy.INDEX_PREFIX.length());
            statement.setString(2, OrderedEvictionPolicy.INDEX_PREFIX);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    indexes.add(rs.getString(1));
                }
            }
        }
        return indexes;
    }
}
