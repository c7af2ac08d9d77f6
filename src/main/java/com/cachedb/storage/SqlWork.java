package com.cachedb.storage;

import com.cachedb.exception.CacheDBException;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A block of statements run against the calling thread's connection.
 */
@FunctionalInterface
public interface SqlWork<T> {
    T execute(Connection connection) throws SQLException, CacheDBException;
}
