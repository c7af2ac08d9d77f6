package com.cachedb.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds the overflow payloads held by rows about to be bulk-deleted, so their
 * file references can be released once the delete commits.
 */
public final class OverflowReferences {
    private static final String FILE_FORMATS = StoreFormat.FILE_STRING.getCode() + ", "
            + StoreFormat.FILE_BYTES.getCode() + ", " + StoreFormat.FILE_OBJECT.getCode();

    private OverflowReferences() {
    }

    /**
     * @param where SQL predicate over the cache table, without the WHERE keyword
     */
    public static List<StoredValue> collect(Connection connection, String where, Object... params)
            throws SQLException {
        String sql = "SELECT key, key_format, value, value_format FROM cache WHERE (" + where + ") "
                + "AND (key_format IN (" + FILE_FORMATS + ") OR value_format IN (" + FILE_FORMATS + "))";
        List<StoredValue> refs = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    addIfFile(refs, rs.getObject(1), StoreFormat.fromCode(rs.getInt(2)));
                    addIfFile(refs, rs.getObject(3), StoreFormat.fromCode(rs.getInt(4)));
                }
            }
        }
        return refs;
    }

    public static void addIfFile(List<StoredValue> refs, Object payload, StoreFormat format) {
        if (format.isFile() && payload != null) {
            refs.add(new StoredValue(payload, format));
        }
    }
}
