package com.cachedb.store;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;

/**
 * A serialized key or value together with its format tag
 */
public class StoredValue {
    private final Object payload;
    private final StoreFormat format;

    public StoredValue(Object payload, StoreFormat format) {
        this.payload = payload;
        this.format = format;
    }

    public Object getPayload() { return payload; }
    public StoreFormat getFormat() { return format; }

    /**
     * Binds the payload at {@code index} keeping its SQLite storage class.
     */
    public void bind(PreparedStatement statement, int index) throws SQLException {
        if (payload == null) {
            statement.setNull(index, Types.BLOB);
        } else if (payload instanceof byte[]) {
            statement.setBytes(index, (byte[]) payload);
        } else if (payload instanceof Double || payload instanceof Float) {
            statement.setDouble(index, ((Number) payload).doubleValue());
        } else if (payload instanceof Number) {
            statement.setLong(index, ((Number) payload).longValue());
        } else {
            statement.setString(index, payload.toString());
        }
    }

    @Override
    public String toString() {
        return "StoredValue{format=" + format + ", payload="
                + (payload instanceof byte[] ? ((byte[]) payload).length + " bytes" : payload) + "}";
    }
}
