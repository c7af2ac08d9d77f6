package com.cachedb.store;

/**
 * How a key or value is laid out in the cache table. The code is persisted.
 */
public enum StoreFormat {
    RAW(0),
    NUMBER(1),
    FILE_STRING(2),
    FILE_BYTES(3),
    OBJECT(4),
    FILE_OBJECT(5);

    private final int code;

    StoreFormat(int code) {
        this.code = code;
    }

    public int getCode() { return code; }

    /**
     * Whether the payload is the name of an overflow file rather than the data itself.
     */
    public boolean isFile() {
        return this == FILE_STRING || this == FILE_BYTES || this == FILE_OBJECT;
    }

    public static StoreFormat fromCode(int code) {
        for (StoreFormat format : values()) {
            if (format.code == code) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown store format code: " + code);
    }
}
