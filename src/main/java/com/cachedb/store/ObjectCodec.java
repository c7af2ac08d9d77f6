package com.cachedb.store;

import java.io.IOException;

/**
 * Byte-level codec for values that have no native column representation.
 */
public interface ObjectCodec {
    byte[] encode(Object value) throws IOException;
    Object decode(byte[] data) throws IOException;
}
