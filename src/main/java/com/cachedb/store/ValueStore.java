package com.cachedb.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Optional;

/**
 * Maps keys and values to table payloads, moving oversized ones into overflow files.
 *
 * <ul>
 *   <li>{@code null} and strings/bytes shorter than {@code rawMaxSize} bytes (strings measured
 *       in the configured charset): {@link StoreFormat#RAW}</li>
 *   <li>byte, short, int, long, float, double: {@link StoreFormat#NUMBER}</li>
 *   <li>longer strings/bytes: {@link StoreFormat#FILE_STRING} / {@link StoreFormat#FILE_BYTES}</li>
 *   <li>everything else through the {@link ObjectCodec}: {@link StoreFormat#OBJECT},
 *       or {@link StoreFormat#FILE_OBJECT} when the encoding is large</li>
 * </ul>
 *
 * Integral numbers load back as {@link Long}, floating point ones as {@link Double}.
 */
public class ValueStore {
    private static final Logger logger = LoggerFactory.getLogger(ValueStore.class);

    /**
     * Returned by {@link #load} when the overflow file behind a row is gone.
     */
    public static final Object ABSENT = new Object() {
        @Override
        public String toString() {
            return "<absent>";
        }
    };

    private final OverflowFileStore files;
    private final ObjectCodec codec;
    private final int rawMaxSize;
    private final Charset charset;

    public ValueStore(OverflowFileStore files, ObjectCodec codec, int rawMaxSize, Charset charset) {
        this.files = files;
        this.codec = codec;
        this.rawMaxSize = rawMaxSize;
        this.charset = charset;
    }

    /**
     * Serializes {@code value}, writing (or referencing) an overflow file when needed.
     */
    public StoredValue dump(Object value) throws IOException {
        return serialize(value, true);
    }

    /**
     * Serializes {@code key} for a lookup; overflow payloads are hashed but never written.
     */
    public StoredValue probe(Object key) throws IOException {
        return serialize(key, false);
    }

    public Object load(Object payload, StoreFormat format) throws IOException {
        switch (format) {
            case RAW:
                return payload;
            case NUMBER:
                return normalizeNumber(payload);
            case OBJECT:
                return codec.decode((byte[]) payload);
            case FILE_STRING:
            case FILE_BYTES:
            case FILE_OBJECT:
                return loadFile((String) payload, format);
            default:
                throw new IOException("Unsupported store format: " + format);
        }
    }

    /**
     * False when {@code payload} names an overflow file that no longer exists;
     * the file is not read.
     */
    public boolean isPresent(Object payload, StoreFormat format) {
        return !format.isFile() || payload == null || files.exists(payload.toString());
    }

    /**
     * Gives back the overflow reference held by a payload; inline payloads are ignored.
     */
    public void release(Object payload, StoreFormat format) throws IOException {
        if (format.isFile() && payload != null) {
            files.release(payload.toString());
        }
    }

    public void release(StoredValue stored) throws IOException {
        release(stored.getPayload(), stored.getFormat());
    }

    public OverflowFileStore getFiles() {
        return files;
    }

    private StoredValue serialize(Object value, boolean write) throws IOException {
        if (value == null) {
            return new StoredValue(null, StoreFormat.RAW);
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return new StoredValue(((Number) value).longValue(), StoreFormat.NUMBER);
        }
        if (value instanceof Float || value instanceof Double) {
            return new StoredValue(((Number) value).doubleValue(), StoreFormat.NUMBER);
        }
        if (value instanceof String) {
            String text = (String) value;
            byte[] encoded = text.getBytes(charset);
            if (encoded.length < rawMaxSize) {
                return new StoredValue(text, StoreFormat.RAW);
            }
            return overflow(encoded, StoreFormat.FILE_STRING, write);
        }
        if (value instanceof byte[]) {
            byte[] bytes = (byte[]) value;
            if (bytes.length < rawMaxSize) {
                return new StoredValue(bytes, StoreFormat.RAW);
            }
            return overflow(bytes, StoreFormat.FILE_BYTES, write);
        }

        byte[] encoded = codec.encode(value);
        if (encoded.length < rawMaxSize) {
            return new StoredValue(encoded, StoreFormat.OBJECT);
        }
        return overflow(encoded, StoreFormat.FILE_OBJECT, write);
    }

    private StoredValue overflow(byte[] data, StoreFormat format, boolean write) throws IOException {
        String hash = write ? files.write(data) : OverflowFileStore.signature(data);
        return new StoredValue(hash, format);
    }

    private Object loadFile(String hash, StoreFormat format) throws IOException {
        Optional<byte[]> data = files.read(hash);
        if (!data.isPresent()) {
            logger.warn("Overflow file {} not found, treating entry as absent", hash);
            return ABSENT;
        }
        byte[] bytes = data.get();
        if (format == StoreFormat.FILE_STRING) {
            return new String(bytes, charset);
        }
        if (format == StoreFormat.FILE_BYTES) {
            return bytes;
        }
        return codec.decode(bytes);
    }

    private static Object normalizeNumber(Object payload) throws IOException {
        if (payload instanceof Double || payload instanceof Long) {
            return payload;
        }
        if (payload instanceof Float) {
            return ((Float) payload).doubleValue();
        }
        if (payload instanceof Number) {
            return ((Number) payload).longValue();
        }
        throw new IOException("Numeric column holds a non-number: " + payload);
    }
}
