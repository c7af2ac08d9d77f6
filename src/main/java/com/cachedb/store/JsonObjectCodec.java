package com.cachedb.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Jackson codec writing each value inside an envelope that records its class,
 * so decoding restores the concrete type.
 */
public class JsonObjectCodec implements ObjectCodec {
    private static final Set<String> CONCRETE_CONTAINERS = new HashSet<>(Arrays.asList(
            "java.util.ArrayList", "java.util.LinkedList",
            "java.util.HashMap", "java.util.LinkedHashMap", "java.util.TreeMap",
            "java.util.HashSet", "java.util.LinkedHashSet", "java.util.TreeSet"));

    private final ObjectMapper objectMapper;
    private final ClassLoader classLoader;

    public JsonObjectCodec() {
        this(new ObjectMapper());
    }

    public JsonObjectCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.classLoader = JsonObjectCodec.class.getClassLoader();
    }

    @Override
    public byte[] encode(Object value) throws IOException {
        Envelope envelope = new Envelope(typeName(value), objectMapper.valueToTree(value));
        return objectMapper.writeValueAsBytes(envelope);
    }

    @Override
    public Object decode(byte[] data) throws IOException {
        Envelope envelope = objectMapper.readValue(data, Envelope.class);
        Class<?> type;
        try {
            type = Class.forName(envelope.getType(), false, classLoader);
        } catch (ClassNotFoundException e) {
            throw new IOException("Unknown value class in cache payload: " + envelope.getType(), e);
        }
        return objectMapper.treeToValue(envelope.getValue(), type);
    }

    // immutable and view collections are restored as their mutable counterparts
    private static String typeName(Object value) {
        String name = value.getClass().getName();
        if (CONCRETE_CONTAINERS.contains(name)) {
            return name;
        }
        if (value instanceof List) {
            return ArrayList.class.getName();
        }
        if (value instanceof Set) {
            return LinkedHashSet.class.getName();
        }
        if (value instanceof Collection) {
            return ArrayList.class.getName();
        }
        if (value instanceof Map) {
            return LinkedHashMap.class.getName();
        }
        return name;
    }

    public static class Envelope {
        private final String type;
        private final JsonNode value;

        @JsonCreator
        public Envelope(@JsonProperty("type") String type, @JsonProperty("value") JsonNode value) {
            this.type = type;
            this.value = value;
        }

        @JsonProperty("type")
        public String getType() { return type; }

        @JsonProperty("value")
        public JsonNode getValue() { return value; }
    }
}
