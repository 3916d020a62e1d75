package com.govsandbox.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Deterministic JSON encoding used as digest input: sorted properties, sorted map keys, no indentation.
 * Two structurally equal values always encode to the same bytes, across processes and restarts.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private CanonicalJson() {
    }

    public static byte[] toBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Value is not canonically serializable: " + value.getClass().getName(), e);
        }
    }

    public static String sha3Hex(Object value) {
        return Digests.sha3Hex(toBytes(value));
    }

    /** Shared mapper for bundle import/export; same ordering rules as digest input. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
