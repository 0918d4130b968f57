package com.ivamare.reliability.support;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic JSON rendering for hashing.
 *
 * <p>Keys are sorted, big decimals are written in plain notation and parsed back
 * as {@link java.math.BigDecimal}, and instants are ISO-8601 strings. A value that
 * round-trips through {@link #readMap(String)} renders to the same text again,
 * which is what lets a reloaded audit entry re-hash to its stored chain hash.
 */
public final class CanonicalJson {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public CanonicalJson() {
        this.mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();
    }

    /**
     * Render a value as canonical JSON.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to render canonical JSON", e);
        }
    }

    /**
     * Parse a JSON object written by {@link #write(Object)}.
     *
     * @return an unmodifiable map, or an empty map for null input
     */
    public Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return immutableCopy(mapper.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse canonical JSON", e);
        }
    }

    /**
     * Deep copy of a JSON-shaped map whose nested maps and lists are unmodifiable too.
     * Null values are kept.
     */
    public static Map<String, Object> immutableCopy(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, immutableValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return immutableCopy((Map<String, ?>) map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(immutableValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
