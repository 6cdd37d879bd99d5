package com.example.lence.registry;

import com.example.lence.model.QueryDefinition;
import com.example.lence.model.QueryKey;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable result of one corpus scan: {@code (page, name) -> definition}, in page order.
 */
public record RegistrySnapshot(Map<QueryKey, QueryDefinition> definitions, long generation, Instant builtAt) {
    public RegistrySnapshot {
        definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    public static RegistrySnapshot empty() {
        return new RegistrySnapshot(Map.of(), 0, Instant.EPOCH);
    }

    public QueryDefinition get(QueryKey key) {
        return definitions.get(key);
    }

    public int size() {
        return definitions.size();
    }
}
