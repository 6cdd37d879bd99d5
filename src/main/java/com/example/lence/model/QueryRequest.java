package com.example.lence.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Execute-query input. {@code source} and {@code sql} are only honoured in {@link ServerMode#EDIT}.
 */
public record QueryRequest(
        String page,
        String queryName,
        Map<String, ParamValue> params,
        String source,
        String sql
) {
    public QueryRequest {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static QueryRequest of(String page, String queryName, Map<String, ParamValue> params) {
        return new QueryRequest(page, queryName, params, null, null);
    }

    public boolean hasInlineDefinition() {
        return source != null && sql != null;
    }
}
