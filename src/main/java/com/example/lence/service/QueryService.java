package com.example.lence.service;

import com.example.lence.catalog.SourceCatalog;
import com.example.lence.error.InvalidParametersException;
import com.example.lence.error.LenceException;
import com.example.lence.model.ParamValue;
import com.example.lence.model.QueryDefinition;
import com.example.lence.model.QueryRequest;
import com.example.lence.model.QueryResult;
import com.example.lence.model.ServerMode;
import com.example.lence.model.SourceInfo;
import com.example.lence.pages.PagePaths;
import com.example.lence.registry.QueryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one execute-query request to completion: resolve the definition, check its source and parameters,
 * interpolate, execute, and return the table. The first failing step ends the request with a
 * {@link LenceException}; nothing is retried.
 */
public class QueryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryService.class);

    private final QueryRegistry registry;
    private final SourceCatalog catalog;
    private final ServerMode mode;

    public QueryService(QueryRegistry registry, SourceCatalog catalog, ServerMode mode) {
        this.registry = registry;
        this.catalog = catalog;
        this.mode = mode;
    }

    public QueryResult execute(QueryRequest request) {
        QueryDefinition definition = resolve(request);

        if (!catalog.contains(definition.source())) {
            throw LenceException.notFound("Unknown source: " + definition.source());
        }

        validateParameters(definition, request.params());
        String sql = registry.interpolate(definition, request.params());
        LOGGER.debug("Executing {} on page {} against {}: {}", definition.name(), definition.page(), definition.source(), sql);

        try {
            return catalog.execute(sql);
        } catch (SQLException e) {
            LOGGER.info("Query '{}' on page {} failed: {}", definition.name(), definition.page(), e.getMessage());
            throw LenceException.executionFailed("Query error: " + e.getMessage(), e);
        }
    }

    public List<SourceInfo> listSources() {
        return catalog.list();
    }

    public SourceInfo describeSource(String name) {
        return catalog.describe(name)
                .orElseThrow(() -> LenceException.notFound("Source not found: " + name));
    }

    public ServerMode getMode() {
        return mode;
    }

    private QueryDefinition resolve(QueryRequest request) {
        if (mode == ServerMode.EDIT && request.hasInlineDefinition()) {
            return QueryDefinition.of(PagePaths.normalize(request.page()), nameOrDefault(request.queryName()),
                    request.source(), request.sql());
        }
        return registry.get(request.page(), request.queryName())
                .orElseThrow(() -> LenceException.notFound(String.format(
                        "Query not found: '%s' on page '%s'", request.queryName(), request.page())));
    }

    private void validateParameters(QueryDefinition definition, Map<String, ParamValue> supplied) {
        Set<String> received = supplied.keySet();
        List<String> missing = new ArrayList<>();
        for (String expected : definition.params()) {
            if (!received.contains(expected)) {
                missing.add(expected);
            }
        }
        List<String> extra = new ArrayList<>();
        for (String name : received) {
            if (!definition.params().contains(name)) {
                extra.add(name);
            }
        }
        if (!missing.isEmpty() || !extra.isEmpty()) {
            throw InvalidParametersException.mismatch(missing, extra);
        }
    }

    private String nameOrDefault(String name) {
        return name == null || name.isBlank() ? "inline" : name;
    }
}
