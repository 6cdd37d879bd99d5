package com.example.lence.model;

import com.example.lence.template.ParamExtractor;

import java.util.List;
import java.util.Objects;

/**
 * A named SQL template bound to the page that declares it and the source it reads from.
 * {@code params} is derived from {@code sqlTemplate} once and never changes.
 */
public record QueryDefinition(
        String page,
        String name,
        String source,
        String sqlTemplate,
        List<String> params
) {
    public QueryDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sqlTemplate, "sqlTemplate");
        params = List.copyOf(params);
    }

    public static QueryDefinition of(String page, String name, String source, String sqlTemplate) {
        return new QueryDefinition(page, name, source, sqlTemplate, ParamExtractor.extract(sqlTemplate));
    }

    public static QueryDefinition from(QueryBlock block) {
        return of(block.page(), block.name(), block.source(), block.sql());
    }

    public QueryKey key() {
        return new QueryKey(page, name);
    }
}
