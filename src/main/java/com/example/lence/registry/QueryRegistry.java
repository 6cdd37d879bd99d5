package com.example.lence.registry;

import com.example.lence.error.LenceException;
import com.example.lence.model.ParamValue;
import com.example.lence.model.QueryBlock;
import com.example.lence.model.QueryDefinition;
import com.example.lence.model.QueryKey;
import com.example.lence.pages.PagePaths;
import com.example.lence.template.SqlInterpolator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the live {@link RegistrySnapshot}. A rebuild produces a complete new snapshot and swaps it in with a single
 * reference write; readers keep whichever snapshot they started with, and a failed rebuild changes nothing.
 */
public class QueryRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryRegistry.class);

    private final AtomicReference<RegistrySnapshot> current = new AtomicReference<>(RegistrySnapshot.empty());

    public RegistrySnapshot build(Collection<QueryBlock> blocks) {
        Map<QueryKey, QueryDefinition> definitions = new LinkedHashMap<>();
        Map<QueryKey, QueryBlock> origins = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        for (QueryBlock block : blocks) {
            String page = PagePaths.normalize(block.page());
            QueryKey key = new QueryKey(page, block.name());
            QueryBlock first = origins.putIfAbsent(key, block);
            if (first != null) {
                duplicates.add(String.format("'%s' on page %s (lines %d and %d)", block.name(), page, first.line(), block.line()));
                continue;
            }
            definitions.put(key, QueryDefinition.of(page, block.name(), block.source(), block.sql()));
        }
        if (!duplicates.isEmpty()) {
            throw LenceException.configuration("Duplicate query definitions: " + String.join(", ", duplicates));
        }

        RegistrySnapshot next = current.updateAndGet(
                previous -> new RegistrySnapshot(definitions, previous.generation() + 1, Instant.now()));
        LOGGER.info("Query registry generation {} holds {} definition(s)", next.generation(), next.size());
        return next;
    }

    public Optional<QueryDefinition> get(String page, String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(current.get().get(new QueryKey(PagePaths.normalize(page), name)));
    }

    public List<QueryDefinition> definitions(String page) {
        RegistrySnapshot snapshot = current.get();
        if (page == null) {
            return List.copyOf(snapshot.definitions().values());
        }
        String normalized = PagePaths.normalize(page);
        return snapshot.definitions().values().stream()
                .filter(definition -> definition.page().equals(normalized))
                .toList();
    }

    public String interpolate(QueryDefinition definition, Map<String, ParamValue> values) {
        return SqlInterpolator.interpolate(definition, values);
    }

    public RegistrySnapshot snapshot() {
        return current.get();
    }

    public int size() {
        return current.get().size();
    }
}
