package com.example.lence.config;

import com.example.lence.catalog.SourceCatalog;
import com.example.lence.error.LenceException;
import com.example.lence.model.SourceKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads {@code sources/sources.yaml}:
 * <pre>
 * sources:
 *   orders:
 *     type: csv
 *     path: data/orders.csv
 *     description: Order lines
 * </pre>
 */
public class SourcesConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourcesConfigLoader.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public Map<String, SourceDefinition> load(Path file) {
        Map<String, SourceDefinition> sources = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            LOGGER.info("No sources file at {}; starting without sources", file);
            return sources;
        }
        JsonNode root;
        try {
            root = YAML.readTree(file.toFile());
        } catch (IOException e) {
            throw LenceException.configuration("Cannot read " + file + ": " + e.getMessage(), e);
        }
        JsonNode sourcesNode = root == null ? null : root.get("sources");
        if (sourcesNode == null || sourcesNode.isNull()) {
            return sources;
        }
        if (!sourcesNode.isObject()) {
            throw LenceException.configuration("'sources' in " + file + " must be a mapping of name to source");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = sourcesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                sources.put(field.getKey(), YAML.treeToValue(field.getValue(), SourceDefinition.class));
            } catch (IOException e) {
                throw LenceException.configuration("Invalid source '" + field.getKey() + "' in " + file + ": " + e.getMessage(), e);
            }
        }
        return sources;
    }

    /**
     * Registers every configured source. An entry that cannot be registered is logged and skipped so the
     * remaining sources stay usable.
     *
     * @return the number of sources registered
     */
    public int registerAll(Path file, SourceCatalog catalog) {
        int registered = 0;
        for (Map.Entry<String, SourceDefinition> entry : load(file).entrySet()) {
            SourceDefinition definition = entry.getValue();
            try {
                if (definition.path() == null || definition.path().isBlank()) {
                    throw LenceException.configuration("Source '" + entry.getKey() + "' has no path");
                }
                catalog.register(entry.getKey(), SourceKind.fromLabel(definition.type()), toPath(entry.getKey(), definition),
                        definition.description());
                registered++;
            } catch (LenceException e) {
                LOGGER.error("Skipping source '{}': {}", entry.getKey(), e.getDetail());
            }
        }
        return registered;
    }

    private Path toPath(String name, SourceDefinition definition) {
        try {
            return Path.of(definition.path());
        } catch (InvalidPathException e) {
            throw LenceException.configuration("Source '" + name + "' has an invalid path: " + e.getMessage(), e);
        }
    }
}
