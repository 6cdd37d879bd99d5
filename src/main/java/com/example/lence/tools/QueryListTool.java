package com.example.lence.tools;

import com.example.lence.model.QueryDefinition;
import com.example.lence.registry.QueryRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public class QueryListTool implements Tool {
    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final ObjectMapper mapper;
    private final QueryRegistry registry;

    public QueryListTool(ObjectMapper mapper, QueryRegistry registry) {
        this.mapper = mapper;
        this.registry = registry;
    }

    @Override
    public String getName() {
        return "queries.list";
    }

    @Override
    public String getDescription() {
        return "List the queries declared in pages, optionally for one page, with the parameters each expects.";
    }

    @Override
    public ObjectNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = mapper.createObjectNode();
        properties.putObject("page").put("type", "string")
                .put("description", "Only list queries declared on this page.");
        properties.set("limit", paginationField(
                "Maximum number of results to return (default " + DEFAULT_LIMIT + ", max " + MAX_LIMIT + ").",
                DEFAULT_LIMIT, 1));
        properties.set("cursor", paginationField(
                "Zero-based index from which to continue the result set.", null, 0));
        properties.set("maxSqlLength", paginationField(
                "Optional maximum length for SQL text; longer templates will be truncated.", null, 1));
        schema.set("properties", properties);
        return schema;
    }

    @Override
    public JsonNode call(JsonNode arguments) {
        String page = arguments.path("page").asText(null);
        int limit = determineLimit(arguments);
        int cursor = determineCursor(arguments);
        Integer maxSqlLength = determineMaxSqlLength(arguments);

        List<QueryDefinition> all = registry.definitions(page);
        int totalCount = all.size();
        int startIndex = Math.max(Math.min(cursor, totalCount), 0);
        int endIndex = Math.min(startIndex + limit, totalCount);

        ArrayNode queries = mapper.createArrayNode();
        for (QueryDefinition definition : all.subList(startIndex, endIndex)) {
            queries.add(serialize(definition, maxSqlLength));
        }

        ObjectNode result = mapper.createObjectNode();
        result.set("queries", queries);
        result.put("totalCount", totalCount);
        result.put("limit", limit);
        result.put("cursor", startIndex);
        if (endIndex < totalCount) {
            result.put("nextCursor", endIndex);
        }
        result.put("generation", registry.snapshot().generation());
        return result;
    }

    private ObjectNode serialize(QueryDefinition definition, Integer maxSqlLength) {
        ObjectNode node = mapper.createObjectNode();
        node.put("page", definition.page());
        node.put("name", definition.name());
        node.put("source", definition.source());
        ArrayNode params = mapper.createArrayNode();
        definition.params().forEach(params::add);
        node.set("params", params);
        node.put("sql", maybeTruncate(definition.sqlTemplate(), maxSqlLength));
        return node;
    }

    private int determineLimit(JsonNode arguments) {
        JsonNode limitNode = arguments.get("limit");
        int requested = limitNode != null && limitNode.isNumber()
                ? limitNode.asInt(DEFAULT_LIMIT)
                : DEFAULT_LIMIT;
        if (requested < 1) {
            requested = 1;
        }
        return Math.min(requested, MAX_LIMIT);
    }

    private int determineCursor(JsonNode arguments) {
        JsonNode cursorNode = arguments.get("cursor");
        if (cursorNode == null || !cursorNode.isNumber()) {
            return 0;
        }
        return Math.max(cursorNode.asInt(0), 0);
    }

    private Integer determineMaxSqlLength(JsonNode arguments) {
        JsonNode node = arguments.get("maxSqlLength");
        if (node == null || !node.isNumber() || node.asInt() < 1) {
            return null;
        }
        return node.asInt();
    }

    private String maybeTruncate(String value, Integer maxSqlLength) {
        if (value == null || maxSqlLength == null || value.length() <= maxSqlLength) {
            return value;
        }
        if (maxSqlLength == 1) {
            return "…";
        }
        return value.substring(0, maxSqlLength - 1) + "…";
    }

    private ObjectNode paginationField(String description, Integer defaultValue, int minimum) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", "integer");
        node.put("minimum", minimum);
        node.put("description", description);
        if (defaultValue != null) {
            node.put("default", defaultValue);
        }
        return node;
    }
}
