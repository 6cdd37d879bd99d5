package com.example.lence.tools;

import com.example.lence.model.ColumnInfo;
import com.example.lence.model.QueryRequest;
import com.example.lence.model.QueryResult;
import com.example.lence.service.QueryService;
import com.example.lence.template.ParamValues;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public class QueryExecuteTool implements Tool {
    private final ObjectMapper mapper;
    private final QueryService service;

    public QueryExecuteTool(ObjectMapper mapper, QueryService service) {
        this.mapper = mapper;
        this.service = service;
    }

    @Override
    public String getName() {
        return "query.execute";
    }

    @Override
    public String getDescription() {
        return "Execute a named query declared on a page, with parameter values. "
                + "In edit mode, 'source' and 'sql' may be supplied to run a query that is not saved yet.";
    }

    @Override
    public ObjectNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = mapper.createObjectNode();
        properties.putObject("page").put("type", "string")
                .put("description", "Page path that declares the query, e.g. /sales/dashboard.");
        properties.putObject("query").put("type", "string")
                .put("description", "Query name within the page.");
        properties.putObject("params").put("type", "object")
                .put("description", "Parameter values: string, number, boolean, null or a non-empty list of those.");
        properties.putObject("source").put("type", "string")
                .put("description", "Edit mode only: source the inline SQL reads from.");
        properties.putObject("sql").put("type", "string")
                .put("description", "Edit mode only: inline SQL template.");
        schema.set("properties", properties);
        ArrayNode required = mapper.createArrayNode();
        required.add("page");
        required.add("query");
        schema.set("required", required);
        return schema;
    }

    @Override
    public JsonNode call(JsonNode arguments) {
        String page = arguments.path("page").asText(null);
        String query = arguments.path("query").asText(null);
        if (page == null || query == null) {
            throw new IllegalArgumentException("'page' and 'query' are required");
        }
        QueryRequest request = new QueryRequest(
                page,
                query,
                ParamValues.fromJson(arguments.get("params")),
                textOrNull(arguments.get("source")),
                textOrNull(arguments.get("sql"))
        );
        return serialize(service.execute(request));
    }

    private ObjectNode serialize(QueryResult result) {
        ObjectNode node = mapper.createObjectNode();
        ArrayNode columns = mapper.createArrayNode();
        for (ColumnInfo column : result.columns()) {
            ObjectNode columnNode = mapper.createObjectNode();
            columnNode.put("name", column.name());
            columnNode.put("type", column.type());
            columns.add(columnNode);
        }
        node.set("columns", columns);
        ArrayNode data = mapper.createArrayNode();
        for (List<Object> row : result.data()) {
            data.add(mapper.valueToTree(row));
        }
        node.set("data", data);
        node.put("row_count", result.rowCount());
        return node;
    }

    private String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }
}
