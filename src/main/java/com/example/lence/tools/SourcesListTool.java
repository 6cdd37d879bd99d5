package com.example.lence.tools;

import com.example.lence.model.SourceInfo;
import com.example.lence.service.QueryService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class SourcesListTool implements Tool {
    private final ObjectMapper mapper;
    private final QueryService service;

    public SourcesListTool(ObjectMapper mapper, QueryService service) {
        this.mapper = mapper;
        this.service = service;
    }

    @Override
    public String getName() {
        return "sources.list";
    }

    @Override
    public String getDescription() {
        return "List the data sources queries can read from.";
    }

    @Override
    public ObjectNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    @Override
    public JsonNode call(JsonNode arguments) {
        ArrayNode sources = mapper.createArrayNode();
        for (SourceInfo source : service.listSources()) {
            sources.add(serialize(mapper, source));
        }
        ObjectNode result = mapper.createObjectNode();
        result.set("sources", sources);
        return result;
    }

    static ObjectNode serialize(ObjectMapper mapper, SourceInfo source) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", source.name());
        node.put("type", source.kind().label());
        node.put("description", source.description());
        return node;
    }
}
