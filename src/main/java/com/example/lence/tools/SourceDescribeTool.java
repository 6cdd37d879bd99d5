package com.example.lence.tools;

import com.example.lence.service.QueryService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class SourceDescribeTool implements Tool {
    private final ObjectMapper mapper;
    private final QueryService service;

    public SourceDescribeTool(ObjectMapper mapper, QueryService service) {
        this.mapper = mapper;
        this.service = service;
    }

    @Override
    public String getName() {
        return "sources.describe";
    }

    @Override
    public String getDescription() {
        return "Describe one data source by name.";
    }

    @Override
    public ObjectNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = mapper.createObjectNode();
        properties.putObject("name").put("type", "string");
        schema.set("properties", properties);
        ArrayNode required = mapper.createArrayNode();
        required.add("name");
        schema.set("required", required);
        return schema;
    }

    @Override
    public JsonNode call(JsonNode arguments) {
        String name = arguments.path("name").asText(null);
        if (name == null) {
            throw new IllegalArgumentException("'name' is required");
        }
        return SourcesListTool.serialize(mapper, service.describeSource(name));
    }
}
