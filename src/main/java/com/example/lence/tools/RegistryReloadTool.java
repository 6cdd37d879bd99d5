package com.example.lence.tools;

import com.example.lence.registry.RegistryLoader;
import com.example.lence.registry.RegistrySnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class RegistryReloadTool implements Tool {
    private final ObjectMapper mapper;
    private final RegistryLoader loader;

    public RegistryReloadTool(ObjectMapper mapper, RegistryLoader loader) {
        this.mapper = mapper;
        this.loader = loader;
    }

    @Override
    public String getName() {
        return "registry.reload";
    }

    @Override
    public String getDescription() {
        return "Rescan the pages directory and rebuild the query registry. A failed rebuild keeps the current one.";
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
        RegistrySnapshot snapshot = loader.reload();
        ObjectNode result = mapper.createObjectNode();
        result.put("queries", snapshot.size());
        result.put("generation", snapshot.generation());
        result.put("builtAt", snapshot.builtAt().toString());
        return result;
    }
}
