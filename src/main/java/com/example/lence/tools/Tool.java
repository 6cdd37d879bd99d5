package com.example.lence.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One MCP tool. {@link #call} receives the request arguments as JSON and returns the structured result;
 * failures are thrown and turned into error results by the server.
 */
public interface Tool {
    String getName();

    String getDescription();

    ObjectNode getInputSchema();

    JsonNode call(JsonNode arguments) throws Exception;
}
