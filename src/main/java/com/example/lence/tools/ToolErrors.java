package com.example.lence.tools;

import com.example.lence.error.InvalidParametersException;
import com.example.lence.error.LenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Structured {@code {kind, detail}} error payloads for tool failures.
 */
public final class ToolErrors {
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private ToolErrors() {
    }

    public static ObjectNode toNode(ObjectMapper mapper, Exception exception) {
        ObjectNode node = mapper.createObjectNode();
        if (exception instanceof LenceException lence) {
            node.put("kind", lence.getKind().name());
            node.put("detail", lence.getDetail());
            if (lence instanceof InvalidParametersException invalid) {
                node.set("missing", toArray(mapper, invalid.getMissing()));
                node.set("extra", toArray(mapper, invalid.getExtra()));
                ObjectNode reasons = mapper.createObjectNode();
                for (Map.Entry<String, String> entry : invalid.getInvalid().entrySet()) {
                    reasons.put(entry.getKey(), entry.getValue());
                }
                node.set("invalid", reasons);
            }
            return node;
        }
        String message = exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
        node.put("kind", exception instanceof IllegalArgumentException ? INVALID_REQUEST : INTERNAL_ERROR);
        node.put("detail", message);
        return node;
    }

    private static ArrayNode toArray(ObjectMapper mapper, List<String> values) {
        ArrayNode array = mapper.createArrayNode();
        values.forEach(array::add);
        return array;
    }
}
