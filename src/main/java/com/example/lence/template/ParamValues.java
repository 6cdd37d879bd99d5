package com.example.lence.template;

import com.example.lence.model.ParamValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts request JSON into {@link ParamValue}s. Shapes outside the supported domain are kept as
 * {@link ParamValue.Unsupported} so the caller still sees the name and gets a validation error for it.
 */
public final class ParamValues {

    private ParamValues() {
    }

    public static Map<String, ParamValue> fromJson(JsonNode node) {
        Map<String, ParamValue> values = new LinkedHashMap<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return values;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("'params' must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), toValue(field.getValue()));
        }
        return values;
    }

    public static ParamValue toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ParamValue.NULL;
        }
        if (node.isTextual()) {
            return new ParamValue.Text(node.textValue());
        }
        if (node.isBoolean()) {
            return ParamValue.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return new ParamValue.Number(new BigDecimal(node.bigIntegerValue()));
        }
        if (node.isNumber()) {
            if (node.isDouble() || node.isFloat()) {
                return ParamValue.of(node.doubleValue());
            }
            return new ParamValue.Number(node.decimalValue());
        }
        if (node.isArray()) {
            List<ParamValue> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(toValue(element));
            }
            return new ParamValue.ListValue(elements);
        }
        return new ParamValue.Unsupported(node.getNodeType().name().toLowerCase(Locale.ROOT));
    }
}
