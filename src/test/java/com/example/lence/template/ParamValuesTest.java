package com.example.lence.template;

import com.example.lence.model.ParamValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParamValuesTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void mapsEveryJsonShapeToAVariant() throws Exception {
        Map<String, ParamValue> values = ParamValues.fromJson(mapper.readTree(
                "{\"s\":\"west\",\"i\":10,\"d\":2.5,\"b\":true,\"n\":null,\"l\":[1,\"a\"],\"o\":{\"k\":1}}"));

        assertEquals(new ParamValue.Text("west"), values.get("s"));
        assertEquals(new ParamValue.Number(new BigDecimal(10)), values.get("i"));
        assertEquals(new ParamValue.Number(new BigDecimal("2.5")), values.get("d"));
        assertEquals(new ParamValue.Bool(true), values.get("b"));
        assertEquals(ParamValue.NULL, values.get("n"));
        assertEquals(new ParamValue.ListValue(List.of(
                new ParamValue.Number(BigDecimal.ONE), new ParamValue.Text("a"))), values.get("l"));
        assertTrue(values.get("o") instanceof ParamValue.Unsupported);
        assertEquals(List.of("s", "i", "d", "b", "n", "l", "o"), List.copyOf(values.keySet()));
    }

    @Test
    void treatsMissingParamsAsEmpty() {
        assertEquals(Map.of(), ParamValues.fromJson(null));
        assertEquals(Map.of(), ParamValues.fromJson(mapper.nullNode()));
    }

    @Test
    void rejectsNonObjectParams() {
        assertThrows(IllegalArgumentException.class, () -> ParamValues.fromJson(mapper.createArrayNode()));
    }
}
