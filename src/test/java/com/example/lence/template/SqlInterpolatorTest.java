package com.example.lence.template;

import com.example.lence.error.InvalidParametersException;
import com.example.lence.model.ParamValue;
import com.example.lence.model.QueryDefinition;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlInterpolatorTest {

    @Test
    void doublesSingleQuotesInStrings() {
        String sql = SqlInterpolator.interpolate(
                "SELECT * FROM people WHERE name = ${inputs.name.value}",
                Map.of("name", ParamValue.of("O'Brien")));

        assertEquals("SELECT * FROM people WHERE name = 'O''Brien'", sql);
    }

    @Test
    void keepsInjectionAttemptInsideOneLiteral() {
        String sql = SqlInterpolator.interpolate(
                "SELECT * FROM users WHERE name = ${inputs.name.value}",
                Map.of("name", ParamValue.of("x' OR '1'='1")));

        assertEquals("SELECT * FROM users WHERE name = 'x'' OR ''1''=''1'", sql);
    }

    @Test
    void rendersScalarsAsLiterals() {
        Map<String, ParamValue> values = new LinkedHashMap<>();
        values.put("limit", ParamValue.of(10));
        values.put("ratio", ParamValue.of(1.5));
        values.put("active", ParamValue.of(true));
        values.put("deleted", ParamValue.of(false));
        values.put("owner", ParamValue.NULL);

        String sql = SqlInterpolator.interpolate(
                "SELECT ${inputs.limit.value}, ${inputs.ratio.value}, ${inputs.active.value}, "
                        + "${inputs.deleted.value}, ${inputs.owner.value}",
                values);

        assertEquals("SELECT 10, 1.5, TRUE, FALSE, NULL", sql);
    }

    @Test
    void parenthesizesNegativeNumbers() {
        String sql = SqlInterpolator.interpolate("SELECT 1 -${inputs.offset.value}",
                Map.of("offset", ParamValue.of(-5)));

        assertEquals("SELECT 1 -(-5)", sql);
    }

    @Test
    void interpolatesEndToEndScenario() {
        QueryDefinition definition = QueryDefinition.of("/sales", "top", "orders_src",
                "SELECT * FROM orders WHERE region = ${inputs.region.value} LIMIT ${inputs.limit.value}");
        Map<String, ParamValue> values = new LinkedHashMap<>();
        values.put("region", ParamValue.of("west"));
        values.put("limit", ParamValue.of(10));

        assertEquals("SELECT * FROM orders WHERE region = 'west' LIMIT 10",
                SqlInterpolator.interpolate(definition, values));
    }

    @Test
    void rendersListsForInClauses() {
        ParamValue ids = ParamValue.list(ParamValue.of(1), ParamValue.of(2), ParamValue.of(3));

        assertEquals("SELECT * FROM t WHERE id IN (1, 2, 3)",
                SqlInterpolator.interpolate("SELECT * FROM t WHERE id IN ${inputs.ids.value}", Map.of("ids", ids)));
        assertEquals("SELECT * FROM t WHERE id IN (1, 2, 3)",
                SqlInterpolator.interpolate("SELECT * FROM t WHERE id IN (${inputs.ids.value})", Map.of("ids", ids)));
        assertEquals("SELECT * FROM t WHERE id IN ( 1, 2, 3 )",
                SqlInterpolator.interpolate("SELECT * FROM t WHERE id IN ( ${inputs.ids.value} )", Map.of("ids", ids)));
    }

    @Test
    void escapesEveryStringInAList() {
        ParamValue names = ParamValue.list(ParamValue.of("a'b"), ParamValue.NULL);

        assertEquals("SELECT * FROM t WHERE name IN ('a''b', NULL)",
                SqlInterpolator.interpolate("SELECT * FROM t WHERE name IN ${inputs.names.value}", Map.of("names", names)));
    }

    @Test
    void rejectsEmptyLists() {
        InvalidParametersException error = assertThrows(InvalidParametersException.class,
                () -> SqlInterpolator.interpolate("SELECT * FROM t WHERE id IN ${inputs.ids.value}",
                        Map.of("ids", ParamValue.list())));

        assertEquals(List.of("ids"), List.copyOf(error.getInvalid().keySet()));
        assertTrue(error.getInvalid().get("ids").contains("empty"));
    }

    @Test
    void reportsEveryUnsupportedValueTogether() {
        Map<String, ParamValue> values = new LinkedHashMap<>();
        values.put("filter", new ParamValue.Unsupported("object"));
        values.put("nested", ParamValue.list(ParamValue.list(ParamValue.of(1))));
        values.put("ok", ParamValue.of(1));

        InvalidParametersException error = assertThrows(InvalidParametersException.class,
                () -> SqlInterpolator.interpolate(
                        "SELECT ${inputs.filter.value}, ${inputs.nested.value}, ${inputs.ok.value}", values));

        assertEquals(List.of("filter", "nested"), List.copyOf(error.getInvalid().keySet()));
        assertTrue(error.getDetail().contains("filter"));
        assertTrue(error.getDetail().contains("nested"));
    }

    @Test
    void rejectsNulCharactersInStrings() {
        assertThrows(InvalidParametersException.class,
                () -> SqlInterpolator.interpolate("SELECT ${inputs.s.value}", Map.of("s", ParamValue.of("a\0b"))));
    }

    @Test
    void reportsPlaceholdersWithoutValuesAsMissing() {
        InvalidParametersException error = assertThrows(InvalidParametersException.class,
                () -> SqlInterpolator.interpolate("SELECT ${inputs.a.value}, ${inputs.b.value}", Map.of()));

        assertEquals(List.of("a", "b"), error.getMissing());
    }

    @Test
    void leavesLiteralsCommentsAndMalformedTokensUntouched() {
        String template = "SELECT '${inputs.x.value}' AS raw, ${inputs.x} AS broken -- ${inputs.x.value}\n"
                + "FROM t WHERE a = ${inputs.y.value}";

        String sql = SqlInterpolator.interpolate(template, Map.of("y", ParamValue.of(1)));

        assertEquals("SELECT '${inputs.x.value}' AS raw, ${inputs.x} AS broken -- ${inputs.x.value}\n"
                + "FROM t WHERE a = 1", sql);
    }

    @Test
    void substitutesRepeatedPlaceholdersEverywhere() {
        String sql = SqlInterpolator.interpolate(
                "SELECT * FROM t WHERE a = ${inputs.v.value} OR b = ${inputs.v.value}",
                Map.of("v", ParamValue.of("x")));

        assertEquals("SELECT * FROM t WHERE a = 'x' OR b = 'x'", sql);
    }

    @Test
    void leavesDollarQuotedStringsUntouched() {
        String template = "SELECT $$note: ${inputs.x.value}$$ AS v, $body$ ${inputs.x.value} $body$ AS w "
                + "FROM t WHERE a = ${inputs.y.value}";

        String sql = SqlInterpolator.interpolate(template, Map.of("y", ParamValue.of("$$ AS v, (SELECT 42) AS injected --")));

        assertEquals("SELECT $$note: ${inputs.x.value}$$ AS v, $body$ ${inputs.x.value} $body$ AS w "
                + "FROM t WHERE a = '$$ AS v, (SELECT 42) AS injected --'", sql);
    }

    @Test
    void leavesEscapeStringsUntouched() {
        String template = "SELECT E'it\\'s ${inputs.x.value}' AS v FROM t WHERE a = ${inputs.y.value}";

        String sql = SqlInterpolator.interpolate(template, Map.of("y", ParamValue.of(2)));

        assertEquals("SELECT E'it\\'s ${inputs.x.value}' AS v FROM t WHERE a = 2", sql);
    }

    @Test
    void separatesLiteralFromPrecedingIdentifierCharacter() {
        String sql = SqlInterpolator.interpolate("SELECT E${inputs.s.value}, U&${inputs.s.value}",
                Map.of("s", ParamValue.of("\\' OR 1=1 --")));

        assertEquals("SELECT E '\\'' OR 1=1 --', U& '\\'' OR 1=1 --'", sql);
    }
}
