package com.example.lence.template;

import com.example.lence.error.InvalidParametersException;
import com.example.lence.model.ParamValue;
import com.example.lence.model.QueryDefinition;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Substitutes parameter values into a SQL template as SQL literals.
 * <p>
 * The backing engine addresses sources as named views rather than bind parameters, so this encoding is the only
 * thing standing between request values and the SQL text. Each value becomes a closed literal (or a parenthesised
 * list of them); anything that cannot be written that way is rejected.
 */
public final class SqlInterpolator {

    private SqlInterpolator() {
    }

    public static String interpolate(QueryDefinition definition, Map<String, ParamValue> values) {
        return interpolate(definition.sqlTemplate(), values);
    }

    public static String interpolate(String sqlTemplate, Map<String, ParamValue> values) {
        List<PlaceholderScanner.Segment> segments = PlaceholderScanner.scan(sqlTemplate);

        List<String> missing = new ArrayList<>();
        Map<String, String> invalid = new LinkedHashMap<>();
        for (PlaceholderScanner.Segment segment : segments) {
            if (!(segment instanceof PlaceholderScanner.Placeholder placeholder)) {
                continue;
            }
            String name = placeholder.name();
            if (!values.containsKey(name)) {
                if (!missing.contains(name)) {
                    missing.add(name);
                }
                continue;
            }
            String problem = validate(values.get(name), true);
            if (problem != null) {
                invalid.putIfAbsent(name, problem);
            }
        }
        if (!missing.isEmpty()) {
            throw InvalidParametersException.mismatch(missing, List.of());
        }
        if (!invalid.isEmpty()) {
            throw InvalidParametersException.invalidValues(invalid);
        }

        StringBuilder sql = new StringBuilder(sqlTemplate.length());
        for (PlaceholderScanner.Segment segment : segments) {
            if (segment instanceof PlaceholderScanner.Literal literal) {
                sql.append(literal.text());
            } else if (segment instanceof PlaceholderScanner.Placeholder placeholder) {
                // E${...} or U&${...} would otherwise turn the literal into an escape string
                if (sql.length() > 0 && isPrefixChar(sql.charAt(sql.length() - 1))) {
                    sql.append(' ');
                }
                sql.append(encode(values.get(placeholder.name()), placeholder.parenthesized()));
            }
        }
        return sql.toString();
    }

    /**
     * Encodes a single value as SQL text. A list renders as {@code (a, b)} unless the template already opened the
     * parenthesis, in which case only the elements are written.
     */
    public static String encode(ParamValue value, boolean parenthesized) {
        String problem = validate(value, true);
        if (problem != null) {
            throw new IllegalArgumentException("Cannot encode parameter value: " + problem);
        }
        if (value instanceof ParamValue.ListValue list) {
            StringJoiner joiner = parenthesized
                    ? new StringJoiner(", ")
                    : new StringJoiner(", ", "(", ")");
            for (ParamValue element : list.elements()) {
                joiner.add(encodeScalar(element));
            }
            return joiner.toString();
        }
        return encodeScalar(value);
    }

    public static String quote(String text) {
        return '\'' + text.replace("'", "''") + '\'';
    }

    private static boolean isPrefixChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '&';
    }

    private static String encodeScalar(ParamValue value) {
        if (value instanceof ParamValue.Text text) {
            return quote(text.value());
        }
        if (value instanceof ParamValue.Number number) {
            return renderNumber(number.value());
        }
        if (value instanceof ParamValue.Bool bool) {
            return bool.value() ? "TRUE" : "FALSE";
        }
        if (value instanceof ParamValue.Null) {
            return "NULL";
        }
        throw new IllegalArgumentException("Not a scalar parameter value: " + value);
    }

    private static String renderNumber(BigDecimal number) {
        String plain = number.toPlainString();
        // a bare leading minus after another '-' in the template would start a line comment
        return number.signum() < 0 ? "(" + plain + ")" : plain;
    }

    private static String validate(ParamValue value, boolean allowList) {
        if (value == null) {
            return "no value";
        }
        if (value instanceof ParamValue.Text text) {
            return text.value().indexOf('\0') >= 0 ? "string contains a NUL character" : null;
        }
        if (value instanceof ParamValue.Number || value instanceof ParamValue.Bool || value instanceof ParamValue.Null) {
            return null;
        }
        if (value instanceof ParamValue.ListValue list) {
            if (!allowList) {
                return "nested lists are not supported";
            }
            if (list.elements().isEmpty()) {
                return "empty lists are not supported";
            }
            for (ParamValue element : list.elements()) {
                String problem = validate(element, false);
                if (problem != null) {
                    return "list element: " + problem;
                }
            }
            return null;
        }
        if (value instanceof ParamValue.Unsupported unsupported) {
            return "unsupported value type: " + unsupported.description();
        }
        return "unsupported value type: " + value.getClass().getSimpleName();
    }
}
