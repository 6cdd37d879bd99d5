package com.example.lence.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter validation failure. Every offending name is carried at once: names the query expects but the
 * request omitted, names the request supplied that the query never references, and supplied values that
 * cannot be encoded (keyed by name, with the reason).
 */
public class InvalidParametersException extends LenceException {
    private final List<String> missing;
    private final List<String> extra;
    private final Map<String, String> invalid;

    public InvalidParametersException(List<String> missing, List<String> extra, Map<String, String> invalid) {
        super(ErrorKind.INVALID_PARAMETERS, describe(missing, extra, invalid));
        this.missing = List.copyOf(missing);
        this.extra = List.copyOf(extra);
        this.invalid = Collections.unmodifiableMap(new LinkedHashMap<>(invalid));
    }

    public static InvalidParametersException mismatch(List<String> missing, List<String> extra) {
        return new InvalidParametersException(missing, extra, Map.of());
    }

    public static InvalidParametersException invalidValues(Map<String, String> invalid) {
        return new InvalidParametersException(List.of(), List.of(), invalid);
    }

    public List<String> getMissing() {
        return missing;
    }

    public List<String> getExtra() {
        return extra;
    }

    public Map<String, String> getInvalid() {
        return invalid;
    }

    private static String describe(List<String> missing, List<String> extra, Map<String, String> invalid) {
        List<String> parts = new ArrayList<>();
        if (!missing.isEmpty()) {
            parts.add("Missing parameters: " + missing);
        }
        if (!extra.isEmpty()) {
            parts.add("Unexpected parameters: " + extra);
        }
        if (!invalid.isEmpty()) {
            List<String> reasons = new ArrayList<>();
            invalid.forEach((name, reason) -> reasons.add(name + " (" + reason + ")"));
            parts.add("Invalid values: " + String.join(", ", reasons));
        }
        return parts.isEmpty() ? "Invalid parameters" : String.join("; ", parts);
    }
}
