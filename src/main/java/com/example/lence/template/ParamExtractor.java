package com.example.lence.template;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class ParamExtractor {
    private ParamExtractor() {
    }

    /**
     * Distinct parameter names referenced by the template, in order of first occurrence.
     */
    public static List<String> extract(String sqlTemplate) {
        Set<String> names = new LinkedHashSet<>();
        for (PlaceholderScanner.Segment segment : PlaceholderScanner.scan(sqlTemplate)) {
            if (segment instanceof PlaceholderScanner.Placeholder placeholder) {
                names.add(placeholder.name());
            }
        }
        return List.copyOf(new ArrayList<>(names));
    }
}
