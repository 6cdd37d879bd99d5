package com.example.lence.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tools in registration order; names are unique.
 */
public class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public void register(Tool tool) {
        Tool previous = tools.putIfAbsent(tool.getName(), tool);
        if (previous != null) {
            throw new IllegalStateException("Tool '" + tool.getName() + "' is already registered");
        }
    }

    public List<Tool> list() {
        return Collections.unmodifiableList(new ArrayList<>(tools.values()));
    }
}
