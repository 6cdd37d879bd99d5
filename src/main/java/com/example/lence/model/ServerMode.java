package com.example.lence.model;

import java.util.Locale;

/**
 * How {@code query.execute} resolves a definition. {@link #EDIT} additionally accepts inline source and SQL
 * from the request so authors can preview queries that are not yet saved in a page.
 */
public enum ServerMode {
    REGISTRY,
    EDIT;

    public static ServerMode parse(String value) {
        if (value == null || value.isBlank()) {
            return REGISTRY;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ServerMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown server mode '" + value + "'; expected 'registry' or 'edit'");
    }
}
