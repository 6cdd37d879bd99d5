package com.example.lence.model;

import com.example.lence.error.LenceException;

import java.util.Locale;

public enum SourceKind {
    CSV("csv"),
    PARQUET("parquet");

    private final String label;

    SourceKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SourceKind fromLabel(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (SourceKind kind : values()) {
                if (kind.label.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw LenceException.configuration("Unsupported source type: " + value);
    }
}
