package com.example.lence.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry under {@code sources:} in {@code sources.yaml}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceDefinition(String type, String path, String description) {
}
