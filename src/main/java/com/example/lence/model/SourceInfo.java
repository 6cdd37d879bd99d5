package com.example.lence.model;

public record SourceInfo(String name, SourceKind kind, String description) {
}
