package com.example.lence.model;

public record ColumnInfo(String name, String type) {
}
