package com.example.lence.model;

public record QueryKey(String page, String name) {
    @Override
    public String toString() {
        return page + "#" + name;
    }
}
