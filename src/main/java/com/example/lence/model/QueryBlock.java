package com.example.lence.model;

/**
 * One {@code query} tag as found in a page, before its parameters are extracted.
 *
 * @param line 1-based line of the opening tag, used in corpus error messages
 */
public record QueryBlock(
        String page,
        String name,
        String source,
        String sql,
        int line
) {
}
