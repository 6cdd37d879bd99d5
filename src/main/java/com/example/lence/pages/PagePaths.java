package com.example.lence.pages;

import java.util.ArrayList;
import java.util.List;

public final class PagePaths {
    public static final String ROOT = "/";

    private PagePaths() {
    }

    /**
     * Canonical page path: leading slash, no trailing slash, no {@code .md} suffix, {@code index} folded into its
     * directory. {@code "sales"}, {@code "/sales/"}, {@code "sales.md"} and {@code "sales/index.md"} are all
     * {@code "/sales"}.
     */
    public static String normalize(String path) {
        if (path == null) {
            return ROOT;
        }
        String unix = path.trim().replace('\\', '/');
        if (unix.endsWith(".md")) {
            unix = unix.substring(0, unix.length() - 3);
        }
        List<String> parts = new ArrayList<>();
        for (String part : unix.split("/")) {
            if (!part.isEmpty() && !part.equals(".")) {
                parts.add(part);
            }
        }
        if (!parts.isEmpty() && parts.get(parts.size() - 1).equals("index")) {
            parts.remove(parts.size() - 1);
        }
        return parts.isEmpty() ? ROOT : "/" + String.join("/", parts);
    }
}
