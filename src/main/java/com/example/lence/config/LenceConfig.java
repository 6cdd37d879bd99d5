package com.example.lence.config;

import com.example.lence.catalog.JdbcSourceCatalog;
import com.example.lence.model.ServerMode;

import java.nio.file.Path;

/**
 * Server settings. The project directory comes from the first argument or {@code lence.project}; everything else
 * from system properties.
 */
public record LenceConfig(
        Path projectDir,
        ServerMode mode,
        String jdbcUrl,
        boolean watchPages
) {
    public static final String PROJECT_PROPERTY = "lence.project";
    public static final String MODE_PROPERTY = "lence.mode";
    public static final String JDBC_URL_PROPERTY = "lence.jdbcUrl";
    public static final String WATCH_PROPERTY = "lence.watch";

    public static LenceConfig load(String[] args) {
        String project = args != null && args.length > 0 && !args[0].isBlank()
                ? args[0]
                : System.getProperty(PROJECT_PROPERTY, ".");
        ServerMode mode = ServerMode.parse(System.getProperty(MODE_PROPERTY));
        String jdbcUrl = System.getProperty(JDBC_URL_PROPERTY, JdbcSourceCatalog.DEFAULT_JDBC_URL);
        boolean watch = Boolean.parseBoolean(System.getProperty(WATCH_PROPERTY, String.valueOf(mode == ServerMode.EDIT)));
        return new LenceConfig(Path.of(project).toAbsolutePath().normalize(), mode, jdbcUrl, watch);
    }

    public Path pagesDir() {
        return projectDir.resolve("pages");
    }

    public Path sourcesFile() {
        return projectDir.resolve("sources").resolve("sources.yaml");
    }
}
