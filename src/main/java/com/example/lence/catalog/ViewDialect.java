package com.example.lence.catalog;

import com.example.lence.error.LenceException;
import com.example.lence.model.SourceKind;
import com.example.lence.template.SqlInterpolator;

import java.nio.file.Path;

/**
 * Engine-specific DDL that exposes a data file as a view.
 */
public interface ViewDialect {

    String createView(String name, SourceKind kind, Path location);

    static ViewDialect forJdbcUrl(String jdbcUrl) {
        if (jdbcUrl != null && jdbcUrl.startsWith("jdbc:duckdb:")) {
            return new DuckDb();
        }
        if (jdbcUrl != null && jdbcUrl.startsWith("jdbc:h2:")) {
            return new H2();
        }
        throw LenceException.configuration("Unsupported JDBC URL for the source catalog: " + jdbcUrl);
    }

    final class H2 implements ViewDialect {
        @Override
        public String createView(String name, SourceKind kind, Path location) {
            if (kind != SourceKind.CSV) {
                throw LenceException.configuration(
                        "Source '" + name + "': " + kind.label() + " files are not readable by the H2 engine; use a jdbc:duckdb: URL");
            }
            return "CREATE OR REPLACE VIEW " + name + " AS SELECT * FROM CSVREAD("
                    + SqlInterpolator.quote(location.toString())
                    + ", NULL, 'charset=UTF-8 caseSensitiveColumnNames=true')";
        }
    }

    final class DuckDb implements ViewDialect {
        @Override
        public String createView(String name, SourceKind kind, Path location) {
            String reader = switch (kind) {
                case CSV -> "read_csv_auto";
                case PARQUET -> "read_parquet";
            };
            return "CREATE OR REPLACE VIEW " + name + " AS SELECT * FROM " + reader
                    + "(" + SqlInterpolator.quote(location.toString()) + ")";
        }
    }
}
