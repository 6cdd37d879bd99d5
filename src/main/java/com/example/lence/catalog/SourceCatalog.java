package com.example.lence.catalog;

import com.example.lence.model.QueryResult;
import com.example.lence.model.SourceInfo;
import com.example.lence.model.SourceKind;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Named, file-backed relations that SQL can query by name.
 */
public interface SourceCatalog extends AutoCloseable {

    /**
     * Makes {@code name} queryable. Replaces an existing source of the same name.
     *
     * @throws com.example.lence.error.LenceException with kind {@code CONFIGURATION_ERROR} if the name, kind or
     *                                                location cannot be registered
     */
    void register(String name, SourceKind kind, Path location, String description);

    /**
     * Runs SQL text against the registered sources.
     *
     * @throws SQLException when the engine rejects or fails the statement
     */
    QueryResult execute(String sql) throws SQLException;

    List<SourceInfo> list();

    Optional<SourceInfo> describe(String name);

    default boolean contains(String name) {
        return describe(name).isPresent();
    }

    @Override
    void close();
}
