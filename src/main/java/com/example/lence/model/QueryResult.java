package com.example.lence.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tabular query output: columns in engine order, row-major data, and a row count that always equals
 * {@code data.size()}.
 */
public record QueryResult(
        List<ColumnInfo> columns,
        List<List<Object>> data,
        int rowCount
) {
    public QueryResult {
        columns = List.copyOf(columns);
        List<List<Object>> rows = new ArrayList<>(data.size());
        for (List<Object> row : data) {
            if (row.size() != columns.size()) {
                throw new IllegalStateException("Row width " + row.size() + " does not match column count " + columns.size());
            }
            // rows may carry SQL NULLs, so List.copyOf is not an option
            rows.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        if (rowCount != rows.size()) {
            throw new IllegalStateException("Row count " + rowCount + " does not match " + rows.size() + " data rows");
        }
        data = Collections.unmodifiableList(rows);
    }

    public static QueryResult of(List<ColumnInfo> columns, List<List<Object>> data) {
        return new QueryResult(columns, data, data.size());
    }
}
