package com.skanga.dbgate.db;

import java.util.List;

/**
 * Immutable result of one statement execution.
 *
 * @param columns column names in result set order, empty when the statement produced no result set
 * @param rows data rows, each a list of column values, never more than {@code rowLimit}
 * @param rowCount number of rows returned
 * @param rowLimit effective row limit that was applied
 * @param executionTimeMs time taken to execute and read the statement in milliseconds
 */
public record QueryResult(List<String> columns, List<List<Object>> rows, int rowCount, int rowLimit, long executionTimeMs) {
    public QueryResult {
        if (columns == null) {
            throw new IllegalArgumentException("Columns cannot be null");
        }
        if (rows == null) {
            throw new IllegalArgumentException("Rows cannot be null");
        }
        if (rowCount < 0) {
            throw new IllegalArgumentException("Row count cannot be negative");
        }
        if (executionTimeMs < 0) {
            throw new IllegalArgumentException("Execution time cannot be negative");
        }
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    /**
     * True when the statement produced no result set at all (DDL or DML).
     */
    public boolean hasNoResultSet() {
        return columns.isEmpty();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * True when the row limit was reached, so more rows may have been discarded.
     */
    public boolean truncated() {
        return rowCount > 0 && rowCount == rowLimit;
    }
}
