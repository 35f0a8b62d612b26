package com.jobly.board.sql;

import java.util.Map;

/**
 * Maps external (JSON) field names to storage column names. Fields without an entry map to
 * themselves.
 */
public final class ColumnMap {
    private static final ColumnMap IDENTITY = new ColumnMap(Map.of());

    private final Map<String, String> columns;

    private ColumnMap(Map<String, String> columns) {
        this.columns = columns;
    }

    public static ColumnMap identity() {
        return IDENTITY;
    }

    public static ColumnMap of(Map<String, String> columns) {
        return columns == null || columns.isEmpty() ? IDENTITY : new ColumnMap(Map.copyOf(columns));
    }

    public String columnFor(String field) {
        return columns.getOrDefault(field, field);
    }
}
