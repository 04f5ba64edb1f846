package com.community.leaderboard.util;

import java.util.Collections;
import java.util.List;

/**
 * Generates JDBC positional placeholders for multi-row statements.
 */
public final class SqlPlaceholders {

    private SqlPlaceholders() {
    }

    /**
     * A single row tuple, e.g. {@code (?, ?, ?)} for three columns.
     */
    public static String row(int columns) {
        if (columns <= 0) {
            throw new IllegalArgumentException("columns must be positive, got " + columns);
        }
        return "(" + String.join(", ", Collections.nCopies(columns, "?")) + ")";
    }

    /**
     * Row tuples for a multi-row VALUES clause: {@code (?, ?),\n(?, ?)}.
     * A column may carry a cast, see {@link #row(List)}.
     */
    public static String rows(int rowCount, int columns) {
        return rows(rowCount, row(columns));
    }

    /**
     * Same as {@link #rows(int, int)} but each column is given its own placeholder
     * expression, e.g. {@code CAST(? AS jsonb)}.
     */
    public static String rows(int rowCount, List<String> columnPlaceholders) {
        return rows(rowCount, row(columnPlaceholders));
    }

    public static String row(List<String> columnPlaceholders) {
        if (columnPlaceholders == null || columnPlaceholders.isEmpty()) {
            throw new IllegalArgumentException("at least one column placeholder is required");
        }
        return "(" + String.join(", ", columnPlaceholders) + ")";
    }

    /**
     * Comma separated list for an IN clause: {@code ?, ?, ?}.
     */
    public static String list(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive, got " + size);
        }
        return String.join(", ", Collections.nCopies(size, "?"));
    }

    private static String rows(int rowCount, String tuple) {
        if (rowCount <= 0) {
            throw new IllegalArgumentException("rowCount must be positive, got " + rowCount);
        }
        StringBuilder sql = new StringBuilder();
        for (int i = 0; i < rowCount; i++) {
            sql.append(tuple);
            if (i < rowCount - 1) {
                sql.append(",\n");
            }
        }
        return sql.toString();
    }
}
