package com.spatialnote.backend.domain.payload;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular payload. Cells are kept as strings; dtypes maps a column name to a
 * declared type ("int", "float", "datetime", "bool", ...).
 */
public record DataFrameData(
        List<String> columns,
        List<List<String>> rows,
        Map<String, String> dtypes
) {
    public DataFrameData {
        columns = columns != null ? List.copyOf(columns) : List.of();
        rows = rows != null ? rows.stream().map(r -> r == null ? List.<String>of() : List.copyOf(r)).toList() : List.of();
        dtypes = dtypes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(dtypes)) : Map.of();
    }

    public int shapeRows() {
        return rows.size();
    }

    public int shapeColumns() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty() || rows.isEmpty();
    }

    /** Value of a cell, or an empty string for ragged rows. */
    public String cell(int row, int column) {
        List<String> r = rows.get(row);
        return column < r.size() ? r.get(column) : "";
    }
}
