package com.patent.linkage.bulk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Row-oriented table of string cells with a fixed column list.
 * Every row holds a value for every column; absent cells are empty strings.
 */
public final class Table {

    private final List<String> columns;
    private final List<Map<String, String>> rows;

    private Table(List<String> columns, List<Map<String, String>> rows) {
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(rows);
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public static Builder builder(String... columns) {
        return new Builder(List.of(columns));
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, String>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public String value(int rowIndex, String column) {
        return rows.get(rowIndex).getOrDefault(column, "");
    }

    /**
     * Checks that every required column is present.
     *
     * @param source description of where the table came from, used in the error
     * @throws InputSchemaException naming all missing columns
     */
    public void requireColumns(String source, List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String column : required) {
            if (!columns.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new InputSchemaException(source, missing);
        }
    }

    public static class Builder {
        private final List<String> columns;
        private final List<Map<String, String>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            Objects.requireNonNull(columns, "columns is required");
            if (new LinkedHashSet<>(columns).size() != columns.size()) {
                throw new IllegalArgumentException("Duplicate column names: " + columns);
            }
            this.columns = List.copyOf(columns);
        }

        /**
         * Adds a row of values in column order. Nulls become empty strings.
         */
        public Builder addRow(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException("Expected " + columns.size() + " values, got " + values.length);
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i] == null ? "" : values[i].toString());
            }
            rows.add(Collections.unmodifiableMap(row));
            return this;
        }

        /**
         * Adds a row from a column map. Unknown columns are ignored.
         */
        public Builder addRow(Map<String, String> values) {
            Map<String, String> row = new LinkedHashMap<>();
            for (String column : columns) {
                String value = values.get(column);
                row.put(column, value == null ? "" : value);
            }
            rows.add(Collections.unmodifiableMap(row));
            return this;
        }

        public Table build() {
            return new Table(columns, new ArrayList<>(rows));
        }
    }

    @Override
    public String toString() {
        return "Table{columns=" + columns + ", rows=" + rows.size() + '}';
    }
}
