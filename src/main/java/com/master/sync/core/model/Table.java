package com.master.sync.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable in-memory table: an ordered list of column names and rows keyed by column name.
 * A {@code null} cell is a missing value. Every row carries exactly the table's columns.
 *
 * <p>All transformations return a new table; the receiver is never modified.</p>
 */
public final class Table {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    public Table(List<String> columns, List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(columns, "columns is required");
        Objects.requireNonNull(rows, "rows is required");
        Set<String> unique = new LinkedHashSet<>(columns);
        if (unique.size() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + columns);
        }
        this.columns = List.copyOf(columns);
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (String column : this.columns) {
                normalized.put(column, row.get(column));
            }
            copied.add(Collections.unmodifiableMap(normalized));
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    public static Table empty(List<String> columns) {
        return new Table(columns, List.of());
    }

    public static Builder builder(String... columns) {
        return new Builder(Arrays.asList(columns));
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public Map<String, Object> row(int index) {
        return rows.get(index);
    }

    public Object get(int rowIndex, String column) {
        requireColumn(column);
        return rows.get(rowIndex).get(column);
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

    /**
     * Returns all values of one column in row order.
     */
    public List<Object> values(String column) {
        requireColumn(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Projects the table onto the given columns, in the given order.
     */
    public Table select(List<String> selected) {
        for (String column : selected) {
            requireColumn(column);
        }
        return new Table(selected, rows);
    }

    /**
     * Removes the given columns; names not present are ignored.
     */
    public Table drop(Collection<String> dropped) {
        List<String> kept = new ArrayList<>(columns);
        kept.removeAll(dropped);
        return new Table(kept, rows);
    }

    /**
     * Renames columns; names absent from the mapping keep their name.
     */
    public Table rename(Map<String, String> mapping) {
        List<String> renamed = new ArrayList<>(columns.size());
        for (String column : columns) {
            renamed.add(mapping.getOrDefault(column, column));
        }
        List<Map<String, Object>> newRows = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> newRow = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                newRow.put(renamed.get(i), row.get(columns.get(i)));
            }
            newRows.add(newRow);
        }
        return new Table(renamed, newRows);
    }

    /**
     * Replaces the header by position. The number of names must match the column count.
     */
    public Table renamePositionally(List<String> names) {
        if (names.size() != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size()
                    + " column names but got " + names.size() + ": " + names);
        }
        Map<String, String> mapping = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            mapping.put(columns.get(i), names.get(i));
        }
        return rename(mapping);
    }

    /**
     * Returns a copy with the column set to a constant value, appended if absent.
     */
    public Table withConstant(String column, Object value) {
        List<String> newColumns = new ArrayList<>(columns);
        if (!newColumns.contains(column)) {
            newColumns.add(column);
        }
        List<Map<String, Object>> newRows = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> newRow = new LinkedHashMap<>(row);
            newRow.put(column, value);
            newRows.add(newRow);
        }
        return new Table(newColumns, newRows);
    }

    /**
     * Inner join on a single column. Columns of {@code other} that already exist in this
     * table keep this table's values.
     */
    public Table innerJoin(Table other, String on) {
        requireColumn(on);
        other.requireColumn(on);
        List<String> joinedColumns = new ArrayList<>(columns);
        for (String column : other.columns) {
            if (!joinedColumns.contains(column)) {
                joinedColumns.add(column);
            }
        }
        Map<Object, List<Map<String, Object>>> index = new LinkedHashMap<>();
        for (Map<String, Object> row : other.rows) {
            index.computeIfAbsent(row.get(on), k -> new ArrayList<>()).add(row);
        }
        List<Map<String, Object>> joined = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            for (Map<String, Object> match : index.getOrDefault(row.get(on), List.of())) {
                Map<String, Object> merged = new LinkedHashMap<>(match);
                merged.putAll(row);
                joined.add(merged);
            }
        }
        return new Table(joinedColumns, joined);
    }

    /**
     * Stacks tables vertically. The result has the union of all columns in order of first
     * appearance; cells for columns a table lacks are missing.
     */
    public static Table concat(List<Table> tables) {
        Set<String> union = new LinkedHashSet<>();
        List<Map<String, Object>> allRows = new ArrayList<>();
        for (Table table : tables) {
            union.addAll(table.columns);
            allRows.addAll(table.rows);
        }
        return new Table(new ArrayList<>(union), allRows);
    }

    /**
     * Splits the table into consecutive slices of at most {@code chunkSize} rows.
     */
    public List<Table> chunks(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        List<Table> chunks = new ArrayList<>();
        for (int start = 0; start < rows.size(); start += chunkSize) {
            int end = Math.min(start + chunkSize, rows.size());
            chunks.add(new Table(columns, rows.subList(start, end)));
        }
        return chunks;
    }

    private void requireColumn(String column) {
        if (!columns.contains(column)) {
            throw new IllegalArgumentException("Unknown column '" + column + "', columns=" + columns);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Table table = (Table) o;
        return columns.equals(table.columns) && rows.equals(table.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Table{columns=" + columns + ", rows=" + rows.size() + '}';
    }

    public static class Builder {
        private final List<String> columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = List.copyOf(columns);
        }

        /**
         * Adds a row whose values are given in column order.
         */
        public Builder row(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException("Expected " + columns.size()
                        + " values but got " + values.length);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i]);
            }
            rows.add(row);
            return this;
        }

        public Builder row(Map<String, ?> values) {
            rows.add(new LinkedHashMap<>(values));
            return this;
        }

        public Table build() {
            return new Table(columns, rows);
        }
    }
}
