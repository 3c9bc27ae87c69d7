package com.master.sync.reconcile;

import com.master.sync.core.model.Table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered ADD/UPDATE rows produced by reconciliation, backed by a table whose
 * {@code flag} column holds the flag names.
 */
public final class ChangeSet {

    private final Table table;

    public ChangeSet(Table table) {
        Objects.requireNonNull(table, "table is required");
        if (!table.hasColumn(ChangeFlag.COLUMN)) {
            throw new IllegalArgumentException("A change set needs a '" + ChangeFlag.COLUMN + "' column");
        }
        this.table = table;
    }

    public Table toTable() {
        return table;
    }

    public int size() {
        return table.size();
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }

    public List<String> columns() {
        return table.columns();
    }

    public List<ChangeRow> rows() {
        List<ChangeRow> rows = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            Map<String, Object> values = new LinkedHashMap<>(table.row(i));
            Object flag = values.remove(ChangeFlag.COLUMN);
            rows.add(new ChangeRow(i, ChangeFlag.valueOf(flag.toString()), values));
        }
        return rows;
    }

    public List<ChangeRow> rows(ChangeFlag flag) {
        return rows().stream().filter(r -> r.flag() == flag).toList();
    }

    public long count(ChangeFlag flag) {
        return table.values(ChangeFlag.COLUMN).stream().filter(v -> flag.name().equals(v)).count();
    }

    /**
     * Copies {@code source} into {@code target} on UPDATE rows and sets {@code target} to the
     * empty string elsewhere. Some downstream sheets require the "after" column of an update
     * to repeat the identifier.
     */
    public ChangeSet withAfterColumn(String target, String source) {
        if (!table.hasColumn(source)) {
            throw new IllegalArgumentException("Unknown column '" + source + "'");
        }
        List<String> columns = new ArrayList<>(table.columns());
        if (!columns.contains(target)) {
            columns.add(target);
        }
        List<Map<String, Object>> rows = new ArrayList<>(table.size());
        for (Map<String, Object> row : table.rows()) {
            Map<String, Object> newRow = new LinkedHashMap<>(row);
            boolean update = ChangeFlag.UPDATE.name().equals(row.get(ChangeFlag.COLUMN));
            newRow.put(target, update ? row.get(source) : "");
            rows.add(newRow);
        }
        return new ChangeSet(new Table(columns, rows));
    }

    /**
     * Projects the change set onto the given column order, e.g. the sheet's full header.
     * Columns the change set lacks are added as missing values.
     */
    public ChangeSet reorder(List<String> columnOrder) {
        List<String> columns = new ArrayList<>(columnOrder);
        if (!columns.contains(ChangeFlag.COLUMN)) {
            throw new IllegalArgumentException("Column order must include '" + ChangeFlag.COLUMN + "'");
        }
        return new ChangeSet(new Table(columns, table.rows()));
    }

    @Override
    public String toString() {
        return "ChangeSet{rows=" + size() + ", add=" + count(ChangeFlag.ADD)
                + ", update=" + count(ChangeFlag.UPDATE) + '}';
    }
}
