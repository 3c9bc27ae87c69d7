package com.master.sync.reconcile;

import com.master.sync.core.model.Table;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Column layout of one entity sheet: every column name, the key columns identifying a row,
 * the columns dropped on load, and the columns compared for changes.
 *
 * @param columnNames    all columns of the downloaded sheet, in sheet order
 * @param keyColumns     non-empty join key
 * @param dropColumns    columns removed before reconciliation
 * @param compareColumns columns whose differences produce an UPDATE
 */
public record ReconciliationKeySpec(
        List<String> columnNames,
        List<String> keyColumns,
        List<String> dropColumns,
        List<String> compareColumns
) {
    public ReconciliationKeySpec {
        Objects.requireNonNull(columnNames, "columnNames is required");
        Objects.requireNonNull(keyColumns, "keyColumns is required");
        columnNames = List.copyOf(columnNames);
        keyColumns = List.copyOf(keyColumns);
        dropColumns = dropColumns != null ? List.copyOf(dropColumns) : List.of();
        compareColumns = compareColumns != null ? List.copyOf(compareColumns) : List.of();
        if (keyColumns.isEmpty()) {
            throw new IllegalArgumentException("keyColumns must not be empty");
        }
        if (new HashSet<>(keyColumns).size() != keyColumns.size()) {
            throw new IllegalArgumentException("keyColumns must be unique: " + keyColumns);
        }
        for (String key : keyColumns) {
            if (compareColumns.contains(key)) {
                throw new IllegalArgumentException("Key column '" + key + "' cannot also be compared");
            }
        }
    }

    /**
     * Derives the compare columns as every column that is neither a key nor dropped.
     */
    public static ReconciliationKeySpec of(List<String> columnNames, List<String> keyColumns,
                                           List<String> dropColumns) {
        List<String> drop = dropColumns != null ? dropColumns : List.of();
        List<String> compare = new ArrayList<>();
        for (String column : columnNames) {
            if (!keyColumns.contains(column) && !drop.contains(column)) {
                compare.add(column);
            }
        }
        return new ReconciliationKeySpec(columnNames, keyColumns, drop, compare);
    }

    /**
     * Applies the sheet header to a downloaded table by position and removes the drop columns.
     */
    public Table prepareDownloaded(Table downloaded) {
        return downloaded.renamePositionally(columnNames).drop(dropColumns);
    }
}
