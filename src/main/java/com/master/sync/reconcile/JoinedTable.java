package com.master.sync.reconcile;

import com.master.sync.core.model.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of an outer join: the joined rows plus the provenance of each row.
 *
 * @param table       joined rows; non-key columns carry a {@code _left} or {@code _right} suffix
 * @param keyColumns  join keys, unsuffixed
 * @param provenance  one entry per row of {@code table}
 */
public record JoinedTable(Table table, List<String> keyColumns, List<Provenance> provenance) {

    public static final String LEFT_SUFFIX = "_left";
    public static final String RIGHT_SUFFIX = "_right";

    public JoinedTable {
        Objects.requireNonNull(table, "table is required");
        keyColumns = List.copyOf(keyColumns);
        provenance = List.copyOf(provenance);
        if (provenance.size() != table.size()) {
            throw new IllegalArgumentException("provenance size " + provenance.size()
                    + " does not match row count " + table.size());
        }
    }

    /**
     * Rows with the given provenance, in joined order.
     */
    public List<Map<String, Object>> rows(Provenance kind) {
        List<Map<String, Object>> selected = new ArrayList<>();
        for (int i = 0; i < table.size(); i++) {
            if (provenance.get(i) == kind) {
                selected.add(table.row(i));
            }
        }
        return selected;
    }

    public long count(Provenance kind) {
        return provenance.stream().filter(p -> p == kind).count();
    }

    public boolean hasColumn(String column) {
        return table.hasColumn(column);
    }
}
