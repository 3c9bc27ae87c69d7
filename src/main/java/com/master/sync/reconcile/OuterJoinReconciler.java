package com.master.sync.reconcile;

import com.master.sync.core.model.Table;
import com.master.sync.core.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Full outer join of the local (left) and downloaded (right) tables on a key set.
 *
 * <p>Non-key columns present on both sides are suffixed {@code _left} / {@code _right}.
 * A non-key column present on one side only keeps its bare name and is rejected by the
 * suffix check, so both inputs must share the same non-key columns.</p>
 *
 * <p>Keys match on their text form, so a numeric key joins the same key read from a text
 * file, and key cells are written as text. Output rows are sorted by key, comparing each
 * key column in turn with missing keys last.</p>
 */
public class OuterJoinReconciler {
    private static final Logger log = LoggerFactory.getLogger(OuterJoinReconciler.class);

    /**
     * @throws SuffixValidationException if a non-key column ends up without a suffix
     * @throws IllegalArgumentException  if a key column is missing from either input
     */
    public JoinedTable join(Table local, Table downloaded, List<String> keyColumns) {
        if (keyColumns == null || keyColumns.isEmpty()) {
            throw new IllegalArgumentException("keyColumns must not be empty");
        }
        for (String key : keyColumns) {
            if (!local.hasColumn(key) || !downloaded.hasColumn(key)) {
                throw new IllegalArgumentException("Key column '" + key + "' must exist in both tables");
            }
        }

        List<String> leftColumns = nonKey(local, keyColumns);
        List<String> rightColumns = nonKey(downloaded, keyColumns);
        Set<String> shared = new HashSet<>(leftColumns);
        shared.retainAll(rightColumns);

        Map<String, String> leftNames = new LinkedHashMap<>();
        for (String column : leftColumns) {
            leftNames.put(column, shared.contains(column) ? column + JoinedTable.LEFT_SUFFIX : column);
        }
        Map<String, String> rightNames = new LinkedHashMap<>();
        for (String column : rightColumns) {
            rightNames.put(column, shared.contains(column) ? column + JoinedTable.RIGHT_SUFFIX : column);
        }

        List<String> columns = new ArrayList<>(keyColumns);
        columns.addAll(leftNames.values());
        columns.addAll(rightNames.values());
        validateSuffixes(columns, keyColumns);

        Map<List<Object>, List<Map<String, Object>>> rightIndex = new LinkedHashMap<>();
        for (Map<String, Object> row : downloaded.rows()) {
            rightIndex.computeIfAbsent(key(row, keyColumns), k -> new ArrayList<>()).add(row);
        }

        List<JoinedRow> joined = new ArrayList<>();
        Set<List<Object>> matchedKeys = new HashSet<>();
        for (Map<String, Object> left : local.rows()) {
            List<Object> key = key(left, keyColumns);
            List<Map<String, Object>> matches = rightIndex.get(key);
            if (matches == null) {
                joined.add(new JoinedRow(key, combine(keyColumns, key, left, leftNames, null, rightNames),
                        Provenance.LEFT_ONLY));
                continue;
            }
            matchedKeys.add(key);
            for (Map<String, Object> right : matches) {
                joined.add(new JoinedRow(key, combine(keyColumns, key, left, leftNames, right, rightNames),
                        Provenance.BOTH));
            }
        }
        for (Map.Entry<List<Object>, List<Map<String, Object>>> entry : rightIndex.entrySet()) {
            if (matchedKeys.contains(entry.getKey())) {
                continue;
            }
            for (Map<String, Object> right : entry.getValue()) {
                joined.add(new JoinedRow(entry.getKey(),
                        combine(keyColumns, entry.getKey(), null, leftNames, right, rightNames),
                        Provenance.RIGHT_ONLY));
            }
        }

        joined.sort(Comparator.comparing(JoinedRow::key, OuterJoinReconciler::compareKeys));

        List<Map<String, Object>> rows = new ArrayList<>(joined.size());
        List<Provenance> provenance = new ArrayList<>(joined.size());
        for (JoinedRow row : joined) {
            rows.add(row.values());
            provenance.add(row.provenance());
        }
        JoinedTable result = new JoinedTable(new Table(columns, rows), keyColumns, provenance);
        log.info("reconcile.join.completed rows={} leftOnly={} rightOnly={} both={}",
                rows.size(), result.count(Provenance.LEFT_ONLY), result.count(Provenance.RIGHT_ONLY),
                result.count(Provenance.BOTH));
        return result;
    }

    private static void validateSuffixes(List<String> columns, List<String> keyColumns) {
        List<String> invalid = new ArrayList<>();
        for (String column : columns) {
            if (keyColumns.contains(column)) {
                continue;
            }
            if (!column.endsWith(JoinedTable.LEFT_SUFFIX) && !column.endsWith(JoinedTable.RIGHT_SUFFIX)) {
                invalid.add(column);
            }
        }
        if (!invalid.isEmpty()) {
            throw new SuffixValidationException("Columns without _left/_right suffix: " + String.join(", ", invalid));
        }
    }

    private static List<String> nonKey(Table table, List<String> keyColumns) {
        List<String> columns = new ArrayList<>(table.columns());
        columns.removeAll(keyColumns);
        return columns;
    }

    private static List<Object> key(Map<String, Object> row, List<String> keyColumns) {
        List<Object> key = new ArrayList<>(keyColumns.size());
        for (String column : keyColumns) {
            Object value = row.get(column);
            key.add(Values.isMissing(value) ? null : value.toString());
        }
        return key;
    }

    private static Map<String, Object> combine(List<String> keyColumns, List<Object> key,
                                               Map<String, Object> left, Map<String, String> leftNames,
                                               Map<String, Object> right, Map<String, String> rightNames) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyColumns.size(); i++) {
            row.put(keyColumns.get(i), key.get(i));
        }
        for (Map.Entry<String, String> name : leftNames.entrySet()) {
            row.put(name.getValue(), left != null ? left.get(name.getKey()) : null);
        }
        for (Map.Entry<String, String> name : rightNames.entrySet()) {
            row.put(name.getValue(), right != null ? right.get(name.getKey()) : null);
        }
        return row;
    }

    private static int compareKeys(List<Object> a, List<Object> b) {
        for (int i = 0; i < a.size(); i++) {
            Object x = a.get(i);
            Object y = b.get(i);
            if (x == null || y == null) {
                if (x != y) {
                    return x == null ? 1 : -1;
                }
                continue;
            }
            int cmp = x.toString().compareTo(y.toString());
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private record JoinedRow(List<Object> key, Map<String, Object> values, Provenance provenance) {}
}
