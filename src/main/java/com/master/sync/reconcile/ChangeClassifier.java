package com.master.sync.reconcile;

import com.master.sync.core.model.Table;
import com.master.sync.core.model.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a joined table into ADD / UPDATE change rows.
 *
 * <ul>
 *   <li>ADD: local-only rows, with local values.</li>
 *   <li>UPDATE (modified): rows on both sides where any compare column differs, with local
 *       values. Two missing values are equal.</li>
 *   <li>UPDATE (disable): downloaded-only rows not already disabled, with downloaded values
 *       and the disable indicator written as data.</li>
 * </ul>
 * Rows are emitted in that order; nothing is ever deleted.
 */
public class ChangeClassifier {
    private static final Logger log = LoggerFactory.getLogger(ChangeClassifier.class);

    public ChangeSet classify(JoinedTable joined, List<String> compareColumns, List<String> keyColumns,
                              EntityProfile profile) {
        for (String column : compareColumns) {
            if (!joined.hasColumn(column + JoinedTable.LEFT_SUFFIX)
                    || !joined.hasColumn(column + JoinedTable.RIGHT_SUFFIX)) {
                throw new IllegalArgumentException("Compare column '" + column + "' is not present on both sides");
            }
        }

        Table added = extract(joined.rows(Provenance.LEFT_ONLY), joined, compareColumns, keyColumns,
                ChangeFlag.ADD, JoinedTable.LEFT_SUFFIX);

        List<Map<String, Object>> modifiedRows = new ArrayList<>();
        for (Map<String, Object> row : joined.rows(Provenance.BOTH)) {
            if (differs(row, compareColumns)) {
                modifiedRows.add(row);
            }
        }
        Table modified = extract(modifiedRows, joined, compareColumns, keyColumns,
                ChangeFlag.UPDATE, JoinedTable.LEFT_SUFFIX);

        List<Map<String, Object>> disableRows = new ArrayList<>();
        for (Map<String, Object> row : joined.rows(Provenance.RIGHT_ONLY)) {
            if (!alreadyDisabled(row, profile)) {
                disableRows.add(row);
            }
        }
        Table disabled = disable(extract(disableRows, joined, compareColumns, keyColumns,
                ChangeFlag.UPDATE, JoinedTable.RIGHT_SUFFIX), profile);

        Table changes = Table.concat(List.of(added, modified, disabled));
        log.info("reconcile.classify.completed add={} modified={} disabled={} skippedDisabled={}",
                added.size(), modified.size(), disabled.size(),
                joined.count(Provenance.RIGHT_ONLY) - disabled.size());
        return new ChangeSet(changes);
    }

    /**
     * True when any compare column differs between the two sides.
     */
    static boolean differs(Map<String, Object> row, List<String> compareColumns) {
        for (String column : compareColumns) {
            if (!Values.sameValue(row.get(column + JoinedTable.LEFT_SUFFIX),
                    row.get(column + JoinedTable.RIGHT_SUFFIX))) {
                return true;
            }
        }
        return false;
    }

    private static boolean alreadyDisabled(Map<String, Object> row, EntityProfile profile) {
        if (profile.isUserLike()) {
            RetirementPolicy policy = profile.getRetirementPolicy();
            String column = requireRight(row, policy.departmentColumn());
            return policy.sentinel().equals(row.get(column));
        }
        return Values.isOne(row.get(requireRight(row, EntityProfile.DISABLE_FLAG)));
    }

    private static String requireRight(Map<String, Object> row, String column) {
        String suffixed = column + JoinedTable.RIGHT_SUFFIX;
        if (!row.containsKey(suffixed)) {
            throw new IllegalArgumentException("Downloaded data has no '" + column + "' column");
        }
        return suffixed;
    }

    private static Table extract(List<Map<String, Object>> rows, JoinedTable joined, List<String> compareColumns,
                                 List<String> keyColumns, ChangeFlag flag, String suffix) {
        List<String> columns = new ArrayList<>(keyColumns);
        columns.add(ChangeFlag.COLUMN);
        List<String> present = new ArrayList<>();
        for (String column : compareColumns) {
            if (joined.hasColumn(column + suffix)) {
                present.add(column);
            }
        }
        columns.addAll(present);

        List<Map<String, Object>> extracted = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (String key : keyColumns) {
                out.put(key, row.get(key));
            }
            out.put(ChangeFlag.COLUMN, flag.name());
            for (String column : present) {
                out.put(column, row.get(column + suffix));
            }
            extracted.add(out);
        }
        return new Table(columns, extracted);
    }

    private static Table disable(Table rows, EntityProfile profile) {
        if (!profile.isUserLike()) {
            return rows.withConstant(EntityProfile.DISABLE_FLAG, 1);
        }
        RetirementPolicy policy = profile.getRetirementPolicy();
        Table retired = rows;
        for (String column : policy.blankedColumns()) {
            retired = retired.withConstant(column, null);
        }
        return retired.withConstant(policy.departmentColumn(), policy.sentinel());
    }
}
