package com.master.sync.hierarchy;

import com.master.sync.core.model.Table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills rank-name gaps left by hierarchies that skip tiers.
 *
 * <p>Working from the deepest rank upward, a missing {@code rank{i}_name} receives the
 * configured label when {@code rank{i+1}_name} is populated. The deepest rank is filled
 * whenever it is missing. Codes are left untouched.</p>
 */
public class RankGapFiller {

    private final String otherLabel;

    public RankGapFiller(String otherLabel) {
        if (otherLabel == null || otherLabel.isBlank()) {
            throw new IllegalArgumentException("otherLabel must not be blank");
        }
        this.otherLabel = otherLabel;
    }

    public Table fill(Table table, int maxRank) {
        for (int r = 1; r <= maxRank; r++) {
            if (!table.hasColumn(OrgColumns.rankName(r))) {
                throw new IllegalArgumentException("Missing column " + OrgColumns.rankName(r));
            }
        }
        List<Map<String, Object>> rows = new ArrayList<>(table.size());
        for (Map<String, Object> row : table.rows()) {
            Map<String, Object> newRow = new LinkedHashMap<>(row);
            for (int r = maxRank; r >= 1; r--) {
                String column = OrgColumns.rankName(r);
                if (newRow.get(column) != null) {
                    continue;
                }
                boolean lowerPopulated = r == maxRank || newRow.get(OrgColumns.rankName(r + 1)) != null;
                if (lowerPopulated) {
                    newRow.put(column, otherLabel);
                }
            }
            rows.add(newRow);
        }
        return new Table(table.columns(), rows);
    }
}
