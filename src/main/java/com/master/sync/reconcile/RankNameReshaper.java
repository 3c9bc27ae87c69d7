package com.master.sync.reconcile;

import com.master.sync.core.model.Table;
import com.master.sync.core.model.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns wide rank-name columns ({@code user_group_3 .. user_group_5}) into a long table of
 * distinct {@code (column, group_name)} pairs, the shape of the user-group master.
 */
public class RankNameReshaper {

    public static final String COLUMN = "column";
    public static final String GROUP_NAME = "group_name";

    /**
     * Melts {@code basename_startRank .. basename_endRank} column by column, dropping missing
     * names and repeated pairs. {@code column} holds the rank number.
     */
    public Table reshape(Table table, String basename, int startRank, int endRank) {
        if (startRank > endRank) {
            throw new IllegalArgumentException("startRank must be <= endRank");
        }
        Set<List<Object>> seen = new LinkedHashSet<>();
        for (int rank = startRank; rank <= endRank; rank++) {
            for (Object name : table.values(basename + "_" + rank)) {
                if (!Values.isMissing(name)) {
                    seen.add(List.of(rank, name));
                }
            }
        }
        List<Map<String, Object>> rows = new ArrayList<>(seen.size());
        for (List<Object> pair : seen) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(COLUMN, pair.get(0));
            row.put(GROUP_NAME, pair.get(1));
            rows.add(row);
        }
        return new Table(List.of(COLUMN, GROUP_NAME), rows);
    }
}
