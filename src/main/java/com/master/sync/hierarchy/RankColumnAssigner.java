package com.master.sync.hierarchy;

import com.master.sync.core.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the {@code rank{r}_code} / {@code rank{r}_name} columns of every organization row
 * from its root-to-self path in the {@link HierarchyGraph}.
 *
 * <p>For a row, each node on the path writes its code and name into the slot of its own rank.
 * A slot already filled is not overwritten, so the node nearest the root wins when two nodes
 * on one path share a rank.</p>
 */
public class RankColumnAssigner {
    private static final Logger log = LoggerFactory.getLogger(RankColumnAssigner.class);

    /**
     * Returns a copy of {@code table} with rank columns for ranks {@code 1..R}, where R is the
     * highest rank in the table. Existing rank columns are recomputed.
     *
     * @throws MissingOrCorruptRankException if a node on any path has no rank or one outside [1, R]
     */
    public Table assign(Table table, HierarchyGraph graph) {
        int maxRank = maxRank(table);
        Map<String, RankSlot> memo = new HashMap<>();

        List<String> columns = new ArrayList<>(table.columns());
        List<String> rankColumns = rankColumns(maxRank);
        columns.removeAll(rankColumns);
        columns.addAll(rankColumns);

        List<Map<String, Object>> rows = new ArrayList<>(table.size());
        for (Map<String, Object> row : table.rows()) {
            OrgRecord record = OrgRecord.fromRow(row);
            Map<String, Object> newRow = new LinkedHashMap<>(row);
            for (String column : rankColumns) {
                newRow.put(column, null);
            }

            List<String> path = new ArrayList<>(graph.ancestorsTopological(record.code()));
            path.add(record.code());
            for (String code : path) {
                RankSlot slot = memo.computeIfAbsent(code, c -> resolve(c, graph, maxRank));
                String codeColumn = OrgColumns.rankCode(slot.rank());
                if (newRow.get(codeColumn) == null) {
                    newRow.put(codeColumn, slot.code());
                    newRow.put(OrgColumns.rankName(slot.rank()), slot.name());
                }
            }
            rows.add(newRow);
        }

        log.info("org.rank.assigned rows={} maxRank={} cachedNodes={}", rows.size(), maxRank, memo.size());
        return new Table(columns, rows);
    }

    /**
     * Highest rank present in the table's {@code rank} column, or 0 if none.
     */
    public static int maxRank(Table table) {
        int max = 0;
        for (Map<String, Object> row : table.rows()) {
            Integer rank = OrgRecord.fromRow(row).rank();
            if (rank != null && rank > max) {
                max = rank;
            }
        }
        return max;
    }

    static List<String> rankColumns(int maxRank) {
        List<String> columns = new ArrayList<>(maxRank * 2);
        for (int r = 1; r <= maxRank; r++) {
            columns.add(OrgColumns.rankCode(r));
        }
        for (int r = 1; r <= maxRank; r++) {
            columns.add(OrgColumns.rankName(r));
        }
        return columns;
    }

    private static RankSlot resolve(String code, HierarchyGraph graph, int maxRank) {
        OrgNode node = graph.node(code);
        Integer rank = node != null ? node.rank() : null;
        if (rank == null || rank < 1 || rank > maxRank) {
            throw new MissingOrCorruptRankException(
                    "org_code '" + code + "' has an invalid rank '" + rank + "' (expected 1.." + maxRank + ")");
        }
        return new RankSlot(rank, code, node.name());
    }

    private record RankSlot(int rank, String code, String name) {}
}
