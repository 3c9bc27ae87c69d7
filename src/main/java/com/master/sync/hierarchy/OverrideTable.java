package com.master.sync.hierarchy;

import com.master.sync.core.model.Table;
import com.master.sync.core.model.Values;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Abbreviation overrides keyed by org code, iterated in the order of the source table.
 * The iteration order decides which override wins when several apply to one duplicate.
 */
public final class OverrideTable {

    private final Map<String, AbbreviationOverride> overrides;

    private OverrideTable(Map<String, AbbreviationOverride> overrides) {
        this.overrides = Collections.unmodifiableMap(overrides);
    }

    public static OverrideTable empty() {
        return new OverrideTable(new LinkedHashMap<>());
    }

    public static OverrideTable of(List<AbbreviationOverride> entries) {
        Map<String, AbbreviationOverride> map = new LinkedHashMap<>();
        for (AbbreviationOverride entry : entries) {
            if (map.put(entry.orgCode(), entry) != null) {
                throw new IllegalArgumentException("Duplicate override for org_code '" + entry.orgCode() + "'");
            }
        }
        return new OverrideTable(map);
    }

    /**
     * Builds the table from {@code org_code, abbreviation[, rank]} rows. The rank is always
     * taken from the hierarchy; a rank column in the source is ignored.
     *
     * @throws MappingOrgNotFoundException if a row references an org code absent from the graph
     * @throws MissingOrCorruptRankException if the referenced org has no rank
     */
    public static OverrideTable resolve(Table mapping, HierarchyGraph graph) {
        List<AbbreviationOverride> entries = new ArrayList<>(mapping.size());
        for (Map<String, Object> row : mapping.rows()) {
            String orgCode = Values.toText(row.get(OrgColumns.ORG_CODE));
            OrgNode node = orgCode != null ? graph.node(orgCode) : null;
            if (node == null) {
                throw new MappingOrgNotFoundException(
                        "Abbreviation org_code '" + orgCode + "' does not exist in the hierarchy");
            }
            if (node.rank() == null) {
                throw new MissingOrCorruptRankException("Abbreviation org_code '" + orgCode + "' has no rank");
            }
            Object abbreviation = row.get(OrgColumns.ABBREVIATION);
            entries.add(new AbbreviationOverride(
                    orgCode, Values.isMissing(abbreviation) ? "" : abbreviation.toString(), node.rank()));
        }
        return of(entries);
    }

    public Collection<AbbreviationOverride> entries() {
        return overrides.values();
    }

    public AbbreviationOverride get(String orgCode) {
        return overrides.get(orgCode);
    }

    public int size() {
        return overrides.size();
    }

    public boolean isEmpty() {
        return overrides.isEmpty();
    }
}
