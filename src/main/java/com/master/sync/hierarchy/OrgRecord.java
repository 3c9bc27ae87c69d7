package com.master.sync.hierarchy;

import com.master.sync.core.model.Values;

import java.util.Map;
import java.util.Objects;

/**
 * One organizational unit as supplied by the upstream source.
 *
 * @param code       unique org code
 * @param name       display name, may be null
 * @param parentCode code of the parent unit, null for a root
 * @param rank       organizational tier (not graph depth), may be null when the source is corrupt
 */
public record OrgRecord(String code, String name, String parentCode, Integer rank) {

    public OrgRecord {
        Objects.requireNonNull(code, "code is required");
    }

    /**
     * Reads a record from a table row. The parent is taken from {@code parent_org_code},
     * falling back to {@code parent_code}; blank parents are roots.
     *
     * @throws MissingOrCorruptRankException if the rank cell is present but not an integer
     */
    public static OrgRecord fromRow(Map<String, Object> row) {
        String code = Values.toText(row.get(OrgColumns.ORG_CODE));
        if (code == null) {
            throw new IllegalArgumentException("Organization row without org_code: " + row);
        }
        Object parent = row.containsKey(OrgColumns.PARENT_ORG_CODE)
                ? row.get(OrgColumns.PARENT_ORG_CODE)
                : row.get(OrgColumns.PARENT_CODE);
        Object name = row.get(OrgColumns.ORG_NAME);
        return new OrgRecord(
                code,
                Values.isMissing(name) ? null : name.toString(),
                Values.toText(parent),
                rank(code, row.get(OrgColumns.RANK)));
    }

    private static Integer rank(String code, Object value) {
        try {
            return Values.toInteger(value);
        } catch (IllegalArgumentException e) {
            throw new MissingOrCorruptRankException(
                    "Corrupt rank '" + value + "' for org_code '" + code + "'", e);
        }
    }
}
