package com.master.sync.hierarchy;

/**
 * Column names of the organization master table.
 */
public final class OrgColumns {

    public static final String ORG_CODE = "org_code";
    public static final String ORG_NAME = "org_name";
    public static final String PARENT_ORG_CODE = "parent_org_code";
    public static final String PARENT_CODE = "parent_code";
    public static final String RANK = "rank";
    public static final String ABBREVIATION = "abbreviation";
    public static final String LOCATION_CODE = "location_code";

    private OrgColumns() {
        // Constants
    }

    public static String rankCode(int rank) {
        return "rank" + rank + "_code";
    }

    public static String rankName(int rank) {
        return "rank" + rank + "_name";
    }
}
