package com.master.sync.hierarchy;

import com.master.sync.core.model.Table;

/**
 * Organization tables shared by the hierarchy tests.
 */
final class OrgFixtures {

    private OrgFixtures() {
    }

    static Table.Builder orgTable() {
        return Table.builder(OrgColumns.ORG_CODE, OrgColumns.ORG_NAME, OrgColumns.PARENT_ORG_CODE, OrgColumns.RANK);
    }

    /**
     * Company → Tokyo / Osaka, each with a "Sales" unit.
     */
    static Table tokyoOsaka() {
        return orgTable()
                .row("HQ", "Company", null, "1")
                .row("TYO", "Tokyo", "HQ", "2")
                .row("OSK", "Osaka", "HQ", "2")
                .row("S1", "Sales", "TYO", "3")
                .row("S2", "Sales", "OSK", "3")
                .build();
    }

    /**
     * Company → East → Tokyo → Sales and Company → West → Osaka → Sales.
     */
    static Table regions() {
        return orgTable()
                .row("HQ", "Company", null, "1")
                .row("EAST", "East", "HQ", "2")
                .row("WEST", "West", "HQ", "2")
                .row("TYO", "Tokyo", "EAST", "3")
                .row("OSK", "Osaka", "WEST", "3")
                .row("S1", "Sales", "TYO", "4")
                .row("S2", "Sales", "OSK", "4")
                .build();
    }

    static HierarchyGraph graph(Table table) {
        return HierarchyGraph.build(OrganizationBuilder.toRecords(table));
    }
}
