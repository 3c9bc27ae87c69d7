package com.master.sync.api;

import com.master.sync.config.SyncConfig;
import com.master.sync.core.model.Table;
import com.master.sync.reconcile.ChangeFlag;
import com.master.sync.reconcile.ChangeRow;
import com.master.sync.reconcile.ChangeSet;
import com.master.sync.reconcile.ReconciliationKeySpec;
import com.master.sync.reconcile.ReferentialIntegrityException;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MasterSyncService Tests")
class MasterSyncServiceTest {

    private final MasterSyncService service = new MasterSyncService();

    private static final ReconciliationKeySpec LOCATION_SPEC = ReconciliationKeySpec.of(
            List.of("flag", "location_code", "location_name", "location_identifier", "location_after", "disable_flag"),
            List.of("location_code"), List.of("flag", "location_after"));

    private static final ReconciliationKeySpec ORG_SPEC = ReconciliationKeySpec.of(
            List.of("flag", "org_code", "org_name", "parent_org_code", "location_code", "disable_flag"),
            List.of("org_code"), List.of("flag"));

    private static final ReconciliationKeySpec USER_SPEC = ReconciliationKeySpec.of(
            List.of("flag", "user_id", "org_code", "department_code", "disable_flag", "user_group1"),
            List.of("user_id"), List.of("flag"));

    private static final ReconciliationKeySpec GROUP_SPEC = ReconciliationKeySpec.of(
            List.of("flag", "column", "group_name", "disable_flag"),
            List.of("column", "group_name"), List.of("flag"));

    private Table locations() {
        return service.prepareLocations(Table.builder("事業所コード", "事業所名")
                .row("L1", "Tokyo")
                .row("L2", "Osaka")
                .build());
    }

    private static Table organizations() {
        return Table.builder("org_code", "org_name", "parent_org_code", "rank", "location_code")
                .row("HQ", "Company", null, "1", "L1")
                .row("TYO", "Tokyo", "HQ", "2", "L1")
                .row("OSK", "Osaka", "HQ", "2", "L2")
                .row("S1", "Sales", "TYO", "3", "L1")
                .row("S2", "Sales", "OSK", "3", "L2")
                .build();
    }

    private static Table users() {
        return Table.builder("user_id", "org_code", "location_code", "department_code",
                        "user_group_3", "user_group_4", "user_group_5")
                .row("U1", "S1", "L1", "D1", "Sales (TYO)", null, null)
                .row("U2", "S2", "L2", "D2", "Sales (OSK)", null, null)
                .build();
    }

    @Nested
    @DisplayName("In-memory runs")
    class InMemory {

        @Test
        @DisplayName("prepareLocations should rename headers and derive the identifier")
        void prepareLocations() {
            Table prepared = locations();

            assertEquals(List.of("location_code", "location_name", "location_identifier", "disable_flag"),
                    prepared.columns());
            assertEquals("L2_Osaka", prepared.get(1, "location_identifier"));
            assertNull(prepared.get(1, "disable_flag"));
        }

        @Test
        @DisplayName("Locations should be laid out in sheet order with the after column on updates")
        void syncLocations() {
            Table downloaded = LOCATION_SPEC.prepareDownloaded(
                    Table.builder("a", "b", "c", "d", "e", "f")
                            .row(null, "L1", "Tokyo", "L1_Tokyo", null, null)
                            .row(null, "L3", "Nagoya", "L3_Nagoya", null, null)
                            .build());

            ChangeSet changes = service.syncLocations(locations(), downloaded, LOCATION_SPEC);

            assertEquals(LOCATION_SPEC.columnNames(), changes.columns());
            assertEquals(List.of("ADD", "UPDATE"), changes.toTable().values("flag"));
            assertEquals(List.of("L2", "L3"), changes.toTable().values("location_code"));
            assertEquals(List.of("", "L3_Nagoya"), changes.toTable().values("location_after"));
            assertEquals(1, changes.rows().get(1).disableFlag());
        }

        @Test
        @DisplayName("buildOrganization should disambiguate names and fill rank gaps")
        void buildOrganization() {
            Table mapping = Table.builder("org_code", "abbreviation").row("TYO", "TYO").row("OSK", "OSK").build();

            Table organization = service.buildOrganization(organizations(), mapping, "その他");

            assertEquals("Sales (TYO)", organization.get(3, "rank3_name"));
            assertEquals("その他", organization.get(0, "rank2_name"));
        }

        @Test
        @DisplayName("Organizations should be reconciled after the location check")
        void syncOrganizations() {
            Table organization = service.buildOrganization(organizations(), null, null);
            Table downloaded = ORG_SPEC.prepareDownloaded(Table.builder("a", "b", "c", "d", "e", "f")
                    .row(null, "HQ", "Company", null, "L1", null)
                    .row(null, "OLD", "Closed", "HQ", "L1", null)
                    .build());

            ChangeSet changes = service.syncOrganizations(organization, locations(), downloaded, ORG_SPEC);

            assertEquals(4, changes.count(ChangeFlag.ADD));
            List<ChangeRow> updates = changes.rows(ChangeFlag.UPDATE);
            assertEquals(1, updates.size());
            assertEquals("OLD", updates.get(0).get("org_code"));
            assertEquals(1, updates.get(0).disableFlag());
        }

        @Test
        @DisplayName("An organization at an unknown location should fail")
        void unknownLocation() {
            Table organization = Table.builder("org_code", "org_name", "parent_org_code", "rank", "location_code")
                    .row("HQ", "Company", null, "1", "L9")
                    .build();
            Table downloaded = Table.builder("org_code", "org_name", "parent_org_code", "location_code", "disable_flag")
                    .build();

            ReferentialIntegrityException e = assertThrows(ReferentialIntegrityException.class,
                    () -> service.syncOrganizations(organization, locations(), downloaded, ORG_SPEC));
            assertEquals(List.of("L9"), e.getMissingCodes());
        }

        @Test
        @DisplayName("Users missing locally should be retired with the configured sentinel")
        void syncUsers() {
            Table organization = service.buildOrganization(organizations(), null, null);
            Table downloaded = USER_SPEC.prepareDownloaded(Table.builder("a", "b", "c", "d", "e", "f")
                    .row(null, "U1", "S1", "D1", null, null)
                    .row(null, "U9", "HQ", "D9", null, "G9")
                    .build());

            ChangeSet changes = service.syncUsers(users(), organization, locations(), downloaded, USER_SPEC,
                    "SYS_RETIRE");

            assertEquals(2, changes.size());
            assertEquals("U2", changes.rows(ChangeFlag.ADD).get(0).get("user_id"));
            ChangeRow retired = changes.rows(ChangeFlag.UPDATE).get(0);
            assertEquals("U9", retired.get("user_id"));
            assertEquals("SYS_RETIRE", retired.get("department_code"));
            assertNull(retired.get("user_group1"));
        }

        @Test
        @DisplayName("User groups should be keyed by rank and name")
        void syncUserGroups() {
            Table downloaded = GROUP_SPEC.prepareDownloaded(Table.builder("a", "b", "c", "d")
                    .row(null, "3", "Sales (TYO)", null)
                    .row(null, "5", "Old", null)
                    .build());

            ChangeSet changes = service.syncUserGroups(users(), downloaded, GROUP_SPEC);

            assertEquals(2, changes.size());
            ChangeRow added = changes.rows(ChangeFlag.ADD).get(0);
            assertEquals("3", added.get("column"));
            assertEquals("Sales (OSK)", added.get("group_name"));
            ChangeRow disabled = changes.rows(ChangeFlag.UPDATE).get(0);
            assertEquals("Old", disabled.get("group_name"));
            assertEquals(1, disabled.disableFlag());
        }
    }

    @Nested
    @DisplayName("File-based run")
    class FileBased {

        @TempDir
        Path tempDir;

        private void write(String relative, String content) throws IOException {
            Path file = tempDir.resolve(relative);
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        }

        private void writeColumns(Path file) throws IOException {
            try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
                sheet(workbook, "事業所", LOCATION_SPEC);
                sheet(workbook, "組織", ORG_SPEC);
                sheet(workbook, "ユーザー情報", USER_SPEC);
                sheet(workbook, "ユーザーグループ", GROUP_SPEC);
                workbook.write(out);
            }
        }

        private void sheet(Workbook workbook, String name, ReconciliationKeySpec spec) {
            Sheet sheet = workbook.createSheet(name);
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("列名");
            header.createCell(1).setCellValue("キー");
            header.createCell(2).setCellValue("削除");
            int r = 1;
            for (String column : spec.columnNames()) {
                Row row = sheet.createRow(r++);
                row.createCell(0).setCellValue(column);
                if (spec.keyColumns().contains(column)) {
                    row.createCell(1).setCellValue("○");
                }
                if (spec.dropColumns().contains(column)) {
                    row.createCell(2).setCellValue("○");
                }
            }
        }

        @Test
        @DisplayName("run should reconcile every entity and export the change sets")
        void runsEndToEnd() throws IOException {
            write("data/locations.csv", "事業所コード,事業所名\nL1,Tokyo\nL2,Osaka\n");
            write("data/organizations.csv", "org_code,org_name,parent_org_code,rank,location_code\n"
                    + "HQ,Company,,1,L1\nTYO,Tokyo,HQ,2,L1\nOSK,Osaka,HQ,2,L2\nS1,Sales,TYO,3,L1\nS2,Sales,OSK,3,L2\n");
            write("data/mapping.csv", "org_code,abbreviation\nTYO,TYO\nOSK,OSK\n");
            write("data/users.csv", "user_id,org_code,location_code,department_code,user_group_3,user_group_4,user_group_5\n"
                    + "U1,S1,L1,D1,Sales (TYO),,\nU2,S2,L2,D2,Sales (OSK),,\n");
            write("download/location_1.txt", "f\tcode\tname\tid\tafter\tdisabled\n\tL1\tTokyo\tL1_Tokyo\t\t\n");
            write("download/org_1.txt", "f\tcode\tname\tparent\tlocation\tdisabled\n\tHQ\tCompany\t\tL1\t\n");
            write("download/user_1.txt", "f\tid\torg\tdept\tdisabled\tgroup\n"
                    + "\tU1\tS1\tD1\t\t\n\tU9\tHQ\tD9\t\tG9\n");
            write("download/usergroup_1.txt", "f\tcolumn\tname\tdisabled\n\t3\tSales (TYO)\t\n");
            Files.createDirectories(tempDir.resolve("conf"));
            writeColumns(tempDir.resolve("conf/columns.xlsx"));

            SyncConfig config = new SyncConfig(2, "その他", "SYS_RETIRE", StandardCharsets.UTF_8,
                    tempDir.resolve("out"),
                    new SyncConfig.Sources(tempDir.resolve("data/organizations.csv"),
                            tempDir.resolve("data/mapping.csv"),
                            tempDir.resolve("data/locations.csv"),
                            tempDir.resolve("data/users.csv"),
                            tempDir.resolve("conf/columns.xlsx")),
                    new SyncConfig.Downloads(tempDir.resolve("download/org_*.txt"),
                            tempDir.resolve("download/user_*.txt"),
                            tempDir.resolve("download/location_*.txt"),
                            tempDir.resolve("download/usergroup_*.txt")));

            SyncResult result = service.run(config);

            assertEquals(1, result.changes(EntityKind.LOCATION).size());
            assertEquals(4, result.changes(EntityKind.ORGANIZATION).count(ChangeFlag.ADD));
            assertEquals(2, result.changes(EntityKind.USER).size());
            assertEquals(1, result.changes(EntityKind.USER_GROUP).size());

            assertEquals(2, result.export(EntityKind.ORGANIZATION).chunkCount());
            assertTrue(Files.exists(tempDir.resolve("out/organization_original.xlsx")));
            assertTrue(Files.exists(tempDir.resolve("out/organization_02.csv")));
            assertEquals(0, result.export(EntityKind.LOCATION).chunkCount());
            assertTrue(Files.exists(tempDir.resolve("out/usergroup_original.xlsx")));
        }
    }
}
