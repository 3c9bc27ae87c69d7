package com.master.sync.hierarchy;

import com.master.sync.core.model.Table;
import com.master.sync.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrganizationBuilder Tests")
class OrganizationBuilderTest {

    @Mock
    private MetricsService metrics;

    private OrganizationBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new OrganizationBuilder(new RankColumnAssigner(), new DuplicateNameResolver(), metrics);
    }

    @Test
    @DisplayName("Duplicates without a mapping should be suffixed with their own name")
    void withoutMapping() {
        Table result = builder.createOrganization(OrgFixtures.tokyoOsaka(), null);

        assertEquals("Sales (Sales)", result.get(3, "rank3_name"));
        assertEquals("Sales (Sales)", result.get(4, "rank3_name"));
        verify(metrics).recordHierarchySize(5);
        verify(metrics).recordDuplicateGroups(1);
    }

    @Test
    @DisplayName("Duplicates should take the abbreviation of their diverging ancestor")
    void withMapping() {
        Table mapping = Table.builder("org_code", "abbreviation")
                .row("TYO", "TYO")
                .row("OSK", "OSK")
                .build();

        Table result = builder.createOrganization(OrgFixtures.tokyoOsaka(), mapping);

        assertEquals("Sales (TYO)", result.get(3, "rank3_name"));
        assertEquals("Sales (OSK)", result.get(4, "rank3_name"));
        assertEquals("Tokyo", result.get(1, "rank2_name"));
    }

    @Test
    @DisplayName("Without duplicates the rank columns should be returned as is")
    void noDuplicates() {
        Table table = OrgFixtures.orgTable()
                .row("HQ", "Company", null, "1")
                .row("TYO", "Tokyo", "HQ", "2")
                .build();

        Table result = builder.createOrganization(table, null);

        assertEquals("Tokyo", result.get(1, "rank2_name"));
        verify(metrics).recordDuplicateGroups(0);
    }

    @Test
    @DisplayName("Extra input columns should be preserved")
    void preservesExtraColumns() {
        Table table = Table.builder("org_code", "org_name", "parent_code", "rank", "location_code")
                .row("HQ", "Company", null, "1", "L1")
                .row("TYO", "Tokyo", "HQ", "2", "L2")
                .build();

        Table result = builder.createOrganization(table, null);

        assertTrue(result.hasColumn("location_code"));
        assertEquals("L2", result.get(1, "location_code"));
        assertEquals("HQ", result.get(1, "rank1_code"));
    }

    @Test
    @DisplayName("A mapping naming an unknown org should fail")
    void unknownMappingOrg() {
        Table mapping = Table.builder("org_code", "abbreviation").row("NOPE", "N").build();

        assertThrows(MappingOrgNotFoundException.class,
                () -> builder.createOrganization(OrgFixtures.tokyoOsaka(), mapping));
    }

    @Test
    @DisplayName("A non-numeric rank should fail as a corrupt rank naming the org")
    void nonNumericRank() {
        Table table = OrgFixtures.orgTable()
                .row("O1", "Company", null, "1")
                .row("O2", "Tokyo", "O1", "2")
                .row("O4", "Sales", "O2", "abc")
                .build();

        MissingOrCorruptRankException e = assertThrows(MissingOrCorruptRankException.class,
                () -> builder.createOrganization(table, null));
        assertTrue(e.getMessage().contains("'abc'"));
        assertTrue(e.getMessage().contains("'O4'"));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        verify(metrics, never()).recordHierarchySize(anyInt());
    }

    @Test
    @DisplayName("A cyclic hierarchy should fail before any rank is assigned")
    void cyclicHierarchy() {
        Table table = OrgFixtures.orgTable()
                .row("A", "A", "B", "1")
                .row("B", "B", "A", "2")
                .build();

        assertThrows(CyclicHierarchyException.class, () -> builder.createOrganization(table, null));
        verify(metrics, never()).recordDuplicateGroups(anyInt());
    }
}
