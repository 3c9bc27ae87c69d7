package com.master.sync.hierarchy;

import com.master.sync.core.model.Table;
import com.master.sync.logging.LogContext;
import com.master.sync.metrics.MetricsService;
import com.master.sync.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns raw organization rows into the disambiguated organization master table:
 * build the hierarchy, derive rank columns, then rename duplicates.
 */
public class OrganizationBuilder {
    private static final Logger log = LoggerFactory.getLogger(OrganizationBuilder.class);

    private final RankColumnAssigner rankColumnAssigner;
    private final DuplicateNameResolver duplicateNameResolver;
    private final MetricsService metrics;

    public OrganizationBuilder() {
        this(new RankColumnAssigner(), new DuplicateNameResolver(), new NoOpMetricsService());
    }

    public OrganizationBuilder(RankColumnAssigner rankColumnAssigner,
                               DuplicateNameResolver duplicateNameResolver,
                               MetricsService metrics) {
        this.rankColumnAssigner = rankColumnAssigner;
        this.duplicateNameResolver = duplicateNameResolver;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Builds the organization master table.
     *
     * @param organizations rows with {@code org_code, org_name, parent_org_code|parent_code, rank}
     * @param mapping       abbreviation rows with {@code org_code, abbreviation}; may be null
     * @return the input rows with rank columns, duplicate names suffixed with their identifier
     */
    public Table createOrganization(Table organizations, Table mapping) {
        try (LogContext ctx = LogContext.forHierarchy(LogContext.generateRunId())) {
            log.info("org.build.starting rows={}", organizations.size());

            HierarchyGraph graph = HierarchyGraph.build(toRecords(organizations));
            metrics.recordHierarchySize(graph.size());

            Table withRanks = rankColumnAssigner.assign(organizations, graph);

            List<DuplicateGroup> duplicates = duplicateNameResolver.findDuplicates(withRanks);
            metrics.recordDuplicateGroups(duplicates.size());
            if (duplicates.isEmpty()) {
                log.info("org.build.completed rows={} duplicates=0", withRanks.size());
                return withRanks;
            }

            OverrideTable overrides = mapping != null
                    ? OverrideTable.resolve(mapping, graph)
                    : OverrideTable.empty();
            List<ResolvedDuplicate> resolved = duplicateNameResolver.assignIdentifiers(duplicates, graph, overrides);
            duplicateNameResolver.validate(resolved);
            Table result = duplicateNameResolver.apply(withRanks, resolved);

            log.info("org.build.completed rows={} duplicateGroups={} renamed={}",
                    result.size(), duplicates.size(), resolved.size());
            return result;
        }
    }

    static List<OrgRecord> toRecords(Table organizations) {
        List<OrgRecord> records = new ArrayList<>(organizations.size());
        for (Map<String, Object> row : organizations.rows()) {
            records.add(OrgRecord.fromRow(row));
        }
        return records;
    }
}
