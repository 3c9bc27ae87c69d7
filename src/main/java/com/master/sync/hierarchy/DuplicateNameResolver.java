package com.master.sync.hierarchy;

import com.master.sync.core.model.Table;
import com.master.sync.rules.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds organizational units sharing a normalized display name and picks an identifier
 * for each so that the rank-name columns become unambiguous.
 *
 * <p>Members of a group are partitioned by their normalized ancestor-name paths: the
 * longest common prefix is skipped and members are split on the next path segment.
 * Splitting repeats on an explicit FIFO worklist until every subset is a singleton.
 * A singleton's identifier defaults to its own display name and is replaced by the
 * abbreviation of the first override (in override-table order) that names one of its
 * ancestors at or below the divergence rank.</p>
 */
public class DuplicateNameResolver {
    private static final Logger log = LoggerFactory.getLogger(DuplicateNameResolver.class);

    private static final String SHORTER_PATH = "";

    private final NameNormalizer normalizer;

    public DuplicateNameResolver() {
        this(new NameNormalizer());
    }

    public DuplicateNameResolver(NameNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Groups the table's organization rows by normalized name and keeps groups of two or more.
     * Groups and members appear in table order.
     */
    public List<DuplicateGroup> findDuplicates(Table table) {
        Map<String, List<OrgRecord>> byName = new LinkedHashMap<>();
        for (Map<String, Object> row : table.rows()) {
            OrgRecord record = OrgRecord.fromRow(row);
            byName.computeIfAbsent(normalizer.normalize(record.name()), k -> new ArrayList<>()).add(record);
        }
        List<DuplicateGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<OrgRecord>> entry : byName.entrySet()) {
            if (entry.getValue().size() > 1) {
                groups.add(new DuplicateGroup(entry.getKey(), entry.getValue()));
            }
        }
        log.info("org.duplicates.found groups={}", groups.size());
        return groups;
    }

    /**
     * Chooses an identifier for every member of every group.
     */
    public List<ResolvedDuplicate> assignIdentifiers(List<DuplicateGroup> groups,
                                                     HierarchyGraph graph,
                                                     OverrideTable overrides) {
        List<ResolvedDuplicate> resolved = new ArrayList<>();
        for (DuplicateGroup group : groups) {
            Map<String, String> identifiers = resolveGroup(group, graph, overrides);
            for (OrgRecord member : group.members()) {
                resolved.add(new ResolvedDuplicate(member, identifiers.get(member.code())));
            }
        }
        return resolved;
    }

    /**
     * Logs a warning for every member left without an identifier and returns the messages.
     */
    public List<String> validate(List<ResolvedDuplicate> resolved) {
        List<String> warnings = new ArrayList<>();
        for (ResolvedDuplicate duplicate : resolved) {
            if (!duplicate.hasIdentifier()) {
                String message = "No identifier for org_name '" + duplicate.record().name()
                        + "' (org_code " + duplicate.record().code() + ")";
                log.warn("org.duplicates.missingIdentifier orgCode={} orgName='{}'",
                        duplicate.record().code(), duplicate.record().name());
                warnings.add(message);
            }
        }
        if (warnings.isEmpty()) {
            log.info("org.duplicates.validated members={}", resolved.size());
        }
        return warnings;
    }

    /**
     * Rewrites each resolved record's own-rank name column to {@code "name (identifier)"}.
     */
    public Table apply(Table table, List<ResolvedDuplicate> resolved) {
        Map<String, ResolvedDuplicate> byCode = new HashMap<>();
        for (ResolvedDuplicate duplicate : resolved) {
            byCode.put(duplicate.record().code(), duplicate);
        }
        List<Map<String, Object>> rows = new ArrayList<>(table.size());
        for (Map<String, Object> row : table.rows()) {
            ResolvedDuplicate duplicate = byCode.get(OrgRecord.fromRow(row).code());
            if (duplicate == null || duplicate.record().rank() == null) {
                rows.add(row);
                continue;
            }
            String column = OrgColumns.rankName(duplicate.record().rank());
            if (!table.hasColumn(column)) {
                throw new IllegalArgumentException("Missing rank column " + column);
            }
            Map<String, Object> newRow = new LinkedHashMap<>(row);
            newRow.put(column, duplicate.displayName());
            rows.add(newRow);
        }
        return new Table(table.columns(), rows);
    }

    private Map<String, String> resolveGroup(DuplicateGroup group, HierarchyGraph graph, OverrideTable overrides) {
        Map<String, List<String>> paths = new LinkedHashMap<>();
        Map<String, OrgRecord> members = new HashMap<>();
        for (OrgRecord member : group.members()) {
            paths.put(member.code(), namePath(member.code(), graph));
            members.put(member.code(), member);
        }

        Map<String, String> identifiers = new HashMap<>();
        Deque<List<String>> worklist = new ArrayDeque<>();
        worklist.add(new ArrayList<>(paths.keySet()));

        while (!worklist.isEmpty()) {
            List<String> subset = worklist.poll();
            int prefixLength = commonPrefixLength(subset, paths);

            if (prefixLength == 0) {
                for (String code : subset) {
                    identifiers.put(code, ownName(members.get(code)));
                }
                continue;
            }

            Map<String, List<String>> partitions = new LinkedHashMap<>();
            for (String code : subset) {
                List<String> path = paths.get(code);
                String segment = path.size() > prefixLength ? path.get(prefixLength) : SHORTER_PATH;
                partitions.computeIfAbsent(segment, k -> new ArrayList<>()).add(code);
            }

            if (partitions.size() == 1) {
                // identical paths cannot be split further
                log.warn("org.duplicates.indistinguishable name='{}' codes={}", group.normalizedName(), subset);
                for (String code : subset) {
                    identifiers.put(code, ownName(members.get(code)));
                }
                continue;
            }

            for (Map.Entry<String, List<String>> partition : partitions.entrySet()) {
                List<String> codes = partition.getValue();
                if (codes.size() == 1) {
                    String code = codes.get(0);
                    identifiers.put(code, singletonIdentifier(members.get(code), partition.getKey(), graph, overrides));
                } else {
                    worklist.add(codes);
                }
            }
        }

        for (OrgRecord member : group.members()) {
            identifiers.putIfAbsent(member.code(), ownName(member));
        }
        return identifiers;
    }

    private String singletonIdentifier(OrgRecord member, String segment, HierarchyGraph graph, OverrideTable overrides) {
        List<String> ancestors = graph.ancestorsTopological(member.code());
        int divergenceRank = 0;
        for (String code : ancestors) {
            OrgNode node = graph.node(code);
            if (normalizer.normalize(node.name()).equals(segment)) {
                divergenceRank = node.rank() != null ? node.rank() : 0;
                break;
            }
        }

        for (AbbreviationOverride override : overrides.entries()) {
            if (ancestors.contains(override.orgCode()) && override.rank() >= divergenceRank) {
                log.debug("org.duplicates.override orgCode={} via={} rank={}",
                        member.code(), override.orgCode(), override.rank());
                return override.abbreviation();
            }
        }
        return ownName(member);
    }

    private List<String> namePath(String code, HierarchyGraph graph) {
        List<String> path = new ArrayList<>();
        for (String ancestor : graph.ancestorsTopological(code)) {
            path.add(normalizer.normalize(graph.node(ancestor).name()));
        }
        return path;
    }

    private static int commonPrefixLength(List<String> subset, Map<String, List<String>> paths) {
        List<String> first = paths.get(subset.get(0));
        int length = first.size();
        for (String code : subset.subList(1, subset.size())) {
            List<String> path = paths.get(code);
            int i = 0;
            while (i < length && i < path.size() && first.get(i).equals(path.get(i))) {
                i++;
            }
            length = i;
            if (length == 0) {
                break;
            }
        }
        return length;
    }

    private static String ownName(OrgRecord record) {
        return record.name() != null ? record.name() : "";
    }
}
