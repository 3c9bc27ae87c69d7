package com.master.sync.api;

import com.master.sync.bulk.ChunkedChangeSetWriter;
import com.master.sync.bulk.ExportResult;
import com.master.sync.bulk.LatestFileLocator;
import com.master.sync.bulk.ProgressCallback;
import com.master.sync.bulk.SheetConfigLoader;
import com.master.sync.bulk.TableReaders;
import com.master.sync.config.SyncConfig;
import com.master.sync.core.model.Table;
import com.master.sync.hierarchy.DuplicateNameResolver;
import com.master.sync.hierarchy.OrgColumns;
import com.master.sync.hierarchy.OrganizationBuilder;
import com.master.sync.hierarchy.RankColumnAssigner;
import com.master.sync.hierarchy.RankGapFiller;
import com.master.sync.metrics.MetricsService;
import com.master.sync.metrics.NoOpMetricsService;
import com.master.sync.reconcile.ChangeSet;
import com.master.sync.reconcile.EntityProfile;
import com.master.sync.reconcile.LocationReferenceValidator;
import com.master.sync.reconcile.MasterReconciler;
import com.master.sync.reconcile.RankNameReshaper;
import com.master.sync.reconcile.ReconciliationKeySpec;
import com.master.sync.reconcile.RetirementPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point wiring the hierarchy builder and the reconciliation engine into complete
 * runs for organizations, locations, users and user groups.
 *
 * <p>Each {@code sync*} method takes the local table(s) and the downloaded table already
 * laid out by {@link ReconciliationKeySpec#prepareDownloaded(Table)}. The local table is
 * aligned to the downloaded columns before the join: local columns the sheet does not know
 * are dropped and sheet columns absent locally are compared as missing values.</p>
 *
 * <p>{@link #run(SyncConfig)} performs the file-based run in the order locations,
 * organizations, users, user groups, and exports every change set.</p>
 */
public class MasterSyncService {
    private static final Logger log = LoggerFactory.getLogger(MasterSyncService.class);

    public static final String LOCATION_NAME = "location_name";
    public static final String LOCATION_IDENTIFIER = "location_identifier";
    public static final String LOCATION_AFTER = "location_after";
    static final String LOCAL_LOCATION_CODE = "事業所コード";
    static final String LOCAL_LOCATION_NAME = "事業所名";

    static final String USER_GROUP_BASENAME = "user_group";
    static final int USER_GROUP_START_RANK = 3;
    static final int USER_GROUP_END_RANK = 5;

    private final OrganizationBuilder organizationBuilder;
    private final MasterReconciler reconciler;
    private final LocationReferenceValidator locationValidator;
    private final RankNameReshaper reshaper;
    private final ChunkedChangeSetWriter writer;

    public MasterSyncService() {
        this(new NoOpMetricsService());
    }

    public MasterSyncService(MetricsService metrics) {
        this(new OrganizationBuilder(new RankColumnAssigner(),
                        new DuplicateNameResolver(), metrics),
                new MasterReconciler(metrics),
                new LocationReferenceValidator(),
                new RankNameReshaper(),
                new ChunkedChangeSetWriter());
    }

    public MasterSyncService(OrganizationBuilder organizationBuilder,
                             MasterReconciler reconciler,
                             LocationReferenceValidator locationValidator,
                             RankNameReshaper reshaper,
                             ChunkedChangeSetWriter writer) {
        this.organizationBuilder = organizationBuilder;
        this.reconciler = reconciler;
        this.locationValidator = locationValidator;
        this.reshaper = reshaper;
        this.writer = writer;
    }

    /**
     * Builds the disambiguated organization table and, when {@code otherLabel} is set, fills
     * rank-name gaps with it.
     */
    public Table buildOrganization(Table organizations, Table mapping, String otherLabel) {
        Table organization = organizationBuilder.createOrganization(organizations, mapping);
        if (otherLabel == null || otherLabel.isBlank()) {
            return organization;
        }
        return new RankGapFiller(otherLabel).fill(organization, RankColumnAssigner.maxRank(organization));
    }

    /**
     * Renames the local location sheet's headers and derives {@code location_identifier}
     * as {@code code_name}. The result is the canonical location table.
     */
    public Table prepareLocations(Table locations) {
        Map<String, String> rename = new HashMap<>();
        rename.put(LOCAL_LOCATION_CODE, LocationReferenceValidator.LOCATION_CODE);
        rename.put(LOCAL_LOCATION_NAME, LOCATION_NAME);
        Table renamed = locations.rename(rename);

        List<String> columns = new ArrayList<>(renamed.columns());
        if (!columns.contains(LOCATION_IDENTIFIER)) {
            columns.add(LOCATION_IDENTIFIER);
        }
        List<Map<String, Object>> rows = new ArrayList<>(renamed.size());
        for (Map<String, Object> row : renamed.rows()) {
            Map<String, Object> newRow = new LinkedHashMap<>(row);
            Object code = row.get(LocationReferenceValidator.LOCATION_CODE);
            Object name = row.get(LOCATION_NAME);
            newRow.put(LOCATION_IDENTIFIER, code == null || name == null ? null : code + "_" + name);
            rows.add(newRow);
        }
        return new Table(columns, rows).withConstant(EntityProfile.DISABLE_FLAG, null);
    }

    /**
     * @param locations canonical location table from {@link #prepareLocations(Table)}
     */
    public ChangeSet syncLocations(Table locations, Table downloaded, ReconciliationKeySpec spec) {
        ChangeSet changes = reconcile(EntityKind.LOCATION, locations, downloaded, spec, EntityProfile.STANDARD);
        return changes.withAfterColumn(LOCATION_AFTER, LOCATION_IDENTIFIER).reorder(spec.columnNames());
    }

    /**
     * @param organization output of {@link #buildOrganization(Table, Table, String)}
     * @throws com.master.sync.reconcile.ReferentialIntegrityException if an org references an unknown location
     */
    public ChangeSet syncOrganizations(Table organization, Table locations, Table downloaded,
                                       ReconciliationKeySpec spec) {
        Table local = locationValidator.mergeLocation(organization, locations);
        return reconcile(EntityKind.ORGANIZATION, local, downloaded, spec, EntityProfile.STANDARD);
    }

    /**
     * Users are enriched with their location and organization; users whose org is unknown
     * are left out. Users missing from the local table are retired.
     */
    public ChangeSet syncUsers(Table users, Table organization, Table locations, Table downloaded,
                               ReconciliationKeySpec spec, String retirementSentinel) {
        Table local = locationValidator.mergeLocation(users, locations)
                .innerJoin(organization, OrgColumns.ORG_CODE)
                .withConstant(EntityProfile.DISABLE_FLAG, null);
        log.info("sync.users.prepared users={} joined={}", users.size(), local.size());
        EntityProfile profile = EntityProfile.userLike(RetirementPolicy.withSentinel(retirementSentinel));
        return reconcile(EntityKind.USER, local, downloaded, spec, profile);
    }

    /**
     * User groups are the distinct {@code user_group_3..5} names of the prepared users.
     */
    public ChangeSet syncUserGroups(Table users, Table downloaded, ReconciliationKeySpec spec) {
        Table groups = reshaper.reshape(users, USER_GROUP_BASENAME, USER_GROUP_START_RANK, USER_GROUP_END_RANK)
                .withConstant(EntityProfile.DISABLE_FLAG, null);
        warnDuplicateGroupNames(groups);
        return reconcile(EntityKind.USER_GROUP, groups, downloaded, spec, EntityProfile.STANDARD);
    }

    public ExportResult export(EntityKind kind, ChangeSet changes, int chunkSize, Path outputDirectory) {
        return writer.write(changes, chunkSize, outputDirectory.resolve(kind.getFileBaseName()), ProgressCallback.NOOP);
    }

    /**
     * Reads every input named by {@code config}, reconciles the four entities and writes
     * their change sets to the output directory.
     */
    public SyncResult run(SyncConfig config) {
        LatestFileLocator locator = new LatestFileLocator();
        SheetConfigLoader sheets = new SheetConfigLoader();
        SyncConfig.Sources sources = config.sources();
        SyncConfig.Downloads downloads = config.downloads();

        Map<EntityKind, ChangeSet> changes = new EnumMap<>(EntityKind.class);
        Map<EntityKind, ExportResult> exports = new EnumMap<>(EntityKind.class);

        Table locations = prepareLocations(read(sources.locations(), config));
        ReconciliationKeySpec locationSpec = sheets.load(sources.columns(), EntityKind.LOCATION.getSheetName());
        changes.put(EntityKind.LOCATION, syncLocations(locations,
                download(locator, downloads.locations(), locationSpec, config), locationSpec));

        Table mapping = sources.mapping() != null ? read(sources.mapping(), config) : null;
        Table organization = buildOrganization(read(sources.organizations(), config), mapping, config.otherLabel());
        ReconciliationKeySpec orgSpec = sheets.load(sources.columns(), EntityKind.ORGANIZATION.getSheetName());
        changes.put(EntityKind.ORGANIZATION, syncOrganizations(organization, locations,
                download(locator, downloads.organizations(), orgSpec, config), orgSpec));

        Table users = read(sources.users(), config);
        ReconciliationKeySpec userSpec = sheets.load(sources.columns(), EntityKind.USER.getSheetName());
        changes.put(EntityKind.USER, syncUsers(users, organization, locations,
                download(locator, downloads.users(), userSpec, config), userSpec, config.retirementSentinel()));

        ReconciliationKeySpec groupSpec = sheets.load(sources.columns(), EntityKind.USER_GROUP.getSheetName());
        changes.put(EntityKind.USER_GROUP, syncUserGroups(users,
                download(locator, downloads.userGroups(), groupSpec, config), groupSpec));

        for (Map.Entry<EntityKind, ChangeSet> entry : changes.entrySet()) {
            exports.put(entry.getKey(), export(entry.getKey(), entry.getValue(),
                    config.chunkSize(), config.outputDirectory()));
        }
        log.info("sync.completed entities={}", changes.size());
        return new SyncResult(changes, exports);
    }

    private ChangeSet reconcile(EntityKind kind, Table local, Table downloaded, ReconciliationKeySpec spec,
                                EntityProfile profile) {
        Table aligned = new Table(downloaded.columns(), local.rows());
        return reconciler.processMasterUpdate(kind.getFileBaseName(), aligned, downloaded, spec, profile);
    }

    private static void warnDuplicateGroupNames(Table groups) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (Object name : groups.values(RankNameReshaper.GROUP_NAME)) {
            counts.merge(name, 1, Integer::sum);
        }
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > 1) {
                log.warn("sync.userGroups.duplicateName name='{}' ranks={}", entry.getKey(), entry.getValue());
            }
        }
    }

    private static Table read(Path path, SyncConfig config) {
        return TableReaders.forPath(path, config.charset()).read(path);
    }

    private static Table download(LatestFileLocator locator, Path glob, ReconciliationKeySpec spec,
                                  SyncConfig config) {
        return spec.prepareDownloaded(read(locator.latest(glob), config));
    }
}
