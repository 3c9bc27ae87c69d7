package com.master.sync.reconcile;

import com.master.sync.core.model.Table;
import com.master.sync.logging.LogContext;
import com.master.sync.metrics.MetricsService;
import com.master.sync.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the change set that brings the downloaded master in line with the local one:
 * outer join, classify, validate.
 */
public class MasterReconciler {
    private static final Logger log = LoggerFactory.getLogger(MasterReconciler.class);

    private final OuterJoinReconciler joiner;
    private final ChangeClassifier classifier;
    private final ChangeSetValidator validator;
    private final MetricsService metrics;

    public MasterReconciler() {
        this(new OuterJoinReconciler(), new ChangeClassifier(), new ChangeSetValidator(), new NoOpMetricsService());
    }

    public MasterReconciler(MetricsService metrics) {
        this(new OuterJoinReconciler(), new ChangeClassifier(), new ChangeSetValidator(), metrics);
    }

    public MasterReconciler(OuterJoinReconciler joiner, ChangeClassifier classifier,
                            ChangeSetValidator validator, MetricsService metrics) {
        this.joiner = joiner;
        this.classifier = classifier;
        this.validator = validator;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * @param entityType label used for logging and metrics, e.g. "organization"
     * @param local      desired state
     * @param downloaded current downstream state, already prepared with the sheet header
     * @param spec       key and compare columns
     * @param profile    disable semantics of the entity
     * @return the validated change set
     */
    public ChangeSet processMasterUpdate(String entityType, Table local, Table downloaded,
                                         ReconciliationKeySpec spec, EntityProfile profile) {
        Instant start = Instant.now();
        try (LogContext ctx = LogContext.forReconciliation(LogContext.generateRunId(), entityType)) {
            log.info("reconcile.starting entityType={} local={} downloaded={}",
                    entityType, local.size(), downloaded.size());
            try {
                JoinedTable joined = joiner.join(local, downloaded, spec.keyColumns());
                ChangeSet changes = classifier.classify(joined, spec.compareColumns(), spec.keyColumns(), profile);
                validator.validate(changes);

                metrics.incrementChanges(entityType, ChangeFlag.ADD, changes.count(ChangeFlag.ADD));
                metrics.incrementChanges(entityType, ChangeFlag.UPDATE, changes.count(ChangeFlag.UPDATE));
                metrics.recordDisabledRows(entityType, countDisabled(joined, changes, spec.keyColumns()));
                log.info("reconcile.completed entityType={} changes={}", entityType, changes);
                return changes;
            } catch (RuntimeException e) {
                log.error("reconcile.failed entityType={} error={}", entityType, e.getMessage());
                throw e;
            } finally {
                metrics.recordRunDuration(entityType, Duration.between(start, Instant.now()));
            }
        }
    }

    private static long countDisabled(JoinedTable joined, ChangeSet changes, List<String> keyColumns) {
        Set<List<Object>> rightOnly = new HashSet<>();
        for (Map<String, Object> row : joined.rows(Provenance.RIGHT_ONLY)) {
            rightOnly.add(key(row, keyColumns));
        }
        return changes.rows(ChangeFlag.UPDATE).stream()
                .filter(r -> rightOnly.contains(key(r.values(), keyColumns)))
                .count();
    }

    private static List<Object> key(Map<String, Object> row, List<String> keyColumns) {
        List<Object> key = new ArrayList<>(keyColumns.size());
        for (String column : keyColumns) {
            key.add(row.get(column));
        }
        return key;
    }
}
