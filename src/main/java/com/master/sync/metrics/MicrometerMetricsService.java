package com.master.sync.metrics;

import com.master.sync.reconcile.ChangeFlag;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code master.sync.run.duration}: Timer (tag: entityType)</li>
 *   <li>{@code master.sync.changes}: Counter (tags: entityType, flag)</li>
 *   <li>{@code master.sync.disabled}: Counter (tag: entityType)</li>
 *   <li>{@code master.sync.duplicate.groups}: DistributionSummary</li>
 *   <li>{@code master.sync.hierarchy.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary duplicateGroupSummary;
    private final DistributionSummary hierarchySizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.duplicateGroupSummary = DistributionSummary.builder("master.sync.duplicate.groups")
                .description("Number of duplicate-name groups per organization build")
                .register(registry);
        this.hierarchySizeSummary = DistributionSummary.builder("master.sync.hierarchy.size")
                .description("Number of nodes per organization hierarchy")
                .register(registry);
    }

    @Override
    public void recordRunDuration(String entityType, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(entityType, k ->
                Timer.builder("master.sync.run.duration")
                        .description("Duration of master update runs")
                        .tag("entityType", entityType)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementChanges(String entityType, ChangeFlag flag, long count) {
        String key = "changes:" + entityType + ":" + flag.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("master.sync.changes")
                        .description("Number of change rows emitted")
                        .tag("entityType", entityType)
                        .tag("flag", flag.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordDisabledRows(String entityType, long count) {
        String key = "disabled:" + entityType;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("master.sync.disabled")
                        .description("Number of rows soft-disabled downstream")
                        .tag("entityType", entityType)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordDuplicateGroups(int groups) {
        duplicateGroupSummary.record(groups);
    }

    @Override
    public void recordHierarchySize(int nodes) {
        hierarchySizeSummary.record(nodes);
    }
}
