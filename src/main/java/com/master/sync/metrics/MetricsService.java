package com.master.sync.metrics;

import com.master.sync.reconcile.ChangeFlag;

import java.time.Duration;

/**
 * Interface for recording master sync metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without a
 * metrics registry.
 */
public interface MetricsService {

    void recordRunDuration(String entityType, Duration duration);

    void incrementChanges(String entityType, ChangeFlag flag, long count);

    void recordDisabledRows(String entityType, long count);

    void recordDuplicateGroups(int groups);

    void recordHierarchySize(int nodes);
}
