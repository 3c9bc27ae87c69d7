package com.master.sync.metrics;

import com.master.sync.reconcile.ChangeFlag;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(String entityType, Duration duration) {
    }

    @Override
    public void incrementChanges(String entityType, ChangeFlag flag, long count) {
    }

    @Override
    public void recordDisabledRows(String entityType, long count) {
    }

    @Override
    public void recordDuplicateGroups(int groups) {
    }

    @Override
    public void recordHierarchySize(int nodes) {
    }
}
