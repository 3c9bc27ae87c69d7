package com.master.sync.api;

import com.master.sync.bulk.ExportResult;
import com.master.sync.reconcile.ChangeSet;

import java.util.Map;

/**
 * Outcome of a complete run: the change set and exported files of every entity.
 */
public record SyncResult(Map<EntityKind, ChangeSet> changes, Map<EntityKind, ExportResult> exports) {

    public SyncResult {
        changes = Map.copyOf(changes);
        exports = Map.copyOf(exports);
    }

    public ChangeSet changes(EntityKind kind) {
        return changes.get(kind);
    }

    public ExportResult export(EntityKind kind) {
        return exports.get(kind);
    }
}
