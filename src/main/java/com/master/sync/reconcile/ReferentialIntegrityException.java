package com.master.sync.reconcile;

import com.master.sync.core.MasterSyncException;

import java.util.List;

/**
 * Thrown when rows reference location codes missing from the canonical location table.
 */
public class ReferentialIntegrityException extends MasterSyncException {

    private final List<String> missingCodes;

    public ReferentialIntegrityException(List<String> missingCodes) {
        super("location_code values not found in the location table: " + String.join(", ", missingCodes));
        this.missingCodes = List.copyOf(missingCodes);
    }

    public List<String> getMissingCodes() {
        return missingCodes;
    }
}
