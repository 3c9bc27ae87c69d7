package com.master.sync.reconcile;

import com.master.sync.core.MasterSyncException;

/**
 * Thrown when a change set contains a disable flag that is neither missing nor 1.
 */
public class InvalidDisableFlagException extends MasterSyncException {

    public InvalidDisableFlagException(String message) {
        super(message);
    }
}
