package com.master.sync.reconcile;

import com.master.sync.core.MasterSyncException;

/**
 * Thrown when a change set contains a flag other than ADD or UPDATE.
 */
public class InvalidFlagException extends MasterSyncException {

    public InvalidFlagException(String message) {
        super(message);
    }
}
