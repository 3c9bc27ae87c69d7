package com.master.sync.reconcile;

import com.master.sync.core.MasterSyncException;

/**
 * Thrown when a joined non-key column carries neither the {@code _left} nor the {@code _right} suffix.
 */
public class SuffixValidationException extends MasterSyncException {

    public SuffixValidationException(String message) {
        super(message);
    }
}
