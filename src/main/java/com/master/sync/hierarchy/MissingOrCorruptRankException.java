package com.master.sync.hierarchy;

import com.master.sync.core.MasterSyncException;

/**
 * Thrown when a node on an ancestor path has no rank or a rank outside {@code [1, R]},
 * or when a rank cell cannot be read as an integer.
 */
public class MissingOrCorruptRankException extends MasterSyncException {

    public MissingOrCorruptRankException(String message) {
        super(message);
    }

    public MissingOrCorruptRankException(String message, Throwable cause) {
        super(message, cause);
    }
}
