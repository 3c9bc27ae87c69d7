package com.master.sync.core;

/**
 * Base class for failures raised by the hierarchy and reconciliation pipelines.
 * Every failure is raised at the point of detection and propagates to the caller.
 */
public class MasterSyncException extends RuntimeException {

    public MasterSyncException(String message) {
        super(message);
    }

    public MasterSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
