package com.master.sync.bulk;

import com.master.sync.core.MasterSyncException;

/**
 * Runtime exception wrapping I/O failures while reading or writing tabular files.
 */
public class TableIoException extends MasterSyncException {

    public TableIoException(String message) {
        super(message);
    }

    public TableIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
