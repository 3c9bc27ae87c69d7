package com.master.sync.hierarchy;

import com.master.sync.core.MasterSyncException;

/**
 * Thrown when the parent relation of the organization records contains a cycle.
 */
public class CyclicHierarchyException extends MasterSyncException {

    public CyclicHierarchyException(String message) {
        super(message);
    }
}
