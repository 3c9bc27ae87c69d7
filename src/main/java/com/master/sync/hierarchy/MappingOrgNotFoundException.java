package com.master.sync.hierarchy;

import com.master.sync.core.MasterSyncException;

/**
 * Thrown when an abbreviation override references an org code absent from the hierarchy.
 */
public class MappingOrgNotFoundException extends MasterSyncException {

    public MappingOrgNotFoundException(String message) {
        super(message);
    }
}
