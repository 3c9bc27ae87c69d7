package com.master.sync.config;

import com.master.sync.core.MasterSyncException;

/**
 * Thrown when the run configuration cannot be read or is invalid.
 */
public class ConfigurationException extends MasterSyncException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
