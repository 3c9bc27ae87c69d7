package com.master.sync.reconcile;

/**
 * Which side of an outer join a row came from.
 */
public enum Provenance {
    /**
     * Only in the local (desired) data.
     */
    LEFT_ONLY,

    /**
     * Only in the downloaded (current) data.
     */
    RIGHT_ONLY,

    /**
     * Present on both sides.
     */
    BOTH
}
