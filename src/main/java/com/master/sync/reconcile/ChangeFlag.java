package com.master.sync.reconcile;

/**
 * Kind of change sent downstream. Removal is always an UPDATE that flips a disable
 * indicator; there is no delete.
 */
public enum ChangeFlag {
    ADD,
    UPDATE;

    /**
     * Column holding the flag in an exported change set.
     */
    public static final String COLUMN = "flag";

    /**
     * Returns true if the text names a known flag.
     */
    public static boolean isValid(Object value) {
        if (value instanceof ChangeFlag) {
            return true;
        }
        if (value instanceof String s) {
            for (ChangeFlag flag : values()) {
                if (flag.name().equals(s)) {
                    return true;
                }
            }
        }
        return false;
    }
}
