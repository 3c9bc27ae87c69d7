package com.master.sync.hierarchy;

/**
 * A duplicate-group member with the identifier chosen for it.
 *
 * @param record     the organization record
 * @param identifier label appended to the display name, empty when none could be chosen
 */
public record ResolvedDuplicate(OrgRecord record, String identifier) {

    public boolean hasIdentifier() {
        return identifier != null && !identifier.isEmpty();
    }

    /**
     * The display name with the identifier in parentheses, or the plain name without one.
     */
    public String displayName() {
        return hasIdentifier() ? record.name() + " (" + identifier + ")" : record.name();
    }
}
