package com.master.sync.hierarchy;

/**
 * A node of the {@link HierarchyGraph}.
 *
 * @param code        org code
 * @param name        display name, null for placeholders
 * @param rank        organizational tier, null for placeholders or corrupt records
 * @param placeholder true when the node was only referenced as a parent and has no record
 */
public record OrgNode(String code, String name, Integer rank, boolean placeholder) {

    static OrgNode placeholder(String code) {
        return new OrgNode(code, null, null, true);
    }
}
