package com.master.sync.hierarchy;

import java.util.List;

/**
 * Organization records sharing one normalized name.
 *
 * @param normalizedName the shared normalized name
 * @param members        at least two records, in table order
 */
public record DuplicateGroup(String normalizedName, List<OrgRecord> members) {

    public DuplicateGroup {
        members = List.copyOf(members);
        if (members.size() < 2) {
            throw new IllegalArgumentException("A duplicate group needs at least two members");
        }
    }
}
