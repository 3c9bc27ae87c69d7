package com.master.sync.hierarchy;

import java.util.Objects;

/**
 * Abbreviation used as the identifier of duplicates below the given org.
 *
 * @param orgCode      org the abbreviation belongs to
 * @param abbreviation short label, empty when the source cell was blank
 * @param rank         rank of {@code orgCode} in the hierarchy
 */
public record AbbreviationOverride(String orgCode, String abbreviation, int rank) {

    public AbbreviationOverride {
        Objects.requireNonNull(orgCode, "orgCode is required");
        abbreviation = abbreviation == null || abbreviation.isBlank() ? "" : abbreviation;
    }
}
