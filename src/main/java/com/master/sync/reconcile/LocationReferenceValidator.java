package com.master.sync.reconcile;

import com.master.sync.core.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Checks that every {@code location_code} referenced by organization or user rows exists
 * in the canonical location table.
 */
public class LocationReferenceValidator {
    private static final Logger log = LoggerFactory.getLogger(LocationReferenceValidator.class);

    public static final String LOCATION_CODE = "location_code";

    /**
     * @throws IllegalArgumentException      if either table lacks {@code location_code}
     * @throws ReferentialIntegrityException listing the distinct unresolved codes in row order
     */
    public void validate(Table rows, Table locations) {
        if (!rows.hasColumn(LOCATION_CODE)) {
            throw new IllegalArgumentException("Table has no " + LOCATION_CODE + " column");
        }
        if (!locations.hasColumn(LOCATION_CODE)) {
            throw new IllegalArgumentException("Location table has no " + LOCATION_CODE + " column");
        }
        Set<Object> known = new HashSet<>(locations.values(LOCATION_CODE));
        Set<String> missing = new LinkedHashSet<>();
        for (Object code : rows.values(LOCATION_CODE)) {
            if (!known.contains(code)) {
                missing.add(String.valueOf(code));
            }
        }
        if (!missing.isEmpty()) {
            throw new ReferentialIntegrityException(new ArrayList<>(missing));
        }
        log.info("reconcile.location.validated rows={}", rows.size());
    }

    /**
     * Validates the references, then inner-joins the location columns onto the rows.
     */
    public Table mergeLocation(Table rows, Table locations) {
        validate(rows, locations);
        return rows.innerJoin(locations, LOCATION_CODE);
    }
}
