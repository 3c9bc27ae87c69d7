package com.master.sync.reconcile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * How user-like entities are retired: instead of a disable flag, the department column is
 * set to a sentinel and flag-dependent columns are blanked.
 *
 * @param departmentColumn column moved to the sentinel on retirement
 * @param sentinel         department value marking a retired user
 * @param blankedColumns   columns cleared on retirement
 */
public record RetirementPolicy(String departmentColumn, String sentinel, List<String> blankedColumns) {

    public static final String DEFAULT_DEPARTMENT_COLUMN = "department_code";
    public static final String DEFAULT_SENTINEL = "SYS_RETIRE";
    private static final int USER_GROUP_COLUMNS = 10;

    public RetirementPolicy {
        Objects.requireNonNull(departmentColumn, "departmentColumn is required");
        Objects.requireNonNull(sentinel, "sentinel is required");
        blankedColumns = blankedColumns != null ? List.copyOf(blankedColumns) : List.of();
    }

    /**
     * {@code department_code} set to {@code SYS_RETIRE}; {@code disable_flag} and
     * {@code user_group1..user_group10} blanked.
     */
    public static RetirementPolicy defaults() {
        return withSentinel(DEFAULT_SENTINEL);
    }

    public static RetirementPolicy withSentinel(String sentinel) {
        List<String> blanked = new ArrayList<>();
        blanked.add(EntityProfile.DISABLE_FLAG);
        for (int i = 1; i <= USER_GROUP_COLUMNS; i++) {
            blanked.add("user_group" + i);
        }
        return new RetirementPolicy(DEFAULT_DEPARTMENT_COLUMN, sentinel, blanked);
    }
}
