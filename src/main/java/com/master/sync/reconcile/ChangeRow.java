package com.master.sync.reconcile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a change set: the key and compare values to send downstream plus the flag.
 *
 * @param index  position in the change set
 * @param flag   ADD or UPDATE
 * @param values cell values by column, excluding the flag column
 */
public record ChangeRow(int index, ChangeFlag flag, Map<String, Object> values) {

    public ChangeRow {
        Objects.requireNonNull(flag, "flag is required");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String column) {
        return values.get(column);
    }

    /**
     * The {@code disable_flag} value, or null when not set.
     */
    public Object disableFlag() {
        return values.get(EntityProfile.DISABLE_FLAG);
    }
}
