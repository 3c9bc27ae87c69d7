package com.master.sync.reconcile;

import com.master.sync.core.model.Table;
import com.master.sync.core.model.Values;

import java.util.Map;

/**
 * Post-conditions of a change set: every disable flag is missing or 1, and every flag is
 * ADD or UPDATE. Raw tables are accepted so that edited change sets can be checked again.
 */
public class ChangeSetValidator {

    public void validate(ChangeSet changes) {
        validate(changes.toTable());
    }

    /**
     * @throws InvalidDisableFlagException on a disable flag other than missing or 1
     * @throws InvalidFlagException        on a flag other than ADD or UPDATE
     */
    public void validate(Table changes) {
        if (changes.hasColumn(EntityProfile.DISABLE_FLAG)) {
            int rowIndex = 0;
            for (Map<String, Object> row : changes.rows()) {
                Object value = row.get(EntityProfile.DISABLE_FLAG);
                if (!Values.isMissing(value) && !Values.isOne(value)) {
                    throw new InvalidDisableFlagException(
                            "Invalid disable_flag '" + value + "' at row " + rowIndex);
                }
                rowIndex++;
            }
        }
        if (changes.hasColumn(ChangeFlag.COLUMN)) {
            int rowIndex = 0;
            for (Map<String, Object> row : changes.rows()) {
                Object value = row.get(ChangeFlag.COLUMN);
                if (!ChangeFlag.isValid(value)) {
                    throw new InvalidFlagException("Invalid flag '" + value + "' at row " + rowIndex);
                }
                rowIndex++;
            }
        }
    }
}
