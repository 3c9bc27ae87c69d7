package com.master.sync.reconcile;

import com.master.sync.core.model.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChangeSetValidator Tests")
class ChangeSetValidatorTest {

    private final ChangeSetValidator validator = new ChangeSetValidator();

    @Test
    @DisplayName("Missing and 1 disable flags should pass")
    void validChanges() {
        Table table = Table.builder("id", "flag", "disable_flag")
                .row("K1", "ADD", null)
                .row("K2", "UPDATE", 1)
                .row("K3", "UPDATE", "1")
                .build();

        assertDoesNotThrow(() -> validator.validate(new ChangeSet(table)));
    }

    @Test
    @DisplayName("A disable flag other than 1 should fail with its row index")
    void invalidDisableFlag() {
        Table table = Table.builder("id", "flag", "disable_flag")
                .row("K1", "ADD", null)
                .row("K2", "UPDATE", 0)
                .build();

        InvalidDisableFlagException e = assertThrows(InvalidDisableFlagException.class,
                () -> validator.validate(table));
        assertTrue(e.getMessage().contains("row 1"));
    }

    @Test
    @DisplayName("A flag other than ADD or UPDATE should fail")
    void invalidFlag() {
        Table table = Table.builder("id", "flag").row("K1", "DELETE").build();

        assertThrows(InvalidFlagException.class, () -> validator.validate(table));
    }

    @Test
    @DisplayName("A missing flag should fail")
    void missingFlag() {
        Table table = Table.builder("id", "flag").row("K1", null).build();

        assertThrows(InvalidFlagException.class, () -> validator.validate(table));
    }
}
