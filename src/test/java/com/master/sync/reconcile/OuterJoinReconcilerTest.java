package com.master.sync.reconcile;

import com.master.sync.core.model.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OuterJoinReconciler Tests")
class OuterJoinReconcilerTest {

    private final OuterJoinReconciler joiner = new OuterJoinReconciler();

    private final Table local = Table.builder("id", "name")
            .row("K3", "c")
            .row("K1", "a")
            .build();
    private final Table downloaded = Table.builder("id", "name")
            .row("K2", "b")
            .row("K1", "a2")
            .build();

    @Test
    @DisplayName("Should suffix shared columns and tag each row's provenance")
    void suffixesAndProvenance() {
        JoinedTable joined = joiner.join(local, downloaded, List.of("id"));

        assertEquals(List.of("id", "name_left", "name_right"), joined.table().columns());
        assertEquals(1, joined.count(Provenance.LEFT_ONLY));
        assertEquals(1, joined.count(Provenance.RIGHT_ONLY));
        assertEquals(1, joined.count(Provenance.BOTH));
    }

    @Test
    @DisplayName("Rows should be sorted by key")
    void sortedByKey() {
        JoinedTable joined = joiner.join(local, downloaded, List.of("id"));

        assertEquals(List.of("K1", "K2", "K3"), joined.table().values("id"));
        assertEquals(List.of(Provenance.BOTH, Provenance.RIGHT_ONLY, Provenance.LEFT_ONLY), joined.provenance());
        assertEquals(Arrays.asList("a", null, "c"), joined.table().values("name_left"));
        assertEquals(Arrays.asList("a2", "b", null), joined.table().values("name_right"));
    }

    @Test
    @DisplayName("Composite keys should match on every key column")
    void compositeKeys() {
        Table left = Table.builder("a", "b", "v").row("1", "x", "l").build();
        Table right = Table.builder("a", "b", "v")
                .row("1", "x", "r")
                .row("1", "y", "r2")
                .build();

        JoinedTable joined = joiner.join(left, right, List.of("a", "b"));

        assertEquals(2, joined.table().size());
        assertEquals(1, joined.count(Provenance.BOTH));
        assertEquals(1, joined.count(Provenance.RIGHT_ONLY));
    }

    @Test
    @DisplayName("A column on one side only should fail the suffix check")
    void oneSidedColumnFails() {
        Table right = Table.builder("id", "name", "extra").row("K1", "a", "x").build();

        SuffixValidationException e = assertThrows(SuffixValidationException.class,
                () -> joiner.join(local, right, List.of("id")));
        assertTrue(e.getMessage().contains("extra"));
    }

    @Test
    @DisplayName("A key missing from either side should be rejected")
    void missingKeyRejected() {
        assertThrows(IllegalArgumentException.class, () -> joiner.join(local, downloaded, List.of("code")));
        assertThrows(IllegalArgumentException.class, () -> joiner.join(local, downloaded, List.of()));
    }

    @Test
    @DisplayName("Repeated keys should produce every pairing")
    void manyToMany() {
        Table left = Table.builder("id", "v").row("K", "l1").row("K", "l2").build();
        Table right = Table.builder("id", "v").row("K", "r1").row("K", "r2").build();

        JoinedTable joined = joiner.join(left, right, List.of("id"));

        assertEquals(4, joined.count(Provenance.BOTH));
    }
}
