package com.master.sync.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NameNormalizer Tests")
class NameNormalizerTest {

    private final NameNormalizer normalizer = new NameNormalizer();

    @ParameterizedTest
    @CsvSource({
            "Sales, sales",
            "ＳＡＬＥＳ, sales",
            "営業１課, 営業1課",
            "ｴｲｷﾞｮｳ, エイギョウ"
    })
    @DisplayName("Should apply NFKC then lower-case")
    void normalizes(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input));
    }

    @Test
    @DisplayName("Null should normalize to the empty string")
    void nullIsEmpty() {
        assertEquals("", normalizer.normalize(null));
    }

    @Test
    @DisplayName("Whitespace should be preserved")
    void keepsWhitespace() {
        assertEquals(" sales  team ", normalizer.normalize(" Sales  Team "));
        assertFalse(normalizer.areEquivalent("Sales Team", "SalesTeam"));
    }

    @Test
    @DisplayName("Full-width and half-width variants should be equivalent")
    void equivalence() {
        assertTrue(normalizer.areEquivalent("Ｓａｌｅｓ", "sales"));
    }
}
