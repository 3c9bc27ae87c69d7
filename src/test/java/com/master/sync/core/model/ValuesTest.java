package com.master.sync.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Values Tests")
class ValuesTest {

    @Test
    @DisplayName("Two missing values should be equal, NaN included")
    void missingValuesAreEqual() {
        assertTrue(Values.sameValue(null, null));
        assertTrue(Values.sameValue(Double.NaN, null));
        assertTrue(Values.sameValue(Double.NaN, Double.NaN));
    }

    @Test
    @DisplayName("A missing and a present value should differ")
    void missingDiffersFromPresent() {
        assertFalse(Values.sameValue(null, "x"));
        assertFalse(Values.sameValue(0, Double.NaN));
    }

    @Test
    @DisplayName("Numbers should compare by value across types")
    void numbersCompareByValue() {
        assertTrue(Values.sameValue(1, 1.0));
        assertTrue(Values.sameValue(2L, new BigDecimal("2.00")));
        assertFalse(Values.sameValue(1, "1"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "1.0", " 1 "})
    @DisplayName("isOne should accept the text form of one")
    void isOneAcceptsText(String value) {
        assertTrue(Values.isOne(value));
    }

    @Test
    @DisplayName("isOne should reject other values")
    void isOneRejectsOthers() {
        assertTrue(Values.isOne(1));
        assertTrue(Values.isOne(1.0));
        assertFalse(Values.isOne(0));
        assertFalse(Values.isOne("yes"));
        assertFalse(Values.isOne(null));
        assertFalse(Values.isOne(Double.NaN));
    }

    @Test
    @DisplayName("toInteger should parse integral text and reject fractions")
    void toInteger() {
        assertEquals(3, Values.toInteger("3"));
        assertEquals(3, Values.toInteger("3.0"));
        assertEquals(4, Values.toInteger(4));
        assertNull(Values.toInteger(" "));
        assertNull(Values.toInteger(null));
        assertThrows(IllegalArgumentException.class, () -> Values.toInteger("3.5"));
        assertThrows(IllegalArgumentException.class, () -> Values.toInteger("three"));
    }

    @Test
    @DisplayName("toText should treat blank text as missing")
    void toText() {
        assertEquals("abc", Values.toText("abc"));
        assertEquals("12", Values.toText(12));
        assertNull(Values.toText("  "));
        assertNull(Values.toText(Double.NaN));
    }
}
