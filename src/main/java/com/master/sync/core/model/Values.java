package com.master.sync.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Cell value helpers shared by the hierarchy and reconciliation code.
 * A cell is missing when it is {@code null} or a floating point NaN.
 */
public final class Values {

    private Values() {
        // Utility class
    }

    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    /**
     * Missing-aware equality: two missing values are equal, a missing and a present value
     * differ, numbers compare by decimal value and everything else by {@code equals}.
     */
    public static boolean sameValue(Object left, Object right) {
        boolean leftMissing = isMissing(left);
        boolean rightMissing = isMissing(right);
        if (leftMissing || rightMissing) {
            return leftMissing && rightMissing;
        }
        if (left instanceof Number l && right instanceof Number r) {
            return toDecimal(l).compareTo(toDecimal(r)) == 0;
        }
        return Objects.equals(left, right);
    }

    /**
     * True when the value is the integer one, either as a number or as its text form.
     */
    public static boolean isOne(Object value) {
        if (isMissing(value)) {
            return false;
        }
        if (value instanceof Number n) {
            return toDecimal(n).compareTo(BigDecimal.ONE) == 0;
        }
        if (value instanceof String s) {
            try {
                return new BigDecimal(s.trim()).compareTo(BigDecimal.ONE) == 0;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    /**
     * Parses an integer-convertible cell ("3", "3.0", 3). Missing or blank cells yield null.
     *
     * @throws IllegalArgumentException if the value is present but not an integer
     */
    public static Integer toInteger(Object value) {
        if (isMissing(value)) {
            return null;
        }
        if (value instanceof Integer i) {
            return i;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Not an integer value: '" + value + "'", e);
        }
    }

    /**
     * Returns the cell as text, or null when missing. Blank text is treated as missing.
     */
    public static String toText(Object value) {
        if (isMissing(value)) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal bd) {
            return bd;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }
}
