package com.master.sync.rules;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Canonicalizes organization display names for duplicate detection.
 * Applies NFKC compatibility normalization (full-width letters and digits become ASCII,
 * half-width katakana become full-width) and then lower-cases the result.
 *
 * <p>Whitespace is kept as is: two names differing only in spacing are distinct.</p>
 */
public class NameNormalizer {

    /**
     * Normalizes the given name. Null yields the empty string.
     */
    public String normalize(String name) {
        if (name == null) {
            return "";
        }
        return Normalizer.normalize(name, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
    }

    /**
     * Checks if two names are equivalent after normalization.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }
}
