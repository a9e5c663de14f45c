package com.example.drawingdiff.util;

import java.util.Locale;

/**
 * Canonical form of sheet identifiers used for pairing: surrounding whitespace removed and letters
 * upper-cased, so {@code " a-101 "} and {@code "A-101"} pair up.
 */
public final class IdentifierNormalizer {

    private IdentifierNormalizer() {
    }

    /**
     * @return the normalized identifier, or {@code null} when the input is null or blank
     */
    public static String normalize(String identifier) {
        if (identifier == null) {
            return null;
        }
        String trimmed = identifier.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }
}
