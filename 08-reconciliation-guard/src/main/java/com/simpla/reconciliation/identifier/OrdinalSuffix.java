package com.simpla.reconciliation.identifier;

import java.util.Locale;

/**
 * Latin ordinal appended to an article number when articles are inserted
 * between two existing ones ("11 bis", "11 ter", ...). Declaration order is
 * the ordering rank.
 */
public enum OrdinalSuffix {
    NONE(""),
    BIS("bis"),
    TER("ter"),
    QUATER("quater"),
    QUINQUIES("quinquies"),
    SEXIES("sexies"),
    SEPTIES("septies"),
    OCTIES("octies"),
    NONIES("nonies"),
    DECIES("decies");

    private final String word;

    OrdinalSuffix(String word) {
        this.word = word;
    }

    public String getWord() {
        return word;
    }

    public int rank() {
        return ordinal();
    }

    /**
     * Looks up a suffix by its word, ignoring case. Blank or unknown words map to {@link #NONE}.
     */
    public static OrdinalSuffix fromWord(String word) {
        if (word == null || word.isBlank()) {
            return NONE;
        }
        String normalized = word.trim().toLowerCase(Locale.ROOT);
        for (OrdinalSuffix suffix : values()) {
            if (suffix.word.equals(normalized)) {
                return suffix;
            }
        }
        return NONE;
    }
}
