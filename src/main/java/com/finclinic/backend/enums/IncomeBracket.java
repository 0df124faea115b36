package com.finclinic.backend.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Monthly income brackets (AED) as collected on the profile form.
 * The first four are below 30K, the last four at or above it.
 */
public enum IncomeBracket {
    BELOW_5K("Below 5K", false),
    FROM_5K_TO_10K("5K-10K", false),
    FROM_10K_TO_20K("10K-20K", false),
    FROM_20K_TO_30K("20K-30K", false),
    FROM_30K_TO_40K("30K-40K", true),
    FROM_40K_TO_50K("40K-50K", true),
    FROM_50K_TO_100K("50K-100K", true),
    ABOVE_100K("Above 100K", true);

    private final String label;
    private final boolean high;

    IncomeBracket(String label, boolean high) {
        this.label = label;
        this.high = high;
    }

    public String getLabel() {
        return label;
    }

    public boolean isHigh() {
        return high;
    }

    /**
     * Accepts either the form label ("30K-40K") or the constant name, ignoring case.
     */
    public static Optional<IncomeBracket> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        for (IncomeBracket bracket : values()) {
            if (bracket.label.equalsIgnoreCase(normalized)
                    || bracket.name().equals(normalized.toUpperCase(Locale.ROOT))) {
                return Optional.of(bracket);
            }
        }
        return Optional.empty();
    }
}
