package com.finclinic.backend.enums;

/**
 * Overall score bands. Declared from the highest lower bound down; each band covers
 * {@code [lowerBound, next band's lowerBound)} and {@link #EXCELLENT} is closed at 100.
 */
public enum StatusBand {
    EXCELLENT("Excellent", 80),
    GOOD("Good", 60),
    NEEDS_IMPROVEMENT("Needs Improvement", 30),
    AT_RISK("At Risk", 0);

    private final String displayName;
    private final int lowerBound;

    StatusBand(String displayName, int lowerBound) {
        this.displayName = displayName;
        this.lowerBound = lowerBound;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getLowerBound() {
        return lowerBound;
    }
}
