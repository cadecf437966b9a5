package com.papertrail.core.model;

/**
 * Severity of a red flag, ordered from most to least severe.
 */
public enum Severity {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns the next more severe level, or CRITICAL if already there.
     */
    public Severity escalate() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() - 1];
    }

    public boolean isAtLeast(Severity other) {
        return ordinal() <= other.ordinal();
    }

    /**
     * Returns the more severe of the two.
     */
    public static Severity max(Severity a, Severity b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }
}
