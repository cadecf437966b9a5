package com.papertrail.core.model;

/**
 * How wins are distributed between two co-bidding contractors.
 */
public enum WinPattern {
    /** Wins alternate between the pair across time-ordered shared contracts. */
    ROTATING("rotating"),
    COMPETITIVE("competitive");

    private final String label;

    WinPattern(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
