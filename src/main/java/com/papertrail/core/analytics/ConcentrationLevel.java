package com.papertrail.core.analytics;

/**
 * Market concentration bands on the 0-1 HHI scale (DOJ/FTC 1500 and 2500 points).
 */
public enum ConcentrationLevel {
    LOW,
    MODERATE,
    HIGH;

    public static final double MODERATE_FLOOR = 0.15;
    public static final double HIGH_FLOOR = 0.25;

    public static ConcentrationLevel of(double hhi) {
        if (hhi >= HIGH_FLOOR) {
            return HIGH;
        }
        if (hhi >= MODERATE_FLOOR) {
            return MODERATE;
        }
        return LOW;
    }
}
