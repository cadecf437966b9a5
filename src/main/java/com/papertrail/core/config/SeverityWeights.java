package com.papertrail.core.config;

import com.papertrail.core.model.Severity;

/**
 * Probability-style weight of one flag of each severity in the risk roll-up.
 */
public record SeverityWeights(double critical, double high, double medium, double low) {

    public SeverityWeights {
        for (double w : new double[]{critical, high, medium, low}) {
            if (w < 0.0 || w > 1.0) {
                throw new IllegalArgumentException("Severity weights must be between 0.0 and 1.0, got " + w);
            }
        }
    }

    public static SeverityWeights defaults() {
        return new SeverityWeights(0.6, 0.4, 0.2, 0.05);
    }

    public double weightOf(Severity severity) {
        return switch (severity) {
            case CRITICAL -> critical;
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
        };
    }
}
