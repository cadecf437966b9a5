package com.papertrail.core.config;

/**
 * Weights and saturation points of the dynasty score.
 *
 * <p>Each component is normalized to [0,1]: positions held and municipalities
 * governed saturate at their configured counts, contractor ownership is 0 or 1.
 * The weights must sum to 1.0, which keeps the score in [0,1].</p>
 */
public record DynastyWeights(
        double positions,
        double municipalities,
        double ownership,
        int positionSaturation,
        int municipalitySaturation
) {
    private static final double TOLERANCE = 1e-9;

    public DynastyWeights {
        if (positions < 0 || municipalities < 0 || ownership < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = positions + municipalities + ownership;
        if (Math.abs(sum - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
        if (positionSaturation < 1 || municipalitySaturation < 1) {
            throw new IllegalArgumentException("Saturation counts must be >= 1");
        }
    }

    public static DynastyWeights defaults() {
        return new DynastyWeights(0.4, 0.3, 0.3, 5, 3);
    }
}
