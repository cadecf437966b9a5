package com.papertrail.core.report;

import com.papertrail.core.config.SeverityWeights;
import com.papertrail.core.model.RedFlag;

import java.util.Collection;
import java.util.Objects;

/**
 * Rolls an entity's flags up into one risk score in [0, 1].
 *
 * <p>Each flag is treated as an independent signal with a probability given by
 * its severity weight; the score is the chance that at least one of them is
 * real, {@code 1 - prod(1 - w)}. Flags from different detectors are weighed
 * alike.</p>
 */
public class RiskScoreCalculator {

    private final SeverityWeights weights;

    public RiskScoreCalculator(SeverityWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights is required");
    }

    public RiskScoreCalculator() {
        this(SeverityWeights.defaults());
    }

    public double score(Collection<RedFlag> flags) {
        double clean = 1.0;
        for (RedFlag flag : flags) {
            clean *= 1.0 - weights.weightOf(flag.getSeverity());
        }
        return Math.min(1.0, Math.max(0.0, 1.0 - clean));
    }

    public SeverityWeights getWeights() {
        return weights;
    }
}
