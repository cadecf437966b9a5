package com.papertrail.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds and budgets of the red-flag detectors.
 */
public class DetectionOptions {

    private final double singleBidderEscalationRate;
    private final int singleBidderAggregateMinimum;
    private final double identicalBidEpsilon;
    private final double hhiMediumThreshold;
    private final double hhiHighThreshold;
    private final double hhiCriticalThreshold;
    private final int ringMinSize;
    private final double ringMinDensity;
    private final double ringMinRotation;
    private final int ringCriticalSize;
    private final double ringCriticalRotation;
    private final int communityIterationBudget;
    private final int maxCycleLength;
    private final long cycleSearchBudget;
    private final double shellCapitalRatio;
    private final int geographicMinAwards;
    private final int timingClusterMinAwards;
    private final int timingClusterWindowDays;
    private final Duration detectorTimeout;
    private final int parallelism;

    private DetectionOptions(Builder builder) {
        this.singleBidderEscalationRate = builder.singleBidderEscalationRate;
        this.singleBidderAggregateMinimum = builder.singleBidderAggregateMinimum;
        this.identicalBidEpsilon = builder.identicalBidEpsilon;
        this.hhiMediumThreshold = builder.hhiMediumThreshold;
        this.hhiHighThreshold = builder.hhiHighThreshold;
        this.hhiCriticalThreshold = builder.hhiCriticalThreshold;
        this.ringMinSize = builder.ringMinSize;
        this.ringMinDensity = builder.ringMinDensity;
        this.ringMinRotation = builder.ringMinRotation;
        this.ringCriticalSize = builder.ringCriticalSize;
        this.ringCriticalRotation = builder.ringCriticalRotation;
        this.communityIterationBudget = builder.communityIterationBudget;
        this.maxCycleLength = builder.maxCycleLength;
        this.cycleSearchBudget = builder.cycleSearchBudget;
        this.shellCapitalRatio = builder.shellCapitalRatio;
        this.geographicMinAwards = builder.geographicMinAwards;
        this.timingClusterMinAwards = builder.timingClusterMinAwards;
        this.timingClusterWindowDays = builder.timingClusterWindowDays;
        this.detectorTimeout = builder.detectorTimeout;
        this.parallelism = builder.parallelism;
    }

    /**
     * A contractor whose single-bidder share of awards exceeds this rate has its
     * single-bidder flags escalated.
     */
    public double getSingleBidderEscalationRate() {
        return singleBidderEscalationRate;
    }

    /**
     * Minimum single-bidder awards before a contractor gets an aggregate flag.
     */
    public int getSingleBidderAggregateMinimum() {
        return singleBidderAggregateMinimum;
    }

    public double getIdenticalBidEpsilon() {
        return identicalBidEpsilon;
    }

    public double getHhiMediumThreshold() {
        return hhiMediumThreshold;
    }

    public double getHhiHighThreshold() {
        return hhiHighThreshold;
    }

    public double getHhiCriticalThreshold() {
        return hhiCriticalThreshold;
    }

    public int getRingMinSize() {
        return ringMinSize;
    }

    public double getRingMinDensity() {
        return ringMinDensity;
    }

    public double getRingMinRotation() {
        return ringMinRotation;
    }

    public int getRingCriticalSize() {
        return ringCriticalSize;
    }

    public double getRingCriticalRotation() {
        return ringCriticalRotation;
    }

    /**
     * Maximum local-moving passes of community detection.
     */
    public int getCommunityIterationBudget() {
        return communityIterationBudget;
    }

    public int getMaxCycleLength() {
        return maxCycleLength;
    }

    /**
     * Maximum edge expansions of the cycle search across all roots.
     */
    public long getCycleSearchBudget() {
        return cycleSearchBudget;
    }

    public double getShellCapitalRatio() {
        return shellCapitalRatio;
    }

    /**
     * Minimum awards outside a contractor's home province before it is flagged.
     */
    public int getGeographicMinAwards() {
        return geographicMinAwards;
    }

    public int getTimingClusterMinAwards() {
        return timingClusterMinAwards;
    }

    /**
     * Two awards closer than this many days apart count toward a timing cluster.
     */
    public int getTimingClusterWindowDays() {
        return timingClusterWindowDays;
    }

    public Duration getDetectorTimeout() {
        return detectorTimeout;
    }

    public int getParallelism() {
        return parallelism;
    }

    public static DetectionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double singleBidderEscalationRate = 0.8;
        private int singleBidderAggregateMinimum = 3;
        private double identicalBidEpsilon = 0.001;
        private double hhiMediumThreshold = 0.25;
        private double hhiHighThreshold = 0.5;
        private double hhiCriticalThreshold = 0.75;
        private int ringMinSize = 3;
        private double ringMinDensity = 0.6;
        private double ringMinRotation = 0.5;
        private int ringCriticalSize = 4;
        private double ringCriticalRotation = 0.8;
        private int communityIterationBudget = 100;
        private int maxCycleLength = 6;
        private long cycleSearchBudget = 1_000_000L;
        private double shellCapitalRatio = 100.0;
        private int geographicMinAwards = 3;
        private int timingClusterMinAwards = 3;
        private int timingClusterWindowDays = 2;
        private Duration detectorTimeout = Duration.ofMinutes(2);
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());

        public Builder singleBidderEscalationRate(double rate) {
            validateFraction(rate, "singleBidderEscalationRate");
            this.singleBidderEscalationRate = rate;
            return this;
        }

        public Builder singleBidderAggregateMinimum(int minimum) {
            validatePositive(minimum, "singleBidderAggregateMinimum");
            this.singleBidderAggregateMinimum = minimum;
            return this;
        }

        public Builder identicalBidEpsilon(double epsilon) {
            validateFraction(epsilon, "identicalBidEpsilon");
            this.identicalBidEpsilon = epsilon;
            return this;
        }

        public Builder hhiThresholds(double medium, double high, double critical) {
            validateFraction(medium, "hhiMediumThreshold");
            validateFraction(high, "hhiHighThreshold");
            validateFraction(critical, "hhiCriticalThreshold");
            this.hhiMediumThreshold = medium;
            this.hhiHighThreshold = high;
            this.hhiCriticalThreshold = critical;
            return this;
        }

        public Builder ringMinSize(int size) {
            if (size < 2) {
                throw new IllegalArgumentException("ringMinSize must be >= 2");
            }
            this.ringMinSize = size;
            return this;
        }

        public Builder ringMinDensity(double density) {
            validateFraction(density, "ringMinDensity");
            this.ringMinDensity = density;
            return this;
        }

        public Builder ringMinRotation(double rotation) {
            validateFraction(rotation, "ringMinRotation");
            this.ringMinRotation = rotation;
            return this;
        }

        public Builder ringCritical(int size, double rotation) {
            validatePositive(size, "ringCriticalSize");
            validateFraction(rotation, "ringCriticalRotation");
            this.ringCriticalSize = size;
            this.ringCriticalRotation = rotation;
            return this;
        }

        public Builder communityIterationBudget(int budget) {
            validatePositive(budget, "communityIterationBudget");
            this.communityIterationBudget = budget;
            return this;
        }

        public Builder maxCycleLength(int length) {
            if (length < 2) {
                throw new IllegalArgumentException("maxCycleLength must be >= 2");
            }
            this.maxCycleLength = length;
            return this;
        }

        public Builder cycleSearchBudget(long budget) {
            if (budget <= 0) {
                throw new IllegalArgumentException("cycleSearchBudget must be positive");
            }
            this.cycleSearchBudget = budget;
            return this;
        }

        public Builder shellCapitalRatio(double ratio) {
            if (ratio <= 0) {
                throw new IllegalArgumentException("shellCapitalRatio must be positive");
            }
            this.shellCapitalRatio = ratio;
            return this;
        }

        public Builder geographicMinAwards(int minimum) {
            validatePositive(minimum, "geographicMinAwards");
            this.geographicMinAwards = minimum;
            return this;
        }

        public Builder timingCluster(int minAwards, int windowDays) {
            if (minAwards < 2) {
                throw new IllegalArgumentException("timingClusterMinAwards must be >= 2");
            }
            if (windowDays < 0) {
                throw new IllegalArgumentException("timingClusterWindowDays must not be negative");
            }
            this.timingClusterMinAwards = minAwards;
            this.timingClusterWindowDays = windowDays;
            return this;
        }

        public Builder detectorTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout is required");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("detectorTimeout must be positive");
            }
            this.detectorTimeout = timeout;
            return this;
        }

        public Builder parallelism(int parallelism) {
            validatePositive(parallelism, "parallelism");
            this.parallelism = parallelism;
            return this;
        }

        public DetectionOptions build() {
            if (!(hhiMediumThreshold <= hhiHighThreshold && hhiHighThreshold <= hhiCriticalThreshold)) {
                throw new IllegalArgumentException("HHI thresholds must be ordered medium <= high <= critical");
            }
            return new DetectionOptions(this);
        }

        private void validateFraction(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        private void validatePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }
}
