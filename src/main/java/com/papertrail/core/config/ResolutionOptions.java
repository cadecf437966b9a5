package com.papertrail.core.config;

/**
 * Options for entity resolution: decision thresholds, blocking and parallelism.
 */
public class ResolutionOptions {

    private static final double DEFAULT_AUTO_MERGE_THRESHOLD = 0.92;
    private static final double DEFAULT_REVIEW_THRESHOLD = 0.85;
    private static final int DEFAULT_REGISTRATION_PREFIX_LENGTH = 6;

    private final double autoMergeThreshold;
    private final double reviewThreshold;
    private final boolean registrationMatchMerges;
    private final int registrationPrefixLength;
    private final int parallelism;

    private ResolutionOptions(Builder builder) {
        this.autoMergeThreshold = builder.autoMergeThreshold;
        this.reviewThreshold = builder.reviewThreshold;
        this.registrationMatchMerges = builder.registrationMatchMerges;
        this.registrationPrefixLength = builder.registrationPrefixLength;
        this.parallelism = builder.parallelism;
    }

    public double getAutoMergeThreshold() {
        return autoMergeThreshold;
    }

    public double getReviewThreshold() {
        return reviewThreshold;
    }

    /**
     * Whether two records carrying the same registration number merge regardless of name score.
     */
    public boolean isRegistrationMatchMerges() {
        return registrationMatchMerges;
    }

    public int getRegistrationPrefixLength() {
        return registrationPrefixLength;
    }

    public int getParallelism() {
        return parallelism;
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Creates conservative options (higher thresholds, names only).
     */
    public static ResolutionOptions conservative() {
        return builder()
                .autoMergeThreshold(0.97)
                .reviewThreshold(0.90)
                .registrationMatchMerges(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double autoMergeThreshold = DEFAULT_AUTO_MERGE_THRESHOLD;
        private double reviewThreshold = DEFAULT_REVIEW_THRESHOLD;
        private boolean registrationMatchMerges = true;
        private int registrationPrefixLength = DEFAULT_REGISTRATION_PREFIX_LENGTH;
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());

        public Builder autoMergeThreshold(double autoMergeThreshold) {
            validateThreshold(autoMergeThreshold, "autoMergeThreshold");
            this.autoMergeThreshold = autoMergeThreshold;
            return this;
        }

        public Builder reviewThreshold(double reviewThreshold) {
            validateThreshold(reviewThreshold, "reviewThreshold");
            this.reviewThreshold = reviewThreshold;
            return this;
        }

        public Builder registrationMatchMerges(boolean registrationMatchMerges) {
            this.registrationMatchMerges = registrationMatchMerges;
            return this;
        }

        public Builder registrationPrefixLength(int registrationPrefixLength) {
            if (registrationPrefixLength <= 0) {
                throw new IllegalArgumentException("registrationPrefixLength must be positive");
            }
            this.registrationPrefixLength = registrationPrefixLength;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public ResolutionOptions build() {
            if (autoMergeThreshold < reviewThreshold) {
                throw new IllegalArgumentException("autoMergeThreshold must be >= reviewThreshold");
            }
            return new ResolutionOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
