package com.papertrail.core.config;

/**
 * Options for relationship derivation.
 */
public class DerivationOptions {

    /** RA 9184 public-bidding threshold for goods and infrastructure, in pesos. */
    public static final double DEFAULT_BIDDING_THRESHOLD = 5_000_000.0;

    private final int minSharedContracts;
    private final double biddingThreshold;
    private final int splitWindowDays;
    private final double splitTitleSimilarity;
    private final double familyThreshold;
    private final double associationThreshold;
    private final int minSharedDonors;

    private DerivationOptions(Builder builder) {
        this.minSharedContracts = builder.minSharedContracts;
        this.biddingThreshold = builder.biddingThreshold;
        this.splitWindowDays = builder.splitWindowDays;
        this.splitTitleSimilarity = builder.splitTitleSimilarity;
        this.familyThreshold = builder.familyThreshold;
        this.associationThreshold = builder.associationThreshold;
        this.minSharedDonors = builder.minSharedDonors;
    }

    /**
     * Minimum number of shared contracts before two bidders get a CO_BID_WITH edge.
     */
    public int getMinSharedContracts() {
        return minSharedContracts;
    }

    public double getBiddingThreshold() {
        return biddingThreshold;
    }

    /**
     * Contracts awarded within this many days of a cluster's first award may join it.
     */
    public int getSplitWindowDays() {
        return splitWindowDays;
    }

    public double getSplitTitleSimilarity() {
        return splitTitleSimilarity;
    }

    public double getFamilyThreshold() {
        return familyThreshold;
    }

    public double getAssociationThreshold() {
        return associationThreshold;
    }

    public int getMinSharedDonors() {
        return minSharedDonors;
    }

    public static DerivationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int minSharedContracts = 2;
        private double biddingThreshold = DEFAULT_BIDDING_THRESHOLD;
        private int splitWindowDays = 7;
        private double splitTitleSimilarity = 0.25;
        private double familyThreshold = 0.97;
        private double associationThreshold = 0.90;
        private int minSharedDonors = 2;

        public Builder minSharedContracts(int minSharedContracts) {
            if (minSharedContracts < 1) {
                throw new IllegalArgumentException("minSharedContracts must be >= 1");
            }
            this.minSharedContracts = minSharedContracts;
            return this;
        }

        public Builder biddingThreshold(double biddingThreshold) {
            if (biddingThreshold <= 0) {
                throw new IllegalArgumentException("biddingThreshold must be positive");
            }
            this.biddingThreshold = biddingThreshold;
            return this;
        }

        public Builder splitWindowDays(int splitWindowDays) {
            if (splitWindowDays < 1) {
                throw new IllegalArgumentException("splitWindowDays must be >= 1");
            }
            this.splitWindowDays = splitWindowDays;
            return this;
        }

        public Builder splitTitleSimilarity(double splitTitleSimilarity) {
            validateThreshold(splitTitleSimilarity, "splitTitleSimilarity");
            this.splitTitleSimilarity = splitTitleSimilarity;
            return this;
        }

        public Builder familyThreshold(double familyThreshold) {
            validateThreshold(familyThreshold, "familyThreshold");
            this.familyThreshold = familyThreshold;
            return this;
        }

        public Builder associationThreshold(double associationThreshold) {
            validateThreshold(associationThreshold, "associationThreshold");
            this.associationThreshold = associationThreshold;
            return this;
        }

        public Builder minSharedDonors(int minSharedDonors) {
            if (minSharedDonors < 1) {
                throw new IllegalArgumentException("minSharedDonors must be >= 1");
            }
            this.minSharedDonors = minSharedDonors;
            return this;
        }

        public DerivationOptions build() {
            if (familyThreshold < associationThreshold) {
                throw new IllegalArgumentException("familyThreshold must be >= associationThreshold");
            }
            return new DerivationOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
