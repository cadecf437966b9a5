package com.papertrail.core.model;

/**
 * Outcome of comparing two records.
 */
public enum MatchDecision {
    /**
     * Score at or above the auto-merge threshold (0.92 by default).
     * The pair is unioned into one cluster.
     */
    AUTO_MERGE,

    /**
     * Score in the review band (0.85 to 0.92 by default).
     * Queued for a human; never merged automatically.
     */
    NEEDS_REVIEW,

    /**
     * Below the review threshold, or rejected by a reviewer.
     */
    DISTINCT
}
