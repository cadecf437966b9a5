package com.papertrail.core.review;

/**
 * Adjudication state of a queued pair.
 */
public enum ReviewStatus {
    PENDING,
    /** Reviewer confirmed the pair is one entity; merged on the next run. */
    CONFIRMED,
    /** Reviewer ruled the pair distinct; never re-queued or merged. */
    REJECTED
}
