package com.papertrail.core.model;

import java.util.Objects;

/**
 * Result of comparing two records: the similarity score and the decision
 * taken under the configured thresholds.
 */
public record MergeDecision(
        RecordPair pair,
        EntityKind kind,
        double score,
        MatchDecision decision,
        String rationale
) {
    public MergeDecision {
        Objects.requireNonNull(pair, "pair is required");
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(decision, "decision is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
    }

    /**
     * Classifies a score against the auto-merge and review thresholds.
     */
    public static MergeDecision of(RecordPair pair, EntityKind kind, double score,
                                   double autoMergeThreshold, double reviewThreshold) {
        MatchDecision decision;
        String rationale;
        if (score >= autoMergeThreshold) {
            decision = MatchDecision.AUTO_MERGE;
            rationale = String.format("similarity %.4f >= auto-merge %.2f", score, autoMergeThreshold);
        } else if (score >= reviewThreshold) {
            decision = MatchDecision.NEEDS_REVIEW;
            rationale = String.format("similarity %.4f in review band [%.2f, %.2f)",
                    score, reviewThreshold, autoMergeThreshold);
        } else {
            decision = MatchDecision.DISTINCT;
            rationale = String.format("similarity %.4f < review %.2f", score, reviewThreshold);
        }
        return new MergeDecision(pair, kind, score, decision, rationale);
    }

    public MergeDecision withDecision(MatchDecision newDecision, String newRationale) {
        return new MergeDecision(pair, kind, score, newDecision, newRationale);
    }

    public boolean shouldMerge() {
        return decision == MatchDecision.AUTO_MERGE;
    }

    public boolean requiresReview() {
        return decision == MatchDecision.NEEDS_REVIEW;
    }
}
