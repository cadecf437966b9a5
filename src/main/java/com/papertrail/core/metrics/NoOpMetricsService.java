package com.papertrail.core.metrics;

import com.papertrail.core.model.EdgeType;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.MatchDecision;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(String stage, boolean success, Duration duration) {
    }

    @Override
    public void recordMatchDecision(EntityKind kind, MatchDecision decision) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordEntitiesResolved(EntityKind kind, int count) {
    }

    @Override
    public void recordDataQualityWarning(String stage) {
    }

    @Override
    public void recordDerivedEdges(EdgeType type, int count) {
    }

    @Override
    public void recordRedFlag(RedFlagType type, Severity severity) {
    }

    @Override
    public void recordDetectorFailure(String detector) {
    }
}
