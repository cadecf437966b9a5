package com.papertrail.core.metrics;

import com.papertrail.core.model.EdgeType;
import com.papertrail.core.model.EntityKind;
import com.papertrail.core.model.MatchDecision;
import com.papertrail.core.model.RedFlagType;
import com.papertrail.core.model.Severity;

import java.time.Duration;

/**
 * Records pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so the core runs
 * without any registry configured.
 */
public interface MetricsService {

    void recordStageDuration(String stage, boolean success, Duration duration);

    void recordMatchDecision(EntityKind kind, MatchDecision decision);

    void recordSimilarityScore(double score);

    void recordEntitiesResolved(EntityKind kind, int count);

    void recordDataQualityWarning(String stage);

    void recordDerivedEdges(EdgeType type, int count);

    void recordRedFlag(RedFlagType type, Severity severity);

    void recordDetectorFailure(String detector);
}
