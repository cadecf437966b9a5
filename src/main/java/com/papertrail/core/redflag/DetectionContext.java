package com.papertrail.core.redflag;

import com.papertrail.core.analytics.ConcentrationMetric;
import com.papertrail.core.analytics.DynastyScore;
import com.papertrail.core.config.DetectionOptions;
import com.papertrail.core.derive.DerivationResult;
import com.papertrail.core.derive.ResolvedGraph;
import com.papertrail.core.model.DerivedEdge;
import com.papertrail.core.model.EdgeType;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Read-only input shared by all detectors of one run. Every flag of the run
 * carries the same {@code detectedAt}.
 */
public record DetectionContext(
        String runId,
        ResolvedGraph graph,
        DerivationResult derivation,
        List<ConcentrationMetric> concentration,
        List<DynastyScore> dynasties,
        DetectionOptions options,
        Instant detectedAt
) {
    public DetectionContext {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(graph, "graph is required");
        Objects.requireNonNull(derivation, "derivation is required");
        Objects.requireNonNull(options, "options is required");
        Objects.requireNonNull(detectedAt, "detectedAt is required");
        concentration = concentration != null ? List.copyOf(concentration) : List.of();
        dynasties = dynasties != null ? List.copyOf(dynasties) : List.of();
    }

    public List<DerivedEdge> edges(EdgeType type) {
        return derivation.edgesOfType(type);
    }
}
